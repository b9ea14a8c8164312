/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.tmpl.jscomp;

import com.google.javascript.tmpl.lexer.Node;
import com.google.javascript.tmpl.lexer.Token;

/**
 * Separates a block's opening brace from a brace that directly follows it. Template languages
 * read "{{" and "{%" as the start of a directive, so "{ {% if x %}" must not print as
 * "{{% if x %}".
 */
final class FixNestedScopeSpacing implements CompilerPass {

  @Override
  public void process(Node root) {
    for (Node scope : NodeUtil.collect(root, Node::isScope)) {
      Node first = scope.getFirstChild();
      if (first != null && first.toSource().startsWith("{")) {
        Node space = Node.newString(Token.WHITESPACE, " ");
        space.setLinenoCharno(first.getLineno(), first.getCharno());
        space.insertBefore(first);
      }
    }
  }
}
