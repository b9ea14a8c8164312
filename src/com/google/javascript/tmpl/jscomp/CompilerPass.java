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

/**
 * Interface for the steps of a template script compilation.
 *
 * <p>Class has single function "process", which is passed the root node of the tokenized script.
 * Passes report problems by throwing {@link JsCompilationException}.
 */
public interface CompilerPass {

  /**
   * Process the script with root node root. Can modify the contents of the tree.
   *
   * @param root Top of the token tree
   */
  void process(Node root);
}
