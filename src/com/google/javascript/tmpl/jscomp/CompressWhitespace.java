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
 * Removes the whitespace that carries no meaning. Whitespace tokens shrink to one space, operators
 * lose their surrounding whitespace, except for {@code in} and {@code instanceof}.
 *
 * <p>String literals, regular expressions and embedded tags are left alone. One space is kept where
 * adjacent tokens would otherwise run together, as in {@code a- -b} or {@code 1 .toString()}.
 */
final class CompressWhitespace implements CompilerPass {

  @Override
  public void process(Node root) {
    compress(root);

    Node first = root.getFirstChild();
    if (first != null && first.isWhitespace()) {
      first.setString("");
    }
    Node last = root.getLastChild();
    if (last != null && last.isWhitespace()) {
      last.setString("");
    }
  }

  private static void compress(Node parent) {
    for (Node c = parent.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isWhitespace()) {
        c.setString(" ");
      } else if (c.isOperator()) {
        compressOperator(c);
        separateFromPrevious(c);
      } else if (c.isRegexObject()) {
        separateFromPrevious(c);
      } else if (c.isString() || c.getToken().isLeaf()) {
        continue;
      } else {
        compress(c);
      }
    }
  }

  private static void compressOperator(Node operator) {
    String op = operator.getOperator();
    if (op.equals("in") || op.equals("instanceof")) {
      operator.setString(" " + op + " ");
    } else {
      operator.setString(op);
    }
  }

  /**
   * Keeps one space between {@code n} and its previous sibling when printing them side by side
   * would read as different tokens.
   */
  private static void separateFromPrevious(Node n) {
    Node previous = n.getPrevious();
    if (previous == null
        || !(previous.isOperator() || previous.isNumber() || previous.isRegexObject())) {
      return;
    }
    String before = previous.toSource();
    String after = n.toSource();
    if (before.isEmpty()
        || after.isEmpty()
        || !wouldMerge(previous, before.charAt(before.length() - 1), after.charAt(0))) {
      return;
    }
    if (previous.isOperator()) {
      previous.setString(before + " ");
    } else if (n.isOperator()) {
      n.setString(" " + after);
    }
  }

  /** Whether {@code last}, ending {@code previous}, runs into {@code first} when printed. */
  private static boolean wouldMerge(Node previous, char last, char first) {
    if (last == first && (last == '+' || last == '-' || last == '/')) {
      return true;
    }
    if (last == '/' && first == '*') {
      return true;
    }
    return previous.isNumber() && first == '.';
  }
}
