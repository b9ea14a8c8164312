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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.tmpl.lexer.Node;
import org.jspecify.annotations.Nullable;

/**
 * Checks that statements end with a semicolon, such as in
 *
 * <pre>
 * var x = 1; var y = 2;
 * </pre>
 *
 * and rejects objects literals with a comma before the closing brace.
 *
 * <p>This is a heuristic over the token sequence of each block, not a parser: a statement is
 * expected to end once an identifier, a number or a bracket group has been seen, and the next
 * identifier, {@code return}, block keyword or {@code var} has to be separated from it by an
 * operator or a block.
 */
final class CheckStatementTermination implements CompilerPass {

  static final DiagnosticType MISSING_SEMICOLON =
      DiagnosticType.error("JSC_MISSING_SEMICOLON", "Missing semicolon before {0}");

  static final DiagnosticType TRAILING_COMMA =
      DiagnosticType.error(
          "JSC_TRAILING_COMMA", "Trailing comma before closing brace is not portable");

  /** Keywords introducing a construct that needs no terminating semicolon. */
  private static final ImmutableSet<String> BLOCK_KEYWORDS =
      ImmutableSet.of("for", "if", "switch", "function", "try", "catch", "while");

  @Override
  public void process(Node root) {
    ImmutableList<Node> scopes = NodeUtil.collect(root, Node::isScope);
    for (Node scope : scopes) {
      Node last = scope.getLastChild();
      if (last != null && last.isComma()) {
        throw new JsCompilationException(JSError.make(last, TRAILING_COMMA));
      }
    }

    checkBlock(root);
    for (Node scope : scopes) {
      checkBlock(scope);
    }
  }

  /** Checks the direct children of a block. */
  private static void checkBlock(Node block) {
    Cursor cursor = new Cursor(block);
    boolean terminationPending = false;

    while (cursor.hasNode()) {
      Node c = cursor.current();

      if (c.isKeyword() && BLOCK_KEYWORDS.contains(c.getString())) {
        if (terminationPending) {
          reportMissing(c);
        }
        terminationPending = false;

        if (c.isKeyword("function")) {
          // A function expression assigned to something is a statement of its own.
          Node last = cursor.getLastNonWhitespace();
          if (last != null && last.isOperator("=")) {
            terminationPending = true;
          }
          cursor.next();
          cursor.skipWhitespace();
          if (cursor.hasNode() && cursor.current().isVariable()) {
            cursor.next();
          }
        } else {
          cursor.next();
        }

        cursor.skipWhitespace();
        if (cursor.hasNode() && cursor.current().isParentheses()) {
          cursor.next();
        }
        // The condition of "do {} while (x)" may end the block.
        cursor.skipWhitespace();
        if (cursor.hasNode() && cursor.current().isScope()) {
          cursor.next();
        }
        continue;
      }

      if (c.isKeyword("var")) {
        Node last = cursor.getLastNonWhitespace();
        if (last != null && !canPrecedeDeclaration(last)) {
          reportMissing(c);
        }
      } else if (c.isOperator()) {
        terminationPending = false;
      } else if (c.isParentheses() || c.isSquareBrackets()) {
        terminationPending = true;
      } else if (c.isScope()) {
        terminationPending = false;
      } else if (c.isKeyword("return")) {
        if (terminationPending) {
          reportMissing(c);
        }
        terminationPending = false;
      } else if (c.isVariable() || c.isNumber()) {
        if (terminationPending) {
          reportMissing(c);
        }
        terminationPending = true;
      }
      cursor.next();
    }
  }

  private static boolean canPrecedeDeclaration(Node n) {
    return n.isSemicolon()
        || n.isColon()
        || n.isScope()
        || n.isEmbeddedTag()
        || n.isParentheses();
  }

  private static void reportMissing(Node n) {
    throw new JsCompilationException(JSError.make(n, MISSING_SEMICOLON, n.toSource()));
  }

  /** A position in the children of a block. */
  private static final class Cursor {
    private final ImmutableList<Node> nodes;
    private int index = 0;

    Cursor(Node block) {
      this.nodes = ImmutableList.copyOf(block.children());
    }

    boolean hasNode() {
      return index < nodes.size();
    }

    Node current() {
      return nodes.get(index);
    }

    void next() {
      index++;
    }

    void skipWhitespace() {
      while (hasNode() && current().isWhitespace()) {
        index++;
      }
    }

    /**
     * Returns the last child before the current one that is not whitespace. The first child of the
     * block is never returned, so a declaration following only a leading directive is accepted.
     */
    @Nullable Node getLastNonWhitespace() {
      for (int i = index - 1; i >= 1; i--) {
        if (!nodes.get(i).isWhitespace()) {
          return nodes.get(i);
        }
      }
      return null;
    }
  }
}
