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

package com.google.javascript.tmpl.lexer;

/**
 * The kinds of node in a template script tree.
 *
 * <p>Leaf kinds hold a string, container kinds hold child nodes.
 */
public enum Token {
  /** The container handed to the compiler: a whole script, or a node of the host document. */
  ROOT(false),
  /** Something between curly braces. */
  SCOPE(false),
  PARENTHESES(false),
  SQUARE_BRACKETS(false),
  WHITESPACE(true),
  OPERATOR(true),
  KEYWORD(true),
  VARIABLE(true),
  DOUBLE_QUOTED_STRING(false),
  SINGLE_QUOTED_STRING(false),
  REGEX_OBJECT(false),
  NUMBER(true),
  /** An already parsed directive of the host template language. Never looked into. */
  EMBEDDED_TAG(true),
  /** A raw text fragment. */
  TEXT(true);

  private final boolean leaf;

  Token(boolean leaf) {
    this.leaf = leaf;
  }

  public boolean isLeaf() {
    return leaf;
  }

  public boolean isString() {
    return this == DOUBLE_QUOTED_STRING || this == SINGLE_QUOTED_STRING;
  }
}
