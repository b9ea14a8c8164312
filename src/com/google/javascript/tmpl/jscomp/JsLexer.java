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

import static com.google.javascript.tmpl.lexer.LexerAction.error;
import static com.google.javascript.tmpl.lexer.LexerAction.pop;
import static com.google.javascript.tmpl.lexer.LexerAction.push;
import static com.google.javascript.tmpl.lexer.LexerAction.record;
import static com.google.javascript.tmpl.lexer.LexerAction.recordGroup;
import static com.google.javascript.tmpl.lexer.LexerAction.shift;
import static com.google.javascript.tmpl.lexer.LexerAction.startToken;
import static com.google.javascript.tmpl.lexer.LexerAction.stopToken;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.tmpl.lexer.Node;
import com.google.javascript.tmpl.lexer.State;
import com.google.javascript.tmpl.lexer.StateTable;
import com.google.javascript.tmpl.lexer.Token;
import com.google.javascript.tmpl.lexer.Tokenizer;
import com.google.javascript.tmpl.lexer.TokenizerException;

/**
 * Splits template script source into a token tree.
 *
 * <p>Curly braces, parentheses and square brackets become nested {@link Token#SCOPE}, {@link
 * Token#PARENTHESES} and {@link Token#SQUARE_BRACKETS} nodes. Comments are dropped. Whitespace
 * around operators and brackets is dropped, other whitespace is kept as {@link Token#WHITESPACE}.
 *
 * <p>A slash is a division operator when it directly follows an identifier, a number or a closing
 * bracket, and starts a regular expression literal everywhere else.
 */
public final class JsLexer {

  static final DiagnosticType LEX_ERROR =
      DiagnosticType.error("JSC_LEX_ERROR", "Cannot tokenize script: {0}");

  static final DiagnosticType UNEXPECTED_END_OF_INPUT =
      DiagnosticType.error("JSC_UNEXPECTED_END_OF_INPUT", "Unexpected end of input: {0}");

  static final DiagnosticType UNBALANCED_GROUP =
      DiagnosticType.error("JSC_UNBALANCED_GROUP", "Unbalanced brackets: {0}");

  /** Words lexed as {@link Token#KEYWORD}. */
  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "break", "case", "catch", "const", "continue", "debugger", "default", "delete", "do",
          "else", "enum", "false", "finally", "for", "function", "if", "new", "null", "return",
          "switch", "this", "throw", "true", "try", "typeof", "var", "void", "while", "with");

  static final String ROOT = "root";
  static final String DOUBLE_QUOTED_STRING = "double-quoted-string";
  static final String SINGLE_QUOTED_STRING = "single-quoted-string";
  static final String MULTILINE_COMMENT = "multiline-comment";
  static final String SINGLELINE_COMMENT = "singleline-comment";
  static final String AFTER_VARNAME = "after-varname";
  static final String REGEX_OBJECT = "regex-object";

  private static final String NOT_IDENTIFIER_PART = "(?![a-zA-Z0-9_$])";

  private static final String OPERATORS =
      "(>>>=|===|!==|>>>|<<=|>>=|==|!=|<=|>=|&&|\\|\\||\\+\\+|--|\\+=|-=|\\*=|%=|&=|\\|=|\\^=|<<|>>"
          + "|[;,=?:|^&!<>*%~.+-])";

  static final StateTable STATES =
      new StateTable(
          ROOT,
          State.builder(ROOT)
              .setMayEndInput()
              .on("\\s*\\{\\s*", startToken(Token.SCOPE), shift())
              .on("\\s*\\}\\s*", stopToken(Token.SCOPE), shift())
              .on("/\\*", push(MULTILINE_COMMENT), shift())
              .on("//", push(SINGLELINE_COMMENT), shift())
              .on(
                  "\"",
                  push(DOUBLE_QUOTED_STRING),
                  startToken(Token.DOUBLE_QUOTED_STRING),
                  shift())
              .on(
                  "'",
                  push(SINGLE_QUOTED_STRING),
                  startToken(Token.SINGLE_QUOTED_STRING),
                  shift())
              .on(
                  "(" + Joiner.on('|').join(KEYWORDS) + ")" + NOT_IDENTIFIER_PART,
                  startToken(Token.KEYWORD),
                  recordGroup(1),
                  shift(),
                  stopToken(Token.KEYWORD))
              .on(
                  "\\s*(in|instanceof)" + NOT_IDENTIFIER_PART + "\\s*",
                  startToken(Token.OPERATOR),
                  record(match -> " " + match.group(1) + " "),
                  shift(),
                  stopToken(Token.OPERATOR))
              .on(
                  "\\s*" + OPERATORS + "\\s*",
                  startToken(Token.OPERATOR),
                  recordGroup(1),
                  shift(),
                  stopToken(Token.OPERATOR))
              .on("\\s*\\(\\s*", startToken(Token.PARENTHESES), shift())
              .on("\\s*\\)\\s*", stopToken(Token.PARENTHESES), shift(), push(AFTER_VARNAME))
              .on("\\s*\\[\\s*", startToken(Token.SQUARE_BRACKETS), shift())
              .on(
                  "\\s*\\]\\s*",
                  stopToken(Token.SQUARE_BRACKETS),
                  shift(),
                  push(AFTER_VARNAME))
              .on(
                  "[a-zA-Z_$][a-zA-Z_$0-9]*",
                  startToken(Token.VARIABLE),
                  record(),
                  shift(),
                  stopToken(Token.VARIABLE),
                  push(AFTER_VARNAME))
              .on(
                  "[0-9.]+",
                  startToken(Token.NUMBER),
                  record(),
                  shift(),
                  stopToken(Token.NUMBER),
                  push(AFTER_VARNAME))
              .on(
                  "\\s+",
                  startToken(Token.WHITESPACE),
                  record(),
                  shift(),
                  stopToken(Token.WHITESPACE))
              .on(
                  "/(?![/*])",
                  startToken(Token.REGEX_OBJECT),
                  record(),
                  shift(),
                  push(REGEX_OBJECT))
              .on("(?s).", error("unexpected character"))
              .build(),
          State.builder(DOUBLE_QUOTED_STRING)
              .on("\"", pop(), shift(), stopToken(Token.DOUBLE_QUOTED_STRING))
              .on("\\\\'", record("'"), shift())
              .on("\\\\\"", record(), shift())
              .on("(?s)\\\\.", record(), shift())
              .on("[^\"\\\\]+", record(), shift())
              .build(),
          State.builder(SINGLE_QUOTED_STRING)
              .on("'", pop(), shift(), stopToken(Token.SINGLE_QUOTED_STRING))
              .on("\\\\\"", record("\""), shift())
              .on("\\\\'", record(), shift())
              .on("(?s)\\\\.", record(), shift())
              .on("[^'\\\\]+", record(), shift())
              .build(),
          State.builder(MULTILINE_COMMENT)
              .setComment()
              .on("\\*/", shift(), pop())
              .on("(?:\\*(?!/)|[^*])+", shift())
              .build(),
          State.builder(SINGLELINE_COMMENT)
              .setComment()
              .setMayEndInput()
              .on("\\n", shift(), pop())
              .on("[^\\n]+", shift())
              .build(),
          State.builder(AFTER_VARNAME)
              .setTransient()
              .on(
                  "\\s*/(?![/*])\\s*",
                  startToken(Token.OPERATOR),
                  record("/"),
                  shift(),
                  stopToken(Token.OPERATOR))
              .on("/\\*", push(MULTILINE_COMMENT), shift())
              .on("//[^\\n]*", shift())
              .on("(?s).", pop())
              .build(),
          State.builder(REGEX_OBJECT)
              .on("(?s)\\\\.", record(), shift())
              .on("\\[(?:(?s)\\\\.|[^\\]\\\\])*\\]", record(), shift())
              .on("[^/\\\\\\[]+", record(), shift())
              .on("/[a-z]*", record(), shift(), stopToken(Token.REGEX_OBJECT), pop())
              .build());

  private static final Tokenizer TOKENIZER = new Tokenizer(STATES);

  private JsLexer() {}

  /**
   * Replaces the text and embedded tag children of {@code root} with their token tree.
   *
   * @throws JsCompilationException if the script cannot be tokenized
   */
  public static void tokenize(Node root) {
    try {
      TOKENIZER.tokenize(root);
    } catch (TokenizerException e) {
      throw new JsCompilationException(toError(e), e);
    }
  }

  private static JSError toError(TokenizerException e) {
    DiagnosticType type = getDiagnosticType(e.getReason());
    String message = e.getMessage() + " (in " + e.getStateName() + ")";
    Node node = e.getNode();
    if (node != null) {
      return JSError.make(node, type, message);
    }
    return JSError.make(e.getSourceName(), e.getLineno(), e.getCharno(), type, message);
  }

  private static DiagnosticType getDiagnosticType(TokenizerException.Reason reason) {
    switch (reason) {
      case END_OF_INPUT:
        return UNEXPECTED_END_OF_INPUT;
      case UNBALANCED_GROUP:
        return UNBALANCED_GROUP;
      case NO_TRANSITION:
      case ERROR_ACTION:
        return LEX_ERROR;
    }
    throw new IllegalStateException("Unexpected reason: " + reason);
  }
}
