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

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.tmpl.lexer.LexerAction.error;
import static com.google.javascript.tmpl.lexer.LexerAction.pop;
import static com.google.javascript.tmpl.lexer.LexerAction.push;
import static com.google.javascript.tmpl.lexer.LexerAction.record;
import static com.google.javascript.tmpl.lexer.LexerAction.shift;
import static com.google.javascript.tmpl.lexer.LexerAction.startToken;
import static com.google.javascript.tmpl.lexer.LexerAction.stopToken;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests the engine with a small language: words, parenthesized groups, double quoted strings,
 * "#" comments to the end of the line, and a "~" operator that is only recognized right after a
 * word.
 */
@RunWith(JUnit4.class)
public final class TokenizerTest {

  private static final StateTable TABLE =
      new StateTable(
          "main",
          State.builder("main")
              .setMayEndInput()
              .on("\\(", startToken(Token.PARENTHESES), shift())
              .on("\\)", stopToken(Token.PARENTHESES), shift())
              .on("\"", push("string"), startToken(Token.DOUBLE_QUOTED_STRING), shift())
              .on("#", push("comment"), shift())
              .on(
                  "[a-z]+",
                  startToken(Token.VARIABLE),
                  record(),
                  shift(),
                  stopToken(Token.VARIABLE),
                  push("after-word"))
              .on(
                  " +",
                  startToken(Token.WHITESPACE),
                  record(),
                  shift(),
                  stopToken(Token.WHITESPACE))
              .on("\n", shift())
              .on("!", error("exclamation marks are not allowed"))
              .build(),
          State.builder("string")
              .on("\"", pop(), shift(), stopToken(Token.DOUBLE_QUOTED_STRING))
              .on("[^\"]+", record(), shift())
              .build(),
          State.builder("comment")
              .setComment()
              .setMayEndInput()
              .on("\n", shift(), pop())
              .on("[^\n]+", shift())
              .build(),
          State.builder("after-word")
              .setTransient()
              .on(
                  "~",
                  startToken(Token.OPERATOR),
                  record(),
                  shift(),
                  stopToken(Token.OPERATOR))
              .on("(?s).", pop())
              .build());

  private static Node tokenize(Node... children) {
    Node root = Node.newRoot("test");
    for (Node child : children) {
      root.addChildToBack(child);
    }
    new Tokenizer(TABLE).tokenize(root);
    return root;
  }

  private static Node tokenize(String text) {
    return tokenize(Node.newText(text));
  }

  private static TokenizerException tokenizeWithError(String text) {
    return assertThrows(TokenizerException.class, () -> tokenize(text));
  }

  @Test
  public void testNesting() {
    Node root = tokenize("ab (cd (e))");

    assertThat(root.getChildCount()).isEqualTo(3);
    Node outer = root.getLastChild();
    assertThat(outer.isParentheses()).isTrue();
    assertThat(outer.getFirstChild().getString()).isEqualTo("cd");
    assertThat(outer.getLastChild().isParentheses()).isTrue();
    assertThat(root.toSource()).isEqualTo("ab (cd (e))");
  }

  @Test
  public void testTransientStateOnlyFollowsWord() {
    Node root = tokenize("a~b");
    assertThat(root.getChildAtIndex(1).isOperator("~")).isTrue();

    TokenizerException e = tokenizeWithError("a ~b");
    assertThat(e.getReason()).isEqualTo(TokenizerException.Reason.NO_TRANSITION);
    assertThat(e.getStateName()).isEqualTo("main");
  }

  @Test
  public void testCommentsProduceNothing() {
    Node root = tokenize("a # ignored (\nb");

    assertThat(root.toSource()).isEqualTo("a b");
  }

  @Test
  public void testInputMayEndInComment() {
    assertThat(tokenize("a # trailing").toSource()).isEqualTo("a ");
  }

  @Test
  public void testStringFragments() {
    Node root = tokenize("\"x y\"");

    Node string = root.getFirstChild();
    assertThat(string.isString()).isTrue();
    assertThat(string.getFirstChild().isText()).isTrue();
    assertThat(string.getStringValue()).isEqualTo("x y");
  }

  @Test
  public void testPositions() {
    Node root = tokenize("ab\n  (cd)");

    Node ab = root.getFirstChild();
    assertThat(ab.getLineno()).isEqualTo(1);
    assertThat(ab.getCharno()).isEqualTo(0);
    Node parens = root.getLastChild();
    assertThat(parens.getLineno()).isEqualTo(2);
    assertThat(parens.getCharno()).isEqualTo(2);
    assertThat(parens.getFirstChild().getCharno()).isEqualTo(3);
  }

  @Test
  public void testFragmentPositionsAreUsed() {
    Node root =
        tokenize(
            Node.newText("ab").setLinenoCharno(4, 10),
            Node.newEmbeddedTag("{{ x }}"),
            Node.newText("cd").setLinenoCharno(4, 20));

    assertThat(root.getFirstChild().getLineno()).isEqualTo(4);
    assertThat(root.getLastChild().getCharno()).isEqualTo(20);
  }

  @Test
  public void testEmbeddedTagGoesToInnermostOpenToken() {
    Node tag = Node.newEmbeddedTag("{{ name }}");
    Node root = tokenize(Node.newText("a (\"hello "), tag, Node.newText("\")"));

    Node string = root.getLastChild().getFirstChild();
    assertThat(string.isString()).isTrue();
    assertThat(tag.getParent()).isSameInstanceAs(string);
    assertThat(root.toSource()).isEqualTo("a (\"hello {{ name }}\")");
  }

  @Test
  public void testEmbeddedTagEndsTransientState() {
    Node root = tokenize(Node.newText("a"), Node.newEmbeddedTag("{{ x }}"), Node.newText("b"));

    assertThat(root.getChildCount()).isEqualTo(3);
    assertThat(root.getChildAtIndex(1).isEmbeddedTag()).isTrue();
  }

  @Test
  public void testEmbeddedTagInCommentIsDropped() {
    Node root =
        tokenize(Node.newText("a #"), Node.newEmbeddedTag("{{ x }}"), Node.newText(" c\nb"));

    assertThat(root.toSource()).isEqualTo("a b");
  }

  @Test
  public void testUnterminatedString() {
    TokenizerException e = tokenizeWithError("a \"open");

    assertThat(e.getReason()).isEqualTo(TokenizerException.Reason.END_OF_INPUT);
    assertThat(e.getStateName()).isEqualTo("string");
    assertThat(e.getSourceName()).isEqualTo("test");
  }

  @Test
  public void testUnclosedGroup() {
    TokenizerException e = tokenizeWithError("a (b");

    assertThat(e.getReason()).isEqualTo(TokenizerException.Reason.UNBALANCED_GROUP);
    assertThat(e.getNode().isParentheses()).isTrue();
    assertThat(e.getCharno()).isEqualTo(2);
  }

  @Test
  public void testUnopenedGroup() {
    TokenizerException e = tokenizeWithError("a)");

    assertThat(e.getReason()).isEqualTo(TokenizerException.Reason.UNBALANCED_GROUP);
    assertThat(e.getNode()).isNull();
  }

  @Test
  public void testErrorAction() {
    TokenizerException e = tokenizeWithError("ab !");

    assertThat(e.getReason()).isEqualTo(TokenizerException.Reason.ERROR_ACTION);
    assertThat(e).hasMessageThat().isEqualTo("exclamation marks are not allowed");
    assertThat(e.getCharno()).isEqualTo(3);
  }

  @Test
  public void testTransitionWithoutProgressIsRejected() {
    StateTable stuck =
        new StateTable("main", State.builder("main").on("x", record()).build());
    Node root = Node.newRoot(null);
    root.addChildToBack(Node.newText("x"));

    assertThrows(IllegalStateException.class, () -> new Tokenizer(stuck).tokenize(root));
  }

  @Test
  public void testUnknownState() {
    assertThrows(IllegalArgumentException.class, () -> TABLE.getState("nowhere"));
  }
}
