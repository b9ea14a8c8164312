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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.MatchResult;
import org.jspecify.annotations.Nullable;

/** The mutable state of one {@link Tokenizer} run: state stack, open tokens and position. */
final class ScanContext {
  private final StateTable table;
  private final Node container;
  private final @Nullable String sourceName;

  private final Deque<State> states = new ArrayDeque<>();
  /** Innermost first. The bottom entry is the container being tokenized. */
  private final Deque<Node> openTokens = new ArrayDeque<>();

  private int lineno;
  private int charno;
  /** Characters shifted by the transition being applied. */
  private int shifted;

  ScanContext(StateTable table, Node container) {
    this.table = table;
    this.container = container;
    this.sourceName = container.getSourceFileName();
    this.lineno = container.getLineno() == -1 ? 1 : container.getLineno();
    this.charno = Math.max(container.getCharno(), 0);
    states.push(table.getStartState());
    openTokens.push(container);
  }

  State currentState() {
    return states.peek();
  }

  int stateDepth() {
    return states.size();
  }

  /** Applies the actions of {@code transition} and returns the number of characters consumed. */
  int apply(Transition transition, MatchResult match) {
    shifted = 0;
    for (LexerAction action : transition.getActions()) {
      action.apply(this, match);
    }
    return shifted;
  }

  void startToken(Token token) {
    Node node = Node.newToken(token).setLinenoCharno(lineno, charno);
    openTokens.peek().addChildToBack(node);
    openTokens.push(node);
  }

  void stopToken(Token token) {
    Node innermost = openTokens.peek();
    if (innermost == container) {
      throw newException(
          TokenizerException.Reason.UNBALANCED_GROUP,
          "Closing " + token + " without a matching opening",
          null);
    }
    if (innermost.getToken() != token) {
      throw newException(
          TokenizerException.Reason.UNBALANCED_GROUP,
          "Closing " + token + " while " + innermost.getToken() + " is open",
          innermost);
    }
    openTokens.pop();
  }

  void record(String text) {
    Node innermost = openTokens.peek();
    if (innermost.getToken().isLeaf()) {
      innermost.appendString(text);
    } else if (!text.isEmpty()) {
      innermost.addChildToBack(Node.newText(text).setLinenoCharno(lineno, charno));
    }
  }

  void shift(String text) {
    shifted += text.length();
    advance(text);
  }

  void push(String stateName) {
    states.push(table.getState(stateName));
  }

  void pop() {
    checkState(states.size() > 1, "Cannot leave the start state %s", currentState());
    states.pop();
  }

  void moveTo(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
  }

  /**
   * Adds an embedded tag to the innermost open token. Transient states end here. Inside comments
   * the tag is dropped.
   */
  void appendEmbeddedTag(Node tag) {
    leaveTransientStates();
    if (!currentState().isComment()) {
      if (tag.getLineno() == -1) {
        tag.setLinenoCharno(lineno, charno);
      }
      openTokens.peek().addChildToBack(tag);
    }
    advance(tag.getString());
  }

  /** Checks that the input may end here. */
  void finish() {
    leaveTransientStates();
    if (!currentState().mayEndInput()) {
      throw newException(
          TokenizerException.Reason.END_OF_INPUT,
          "Unexpected end of input in state " + currentState(),
          null);
    }
    if (openTokens.size() > 1) {
      Node innermost = openTokens.peek();
      throw newException(
          TokenizerException.Reason.UNBALANCED_GROUP,
          innermost.getToken() + " is never closed",
          innermost);
    }
  }

  TokenizerException newException(
      TokenizerException.Reason reason, String message, @Nullable Node node) {
    int line = node != null ? node.getLineno() : lineno;
    int column = node != null ? node.getCharno() : charno;
    return new TokenizerException(
        reason, message, currentState().getName(), sourceName, line, column, node);
  }

  TokenizerException newException(TokenizerException.Reason reason, String message) {
    return newException(reason, message, null);
  }

  private void leaveTransientStates() {
    while (currentState().isTransient()) {
      states.pop();
    }
  }

  private void advance(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        lineno++;
        charno = 0;
      } else {
        charno++;
      }
    }
  }
}
