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

import org.jspecify.annotations.Nullable;

/** Thrown by the {@link Tokenizer} when the input cannot be scanned. */
public final class TokenizerException extends RuntimeException {

  /** What went wrong. */
  public enum Reason {
    /** No transition of the active state matches. */
    NO_TRANSITION,
    /** The input ended in a state that needs more input. */
    END_OF_INPUT,
    /** A closing delimiter did not match the innermost open group, or a group was never closed. */
    UNBALANCED_GROUP,
    /** A transition explicitly rejected the input. */
    ERROR_ACTION
  }

  private final Reason reason;
  private final String stateName;
  private final @Nullable String sourceName;
  private final int lineno;
  private final int charno;
  private final @Nullable Node node;

  TokenizerException(
      Reason reason,
      String message,
      String stateName,
      @Nullable String sourceName,
      int lineno,
      int charno,
      @Nullable Node node) {
    super(message);
    this.reason = reason;
    this.stateName = stateName;
    this.sourceName = sourceName;
    this.lineno = lineno;
    this.charno = charno;
    this.node = node;
  }

  public Reason getReason() {
    return reason;
  }

  /** The state that was active when scanning stopped. */
  public String getStateName() {
    return stateName;
  }

  public @Nullable String getSourceName() {
    return sourceName;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  /** The open token the failure is about, if any. */
  public @Nullable Node getNode() {
    return node;
  }
}
