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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import java.util.regex.MatchResult;

/**
 * One step of a {@link Transition}. Actions are only built through the static factories of this
 * class.
 */
public abstract class LexerAction {

  LexerAction() {}

  abstract void apply(ScanContext scan, MatchResult match);

  /** Creates a node of the given kind, appends it to the innermost open token and opens it. */
  public static LexerAction startToken(Token token) {
    checkNotNull(token);
    return new LexerAction() {
      @Override
      void apply(ScanContext scan, MatchResult match) {
        scan.startToken(token);
      }

      @Override
      public String toString() {
        return "StartToken(" + token + ")";
      }
    };
  }

  /** Closes the innermost open token, which has to be of the given kind. */
  public static LexerAction stopToken(Token token) {
    checkNotNull(token);
    return new LexerAction() {
      @Override
      void apply(ScanContext scan, MatchResult match) {
        scan.stopToken(token);
      }

      @Override
      public String toString() {
        return "StopToken(" + token + ")";
      }
    };
  }

  /** Appends the matched text to the innermost open token. */
  public static LexerAction record() {
    return record(match -> match.group());
  }

  /** Appends the text matched by a capturing group to the innermost open token. */
  public static LexerAction recordGroup(int group) {
    return record(match -> match.group(group));
  }

  /** Appends a fixed text to the innermost open token, whatever was matched. */
  public static LexerAction record(String text) {
    checkNotNull(text);
    return record(match -> text);
  }

  public static LexerAction record(Function<MatchResult, String> text) {
    checkNotNull(text);
    return new LexerAction() {
      @Override
      void apply(ScanContext scan, MatchResult match) {
        scan.record(text.apply(match));
      }

      @Override
      public String toString() {
        return "Record";
      }
    };
  }

  /** Consumes the matched text. */
  public static LexerAction shift() {
    return new LexerAction() {
      @Override
      void apply(ScanContext scan, MatchResult match) {
        scan.shift(match.group());
      }

      @Override
      public String toString() {
        return "Shift";
      }
    };
  }

  public static LexerAction push(String state) {
    checkNotNull(state);
    return new LexerAction() {
      @Override
      void apply(ScanContext scan, MatchResult match) {
        scan.push(state);
      }

      @Override
      public String toString() {
        return "Push(" + state + ")";
      }
    };
  }

  public static LexerAction pop() {
    return new LexerAction() {
      @Override
      void apply(ScanContext scan, MatchResult match) {
        scan.pop();
      }

      @Override
      public String toString() {
        return "Pop";
      }
    };
  }

  /** Aborts scanning with the given message. */
  public static LexerAction error(String message) {
    checkNotNull(message);
    return new LexerAction() {
      @Override
      void apply(ScanContext scan, MatchResult match) {
        throw scan.newException(TokenizerException.Reason.ERROR_ACTION, message);
      }

      @Override
      public String toString() {
        return "Error(" + message + ")";
      }
    };
  }
}
