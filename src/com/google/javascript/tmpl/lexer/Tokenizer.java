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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.regex.Matcher;

/**
 * A scanner driven by a {@link StateTable}.
 *
 * <p>The tokenizer replaces the {@link Token#TEXT} children of a container with the token tree
 * the table describes. At every position the transitions of the active state are tried in order,
 * and the first one that matches has its actions applied. Patterns are matched with transparent
 * bounds, so look-arounds can see the text around the current position.
 *
 * <p>{@link Token#EMBEDDED_TAG} children of the container are not scanned: each one is added as a
 * whole to the token that is open where it occurs.
 */
public final class Tokenizer {
  private static final int EXCERPT_LENGTH = 12;

  private final StateTable table;

  public Tokenizer(StateTable table) {
    this.table = checkNotNull(table);
  }

  /**
   * Tokenizes the children of {@code container} in place.
   *
   * @throws TokenizerException if the text does not match the table
   */
  public void tokenize(Node container) {
    ImmutableList<Node> input = container.detachChildren();
    ScanContext scan = new ScanContext(table, container);
    for (Node child : input) {
      if (child.isText()) {
        if (child.getLineno() != -1) {
          scan.moveTo(child.getLineno(), child.getCharno());
        }
        scanText(scan, child.getString());
      } else {
        checkArgument(child.isEmbeddedTag(), "Cannot tokenize %s", child);
        scan.appendEmbeddedTag(child);
      }
    }
    scan.finish();
  }

  private static void scanText(ScanContext scan, String text) {
    int pos = 0;
    while (pos < text.length()) {
      State state = scan.currentState();
      Transition transition = null;
      Matcher matcher = null;
      for (Transition candidate : state.getTransitions()) {
        Matcher m =
            candidate
                .getPattern()
                .matcher(text)
                .region(pos, text.length())
                .useTransparentBounds(true)
                .useAnchoringBounds(false);
        if (m.lookingAt()) {
          transition = candidate;
          matcher = m;
          break;
        }
      }
      if (transition == null) {
        throw scan.newException(
            TokenizerException.Reason.NO_TRANSITION,
            "Unexpected input in state " + state + ": " + excerpt(text, pos));
      }

      int depth = scan.stateDepth();
      int consumed = scan.apply(transition, matcher.toMatchResult());
      if (consumed == 0 && scan.currentState() == state && scan.stateDepth() == depth) {
        throw new IllegalStateException(
            "Transition " + transition + " of state " + state + " consumes nothing");
      }
      pos += consumed;
    }
  }

  private static String excerpt(String text, int pos) {
    int end = Math.min(text.length(), pos + EXCERPT_LENGTH);
    return "\"" + text.substring(pos, end).replace("\n", "\\n") + "\"";
  }
}
