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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.regex.Pattern;

/**
 * A rule of a lexer state: when {@code pattern} matches at the current position, the actions are
 * applied in order.
 */
@AutoValue
public abstract class Transition {

  public abstract Pattern getPattern();

  public abstract ImmutableList<LexerAction> getActions();

  public static Transition of(String regex, LexerAction... actions) {
    return new AutoValue_Transition(Pattern.compile(regex), ImmutableList.copyOf(actions));
  }

  @Override
  public final String toString() {
    return getPattern().pattern();
  }
}
