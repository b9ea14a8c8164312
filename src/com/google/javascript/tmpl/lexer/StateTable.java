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

import com.google.common.collect.ImmutableMap;

/** The states of a sub-language lexer, with the one scanning starts in. */
public final class StateTable {
  private final ImmutableMap<String, State> states;
  private final State startState;

  public StateTable(String startState, State... states) {
    ImmutableMap.Builder<String, State> builder = ImmutableMap.builder();
    for (State state : states) {
      builder.put(state.getName(), state);
    }
    this.states = builder.buildOrThrow();
    this.startState = getState(startState);
  }

  public State getState(String name) {
    State state = states.get(name);
    checkArgument(state != null, "Unknown lexer state: %s", name);
    return state;
  }

  public State getStartState() {
    return startState;
  }
}
