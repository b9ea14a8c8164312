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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** A named lexer state: an ordered list of transitions, tried first to last. */
public final class State {
  private final String name;
  private final ImmutableList<Transition> transitions;
  private final boolean isTransient;
  private final boolean isComment;
  private final boolean mayEndInput;

  private State(Builder builder) {
    this.name = builder.name;
    this.transitions = builder.transitions.build();
    this.isTransient = builder.isTransient;
    this.isComment = builder.isComment;
    this.mayEndInput = builder.mayEndInput || builder.isTransient;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Transition> getTransitions() {
    return transitions;
  }

  /**
   * Transient states only look at what directly follows the previous token. They are left as
   * soon as an embedded tag or the end of the input is reached.
   */
  public boolean isTransient() {
    return isTransient;
  }

  /** Comment states produce no output, embedded tags met inside them are dropped. */
  public boolean isComment() {
    return isComment;
  }

  /** Whether the input may end while this state is active. */
  public boolean mayEndInput() {
    return mayEndInput;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builder for {@link State}. */
  public static final class Builder {
    private final String name;
    private final ImmutableList.Builder<Transition> transitions = ImmutableList.builder();
    private boolean isTransient;
    private boolean isComment;
    private boolean mayEndInput;

    private Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder on(String regex, LexerAction... actions) {
      transitions.add(Transition.of(regex, actions));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTransient() {
      this.isTransient = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setComment() {
      this.isComment = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMayEndInput() {
      this.mayEndInput = true;
      return this;
    }

    public State build() {
      return new State(this);
    }
  }
}
