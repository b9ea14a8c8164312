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

import com.google.common.collect.ImmutableList;
import com.google.javascript.tmpl.lexer.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * What a compilation reports back to the template pipeline that runs it. By default the texts of
 * the literal translation calls are collected; pipelines extracting messages override {@link
 * #rememberTranslation}.
 */
public class CompilationContext {

  /** A literal translation call met during compilation. */
  public record RememberedTranslation(Node call, String text) {}

  private final List<RememberedTranslation> translations = new ArrayList<>();

  /**
   * Called once for every literal call of the translation function.
   *
   * @param call the variable naming the translation function
   * @param text the concatenated string arguments
   */
  public void rememberTranslation(Node call, String text) {
    translations.add(new RememberedTranslation(call, text));
  }

  public ImmutableList<RememberedTranslation> getRememberedTranslations() {
    return ImmutableList.copyOf(translations);
  }
}
