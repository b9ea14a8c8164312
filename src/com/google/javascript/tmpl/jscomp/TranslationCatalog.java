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

import org.jspecify.annotations.Nullable;

/** The translations of one locale, keyed by the source text. */
public interface TranslationCatalog {

  /**
   * Returns the translation of {@code text}, or {@code null} if the catalog has none.
   */
  @Nullable String translate(String text);

  /** A catalog that translates every text to itself. */
  static TranslationCatalog identity() {
    return text -> text;
  }
}
