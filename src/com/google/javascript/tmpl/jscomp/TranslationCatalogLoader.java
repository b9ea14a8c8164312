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

import java.io.IOException;
import java.util.Optional;

/** Finds the translation catalog of a locale. */
public interface TranslationCatalogLoader {

  /**
   * Loads the catalog of {@code locale}.
   *
   * @return the catalog, or empty if the locale has none
   * @throws IOException if the catalog exists but cannot be read
   */
  Optional<TranslationCatalog> load(String locale) throws IOException;
}
