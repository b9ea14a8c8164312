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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads JSON catalogs laid out as {@code <directory>/<locale>/<domain>.json}.
 *
 * @see JsonTranslationCatalog
 */
public final class DirectoryCatalogLoader implements TranslationCatalogLoader {
  private final Path directory;
  private final String domain;

  public DirectoryCatalogLoader(Path directory, String domain) {
    checkArgument(!domain.isEmpty(), "Empty catalog domain");
    this.directory = checkNotNull(directory);
    this.domain = domain;
  }

  Path getCatalogPath(String locale) {
    return directory.resolve(locale).resolve(domain + ".json");
  }

  @Override
  public Optional<TranslationCatalog> load(String locale) throws IOException {
    Path path = getCatalogPath(locale);
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    String contents = Files.readString(path, StandardCharsets.UTF_8);
    try {
      return Optional.of(JsonTranslationCatalog.parse(contents));
    } catch (JsonParseException e) {
      throw new IOException("Malformed translation catalog " + path, e);
    }
  }

  @Override
  public String toString() {
    return directory + "/<locale>/" + domain + ".json";
  }
}
