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

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A catalog read from a flat JSON object mapping source texts to their translations, e.g.
 *
 * <pre>
 * {"Hello": "Bonjour", "Goodbye": "Au revoir"}
 * </pre>
 *
 * Empty translations count as missing.
 */
public final class JsonTranslationCatalog implements TranslationCatalog {
  private final ImmutableMap<String, String> translations;

  private JsonTranslationCatalog(ImmutableMap<String, String> translations) {
    this.translations = translations;
  }

  /**
   * Parses a catalog.
   *
   * @throws JsonParseException if {@code contents} is not a JSON object of strings
   */
  public static JsonTranslationCatalog parse(String contents) {
    JsonObject root = new Gson().fromJson(contents, JsonObject.class);
    if (root == null) {
      throw new JsonParseException("Empty translation catalog");
    }
    ImmutableMap.Builder<String, String> translations = ImmutableMap.builder();
    for (Map.Entry<String, JsonElement> entry : root.entrySet()) {
      JsonElement value = entry.getValue();
      if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
        throw new JsonParseException("Translation of \"" + entry.getKey() + "\" is not a string");
      }
      if (!value.getAsString().isEmpty()) {
        translations.put(entry.getKey(), value.getAsString());
      }
    }
    return new JsonTranslationCatalog(translations.buildOrThrow());
  }

  public static JsonTranslationCatalog of(Map<String, String> translations) {
    return new JsonTranslationCatalog(ImmutableMap.copyOf(translations));
  }

  @Override
  public @Nullable String translate(String text) {
    return translations.get(text);
  }

  public int size() {
    return translations.size();
  }
}
