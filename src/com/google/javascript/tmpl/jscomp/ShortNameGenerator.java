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

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Generates the shortest lowercase names first: {@code a, b, ..., z, aa, ab, ..., az, ba, ...}.
 * JavaScript reserved words are never generated.
 *
 * <p>This class is not thread safe.
 */
final class ShortNameGenerator implements NameGenerator {

  private static final int ALPHABET_SIZE = 26;

  /** Keywords, future reserved words and literals of JavaScript. */
  static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of(
          "abstract", "arguments", "await", "boolean", "break", "byte", "case", "catch", "char",
          "class", "const", "continue", "debugger", "default", "delete", "do", "double", "else",
          "enum", "eval", "export", "extends", "false", "final", "finally", "float", "for",
          "function", "goto", "if", "implements", "import", "in", "instanceof", "int",
          "interface", "let", "long", "native", "new", "null", "package", "private", "protected",
          "public", "return", "short", "static", "super", "switch", "synchronized", "this",
          "throw", "throws", "transient", "true", "try", "typeof", "undefined", "var", "void",
          "volatile", "while", "with", "yield");

  private Set<String> reservedNames;
  private int nameCount;

  ShortNameGenerator() {
    reset(ImmutableSet.of());
  }

  ShortNameGenerator(Set<String> reservedNames) {
    reset(reservedNames);
  }

  @Override
  public void reset(Set<String> reservedNames) {
    this.reservedNames = reservedNames;
    this.nameCount = 0;
  }

  @Override
  public String generateNextName() {
    while (true) {
      String name = nameAt(nameCount);
      nameCount++;

      // Make sure it's not a JS keyword or reserved name.
      if (RESERVED_WORDS.contains(name) || reservedNames.contains(name)) {
        continue;
      }
      return name;
    }
  }

  /** Returns the name at the given zero-based position of the sequence. */
  static String nameAt(int index) {
    StringBuilder name = new StringBuilder();
    for (int i = index + 1; i > 0; i = (i - 1) / ALPHABET_SIZE) {
      name.append((char) ('a' + (i - 1) % ALPHABET_SIZE));
    }
    return name.reverse().toString();
  }
}
