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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DirectoryCatalogLoaderTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private Path writeCatalog(String locale, String domain, String contents) throws IOException {
    Path dir = folder.getRoot().toPath().resolve(locale);
    Files.createDirectories(dir);
    return Files.writeString(dir.resolve(domain + ".json"), contents, StandardCharsets.UTF_8);
  }

  @Test
  public void testLoad() throws IOException {
    writeCatalog("fr", "javascript", "{\"Hello\": \"Bonjour\"}");
    DirectoryCatalogLoader loader =
        new DirectoryCatalogLoader(folder.getRoot().toPath(), "javascript");

    Optional<TranslationCatalog> catalog = loader.load("fr");

    assertThat(catalog).isPresent();
    assertThat(catalog.get().translate("Hello")).isEqualTo("Bonjour");
  }

  @Test
  public void testCatalogPath() {
    Path root = folder.getRoot().toPath();
    DirectoryCatalogLoader loader = new DirectoryCatalogLoader(root, "widgets");

    assertThat(loader.getCatalogPath("pt_BR"))
        .isEqualTo(root.resolve("pt_BR").resolve("widgets.json"));
  }

  @Test
  public void testMissingCatalog() throws IOException {
    writeCatalog("fr", "other", "{\"Hello\": \"Bonjour\"}");
    DirectoryCatalogLoader loader =
        new DirectoryCatalogLoader(folder.getRoot().toPath(), "javascript");

    assertThat(loader.load("fr")).isEmpty();
    assertThat(loader.load("de")).isEmpty();
  }

  @Test
  public void testMalformedCatalog() throws IOException {
    Path path = writeCatalog("fr", "javascript", "{\"Hello\": [\"Bonjour\"]}");
    DirectoryCatalogLoader loader =
        new DirectoryCatalogLoader(folder.getRoot().toPath(), "javascript");

    IOException e = assertThrows(IOException.class, () -> loader.load("fr"));

    assertThat(e).hasMessageThat().contains(path.toString());
  }

  @Test
  public void testEmptyDomain() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new DirectoryCatalogLoader(folder.getRoot().toPath(), ""));
  }
}
