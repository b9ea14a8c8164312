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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The translation catalogs of all locales requested so far.
 *
 * <p>The catalog of a locale is loaded on its first request and kept for the lifetime of the
 * cache. A locale without a catalog, or whose catalog cannot be read, translates every text to
 * itself; such failures are logged once and not retried.
 */
public final class TranslationCache {
  private static final Logger logger = Logger.getLogger(TranslationCache.class.getName());

  /** The caches shared by compilers reading the same catalogs, by catalog location. */
  private static final ConcurrentMap<String, TranslationCache> sharedCaches =
      new ConcurrentHashMap<>();

  private final TranslationCatalogLoader loader;
  private final LoadingCache<String, TranslationCatalog> catalogs;

  public TranslationCache(TranslationCatalogLoader loader) {
    this.loader = checkNotNull(loader);
    this.catalogs =
        CacheBuilder.newBuilder()
            .build(
                new CacheLoader<String, TranslationCatalog>() {
                  @Override
                  public TranslationCatalog load(String locale) {
                    return loadOrFallBack(locale);
                  }
                });
  }

  /**
   * Returns the cache of the catalogs configured in {@code options}, shared with every other
   * compiler using the same catalogs.
   */
  public static TranslationCache forOptions(CompilerOptions options) {
    String directory = options.getCatalogDirectory();
    if (directory == null) {
      return sharedCaches.computeIfAbsent("", key -> new TranslationCache(new NoCatalogs()));
    }
    Path path = Path.of(directory);
    String domain = options.getCatalogDomain();
    return sharedCaches.computeIfAbsent(
        path.toAbsolutePath().normalize() + "/" + domain,
        key -> new TranslationCache(new DirectoryCatalogLoader(path, domain)));
  }

  /** Returns the translation of {@code text} in {@code locale}, or {@code text} itself. */
  public String resolve(String locale, String text) {
    String translation = getCatalog(locale).translate(text);
    return translation != null ? translation : text;
  }

  public TranslationCatalog getCatalog(String locale) {
    return catalogs.getUnchecked(locale);
  }

  private TranslationCatalog loadOrFallBack(String locale) {
    Optional<TranslationCatalog> catalog;
    try {
      catalog = loader.load(locale);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot load translations for locale " + locale, e);
      return TranslationCatalog.identity();
    }
    if (catalog.isPresent()) {
      logger.fine("Loaded translations for locale " + locale + " from " + loader);
      return catalog.get();
    }
    logger.info("No translations for locale " + locale + " in " + loader);
    return TranslationCatalog.identity();
  }

  /** The loader of compilers configured without catalogs. */
  private static final class NoCatalogs implements TranslationCatalogLoader {
    @Override
    public Optional<TranslationCatalog> load(String locale) {
      return Optional.empty();
    }

    @Override
    public String toString() {
      return "(no catalog directory)";
    }
  }
}
