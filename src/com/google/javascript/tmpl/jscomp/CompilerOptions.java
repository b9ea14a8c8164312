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

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** Compiler options. */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  /** Name of the function whose literal calls are collected and translated. */
  private String translationFunctionName = "gettext";

  /** The locale translation calls are resolved for. */
  private String locale = "en";

  /**
   * Whether literal translation calls are replaced by their translation. When false the calls are
   * only collected.
   */
  private boolean translate = true;

  /** Whether the statement termination check runs. */
  private boolean validate = true;

  /** Root of the catalog tree read by {@link DirectoryCatalogLoader}. */
  private @Nullable String catalogDirectory = null;

  /** File name, without extension, of the catalogs below {@link #catalogDirectory}. */
  private String catalogDomain = "javascript";

  public CompilerOptions() {}

  public String getTranslationFunctionName() {
    return translationFunctionName;
  }

  public void setTranslationFunctionName(String translationFunctionName) {
    checkArgument(!translationFunctionName.isEmpty(), "Empty translation function name");
    this.translationFunctionName = translationFunctionName;
  }

  public String getLocale() {
    return locale;
  }

  public void setLocale(String locale) {
    this.locale = checkNotNull(locale);
  }

  public boolean shouldTranslate() {
    return translate;
  }

  public void setTranslate(boolean translate) {
    this.translate = translate;
  }

  public boolean shouldValidate() {
    return validate;
  }

  public void setValidate(boolean validate) {
    this.validate = validate;
  }

  public @Nullable String getCatalogDirectory() {
    return catalogDirectory;
  }

  public void setCatalogDirectory(@Nullable String catalogDirectory) {
    this.catalogDirectory = catalogDirectory;
  }

  public String getCatalogDomain() {
    return catalogDomain;
  }

  public void setCatalogDomain(String catalogDomain) {
    checkArgument(!catalogDomain.isEmpty(), "Empty catalog domain");
    this.catalogDomain = catalogDomain;
  }
}
