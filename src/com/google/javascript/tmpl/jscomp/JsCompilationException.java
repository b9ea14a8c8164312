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

/**
 * Thrown when a script cannot be compiled. Every pass stops at the first error it finds, so the
 * exception carries exactly one {@link JSError}.
 */
public final class JsCompilationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  @SuppressWarnings("serial")
  private final JSError error;

  public JsCompilationException(JSError error) {
    super(error.toString());
    this.error = checkNotNull(error);
  }

  public JsCompilationException(JSError error, Throwable cause) {
    super(error.toString(), cause);
    this.error = checkNotNull(error);
  }

  public JSError getError() {
    return error;
  }

  public DiagnosticType getType() {
    return error.type();
  }
}
