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

import java.util.logging.Logger;

/** An error handler that logs errors using a logger, at the SEVERE level. */
public class LoggerErrorHandler implements ErrorHandler {
  private final Logger logger;

  public LoggerErrorHandler(Logger logger) {
    this.logger = logger;
  }

  /** Creates an instance that logs to the logger of {@link TemplateJsCompiler}. */
  public LoggerErrorHandler() {
    this(Logger.getLogger(TemplateJsCompiler.class.getName()));
  }

  @Override
  public void report(JSError error) {
    logger.severe(error.toString());
  }
}
