/*
 * Copyright 2026 The RStyler Authors.
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

package com.google.rstyler.nest;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects the diagnostics of a nesting run and writes them to a logger once the run is over:
 * errors at {@link Level#SEVERE}, warnings at {@link Level#WARNING}. A run without diagnostics
 * logs nothing.
 */
public class LoggerErrorManager extends SortingErrorManager {
  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  private static Level toLogLevel(CheckLevel level) {
    return level == CheckLevel.ERROR ? Level.SEVERE : Level.WARNING;
  }

  @Override
  public void println(CheckLevel level, StylerError error) {
    logger.log(toLogLevel(level), error.format(level));
  }

  @Override
  protected void printSummary() {
    if (getErrorCount() + getWarningCount() == 0) {
      return;
    }
    logger.log(
        hasErrors() ? Level.SEVERE : Level.WARNING,
        "Nesting finished with {0} error(s) and {1} warning(s)",
        new Object[] {getErrorCount(), getWarningCount()});
  }
}
