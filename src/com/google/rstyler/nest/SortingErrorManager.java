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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.Objects;
import java.util.TreeSet;

/**
 * An error manager that sorts and deduplicates the diagnostics reported to it. This error manager
 * does not produce any output; subclasses override {@link #println(CheckLevel, StylerError)} and
 * {@link #printSummary()} to do so.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, StylerError error) {
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<StylerError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<StylerError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<StylerError> toList(CheckLevel level) {
    ImmutableList.Builder<StylerError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /** Prints one diagnostic. Called by {@link #generateReport()}. */
  public void println(CheckLevel level, StylerError error) {}

  /** Prints the number of errors and warnings. Called by {@link #generateReport()}. */
  protected void printSummary() {}

  /**
   * Orders diagnostics by line number, {@link CheckLevel}, column and description. Diagnostics
   * without a line sort first.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // null is the smallest value
      if (p2 == null) {
        return p1 == null ? 0 : P1_GT_P2;
      }
      if (p1 == null) {
        return P1_LT_P2;
      }

      // lineno comparison
      int lineno1 = p1.error.lineno();
      int lineno2 = p2.error.lineno();
      if (lineno1 != lineno2) {
        return Integer.compare(lineno1, lineno2);
      }

      // check level
      if (p1.level != p2.level) {
        return p2.level.compareTo(p1.level);
      }

      // charno comparison
      int charno1 = p1.error.charno();
      int charno2 = p2.error.charno();
      if (charno1 != charno2) {
        return Integer.compare(charno1, charno2);
      }

      int typeCompare = p1.error.type().key.compareTo(p2.error.type().key);
      if (typeCompare != 0) {
        return typeCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static class ErrorWithLevel {
    final StylerError error;
    final CheckLevel level;

    ErrorWithLevel(StylerError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(level, error.description(), error.lineno(), error.charno());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return Objects.equals(level, e.level)
          && Objects.equals(error.description(), e.error.description())
          && error.lineno() == e.error.lineno()
          && error.charno() == e.error.charno();
    }
  }
}
