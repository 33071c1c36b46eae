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

import java.io.Serializable;

/**
 * The type of a diagnostic raised while nesting a parse table: a stable key, a
 * {@link java.text.MessageFormat} pattern for the description, and the level it is reported at.
 * Types are compared by key.
 */
public final class DiagnosticType implements Serializable {
  private static final long serialVersionUID = 1;

  /** Stable identifier, e.g. {@code RSTYLER_DANGLING_PARENT}. */
  public final String key;

  /** The level the nesting stages report this diagnostic at. */
  public final CheckLevel level;

  private final String format;

  /** A diagnostic that aborts nesting of the input. */
  public static DiagnosticType error(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.ERROR, descriptionFormat);
  }

  /** A diagnostic that is returned alongside a complete result. */
  public static DiagnosticType warning(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.WARNING, descriptionFormat);
  }

  private DiagnosticType(String key, CheckLevel level, String format) {
    this.key = key;
    this.level = level;
    this.format = format;
  }

  String format(String... arguments) {
    return Platform.formatMessage(format, arguments);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DiagnosticType && ((DiagnosticType) other).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key;
  }
}
