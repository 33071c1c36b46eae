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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;

/** Options for nesting a parse table. */
public class NestOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String DEFAULT_IGNORE_START = "# styler: off";
  public static final String DEFAULT_IGNORE_STOP = "# styler: on";

  static final String IGNORE_START_PROPERTY = "rstyler.ignore_start";
  static final String IGNORE_STOP_PROPERTY = "rstyler.ignore_stop";

  /** Comment text that starts a region excluded from formatting. */
  private String ignoreStart = DEFAULT_IGNORE_START;

  /** Comment text that ends a region excluded from formatting. */
  private String ignoreStop = DEFAULT_IGNORE_STOP;

  private boolean flattenOperators = true;

  private boolean relocateEqAssign = true;

  /** Creates options with the ignore markers taken from system properties, if set. */
  public static NestOptions fromSystemProperties() {
    return new NestOptions()
        .setIgnoreStart(System.getProperty(IGNORE_START_PROPERTY, DEFAULT_IGNORE_START))
        .setIgnoreStop(System.getProperty(IGNORE_STOP_PROPERTY, DEFAULT_IGNORE_STOP));
  }

  public String getIgnoreStart() {
    return ignoreStart;
  }

  @CanIgnoreReturnValue
  public NestOptions setIgnoreStart(String ignoreStart) {
    this.ignoreStart = checkNotNull(ignoreStart);
    return this;
  }

  public String getIgnoreStop() {
    return ignoreStop;
  }

  @CanIgnoreReturnValue
  public NestOptions setIgnoreStop(String ignoreStop) {
    this.ignoreStop = checkNotNull(ignoreStop);
    return this;
  }

  public boolean shouldFlattenOperators() {
    return flattenOperators;
  }

  @CanIgnoreReturnValue
  public NestOptions setFlattenOperators(boolean flattenOperators) {
    this.flattenOperators = flattenOperators;
    return this;
  }

  public boolean shouldRelocateEqAssign() {
    return relocateEqAssign;
  }

  /** Whether top-level {@code =} assignments get wrapped like {@code <-} assignments. */
  @CanIgnoreReturnValue
  public NestOptions setRelocateEqAssign(boolean relocateEqAssign) {
    this.relocateEqAssign = relocateEqAssign;
    return this;
  }

  /**
   * Checks for combinations of options that cannot work.
   *
   * @throws InvalidOptionsException if a marker is blank or both markers are the same
   */
  public void validate() {
    if (ignoreStart.trim().isEmpty() || ignoreStop.trim().isEmpty()) {
      throw new InvalidOptionsException("Ignore markers must not be blank.");
    }
    if (ignoreStart.trim().equals(ignoreStop.trim())) {
      throw new InvalidOptionsException(
          "Ignore start and stop markers must differ, both are \"%s\".", ignoreStart);
    }
  }

  /**
   * Exception to indicate incompatible options in the NestOptions.
   */
  public static class InvalidOptionsException extends RuntimeException {
    private InvalidOptionsException(String message, Object... args) {
      super(String.format(message, args));
    }
  }
}
