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

import com.google.auto.value.AutoValue;
import com.google.auto.value.AutoValue.CopyAnnotations;
import com.google.errorprone.annotations.Immutable;

/** A run of consecutive ignored terminals, described by the lines it covers. */
@AutoValue
@CopyAnnotations
@Immutable
public abstract class IgnoredRange {

  static IgnoredRange create(int startLine, int endLine, int firstPosId) {
    return new AutoValue_IgnoredRange(startLine, endLine, firstPosId);
  }

  public abstract int getStartLine();

  public abstract int getEndLine();

  /** The pos id of the first ignored terminal of the range. */
  public abstract int getFirstPosId();

  public boolean containsLine(int line) {
    return getStartLine() <= line && line <= getEndLine();
  }
}
