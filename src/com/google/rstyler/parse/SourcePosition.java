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

package com.google.rstyler.parse;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.auto.value.AutoValue.CopyAnnotations;
import com.google.errorprone.annotations.Immutable;
import java.util.Comparator;

/**
 * The source span of a parse token: start line, start column, end line and end column, all
 * one-indexed and inclusive, as reported by the tokenizer.
 */
@AutoValue
@CopyAnnotations
@Immutable
public abstract class SourcePosition implements Comparable<SourcePosition> {

  public static SourcePosition create(int startLine, int startColumn, int endLine, int endColumn) {
    checkArgument(
        startLine < endLine || (startLine == endLine && startColumn <= endColumn),
        "Bad position information: %s:%s-%s:%s",
        startLine,
        startColumn,
        endLine,
        endColumn);
    return new AutoValue_SourcePosition(startLine, startColumn, endLine, endColumn);
  }

  /** Returns a position spanning from the start of {@code first} to the end of {@code last}. */
  public static SourcePosition span(SourcePosition first, SourcePosition last) {
    return create(
        first.getStartLine(), first.getStartColumn(), last.getEndLine(), last.getEndColumn());
  }

  public abstract int getStartLine();

  public abstract int getStartColumn();

  public abstract int getEndLine();

  public abstract int getEndColumn();

  public boolean isMultiLine() {
    return getStartLine() != getEndLine();
  }

  /**
   * Orders by start, and among tokens starting at the same place puts the wider span first, so an
   * enclosing construct precedes its first child.
   */
  @Override
  public final int compareTo(SourcePosition other) {
    return SOURCE_ORDER.compare(this, other);
  }

  private static final Comparator<SourcePosition> SOURCE_ORDER =
      Comparator.comparingInt(SourcePosition::getStartLine)
          .thenComparingInt(SourcePosition::getStartColumn)
          .thenComparing(Comparator.comparingInt(SourcePosition::getEndLine).reversed())
          .thenComparing(Comparator.comparingInt(SourcePosition::getEndColumn).reversed());

  @Override
  public final String toString() {
    return getStartLine() + ":" + getStartColumn() + "-" + getEndLine() + ":" + getEndColumn();
  }
}
