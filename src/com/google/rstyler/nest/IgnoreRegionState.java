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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.rstyler.parse.ParseNode;
import com.google.rstyler.parse.ParseNodes;
import java.util.List;

/**
 * The regions of one input that must be left untouched by the formatter. A new instance is created
 * for every nesting run and handed to the caller with the nested table; it is never shared between
 * runs.
 */
public final class IgnoreRegionState {

  private boolean hasStartMarkers;
  private ImmutableList<IgnoredRange> ranges = ImmutableList.of();
  private ImmutableList<ParseNode> ignoredTerminals = ImmutableList.of();
  private boolean recorded;

  IgnoreRegionState() {}

  /** Whether the input contains at least one start marker. */
  public boolean hasStartMarkers() {
    return hasStartMarkers;
  }

  void setHasStartMarkers(boolean hasStartMarkers) {
    this.hasStartMarkers = hasStartMarkers;
  }

  public ImmutableList<IgnoredRange> getIgnoredRanges() {
    return ranges;
  }

  /** The ignored terminals in source order. */
  public ImmutableList<ParseNode> getIgnoredTerminals() {
    return ignoredTerminals;
  }

  public boolean isLineIgnored(int line) {
    for (IgnoredRange range : ranges) {
      if (range.containsLine(line)) {
        return true;
      }
    }
    return false;
  }

  /** Captures the ignored terminals of a flagged flat table. May only be called once per run. */
  void record(List<ParseNode> table) {
    checkState(!recorded, "Ignore regions were already recorded for this run");
    recorded = true;
    ImmutableList.Builder<IgnoredRange> rangesBuilder = ImmutableList.builder();
    ImmutableList.Builder<ParseNode> terminalsBuilder = ImmutableList.builder();
    ParseNode first = null;
    ParseNode last = null;
    for (ParseNode terminal : ParseNodes.terminals(table)) {
      if (terminal.isIgnored()) {
        terminalsBuilder.add(terminal);
        if (first == null) {
          first = terminal;
        }
        last = terminal;
      } else if (first != null) {
        rangesBuilder.add(
            IgnoredRange.create(first.getStartLine(), last.getEndLine(), first.getPosId()));
        first = null;
      }
    }
    if (first != null) {
      rangesBuilder.add(
          IgnoredRange.create(first.getStartLine(), last.getEndLine(), first.getPosId()));
    }
    ranges = rangesBuilder.build();
    ignoredTerminals = terminalsBuilder.build();
  }
}
