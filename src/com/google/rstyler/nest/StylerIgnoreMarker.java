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

import com.google.rstyler.parse.ParseNode;
import com.google.rstyler.parse.ParseNodes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Flags the tokens that lie between an ignore start marker and the matching stop marker, so the
 * formatter leaves them as they are.
 *
 * <p>A marker is a comment whose trimmed text equals the configured marker. A start marker that
 * follows code on the same line is an inline marker: it ignores only the tokens of that line and
 * needs no stop marker. A comment that holds other text besides the marker is not a marker, so
 * {@code 1 # note # styler: off} is not ignored.
 *
 * <p>A start marker inside an open region, or a stop marker outside of one, makes the sequence
 * invalid: a warning is reported and the region opened by the offending sequence is dropped.
 */
final class StylerIgnoreMarker implements NestingPass {

  private static final Logger logger = Logger.getLogger(StylerIgnoreMarker.class.getName());

  private enum ScanState {
    ACTIVE,
    IGNORING
  }

  private final String ignoreStart;
  private final String ignoreStop;
  private final IgnoreRegionState regions;
  private final ErrorHandler errorHandler;

  StylerIgnoreMarker(NestOptions options, IgnoreRegionState regions, ErrorHandler errorHandler) {
    this.ignoreStart = options.getIgnoreStart().trim();
    this.ignoreStop = options.getIgnoreStop().trim();
    this.regions = regions;
    this.errorHandler = errorHandler;
  }

  @Override
  public void process(List<ParseNode> table) {
    List<ParseNode> ordered = new ArrayList<>(table);
    ParseNodes.sortByPosId(ordered);
    for (ParseNode node : ordered) {
      node.setIgnored(false);
    }

    boolean anyStart = ordered.stream().anyMatch(this::isStartMarker);
    regions.setHasStartMarkers(anyStart);
    if (anyStart || ordered.stream().anyMatch(this::isStopMarker)) {
      Set<ParseNode> inlineMarkers = findInlineMarkers(ordered);
      scan(ordered, inlineMarkers);
      ignoreInlineLines(ordered, inlineMarkers);
    }
    regions.record(ordered);
    logger.fine(regions.getIgnoredRanges().size() + " ignored range(s)");
  }

  private void scan(List<ParseNode> ordered, Set<ParseNode> inlineMarkers) {
    ScanState state = ScanState.ACTIVE;
    List<ParseNode> pending = new ArrayList<>();
    for (ParseNode node : ordered) {
      if (isStartMarker(node) && !inlineMarkers.contains(node)) {
        if (state == ScanState.IGNORING) {
          reportInvalidSequence(node, "start", "stop");
          pending.clear();
          state = ScanState.ACTIVE;
        } else {
          pending.add(node);
          state = ScanState.IGNORING;
        }
      } else if (isStopMarker(node)) {
        if (state == ScanState.IGNORING) {
          pending.add(node);
          commit(pending, node);
          state = ScanState.ACTIVE;
        } else {
          reportInvalidSequence(node, "stop", "start");
        }
      } else if (state == ScanState.IGNORING) {
        pending.add(node);
      }
    }
    if (state == ScanState.IGNORING) {
      // An open region runs to the end of the input.
      commit(pending, null);
    }
  }

  /**
   * Flags the tokens of a closed region. Non-terminals that extend past the stop marker enclose
   * code that is formatted and keep their flag unset.
   */
  private static void commit(List<ParseNode> pending, @Nullable ParseNode stopMarker) {
    for (ParseNode node : pending) {
      if (node.isTerminal()
          || stopMarker == null
          || node.getEndLine() <= stopMarker.getStartLine()) {
        node.setIgnored(true);
      }
    }
    pending.clear();
  }

  private Set<ParseNode> findInlineMarkers(List<ParseNode> ordered) {
    Set<ParseNode> inline = new HashSet<>();
    ParseNode previousTerminal = null;
    for (ParseNode node : ordered) {
      if (!node.isTerminal()) {
        continue;
      }
      if (isStartMarker(node)
          && previousTerminal != null
          && previousTerminal.getEndLine() == node.getStartLine()) {
        inline.add(node);
      }
      previousTerminal = node;
    }
    return inline;
  }

  private static void ignoreInlineLines(List<ParseNode> ordered, Set<ParseNode> inlineMarkers) {
    Set<Integer> lines = new HashSet<>();
    for (ParseNode marker : inlineMarkers) {
      lines.add(marker.getStartLine());
    }
    for (ParseNode node : ordered) {
      if (!lines.contains(node.getStartLine())) {
        continue;
      }
      if (node.isTerminal() || !node.getPosition().isMultiLine()) {
        node.setIgnored(true);
      }
    }
  }

  private boolean isStartMarker(ParseNode node) {
    return isMarker(node, ignoreStart);
  }

  private boolean isStopMarker(ParseNode node) {
    return isMarker(node, ignoreStop);
  }

  private static boolean isMarker(ParseNode node, String marker) {
    return node.isTerminal() && node.isComment() && node.getText().trim().equals(marker);
  }

  private void reportInvalidSequence(ParseNode marker, String kind, String missingKind) {
    errorHandler.report(
        CheckLevel.WARNING,
        StylerError.make(
            marker,
            ParseTableErrors.INVALID_IGNORE_SEQUENCE,
            kind,
            marker.getText().trim(),
            missingKind));
  }
}
