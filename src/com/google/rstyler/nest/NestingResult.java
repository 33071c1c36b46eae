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
import com.google.common.collect.Iterables;
import com.google.rstyler.parse.ParseNode;

/** The outcome of nesting one parse table. */
public final class NestingResult {
  private final ImmutableList<ParseNode> roots;
  private final IgnoreRegionState ignoreRegions;
  private final ImmutableList<StylerError> warnings;
  private final int nestingIterations;

  NestingResult(
      ImmutableList<ParseNode> roots,
      IgnoreRegionState ignoreRegions,
      ImmutableList<StylerError> warnings,
      int nestingIterations) {
    this.roots = roots;
    this.ignoreRegions = ignoreRegions;
    this.warnings = warnings;
    this.nestingIterations = nestingIterations;
  }

  /** The top-level nodes in source order. A single expression yields exactly one. */
  public ImmutableList<ParseNode> getRoots() {
    return roots;
  }

  /** Returns the single top-level node, failing if there is not exactly one. */
  public ParseNode getOnlyRoot() {
    return Iterables.getOnlyElement(roots);
  }

  /** The regions the formatter must pass through unchanged. */
  public IgnoreRegionState getIgnoreRegions() {
    return ignoreRegions;
  }

  public ImmutableList<StylerError> getWarnings() {
    return warnings;
  }

  /** The number of iterations the tree builder needed, which is the depth of the tree. */
  public int getNestingIterations() {
    return nestingIterations;
  }
}
