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
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/** Static helpers for flat and nested parse tables. */
public final class ParseNodes {

  /** Canonical sibling order. */
  public static final Comparator<ParseNode> BY_POS_ID = Comparator.comparingInt(ParseNode::getPosId);

  /**
   * Source order used to number tokens: by position, and for identical spans the non-terminal
   * before the terminal it wraps.
   */
  public static final Comparator<ParseNode> SOURCE_ORDER =
      Comparator.comparing(ParseNode::getPosition)
          .thenComparing(ParseNode::isTerminal)
          .thenComparingInt(ParseNode::getId);

  /** Numbers {@code table} 1..n in {@link #SOURCE_ORDER} and sorts it by the new pos ids. */
  public static void assignPosIds(List<ParseNode> table) {
    table.sort(SOURCE_ORDER);
    int posId = 1;
    for (ParseNode node : table) {
      node.setPosId(posId++);
    }
  }

  public static void sortByPosId(List<ParseNode> nodes) {
    nodes.sort(BY_POS_ID);
  }

  /** Returns the terminals of a flat table in pos id order. */
  public static ImmutableList<ParseNode> terminals(List<ParseNode> table) {
    return table.stream()
        .filter(ParseNode::isTerminal)
        .sorted(BY_POS_ID)
        .collect(toImmutableList());
  }

  /** Returns every node of a nested table, re-linearized by pos id. */
  public static ImmutableList<ParseNode> flatten(List<ParseNode> roots) {
    List<ParseNode> all = new ArrayList<>();
    Deque<ParseNode> stack = new ArrayDeque<>(roots);
    while (!stack.isEmpty()) {
      ParseNode node = stack.pop();
      all.add(node);
      for (ParseNode child : node.getChildren()) {
        stack.push(child);
      }
    }
    all.sort(BY_POS_ID);
    return ImmutableList.copyOf(all);
  }

  /** Returns the number of edges on the longest root-to-leaf path, 0 for childless roots. */
  public static int depth(List<ParseNode> roots) {
    int depth = 0;
    List<ParseNode> level = roots;
    while (true) {
      List<ParseNode> next = new ArrayList<>();
      for (ParseNode node : level) {
        next.addAll(node.getChildren());
      }
      if (next.isEmpty()) {
        return depth;
      }
      depth++;
      level = next;
    }
  }

  /** Returns the line on which the first top-level token starts. */
  public static int findStartLine(List<ParseNode> roots) {
    checkArgument(!roots.isEmpty(), "Empty parse table");
    return roots.get(0).getStartLine();
  }

  private ParseNodes() {}
}
