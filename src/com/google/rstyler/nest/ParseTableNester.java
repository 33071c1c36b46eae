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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.rstyler.parse.ParseNode;
import com.google.rstyler.parse.ParseNodes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns a flat table, in which the tree is only implied by parent ids, into a nested table.
 *
 * <p>Each iteration splits the working set into internal nodes (nodes some other node names as its
 * parent, and top-level nodes) and leaves. The leaves are handed to their parents, merged with the
 * children those parents collected in earlier iterations and ordered by pos id; then the leaves
 * leave the working set. Once only top-level nodes remain they are the nested table. A node becomes
 * a leaf only after its whole subtree has been attached to it, so the number of iterations equals
 * the depth of the tree.
 *
 * <p>The table must have passed {@link ParseTableValidator}.
 */
final class ParseTableNester {

  private static final Logger logger = Logger.getLogger(ParseTableNester.class.getName());

  private final ErrorHandler errorHandler;
  private int iterationCount = -1;

  ParseTableNester(ErrorHandler errorHandler) {
    this.errorHandler = errorHandler;
  }

  /**
   * Nests {@code table}.
   *
   * @return the top-level nodes in pos id order, each holding its subtree
   * @throws InvalidParseTableException if some nodes never reach a top-level node
   */
  List<ParseNode> nest(List<ParseNode> table) {
    List<ParseNode> working = new ArrayList<>(table);
    int iterations = 0;
    while (!allTopLevel(working)) {
      working = nestLeaves(working);
      iterations++;
    }
    ParseNodes.sortByPosId(working);
    iterationCount = iterations;
    logger.fine("Nested " + table.size() + " tokens in " + iterations + " iteration(s)");
    return working;
  }

  /** Returns the number of iterations the last call to {@link #nest} took. */
  int getIterationCount() {
    checkState(iterationCount >= 0, "nest() was not called");
    return iterationCount;
  }

  private List<ParseNode> nestLeaves(List<ParseNode> working) {
    Set<Integer> parentIds = new HashSet<>();
    for (ParseNode node : working) {
      parentIds.add(node.getParentId());
    }

    List<ParseNode> internal = new ArrayList<>();
    ListMultimap<Integer, ParseNode> leavesByParent = ArrayListMultimap.create();
    for (ParseNode node : working) {
      if (parentIds.contains(node.getId()) || node.isTopLevel()) {
        internal.add(node);
      } else {
        leavesByParent.put(node.getParentId(), node);
      }
    }

    if (leavesByParent.isEmpty()) {
      reportCycle(internal);
    }

    for (ParseNode parent : internal) {
      List<ParseNode> leaves = leavesByParent.get(parent.getId());
      if (leaves.isEmpty()) {
        continue;
      }
      List<ParseNode> merged = new ArrayList<>(leaves);
      merged.addAll(parent.getChildren());
      ParseNodes.sortByPosId(merged);
      parent.setChildren(merged);
    }
    return internal;
  }

  private static boolean allTopLevel(List<ParseNode> working) {
    for (ParseNode node : working) {
      if (!node.isTopLevel()) {
        return false;
      }
    }
    return true;
  }

  private void reportCycle(List<ParseNode> working) {
    ParseNode culprit = null;
    for (ParseNode node : working) {
      if (!node.isTopLevel() && (culprit == null || node.getId() < culprit.getId())) {
        culprit = node;
      }
    }
    StylerError error =
        StylerError.make(culprit, ParseTableErrors.PARENT_CYCLE, String.valueOf(culprit.getId()));
    errorHandler.report(CheckLevel.ERROR, error);
    throw new InvalidParseTableException(error);
  }
}
