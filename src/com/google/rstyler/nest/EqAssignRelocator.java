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
import com.google.rstyler.parse.SourcePosition;
import com.google.rstyler.parse.TokenKinds;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Wraps {@code =} assignments into an {@code expr} node of their own.
 *
 * <p>The grammar nests {@code a <- 1} as {@code expr(expr(a), <-, expr(1))} but leaves the parts of
 * {@code a = 1} as plain siblings of the enclosing list. This pass gives the {@code =} form the
 * same shape, so that every assignment can be formatted by one rule. Chained assignments such as
 * {@code a = b = 1} are wrapped as a whole. Lists owned by an {@code equal_assign} node are
 * already shaped and are left alone, as is a run that already makes up the whole child list of its
 * owner.
 *
 * <p>A wrapper takes the pos id of its first child. Sibling lists stay ordered by pos id, but pos
 * ids are no longer unique across the whole tree once a wrapper was added.
 */
final class EqAssignRelocator implements NestingPass {

  private final NodeIdSupplier idSupplier;

  EqAssignRelocator(NodeIdSupplier idSupplier) {
    this.idSupplier = idSupplier;
  }

  /** Whether the flat table has an {@code =} assignment, i.e. whether this pass has work to do. */
  static boolean hasEqAssign(List<ParseNode> table) {
    for (ParseNode node : table) {
      if (node.isKind(TokenKinds.EQ_ASSIGN)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void process(List<ParseNode> roots) {
    visit(roots, null);
  }

  private void visit(List<ParseNode> siblings, @Nullable ParseNode owner) {
    for (ParseNode node : siblings) {
      if (node.hasChildren()) {
        List<ParseNode> children = new ArrayList<>(node.getChildren());
        visit(children, node);
        node.setChildren(children);
      }
    }
    if (owner != null && owner.isKind(TokenKinds.EQUAL_ASSIGN)) {
      return;
    }
    relocate(siblings, owner);
  }

  private void relocate(List<ParseNode> siblings, @Nullable ParseNode owner) {
    List<Integer> eqAssigns = eqAssignIndices(siblings);
    if (eqAssigns.isEmpty()) {
      return;
    }
    int removed = 0;
    for (int[] block : findBlocks(siblings.size(), eqAssigns)) {
      int firstEq = -1;
      int lastEq = -1;
      for (int eq : eqAssigns) {
        if (block[0] <= eq && eq <= block[1]) {
          firstEq = firstEq < 0 ? eq : firstEq;
          lastEq = eq;
        }
      }
      // Indices refer to the list before any run was wrapped.
      int from = Math.max(firstEq - 1, block[0]) - removed;
      int to = Math.min(lastEq + 1, block[1]) - removed;
      if (owner != null && from == 0 && to == siblings.size() - 1) {
        // The owner already is the assignment node.
        continue;
      }
      wrap(siblings, from, to, owner == null ? ParseNode.NO_PARENT : owner.getId());
      removed += to - from;
    }
  }

  /**
   * Splits {@code 0..size-1} into blocks of one assignment each. A new block starts at the left
   * hand side of an {@code =} that is more than two tokens after the previous one; closer
   * {@code =} tokens belong to the same chained assignment.
   */
  static List<int[]> findBlocks(int size, List<Integer> eqAssigns) {
    List<int[]> blocks = new ArrayList<>();
    int start = 0;
    for (int k = 1; k < eqAssigns.size(); k++) {
      int lhs = eqAssigns.get(k) - 1;
      if (eqAssigns.get(k) - eqAssigns.get(k - 1) > 2 && lhs > start) {
        blocks.add(new int[] {start, lhs - 1});
        start = lhs;
      }
    }
    blocks.add(new int[] {start, size - 1});
    return blocks;
  }

  private void wrap(List<ParseNode> siblings, int from, int to, int ownerId) {
    List<ParseNode> run = new ArrayList<>(siblings.subList(from, to + 1));
    ParseNode first = run.get(0);
    ParseNode wrapper =
        ParseNode.newNonTerminal(
            idSupplier.getUniqueId(),
            ownerId,
            SourcePosition.span(first.getPosition(), run.get(run.size() - 1).getPosition()),
            TokenKinds.EXPR);
    wrapper.setPosId(first.getPosId());
    for (ParseNode node : run) {
      node.setParentId(wrapper.getId());
    }
    wrapper.setChildren(run);
    siblings.subList(from, to + 1).clear();
    siblings.add(from, wrapper);
  }

  private static List<Integer> eqAssignIndices(List<ParseNode> siblings) {
    List<Integer> indices = new ArrayList<>();
    for (int i = 0; i < siblings.size(); i++) {
      if (siblings.get(i).isKind(TokenKinds.EQ_ASSIGN)) {
        indices.add(i);
      }
    }
    return indices;
  }
}
