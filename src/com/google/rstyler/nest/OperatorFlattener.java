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
import com.google.common.collect.ImmutableSet;
import com.google.rstyler.parse.ParseNode;
import com.google.rstyler.parse.ParseNodes;
import com.google.rstyler.parse.TokenKinds;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens chains of binary operators of one family into a single sibling list, so that
 * {@code a %>% b %>% c} is one node with five children instead of two nested nodes.
 *
 * <p>The grammar nests such chains either through the left operand (left-nested families) or
 * through the right operand (right-nested families). Sibling lists are rewritten bottom-up:
 * children first, then the list holding them.
 */
final class OperatorFlattener implements NestingPass {

  static final ImmutableSet<String> LEFT_NESTED_KINDS =
      ImmutableSet.<String>builder()
          .addAll(TokenKinds.SPECIAL_KINDS)
          .addAll(TokenKinds.MATH_KINDS)
          .add(TokenKinds.DOLLAR)
          .build();

  static final ImmutableSet<String> RIGHT_NESTED_KINDS =
      ImmutableSet.<String>builder()
          .addAll(TokenKinds.SPECIAL_KINDS)
          .add(TokenKinds.LEFT_ASSIGN, TokenKinds.PLUS, TokenKinds.MINUS)
          .build();

  @Override
  public void process(List<ParseNode> roots) {
    visit(roots);
  }

  private static void visit(List<ParseNode> siblings) {
    for (ParseNode node : siblings) {
      if (node.hasChildren()) {
        List<ParseNode> children = new ArrayList<>(node.getChildren());
        visit(children);
        node.setChildren(children);
      }
    }
    flatten(siblings, LEFT_NESTED_KINDS, true);
    flatten(siblings, RIGHT_NESTED_KINDS, false);
  }

  /**
   * Repeatedly replaces the operand next to the outermost operator of {@code kinds} by its
   * children, as long as that operand is itself an operator node of the family. The first sibling
   * is never treated as an operator, since an operator there is unary.
   */
  static void flatten(List<ParseNode> siblings, ImmutableSet<String> kinds, boolean left) {
    while (true) {
      int operator = left ? firstOperator(siblings, kinds) : lastOperator(siblings, kinds);
      if (operator < 0) {
        return;
      }
      int operandIndex =
          left ? previousNonComment(siblings, operator) : nextNonComment(siblings, operator);
      if (operandIndex < 0) {
        return;
      }
      ParseNode operand = siblings.get(operandIndex);
      if (!containsOperator(operand.getChildren(), kinds)) {
        return;
      }
      bindWithChildren(siblings, operandIndex);
    }
  }

  private static void bindWithChildren(List<ParseNode> siblings, int index) {
    ParseNode operand = siblings.remove(index);
    for (ParseNode child : operand.getChildren()) {
      child.setParentId(operand.getParentId());
      siblings.add(child);
    }
    ParseNodes.sortByPosId(siblings);
  }

  private static boolean containsOperator(ImmutableList<ParseNode> nodes, ImmutableSet<String> kinds) {
    for (int i = 1; i < nodes.size(); i++) {
      if (kinds.contains(nodes.get(i).getKind())) {
        return true;
      }
    }
    return false;
  }

  private static int firstOperator(List<ParseNode> siblings, ImmutableSet<String> kinds) {
    for (int i = 1; i < siblings.size(); i++) {
      if (kinds.contains(siblings.get(i).getKind())) {
        return i;
      }
    }
    return -1;
  }

  private static int lastOperator(List<ParseNode> siblings, ImmutableSet<String> kinds) {
    for (int i = siblings.size() - 1; i >= 1; i--) {
      if (kinds.contains(siblings.get(i).getKind())) {
        return i;
      }
    }
    return -1;
  }

  static int previousNonComment(List<ParseNode> siblings, int index) {
    for (int i = index - 1; i >= 0; i--) {
      if (!siblings.get(i).isComment()) {
        return i;
      }
    }
    return -1;
  }

  static int nextNonComment(List<ParseNode> siblings, int index) {
    for (int i = index + 1; i < siblings.size(); i++) {
      if (!siblings.get(i).isComment()) {
        return i;
      }
    }
    return -1;
  }
}
