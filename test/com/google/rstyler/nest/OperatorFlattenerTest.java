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

import static com.google.common.truth.Truth.assertThat;

import com.google.rstyler.parse.ParseNode;
import com.google.rstyler.parse.ParseNodes;
import com.google.rstyler.parse.ParseTableFixture;
import com.google.rstyler.parse.TokenKinds;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class OperatorFlattenerTest {

  private static List<ParseNode> nest(List<ParseNode> table) {
    new SpecialOperatorMapper().process(table);
    return new ParseTableNester(new SortingErrorManager()).nest(table);
  }

  private static List<String> kinds(List<ParseNode> nodes) {
    List<String> kinds = new ArrayList<>();
    for (ParseNode node : nodes) {
      kinds.add(node.getKind());
    }
    return kinds;
  }

  private static List<Integer> ids(List<ParseNode> nodes) {
    List<Integer> ids = new ArrayList<>();
    for (ParseNode node : nodes) {
      ids.add(node.getId());
    }
    return ids;
  }

  @Test
  public void testRightNestedAssignmentChain() {
    List<ParseNode> roots = nest(ParseTableFixture.assignmentChain());
    assertThat(roots.get(0).getChildren()).hasSize(3);

    new OperatorFlattener().process(roots);

    ParseNode root = roots.get(0);
    assertThat(ids(root.getChildren())).containsExactly(2, 3, 5, 6, 8).inOrder();
    assertThat(kinds(root.getChildren()))
        .containsExactly(
            TokenKinds.EXPR,
            TokenKinds.LEFT_ASSIGN,
            TokenKinds.EXPR,
            TokenKinds.LEFT_ASSIGN,
            TokenKinds.EXPR)
        .inOrder();
    for (ParseNode child : root.getChildren()) {
      assertThat(child.getParentId()).isEqualTo(12);
    }
  }

  @Test
  public void testLeftNestedPipeChain() {
    List<ParseNode> roots = nest(ParseTableFixture.pipeChain());

    new OperatorFlattener().process(roots);

    ParseNode root = roots.get(0);
    assertThat(ids(root.getChildren())).containsExactly(2, 3, 5, 9, 11).inOrder();
    assertThat(kinds(root.getChildren()))
        .containsExactly(
            TokenKinds.EXPR,
            TokenKinds.SPECIAL_PIPE,
            TokenKinds.EXPR,
            TokenKinds.SPECIAL_PIPE,
            TokenKinds.EXPR)
        .inOrder();
    assertThat(ParseNodes.depth(roots)).isEqualTo(2);
  }

  @Test
  public void testLongLeftNestedChain() {
    // ((a + b) - c) * d
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(30, 0, 1, 1, 1, 13)
            .expr(20, 30, 1, 1, 1, 9)
            .expr(10, 20, 1, 1, 1, 5)
            .symbol(1, 10, 1, 1, "a")
            .terminal(3, 10, 1, 3, 1, 3, TokenKinds.PLUS, "+")
            .symbol(4, 10, 1, 5, "b")
            .terminal(6, 20, 1, 7, 1, 7, TokenKinds.MINUS, "-")
            .symbol(7, 20, 1, 9, "c")
            .terminal(9, 30, 1, 11, 1, 11, TokenKinds.TIMES, "*")
            .symbol(11, 30, 1, 13, "d")
            .build();
    List<ParseNode> roots = nest(table);

    new OperatorFlattener().process(roots);

    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 5, 6, 8, 9, 12).inOrder();
  }

  @Test
  public void testHigherPrecedenceOperandStaysNested() {
    // a + b * c
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(20, 0, 1, 1, 1, 5)
            .symbol(1, 20, 1, 1, "a")
            .terminal(3, 20, 1, 2, 1, 2, TokenKinds.PLUS, "+")
            .expr(10, 20, 1, 3, 1, 5)
            .symbol(4, 10, 1, 3, "b")
            .terminal(6, 10, 1, 4, 1, 4, TokenKinds.TIMES, "*")
            .symbol(7, 10, 1, 5, "c")
            .build();
    List<ParseNode> roots = nest(table);

    new OperatorFlattener().process(roots);

    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 10).inOrder();
    assertThat(ids(ParseTableFixture.find(table, 10).getChildren()))
        .containsExactly(5, 6, 8)
        .inOrder();
  }

  @Test
  public void testAssignmentAndPipeShareTheRightNestedFamily() {
    // a <- b %>% c
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(20, 0, 1, 1, 1, 12)
            .symbol(1, 20, 1, 1, "a")
            .terminal(3, 20, 1, 3, 1, 4, TokenKinds.LEFT_ASSIGN, "<-")
            .expr(10, 20, 1, 6, 1, 12)
            .symbol(4, 10, 1, 6, "b")
            .terminal(6, 10, 1, 8, 1, 10, TokenKinds.SPECIAL, "%>%")
            .symbol(7, 10, 1, 12, "c")
            .build();
    List<ParseNode> roots = nest(table);

    new OperatorFlattener().process(roots);

    assertThat(kinds(roots.get(0).getChildren()))
        .containsExactly(
            TokenKinds.EXPR,
            TokenKinds.LEFT_ASSIGN,
            TokenKinds.EXPR,
            TokenKinds.SPECIAL_PIPE,
            TokenKinds.EXPR)
        .inOrder();
  }

  @Test
  public void testUnaryOperatorIsNotFlattened() {
    // a - -b: the right operand starts with an operator, which makes it unary
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(20, 0, 1, 1, 1, 6)
            .symbol(1, 20, 1, 1, "a")
            .terminal(3, 20, 1, 3, 1, 3, TokenKinds.MINUS, "-")
            .expr(10, 20, 1, 5, 1, 6)
            .terminal(4, 10, 1, 5, 1, 5, TokenKinds.MINUS, "-")
            .symbol(5, 10, 1, 6, "b")
            .build();
    List<ParseNode> roots = nest(table);

    new OperatorFlattener().process(roots);

    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 10).inOrder();
  }

  @Test
  public void testCommentBetweenOperatorAndOperandIsSkipped() {
    // a <- # note
    //   b <- c
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(20, 0, 1, 1, 2, 8)
            .symbol(1, 20, 1, 1, "a")
            .terminal(3, 20, 1, 3, 1, 4, TokenKinds.LEFT_ASSIGN, "<-")
            .comment(4, 20, 1, 6, "# note")
            .expr(10, 20, 2, 3, 2, 8)
            .symbol(5, 10, 2, 3, "b")
            .terminal(7, 10, 2, 5, 2, 6, TokenKinds.LEFT_ASSIGN, "<-")
            .symbol(8, 10, 2, 8, "c")
            .build();
    List<ParseNode> roots = nest(table);

    new OperatorFlattener().process(roots);

    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 4, 6, 7, 9).inOrder();
  }

  @Test
  public void testNestedChainsInsideOperandsAreFlattenedFirst() {
    // f(a <- b <- c): the chain sits below the call
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(40, 0, 1, 1, 1, 13)
            .symbol(30, 40, 1, 1, "f")
            .terminal(32, 40, 1, 2, 1, 2, TokenKinds.LEFT_PAREN, "(")
            .terminal(33, 40, 1, 13, 1, 13, TokenKinds.RIGHT_PAREN, ")")
            .expr(12, 40, 1, 3, 1, 12)
            .symbol(1, 12, 1, 3, "a")
            .terminal(3, 12, 1, 5, 1, 6, TokenKinds.LEFT_ASSIGN, "<-")
            .expr(10, 12, 1, 8, 1, 12)
            .symbol(4, 10, 1, 8, "b")
            .terminal(6, 10, 1, 10, 1, 11, TokenKinds.LEFT_ASSIGN, "<-")
            .symbol(7, 10, 1, 12, "c")
            .build();
    List<ParseNode> roots = nest(table);

    new OperatorFlattener().process(roots);

    ParseNode call = roots.get(0);
    assertThat(ids(call.getChildren())).containsExactly(31, 32, 12, 33).inOrder();
    assertThat(ids(ParseTableFixture.find(table, 12).getChildren()))
        .containsExactly(2, 3, 5, 6, 8)
        .inOrder();
  }
}
