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
import com.google.rstyler.parse.SourcePosition;
import com.google.rstyler.parse.TokenKinds;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EqAssignRelocatorTest {

  private static List<ParseNode> relocate(List<ParseNode> table, int maxId) {
    List<ParseNode> roots = new ParseTableNester(new SortingErrorManager()).nest(table);
    new EqAssignRelocator(new NodeIdSupplier(maxId)).process(roots);
    return roots;
  }

  private static List<Integer> ids(List<ParseNode> nodes) {
    List<Integer> ids = new ArrayList<>();
    for (ParseNode node : nodes) {
      ids.add(node.getId());
    }
    return ids;
  }

  /** {@code a = 1} at column 1 of {@code line}, ids {@code base} to {@code base + 4}. */
  private static ParseTableFixture assignment(ParseTableFixture fixture, int base, int line) {
    return fixture
        .symbol(base, 0, line, 1, "a")
        .terminal(base + 2, 0, line, 3, line, 3, TokenKinds.EQ_ASSIGN, "=")
        .expr(base + 4, 0, line, 5, line, 5)
        .terminal(base + 3, base + 4, line, 5, line, 5, TokenKinds.NUM_CONST, "1");
  }

  @Test
  public void testTopLevelAssignmentIsWrapped() {
    List<ParseNode> table = assignment(new ParseTableFixture(), 1, 1).build();
    ParseNode lhs = ParseTableFixture.find(table, 2);

    List<ParseNode> roots = relocate(table, 5);

    assertThat(roots).hasSize(1);
    ParseNode wrapper = roots.get(0);
    assertThat(wrapper.getId()).isEqualTo(6);
    assertThat(wrapper.getParentId()).isEqualTo(ParseNode.NO_PARENT);
    assertThat(wrapper.getKind()).isEqualTo(TokenKinds.EXPR);
    assertThat(wrapper.isTerminal()).isFalse();
    assertThat(wrapper.getText()).isEmpty();
    assertThat(wrapper.getPosId()).isEqualTo(lhs.getPosId());
    assertThat(wrapper.getPosition()).isEqualTo(SourcePosition.create(1, 1, 1, 5));
    assertThat(ids(wrapper.getChildren())).containsExactly(2, 3, 5).inOrder();
    for (ParseNode child : wrapper.getChildren()) {
      assertThat(child.getParentId()).isEqualTo(6);
    }
  }

  @Test
  public void testEachStatementGetsItsOwnWrapper() {
    ParseTableFixture fixture = new ParseTableFixture();
    assignment(fixture, 1, 1);
    assignment(fixture, 6, 2);
    List<ParseNode> table = fixture.build();

    List<ParseNode> roots = relocate(table, 10);

    assertThat(ids(roots)).containsExactly(11, 12).inOrder();
    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 5).inOrder();
    assertThat(ids(roots.get(1).getChildren())).containsExactly(7, 8, 10).inOrder();
    assertThat(roots.get(1).getPosition()).isEqualTo(SourcePosition.create(2, 1, 2, 5));
  }

  @Test
  public void testChainedAssignmentIsWrappedAsAWhole() {
    // a = b = 1
    List<ParseNode> table =
        new ParseTableFixture()
            .symbol(1, 0, 1, 1, "a")
            .terminal(3, 0, 1, 3, 1, 3, TokenKinds.EQ_ASSIGN, "=")
            .symbol(4, 0, 1, 5, "b")
            .terminal(6, 0, 1, 7, 1, 7, TokenKinds.EQ_ASSIGN, "=")
            .expr(8, 0, 1, 9, 1, 9)
            .terminal(7, 8, 1, 9, 1, 9, TokenKinds.NUM_CONST, "1")
            .build();

    List<ParseNode> roots = relocate(table, 8);

    assertThat(roots).hasSize(1);
    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 5, 6, 8).inOrder();
  }

  @Test
  public void testAssignmentInsideBracesIsWrapped() {
    // { a = 1 }
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(10, 0, 1, 1, 1, 9)
            .terminal(1, 10, 1, 1, 1, 1, "'{'", "{")
            .symbol(2, 10, 1, 3, "a")
            .terminal(4, 10, 1, 5, 1, 5, TokenKinds.EQ_ASSIGN, "=")
            .expr(6, 10, 1, 7, 1, 7)
            .terminal(5, 6, 1, 7, 1, 7, TokenKinds.NUM_CONST, "1")
            .terminal(7, 10, 1, 9, 1, 9, "'}'", "}")
            .build();

    List<ParseNode> roots = relocate(table, 10);

    ParseNode braces = roots.get(0);
    assertThat(ids(braces.getChildren())).containsExactly(1, 11, 7).inOrder();
    ParseNode wrapper = braces.getChildren().get(1);
    assertThat(wrapper.getParentId()).isEqualTo(10);
    assertThat(ids(wrapper.getChildren())).containsExactly(3, 4, 6).inOrder();
  }

  @Test
  public void testAssignmentThatIsAlreadyAnExpressionIsNotWrappedAgain() {
    // expr(expr(a) = expr(1)), the shape of a <- 1
    List<ParseNode> table =
        new ParseTableFixture()
            .expr(10, 0, 1, 1, 1, 5)
            .symbol(1, 10, 1, 1, "a")
            .terminal(3, 10, 1, 3, 1, 3, TokenKinds.EQ_ASSIGN, "=")
            .expr(5, 10, 1, 5, 1, 5)
            .terminal(4, 5, 1, 5, 1, 5, TokenKinds.NUM_CONST, "1")
            .build();

    List<ParseNode> roots = relocate(table, 10);

    assertThat(ids(roots)).containsExactly(10);
    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 5).inOrder();
    assertThat(ParseNodes.depth(roots)).isEqualTo(2);
  }

  @Test
  public void testLeadingCommentStaysOutside() {
    // # c
    // a = 1
    ParseTableFixture fixture = new ParseTableFixture().comment(20, 0, 1, 1, "# c");
    List<ParseNode> table = assignment(fixture, 1, 2).build();

    List<ParseNode> roots = relocate(table, 20);

    assertThat(ids(roots)).containsExactly(20, 21).inOrder();
    assertThat(ids(roots.get(1).getChildren())).containsExactly(2, 3, 5).inOrder();
  }

  @Test
  public void testEqualAssignNodeIsLeftAlone() {
    List<ParseNode> table =
        new ParseTableFixture()
            .nonTerminal(10, 0, 1, 1, 1, 5, TokenKinds.EQUAL_ASSIGN)
            .symbol(1, 10, 1, 1, "a")
            .terminal(3, 10, 1, 3, 1, 3, TokenKinds.EQ_ASSIGN, "=")
            .expr(5, 10, 1, 5, 1, 5)
            .terminal(4, 5, 1, 5, 1, 5, TokenKinds.NUM_CONST, "1")
            .build();

    List<ParseNode> roots = relocate(table, 10);

    assertThat(ids(roots)).containsExactly(10);
    assertThat(ids(roots.get(0).getChildren())).containsExactly(2, 3, 5).inOrder();
  }

  @Test
  public void testHasEqAssign() {
    assertThat(EqAssignRelocator.hasEqAssign(assignment(new ParseTableFixture(), 1, 1).build()))
        .isTrue();
    assertThat(
            EqAssignRelocator.hasEqAssign(ParseTableFixture.assignmentChain()))
        .isFalse();
  }

  @Test
  public void testFindBlocks() {
    List<int[]> blocks = EqAssignRelocator.findBlocks(6, List.of(1, 4));

    assertThat(blocks).hasSize(2);
    assertThat(blocks.get(0)).asList().containsExactly(0, 2).inOrder();
    assertThat(blocks.get(1)).asList().containsExactly(3, 5).inOrder();
  }
}
