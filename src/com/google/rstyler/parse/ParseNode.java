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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A single row of a parse table. Created by the tokenizer with its parent link, position, kind and
 * text, then annotated in place by the nesting stages. Once the table is nested, non-terminals hold
 * their children ordered by {@link #getPosId()}.
 */
public final class ParseNode {

  /** Parent ids at or below this value mark a top-level token. */
  public static final int NO_PARENT = 0;

  private final int id;
  private int parentId;
  private int posId;
  private final SourcePosition position;
  private String kind;
  private final String text;
  private final boolean terminal;

  private @Nullable String tokenBefore;
  private @Nullable String tokenAfter;
  private boolean ignored;

  // null until the node has been given at least one child
  private @Nullable List<ParseNode> children;

  public ParseNode(
      int id, int parentId, SourcePosition position, String kind, String text, boolean terminal) {
    this.id = id;
    this.parentId = parentId;
    this.position = checkNotNull(position);
    this.kind = checkNotNull(kind);
    this.text = checkNotNull(text);
    this.terminal = terminal;
  }

  /** Creates a non-terminal with no text, used for nodes synthesized after tokenizing. */
  public static ParseNode newNonTerminal(int id, int parentId, SourcePosition position, String kind) {
    return new ParseNode(id, parentId, position, kind, "", false);
  }

  public int getId() {
    return id;
  }

  public int getParentId() {
    return parentId;
  }

  public void setParentId(int parentId) {
    this.parentId = parentId;
  }

  public boolean isTopLevel() {
    return parentId <= NO_PARENT;
  }

  public int getPosId() {
    return posId;
  }

  public void setPosId(int posId) {
    this.posId = posId;
  }

  public SourcePosition getPosition() {
    return position;
  }

  public int getStartLine() {
    return position.getStartLine();
  }

  public int getEndLine() {
    return position.getEndLine();
  }

  public String getKind() {
    return kind;
  }

  public void setKind(String kind) {
    this.kind = checkNotNull(kind);
  }

  public boolean isKind(String kind) {
    return this.kind.equals(kind);
  }

  public boolean isComment() {
    return isKind(TokenKinds.COMMENT);
  }

  public String getText() {
    return text;
  }

  public boolean isTerminal() {
    return terminal;
  }

  /** The kind of the previous terminal in source order, {@code ""} for the first terminal. */
  public @Nullable String getTokenBefore() {
    return tokenBefore;
  }

  /** The kind of the next terminal in source order, {@code ""} for the last terminal. */
  public @Nullable String getTokenAfter() {
    return tokenAfter;
  }

  public void setTokenBefore(@Nullable String tokenBefore) {
    checkState(terminal || tokenBefore == null, "Not a terminal: %s", this);
    this.tokenBefore = tokenBefore;
  }

  public void setTokenAfter(@Nullable String tokenAfter) {
    checkState(terminal || tokenAfter == null, "Not a terminal: %s", this);
    this.tokenAfter = tokenAfter;
  }

  public boolean isIgnored() {
    return ignored;
  }

  public void setIgnored(boolean ignored) {
    this.ignored = ignored;
  }

  public boolean hasChildren() {
    return children != null;
  }

  public ImmutableList<ParseNode> getChildren() {
    return children == null ? ImmutableList.of() : ImmutableList.copyOf(children);
  }

  /**
   * Replaces the children of this node. An empty list clears them, so that a node without children
   * is never confused with one whose children are an empty table.
   */
  public void setChildren(@Nullable List<ParseNode> children) {
    if (children == null || children.isEmpty()) {
      this.children = null;
      return;
    }
    checkState(!terminal, "Terminal %s cannot hold children", this);
    this.children = new ArrayList<>(children);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind).append(" #").append(id).append(" <- ").append(parentId);
    sb.append(" [").append(position).append("]");
    if (!text.isEmpty()) {
      sb.append(" '").append(text).append("'");
    }
    if (ignored) {
      sb.append(" (ignored)");
    }
    return sb.toString();
  }
}
