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
import com.google.rstyler.parse.ParseNode;
import com.google.rstyler.parse.ParseNodes;
import java.util.List;

/**
 * Adds the kind of the previous and the next terminal to every terminal of a flat table. Only
 * terminals take part in the neighbor chain; non-terminals are left without context.
 */
final class TerminalContextAnnotator implements NestingPass {

  private static final String NO_TOKEN = "";

  @Override
  public void process(List<ParseNode> table) {
    addTerminalTokenBefore(table);
    addTerminalTokenAfter(table);
  }

  static void addTerminalTokenBefore(List<ParseNode> table) {
    ImmutableList<ParseNode> terminals = ParseNodes.terminals(table);
    for (int i = 0; i < terminals.size(); i++) {
      terminals.get(i).setTokenBefore(i == 0 ? NO_TOKEN : terminals.get(i - 1).getKind());
    }
  }

  static void addTerminalTokenAfter(List<ParseNode> table) {
    ImmutableList<ParseNode> terminals = ParseNodes.terminals(table);
    int last = terminals.size() - 1;
    for (int i = 0; i <= last; i++) {
      terminals.get(i).setTokenAfter(i == last ? NO_TOKEN : terminals.get(i + 1).getKind());
    }
  }

  /**
   * Clears the context of every token. Used once tokens were added to a table, which invalidates
   * the neighbor information.
   */
  static void removeTerminalContext(List<ParseNode> table) {
    for (ParseNode node : table) {
      node.setTokenBefore(null);
      node.setTokenAfter(null);
    }
  }
}
