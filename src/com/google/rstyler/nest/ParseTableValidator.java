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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a flat table honors the tokenizer contract before it is nested: ids and pos ids are
 * unique, pos ids follow the source order, and every parent reference names a non-terminal of the
 * same table. A violation is reported as an error and aborts nesting.
 */
final class ParseTableValidator {

  private final ErrorHandler errorHandler;

  ParseTableValidator(ErrorHandler errorHandler) {
    this.errorHandler = errorHandler;
  }

  void validate(List<ParseNode> table) {
    Map<Integer, ParseNode> byId = new HashMap<>();
    for (ParseNode node : table) {
      if (byId.put(node.getId(), node) != null) {
        fail(node, ParseTableErrors.DUPLICATE_ID, String.valueOf(node.getId()));
      }
    }
    validatePositions(table);
    for (ParseNode node : table) {
      if (node.isTopLevel()) {
        continue;
      }
      ParseNode parent = byId.get(node.getParentId());
      if (parent == null) {
        fail(
            node,
            ParseTableErrors.DANGLING_PARENT,
            String.valueOf(node.getId()),
            String.valueOf(node.getParentId()));
      } else if (parent.isTerminal()) {
        fail(
            node,
            ParseTableErrors.TERMINAL_PARENT,
            String.valueOf(node.getId()),
            String.valueOf(parent.getId()));
      }
    }
  }

  private void validatePositions(List<ParseNode> table) {
    List<ParseNode> ordered = new ArrayList<>(table);
    ParseNodes.sortByPosId(ordered);
    for (int i = 1; i < ordered.size(); i++) {
      ParseNode previous = ordered.get(i - 1);
      ParseNode current = ordered.get(i);
      if (previous.getPosId() == current.getPosId()) {
        fail(
            current,
            ParseTableErrors.DUPLICATE_POS_ID,
            String.valueOf(previous.getId()),
            String.valueOf(current.getId()),
            String.valueOf(current.getPosId()));
      }
      if (previous.getPosition().compareTo(current.getPosition()) > 0) {
        fail(
            current,
            ParseTableErrors.POSITION_ORDER,
            String.valueOf(previous.getId()),
            previous.getPosition().toString(),
            String.valueOf(current.getId()),
            current.getPosition().toString());
      }
    }
  }

  private void fail(ParseNode node, DiagnosticType type, String... arguments) {
    StylerError error = StylerError.make(node, type, arguments);
    errorHandler.report(CheckLevel.ERROR, error);
    throw new InvalidParseTableException(error);
  }
}
