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
import com.google.rstyler.parse.TokenKinds;
import java.util.List;

/** Maps the generic {@code SPECIAL} kind to a kind that tells which special operator it is. */
final class SpecialOperatorMapper implements NestingPass {

  static final String PIPE_TEXT = "%>%";
  static final String IN_TEXT = "%in%";

  @Override
  public void process(List<ParseNode> table) {
    for (ParseNode node : table) {
      if (node.isKind(TokenKinds.SPECIAL)) {
        node.setKind(mapSpecial(node.getText()));
      }
    }
  }

  static String mapSpecial(String text) {
    switch (text) {
      case PIPE_TEXT:
        return TokenKinds.SPECIAL_PIPE;
      case IN_TEXT:
        return TokenKinds.SPECIAL_IN;
      default:
        return TokenKinds.SPECIAL_OTHER;
    }
  }
}
