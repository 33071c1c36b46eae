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

import static java.util.Objects.requireNonNull;

import com.google.rstyler.parse.ParseNode;
import java.io.Serializable;

/**
 * Diagnostic raised while nesting a parse table. Every diagnostic points at the token that caused
 * it.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param tokenId Id of the offending token.
 * @param lineno One-indexed line on which the offending token starts.
 * @param charno One-indexed column at which the offending token starts.
 * @param defaultLevel The level of the diagnostic type.
 */
public record StylerError(
    DiagnosticType type,
    String description,
    int tokenId,
    int lineno,
    int charno,
    CheckLevel defaultLevel)
    implements Serializable {
  public StylerError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a StylerError located at a token.
   *
   * @param node Determines the token id, line and column
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static StylerError make(ParseNode node, DiagnosticType type, String... arguments) {
    return new StylerError(
        type,
        type.format(arguments),
        node.getId(),
        node.getStartLine(),
        node.getPosition().getStartColumn(),
        type.level);
  }

  /** Formats this error as {@code "line:col: LEVEL - [KEY] description"}. */
  public String format(CheckLevel level) {
    return lineno + ":" + charno + ": " + level + " - [" + type.key + "] " + description;
  }

  @Override
  public String toString() {
    return type.key + " at token " + tokenId + " (" + lineno + ":" + charno + "): " + description;
  }
}
