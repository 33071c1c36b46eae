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

/** Diagnostics reported while validating and nesting a parse table. */
public final class ParseTableErrors {

  private ParseTableErrors() {}

  static final DiagnosticType DANGLING_PARENT =
      DiagnosticType.error(
          "RSTYLER_DANGLING_PARENT",
          "Token {0} refers to parent {1}, which is not in the parse table.");

  static final DiagnosticType DUPLICATE_ID =
      DiagnosticType.error("RSTYLER_DUPLICATE_ID", "Token id {0} occurs more than once.");

  static final DiagnosticType DUPLICATE_POS_ID =
      DiagnosticType.error(
          "RSTYLER_DUPLICATE_POS_ID", "Tokens {0} and {1} share the position id {2}.");

  static final DiagnosticType POSITION_ORDER =
      DiagnosticType.error(
          "RSTYLER_POSITION_ORDER",
          "Token {0} at {1} is numbered before token {2} at {3}, which precedes it in the source.");

  static final DiagnosticType TERMINAL_PARENT =
      DiagnosticType.error(
          "RSTYLER_TERMINAL_PARENT", "Token {0} refers to the terminal {1} as its parent.");

  static final DiagnosticType PARENT_CYCLE =
      DiagnosticType.error(
          "RSTYLER_PARENT_CYCLE", "Token {0} is part of a parent cycle and has no root.");

  public static final DiagnosticType INVALID_IGNORE_SEQUENCE =
      DiagnosticType.warning(
          "RSTYLER_INVALID_IGNORE_SEQUENCE",
          "Invalid ignore sequence: {0} marker \"{1}\" without a matching {2} marker."
              + " The markers of this sequence are not honored.");
}
