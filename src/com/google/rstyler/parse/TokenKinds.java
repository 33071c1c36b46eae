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

import com.google.common.collect.ImmutableSet;

/**
 * Token kinds produced by the tokenizer, plus the refined kinds introduced while nesting. Terminal
 * kinds that are single characters are quoted the way the grammar names them (e.g. {@code "'+'"}).
 */
public final class TokenKinds {

  // Non-terminals
  public static final String EXPR = "expr";
  public static final String EQUAL_ASSIGN = "equal_assign";

  // Terminals
  public static final String COMMENT = "COMMENT";
  public static final String SYMBOL = "SYMBOL";
  public static final String NUM_CONST = "NUM_CONST";
  public static final String STR_CONST = "STR_CONST";
  public static final String EQ_ASSIGN = "EQ_ASSIGN";
  public static final String LEFT_ASSIGN = "LEFT_ASSIGN";
  public static final String PLUS = "'+'";
  public static final String MINUS = "'-'";
  public static final String TIMES = "'*'";
  public static final String DIVIDE = "'/'";
  public static final String POWER = "'^'";
  public static final String DOLLAR = "'$'";
  public static final String LEFT_PAREN = "'('";
  public static final String RIGHT_PAREN = "')'";

  /** The generic kind the grammar uses for every {@code %op%} operator. */
  public static final String SPECIAL = "SPECIAL";

  public static final String SPECIAL_PIPE = special("PIPE");
  public static final String SPECIAL_IN = special("IN");
  public static final String SPECIAL_OTHER = special("OTHER");

  public static final ImmutableSet<String> SPECIAL_KINDS =
      ImmutableSet.of(SPECIAL_PIPE, SPECIAL_IN, SPECIAL_OTHER);

  public static final ImmutableSet<String> MATH_KINDS =
      ImmutableSet.of(PLUS, MINUS, TIMES, DIVIDE, POWER);

  private static String special(String subKind) {
    return SPECIAL + "-" + subKind;
  }

  private TokenKinds() {}
}
