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

/**
 * Thrown when a parse table breaks the tokenizer contract, e.g. when a token refers to a parent
 * that does not exist. No nested table is produced for such an input.
 */
public class InvalidParseTableException extends RuntimeException {
  private final StylerError error;

  InvalidParseTableException(StylerError error) {
    super(error.description());
    this.error = error;
  }

  public StylerError getError() {
    return error;
  }
}
