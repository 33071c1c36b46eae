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
import java.util.List;

/**
 * A stage that rewrites a parse table in place. Flat stages receive the whole flat table; tree
 * stages receive the mutable list of top-level nodes of a nested table.
 */
public interface NestingPass {

  /**
   * Processes the table.
   *
   * @param nodes the flat table, or the top-level nodes of a nested table
   */
  void process(List<ParseNode> nodes);
}
