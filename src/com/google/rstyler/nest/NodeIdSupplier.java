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
 * Generates ids for nodes synthesized after tokenizing. Ids start above the largest id of the input
 * table so they never collide with tokenizer ids.
 */
final class NodeIdSupplier {
  private int next;

  NodeIdSupplier(int maxExistingId) {
    this.next = maxExistingId + 1;
  }

  int getUniqueId() {
    return next++;
  }
}
