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

import java.text.MessageFormat;

/** Formatting helpers shared by the diagnostics classes. */
final class Platform {

  static String formatMessage(String message, String... arguments) {
    // MessageFormat drops single quotes; message patterns double them where they are wanted.
    return MessageFormat.format(message, (Object[]) arguments);
  }

  private Platform() {}
}
