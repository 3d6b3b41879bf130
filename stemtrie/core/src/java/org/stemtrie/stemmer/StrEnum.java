/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stemtrie.stemmer;

/**
 * Walks the characters of a key either head-to-tail (forward tries) or
 * tail-to-head (backward tries, the usual choice for suffix rules).
 */
final class StrEnum {
  private final CharSequence s;
  private int from;
  private final int by;

  StrEnum(CharSequence s, boolean forward) {
    this.s = s;
    if (forward) {
      from = 0;
      by = 1;
    } else {
      from = s.length() - 1;
      by = -1;
    }
  }

  int length() {
    return s.length();
  }

  char next() {
    char ch = s.charAt(from);
    from += by;
    return ch;
  }
}
