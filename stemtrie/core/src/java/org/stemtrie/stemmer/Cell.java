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
 * One transition of a {@link Row}: the command reached by taking it, the row
 * it continues into, how many insertions landed on it and how many extra key
 * characters it swallows.
 */
final class Cell {
  /** Index of the child row, or -1 for a leaf. */
  int ref = -1;
  /** Index into the owning trie's {@link CommandPool}, or -1 if none. */
  int cmd = -1;
  /** Occurrence counter, summed when cells are merged. */
  int cnt = 0;
  /** Key characters consumed after this cell without further branching. */
  int skip = 0;

  Cell() {}

  Cell(Cell other) {
    this.ref = other.ref;
    this.cmd = other.cmd;
    this.cnt = other.cnt;
    this.skip = other.skip;
  }

  boolean isEmpty() {
    return cmd < 0 && ref < 0;
  }

  @Override
  public String toString() {
    return "ref(" + ref + ")cmd(" + cmd + ")cnt(" + cnt + ")skp(" + skip + ")";
  }
}
