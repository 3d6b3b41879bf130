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

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces a transition into a row whose cells all end with the same command
 * by a leaf carrying that command, so lookups stop one row earlier.
 *
 * <p>With {@code changeSkip} the lifted cell remembers, as its skip, how many
 * characters the removed rows used to consume; {@link Trie#getFully} keeps
 * its answers for every stored key. Without it the skip is dropped and only
 * {@link Trie#getLastOnPath} keeps its answers.
 *
 * @lucene.experimental
 */
public class Lift extends Reduce {
  private final boolean changeSkip;

  /**
   * @param changeSkip whether lifted cells must carry the skip of the rows
   *        they replace
   */
  public Lift(boolean changeSkip) {
    this.changeSkip = changeSkip;
  }

  @Override
  public Trie optimize(Trie orig) {
    List<Row> rows = new ArrayList<>(orig.rows.size());
    for (Row row : orig.rows) {
      rows.add(new Row(row));
    }
    // children usually have higher indices than their parents, so they are lifted first
    for (int j = rows.size() - 1; j >= 0; j--) {
      liftUp(rows.get(j), rows);
    }
    return removeGaps(orig.forward, orig.root, rows, orig.cmds);
  }

  /** Lifts every child of {@code in} that is uniform. */
  public void liftUp(Row in, List<Row> nodes) {
    for (Cell c : in.cells.values()) {
      if (c.ref < 0) {
        continue;
      }
      Row to = nodes.get(c.ref);
      int sum = to.uniformCmd(changeSkip);
      if (sum < 0) {
        continue;
      }
      if (sum == c.cmd) {
        if (changeSkip) {
          // the key ending at this cell would need extra characters afterwards
          if (c.skip != to.uniformSkip + 1) {
            continue;
          }
          c.skip = to.uniformSkip + 1;
        } else {
          c.skip = 0;
        }
        c.cnt += to.uniformCnt;
        c.ref = -1;
      } else if (c.cmd < 0) {
        c.cnt = to.uniformCnt;
        c.cmd = sum;
        c.ref = -1;
        c.skip = changeSkip ? to.uniformSkip + 1 : 0;
      }
    }
  }
}
