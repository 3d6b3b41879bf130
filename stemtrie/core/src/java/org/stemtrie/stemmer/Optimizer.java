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
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * Merges rows that do not contradict each other. Rows are taken from the
 * highest index down and each is merged into the first already accepted row
 * it is compatible with (first fit), or accepted as a new row.
 *
 * <p>Two rows are compatible when, for every character they share, the
 * cells have the same skip and do not disagree on their command or on their
 * child (an absent value agrees with anything).
 *
 * @lucene.experimental
 */
public class Optimizer extends Reduce {

  /** Sole constructor. */
  public Optimizer() {}

  @Override
  public Trie optimize(Trie orig) {
    List<Row> orows = orig.rows;
    List<Row> rows = new ArrayList<>();
    int[] remap = new int[orows.size()];
    Arrays.fill(remap, -1);
    // rows still pointing at unprocessed input rows: never merged, fixed up at the end
    BitSet pending = new BitSet();

    for (int j = orows.size() - 1; j >= 0; j--) {
      Row old = orows.get(j);
      if (refersAhead(old, remap)) {
        remap[j] = rows.size();
        pending.set(rows.size());
        rows.add(new Row(old));
        continue;
      }
      Row now = remap(old, remap);
      boolean merged = false;
      for (int i = 0; i < rows.size(); i++) {
        if (pending.get(i)) {
          continue;
        }
        Row q = merge(now, rows.get(i));
        if (q != null) {
          rows.set(i, q);
          merged = true;
          remap[j] = i;
          break;
        }
      }
      if (merged == false) {
        remap[j] = rows.size();
        rows.add(now);
      }
    }
    for (int i = pending.nextSetBit(0); i >= 0; i = pending.nextSetBit(i + 1)) {
      rows.set(i, remap(rows.get(i), remap));
    }

    return removeGaps(orig.forward, remap[orig.root], rows, orig.cmds);
  }

  private static boolean refersAhead(Row row, int[] remap) {
    for (Cell c : row.cells.values()) {
      if (c.ref >= 0 && remap[c.ref] < 0) {
        return true;
      }
    }
    return false;
  }

  /**
   * Merges two rows.
   *
   * @return the merged row, or null if the rows are not compatible
   */
  public Row merge(Row master, Row existing) {
    Row n = new Row();
    for (Map.Entry<Character,Cell> e : master.cells.entrySet()) {
      Cell a = e.getValue();
      Cell b = existing.at(e.getKey());
      Cell s = (b == null) ? new Cell(a) : merge(a, b);
      if (s == null) {
        return null;
      }
      n.cells.put(e.getKey(), s);
    }
    for (Map.Entry<Character,Cell> e : existing.cells.entrySet()) {
      if (master.at(e.getKey()) == null) {
        n.cells.put(e.getKey(), new Cell(e.getValue()));
      }
    }
    return n;
  }

  /**
   * Merges two cells.
   *
   * @return the merged cell, or null if the cells are not compatible
   */
  Cell merge(Cell m, Cell e) {
    if (m.skip != e.skip) {
      return null;
    }
    Cell n = new Cell();
    if (m.cmd >= 0) {
      if (e.cmd >= 0 && m.cmd != e.cmd) {
        return null;
      }
      n.cmd = m.cmd;
    } else {
      n.cmd = e.cmd;
    }
    if (m.ref >= 0) {
      if (e.ref >= 0 && m.ref != e.ref) {
        return null;
      }
      n.ref = m.ref;
    } else {
      n.ref = e.ref;
    }
    n.cnt = m.cnt + e.cnt;
    n.skip = m.skip;
    return n;
  }
}
