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
import java.util.List;
import java.util.Map;

/**
 * A pass turning a {@link Trie} into a smaller one that answers the same
 * lookups. Passes never modify the trie they are given.
 *
 * <p>Every pass finishes with {@link #removeGaps}: rows reachable from the
 * root are renumbered densely, in depth-first order, and the others are
 * dropped.
 *
 * @lucene.experimental
 */
public abstract class Reduce {

  /** Sole constructor. (For invocation by subclass constructors.) */
  protected Reduce() {}

  /** Returns the reduced copy of {@code orig}. */
  public abstract Trie optimize(Trie orig);

  /**
   * Builds a new trie out of the rows reachable from {@code root}. The rows
   * and the pool are copied, so the result shares nothing with the arguments.
   */
  protected static Trie removeGaps(boolean forward, int root, List<Row> rows, CommandPool cmds) {
    int[] remap = new int[rows.size()];
    Arrays.fill(remap, -1);
    List<Row> visited = new ArrayList<>();
    visit(root, rows, visited, remap);
    List<Row> compact = new ArrayList<>(visited.size());
    for (Row row : visited) {
      compact.add(remap(row, remap));
    }
    return new Trie(forward, remap[root], cmds.copy(), compact);
  }

  // 深度优先  按访问顺序重新编号
  private static void visit(int ind, List<Row> old, List<Row> to, int[] remap) {
    remap[ind] = to.size();
    Row now = old.get(ind);
    to.add(now);
    for (Cell c : now.cells.values()) {
      if (c.ref >= 0 && remap[c.ref] < 0) {
        visit(c.ref, old, to, remap);
      }
    }
  }

  /** Copies {@code old}, translating every child reference through {@code remap}. */
  static Row remap(Row old, int[] remap) {
    Row row = new Row();
    for (Map.Entry<Character,Cell> e : old.cells.entrySet()) {
      Cell nc = new Cell(e.getValue());
      if (nc.ref >= 0) {
        nc.ref = remap[nc.ref];
      }
      row.cells.put(e.getKey(), nc);
    }
    return row;
  }
}
