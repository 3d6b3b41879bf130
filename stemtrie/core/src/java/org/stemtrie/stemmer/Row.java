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

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * The outgoing transitions of one trie node, kept sorted by character.
 *
 * <p>{@link #uniformCnt} and {@link #uniformSkip} are side results of the
 * last {@link #uniformCmd(boolean)} call and are never persisted.
 */
public class Row {
  final TreeMap<Character,Cell> cells = new TreeMap<>();
  int uniformCnt = 0;
  int uniformSkip = 0;

  /** Creates an empty row. */
  public Row() {}

  /** Deep copy of {@code old}: cells are copied, not shared. */
  public Row(Row old) {
    for (Map.Entry<Character,Cell> e : old.cells.entrySet()) {
      cells.put(e.getKey(), new Cell(e.getValue()));
    }
  }

  /**
   * Reads a row written by {@link #store(DataOutput)}.
   *
   * @throws CorruptIndexException if the cell count is negative
   */
  public Row(DataInput in) throws IOException {
    int count = in.readInt();
    if (count < 0) {
      throw new CorruptIndexException("invalid cell count: " + count, in);
    }
    for (int i = 0; i < count; i++) {
      char ch = (char) in.readShort();
      Cell c = new Cell();
      c.cmd = in.readInt();
      c.cnt = in.readInt();
      c.ref = in.readInt();
      c.skip = in.readInt();
      if (c.cnt < 0 || c.skip < 0) {
        throw new CorruptIndexException("invalid cell for char " + (int) ch + ": " + c, in);
      }
      cells.put(ch, c);
    }
  }

  /** Returns the cell for {@code way}, or null. */
  Cell at(Character way) {
    return cells.get(way);
  }

  /** Sets the command of the {@code way} transition, creating the cell if needed. */
  public void setCmd(Character way, int cmd) {
    Cell c = at(way);
    if (c == null) {
      c = new Cell();
      cells.put(way, c);
    }
    c.cmd = cmd;
    c.cnt = (cmd >= 0) ? 1 : 0;
  }

  /** Sets the child row of the {@code way} transition, creating the cell if needed. */
  public void setRef(Character way, int ref) {
    Cell c = at(way);
    if (c == null) {
      c = new Cell();
      cells.put(way, c);
    }
    c.ref = ref;
  }

  /** Command index of the {@code way} transition, or -1. */
  public int getCmd(Character way) {
    Cell c = at(way);
    return (c == null) ? -1 : c.cmd;
  }

  /** Occurrence counter of the {@code way} transition, or -1 if absent. */
  public int getCnt(Character way) {
    Cell c = at(way);
    return (c == null) ? -1 : c.cnt;
  }

  /** Child row of the {@code way} transition, or -1. */
  public int getRef(Character way) {
    Cell c = at(way);
    return (c == null) ? -1 : c.ref;
  }

  /** Number of cells that carry a command or a child reference. */
  public int getCells() {
    int size = 0;
    for (Cell c : cells.values()) {
      if (c.isEmpty() == false) {
        size++;
      }
    }
    return size;
  }

  /** Number of cells with a child reference. */
  public int getCellsPnt() {
    int size = 0;
    for (Cell c : cells.values()) {
      if (c.ref >= 0) {
        size++;
      }
    }
    return size;
  }

  /** Number of cells with a command. */
  public int getCellsVal() {
    int size = 0;
    for (Cell c : cells.values()) {
      if (c.cmd >= 0) {
        size++;
      }
    }
    return size;
  }

  /**
   * Returns the command shared by every cell of this row, or -1 if the row is
   * not uniform. A row holding any child reference is never uniform. When
   * {@code eqSkip} is set the cells must also agree on their skip.
   *
   * <p>Also sets {@link #uniformCnt} (number of agreeing cells) and
   * {@link #uniformSkip}.
   */
  public int uniformCmd(boolean eqSkip) {
    int ret = -1;
    uniformCnt = 1;
    uniformSkip = 0;
    for (Cell c : cells.values()) {
      if (c.ref >= 0) {
        return -1;
      }
      if (c.cmd >= 0) {
        if (ret < 0) {
          ret = c.cmd;
          uniformSkip = c.skip;
        } else if (ret == c.cmd) {
          if (eqSkip && uniformSkip != c.skip) {
            return -1;
          }
          uniformCnt++;
        } else {
          return -1;
        }
      }
    }
    return ret;
  }

  /**
   * Writes the non-empty cells of this row, preceded by their count.
   */
  public void store(DataOutput out) throws IOException {
    out.writeInt(getCells());
    for (Map.Entry<Character,Cell> e : cells.entrySet()) {
      Cell c = e.getValue();
      if (c.isEmpty()) {
        continue;
      }
      out.writeShort((short) e.getKey().charValue());
      out.writeInt(c.cmd);
      out.writeInt(c.cnt);
      out.writeInt(c.ref);
      out.writeInt(c.skip);
    }
  }

  @Override
  public String toString() {
    return "Row(" + cells + ")";
  }
}
