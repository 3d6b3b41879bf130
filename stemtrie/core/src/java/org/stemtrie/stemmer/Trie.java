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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * A trie of character transitions whose cells point at patch commands.
 *
 * <p>Rows live in one list and refer to each other by index; row
 * {@link #root} is the entry point. Commands are interned in a
 * {@link CommandPool} owned by this trie.
 *
 * <p>Persisted form: forward flag, root, the commands (each as a char count
 * followed by its UTF-16 units), then the rows (see {@link Row#store}).
 *
 * @lucene.experimental
 */
public class Trie extends BaseTrie {

  final List<Row> rows;
  final CommandPool cmds;
  final int root;

  /** Creates an empty trie with a single root row. */
  public Trie(boolean forward) {
    super(forward);
    rows = new ArrayList<>();
    rows.add(new Row());
    cmds = new CommandPool();
    root = 0;
  }

  /** Takes ownership of {@code rows} and {@code cmds}. */
  Trie(boolean forward, int root, CommandPool cmds, List<Row> rows) {
    super(forward);
    this.root = root;
    this.cmds = cmds;
    this.rows = rows;
  }

  /**
   * Reads a trie written by {@link #store(DataOutput)}.
   *
   * @throws CorruptIndexException if the data does not describe a valid trie
   * @throws java.io.EOFException if the data ends early
   */
  public Trie(DataInput in) throws IOException {
    super(readBoolean(in));
    root = in.readInt();
    int numCmds = readCount(in, "command");
    cmds = new CommandPool();
    for (int i = 0; i < numCmds; i++) {
      String cmd = readCommand(in);
      if (cmds.add(cmd) != i) {
        throw new CorruptIndexException("duplicate command \"" + cmd + "\"", in);
      }
    }
    int numRows = readCount(in, "row");
    // 行数来自文件  不可信  不预分配
    rows = new ArrayList<>();
    for (int i = 0; i < numRows; i++) {
      rows.add(new Row(in));
    }
    if (root < 0 || root >= numRows) {
      throw new CorruptIndexException("root " + root + " out of bounds (rows=" + numRows + ")", in);
    }
    for (int i = 0; i < numRows; i++) {
      for (Cell c : rows.get(i).cells.values()) {
        if (c.ref < -1 || c.ref >= numRows || c.cmd < -1 || c.cmd >= numCmds) {
          throw new CorruptIndexException("row " + i + " has invalid cell " + c, in);
        }
      }
    }
  }

  @Override
  public void add(CharSequence key, CharSequence cmd) {
    if (key == null || cmd == null || cmd.length() == 0) {
      return;
    }
    if (key.length() == 0) {
      throw new IllegalArgumentException("key must not be empty");
    }
    int idCmd = cmds.add(cmd);

    Row r = getRow(root);
    StrEnum e = new StrEnum(key, forward);
    for (int i = 0; i < e.length() - 1; i++) {
      Character ch = e.next();
      int node = r.getRef(ch);
      if (node >= 0) {
        r = getRow(node);
      } else {
        node = rows.size();
        Row n = new Row();
        rows.add(n);
        r.setRef(ch, node);
        r = n;
      }
    }
    r.setCmd(e.next(), idCmd);
  }

  @Override
  public CharSequence getFully(CharSequence key) {
    Row now = getRow(root);
    int cmd = -1;
    StrEnum e = new StrEnum(key, forward);
    for (int i = 0; i < key.length();) {
      Character ch = e.next();
      i++;
      Cell c = now.at(ch);
      if (c == null) {
        return null;
      }
      cmd = c.cmd;
      // skip 个字符不再分支  直接吞掉
      for (int skip = c.skip; skip > 0; skip--) {
        if (i < key.length()) {
          e.next();
        } else {
          return null;
        }
        i++;
      }
      if (c.ref >= 0) {
        now = getRow(c.ref);
      } else if (i < key.length()) {
        return null;
      }
    }
    return (cmd == -1) ? null : cmds.get(cmd);
  }

  @Override
  public CharSequence getLastOnPath(CharSequence key) {
    if (key.length() == 0) {
      return null;
    }
    Row now = getRow(root);
    CharSequence last = null;
    StrEnum e = new StrEnum(key, forward);
    for (int i = 0; i < key.length() - 1; i++) {
      Character ch = e.next();
      int w = now.getCmd(ch);
      if (w >= 0) {
        last = cmds.get(w);
      }
      w = now.getRef(ch);
      if (w >= 0) {
        now = getRow(w);
      } else {
        return last;
      }
    }
    int w = now.getCmd(e.next());
    return (w >= 0) ? cmds.get(w) : last;
  }

  /**
   * Returns every distinct command met on {@code key}'s path, in the order
   * they were met, or null if there are none. Skips are honored as in
   * {@link #getFully}; a dead end stops the walk but keeps what was found.
   */
  public String[] getAll(CharSequence key) {
    Set<String> found = new LinkedHashSet<>();
    Row now = getRow(root);
    StrEnum e = new StrEnum(key, forward);
    walk:
    for (int i = 0; i < key.length();) {
      Character ch = e.next();
      i++;
      Cell c = now.at(ch);
      if (c == null) {
        break;
      }
      if (c.cmd >= 0) {
        found.add(cmds.get(c.cmd));
      }
      for (int skip = c.skip; skip > 0; skip--) {
        if (i >= key.length()) {
          break walk;
        }
        e.next();
        i++;
      }
      if (c.ref < 0) {
        break;
      }
      now = getRow(c.ref);
    }
    return found.isEmpty() ? null : found.toArray(new String[0]);
  }

  @Override
  public Trie reduce(Reduce by) {
    return by.optimize(this);
  }

  @Override
  public void store(DataOutput out) throws IOException {
    writeBoolean(out, forward);
    out.writeInt(root);
    out.writeInt(cmds.size());
    for (int i = 0; i < cmds.size(); i++) {
      writeCommand(out, cmds.get(i));
    }
    out.writeInt(rows.size());
    for (Row row : rows) {
      row.store(out);
    }
  }

  /** Index of the entry row. */
  public int getRoot() {
    return root;
  }

  /** Number of rows, reachable or not. */
  public int getRowCount() {
    return rows.size();
  }

  /** Number of distinct pooled commands. */
  public int getCommandCount() {
    return cmds.size();
  }

  /** Number of non-empty cells over all rows. */
  public int getCells() {
    int size = 0;
    for (Row row : rows) {
      size += row.getCells();
    }
    return size;
  }

  /** Number of cells with a child reference over all rows. */
  public int getCellsPnt() {
    int size = 0;
    for (Row row : rows) {
      size += row.getCellsPnt();
    }
    return size;
  }

  /** Number of cells with a command over all rows. */
  public int getCellsVal() {
    int size = 0;
    for (Row row : rows) {
      size += row.getCellsVal();
    }
    return size;
  }

  @Override
  public String getStatistics() {
    return String.format(Locale.ROOT, "nodes=%d cells=%d pointers=%d values=%d commands=%d",
        getRowCount(), getCells(), getCellsPnt(), getCellsVal(), getCommandCount());
  }

  private Row getRow(int index) {
    return rows.get(index);
  }

  @Override
  public String toString() {
    return "Trie(forward=" + forward + " root=" + root + " " + getStatistics() + ")";
  }
}
