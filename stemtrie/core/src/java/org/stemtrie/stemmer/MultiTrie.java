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
import java.util.Collections;
import java.util.List;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * A stack of {@link Trie}s ("layers") sharing the same keys. A command is cut
 * into chunks of {@link #getChunkWidth()} characters; chunk {@code i} goes to
 * layer {@code i} and an end marker goes to the layer after the last chunk.
 * Each layer then only has to agree on a small piece of the command, which
 * keeps the layers small once reduced.
 *
 * <p>Persisted form: forward flag, chunk width, layer count, then every layer
 * in the {@link Trie} format.
 *
 * @lucene.experimental
 */
public class MultiTrie extends BaseTrie {

  /** Marks the layer after the last chunk of a command. */
  static final char EOM = '\uffff';
  static final String EOM_NODE = String.valueOf(EOM);

  final List<Trie> tries;
  final int by;

  /** Creates an empty layered trie cutting commands into single characters. */
  public MultiTrie(boolean forward) {
    this(forward, 1);
  }

  /** Creates an empty layered trie cutting commands into {@code by}-character chunks. */
  public MultiTrie(boolean forward, int by) {
    super(forward);
    if (by < 1) {
      throw new IllegalArgumentException("chunk width must be >= 1, got " + by);
    }
    this.by = by;
    this.tries = new ArrayList<>();
  }

  /** Takes ownership of {@code tries}. */
  MultiTrie(boolean forward, int by, List<Trie> tries) {
    super(forward);
    this.by = by;
    this.tries = tries;
  }

  /**
   * Reads a layered trie written by {@link #store(DataOutput)}.
   *
   * @throws CorruptIndexException if the data does not describe a valid table
   */
  public MultiTrie(DataInput in) throws IOException {
    super(readBoolean(in));
    by = in.readInt();
    if (by < 1) {
      throw new CorruptIndexException("invalid chunk width: " + by, in);
    }
    int layers = readCount(in, "layer");
    tries = new ArrayList<>();
    for (int i = 0; i < layers; i++) {
      tries.add(new Trie(in));
    }
  }

  @Override
  public CharSequence getFully(CharSequence key) {
    StringBuilder result = new StringBuilder(tries.size() * by);
    for (Trie trie : tries) {
      CharSequence r = trie.getFully(key);
      if (r == null || isEom(r)) {
        break;
      }
      result.append(r);
    }
    return result.toString();
  }

  @Override
  public CharSequence getLastOnPath(CharSequence key) {
    StringBuilder result = new StringBuilder(tries.size() * by);
    for (Trie trie : tries) {
      CharSequence r = trie.getLastOnPath(key);
      if (r == null || isEom(r)) {
        break;
      }
      result.append(r);
    }
    return result.toString();
  }

  @Override
  public void add(CharSequence key, CharSequence cmd) {
    if (cmd == null || cmd.length() == 0) {
      return;
    }
    int levels = (cmd.length() + by - 1) / by;
    grow(levels);
    for (int i = 0; i < levels; i++) {
      int start = by * i;
      tries.get(i).add(key, cmd.subSequence(start, Math.min(start + by, cmd.length())));
    }
    tries.get(levels).add(key, EOM_NODE);
  }

  /** Makes sure layers {@code 0..levels} exist. */
  void grow(int levels) {
    while (levels >= tries.size()) {
      tries.add(new Trie(forward));
    }
  }

  @Override
  public MultiTrie reduce(Reduce by) {
    List<Trie> reduced = new ArrayList<>(tries.size());
    for (Trie trie : tries) {
      reduced.add(trie.reduce(by));
    }
    return newInstance(reduced);
  }

  /** Creates a layered trie of the same kind holding {@code layers}. */
  MultiTrie newInstance(List<Trie> layers) {
    return new MultiTrie(forward, by, layers);
  }

  @Override
  public void store(DataOutput out) throws IOException {
    writeBoolean(out, forward);
    out.writeInt(by);
    out.writeInt(tries.size());
    for (Trie trie : tries) {
      trie.store(out);
    }
  }

  /** Width of the command chunks stored per layer. */
  public int getChunkWidth() {
    return by;
  }

  /** Read-only view of the layers. */
  public List<Trie> getLayers() {
    return Collections.unmodifiableList(tries);
  }

  @Override
  public String getStatistics() {
    StringBuilder sb = new StringBuilder();
    sb.append("layers=").append(tries.size());
    for (int i = 0; i < tries.size(); i++) {
      sb.append(" [").append(i).append(": ").append(tries.get(i).getStatistics()).append(']');
    }
    return sb.toString();
  }

  static boolean isEom(CharSequence r) {
    return r.length() == 1 && r.charAt(0) == EOM;
  }
}
