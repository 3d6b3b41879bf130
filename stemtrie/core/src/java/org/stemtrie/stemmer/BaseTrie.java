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

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * A table mapping keys (words) to patch commands, either a single
 * {@link Trie} or a layered {@link MultiTrie}.
 *
 * <p>Tables are filled by a single writer through {@link #add}, shrunk with
 * {@link #reduce} and then only read.
 *
 * @lucene.experimental
 */
public abstract class BaseTrie {

  /** True if keys are consumed head-to-tail, false for tail-to-head. */
  protected final boolean forward;

  protected BaseTrie(boolean forward) {
    this.forward = forward;
  }

  /** True if keys are consumed from their first character on. */
  public boolean isForward() {
    return forward;
  }

  /**
   * Maps {@code key} to {@code cmd}, replacing any command stored for the
   * same key. Empty commands are ignored.
   */
  public abstract void add(CharSequence key, CharSequence cmd);

  /**
   * Returns the command stored for exactly {@code key}, or null if the key
   * does not resolve to one.
   */
  public abstract CharSequence getFully(CharSequence key);

  /**
   * Returns the command of the deepest transition on {@code key}'s path that
   * carries one, even if the path ends before the key does; null if none.
   */
  public abstract CharSequence getLastOnPath(CharSequence key);

  /** Returns a new, smaller table with the same answers; this table is not modified. */
  public abstract BaseTrie reduce(Reduce by);

  /** Writes this table. */
  public abstract void store(DataOutput out) throws IOException;

  /** One-line size summary, used when logging the reduction passes. */
  public abstract String getStatistics();

  static void writeBoolean(DataOutput out, boolean value) throws IOException {
    out.writeByte(value ? (byte) 1 : (byte) 0);
  }

  static boolean readBoolean(DataInput in) throws IOException {
    byte b = in.readByte();
    if (b == 0) {
      return false;
    } else if (b == 1) {
      return true;
    }
    throw new CorruptIndexException("invalid boolean byte: " + b, in);
  }

  /**
   * Writes a command char by char. Commands may hold unpaired surrogates
   * (an inserted supplementary character becomes two tokens), which a
   * UTF-8 string would not keep.
   */
  static void writeCommand(DataOutput out, String cmd) throws IOException {
    out.writeVInt(cmd.length());
    for (int i = 0; i < cmd.length(); i++) {
      out.writeShort((short) cmd.charAt(i));
    }
  }

  static String readCommand(DataInput in) throws IOException {
    int length = in.readVInt();
    if (length < 0) {
      throw new CorruptIndexException("invalid command length: " + length, in);
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < length; i++) {
      sb.append((char) in.readShort());
    }
    return sb.toString();
  }

  static int readCount(DataInput in, String what) throws IOException {
    int count = in.readInt();
    if (count < 0) {
      throw new CorruptIndexException("invalid " + what + " count: " + count, in);
    }
    return count;
  }
}
