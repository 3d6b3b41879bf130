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
import java.util.List;

import org.apache.lucene.store.DataInput;

/**
 * A {@link MultiTrie} that cuts commands at skip tokens instead of at a fixed
 * width: every {@code -N} token is a segment of its own and every maximal run
 * of other tokens is another, so a run of edits stays in one layer.
 *
 * <p>Once a layer's segment is known, the characters it consumes are removed
 * from the key before the next layer is asked, so later layers never look at
 * characters an earlier segment already accounted for.
 *
 * @lucene.experimental
 */
public class MultiTrie2 extends MultiTrie {

  /** Creates an empty table. */
  public MultiTrie2(boolean forward) {
    super(forward);
  }

  MultiTrie2(boolean forward, int by, List<Trie> tries) {
    super(forward, by, tries);
  }

  /** Reads a table written by {@link #store}. */
  public MultiTrie2(DataInput in) throws IOException {
    super(in);
  }

  @Override
  public CharSequence getFully(CharSequence key) {
    return lookup(key, true);
  }

  @Override
  public CharSequence getLastOnPath(CharSequence key) {
    return lookup(key, false);
  }

  private CharSequence lookup(CharSequence key, boolean fully) {
    StringBuilder result = new StringBuilder(tries.size() * 2);
    CharSequence lastKey = key;
    char lastOp = ' ';
    for (Trie trie : tries) {
      CharSequence r = fully ? trie.getFully(lastKey) : trie.getLastOnPath(lastKey);
      if (r == null || isEom(r) || r.length() < 2) {
        break;
      }
      if (cannotFollow(lastOp, r.charAt(0))) {
        // the layers disagree about this key; keep what was consistent so far
        break;
      }
      lastOp = r.charAt(r.length() - 2);
      result.append(r);
      key = skip(key, lengthPattern(r));
      if (key.length() != 0) {
        lastKey = key;
      }
    }
    return result.toString();
  }

  /**
   * @throws IllegalArgumentException if {@code cmd} is not a sequence of
   *         two-character tokens, or if two of its segments may not follow
   *         each other
   */
  @Override
  public void add(CharSequence key, CharSequence cmd) {
    if (cmd == null || cmd.length() == 0) {
      return;
    }
    CharSequence[] p = decompose(cmd);
    for (int i = 1; i < p.length; i++) {
      CharSequence prev = p[i - 1];
      if (cannotFollow(prev.charAt(prev.length() - 2), p[i].charAt(0))) {
        throw new IllegalArgumentException("segment \"" + p[i] + "\" cannot follow \"" + prev
            + "\" in command \"" + cmd + "\"");
      }
    }
    int levels = p.length;
    grow(levels);
    CharSequence lastKey = key;
    for (int i = 0; i < levels; i++) {
      if (key.length() > 0) {
        tries.get(i).add(key, p[i]);
        lastKey = key;
      } else {
        tries.get(i).add(lastKey, p[i]);
      }
      key = skip(key, lengthPattern(p[i]));
    }
    tries.get(levels).add(key.length() > 0 ? key : lastKey, EOM_NODE);
  }

  /**
   * Cuts {@code cmd} into segments: each {@code -N} token alone, and each
   * maximal run of other tokens.
   *
   * @throws IllegalArgumentException if {@code cmd} has an odd length
   */
  public static CharSequence[] decompose(CharSequence cmd) {
    if (cmd.length() % 2 != 0) {
      throw new IllegalArgumentException("malformed command \"" + cmd + "\": odd length");
    }
    List<CharSequence> parts = new ArrayList<>();
    for (int i = 0; i < cmd.length();) {
      if (cmd.charAt(i) == '-') {
        parts.add(cmd.subSequence(i, i + 2));
        i += 2;
      } else {
        int next = dashEven(cmd, i);
        int end = (next < 0) ? cmd.length() : next;
        parts.add(cmd.subSequence(i, end));
        i = end;
      }
    }
    return parts.toArray(new CharSequence[0]);
  }

  @Override
  MultiTrie newInstance(List<Trie> layers) {
    return new MultiTrie2(forward, by, layers);
  }

  /** Two skips, or two deletes, in a row mean the segments were cut wrongly. */
  static boolean cannotFollow(char after, char goes) {
    switch (after) {
      case '-':
      case 'D':
        return after == goes;
      default:
        return false;
    }
  }

  /** Drops {@code count} characters from the end of the key that is consumed first. */
  private CharSequence skip(CharSequence in, int count) {
    if (count <= 0) {
      return in;
    }
    if (count >= in.length()) {
      return "";
    }
    if (forward) {
      return in.subSequence(count, in.length());
    } else {
      return in.subSequence(0, in.length() - count);
    }
  }

  /** First dash token at or after {@code from}, stepping token by token; -1 if none. */
  private static int dashEven(CharSequence in, int from) {
    while (from < in.length()) {
      if (in.charAt(from) == '-') {
        return from;
      }
      from += 2;
    }
    return -1;
  }

  /** Number of key characters a segment accounts for. */
  static int lengthPattern(CharSequence cmd) {
    int len = 0;
    for (int i = 0; i + 1 < cmd.length(); i += 2) {
      switch (cmd.charAt(i)) {
        case '-':
        case 'D':
          len += cmd.charAt(i + 1) - 'a' + 1;
          break;
        case 'R':
        case 'I':
          len++;
          break;
        default:
          break;
      }
    }
    return len;
  }
}
