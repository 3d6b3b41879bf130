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

import java.util.Objects;

/**
 * Computes the cheapest weighted edit script (a <em>patch command</em>)
 * turning a word into its stem, and replays such scripts.
 *
 * <p>A patch command is a sequence of two-character tokens read from the end
 * of the word towards its start:
 * <ul>
 *   <li>{@code -N}: skip N unchanged characters</li>
 *   <li>{@code DN}: delete N characters</li>
 *   <li>{@code Ic}: insert character {@code c}</li>
 *   <li>{@code Rc}: replace the current character with {@code c}</li>
 * </ul>
 * Counts are encoded as {@code 'a' + N - 1}, so {@code a} is one, {@code z}
 * is 26; longer runs simply continue past {@code z}.
 *
 * <p>Instances keep their dynamic-programming tables between calls and are
 * not thread safe.
 */
public class Diff {

  /** Cost of a diagonal step between two different characters. */
  static final int MISMATCH = 100;

  private static final int D = 0; // diagonal, same character
  private static final int X = 1; // delete a word character
  private static final int Y = 2; // insert a stem character
  private static final int R = 3; // replace

  /** Largest run length a single count character can carry. */
  static final int MAX_COUNT = Character.MAX_VALUE - 'a' + 1;

  private final int insert;
  private final int delete;
  private final int replace;
  private final int noop;

  private int sizex = 0;
  private int sizey = 0;
  private int[][] net;
  private int[][] way;
  private int netCost = -1;

  /** Uses cost 1 for insert, delete and replace, and 0 for an unchanged character. */
  public Diff() {
    this(1, 1, 1, 0);
  }

  /**
   * @param insert cost of inserting a stem character
   * @param delete cost of deleting a word character
   * @param replace cost of replacing a character
   * @param noop cost of keeping an equal character
   */
  public Diff(int insert, int delete, int replace, int noop) {
    if (insert < 0 || delete < 0 || replace < 0 || noop < 0) {
      throw new IllegalArgumentException("costs must be >= 0, got insert=" + insert
          + " delete=" + delete + " replace=" + replace + " noop=" + noop);
    }
    this.insert = insert;
    this.delete = delete;
    this.replace = replace;
    this.noop = noop;
  }

  /**
   * Replays {@code diff} on {@code dest}, in place.
   *
   * <p>A script that points outside the buffer stops at the offending token
   * and leaves {@code dest} as far as it got; this is reported through the
   * return value rather than thrown, since damaged scripts in a dictionary
   * must only cost the affected word.
   *
   * @return true if every token was applied, false if the script was truncated
   */
  public static boolean apply(StringBuilder dest, CharSequence diff) {
    if (diff == null) {
      return true;
    }
    int pos = dest.length() - 1;
    for (int i = 0; i < diff.length() / 2; i++) {
      char cmd = diff.charAt(2 * i);
      char param = diff.charAt(2 * i + 1);
      int parNum = param - 'a' + 1;
      switch (cmd) {
        case '-':
          pos = pos - parNum + 1;
          break;
        case 'R':
          if (pos < 0 || pos >= dest.length()) {
            return false;
          }
          dest.setCharAt(pos, param);
          break;
        case 'D':
          int end = pos;
          pos -= parNum - 1;
          if (parNum < 1 || pos < 0 || pos >= dest.length()) {
            return false;
          }
          dest.delete(pos, Math.min(end + 1, dest.length()));
          break;
        case 'I':
          pos += 1;
          if (pos < 0 || pos > dest.length()) {
            return false;
          }
          dest.insert(pos, param);
          break;
        default:
          // unknown opcode: only moves the cursor, like every other token
          break;
      }
      pos--;
    }
    return true;
  }

  /**
   * Returns the patch command turning {@code a} into {@code b}.
   *
   * @throws IllegalArgumentException if a run of unchanged or deleted
   *         characters is too long to encode
   */
  public String exec(String a, String b) {
    Objects.requireNonNull(a, "word");
    Objects.requireNonNull(b, "stem");
    int maxx = a.length() + 1;
    int maxy = b.length() + 1;
    if (maxx >= sizex || maxy >= sizey) {
      sizex = Math.max(sizex, maxx + 8);
      sizey = Math.max(sizey, maxy + 8);
      net = new int[sizex][sizey];
      way = new int[sizex][sizey];
    }
    net[0][0] = 0;
    for (int x = 1; x < maxx; x++) {
      net[x][0] = x * delete;
      way[x][0] = X;
    }
    for (int y = 1; y < maxy; y++) {
      net[0][y] = y * insert;
      way[0][y] = Y;
    }

    int[] go = new int[4];
    for (int x = 1; x < maxx; x++) {
      for (int y = 1; y < maxy; y++) {
        go[X] = net[x - 1][y] + delete;
        go[Y] = net[x][y - 1] + insert;
        go[R] = net[x - 1][y - 1] + replace;
        go[D] = net[x - 1][y - 1] + ((a.charAt(x - 1) == b.charAt(y - 1)) ? noop : MISMATCH);
        // 比较顺序决定了等价脚本中选哪一个  不能调换
        int min = D;
        if (go[min] >= go[X]) {
          min = X;
        }
        if (go[min] > go[Y]) {
          min = Y;
        }
        if (go[min] > go[R]) {
          min = R;
        }
        way[x][y] = min;
        net[x][y] = go[min];
      }
    }
    netCost = net[maxx - 1][maxy - 1];

    // read the patch string, from the end of the word backwards
    StringBuilder result = new StringBuilder();
    int deletes = 0;
    int equals = 0;
    for (int x = maxx - 1, y = maxy - 1; x + y != 0;) {
      switch (way[x][y]) {
        case X:
          if (equals != 0) {
            result.append('-').append(count(equals));
            equals = 0;
          }
          deletes++;
          x--;
          break;
        case Y:
          if (deletes != 0) {
            result.append('D').append(count(deletes));
            deletes = 0;
          }
          if (equals != 0) {
            result.append('-').append(count(equals));
            equals = 0;
          }
          result.append('I');
          result.append(b.charAt(--y));
          break;
        case R:
          if (deletes != 0) {
            result.append('D').append(count(deletes));
            deletes = 0;
          }
          if (equals != 0) {
            result.append('-').append(count(equals));
            equals = 0;
          }
          result.append('R');
          result.append(b.charAt(--y));
          x--;
          break;
        case D:
          if (deletes != 0) {
            result.append('D').append(count(deletes));
            deletes = 0;
          }
          equals++;
          x--;
          y--;
          break;
        default:
          throw new AssertionError("unknown move " + way[x][y]);
      }
    }
    if (deletes != 0) {
      result.append('D').append(count(deletes));
    }
    return result.toString();
  }

  /**
   * Cost of the optimal alignment found by the last {@link #exec} call, or -1
   * if {@code exec} was never called.
   */
  public int getNetCost() {
    return netCost;
  }

  /** Sums the configured cost of every token of {@code script}. */
  public int cost(CharSequence script) {
    int total = 0;
    for (int i = 0; i + 1 < script.length(); i += 2) {
      int n = script.charAt(i + 1) - 'a' + 1;
      switch (script.charAt(i)) {
        case '-':
          total += n * noop;
          break;
        case 'D':
          total += n * delete;
          break;
        case 'I':
          total += insert;
          break;
        case 'R':
          total += replace;
          break;
        default:
          throw new IllegalArgumentException("unknown opcode '" + script.charAt(i) + "' in " + script);
      }
    }
    return total;
  }

  /** Encodes a run length as its count character. */
  static char count(int n) {
    if (n < 1 || n > MAX_COUNT) {
      throw new IllegalArgumentException("run length out of range: " + n);
    }
    return (char) ('a' + n - 1);
  }
}
