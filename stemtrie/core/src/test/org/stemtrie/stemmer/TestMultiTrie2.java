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
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.LuceneTestCase;
import org.apache.lucene.util.TestUtil;

import static org.stemtrie.stemmer.TrieTestUtil.str;

public class TestMultiTrie2 extends LuceneTestCase {

  private static String[] segments(CharSequence cmd) {
    return Arrays.stream(MultiTrie2.decompose(cmd)).map(CharSequence::toString).toArray(String[]::new);
  }

  public void testDecompose() {
    assertArrayEquals(new String[] {"-b", "DaIx", "-c", "Ry"}, segments("-bDaIx-cRy"));
    assertArrayEquals(new String[] {"DaIx"}, segments("DaIx"));
    assertArrayEquals(new String[] {"-a"}, segments("-a"));
    assertArrayEquals(new String[0], segments(""));
    expectThrows(IllegalArgumentException.class, () -> MultiTrie2.decompose("-aD"));
  }

  public void testLengthPattern() {
    assertEquals(3, MultiTrie2.lengthPattern("DbIx"));
    assertEquals(3, MultiTrie2.lengthPattern("-c"));
    assertEquals(1, MultiTrie2.lengthPattern("Ry"));
    assertEquals(2, MultiTrie2.lengthPattern("RoRo"));
  }

  public void testCannotFollow() {
    assertTrue(MultiTrie2.cannotFollow('-', '-'));
    assertTrue(MultiTrie2.cannotFollow('D', 'D'));
    assertFalse(MultiTrie2.cannotFollow('-', 'D'));
    assertFalse(MultiTrie2.cannotFollow('R', 'R'));
    assertFalse(MultiTrie2.cannotFollow(' ', '-'));
  }

  public void testSegmentsGoToTheirOwnLayer() {
    MultiTrie2 trie = new MultiTrie2(false);
    String cmd = new Diff().exec("geese", "goose");
    assertEquals("-bRoRo", cmd);
    trie.add("geese", cmd);
    assertEquals(3, trie.getLayers().size());
    assertEquals("-b", str(trie.getLayers().get(0).getFully("geese")));
    // the second layer is keyed by what is left once the skip is consumed
    assertEquals("RoRo", str(trie.getLayers().get(1).getFully("gee")));
    assertEquals("-bRoRo", str(trie.getFully("geese")));
    assertEquals("-bRoRo", str(trie.getLastOnPath("geese")));

    StringBuilder sb = new StringBuilder("geese");
    assertTrue(Diff.apply(sb, trie.getFully("geese")));
    assertEquals("goose", sb.toString());
  }

  public void testAdjacentSkipsRejected() {
    MultiTrie2 trie = new MultiTrie2(true);
    expectThrows(IllegalArgumentException.class, () -> trie.add("abc", "-a-b"));
    expectThrows(IllegalArgumentException.class, () -> trie.add("abc", "-aR"));
  }

  public void testContradictingLayersKeepPartialResult() {
    Trie first = new Trie(true);
    first.add("ab", "-a");
    Trie second = new Trie(true);
    // the key left after "-a" consumed one character
    second.add("b", "-b");
    MultiTrie2 trie = new MultiTrie2(true, 1, new ArrayList<>(Arrays.asList(first, second)));
    assertEquals("-a", str(trie.getFully("ab")));
    assertEquals("-a", str(trie.getLastOnPath("ab")));
  }

  private static Map<String,String> distinctEntries(boolean forward) {
    Diff diff = new Diff();
    Map<String,String> entries = new LinkedHashMap<>();
    for (int i = 0; i < 26; i++) {
      // keys of different words never meet: backward keys keep their first
      // character, forward keys their last one
      String marker = String.valueOf((char) ('a' + i));
      String rest = TestUtil.randomSimpleStringRange(random(), 'a', 'e', 8);
      String word = forward ? rest + marker : marker + rest;
      String stem = random().nextBoolean()
          ? word.substring(0, random().nextInt(word.length() + 1))
          : TestUtil.randomSimpleStringRange(random(), 'a', 'e', 10);
      String cmd = diff.exec(word, stem);
      if (cmd.isEmpty() == false) {
        entries.put(word, cmd);
      }
    }
    return entries;
  }

  public void testRandomLayers() {
    for (boolean forward : new boolean[] {true, false}) {
      Map<String,String> entries = distinctEntries(forward);
      MultiTrie2 trie = TrieTestUtil.fill(new MultiTrie2(forward), entries);
      for (Map.Entry<String,String> e : entries.entrySet()) {
        assertEquals(e.getValue(), str(trie.getFully(e.getKey())));
        assertEquals(e.getValue(), str(trie.getLastOnPath(e.getKey())));
      }

      MultiTrie reduced = trie.reduce(new Optimizer()).reduce(new Lift(true));
      assertEquals(MultiTrie2.class, reduced.getClass());
      for (Map.Entry<String,String> e : entries.entrySet()) {
        assertEquals(e.getValue(), str(reduced.getFully(e.getKey())));
      }
    }
  }

  public void testSingleWordTables() {
    Diff diff = new Diff();
    int iters = atLeast(100);
    for (int i = 0; i < iters; i++) {
      String word = TestUtil.randomSimpleStringRange(random(), 'a', 'c', 12);
      String stem = TestUtil.randomSimpleStringRange(random(), 'a', 'c', 12);
      if (word.isEmpty()) {
        continue;
      }
      String cmd = diff.exec(word, stem);
      MultiTrie2 trie = new MultiTrie2(random().nextBoolean());
      trie.add(word, cmd);
      assertEquals(cmd, str(trie.getFully(word)));
    }
  }

  public void testStoreAndLoad() throws Exception {
    boolean forward = random().nextBoolean();
    Map<String,String> entries = distinctEntries(forward);
    MultiTrie2 trie = TrieTestUtil.fill(new MultiTrie2(forward), entries);
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    trie.store(out);
    MultiTrie2 loaded = new MultiTrie2(out.toDataInput());
    for (Map.Entry<String,String> e : entries.entrySet()) {
      assertEquals(e.getValue(), str(loaded.getFully(e.getKey())));
    }
    assertArrayEquals(out.toArrayCopy(), TrieTestUtil.toBytes(loaded));
  }
}
