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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.TestUtil;

/** Helpers shared by the trie tests. */
final class TrieTestUtil {

  private TrieTestUtil() {}

  /** Random word to command entries over the alphabet {@code a..maxChar}. */
  static Map<String,String> randomEntries(Random random, int count, char maxChar) {
    Diff diff = new Diff();
    Map<String,String> entries = new LinkedHashMap<>();
    for (int i = 0; i < count; i++) {
      String word = TestUtil.randomSimpleStringRange(random, 'a', maxChar, 10);
      if (word.isEmpty()) {
        continue;
      }
      String stem;
      switch (random.nextInt(3)) {
        case 0:
          stem = word.substring(0, random.nextInt(word.length() + 1));
          break;
        case 1:
          stem = word.substring(0, random.nextInt(word.length() + 1))
              + TestUtil.randomSimpleStringRange(random, 'a', maxChar, 3);
          break;
        default:
          stem = TestUtil.randomSimpleStringRange(random, 'a', maxChar, 10);
          break;
      }
      String cmd = diff.exec(word, stem);
      if (cmd.isEmpty() == false) {
        entries.put(word, cmd);
      }
    }
    return entries;
  }

  static <T extends BaseTrie> T fill(T trie, Map<String,String> entries) {
    for (Map.Entry<String,String> e : entries.entrySet()) {
      trie.add(e.getKey(), e.getValue());
    }
    return trie;
  }

  static byte[] toBytes(BaseTrie trie) throws IOException {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    trie.store(out);
    return out.toArrayCopy();
  }

  static String str(CharSequence cs) {
    return cs == null ? null : cs.toString();
  }
}
