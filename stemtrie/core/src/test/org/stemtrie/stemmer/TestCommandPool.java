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

import org.apache.lucene.util.LuceneTestCase;

public class TestCommandPool extends LuceneTestCase {

  public void testAddReturnsExistingIndex() {
    CommandPool pool = new CommandPool();
    assertEquals(0, pool.add("Da"));
    assertEquals(1, pool.add("-aRb"));
    assertEquals(0, pool.add(new StringBuilder("Da")));
    assertEquals(2, pool.size());
    assertEquals("Da", pool.get(0));
    assertEquals("-aRb", pool.get(1));
    assertEquals(1, pool.indexOf("-aRb"));
    assertEquals(-1, pool.indexOf("Ic"));
  }

  public void testCopyIsIndependent() {
    CommandPool pool = new CommandPool();
    pool.add("Da");
    CommandPool copy = pool.copy();
    assertEquals(1, copy.add("Db"));
    assertEquals(1, pool.size());
    assertEquals(-1, pool.indexOf("Db"));
    assertEquals(0, copy.indexOf("Da"));
  }

  public void testIndicesFollowInsertionOrder() {
    CommandPool pool = new CommandPool();
    int n = atLeast(50);
    for (int i = 0; i < n; i++) {
      String cmd = "I" + (char) ('a' + i % 20);
      assertEquals(i % 20, pool.add(cmd));
    }
    assertEquals(20, pool.size());
  }
}
