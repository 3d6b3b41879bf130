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

import java.nio.charset.StandardCharsets;

import org.apache.lucene.util.InfoStream;
import org.apache.lucene.util.LuceneTestCase;

public class TestCompilerConfig extends LuceneTestCase {

  public void testAllFlags() {
    CompilerConfig config = new CompilerConfig("-0M1LE2G");
    assertTrue(config.isBackward());
    assertTrue(config.isStoreOriginal());
    assertTrue(config.isMulti());
    assertEquals("1LE2G", config.getPasses());
    assertEquals("-0M1LE2G", config.getFlags());
    assertTrue(config.newTrie() instanceof MultiTrie2);
    assertFalse(config.newTrie().isForward());
  }

  public void testForwardPlain() {
    CompilerConfig config = new CompilerConfig("1");
    assertFalse(config.isBackward());
    assertFalse(config.isStoreOriginal());
    assertFalse(config.isMulti());
    assertEquals("1", config.getPasses());
    BaseTrie trie = config.newTrie();
    assertEquals(Trie.class, trie.getClass());
    assertTrue(trie.isForward());
  }

  public void testFlagsOnly() {
    CompilerConfig config = new CompilerConfig("M");
    assertTrue(config.isMulti());
    assertEquals("", config.getPasses());

    // the markers only count in their own position
    config = new CompilerConfig("1-0");
    assertFalse(config.isBackward());
    assertFalse(config.isStoreOriginal());
    assertEquals("1-0", config.getPasses());
  }

  public void testEmptyFlags() {
    expectThrows(IllegalArgumentException.class, () -> new CompilerConfig(""));
    expectThrows(IllegalArgumentException.class, () -> new CompilerConfig(null));
  }

  public void testDefaults() {
    assumeTrue("charset overridden", System.getProperty(CompilerConfig.CHARSET_PROPERTY) == null);
    CompilerConfig config = new CompilerConfig("-");
    assertEquals(StandardCharsets.UTF_8, config.getCharset());
    assertSame(InfoStream.NO_OUTPUT, config.getInfoStream());
    expectThrows(NullPointerException.class, () -> config.setInfoStream(null));
  }
}
