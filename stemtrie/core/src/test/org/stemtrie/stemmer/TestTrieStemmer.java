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

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.StringReader;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.LuceneTestCase;

public class TestTrieStemmer extends LuceneTestCase {

  private static byte[] compile(String flags, String dictionary) throws Exception {
    Compile compile = new Compile(new CompilerConfig(flags));
    BaseTrie trie = compile.reduce(compile.read(new BufferedReader(new StringReader(dictionary))));
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    compile.write(out, trie);
    return out.toArrayCopy();
  }

  public void testStem() {
    Diff diff = new Diff();
    Trie trie = new Trie(false);
    trie.add("walking", diff.exec("walking", "walk"));
    trie.add("geese", diff.exec("geese", "goose"));
    trie.add("ab", "Db");
    TrieStemmer stemmer = new TrieStemmer(trie);
    assertSame(trie, stemmer.getTrie());
    assertEquals("walk", stemmer.stem("walking").toString());
    assertEquals("goose", stemmer.stem("geese").toString());
    // the path of "walking" carries no command before its last character
    assertNull(stemmer.stem("talking"));
    assertNull(stemmer.stem("xyz"));
    // nothing left
    assertNull(stemmer.stem("ab"));
  }

  public void testLoadPlain() throws Exception {
    byte[] bytes = compile("-1", "walk walking walked\nbook books\n");
    BaseTrie table = TrieStemmer.load(new ByteArrayInputStream(bytes));
    assertEquals(Trie.class, table.getClass());
    TrieStemmer stemmer = new TrieStemmer(table);
    assertEquals("walk", stemmer.stem("walked").toString());
    assertEquals("book", stemmer.stem("books").toString());
  }

  public void testLoadLayered() throws Exception {
    byte[] bytes = compile("-0M", "goose geese\nrun ran running\n");
    BaseTrie table = TrieStemmer.load(new ByteArrayInputStream(bytes));
    assertEquals(MultiTrie2.class, table.getClass());
    TrieStemmer stemmer = new TrieStemmer(table);
    assertEquals("goose", stemmer.stem("geese").toString());
    assertEquals("run", stemmer.stem("ran").toString());
    assertEquals("run", stemmer.stem("running").toString());
    assertEquals("goose", stemmer.stem("goose").toString());
  }

  public void testUnknownWordInLayeredTable() throws Exception {
    MultiTrie2 table = new MultiTrie2(false);
    table.add("geese", new Diff().exec("geese", "goose"));
    TrieStemmer stemmer = new TrieStemmer(table);
    assertEquals("", table.getLastOnPath("xyz").toString());
    assertNull(stemmer.stem("xyz"));
    assertEquals("goose", stemmer.stem("geese").toString());
  }

  public void testMissingFlags() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    out.writeString("");
    new Trie(false).store(out);
    expectThrows(CorruptIndexException.class, () -> TrieStemmer.load(new ByteArrayInputStream(out.toArrayCopy())));
  }
}
