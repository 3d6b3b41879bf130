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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.InputStreamDataInput;

/**
 * Stems words with a compiled table: the command found for a word is
 * replayed on it.
 *
 * <p>Instances reuse an internal buffer and are not thread safe.
 */
public class TrieStemmer {
  private final BaseTrie trie;
  private final StringBuilder buffer = new StringBuilder();

  /** Creates a stemmer reading {@code trie}; the table is never modified. */
  public TrieStemmer(BaseTrie trie) {
    this.trie = trie;
  }

  /**
   * Reads a table written by {@link Compile}: the flag string, then a
   * {@link MultiTrie2} if the flags ask for one, else a {@link Trie}.
   * The stream is not closed.
   */
  public static BaseTrie load(InputStream in) throws IOException {
    DataInput din = new InputStreamDataInput(in);
    String flags = din.readString();
    if (flags.isEmpty()) {
      throw new CorruptIndexException("missing flags", din);
    }
    if (new CompilerConfig(flags).isMulti()) {
      return new MultiTrie2(din);
    } else {
      return new Trie(din);
    }
  }

  /** Reads a table written by {@link Compile} from a file. */
  public static BaseTrie load(Path path) throws IOException {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
      return load(in);
    }
  }

  /** The table this stemmer reads. */
  public BaseTrie getTrie() {
    return trie;
  }

  /**
   * Returns the stem of {@code word}, or null if the table has no command
   * for it or the command leaves nothing. The returned buffer is reused by
   * the next call.
   */
  public StringBuilder stem(CharSequence word) {
    CharSequence cmd = trie.getLastOnPath(word);
    // 分层表查不到时返回空串
    if (cmd == null || cmd.length() == 0) {
      return null;
    }
    buffer.setLength(0);
    buffer.append(word);
    Diff.apply(buffer, cmd);
    return buffer.length() > 0 ? buffer : null;
  }
}
