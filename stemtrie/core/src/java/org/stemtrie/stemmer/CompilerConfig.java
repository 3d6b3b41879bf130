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

import java.nio.charset.Charset;
import java.util.Objects;

import org.apache.lucene.util.InfoStream;

/**
 * Settings of a {@link Compile} run, parsed from the flag string that is also
 * written at the head of every compiled table.
 *
 * <p>The flag string is, in order: an optional {@code -} (keys are read
 * tail-to-head), an optional {@code 0} (also store every stem as mapping to
 * itself), an optional {@code M} (build a layered {@link MultiTrie2}), then
 * the reduction passes to run, one letter each:
 * <ul>
 *   <li>{@code 1}: {@link Optimizer}</li>
 *   <li>{@code L}: {@link Lift} keeping skips</li>
 *   <li>{@code E}: {@link Lift} dropping skips</li>
 * </ul>
 * Any other pass letter (including {@code 2} and {@code G}) is skipped.
 *
 * <p>The input charset defaults to the {@value #CHARSET_PROPERTY} system
 * property, or UTF-8.
 */
public final class CompilerConfig {

  /** System property naming the charset of dictionary files. */
  public static final String CHARSET_PROPERTY = "stemtrie.charset";

  private final String flags;
  private final boolean backward;
  private final boolean storeOriginal;
  private final boolean multi;
  private final String passes;
  private Charset charset;
  private InfoStream infoStream = InfoStream.NO_OUTPUT;

  /**
   * @throws IllegalArgumentException if {@code flags} is empty
   */
  public CompilerConfig(String flags) {
    if (flags == null || flags.isEmpty()) {
      throw new IllegalArgumentException("flags must not be empty");
    }
    this.flags = flags;
    int qq = 0;
    backward = flags.charAt(qq) == '-';
    if (backward) {
      qq++;
    }
    storeOriginal = qq < flags.length() && flags.charAt(qq) == '0';
    if (storeOriginal) {
      qq++;
    }
    multi = qq < flags.length() && flags.charAt(qq) == 'M';
    if (multi) {
      qq++;
    }
    passes = flags.substring(qq);
    charset = Charset.forName(System.getProperty(CHARSET_PROPERTY, "UTF-8"));
  }

  /** The flag string this configuration was parsed from. */
  public String getFlags() {
    return flags;
  }

  /** True if keys are consumed tail-to-head. */
  public boolean isBackward() {
    return backward;
  }

  /** True if every stem is also stored, mapped to itself. */
  public boolean isStoreOriginal() {
    return storeOriginal;
  }

  /** True if a layered {@link MultiTrie2} is built. */
  public boolean isMulti() {
    return multi;
  }

  /** Pass letters, in the order they run. */
  public String getPasses() {
    return passes;
  }

  /** Charset of the dictionary files. */
  public Charset getCharset() {
    return charset;
  }

  /** Sets the charset of the dictionary files. */
  public CompilerConfig setCharset(Charset charset) {
    this.charset = Objects.requireNonNull(charset);
    return this;
  }

  /** Where progress messages go; {@link InfoStream#NO_OUTPUT} by default. */
  public InfoStream getInfoStream() {
    return infoStream;
  }

  /** Sets where progress messages go. */
  public CompilerConfig setInfoStream(InfoStream infoStream) {
    this.infoStream = Objects.requireNonNull(infoStream);
    return this;
  }

  /** Creates the empty table these flags ask for. */
  BaseTrie newTrie() {
    return multi ? new MultiTrie2(backward == false) : new Trie(backward == false);
  }

  @Override
  public String toString() {
    return "CompilerConfig(flags=" + flags + " charset=" + charset + ")";
  }
}
