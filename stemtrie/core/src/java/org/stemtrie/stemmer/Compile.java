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

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Pattern;

import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.OutputStreamDataOutput;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.InfoStream;
import org.apache.lucene.util.PrintStreamInfoStream;

/**
 * Compiles dictionary files into stemmer tables.
 *
 * <p>Each dictionary line holds a stem followed by the words that stem to it,
 * separated by whitespace. Every word is stored with the patch command that
 * turns it into the stem, the configured reduction passes run, and the table
 * is written next to the dictionary as {@code <dictionary>.out}, preceded by
 * the flag string.
 *
 * <pre>
 * java org.stemtrie.stemmer.Compile [-][0][M][passes] dictionary...
 * </pre>
 *
 * @see CompilerConfig
 */
public class Compile {

  /** InfoStream component name. */
  public static final String COMPONENT = "COMPILE";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final CompilerConfig config;
  private final InfoStream infoStream;

  /** Creates a compiler running with {@code config}. */
  public Compile(CompilerConfig config) {
    this.config = config;
    this.infoStream = config.getInfoStream();
  }

  /**
   * Reads dictionary lines from {@code in} and returns the table built from
   * them, before any reduction. Empty lines are skipped, and so is any word
   * whose insertion is rejected; both only cost the affected entries.
   */
  public BaseTrie read(BufferedReader in) throws IOException {
    Diff diff = new Diff();
    BaseTrie trie = config.newTrie();
    int lines = 0;
    int words = 0;
    int skippedLines = 0;
    int rejected = 0;
    for (String line = in.readLine(); line != null; line = in.readLine()) {
      lines++;
      String[] tokens = WHITESPACE.split(line.toLowerCase(Locale.ROOT).trim());
      if (tokens[0].isEmpty()) {
        skippedLines++;
        continue;
      }
      String stem = tokens[0];
      if (config.isStoreOriginal()) {
        trie.add(stem, "-a");
      }
      for (int i = 1; i < tokens.length; i++) {
        String token = tokens[i];
        if (token.equals(stem)) {
          continue;
        }
        try {
          trie.add(token, diff.exec(token, stem));
          words++;
        } catch (IllegalArgumentException e) {
          rejected++;
          if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "line " + lines + ": skip \"" + token + "\": " + e.getMessage());
          }
        }
      }
    }
    if (infoStream.isEnabled(COMPONENT)) {
      infoStream.message(COMPONENT, "read " + lines + " lines: words=" + words
          + " emptyLines=" + skippedLines + " rejected=" + rejected);
      infoStream.message(COMPONENT, "built: " + trie.getStatistics());
    }
    return trie;
  }

  /** Runs the configured passes, in order, and returns the final table. */
  public BaseTrie reduce(BaseTrie trie) {
    for (char pass : config.getPasses().toCharArray()) {
      Reduce by = reducerFor(pass);
      if (by == null) {
        if (infoStream.isEnabled(COMPONENT)) {
          infoStream.message(COMPONENT, "pass '" + pass + "' is not supported; skipped");
        }
        continue;
      }
      trie = trie.reduce(by);
      if (infoStream.isEnabled(COMPONENT)) {
        infoStream.message(COMPONENT, pass + ": " + trie.getStatistics());
      }
    }
    return trie;
  }

  /** Returns the pass selected by {@code pass}, or null if there is none. */
  public static Reduce reducerFor(char pass) {
    switch (pass) {
      case '1':
        return new Optimizer();
      case 'L':
        return new Lift(true);
      case 'E':
        return new Lift(false);
      default:
        return null;
    }
  }

  /** Writes the flag string and then {@code trie}. */
  public void write(DataOutput out, BaseTrie trie) throws IOException {
    out.writeString(config.getFlags());
    trie.store(out);
  }

  /**
   * Compiles one dictionary file and returns the path of the table written
   * for it. If writing fails, no partial table is left behind.
   */
  public Path compile(Path dictionary) throws IOException {
    if (infoStream.isEnabled(COMPONENT)) {
      infoStream.message(COMPONENT, "compile " + dictionary + " with " + config);
    }
    BaseTrie trie;
    try (BufferedReader in = Files.newBufferedReader(dictionary, config.getCharset())) {
      trie = read(in);
    }
    trie = reduce(trie);

    Path out = dictionary.resolveSibling(dictionary.getFileName().toString() + ".out");
    OutputStreamDataOutput os = new OutputStreamDataOutput(new BufferedOutputStream(Files.newOutputStream(out)));
    boolean success = false;
    try {
      write(os, trie);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(os);
      } else {
        IOUtils.closeWhileHandlingException(os);
        IOUtils.deleteFilesIgnoringExceptions(out);
      }
    }
    if (infoStream.isEnabled(COMPONENT)) {
      infoStream.message(COMPONENT, "wrote " + out);
    }
    return out;
  }

  public static void main(String[] args) throws IOException {
    if (args.length < 1) {
      System.err.println("Usage: java " + Compile.class.getName() + " [-][0][M][passes] dictionary...");
      return;
    }
    CompilerConfig config = new CompilerConfig(args[0])
        .setInfoStream(new PrintStreamInfoStream(System.out));
    Compile compile = new Compile(config);
    for (int i = 1; i < args.length; i++) {
      compile.compile(Paths.get(args[i]));
    }
  }
}
