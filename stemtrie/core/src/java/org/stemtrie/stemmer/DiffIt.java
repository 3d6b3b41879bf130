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
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Prints the patch commands of a dictionary: for every line, the stem
 * followed by the command of each of its words.
 *
 * <pre>
 * java org.stemtrie.stemmer.DiffIt costs dictionary...
 * </pre>
 * {@code costs} holds up to four digits: insert, delete, replace and no-op
 * cost, defaulting to {@code 1110}.
 */
public final class DiffIt {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int[] DEFAULT_COSTS = {1, 1, 1, 0};

  private DiffIt() {}

  /** Cost digit {@code i} of {@code costs}, or its default. */
  static int cost(String costs, int i) {
    if (i < costs.length() && Character.isDigit(costs.charAt(i))) {
      return costs.charAt(i) - '0';
    }
    return DEFAULT_COSTS[i];
  }

  /** Writes one output line per dictionary line of {@code in}. */
  public static void diff(BufferedReader in, Diff diff, PrintStream out) throws IOException {
    for (String line = in.readLine(); line != null; line = in.readLine()) {
      String[] tokens = WHITESPACE.split(line.toLowerCase(Locale.ROOT).trim());
      if (tokens[0].isEmpty()) {
        continue;
      }
      String stem = tokens[0];
      StringBuilder sb = new StringBuilder(stem);
      for (int i = 1; i < tokens.length; i++) {
        sb.append(' ').append(diff.exec(tokens[i], stem));
      }
      out.println(sb);
    }
  }

  public static void main(String[] args) throws IOException {
    if (args.length < 2) {
      System.err.println("Usage: java " + DiffIt.class.getName() + " costs dictionary...");
      return;
    }
    Diff diff = new Diff(cost(args[0], 0), cost(args[0], 1), cost(args[0], 2), cost(args[0], 3));
    Charset charset = Charset.forName(System.getProperty(CompilerConfig.CHARSET_PROPERTY, "UTF-8"));
    for (int i = 1; i < args.length; i++) {
      try (BufferedReader in = Files.newBufferedReader(Paths.get(args[i]), charset)) {
        diff(in, diff, System.out);
      }
    }
  }
}
