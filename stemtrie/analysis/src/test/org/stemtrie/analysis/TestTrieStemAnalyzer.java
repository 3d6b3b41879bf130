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
package org.stemtrie.analysis;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.BaseTokenStreamTestCase;
import org.apache.lucene.util.BytesRef;
import org.stemtrie.stemmer.Compile;
import org.stemtrie.stemmer.CompilerConfig;

public class TestTrieStemAnalyzer extends BaseTokenStreamTestCase {

  private Path compiledTable(String flags) throws Exception {
    Path rules = createTempDir("analyzer").resolve("rules.txt");
    Files.write(rules, ("walk walking walked walks\n"
        + "book books\n"
        + "goose geese\n"
        + "happy happier happiest\n").getBytes(StandardCharsets.UTF_8));
    return new Compile(new CompilerConfig(flags)).compile(rules);
  }

  public void testAnalyze() throws Exception {
    Analyzer a = new TrieStemAnalyzer(compiledTable("-1"));
    assertAnalyzesTo(a, "Walking, BOOKS and geese!",
        new String[] {"walk", "book", "and", "goose"},
        new int[] {0, 9, 15, 19},
        new int[] {7, 14, 18, 24});
    a.close();
  }

  public void testLayeredTable() throws Exception {
    Analyzer a = new TrieStemAnalyzer(compiledTable("-0M1E"));
    assertAnalyzesTo(a, "happier geese walks happy", new String[] {"happy", "goose", "walk", "happy"});
    a.close();
  }

  public void testNormalize() throws Exception {
    Analyzer a = new TrieStemAnalyzer(compiledTable("-"));
    assertEquals(new BytesRef("walking"), a.normalize("field", "WALKING"));
    a.close();
  }

  public void testRandomStrings() throws Exception {
    Analyzer a = new TrieStemAnalyzer(compiledTable("-1L"));
    checkRandomData(random(), a, 200 * RANDOM_MULTIPLIER);
    a.close();
  }
}
