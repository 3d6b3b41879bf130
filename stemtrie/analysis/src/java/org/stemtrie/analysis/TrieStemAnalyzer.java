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

import java.io.IOException;
import java.nio.file.Path;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.stemtrie.stemmer.BaseTrie;
import org.stemtrie.stemmer.TrieStemmer;

/**
 * {@link Analyzer} stemming with a compiled table: {@link StandardTokenizer},
 * then {@link LowerCaseFilter}, then {@link TrieStemFilter}.
 */
public final class TrieStemAnalyzer extends Analyzer {
  private final BaseTrie table;

  /** Builds an analyzer reading {@code table}; the table is shared, never modified. */
  public TrieStemAnalyzer(BaseTrie table) {
    this.table = table;
  }

  /** Builds an analyzer reading the table compiled into {@code tableFile}. */
  public TrieStemAnalyzer(Path tableFile) throws IOException {
    this(TrieStemmer.load(tableFile));
  }

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    final Tokenizer source = new StandardTokenizer();
    TokenStream result = new LowerCaseFilter(source);
    result = new TrieStemFilter(result, new TrieStemmer(table));
    return new TokenStreamComponents(source, result);
  }

  @Override
  protected TokenStream normalize(String fieldName, TokenStream in) {
    return new LowerCaseFilter(in);
  }
}
