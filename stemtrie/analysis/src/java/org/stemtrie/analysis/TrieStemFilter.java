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

import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.KeywordAttribute;
import org.stemtrie.stemmer.TrieStemmer;

/**
 * Replaces each token by its stem, as found in a compiled stemmer table.
 * Tokens marked as keywords, tokens no longer than the minimum length and
 * tokens the table knows nothing about pass through unchanged.
 */
public final class TrieStemFilter extends TokenFilter {

  /** Tokens of this length or shorter are not stemmed by default. */
  public static final int DEFAULT_MIN_LENGTH = 3;

  // 与上游 token 共享同一个 termAtt  直接在其 buffer 上改写
  private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
  private final KeywordAttribute keywordAtt = addAttribute(KeywordAttribute.class);
  private final TrieStemmer stemmer;
  private final int minLength;

  /**
   * Create a new TrieStemFilter with the default minimum length.
   *
   * @param in TokenStream to filter
   * @param stemmer stemmer used by this filter only
   */
  public TrieStemFilter(TokenStream in, TrieStemmer stemmer) {
    this(in, stemmer, DEFAULT_MIN_LENGTH);
  }

  /**
   * @param in TokenStream to filter
   * @param stemmer stemmer used by this filter only
   * @param minLength tokens of this length or shorter are left alone
   */
  public TrieStemFilter(TokenStream in, TrieStemmer stemmer, int minLength) {
    super(in);
    this.stemmer = stemmer;
    this.minLength = minLength;
  }

  @Override
  public boolean incrementToken() throws IOException {
    if (input.incrementToken()) {
      if (keywordAtt.isKeyword() == false && termAtt.length() > minLength) {
        StringBuilder sb = stemmer.stem(termAtt);
        if (sb != null) {
          termAtt.setEmpty().append(sb);
        }
      }
      return true;
    } else {
      return false;
    }
  }
}
