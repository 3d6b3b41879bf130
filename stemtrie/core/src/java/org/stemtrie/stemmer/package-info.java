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

/**
 * Stemmer tables: patch commands ({@link org.stemtrie.stemmer.Diff}), the
 * tries storing them ({@link org.stemtrie.stemmer.Trie},
 * {@link org.stemtrie.stemmer.MultiTrie2}), the passes shrinking those tries
 * ({@link org.stemtrie.stemmer.Reduce}) and the dictionary compiler
 * ({@link org.stemtrie.stemmer.Compile}).
 */
package org.stemtrie.stemmer;
