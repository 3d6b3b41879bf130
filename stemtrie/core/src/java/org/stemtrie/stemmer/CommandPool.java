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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of distinct patch commands. Cells refer to commands by their
 * index in the pool, so indices never change once assigned.
 *
 * <p>Each {@link Trie} owns its pool; reductions hand a {@link #copy()} to
 * the trie they produce.
 *
 * @lucene.internal
 */
public final class CommandPool {

  private final List<String> commands;
  // 按值去重  下标即插入顺序
  private final Map<String,Integer> ords;

  /** Creates an empty pool. */
  public CommandPool() {
    commands = new ArrayList<>();
    ords = new HashMap<>();
  }

  private CommandPool(CommandPool other) {
    commands = new ArrayList<>(other.commands);
    ords = new HashMap<>(other.ords);
  }

  /**
   * Returns the index of {@code cmd}, appending it first if no equal command
   * is pooled yet.
   */
  public int add(CharSequence cmd) {
    String key = cmd.toString();
    Integer ord = ords.get(key);
    if (ord != null) {
      return ord;
    }
    int next = commands.size();
    commands.add(key);
    ords.put(key, next);
    return next;
  }

  /** Returns the index of {@code cmd}, or -1 if it was never added. */
  public int indexOf(CharSequence cmd) {
    Integer ord = ords.get(cmd.toString());
    return ord == null ? -1 : ord;
  }

  /** Returns the command stored at {@code index}. */
  public String get(int index) {
    return commands.get(index);
  }

  /** Number of distinct commands. */
  public int size() {
    return commands.size();
  }

  CommandPool copy() {
    return new CommandPool(this);
  }

  @Override
  public String toString() {
    return "CommandPool(size=" + commands.size() + ")";
  }
}
