/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rawscan.core.util;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryIdGeneratorTest {

  @Test
  void testIdsAreIncreasing() {
    long previous = Long.parseLong(QueryIdGenerator.nextQueryId());
    for (int i = 0; i < 1000; i++) {
      long next = Long.parseLong(QueryIdGenerator.nextQueryId());
      assertTrue(next > previous);
      assertTrue(next > 0);
      previous = next;
    }
  }

  @Test
  void testIdsAreUniqueAcrossThreads() throws Exception {
    final Set<String> ids = new HashSet<>();
    Thread[] threads = new Thread[4];
    for (int t = 0; t < threads.length; t++) {
      threads[t] = new Thread(new Runnable() {
        @Override
        public void run() {
          for (int i = 0; i < 500; i++) {
            String id = QueryIdGenerator.nextQueryId();
            synchronized (ids) {
              ids.add(id);
            }
          }
        }
      });
      threads[t].start();
    }
    for (Thread thread : threads) {
      thread.join();
    }
    assertEquals(2000, ids.size());
  }
}
