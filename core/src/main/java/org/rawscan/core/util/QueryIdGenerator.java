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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates query ids. Ids are the decimal text of a nano clock reading, forced to be
 * strictly increasing within the JVM so two plans built in the same clock tick never
 * share an id. Ids are always positive.
 */
public final class QueryIdGenerator {

  private static final AtomicLong LAST_ID = new AtomicLong(0L);

  private QueryIdGenerator() {
  }

  public static String nextQueryId() {
    while (true) {
      long last = LAST_ID.get();
      long next = Math.max(System.nanoTime(), last + 1);
      if (LAST_ID.compareAndSet(last, next)) {
        return String.valueOf(next);
      }
    }
  }
}
