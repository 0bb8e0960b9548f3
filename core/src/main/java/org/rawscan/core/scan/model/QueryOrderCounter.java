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

package org.rawscan.core.scan.model;

/**
 * Hands out query orders for one plan. Dimensions and measures share the same counter so
 * that the orders of both families form a single increasing sequence. Not thread safe, a
 * plan is always built by one thread.
 */
public class QueryOrderCounter {

  private int next;

  public int next() {
    return next++;
  }

  /**
   * @return the order the next call of {@link #next()} will return
   */
  public int peek() {
    return next;
  }
}
