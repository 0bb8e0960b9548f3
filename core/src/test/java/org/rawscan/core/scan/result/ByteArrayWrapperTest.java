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

package org.rawscan.core.scan.result;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ByteArrayWrapperTest {

  @Test
  void testKeysGroupByContent() {
    Map<ByteArrayWrapper, Integer> counts = new HashMap<>();
    counts.merge(new ByteArrayWrapper(new byte[] { 1, 2 }), 1, Integer::sum);
    counts.merge(new ByteArrayWrapper(new byte[] { 1, 2 }), 1, Integer::sum);
    counts.merge(new ByteArrayWrapper(new byte[] { 1, 3 }), 1, Integer::sum);

    assertEquals(2, counts.size());
    assertEquals(Integer.valueOf(2), counts.get(new ByteArrayWrapper(new byte[] { 1, 2 })));
  }

  @Test
  void testBytesCompareUnsigned() {
    ByteArrayWrapper low = new ByteArrayWrapper(new byte[] { 0x01 });
    ByteArrayWrapper high = new ByteArrayWrapper(new byte[] { (byte) 0xF0 });
    ByteArrayWrapper prefix = new ByteArrayWrapper(new byte[] { 0x01, 0x00 });

    assertTrue(low.compareTo(high) < 0);
    assertTrue(low.compareTo(prefix) < 0);
    assertEquals(0, low.compareTo(new ByteArrayWrapper(new byte[] { 0x01 })));
  }
}
