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

import org.rawscan.core.constants.RawScanCommonConstants;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RawScanPropertiesTest {

  @AfterEach
  void tearDown() {
    RawScanProperties.getInstance()
        .removeProperty(RawScanCommonConstants.QUERY_COLUMN_RESOLUTION_STRICT)
        .removeProperty("rawscan.test.key");
  }

  @Test
  void testStoreLocationIsLoadedFromClasspath() {
    assertEquals("/tmp/rawscan/store", RawScanProperties.getInstance().getStoreLocation());
  }

  @Test
  void testDefaultValueForMissingOrBlankProperty() {
    RawScanProperties properties = RawScanProperties.getInstance();
    assertNull(properties.getProperty("rawscan.test.key"));
    assertEquals("fallback", properties.getProperty("rawscan.test.key", "fallback"));

    properties.addProperty("rawscan.test.key", "  ");
    assertEquals("fallback", properties.getProperty("rawscan.test.key", "fallback"));

    properties.addProperty("rawscan.test.key", " value ");
    assertEquals("value", properties.getProperty("rawscan.test.key", "fallback"));
  }

  @Test
  void testStrictColumnResolutionFlag() {
    RawScanProperties properties = RawScanProperties.getInstance();
    assertFalse(properties.isStrictColumnResolution());

    properties.addProperty(RawScanCommonConstants.QUERY_COLUMN_RESOLUTION_STRICT, "true");
    assertTrue(properties.isStrictColumnResolution());
  }
}
