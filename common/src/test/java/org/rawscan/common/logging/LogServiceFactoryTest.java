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

package org.rawscan.common.logging;

import java.io.StringWriter;

import org.rawscan.common.logging.impl.StandardLogService;

import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.WriterAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LogServiceFactoryTest {

  private static final String LOGGER_NAME = LogServiceFactoryTest.class.getName();

  private StringWriter output;

  private WriterAppender appender;

  @BeforeEach
  void setUp() {
    output = new StringWriter();
    appender = new WriterAppender(new PatternLayout("%p %m%n"), output);
    Logger.getLogger(LOGGER_NAME).addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    Logger.getLogger(LOGGER_NAME).removeAppender(appender);
  }

  @Test
  void testMessagesGoToNamedLogger() {
    LogService logService = LogServiceFactory.getLogService(LOGGER_NAME);
    logService.info("planned query 1");
    logService.warn("column dropped");
    logService.error(new IllegalStateException("boom"), "scan failed");

    String logged = output.toString();
    assertTrue(logged.contains("INFO planned query 1"));
    assertTrue(logged.contains("WARN column dropped"));
    assertTrue(logged.contains("ERROR scan failed"));
  }

  @Test
  void testDebugIsOffAtInfoLevel() {
    LogService logService = LogServiceFactory.getLogService(LOGGER_NAME);
    assertFalse(logService.isDebugEnabled());
    assertTrue(logService.isInfoEnabled());
    logService.debug("hidden");

    assertFalse(output.toString().contains("hidden"));
  }

  @Test
  void testPartitionPrefix() {
    assertEquals("[partitionID:3] ", StandardLogService.partitionPrefix(3));
  }
}
