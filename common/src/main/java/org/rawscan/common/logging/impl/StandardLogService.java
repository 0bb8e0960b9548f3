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

package org.rawscan.common.logging.impl;

import org.rawscan.common.logging.LogService;

import org.apache.log4j.Logger;

/**
 * Default Implementation of the <code>LogService</code>, backed by log4j
 */
public final class StandardLogService implements LogService {

  private static final String PARTITION_ID = "[partitionID:";

  private Logger logger;

  /**
   * Constructor.
   *
   * @param clazzName for which the Logging is required
   */
  public StandardLogService(String clazzName) {
    logger = Logger.getLogger(clazzName);
  }

  /**
   * Builds the message prefix used to correlate partition decoding logs, e.g.
   * <code>[partitionID:3] </code>
   */
  public static String partitionPrefix(int partitionId) {
    return PARTITION_ID + partitionId + "] ";
  }

  public boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  public boolean isWarnEnabled() {
    return logger.isEnabledFor(org.apache.log4j.Level.WARN);
  }

  public boolean isInfoEnabled() {
    return logger.isInfoEnabled();
  }

  public void debug(String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(message);
    }
  }

  public void info(String message) {
    if (logger.isInfoEnabled()) {
      logger.info(message);
    }
  }

  public void warn(String message) {
    if (isWarnEnabled()) {
      logger.warn(message);
    }
  }

  public void error(String message) {
    logger.error(message);
  }

  public void error(Throwable throwable) {
    logger.error(throwable.getMessage(), throwable);
  }

  public void error(Throwable throwable, String message) {
    logger.error(message, throwable);
  }
}
