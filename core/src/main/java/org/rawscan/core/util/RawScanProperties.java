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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.rawscan.common.logging.LogService;
import org.rawscan.common.logging.LogServiceFactory;
import org.rawscan.core.constants.RawScanCommonConstants;

import org.apache.commons.lang.StringUtils;

/**
 * Holds the system level properties. Properties are loaded once from the file named by
 * the system property {@link RawScanCommonConstants#RAWSCAN_PROPERTIES_FILE_PATH}, or from
 * the classpath resource {@link RawScanCommonConstants#RAWSCAN_PROPERTIES_FILE_PATH_DEFAULT}
 * when it is not set. Values added at runtime through {@link #addProperty} win over
 * loaded ones.
 */
public final class RawScanProperties {

  private static final LogService LOGGER =
      LogServiceFactory.getLogService(RawScanProperties.class.getName());

  private static final RawScanProperties INSTANCE = new RawScanProperties();

  private final Properties rawScanProperties;

  private RawScanProperties() {
    rawScanProperties = new Properties();
    loadProperties();
  }

  public static RawScanProperties getInstance() {
    return INSTANCE;
  }

  /**
   * This method will be used to get the properties value
   *
   * @param key property key
   * @return property value, null if not configured
   */
  public String getProperty(String key) {
    return rawScanProperties.getProperty(key);
  }

  /**
   * This method will be used to get the properties value if property is not
   * present then it will return the default value
   */
  public String getProperty(String key, String defaultValue) {
    String value = getProperty(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    return value.trim();
  }

  /**
   * This method will be used to add a new property
   */
  public RawScanProperties addProperty(String key, String value) {
    rawScanProperties.setProperty(key, value);
    return this;
  }

  /**
   * Remove a property added at runtime or loaded from file
   */
  public RawScanProperties removeProperty(String key) {
    rawScanProperties.remove(key);
    return this;
  }

  /**
   * Returns the store location where the scan engine writes output
   */
  public String getStoreLocation() {
    return getProperty(RawScanCommonConstants.STORE_LOCATION_HDFS,
        RawScanCommonConstants.STORE_LOCATION_DEFAULT_VAL);
  }

  /**
   * Returns whether unresolvable output columns fail the query
   */
  public boolean isStrictColumnResolution() {
    return Boolean.parseBoolean(getProperty(
        RawScanCommonConstants.QUERY_COLUMN_RESOLUTION_STRICT,
        RawScanCommonConstants.QUERY_COLUMN_RESOLUTION_STRICT_DEFAULT));
  }

  private void loadProperties() {
    String propertyPath = System.getProperty(RawScanCommonConstants.RAWSCAN_PROPERTIES_FILE_PATH);
    if (StringUtils.isNotBlank(propertyPath)) {
      File file = new File(propertyPath);
      if (!file.exists()) {
        LOGGER.warn("The properties file " + propertyPath + " does not exist, using defaults");
        return;
      }
      try (InputStream stream = new FileInputStream(file)) {
        rawScanProperties.load(stream);
        LOGGER.info("Properties file path: " + file.getAbsolutePath());
      } catch (IOException e) {
        LOGGER.error(e, "Error while reading the properties file " + propertyPath);
      }
      return;
    }
    InputStream stream = RawScanProperties.class.getClassLoader()
        .getResourceAsStream(RawScanCommonConstants.RAWSCAN_PROPERTIES_FILE_PATH_DEFAULT);
    if (stream == null) {
      LOGGER.info("No " + RawScanCommonConstants.RAWSCAN_PROPERTIES_FILE_PATH_DEFAULT
          + " found on classpath, using defaults");
      return;
    }
    try {
      rawScanProperties.load(stream);
    } catch (IOException e) {
      LOGGER.error(e, "Error while reading "
          + RawScanCommonConstants.RAWSCAN_PROPERTIES_FILE_PATH_DEFAULT + " from classpath");
    } finally {
      try {
        stream.close();
      } catch (IOException e) {
        LOGGER.error(e, "Error while closing properties stream");
      }
    }
  }
}
