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

package org.rawscan.core.constants;

import org.rawscan.common.annotations.InterfaceStability;

@InterfaceStability.Stable
public final class RawScanCommonConstants {

  //////////////////////////////////////////////////////////////////////////////////////////
  // System level property start here
  //////////////////////////////////////////////////////////////////////////////////////////

  /**
   * system property naming the properties file to load
   */
  public static final String RAWSCAN_PROPERTIES_FILE_PATH = "rawscan.properties.filepath";

  /**
   * properties file looked up on the classpath when no file path is configured
   */
  public static final String RAWSCAN_PROPERTIES_FILE_PATH_DEFAULT = "rawscan.properties";

  /**
   * location where the scan engine writes query output
   */
  public static final String STORE_LOCATION_HDFS = "rawscan.storelocation.hdfs";

  public static final String STORE_LOCATION_DEFAULT_VAL = "../rawscan.store";

  /**
   * when true, a requested output column which is neither a dimension nor a measure
   * fails the query instead of being dropped from the plan
   */
  public static final String QUERY_COLUMN_RESOLUTION_STRICT =
      "rawscan.query.column.resolution.strict";

  public static final String QUERY_COLUMN_RESOLUTION_STRICT_DEFAULT = "false";

  //////////////////////////////////////////////////////////////////////////////////////////
  // Session level property start here
  //////////////////////////////////////////////////////////////////////////////////////////

  /**
   * query id supplied by the session, overrides the generated one
   */
  public static final String QUERY_ID = "queryId";

  //////////////////////////////////////////////////////////////////////////////////////////
  // Table level property start here
  //////////////////////////////////////////////////////////////////////////////////////////

  /**
   * dimensions which are stored without a dictionary
   */
  public static final String DICTIONARY_EXCLUDE = "dictionary_exclude";

  //////////////////////////////////////////////////////////////////////////////////////////
  // Unconfigurable values
  //////////////////////////////////////////////////////////////////////////////////////////

  /**
   * member value the key decoder reports for a null dimension member
   */
  public static final String MEMBER_DEFAULT_VAL = "@NU#LL$!";

  public static final String DATABASE_DEFAULT_NAME = "default";

  public static final String FILE_SEPARATOR = "/";

  public static final String COMMA = ",";

  public static final String UNDERSCORE = "_";

  private RawScanCommonConstants() {
  }
}
