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

package org.rawscan.core.metadata.datatype;

import org.rawscan.common.annotations.InterfaceAudience;

/**
 * Holds all singleton object for all data type used
 */
@InterfaceAudience.User
public class DataTypes {

  public static final DataType STRING = new DataType(0, "STRING", -1, String.class);
  public static final DataType BOOLEAN = new DataType(1, "BOOLEAN", 1, Boolean.class);
  public static final DataType BYTE = new DataType(2, "BYTE", 1, Byte.class);
  public static final DataType SHORT = new DataType(3, "SHORT", 2, Short.class);
  public static final DataType INT = new DataType(4, "INT", 4, Integer.class);
  public static final DataType LONG = new DataType(5, "LONG", 8, Long.class);
  public static final DataType FLOAT = new DataType(6, "FLOAT", 4, Float.class);
  public static final DataType DOUBLE = new DataType(7, "DOUBLE", 8, Double.class);

  static final int DECIMAL_TYPE_ID = 9;

  private DataTypes() {
  }

  /**
   * create a decimal type object with specified precision and scale
   */
  public static DecimalType createDecimalType(int precision, int scale) {
    return new DecimalType(precision, scale);
  }
}
