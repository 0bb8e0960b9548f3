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

package org.rawscan.common.exceptions;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.annotations.InterfaceStability;

/**
 * This exception will be thrown when a column referenced while building a query plan
 * is neither a dimension nor a measure of the table. Plan construction is aborted.
 */
@InterfaceAudience.User
@InterfaceStability.Stable
public class SchemaResolutionException extends Exception {

  /**
   * default serial version ID.
   */
  private static final long serialVersionUID = 1L;

  /**
   * name of the column which could not be resolved
   */
  private final String columnName;

  public SchemaResolutionException(String columnName, String message) {
    super(message);
    this.columnName = columnName;
  }

  public String getColumnName() {
    return columnName;
  }
}
