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

package org.rawscan.core.metadata;

import java.io.Serializable;
import java.util.Locale;

import org.rawscan.core.constants.RawScanCommonConstants;

/**
 * Identifier of a table by database and table name
 */
public class TableIdentifier implements Serializable {

  private static final long serialVersionUID = -7084728537289237214L;

  private final String databaseName;

  private final String tableName;

  public TableIdentifier(String databaseName, String tableName) {
    this.databaseName = databaseName == null ?
        RawScanCommonConstants.DATABASE_DEFAULT_NAME : databaseName;
    this.tableName = tableName;
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * @return database name + "_" + table name, lower case
   */
  public String getTableUniqueName() {
    return (databaseName + RawScanCommonConstants.UNDERSCORE + tableName)
        .toLowerCase(Locale.ROOT);
  }

  @Override
  public int hashCode() {
    return getTableUniqueName().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TableIdentifier)) {
      return false;
    }
    return getTableUniqueName().equals(((TableIdentifier) obj).getTableUniqueName());
  }

  @Override
  public String toString() {
    return databaseName + "." + tableName;
  }
}
