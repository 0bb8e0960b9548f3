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

import java.io.Serializable;

/**
 * Entry of a query plan: a column and the query order assigned to it. Query orders are
 * drawn from one counter shared by dimensions and measures of the same plan.
 */
public abstract class QueryColumn implements Serializable {

  private static final long serialVersionUID = -4222306600480181084L;

  /**
   * name of the column
   */
  protected final String columnName;

  /**
   * query order in which result of the query will be sent
   */
  private final int queryOrder;

  protected QueryColumn(String columnName, int queryOrder) {
    if (queryOrder < 0) {
      throw new IllegalArgumentException("query order must not be negative: " + queryOrder);
    }
    this.columnName = columnName;
    this.queryOrder = queryOrder;
  }

  public String getColumnName() {
    return columnName;
  }

  public int getQueryOrder() {
    return queryOrder;
  }

  @Override
  public String toString() {
    return columnName + ":" + queryOrder;
  }
}
