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
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Aggregation hint for a selected dimension: the aggregate functions applied to it in
 * the query and the query order of the dimension for each of them
 */
public class DimensionAggregatorInfo implements Serializable {

  private static final long serialVersionUID = 4801602263271340969L;

  private final String columnName;

  private final ImmutableList<String> aggList;

  private final ImmutableList<Integer> orderList;

  public DimensionAggregatorInfo(String columnName, List<String> aggList,
      List<Integer> orderList) {
    if (aggList.size() != orderList.size()) {
      throw new IllegalArgumentException(
          "aggregate functions and orders differ in size for column " + columnName);
    }
    this.columnName = columnName;
    this.aggList = ImmutableList.copyOf(aggList);
    this.orderList = ImmutableList.copyOf(orderList);
  }

  public String getColumnName() {
    return columnName;
  }

  public List<String> getAggList() {
    return aggList;
  }

  public List<Integer> getOrderList() {
    return orderList;
  }

  @Override
  public String toString() {
    return columnName + aggList;
  }
}
