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
import java.util.Map;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.annotations.InterfaceStability;
import org.rawscan.core.metadata.TableIdentifier;
import org.rawscan.core.scan.expression.Expression;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable plan of a raw query, handed to the scan engine. Instances are only created
 * by {@link QueryPlanBuilder#build()}.
 */
@InterfaceAudience.User
@InterfaceStability.Evolving
public final class QueryPlan implements Serializable {

  private static final long serialVersionUID = -9036044826928017164L;

  private final TableIdentifier tableIdentifier;

  /**
   * list of dimension selected for in query
   */
  private final ImmutableList<QueryDimension> dimensions;

  /**
   * list of measure selected in query
   */
  private final ImmutableList<QueryMeasure> measures;

  /**
   * dimensions the engine has to sort on, always empty for a raw detail query
   */
  private final ImmutableList<QueryDimension> sortedDimensions;

  /**
   * filter the engine evaluates, null when nothing could be pushed down
   */
  private final Expression filterExpression;

  /**
   * aggregation hints keyed by dimension name
   */
  private final ImmutableMap<String, DimensionAggregatorInfo> dimAggregatorInfos;

  private final String queryId;

  private final String outLocationPath;

  private final boolean rawDetailQuery;

  QueryPlan(TableIdentifier tableIdentifier, List<QueryDimension> dimensions,
      List<QueryMeasure> measures, Expression filterExpression,
      Map<String, DimensionAggregatorInfo> dimAggregatorInfos, String queryId,
      String outLocationPath, boolean rawDetailQuery) {
    this.tableIdentifier = tableIdentifier;
    this.dimensions = ImmutableList.copyOf(dimensions);
    this.measures = ImmutableList.copyOf(measures);
    this.sortedDimensions = ImmutableList.of();
    this.filterExpression = filterExpression;
    this.dimAggregatorInfos = ImmutableMap.copyOf(dimAggregatorInfos);
    this.queryId = queryId;
    this.outLocationPath = outLocationPath;
    this.rawDetailQuery = rawDetailQuery;
  }

  public TableIdentifier getTableIdentifier() {
    return tableIdentifier;
  }

  public String getDatabaseName() {
    return tableIdentifier.getDatabaseName();
  }

  public String getTableName() {
    return tableIdentifier.getTableName();
  }

  public List<QueryDimension> getDimensions() {
    return dimensions;
  }

  public List<QueryMeasure> getMeasures() {
    return measures;
  }

  public List<QueryDimension> getSortedDimensions() {
    return sortedDimensions;
  }

  public Expression getFilterExpression() {
    return filterExpression;
  }

  public Map<String, DimensionAggregatorInfo> getDimAggregatorInfos() {
    return dimAggregatorInfos;
  }

  public String getQueryId() {
    return queryId;
  }

  public String getOutLocationPath() {
    return outLocationPath;
  }

  public boolean isRawDetailQuery() {
    return rawDetailQuery;
  }

  /**
   * @return number of dimension and measure entries
   */
  public int getColumnCount() {
    return dimensions.size() + measures.size();
  }

  @Override
  public String toString() {
    return "QueryPlan[" + tableIdentifier + ", queryId=" + queryId + ", dimensions="
        + dimensions + ", measures=" + measures + ", filter=" + filterExpression + "]";
  }
}
