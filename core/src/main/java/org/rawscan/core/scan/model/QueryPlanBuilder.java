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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.rawscan.core.metadata.TableIdentifier;
import org.rawscan.core.scan.expression.Expression;
import org.rawscan.core.util.QueryIdGenerator;

/**
 * Collects the entries of a query plan while it is being planned. Every entry takes its
 * query order from the single {@link QueryOrderCounter} of this builder, so orders are
 * unique and increasing in the order entries were added. {@link #build()} returns an
 * immutable snapshot; changes made to the builder afterwards do not affect it.
 */
public class QueryPlanBuilder {

  private final TableIdentifier tableIdentifier;

  private final QueryOrderCounter queryOrderCounter = new QueryOrderCounter();

  private final List<QueryDimension> dimensions = new ArrayList<>();

  private final List<QueryMeasure> measures = new ArrayList<>();

  // aggregate functions and their query orders, keyed by dimension name
  private final Map<String, List<String>> aggFunctions = new LinkedHashMap<>();
  private final Map<String, List<Integer>> aggOrders = new LinkedHashMap<>();

  private Expression filterExpression;

  private String queryId;

  private String outLocationPath;

  public QueryPlanBuilder(TableIdentifier tableIdentifier) {
    this.tableIdentifier = tableIdentifier;
  }

  /**
   * Append a dimension entry with the next query order
   */
  public QueryDimension addDimension(String columnName) {
    QueryDimension dimension = new QueryDimension(columnName, queryOrderCounter.next());
    dimensions.add(dimension);
    return dimension;
  }

  /**
   * Append a measure entry with the next query order
   */
  public QueryMeasure addMeasure(String columnName) {
    QueryMeasure measure = new QueryMeasure(columnName, queryOrderCounter.next());
    measures.add(measure);
    return measure;
  }

  /**
   * @return the dimension entry with the given name ignoring case, null if absent
   */
  public QueryDimension getDimension(String columnName) {
    for (QueryDimension dimension : dimensions) {
      if (dimension.getColumnName().equalsIgnoreCase(columnName)) {
        return dimension;
      }
    }
    return null;
  }

  /**
   * @return the measure entry with the given name ignoring case, null if absent
   */
  public QueryMeasure getMeasure(String columnName) {
    for (QueryMeasure measure : measures) {
      if (measure.getColumnName().equalsIgnoreCase(columnName)) {
        return measure;
      }
    }
    return null;
  }

  public boolean containsColumn(String columnName) {
    return getDimension(columnName) != null || getMeasure(columnName) != null;
  }

  public List<QueryDimension> getDimensions() {
    return dimensions;
  }

  public List<QueryMeasure> getMeasures() {
    return measures;
  }

  public int getNextQueryOrder() {
    return queryOrderCounter.peek();
  }

  public void addDimAggregatorInfo(String columnName, String aggFunction, int queryOrder) {
    List<String> functions = aggFunctions.get(columnName);
    if (functions == null) {
      functions = new ArrayList<>();
      aggFunctions.put(columnName, functions);
      aggOrders.put(columnName, new ArrayList<Integer>());
    }
    functions.add(aggFunction);
    aggOrders.get(columnName).add(queryOrder);
  }

  public QueryPlanBuilder filterExpression(Expression filterExpression) {
    this.filterExpression = filterExpression;
    return this;
  }

  public QueryPlanBuilder queryId(String queryId) {
    this.queryId = queryId;
    return this;
  }

  public QueryPlanBuilder outLocationPath(String outLocationPath) {
    this.outLocationPath = outLocationPath;
    return this;
  }

  /**
   * Create the immutable plan. A query id is generated when none was set.
   */
  public QueryPlan build() {
    if (queryId == null) {
      queryId = QueryIdGenerator.nextQueryId();
    }
    Map<String, DimensionAggregatorInfo> aggregatorInfos = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : aggFunctions.entrySet()) {
      aggregatorInfos.put(entry.getKey(), new DimensionAggregatorInfo(
          entry.getKey(), entry.getValue(), aggOrders.get(entry.getKey())));
    }
    return new QueryPlan(tableIdentifier, dimensions, measures, filterExpression,
        aggregatorInfos, queryId, outLocationPath, true);
  }
}
