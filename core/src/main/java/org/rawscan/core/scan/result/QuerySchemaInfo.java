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

package org.rawscan.core.scan.result;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import org.rawscan.core.metadata.datatype.DataType;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.scan.model.OutputSchema;
import org.rawscan.core.scan.model.QueryColumn;
import org.rawscan.core.scan.model.QueryDimension;
import org.rawscan.core.scan.model.QueryMeasure;
import org.rawscan.core.scan.model.QueryPlan;

/**
 * Shape of the rows of one query, shared by the scan engine and the row decoders.
 *
 * <p>Holds two mappings built once per plan. {@code queryOrder[ordinal]} is the query
 * order of the output column at that ordinal. {@code storageOffsets[queryOrder]} tells
 * where the value of that entry is stored in a raw row: a value {@code >= 0} is the index
 * in the measure array, a value {@code < 0} is {@code -(index + 1)} of the dimension in
 * the decoded dimension key. While dimensions precede all measures in query order, the
 * measure offset equals {@code queryOrder - dimensionCount}; dimensions added to the plan
 * after the measures break that shortcut, which is why the table is kept explicitly.
 */
public class QuerySchemaInfo implements Serializable {

  private static final long serialVersionUID = -4712303950817316721L;

  private static final int NO_ENTRY = Integer.MIN_VALUE;

  private final String[] queryDimensions;

  private final String[] queryMeasures;

  private final int[] queryOrder;

  private final int[] storageOffsets;

  private final DataType[] outputTypes;

  private final int projectedCount;

  private QuerySchemaInfo(String[] queryDimensions, String[] queryMeasures, int[] queryOrder,
      int[] storageOffsets, DataType[] outputTypes, int projectedCount) {
    this.queryDimensions = queryDimensions;
    this.queryMeasures = queryMeasures;
    this.queryOrder = queryOrder;
    this.storageOffsets = storageOffsets;
    this.outputTypes = outputTypes;
    this.projectedCount = projectedCount;
  }

  /**
   * Build the mappings for a plan and the output its rows are read through
   *
   * @throws IllegalArgumentException if an output column has no entry in the plan
   */
  public static QuerySchemaInfo create(QueryPlan plan, OutputSchema output) {
    List<QueryDimension> dimensions = plan.getDimensions();
    List<QueryMeasure> measures = plan.getMeasures();
    int maxOrder = -1;
    for (QueryColumn column : dimensions) {
      maxOrder = Math.max(maxOrder, column.getQueryOrder());
    }
    for (QueryColumn column : measures) {
      maxOrder = Math.max(maxOrder, column.getQueryOrder());
    }
    int[] storageOffsets = new int[maxOrder + 1];
    Arrays.fill(storageOffsets, NO_ENTRY);
    String[] dimensionNames = new String[dimensions.size()];
    for (int i = 0; i < dimensions.size(); i++) {
      dimensionNames[i] = dimensions.get(i).getColumnName();
      storageOffsets[dimensions.get(i).getQueryOrder()] = -(i + 1);
    }
    String[] measureNames = new String[measures.size()];
    for (int i = 0; i < measures.size(); i++) {
      measureNames[i] = measures.get(i).getColumnName();
      storageOffsets[measures.get(i).getQueryOrder()] = i;
    }

    int[] queryOrder = new int[output.size()];
    DataType[] outputTypes = new DataType[output.size()];
    for (int ordinal = 0; ordinal < output.size(); ordinal++) {
      AttributeReference attr = output.getColumn(ordinal);
      QueryColumn column = findColumn(dimensions, attr.getName());
      if (column == null) {
        column = findColumn(measures, attr.getName());
      }
      if (column == null) {
        throw new IllegalArgumentException(
            "Output column " + attr.getName() + " has no entry in query plan " + plan);
      }
      queryOrder[ordinal] = column.getQueryOrder();
      outputTypes[ordinal] = attr.getDataType();
    }
    return new QuerySchemaInfo(dimensionNames, measureNames, queryOrder, storageOffsets,
        outputTypes, output.getProjectedCount());
  }

  private static QueryColumn findColumn(List<? extends QueryColumn> columns, String name) {
    for (QueryColumn column : columns) {
      if (column.getColumnName().equalsIgnoreCase(name)) {
        return column;
      }
    }
    return null;
  }

  public String[] getQueryDimensions() {
    return queryDimensions.clone();
  }

  public String[] getQueryMeasures() {
    return queryMeasures.clone();
  }

  public int getDimensionCount() {
    return queryDimensions.length;
  }

  public int getMeasureCount() {
    return queryMeasures.length;
  }

  /**
   * @return query order of every output ordinal
   */
  public int[] getQueryOrder() {
    return queryOrder.clone();
  }

  public int getQueryOrder(int ordinal) {
    return queryOrder[ordinal];
  }

  /**
   * @return storage offset of the output column at the ordinal, see class comment
   */
  public int getStorageOffset(int ordinal) {
    return storageOffsets[queryOrder[ordinal]];
  }

  /**
   * @return declared type of the output column at the ordinal, may be null
   */
  public DataType getOutputType(int ordinal) {
    return outputTypes[ordinal];
  }

  public int getOutputColumnCount() {
    return queryOrder.length;
  }

  /**
   * @return number of leading output ordinals visible to the user
   */
  public int getProjectedColumnCount() {
    return projectedCount;
  }
}
