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
import java.util.ArrayList;
import java.util.List;

import org.rawscan.core.plan.logical.AttributeReference;

import com.google.common.collect.ImmutableList;

/**
 * Effective output columns of a raw query, addressed by ordinal. Columns at ordinals
 * {@code >= getProjectedCount()} were added only to evaluate predicates after the scan and
 * are not part of the user visible projection.
 */
public final class OutputSchema implements Serializable {

  private static final long serialVersionUID = 7739612904127352012L;

  private final ImmutableList<AttributeReference> columns;

  private final int projectedCount;

  private OutputSchema(List<AttributeReference> columns, int projectedCount) {
    if (projectedCount < 0 || projectedCount > columns.size()) {
      throw new IllegalArgumentException("projected count " + projectedCount
          + " out of range for " + columns.size() + " columns");
    }
    this.columns = ImmutableList.copyOf(columns);
    this.projectedCount = projectedCount;
  }

  /**
   * Create an output schema in which every column is projected
   */
  public static OutputSchema of(List<AttributeReference> columns) {
    return new OutputSchema(columns, columns.size());
  }

  /**
   * Return a new schema with the given columns appended after the existing ones. The
   * appended columns are not projected.
   */
  public OutputSchema appendPredicateColumns(List<AttributeReference> extraColumns) {
    if (extraColumns.isEmpty()) {
      return this;
    }
    List<AttributeReference> all = new ArrayList<>(columns);
    all.addAll(extraColumns);
    return new OutputSchema(all, projectedCount);
  }

  public List<AttributeReference> getColumns() {
    return columns;
  }

  public AttributeReference getColumn(int ordinal) {
    return columns.get(ordinal);
  }

  public int size() {
    return columns.size();
  }

  public int getProjectedCount() {
    return projectedCount;
  }

  public List<AttributeReference> getProjectedColumns() {
    return columns.subList(0, projectedCount);
  }

  /**
   * @return true if the column at this ordinal exists only for predicate evaluation
   */
  public boolean isPredicateOnly(int ordinal) {
    return ordinal >= projectedCount;
  }

  /**
   * @return ordinal of the column with this name ignoring case, -1 if absent
   */
  public int indexOf(String columnName) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getName().equalsIgnoreCase(columnName)) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    return "OutputSchema" + columns + " projected=" + projectedCount;
  }
}
