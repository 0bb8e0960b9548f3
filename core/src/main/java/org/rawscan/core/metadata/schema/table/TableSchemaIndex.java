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

package org.rawscan.core.metadata.schema.table;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.core.metadata.TableIdentifier;
import org.rawscan.core.metadata.schema.table.column.ColumnDescriptor;
import org.rawscan.core.metadata.schema.table.column.DimensionDescriptor;
import org.rawscan.core.metadata.schema.table.column.MeasureDescriptor;

/**
 * Read only view of a table schema. Column lookup by name is case insensitive.
 * Use {@link TableSchemaBuilder} to create instance.
 */
@InterfaceAudience.User
public class TableSchemaIndex implements Serializable {

  private static final long serialVersionUID = -5862741321563749103L;

  private final TableIdentifier tableIdentifier;

  /**
   * dimensions in schema order
   */
  private final List<DimensionDescriptor> dimensions;

  /**
   * measures in schema order
   */
  private final List<MeasureDescriptor> measures;

  private final Map<String, DimensionDescriptor> dimensionByName;

  private final Map<String, MeasureDescriptor> measureByName;

  TableSchemaIndex(TableIdentifier tableIdentifier, List<DimensionDescriptor> dimensions,
      List<MeasureDescriptor> measures) {
    this.tableIdentifier = tableIdentifier;
    this.dimensions = Collections.unmodifiableList(dimensions);
    this.measures = Collections.unmodifiableList(measures);
    this.dimensionByName = new HashMap<>();
    for (DimensionDescriptor dimension : dimensions) {
      dimensionByName.put(dimension.getColName().toLowerCase(Locale.ROOT), dimension);
    }
    this.measureByName = new HashMap<>();
    for (MeasureDescriptor measure : measures) {
      measureByName.put(measure.getColName().toLowerCase(Locale.ROOT), measure);
    }
  }

  public TableIdentifier getTableIdentifier() {
    return tableIdentifier;
  }

  public String getTableName() {
    return tableIdentifier.getTableName();
  }

  public String getDatabaseName() {
    return tableIdentifier.getDatabaseName();
  }

  public List<DimensionDescriptor> getDimensions() {
    return dimensions;
  }

  public List<MeasureDescriptor> getMeasures() {
    return measures;
  }

  /**
   * @return dimension with the given name, null if the table has no such dimension
   */
  public DimensionDescriptor getDimensionByName(String columnName) {
    return dimensionByName.get(columnName.toLowerCase(Locale.ROOT));
  }

  /**
   * @return measure with the given name, null if the table has no such measure
   */
  public MeasureDescriptor getMeasureByName(String columnName) {
    return measureByName.get(columnName.toLowerCase(Locale.ROOT));
  }

  /**
   * @return the dimension or measure with the given name, null if neither exists
   */
  public ColumnDescriptor getColumnByName(String columnName) {
    DimensionDescriptor dimension = getDimensionByName(columnName);
    if (dimension != null) {
      return dimension;
    }
    return getMeasureByName(columnName);
  }

  @Override
  public String toString() {
    return tableIdentifier + " dimensions=" + dimensions + " measures=" + measures;
  }
}
