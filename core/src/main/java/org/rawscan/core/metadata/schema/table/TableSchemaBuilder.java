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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.rawscan.common.exceptions.MalformedSchemaException;
import org.rawscan.common.logging.LogService;
import org.rawscan.common.logging.LogServiceFactory;
import org.rawscan.core.constants.RawScanCommonConstants;
import org.rawscan.core.metadata.TableIdentifier;
import org.rawscan.core.metadata.TableProperty;
import org.rawscan.core.metadata.datatype.DataType;
import org.rawscan.core.metadata.encoder.Encoding;
import org.rawscan.core.metadata.schema.table.column.DimensionDescriptor;
import org.rawscan.core.metadata.schema.table.column.MeasureDescriptor;

public class TableSchemaBuilder {

  private static final LogService LOGGER =
      LogServiceFactory.getLogService(TableSchemaBuilder.class.getName());

  // following members are required to build TableSchemaIndex

  private String databaseName;
  private String tableName;
  private Map<String, String> tableProperties = new HashMap<>();

  // columns in declaration order, per family
  private List<Field> dimensionFields = new ArrayList<>();
  private List<Field> measureFields = new ArrayList<>();

  private TableSchemaBuilder() { }

  public static TableSchemaBuilder newInstance() {
    return new TableSchemaBuilder();
  }

  public TableSchemaIndex create() throws MalformedSchemaException {
    if (tableName == null) {
      throw new IllegalArgumentException("must provide table name");
    }

    if (databaseName == null) {
      databaseName = RawScanCommonConstants.DATABASE_DEFAULT_NAME;
    }

    validateSchema();

    TableProperty tableProperty = new TableProperty(tableProperties);
    for (String excluded : tableProperty.getDictionaryExcludeColumns()) {
      if (!containsField(dimensionFields, excluded)) {
        throw new MalformedSchemaException(RawScanCommonConstants.DICTIONARY_EXCLUDE
            + " column " + excluded + " is not a dimension of table " + tableName);
      }
    }

    List<DimensionDescriptor> dimensions = new ArrayList<>(dimensionFields.size());
    for (Field field : dimensionFields) {
      List<Encoding> encodings = tableProperty.isDictionaryExcluded(field.name) ?
          Collections.<Encoding>emptyList() : Collections.singletonList(Encoding.DICTIONARY);
      dimensions.add(
          new DimensionDescriptor(field.name, field.dataType, dimensions.size(), encodings));
    }
    List<MeasureDescriptor> measures = new ArrayList<>(measureFields.size());
    for (Field field : measureFields) {
      measures.add(new MeasureDescriptor(field.name, field.dataType, measures.size()));
    }
    TableSchemaIndex schema = new TableSchemaIndex(
        new TableIdentifier(databaseName, tableName), dimensions, measures);
    LOGGER.info("Created schema for table " + schema.getTableIdentifier() + " with "
        + dimensions.size() + " dimensions and " + measures.size() + " measures");
    return schema;
  }

  public TableSchemaBuilder databaseName(String databaseName) {
    this.databaseName = databaseName;
    return this;
  }

  public TableSchemaBuilder tableName(String tableName) {
    this.tableName = tableName;
    return this;
  }

  public TableSchemaBuilder tableProperties(Map<String, String> tableProperties) {
    this.tableProperties = new HashMap<>(tableProperties);
    return this;
  }

  public TableSchemaBuilder tableProperty(String key, String value) {
    this.tableProperties.put(key, value);
    return this;
  }

  /**
   * Add a dimension, dimensions keep the order in which they are added
   */
  public TableSchemaBuilder dimension(String columnName, DataType dataType) {
    dimensionFields.add(new Field(columnName, dataType));
    return this;
  }

  /**
   * Add a measure, measures keep the order in which they are added
   */
  public TableSchemaBuilder measure(String columnName, DataType dataType) {
    measureFields.add(new Field(columnName, dataType));
    return this;
  }

  // check whether there are duplicated column
  private void validateSchema() throws MalformedSchemaException {
    Set<String> fieldNames = new HashSet<>();
    List<Field> fields = new ArrayList<>(dimensionFields);
    fields.addAll(measureFields);
    for (Field field : fields) {
      if (field.name == null || field.dataType == null) {
        throw new MalformedSchemaException("column name and data type must be provided");
      }
      if (!fieldNames.add(field.name.toLowerCase(Locale.ROOT))) {
        throw new MalformedSchemaException(
            "Duplicated column found, column name " + field.name);
      }
    }
  }

  private static boolean containsField(List<Field> fields, String columnName) {
    for (Field field : fields) {
      if (field.name.equalsIgnoreCase(columnName)) {
        return true;
      }
    }
    return false;
  }

  private static class Field {
    private final String name;
    private final DataType dataType;

    Field(String name, DataType dataType) {
      this.name = name;
      this.dataType = dataType;
    }
  }

}
