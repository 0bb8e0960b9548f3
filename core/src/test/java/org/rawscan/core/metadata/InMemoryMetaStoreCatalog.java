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

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.metadata.schema.table.column.DimensionDescriptor;
import org.rawscan.core.metadata.schema.table.column.MeasureDescriptor;

/**
 * Catalog keeping schemas in memory, for tests
 */
public class InMemoryMetaStoreCatalog implements MetaStoreCatalog {

  private final String storePath;

  private final Map<TableIdentifier, TableSchemaIndex> tables = new HashMap<>();

  private final Map<TableIdentifier, long[]> timestamps = new HashMap<>();

  public InMemoryMetaStoreCatalog(String storePath) {
    this.storePath = storePath;
  }

  public void addTable(TableSchemaIndex schema, long creationTime, long lastUpdatedTime) {
    tables.put(schema.getTableIdentifier(), schema);
    timestamps.put(schema.getTableIdentifier(), new long[] { creationTime, lastUpdatedTime });
  }

  @Override
  public TableSchemaIndex getTableSchema(TableIdentifier table) throws IOException {
    TableSchemaIndex schema = tables.get(table);
    if (schema == null) {
      throw new IOException("Table " + table + " does not exist");
    }
    return schema;
  }

  @Override
  public DimensionDescriptor resolveDimension(TableIdentifier table, String columnName)
      throws IOException {
    return getTableSchema(table).getDimensionByName(columnName);
  }

  @Override
  public MeasureDescriptor resolveMeasure(TableIdentifier table, String columnName)
      throws IOException {
    return getTableSchema(table).getMeasureByName(columnName);
  }

  @Override
  public long getTableCreationTime(TableIdentifier table) {
    return timestamps.get(table)[0];
  }

  @Override
  public long getSchemaLastUpdatedTime(TableIdentifier table) {
    return timestamps.get(table)[1];
  }

  @Override
  public String getStorePath() {
    return storePath;
  }
}
