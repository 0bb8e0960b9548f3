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

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.annotations.InterfaceStability;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.metadata.schema.table.column.DimensionDescriptor;
import org.rawscan.core.metadata.schema.table.column.MeasureDescriptor;

/**
 * Catalog supplying table schemas and the timestamps the scan engine uses to validate
 * its caches. Implemented outside this project.
 */
@InterfaceAudience.Developer
@InterfaceStability.Evolving
public interface MetaStoreCatalog {

  /**
   * Return the schema snapshot of the table
   *
   * @throws IOException if the table does not exist or its schema cannot be read
   */
  TableSchemaIndex getTableSchema(TableIdentifier table) throws IOException;

  /**
   * Return the dimension of the table with the given name, null if absent
   */
  DimensionDescriptor resolveDimension(TableIdentifier table, String columnName)
      throws IOException;

  /**
   * Return the measure of the table with the given name, null if absent
   */
  MeasureDescriptor resolveMeasure(TableIdentifier table, String columnName)
      throws IOException;

  long getTableCreationTime(TableIdentifier table);

  long getSchemaLastUpdatedTime(TableIdentifier table);

  String getStorePath();
}
