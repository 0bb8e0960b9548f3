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

package org.rawscan.core.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.rawscan.common.exceptions.SchemaResolutionException;
import org.rawscan.common.logging.LogService;
import org.rawscan.common.logging.LogServiceFactory;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.metadata.schema.table.column.ColumnDescriptor;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.scan.model.OutputSchema;
import org.rawscan.core.scan.model.QueryPlanBuilder;

/**
 * Adds to a plan the columns residual predicates need but the query did not select.
 * Added entries continue the query order sequence of the plan, existing entries are
 * never renumbered. The added columns are appended to the output after the projection
 * boundary, so they can be left out of the rows returned to the user.
 */
public class PlanAugmenter {

  private static final LogService LOGGER =
      LogServiceFactory.getLogService(PlanAugmenter.class.getName());

  /**
   * @param builder plan being built
   * @param attributesNeedToDecode columns referenced by residual predicates
   * @param output current output of the plan
   * @param schema table schema
   * @return output with the added columns appended, the same instance if none was added
   * @throws SchemaResolutionException if a column is neither a dimension nor a measure;
   *                                   the builder is left unchanged in that case
   */
  public OutputSchema augment(QueryPlanBuilder builder,
      Set<AttributeReference> attributesNeedToDecode, OutputSchema output,
      TableSchemaIndex schema) throws SchemaResolutionException {
    if (attributesNeedToDecode.isEmpty()) {
      return output;
    }
    // resolve everything first so that a failure leaves the plan untouched
    List<AttributeReference> extraAttributes = new ArrayList<>();
    List<ColumnDescriptor> extraColumns = new ArrayList<>();
    for (AttributeReference attr : attributesNeedToDecode) {
      if (builder.containsColumn(attr.getName()) || extraAttributes.contains(attr)) {
        continue;
      }
      ColumnDescriptor column = schema.getColumnByName(attr.getName());
      if (column == null) {
        throw new SchemaResolutionException(attr.getName(), "Column " + attr.getName()
            + " used in filter is neither a dimension nor a measure of table "
            + schema.getTableIdentifier());
      }
      extraAttributes.add(attr);
      extraColumns.add(column);
    }
    if (extraColumns.isEmpty()) {
      return output;
    }
    List<AttributeReference> outputExtras = new ArrayList<>(extraAttributes.size());
    for (int i = 0; i < extraColumns.size(); i++) {
      ColumnDescriptor column = extraColumns.get(i);
      if (column.isDimension()) {
        builder.addDimension(column.getColName());
      } else {
        builder.addMeasure(column.getColName());
      }
      if (output.indexOf(extraAttributes.get(i).getName()) < 0) {
        outputExtras.add(extraAttributes.get(i));
      }
    }
    LOGGER.info("Added columns " + extraAttributes + " to the plan of table "
        + schema.getTableIdentifier() + " for filter evaluation");
    return output.appendPredicateColumns(outputExtras);
  }
}
