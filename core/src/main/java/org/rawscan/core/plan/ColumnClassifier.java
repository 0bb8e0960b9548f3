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

import org.rawscan.common.exceptions.SchemaResolutionException;
import org.rawscan.common.logging.LogService;
import org.rawscan.common.logging.LogServiceFactory;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.metadata.schema.table.column.DimensionDescriptor;
import org.rawscan.core.metadata.schema.table.column.MeasureDescriptor;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.scan.model.OutputSchema;
import org.rawscan.core.scan.model.QueryPlanBuilder;
import org.rawscan.core.util.RawScanProperties;

/**
 * Splits the requested output columns into dimension and measure entries of a plan.
 *
 * <p>The request order is not kept: columns are laid out as dimensions in schema order
 * followed by measures in schema order, and query orders are assigned in that layout.
 * The returned {@link OutputSchema} is the output order callers must use from then on.
 *
 * <p>A requested column which is neither a dimension nor a measure is dropped from the
 * plan with a warning, or fails the query when
 * {@code rawscan.query.column.resolution.strict} is true.
 */
public class ColumnClassifier {

  private static final LogService LOGGER =
      LogServiceFactory.getLogService(ColumnClassifier.class.getName());

  private final boolean strictResolution;

  public ColumnClassifier() {
    this(RawScanProperties.getInstance().isStrictColumnResolution());
  }

  public ColumnClassifier(boolean strictResolution) {
    this.strictResolution = strictResolution;
  }

  public OutputSchema classify(List<AttributeReference> requestedColumns,
      TableSchemaIndex schema, QueryPlanBuilder builder) throws SchemaResolutionException {
    if (builder.getNextQueryOrder() != 0) {
      throw new IllegalArgumentException("columns must be classified into an empty plan");
    }
    AttributeReference[] dimAttr = new AttributeReference[schema.getDimensions().size()];
    AttributeReference[] msrAttr = new AttributeReference[schema.getMeasures().size()];
    for (AttributeReference attr : requestedColumns) {
      DimensionDescriptor dimension = schema.getDimensionByName(attr.getName());
      if (dimension != null) {
        if (dimAttr[dimension.getOrdinal()] == null) {
          dimAttr[dimension.getOrdinal()] = attr;
        }
        continue;
      }
      MeasureDescriptor measure = schema.getMeasureByName(attr.getName());
      if (measure != null) {
        if (msrAttr[measure.getOrdinal()] == null) {
          msrAttr[measure.getOrdinal()] = attr;
        }
        continue;
      }
      if (strictResolution) {
        throw new SchemaResolutionException(attr.getName(), "Column " + attr.getName()
            + " is neither a dimension nor a measure of table " + schema.getTableIdentifier());
      }
      LOGGER.warn("Column " + attr.getName() + " is neither a dimension nor a measure of table "
          + schema.getTableIdentifier() + ", it is dropped from the query plan");
    }

    List<AttributeReference> outputColumns = new ArrayList<>();
    for (int i = 0; i < dimAttr.length; i++) {
      if (dimAttr[i] != null) {
        builder.addDimension(schema.getDimensions().get(i).getColName());
        outputColumns.add(dimAttr[i]);
      }
    }
    for (int i = 0; i < msrAttr.length; i++) {
      if (msrAttr[i] != null) {
        builder.addMeasure(schema.getMeasures().get(i).getColName());
        outputColumns.add(msrAttr[i]);
      }
    }
    return OutputSchema.of(outputColumns);
  }
}
