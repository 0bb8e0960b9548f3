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

import java.util.Arrays;
import java.util.Collections;

import org.rawscan.common.exceptions.SchemaResolutionException;
import org.rawscan.core.metadata.SalesSchema;
import org.rawscan.core.metadata.datatype.DataTypes;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.scan.model.OutputSchema;
import org.rawscan.core.scan.model.QueryPlanBuilder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.rawscan.core.metadata.SalesSchema.CITY;
import static org.rawscan.core.metadata.SalesSchema.COUNTRY;
import static org.rawscan.core.metadata.SalesSchema.QUANTITY;
import static org.rawscan.core.metadata.SalesSchema.REVENUE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ColumnClassifierTest {

  private static final AttributeReference BOGUS = new AttributeReference("bogus", DataTypes.INT);

  private TableSchemaIndex schema;

  private QueryPlanBuilder builder;

  @BeforeEach
  void setUp() {
    schema = SalesSchema.create();
    builder = new QueryPlanBuilder(schema.getTableIdentifier());
  }

  @Test
  void testRequestedColumnsAreReorderedDimensionsFirst() throws Exception {
    OutputSchema output = new ColumnClassifier(false)
        .classify(Arrays.asList(REVENUE, CITY, QUANTITY, COUNTRY), schema, builder);

    assertEquals(Arrays.asList(COUNTRY, CITY, QUANTITY, REVENUE), output.getColumns());
    assertEquals(4, output.getProjectedCount());
    assertEquals("country", builder.getDimensions().get(0).getColumnName());
    assertEquals(0, builder.getDimensions().get(0).getQueryOrder());
    assertEquals("city", builder.getDimensions().get(1).getColumnName());
    assertEquals(1, builder.getDimensions().get(1).getQueryOrder());
    assertEquals("quantity", builder.getMeasures().get(0).getColumnName());
    assertEquals(2, builder.getMeasures().get(0).getQueryOrder());
    assertEquals("revenue", builder.getMeasures().get(1).getColumnName());
    assertEquals(3, builder.getMeasures().get(1).getQueryOrder());
  }

  @Test
  void testMeasureOrdersContinueAfterDimensions() throws Exception {
    new ColumnClassifier(false).classify(Arrays.asList(REVENUE, CITY), schema, builder);

    assertEquals(0, builder.getDimension("city").getQueryOrder());
    assertEquals(1, builder.getMeasure("revenue").getQueryOrder());
    assertEquals(2, builder.getNextQueryOrder());
  }

  @Test
  void testUnknownColumnIsDroppedByDefault() throws Exception {
    OutputSchema output = new ColumnClassifier(false)
        .classify(Arrays.asList(CITY, BOGUS, REVENUE), schema, builder);

    assertEquals(Arrays.asList(CITY, REVENUE), output.getColumns());
    assertEquals(1, builder.getDimensions().size());
    assertEquals(1, builder.getMeasures().size());
  }

  @Test
  void testUnknownColumnFailsInStrictMode() {
    SchemaResolutionException e = assertThrows(SchemaResolutionException.class,
        () -> new ColumnClassifier(true)
            .classify(Arrays.asList(CITY, BOGUS), schema, builder));

    assertEquals("bogus", e.getColumnName());
  }

  @Test
  void testNoResolvableColumnGivesEmptyOutput() throws Exception {
    OutputSchema output = new ColumnClassifier(false)
        .classify(Collections.singletonList(BOGUS), schema, builder);

    assertEquals(0, output.size());
    assertTrue(builder.getDimensions().isEmpty());
    assertTrue(builder.getMeasures().isEmpty());
  }

  @Test
  void testColumnRequestedTwiceIsPlannedOnce() throws Exception {
    AttributeReference upperCity = new AttributeReference("CITY", DataTypes.STRING);
    OutputSchema output = new ColumnClassifier(false)
        .classify(Arrays.asList(CITY, upperCity), schema, builder);

    assertEquals(1, output.size());
    assertEquals("city", output.getColumn(0).getName());
    assertEquals(1, builder.getDimensions().size());
  }

  @Test
  void testPlanUsesSchemaColumnName() throws Exception {
    AttributeReference mixedCase = new AttributeReference("City", DataTypes.STRING);
    OutputSchema output = new ColumnClassifier(false)
        .classify(Collections.singletonList(mixedCase), schema, builder);

    assertEquals("City", output.getColumn(0).getName());
    assertEquals("city", builder.getDimensions().get(0).getColumnName());
  }

  @Test
  void testBuilderMustBeEmpty() {
    builder.addDimension("city");

    assertThrows(IllegalArgumentException.class, () -> new ColumnClassifier(false)
        .classify(Collections.singletonList(REVENUE), schema, builder));
  }
}
