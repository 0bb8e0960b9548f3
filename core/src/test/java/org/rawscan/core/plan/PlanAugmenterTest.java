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
import java.util.LinkedHashSet;
import java.util.Set;

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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PlanAugmenterTest {

  private TableSchemaIndex schema;

  private QueryPlanBuilder builder;

  private OutputSchema output;

  private PlanAugmenter augmenter;

  @BeforeEach
  void setUp() throws Exception {
    schema = SalesSchema.create();
    builder = new QueryPlanBuilder(schema.getTableIdentifier());
    output = new ColumnClassifier(false).classify(Arrays.asList(CITY, REVENUE), schema, builder);
    augmenter = new PlanAugmenter();
  }

  private static Set<AttributeReference> columns(AttributeReference... attributes) {
    return new LinkedHashSet<>(Arrays.asList(attributes));
  }

  @Test
  void testMissingDimensionIsAppendedAfterMeasures() throws Exception {
    OutputSchema augmented = augmenter.augment(builder, columns(COUNTRY), output, schema);

    assertEquals(2, builder.getDimension("country").getQueryOrder());
    assertEquals(Arrays.asList(CITY, REVENUE, COUNTRY), augmented.getColumns());
    assertEquals(2, augmented.getProjectedCount());
    assertTrue(augmented.isPredicateOnly(2));
    assertFalse(augmented.isPredicateOnly(1));
    assertEquals(Arrays.asList(CITY, REVENUE), augmented.getProjectedColumns());
  }

  @Test
  void testMissingMeasureIsAppendedToMeasures() throws Exception {
    OutputSchema augmented = augmenter.augment(builder, columns(QUANTITY), output, schema);

    assertEquals(2, builder.getMeasures().size());
    assertEquals(2, builder.getMeasure("quantity").getQueryOrder());
    assertEquals(3, augmented.size());
  }

  @Test
  void testPlannedColumnsAreSkipped() throws Exception {
    AttributeReference upperCity = new AttributeReference("CITY", DataTypes.STRING);
    OutputSchema augmented = augmenter.augment(builder, columns(upperCity, REVENUE), output,
        schema);

    assertSame(output, augmented);
    assertEquals(2, builder.getNextQueryOrder());
  }

  @Test
  void testAugmentingTwiceChangesNothing() throws Exception {
    OutputSchema first = augmenter.augment(builder, columns(COUNTRY, QUANTITY), output, schema);
    int nextOrder = builder.getNextQueryOrder();
    OutputSchema second = augmenter.augment(builder, columns(COUNTRY, QUANTITY), first, schema);

    assertSame(first, second);
    assertEquals(nextOrder, builder.getNextQueryOrder());
    assertEquals(2, builder.getDimensions().size());
    assertEquals(2, builder.getMeasures().size());
  }

  @Test
  void testEmptyDependenciesReturnSameOutput() throws Exception {
    assertSame(output, augmenter.augment(builder,
        Collections.<AttributeReference>emptySet(), output, schema));
  }

  @Test
  void testUnknownColumnLeavesPlanUnchanged() {
    AttributeReference unknown = new AttributeReference("region", DataTypes.STRING);
    SchemaResolutionException e = assertThrows(SchemaResolutionException.class,
        () -> augmenter.augment(builder, columns(COUNTRY, unknown), output, schema));

    assertEquals("region", e.getColumnName());
    assertNull(builder.getDimension("country"));
    assertEquals(2, builder.getNextQueryOrder());
  }
}
