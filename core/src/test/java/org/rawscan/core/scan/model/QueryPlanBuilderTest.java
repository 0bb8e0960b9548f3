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

import org.rawscan.core.metadata.TableIdentifier;
import org.rawscan.core.metadata.datatype.DataTypes;
import org.rawscan.core.scan.expression.ColumnExpression;
import org.rawscan.core.scan.expression.LiteralExpression;
import org.rawscan.core.scan.expression.conditional.EqualToExpression;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryPlanBuilderTest {

  private final TableIdentifier table = new TableIdentifier("retail", "sales");

  @Test
  void testDimensionsAndMeasuresShareOneOrderCounter() {
    QueryPlanBuilder builder = new QueryPlanBuilder(table);
    assertEquals(0, builder.addDimension("city").getQueryOrder());
    assertEquals(1, builder.addMeasure("revenue").getQueryOrder());
    assertEquals(2, builder.addDimension("country").getQueryOrder());
    assertEquals(3, builder.getNextQueryOrder());
    assertEquals(3, builder.build().getColumnCount());
  }

  @Test
  void testLookupIgnoresCase() {
    QueryPlanBuilder builder = new QueryPlanBuilder(table);
    builder.addDimension("city");
    builder.addMeasure("revenue");

    assertNotNull(builder.getDimension("CITY"));
    assertNotNull(builder.getMeasure("Revenue"));
    assertNull(builder.getMeasure("city"));
    assertTrue(builder.containsColumn("REVENUE"));
  }

  @Test
  void testBuiltPlanIsNotAffectedByLaterChanges() {
    QueryPlanBuilder builder = new QueryPlanBuilder(table);
    builder.addDimension("city");
    builder.addDimAggregatorInfo("city", "max", 0);
    QueryPlan plan = builder.queryId("1").build();

    builder.addDimension("country");
    builder.addDimAggregatorInfo("city", "min", 0);

    assertEquals(1, plan.getDimensions().size());
    assertEquals(1, plan.getDimAggregatorInfos().get("city").getAggList().size());
    assertThrows(UnsupportedOperationException.class,
        () -> plan.getDimensions().add(new QueryDimension("product", 5)));
    assertThrows(UnsupportedOperationException.class,
        () -> plan.getDimAggregatorInfos().get("city").getAggList().add("sum"));
  }

  @Test
  void testRawDetailQueryDefaults() {
    QueryPlan plan = new QueryPlanBuilder(table).build();

    assertTrue(plan.isRawDetailQuery());
    assertTrue(plan.getSortedDimensions().isEmpty());
    assertTrue(plan.getQueryId().matches("\\d+"));
    assertEquals("retail", plan.getDatabaseName());
    assertEquals("sales", plan.getTableName());
  }

  @Test
  void testNegativeQueryOrderIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new QueryMeasure("revenue", -1));
  }

  @Test
  void testPlanIsWrittenAsJson() {
    QueryPlanBuilder builder = new QueryPlanBuilder(table);
    builder.addDimension("city");
    builder.addMeasure("revenue");
    builder.addDimAggregatorInfo("city", "count", 0);
    builder.filterExpression(new EqualToExpression(
        new ColumnExpression("city", DataTypes.STRING),
        new LiteralExpression("Oslo", DataTypes.STRING)));
    QueryPlan plan = builder.queryId("99").outLocationPath("/store").build();

    JsonObject json = JsonParser.parseString(QueryPlanJsonWriter.toJson(plan)).getAsJsonObject();
    assertEquals("99", json.get("queryId").getAsString());
    assertEquals("sales", json.get("table").getAsString());
    assertEquals("/store", json.get("outLocationPath").getAsString());
    assertEquals("city",
        json.getAsJsonArray("dimensions").get(0).getAsJsonObject().get("column").getAsString());
    assertEquals(1, json.getAsJsonArray("measures").get(0).getAsJsonObject()
        .get("queryOrder").getAsInt());
    assertEquals(plan.getFilterExpression().getString(), json.get("filter").getAsString());
    assertEquals("count", json.getAsJsonArray("dimAggregatorInfos").get(0).getAsJsonObject()
        .get("function").getAsString());
  }
}
