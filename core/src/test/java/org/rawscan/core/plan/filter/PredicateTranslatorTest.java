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

package org.rawscan.core.plan.filter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.rawscan.common.exceptions.SchemaResolutionException;
import org.rawscan.core.metadata.SalesSchema;
import org.rawscan.core.metadata.datatype.DataTypes;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.metadata.schema.table.column.ColumnDescriptor;
import org.rawscan.core.plan.logical.And;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.plan.logical.Cast;
import org.rawscan.core.plan.logical.Comparison;
import org.rawscan.core.plan.logical.ComparisonOperator;
import org.rawscan.core.plan.logical.FunctionCall;
import org.rawscan.core.plan.logical.In;
import org.rawscan.core.plan.logical.IsNotNull;
import org.rawscan.core.plan.logical.IsNull;
import org.rawscan.core.plan.logical.Literal;
import org.rawscan.core.plan.logical.LogicalExpression;
import org.rawscan.core.plan.logical.Not;
import org.rawscan.core.plan.logical.Or;
import org.rawscan.core.scan.expression.ColumnExpression;
import org.rawscan.core.scan.expression.Expression;
import org.rawscan.core.scan.expression.LiteralExpression;
import org.rawscan.core.scan.expression.conditional.EqualToExpression;
import org.rawscan.core.scan.expression.conditional.GreaterThanExpression;
import org.rawscan.core.scan.expression.conditional.InExpression;
import org.rawscan.core.scan.expression.conditional.LessThanEqualToExpression;
import org.rawscan.core.scan.expression.conditional.NotEqualsExpression;
import org.rawscan.core.scan.expression.conditional.NotInExpression;
import org.rawscan.core.scan.expression.logical.AndExpression;
import org.rawscan.core.scan.expression.logical.OrExpression;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.rawscan.core.metadata.SalesSchema.CITY;
import static org.rawscan.core.metadata.SalesSchema.COUNTRY;
import static org.rawscan.core.metadata.SalesSchema.PRODUCT;
import static org.rawscan.core.metadata.SalesSchema.QUANTITY;
import static org.rawscan.core.metadata.SalesSchema.REVENUE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PredicateTranslatorTest {

  private TableSchemaIndex schema;

  private PredicateTranslator translator;

  @BeforeEach
  void setUp() {
    schema = SalesSchema.create();
    translator = new PredicateTranslator();
  }

  private static Literal string(String value) {
    return new Literal(value, DataTypes.STRING);
  }

  private static Literal integer(int value) {
    return new Literal(value, DataTypes.INT);
  }

  private static FunctionCall lower(LogicalExpression argument) {
    return new FunctionCall("lower", Collections.singletonList(argument));
  }

  @Test
  void testNoPredicateGivesEmptyTranslation() throws Exception {
    assertSame(FilterTranslation.EMPTY,
        translator.translate(Collections.<LogicalExpression>emptyList(), schema));
    assertSame(FilterTranslation.EMPTY, translator.translate(null, schema));
    assertTrue(FilterTranslation.EMPTY.isEmpty());
  }

  @Test
  void testEqualityOnDictionaryDimensionIsPushedDown() throws Exception {
    FilterTranslation translation = translator.translate(
        Collections.singletonList(Comparison.equalTo(CITY, string("Paris"))), schema);

    EqualToExpression filter = (EqualToExpression) translation.getFilterExpression();
    ColumnExpression column = (ColumnExpression) filter.getLeft();
    assertEquals("city", column.getColumnName());
    assertTrue(column.isDimension());
    assertEquals("Paris", ((LiteralExpression) filter.getRight()).getLiteralExpValue());
    assertFalse(filter.isNull());
    assertTrue(translation.getDecodeDependencies().isEmpty());
    assertTrue(translation.getResidualPredicates().isEmpty());
    assertFalse(translation.isEmpty());
  }

  @Test
  void testLiteralOnLeftSwapsOperator() throws Exception {
    Comparison predicate = new Comparison(ComparisonOperator.LESS_THAN, integer(5), QUANTITY);
    Expression filter =
        translator.translate(Collections.singletonList(predicate), schema).getFilterExpression();

    GreaterThanExpression greaterThan = (GreaterThanExpression) filter;
    assertEquals("quantity", ((ColumnExpression) greaterThan.getLeft()).getColumnName());
    assertEquals(5, ((LiteralExpression) greaterThan.getRight()).getLiteralExpValue());
  }

  @Test
  void testCastOnColumnIsStripped() throws Exception {
    Comparison predicate = new Comparison(ComparisonOperator.LESS_THAN_OR_EQUAL,
        new Cast(QUANTITY, DataTypes.LONG), new Literal(10L, DataTypes.LONG));
    Expression filter =
        translator.translate(Collections.singletonList(predicate), schema).getFilterExpression();

    LessThanEqualToExpression lessThan = (LessThanEqualToExpression) filter;
    assertEquals("quantity", ((ColumnExpression) lessThan.getLeft()).getColumnName());
  }

  @Test
  void testPredicateOnNonDictionaryDimensionIsResidual() throws Exception {
    Comparison predicate = Comparison.equalTo(COUNTRY, string("US"));
    FilterTranslation translation =
        translator.translate(Collections.singletonList(predicate), schema);

    assertNull(translation.getFilterExpression());
    assertEquals(Collections.singletonList(predicate), translation.getResidualPredicates());
    assertEquals(Collections.singleton(COUNTRY), translation.getDecodeDependencies());
    assertFalse(translation.isEmpty());
  }

  @Test
  void testConjunctionIsSplitIntoPushedAndResidualParts() throws Exception {
    Comparison pushed = Comparison.equalTo(CITY, string("Paris"));
    Comparison residual = Comparison.equalTo(lower(PRODUCT), string("tea"));
    FilterTranslation translation =
        translator.translate(Collections.singletonList(new And(pushed, residual)), schema);

    assertTrue(translation.getFilterExpression() instanceof EqualToExpression);
    assertEquals(Collections.<LogicalExpression>singletonList(residual),
        translation.getResidualPredicates());
    assertEquals(Collections.singleton(PRODUCT), translation.getDecodeDependencies());
  }

  @Test
  void testDisjunctionWithResidualSideIsResidualAsWhole() throws Exception {
    Or predicate = new Or(Comparison.equalTo(CITY, string("Paris")),
        Comparison.equalTo(lower(PRODUCT), string("tea")));
    FilterTranslation translation =
        translator.translate(Collections.singletonList(predicate), schema);

    assertNull(translation.getFilterExpression());
    assertEquals(Collections.<LogicalExpression>singletonList(predicate),
        translation.getResidualPredicates());
    assertEquals(Arrays.asList(CITY, PRODUCT),
        Arrays.asList(translation.getDecodeDependencies().toArray()));
  }

  @Test
  void testDisjunctionOfPushableSidesIsPushedDown() throws Exception {
    Or predicate = new Or(Comparison.equalTo(CITY, string("Paris")),
        new Comparison(ComparisonOperator.GREATER_THAN, REVENUE,
            new Literal(10.0d, DataTypes.DOUBLE)));
    FilterTranslation translation =
        translator.translate(Collections.singletonList(predicate), schema);

    OrExpression filter = (OrExpression) translation.getFilterExpression();
    assertTrue(filter.getLeft() instanceof EqualToExpression);
    assertTrue(filter.getRight() instanceof GreaterThanExpression);
    assertTrue(translation.getResidualPredicates().isEmpty());
  }

  @Test
  void testTopLevelPredicatesAreAndedInOrder() throws Exception {
    List<LogicalExpression> predicates = Arrays.<LogicalExpression>asList(
        Comparison.equalTo(CITY, string("Paris")),
        Comparison.equalTo(PRODUCT, string("tea")));
    AndExpression filter =
        (AndExpression) translator.translate(predicates, schema).getFilterExpression();

    assertEquals("city",
        ((ColumnExpression) ((EqualToExpression) filter.getLeft()).getLeft()).getColumnName());
    assertEquals("product",
        ((ColumnExpression) ((EqualToExpression) filter.getRight()).getLeft()).getColumnName());
  }

  @Test
  void testInListAndNegatedInList() throws Exception {
    In in = new In(CITY, Arrays.asList(string("Paris"), string("Rome")));
    Expression filter =
        translator.translate(Collections.singletonList(in), schema).getFilterExpression();
    InExpression inExpression = (InExpression) filter;
    assertEquals(2, inExpression.getRight().getChildren().size());

    Expression negated = translator
        .translate(Collections.singletonList(new Not(in)), schema).getFilterExpression();
    assertTrue(negated instanceof NotInExpression);
  }

  @Test
  void testInListWithNonLiteralIsResidual() throws Exception {
    In in = new In(CITY, Arrays.<LogicalExpression>asList(string("Paris"), PRODUCT));
    FilterTranslation translation = translator.translate(Collections.singletonList(in), schema);

    assertNull(translation.getFilterExpression());
    assertEquals(Arrays.asList(CITY, PRODUCT),
        Arrays.asList(translation.getDecodeDependencies().toArray()));
  }

  @Test
  void testNegatedEquality() throws Exception {
    Expression filter = translator.translate(Collections.singletonList(
        new Not(Comparison.equalTo(CITY, string("Paris")))), schema).getFilterExpression();

    assertTrue(filter instanceof NotEqualsExpression);
  }

  @Test
  void testNegatedRangeIsResidual() throws Exception {
    Not predicate = new Not(
        new Comparison(ComparisonOperator.GREATER_THAN, QUANTITY, integer(3)));
    FilterTranslation translation =
        translator.translate(Collections.singletonList(predicate), schema);

    assertNull(translation.getFilterExpression());
    assertEquals(Collections.singleton(QUANTITY), translation.getDecodeDependencies());
  }

  @Test
  void testNullChecks() throws Exception {
    EqualToExpression isNull = (EqualToExpression) translator
        .translate(Collections.singletonList(new IsNull(CITY)), schema).getFilterExpression();
    assertTrue(isNull.isNull());
    assertTrue(((LiteralExpression) isNull.getRight()).isNull());

    NotEqualsExpression isNotNull = (NotEqualsExpression) translator
        .translate(Collections.singletonList(new IsNotNull(CITY)), schema)
        .getFilterExpression();
    assertTrue(isNotNull.isNotNull());
  }

  @Test
  void testComparisonWithNullLiteralIsResidual() throws Exception {
    FilterTranslation translation = translator.translate(Collections.singletonList(
        Comparison.equalTo(CITY, new Literal(null, DataTypes.STRING))), schema);

    assertNull(translation.getFilterExpression());
    assertEquals(1, translation.getResidualPredicates().size());
  }

  @Test
  void testColumnToColumnComparisonIsResidual() throws Exception {
    FilterTranslation translation = translator.translate(
        Collections.singletonList(Comparison.equalTo(CITY, PRODUCT)), schema);

    assertNull(translation.getFilterExpression());
    assertEquals(Arrays.asList(CITY, PRODUCT),
        Arrays.asList(translation.getDecodeDependencies().toArray()));
  }

  @Test
  void testUnknownColumnInPushableComparisonFails() {
    AttributeReference unknown = new AttributeReference("region", DataTypes.STRING);
    SchemaResolutionException e = assertThrows(SchemaResolutionException.class,
        () -> translator.translate(
            Collections.singletonList(Comparison.equalTo(unknown, string("EU"))), schema));

    assertEquals("region", e.getColumnName());
  }

  @Test
  void testCustomPushDownRule() throws Exception {
    PredicateTranslator dimensionsOnly = new PredicateTranslator(new PushDownRule() {
      @Override
      public boolean canPushDown(ColumnDescriptor column, LogicalExpression predicate) {
        return column.isDimension();
      }
    });
    FilterTranslation translation = dimensionsOnly.translate(Collections.singletonList(
        new Comparison(ComparisonOperator.GREATER_THAN, QUANTITY, integer(3))), schema);

    assertNull(translation.getFilterExpression());
    assertEquals(Collections.singleton(QUANTITY), translation.getDecodeDependencies());
  }
}
