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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.rawscan.common.exceptions.SchemaResolutionException;
import org.rawscan.common.logging.LogService;
import org.rawscan.common.logging.LogServiceFactory;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.metadata.schema.table.column.ColumnDescriptor;
import org.rawscan.core.plan.logical.And;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.plan.logical.Cast;
import org.rawscan.core.plan.logical.Comparison;
import org.rawscan.core.plan.logical.ComparisonOperator;
import org.rawscan.core.plan.logical.In;
import org.rawscan.core.plan.logical.IsNotNull;
import org.rawscan.core.plan.logical.IsNull;
import org.rawscan.core.plan.logical.Literal;
import org.rawscan.core.plan.logical.LogicalExpression;
import org.rawscan.core.plan.logical.Not;
import org.rawscan.core.plan.logical.Or;
import org.rawscan.core.scan.expression.ColumnExpression;
import org.rawscan.core.scan.expression.Expression;
import org.rawscan.core.scan.expression.ListExpression;
import org.rawscan.core.scan.expression.LiteralExpression;
import org.rawscan.core.scan.expression.conditional.EqualToExpression;
import org.rawscan.core.scan.expression.conditional.GreaterThanEqualToExpression;
import org.rawscan.core.scan.expression.conditional.GreaterThanExpression;
import org.rawscan.core.scan.expression.conditional.InExpression;
import org.rawscan.core.scan.expression.conditional.LessThanEqualToExpression;
import org.rawscan.core.scan.expression.conditional.LessThanExpression;
import org.rawscan.core.scan.expression.conditional.NotEqualsExpression;
import org.rawscan.core.scan.expression.conditional.NotInExpression;
import org.rawscan.core.scan.expression.logical.AndExpression;
import org.rawscan.core.scan.expression.logical.OrExpression;

/**
 * Translates the predicates of a query into the filter expression of the scan engine.
 *
 * <p>Top level predicates and both sides of an AND are translated independently, so a
 * conjunction can be pushed down partially. An OR is pushed down only when both of its
 * sides are, otherwise the whole OR is kept. Predicates which can not be pushed down are
 * returned as residual predicates and every column they reference becomes a decode
 * dependency of the plan.
 */
public class PredicateTranslator {

  private static final LogService LOGGER =
      LogServiceFactory.getLogService(PredicateTranslator.class.getName());

  private final PushDownRule pushDownRule;

  public PredicateTranslator() {
    this(new DictionaryPushDownRule());
  }

  public PredicateTranslator(PushDownRule pushDownRule) {
    this.pushDownRule = pushDownRule;
  }

  /**
   * Translate the predicates, which are implicitly AND-ed
   *
   * @throws SchemaResolutionException if a predicate which could otherwise be pushed down
   *                                   references a column the table does not have
   */
  public FilterTranslation translate(List<? extends LogicalExpression> predicates,
      TableSchemaIndex schema) throws SchemaResolutionException {
    if (predicates == null || predicates.isEmpty()) {
      return FilterTranslation.EMPTY;
    }
    Set<AttributeReference> attributesNeedToDecode = new LinkedHashSet<>();
    List<LogicalExpression> unprocessedExprs = new ArrayList<>();
    Expression filter = null;
    for (LogicalExpression predicate : predicates) {
      Expression translated =
          processConjunct(predicate, schema, attributesNeedToDecode, unprocessedExprs);
      if (translated != null) {
        filter = filter == null ? translated : new AndExpression(filter, translated);
      }
    }
    if (!unprocessedExprs.isEmpty()) {
      LOGGER.info("Predicates evaluated after scan: " + unprocessedExprs
          + ", columns to decode: " + attributesNeedToDecode);
    }
    return new FilterTranslation(filter, attributesNeedToDecode, unprocessedExprs);
  }

  private Expression processConjunct(LogicalExpression predicate, TableSchemaIndex schema,
      Set<AttributeReference> attributesNeedToDecode, List<LogicalExpression> unprocessedExprs)
      throws SchemaResolutionException {
    if (predicate instanceof And) {
      And and = (And) predicate;
      Expression left =
          processConjunct(and.getLeft(), schema, attributesNeedToDecode, unprocessedExprs);
      Expression right =
          processConjunct(and.getRight(), schema, attributesNeedToDecode, unprocessedExprs);
      if (left == null) {
        return right;
      }
      if (right == null) {
        return left;
      }
      return new AndExpression(left, right);
    }
    Expression translated = transformExpression(predicate, schema);
    if (translated == null) {
      predicate.collectAttributes(attributesNeedToDecode);
      unprocessedExprs.add(predicate);
    }
    return translated;
  }

  /**
   * @return the engine expression, null if the predicate can not be pushed down as a whole
   */
  private Expression transformExpression(LogicalExpression expr, TableSchemaIndex schema)
      throws SchemaResolutionException {
    if (expr instanceof And) {
      And and = (And) expr;
      Expression left = transformExpression(and.getLeft(), schema);
      Expression right = transformExpression(and.getRight(), schema);
      return left != null && right != null ? new AndExpression(left, right) : null;
    } else if (expr instanceof Or) {
      Or or = (Or) expr;
      Expression left = transformExpression(or.getLeft(), schema);
      Expression right = transformExpression(or.getRight(), schema);
      return left != null && right != null ? new OrExpression(left, right) : null;
    } else if (expr instanceof Comparison) {
      return transformComparison((Comparison) expr, false, schema);
    } else if (expr instanceof In) {
      return transformIn((In) expr, false, schema);
    } else if (expr instanceof Not) {
      LogicalExpression child = ((Not) expr).getChild();
      if (child instanceof Comparison) {
        return transformComparison((Comparison) child, true, schema);
      } else if (child instanceof In) {
        return transformIn((In) child, true, schema);
      }
      return null;
    } else if (expr instanceof IsNull || expr instanceof IsNotNull) {
      LogicalExpression child = expr.getChildren().get(0);
      ColumnExpression column = toColumnExpression(child, schema);
      if (column == null || !pushDownRule.canPushDown(column.getColumn(), expr)) {
        return null;
      }
      LiteralExpression nullLiteral = new LiteralExpression(null, column.getDataType());
      if (expr instanceof IsNull) {
        return new EqualToExpression(column, nullLiteral, true);
      }
      return new NotEqualsExpression(column, nullLiteral, true);
    }
    return null;
  }

  private Expression transformComparison(Comparison comparison, boolean negate,
      TableSchemaIndex schema) throws SchemaResolutionException {
    ComparisonOperator operator = comparison.getOperator();
    LogicalExpression columnSide = comparison.getLeft();
    LogicalExpression literalSide = comparison.getRight();
    if (comparison.getLeft() instanceof Literal) {
      columnSide = comparison.getRight();
      literalSide = comparison.getLeft();
      operator = operator.swap();
    }
    if (!(literalSide instanceof Literal) || ((Literal) literalSide).getValue() == null) {
      return null;
    }
    ColumnExpression column = toColumnExpression(columnSide, schema);
    if (column == null || !pushDownRule.canPushDown(column.getColumn(), comparison)) {
      return null;
    }
    LiteralExpression literal = toLiteralExpression((Literal) literalSide);
    if (negate) {
      // only NOT(a = x) and NOT(a <> x) have a direct engine form
      if (operator == ComparisonOperator.EQUAL) {
        return new NotEqualsExpression(column, literal);
      } else if (operator == ComparisonOperator.NOT_EQUAL) {
        return new EqualToExpression(column, literal);
      }
      return null;
    }
    switch (operator) {
      case EQUAL:
        return new EqualToExpression(column, literal);
      case NOT_EQUAL:
        return new NotEqualsExpression(column, literal);
      case LESS_THAN:
        return new LessThanExpression(column, literal);
      case LESS_THAN_OR_EQUAL:
        return new LessThanEqualToExpression(column, literal);
      case GREATER_THAN:
        return new GreaterThanExpression(column, literal);
      case GREATER_THAN_OR_EQUAL:
        return new GreaterThanEqualToExpression(column, literal);
      default:
        return null;
    }
  }

  private Expression transformIn(In in, boolean negate, TableSchemaIndex schema)
      throws SchemaResolutionException {
    List<Expression> literals = new ArrayList<>(in.getList().size());
    for (LogicalExpression element : in.getList()) {
      if (!(element instanceof Literal) || ((Literal) element).getValue() == null) {
        return null;
      }
      literals.add(toLiteralExpression((Literal) element));
    }
    ColumnExpression column = toColumnExpression(in.getValue(), schema);
    if (column == null || !pushDownRule.canPushDown(column.getColumn(), in)) {
      return null;
    }
    ListExpression list = new ListExpression(literals);
    return negate ? new NotInExpression(column, list) : new InExpression(column, list);
  }

  /**
   * @return column expression for an attribute, possibly under casts, null for any other
   *         expression
   */
  private ColumnExpression toColumnExpression(LogicalExpression expr, TableSchemaIndex schema)
      throws SchemaResolutionException {
    while (expr instanceof Cast) {
      expr = ((Cast) expr).getChild();
    }
    if (!(expr instanceof AttributeReference)) {
      return null;
    }
    String name = ((AttributeReference) expr).getName();
    ColumnDescriptor descriptor = schema.getColumnByName(name);
    if (descriptor == null) {
      throw new SchemaResolutionException(name, "Filter column " + name
          + " is neither a dimension nor a measure of table " + schema.getTableIdentifier());
    }
    ColumnExpression column =
        new ColumnExpression(descriptor.getColName(), descriptor.getDataType());
    column.setColumn(descriptor);
    return column;
  }

  private LiteralExpression toLiteralExpression(Literal literal) {
    return new LiteralExpression(literal.getValue(), literal.getDataType());
  }
}
