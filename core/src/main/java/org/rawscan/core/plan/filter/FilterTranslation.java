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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.plan.logical.LogicalExpression;
import org.rawscan.core.scan.expression.Expression;

import com.google.common.collect.ImmutableList;

/**
 * Result of translating the predicates of a query
 */
public final class FilterTranslation {

  public static final FilterTranslation EMPTY = new FilterTranslation(null,
      Collections.<AttributeReference>emptySet(), Collections.<LogicalExpression>emptyList());

  private final Expression filterExpression;

  private final Set<AttributeReference> decodeDependencies;

  private final List<LogicalExpression> residualPredicates;

  FilterTranslation(Expression filterExpression, Set<AttributeReference> decodeDependencies,
      List<LogicalExpression> residualPredicates) {
    this.filterExpression = filterExpression;
    this.decodeDependencies =
        Collections.unmodifiableSet(new LinkedHashSet<>(decodeDependencies));
    this.residualPredicates = ImmutableList.copyOf(residualPredicates);
  }

  /**
   * @return filter the engine evaluates, null if no predicate could be pushed down
   */
  public Expression getFilterExpression() {
    return filterExpression;
  }

  /**
   * @return columns referenced by residual predicates, in discovery order
   */
  public Set<AttributeReference> getDecodeDependencies() {
    return decodeDependencies;
  }

  /**
   * @return predicates to evaluate after the scan, AND-ed together
   */
  public List<LogicalExpression> getResidualPredicates() {
    return residualPredicates;
  }

  public boolean isEmpty() {
    return filterExpression == null && residualPredicates.isEmpty();
  }
}
