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

import com.google.common.collect.ImmutableList;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.exceptions.SchemaResolutionException;
import org.rawscan.common.logging.LogService;
import org.rawscan.common.logging.LogServiceFactory;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.plan.filter.FilterTranslation;
import org.rawscan.core.plan.filter.PredicateTranslator;
import org.rawscan.core.plan.logical.AggregateCall;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.plan.logical.LogicalExpression;
import org.rawscan.core.scan.model.OutputSchema;
import org.rawscan.core.scan.model.QueryDimension;
import org.rawscan.core.scan.model.QueryPlan;
import org.rawscan.core.scan.model.QueryPlanBuilder;
import org.rawscan.core.scan.model.QueryPlanJsonWriter;
import org.rawscan.core.scan.result.QuerySchemaInfo;
import org.rawscan.core.util.RawScanProperties;

/**
 * Plans a raw query: classifies the requested columns, records aggregation hints,
 * translates the predicates and adds the columns residual predicates need. The plan is
 * built only when every step succeeded, a failing query never yields a partial plan.
 */
@InterfaceAudience.User
public class RawQueryPlanner {

  private static final LogService LOGGER =
      LogServiceFactory.getLogService(RawQueryPlanner.class.getName());

  private final ColumnClassifier columnClassifier;

  private final PredicateTranslator predicateTranslator;

  private final PlanAugmenter planAugmenter;

  public RawQueryPlanner() {
    this(new ColumnClassifier(), new PredicateTranslator(), new PlanAugmenter());
  }

  public RawQueryPlanner(ColumnClassifier columnClassifier,
      PredicateTranslator predicateTranslator, PlanAugmenter planAugmenter) {
    this.columnClassifier = columnClassifier;
    this.predicateTranslator = predicateTranslator;
    this.planAugmenter = planAugmenter;
  }

  /**
   * Plan a raw query with a generated query id
   */
  public RawQueryPlan plan(TableSchemaIndex schema, List<AttributeReference> requestedColumns,
      List<? extends LogicalExpression> predicates,
      List<? extends LogicalExpression> aggregateExprs) throws SchemaResolutionException {
    return plan(schema, requestedColumns, predicates, aggregateExprs, null);
  }

  /**
   * Plan a raw query
   *
   * @param schema schema of the queried table
   * @param requestedColumns output columns in request order
   * @param predicates predicates, AND-ed, may be empty
   * @param aggregateExprs aggregate expressions of the query, may be null
   * @param queryId id of the query, generated when null
   * @throws SchemaResolutionException if a column can not be resolved against the schema
   */
  public RawQueryPlan plan(TableSchemaIndex schema, List<AttributeReference> requestedColumns,
      List<? extends LogicalExpression> predicates,
      List<? extends LogicalExpression> aggregateExprs, String queryId)
      throws SchemaResolutionException {
    QueryPlanBuilder builder = new QueryPlanBuilder(schema.getTableIdentifier());
    OutputSchema output = columnClassifier.classify(requestedColumns, schema, builder);
    fillDimAggregatorInfos(builder, aggregateExprs);

    FilterTranslation translation = predicateTranslator.translate(predicates, schema);
    if (!translation.isEmpty()) {
      builder.filterExpression(translation.getFilterExpression());
      if (!translation.getDecodeDependencies().isEmpty()) {
        output = planAugmenter.augment(
            builder, translation.getDecodeDependencies(), output, schema);
      }
    }

    builder.outLocationPath(RawScanProperties.getInstance().getStoreLocation());
    builder.queryId(queryId);
    QueryPlan queryPlan = builder.build();
    QuerySchemaInfo querySchemaInfo = QuerySchemaInfo.create(queryPlan, output);
    LOGGER.info("Planned raw query " + queryPlan.getQueryId() + " on table "
        + schema.getTableIdentifier() + ": " + queryPlan.getDimensions().size()
        + " dimensions, " + queryPlan.getMeasures().size() + " measures, "
        + translation.getResidualPredicates().size() + " residual predicates");
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Raw query plan: " + QueryPlanJsonWriter.toJson(queryPlan));
    }
    return new RawQueryPlan(queryPlan, output,
        ImmutableList.copyOf(translation.getResidualPredicates()), querySchemaInfo);
  }

  /**
   * Just find out whether any aggregate function is applied on a selected dimension
   */
  private void fillDimAggregatorInfos(QueryPlanBuilder builder,
      List<? extends LogicalExpression> aggregateExprs) {
    if (aggregateExprs == null) {
      return;
    }
    for (LogicalExpression expr : aggregateExprs) {
      if (!(expr instanceof AggregateCall)) {
        continue;
      }
      AggregateCall aggregateCall = (AggregateCall) expr;
      List<AttributeReference> attributes = new ArrayList<>();
      aggregateCall.collectAttributes(attributes);
      for (AttributeReference attr : attributes) {
        QueryDimension dimension = builder.getDimension(attr.getName());
        if (dimension != null) {
          builder.addDimAggregatorInfo(dimension.getColumnName(), aggregateCall.getFunction(),
              dimension.getQueryOrder());
        }
      }
    }
  }
}
