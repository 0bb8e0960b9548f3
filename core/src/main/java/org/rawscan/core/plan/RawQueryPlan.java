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

import java.util.List;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.core.plan.logical.LogicalExpression;
import org.rawscan.core.scan.model.OutputSchema;
import org.rawscan.core.scan.model.QueryPlan;
import org.rawscan.core.scan.result.QuerySchemaInfo;

/**
 * Everything planning a raw query produces: the plan for the engine, the output the
 * decoded rows follow, the predicates left for evaluation after the scan and the order
 * mapping used by decoders.
 */
@InterfaceAudience.User
public class RawQueryPlan {

  private final QueryPlan queryPlan;

  private final OutputSchema outputSchema;

  private final List<LogicalExpression> residualPredicates;

  private final QuerySchemaInfo querySchemaInfo;

  RawQueryPlan(QueryPlan queryPlan, OutputSchema outputSchema,
      List<LogicalExpression> residualPredicates, QuerySchemaInfo querySchemaInfo) {
    this.queryPlan = queryPlan;
    this.outputSchema = outputSchema;
    this.residualPredicates = residualPredicates;
    this.querySchemaInfo = querySchemaInfo;
  }

  public QueryPlan getQueryPlan() {
    return queryPlan;
  }

  public OutputSchema getOutputSchema() {
    return outputSchema;
  }

  public List<LogicalExpression> getResidualPredicates() {
    return residualPredicates;
  }

  public QuerySchemaInfo getQuerySchemaInfo() {
    return querySchemaInfo;
  }
}
