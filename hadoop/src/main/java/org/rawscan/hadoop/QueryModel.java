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

package org.rawscan.hadoop;

import java.io.Serializable;

import org.rawscan.core.metadata.AbsoluteTableIdentifier;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.plan.RawQueryPlan;
import org.rawscan.core.scan.expression.Expression;
import org.rawscan.core.scan.model.QueryPlan;
import org.rawscan.core.scan.result.QuerySchemaInfo;

/**
 * Everything the scan engine needs to run a raw query. The table timestamps are passed
 * through from the catalog unchanged so the engine can validate its caches.
 */
public class QueryModel implements Serializable {

  private static final long serialVersionUID = -4674677234007089052L;

  private AbsoluteTableIdentifier absoluteTableIdentifier;

  private QueryPlan queryPlan;

  private QuerySchemaInfo querySchemaInfo;

  private TableSchemaIndex table;

  private long tableCreationTime;

  private long schemaLastUpdatedTime;

  private QueryModel() {
  }

  public static QueryModel createModel(AbsoluteTableIdentifier absoluteTableIdentifier,
      RawQueryPlan rawQueryPlan, TableSchemaIndex table, long tableCreationTime,
      long schemaLastUpdatedTime) {
    QueryModel queryModel = new QueryModel();
    queryModel.absoluteTableIdentifier = absoluteTableIdentifier;
    queryModel.queryPlan = rawQueryPlan.getQueryPlan();
    queryModel.querySchemaInfo = rawQueryPlan.getQuerySchemaInfo();
    queryModel.table = table;
    queryModel.tableCreationTime = tableCreationTime;
    queryModel.schemaLastUpdatedTime = schemaLastUpdatedTime;
    return queryModel;
  }

  public AbsoluteTableIdentifier getAbsoluteTableIdentifier() {
    return absoluteTableIdentifier;
  }

  public QueryPlan getQueryPlan() {
    return queryPlan;
  }

  public QuerySchemaInfo getQuerySchemaInfo() {
    return querySchemaInfo;
  }

  public TableSchemaIndex getTable() {
    return table;
  }

  public Expression getFilterExpression() {
    return queryPlan.getFilterExpression();
  }

  public String getQueryId() {
    return queryPlan.getQueryId();
  }

  public long getTableCreationTime() {
    return tableCreationTime;
  }

  public long getSchemaLastUpdatedTime() {
    return schemaLastUpdatedTime;
  }
}
