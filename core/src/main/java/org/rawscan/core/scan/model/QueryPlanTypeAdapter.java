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

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

/**
 * Writes a {@link QueryPlan} as JSON for tracing. Plans are built by
 * {@link QueryPlanBuilder} only, so reading is not supported.
 */
public class QueryPlanTypeAdapter extends TypeAdapter<QueryPlan> {

  @Override
  public void write(JsonWriter jsonWriter, QueryPlan plan) throws IOException {
    if (plan == null) {
      jsonWriter.nullValue();
      return;
    }
    jsonWriter.beginObject();
    jsonWriter.name("queryId").value(plan.getQueryId());
    jsonWriter.name("database").value(plan.getDatabaseName());
    jsonWriter.name("table").value(plan.getTableName());
    jsonWriter.name("rawDetailQuery").value(plan.isRawDetailQuery());
    jsonWriter.name("outLocationPath").value(plan.getOutLocationPath());
    jsonWriter.name("dimensions");
    writeColumns(jsonWriter, plan.getDimensions());
    jsonWriter.name("measures");
    writeColumns(jsonWriter, plan.getMeasures());
    jsonWriter.name("filter");
    if (plan.getFilterExpression() == null) {
      jsonWriter.nullValue();
    } else {
      jsonWriter.value(plan.getFilterExpression().getString());
    }
    jsonWriter.name("dimAggregatorInfos");
    jsonWriter.beginArray();
    for (Map.Entry<String, DimensionAggregatorInfo> entry :
        plan.getDimAggregatorInfos().entrySet()) {
      DimensionAggregatorInfo info = entry.getValue();
      for (int i = 0; i < info.getAggList().size(); i++) {
        jsonWriter.beginObject();
        jsonWriter.name("column").value(info.getColumnName());
        jsonWriter.name("function").value(info.getAggList().get(i));
        jsonWriter.name("queryOrder").value(info.getOrderList().get(i));
        jsonWriter.endObject();
      }
    }
    jsonWriter.endArray();
    jsonWriter.endObject();
  }

  private void writeColumns(JsonWriter jsonWriter, List<? extends QueryColumn> columns)
      throws IOException {
    jsonWriter.beginArray();
    for (QueryColumn column : columns) {
      jsonWriter.beginObject();
      jsonWriter.name("column").value(column.getColumnName());
      jsonWriter.name("queryOrder").value(column.getQueryOrder());
      jsonWriter.endObject();
    }
    jsonWriter.endArray();
  }

  @Override
  public QueryPlan read(JsonReader jsonReader) throws IOException {
    throw new UnsupportedOperationException("QueryPlan can not be read from JSON");
  }
}
