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

package org.rawscan.core.scan.result;

import java.io.Serializable;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Rows of a partition produced by the scan engine, together with the query schema they
 * were produced for
 */
public class RawResultBatch implements Serializable {

  private static final long serialVersionUID = 8817290346101652177L;

  private final ImmutableList<RawResultRow> rows;

  private final QuerySchemaInfo querySchemaInfo;

  public RawResultBatch(List<RawResultRow> rows, QuerySchemaInfo querySchemaInfo) {
    this.rows = ImmutableList.copyOf(rows);
    this.querySchemaInfo = querySchemaInfo;
  }

  public List<RawResultRow> getRows() {
    return rows;
  }

  public QuerySchemaInfo getQuerySchemaInfo() {
    return querySchemaInfo;
  }

  public int size() {
    return rows.size();
  }
}
