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

package org.rawscan.core.scan.expression;

import org.rawscan.core.metadata.datatype.DataType;
import org.rawscan.core.metadata.schema.table.column.ColumnDescriptor;

public class ColumnExpression extends Expression {

  private static final long serialVersionUID = 1L;

  private String columnName;

  private DataType dataType;

  private ColumnDescriptor column;

  public ColumnExpression(String columnName, DataType dataType) {
    this.columnName = columnName;
    this.dataType = dataType;
  }

  public String getColumnName() {
    return columnName;
  }

  public DataType getDataType() {
    return dataType;
  }

  /**
   * Schema column this expression refers to, set when the filter is translated
   */
  public ColumnDescriptor getColumn() {
    return column;
  }

  public void setColumn(ColumnDescriptor column) {
    this.column = column;
  }

  public boolean isDimension() {
    return column != null && column.isDimension();
  }

  @Override
  public ExpressionType getFilterExpressionType() {
    return ExpressionType.COLUMN;
  }

  @Override
  public String getString() {
    return "ColumnExpression(" + columnName + ")";
  }
}
