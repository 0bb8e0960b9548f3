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

package org.rawscan.core.metadata.schema.table.column;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.rawscan.core.metadata.datatype.DataType;
import org.rawscan.core.metadata.encoder.Encoding;

/**
 * Describes one column of a table. Instances are owned by the table schema and never
 * change while the schema snapshot is alive.
 */
public abstract class ColumnDescriptor implements Serializable {

  private static final long serialVersionUID = 3648269871256322681L;

  private final String columnName;

  private final DataType dataType;

  /**
   * position of this column among the columns of the same family, in schema order
   */
  private final int ordinal;

  private final List<Encoding> encodings;

  protected ColumnDescriptor(String columnName, DataType dataType, int ordinal,
      List<Encoding> encodings) {
    this.columnName = columnName;
    this.dataType = dataType;
    this.ordinal = ordinal;
    this.encodings = Collections.unmodifiableList(new ArrayList<>(encodings));
  }

  public String getColName() {
    return columnName;
  }

  public DataType getDataType() {
    return dataType;
  }

  public int getOrdinal() {
    return ordinal;
  }

  public List<Encoding> getEncoder() {
    return encodings;
  }

  public boolean hasEncoding(Encoding encoding) {
    return encodings.contains(encoding);
  }

  public abstract ColumnFamily getColumnFamily();

  public boolean isDimension() {
    return getColumnFamily() == ColumnFamily.DIMENSION;
  }

  @Override
  public String toString() {
    return getColumnFamily() + "(" + columnName + ":" + dataType + ")";
  }
}
