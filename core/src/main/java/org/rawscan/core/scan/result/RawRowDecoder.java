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

import java.math.BigDecimal;
import java.util.List;

import org.rawscan.core.constants.RawScanCommonConstants;
import org.rawscan.core.metadata.datatype.DataType;
import org.rawscan.core.metadata.datatype.DataTypes;
import org.rawscan.core.scan.result.exception.CursorOutOfRangeException;
import org.rawscan.core.scan.result.exception.DecodeTypeMismatchException;

/**
 * Decodes the raw rows of one partition batch by output ordinal.
 *
 * <p>The decoder is a cursor: call {@link #hasNext()} and then {@link #next()} to position
 * it on a row before reading values. Reading before the first {@link #next()} is a
 * precondition violation and fails with {@link IllegalStateException}.
 *
 * <p>Measure values are read from the measure array of the row. Dimension values are
 * decoded from the dimension key by the engine's {@link DimensionKeyDecoder}, once per row
 * and only when a dimension is read.
 *
 * <p>Values are returned in the representation they are stored in, no widening is done.
 * For decimals the precision and scale passed by the caller are not checked against the
 * stored value.
 *
 * <p>Not thread safe, one decoder serves one consumer.
 */
public class RawRowDecoder implements Row {

  private final List<RawResultRow> rows;

  private final QuerySchemaInfo schema;

  private final DimensionKeyDecoder keyDecoder;

  private int counter;

  private RawResultRow current;

  private Object[] dimensionValues;

  public RawRowDecoder(RawResultBatch batch, DimensionKeyDecoder keyDecoder) {
    this(batch.getRows(), batch.getQuerySchemaInfo(), keyDecoder);
  }

  public RawRowDecoder(List<RawResultRow> rows, QuerySchemaInfo schema,
      DimensionKeyDecoder keyDecoder) {
    this.rows = rows;
    this.schema = schema;
    this.keyDecoder = keyDecoder;
  }

  public boolean hasNext() {
    return counter < rows.size();
  }

  /**
   * Move to the next row
   *
   * @throws CursorOutOfRangeException if no row is left
   */
  public void next() {
    if (!hasNext()) {
      throw new CursorOutOfRangeException(counter, rows.size());
    }
    current = rows.get(counter);
    counter++;
    dimensionValues = null;
  }

  public QuerySchemaInfo getQuerySchemaInfo() {
    return schema;
  }

  /**
   * @return dimension key of the current row
   */
  public ByteArrayWrapper getKey() {
    return currentRow().getKey();
  }

  @Override
  public int numFields() {
    return schema.getOutputColumnCount();
  }

  @Override
  public boolean isNullAt(int ordinal) {
    Object value = value(ordinal);
    return value == null || RawScanCommonConstants.MEMBER_DEFAULT_VAL.equals(value);
  }

  /**
   * @return value at the ordinal, null if the value is null
   * @throws DecodeTypeMismatchException if the value is not stored as the given type
   */
  @Override
  public Object get(int ordinal, DataType dataType) {
    if (isNullAt(ordinal)) {
      return null;
    }
    Object value = value(ordinal);
    if (!dataType.isInstance(value)) {
      throw new DecodeTypeMismatchException(ordinal, dataType, value.getClass());
    }
    return value;
  }

  /**
   * @return value at the ordinal without checking its type, null if the value is null
   */
  public Object getUnchecked(int ordinal) {
    return isNullAt(ordinal) ? null : value(ordinal);
  }

  @Override
  public boolean getBoolean(int ordinal) {
    return (Boolean) getNonNull(ordinal, DataTypes.BOOLEAN);
  }

  @Override
  public byte getByte(int ordinal) {
    return (Byte) getNonNull(ordinal, DataTypes.BYTE);
  }

  @Override
  public short getShort(int ordinal) {
    return (Short) getNonNull(ordinal, DataTypes.SHORT);
  }

  @Override
  public int getInt(int ordinal) {
    return (Integer) getNonNull(ordinal, DataTypes.INT);
  }

  @Override
  public long getLong(int ordinal) {
    return (Long) getNonNull(ordinal, DataTypes.LONG);
  }

  @Override
  public float getFloat(int ordinal) {
    return (Float) getNonNull(ordinal, DataTypes.FLOAT);
  }

  @Override
  public double getDouble(int ordinal) {
    return (Double) getNonNull(ordinal, DataTypes.DOUBLE);
  }

  @Override
  public String getString(int ordinal) {
    return (String) get(ordinal, DataTypes.STRING);
  }

  @Override
  public BigDecimal getDecimal(int ordinal, int precision, int scale) {
    // precision and scale are the caller's, the stored value is returned as is
    return (BigDecimal) get(ordinal, DataTypes.createDecimalType(precision, scale));
  }

  private Object getNonNull(int ordinal, DataType dataType) {
    Object value = get(ordinal, dataType);
    if (value == null) {
      throw new IllegalStateException(
          "Value at ordinal " + ordinal + " is null, check isNullAt before reading it");
    }
    return value;
  }

  private Object value(int ordinal) {
    RawResultRow row = currentRow();
    int offset = schema.getStorageOffset(ordinal);
    if (offset >= 0) {
      return row.getMeasures()[offset];
    }
    return decodedDimensions(row)[-offset - 1];
  }

  private Object[] decodedDimensions(RawResultRow row) {
    if (dimensionValues == null) {
      Object[] decoded = keyDecoder.decode(row.getKey(), schema);
      if (decoded == null || decoded.length < schema.getDimensionCount()) {
        throw new IllegalStateException("Key decoder returned "
            + (decoded == null ? "null" : decoded.length + " values") + " for "
            + schema.getDimensionCount() + " dimensions");
      }
      dimensionValues = decoded;
    }
    return dimensionValues;
  }

  private RawResultRow currentRow() {
    if (current == null) {
      throw new IllegalStateException("next() must be called before reading a row");
    }
    return current;
  }
}
