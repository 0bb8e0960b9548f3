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

import java.util.Iterator;

/**
 * Materializes the rows of a decoder as object arrays. By default only the projected
 * output columns are kept and columns added to the plan for filter evaluation are left
 * out; they are kept when the caller still has residual predicates to evaluate.
 */
public class ProjectedRowIterator implements Iterator<Object[]> {

  private final RawRowDecoder decoder;

  private final QuerySchemaInfo schema;

  private final int width;

  public ProjectedRowIterator(RawRowDecoder decoder) {
    this(decoder, false);
  }

  public ProjectedRowIterator(RawRowDecoder decoder, boolean includePredicateColumns) {
    this.decoder = decoder;
    this.schema = decoder.getQuerySchemaInfo();
    this.width = includePredicateColumns ?
        schema.getOutputColumnCount() : schema.getProjectedColumnCount();
  }

  @Override
  public boolean hasNext() {
    return decoder.hasNext();
  }

  @Override
  public Object[] next() {
    decoder.next();
    Object[] row = new Object[width];
    for (int ordinal = 0; ordinal < row.length; ordinal++) {
      if (decoder.isNullAt(ordinal)) {
        continue;
      }
      if (schema.getOutputType(ordinal) != null) {
        row[ordinal] = decoder.get(ordinal, schema.getOutputType(ordinal));
      } else {
        row[ordinal] = decoder.getUnchecked(ordinal);
      }
    }
    return row;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException("remove");
  }
}
