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

package org.rawscan.core.scan.result.exception;

import org.rawscan.core.metadata.datatype.DataType;

/**
 * Thrown when a value is read as a type it is not stored as. Values are never widened or
 * converted, so reading again with the same type fails again.
 */
public class DecodeTypeMismatchException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int ordinal;

  private final DataType expectedType;

  public DecodeTypeMismatchException(int ordinal, DataType expectedType, Class<?> actualClass) {
    super("Value at ordinal " + ordinal + " is stored as " + actualClass.getName()
        + ", can not be read as " + expectedType);
    this.ordinal = ordinal;
    this.expectedType = expectedType;
  }

  public int getOrdinal() {
    return ordinal;
  }

  public DataType getExpectedType() {
    return expectedType;
  }
}
