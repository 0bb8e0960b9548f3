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

package org.rawscan.core.metadata.datatype;

import java.math.BigDecimal;

public class DecimalType extends DataType {

  private static final long serialVersionUID = 5917234L;

  private int precision;
  private int scale;

  // create a decimal type object with specified precision and scale
  DecimalType(int precision, int scale) {
    super(DataTypes.DECIMAL_TYPE_ID, "DECIMAL", -1, BigDecimal.class);
    this.precision = precision;
    this.scale = scale;
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  @Override
  public String toString() {
    return "DECIMAL(" + precision + "," + scale + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    DecimalType other = (DecimalType) obj;
    return precision == other.precision && scale == other.scale;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * super.hashCode() + precision) + scale;
  }
}
