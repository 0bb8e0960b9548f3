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

import java.io.Serializable;

import org.rawscan.common.annotations.InterfaceAudience;

/**
 * Semantic type of a column value. The value class is the exact Java representation a
 * decoded value of this type has; no widening is applied when values are read.
 */
@InterfaceAudience.User
public class DataType implements Serializable {

  private static final long serialVersionUID = 19371726L;

  // id is used for comparison and serialization/deserialization
  private int id;
  private String name;

  // size of the value of this data type, negative value means variable length
  private int sizeInBytes;

  private Class<?> valueClass;

  DataType(int id, String name, int sizeInBytes, Class<?> valueClass) {
    this.id = id;
    this.name = name;
    this.sizeInBytes = sizeInBytes;
    this.valueClass = valueClass;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public int getSizeInBytes() {
    return sizeInBytes;
  }

  public Class<?> getValueClass() {
    return valueClass;
  }

  /**
   * Return true if the value is stored in the exact representation of this type
   */
  public boolean isInstance(Object value) {
    return valueClass.isInstance(value);
  }

  @Override
  public String toString() {
    return getName();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return id == ((DataType) obj).id;
  }

  @Override
  public int hashCode() {
    return id;
  }
}
