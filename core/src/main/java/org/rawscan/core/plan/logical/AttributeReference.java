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

package org.rawscan.core.plan.logical;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.rawscan.core.metadata.datatype.DataType;

/**
 * Reference to a table column by name with its declared type. Two references are equal
 * when their names are equal ignoring case.
 */
public class AttributeReference extends LogicalExpression {

  private static final long serialVersionUID = 1L;

  private final String name;

  private final DataType dataType;

  public AttributeReference(String name, DataType dataType) {
    if (name == null) {
      throw new IllegalArgumentException("attribute name must not be null");
    }
    this.name = name;
    this.dataType = dataType;
  }

  public String getName() {
    return name;
  }

  public DataType getDataType() {
    return dataType;
  }

  @Override
  public List<LogicalExpression> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AttributeReference)) {
      return false;
    }
    return name.equalsIgnoreCase(((AttributeReference) obj).name);
  }

  @Override
  public int hashCode() {
    return name.toLowerCase(Locale.ROOT).hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
