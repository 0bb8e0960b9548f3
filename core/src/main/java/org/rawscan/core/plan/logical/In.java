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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * value IN (list)
 */
public class In extends LogicalExpression {

  private static final long serialVersionUID = 1L;

  private final LogicalExpression value;
  private final List<LogicalExpression> list;

  public In(LogicalExpression value, List<? extends LogicalExpression> list) {
    this.value = value;
    this.list = Collections.unmodifiableList(new ArrayList<LogicalExpression>(list));
  }

  public LogicalExpression getValue() {
    return value;
  }

  public List<LogicalExpression> getList() {
    return list;
  }

  @Override
  public List<LogicalExpression> getChildren() {
    List<LogicalExpression> children = new ArrayList<>(list.size() + 1);
    children.add(value);
    children.addAll(list);
    return children;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder().append(value).append(" IN (");
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(list.get(i));
    }
    return builder.append(')').toString();
  }
}
