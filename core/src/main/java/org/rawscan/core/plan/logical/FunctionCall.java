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
 * Call of a named function the scan engine knows nothing about, such as LIKE or a
 * user defined function. It is never pushed down.
 */
public class FunctionCall extends LogicalExpression {

  private static final long serialVersionUID = 1L;

  private final String functionName;
  private final List<LogicalExpression> arguments;

  public FunctionCall(String functionName, List<? extends LogicalExpression> arguments) {
    this.functionName = functionName;
    this.arguments = Collections.unmodifiableList(new ArrayList<LogicalExpression>(arguments));
  }

  public String getFunctionName() {
    return functionName;
  }

  @Override
  public List<LogicalExpression> getChildren() {
    return arguments;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(functionName).append('(');
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(arguments.get(i));
    }
    return builder.append(')').toString();
  }
}
