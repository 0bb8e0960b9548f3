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

import java.io.Serializable;
import java.util.Collection;
import java.util.List;

import org.rawscan.common.annotations.InterfaceAudience;

/**
 * Node of the logical expression tree a query is expressed in: output columns,
 * predicates and aggregate calls. Trees are immutable.
 */
@InterfaceAudience.User
public abstract class LogicalExpression implements Serializable {

  private static final long serialVersionUID = 1L;

  public abstract List<LogicalExpression> getChildren();

  /**
   * Add every attribute referenced in this tree to the given collection, depth first
   */
  public void collectAttributes(Collection<AttributeReference> attributes) {
    if (this instanceof AttributeReference) {
      attributes.add((AttributeReference) this);
    }
    for (LogicalExpression child : getChildren()) {
      child.collectAttributes(attributes);
    }
  }
}
