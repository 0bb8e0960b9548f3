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

package org.rawscan.core.plan.filter;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.annotations.InterfaceStability;
import org.rawscan.core.metadata.schema.table.column.ColumnDescriptor;
import org.rawscan.core.plan.logical.LogicalExpression;

/**
 * Scan engine specific rule telling whether a predicate on a column can be evaluated by
 * the engine on its stored form. When it can not, the predicate is evaluated after the
 * scan and the column has to be decoded into the output.
 */
@InterfaceAudience.Developer
@InterfaceStability.Evolving
public interface PushDownRule {

  /**
   * @param column column referenced by the predicate
   * @param predicate the leaf predicate (comparison, IN, IS NULL...) being translated
   */
  boolean canPushDown(ColumnDescriptor column, LogicalExpression predicate);
}
