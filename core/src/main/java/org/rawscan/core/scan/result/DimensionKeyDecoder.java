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

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.annotations.InterfaceStability;

/**
 * Scan engine routine turning a packed dimension key back into dimension values.
 * Implemented by the engine which owns the key layout.
 */
@InterfaceAudience.Developer
@InterfaceStability.Evolving
public interface DimensionKeyDecoder {

  /**
   * @param key packed dimension key of one row
   * @param querySchemaInfo schema of the query the row was produced for
   * @return value of every plan dimension, in plan dimension order. A null member is
   *         reported as null or as the null member value
   */
  Object[] decode(ByteArrayWrapper key, QuerySchemaInfo querySchemaInfo);
}
