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

package org.rawscan.hadoop;

import java.io.IOException;
import java.util.List;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.annotations.InterfaceStability;

import org.apache.hadoop.conf.Configuration;

/**
 * Scan engine running raw queries. Partitions may be produced concurrently, each one is
 * consumed by a single decoder.
 */
@InterfaceAudience.Developer
@InterfaceStability.Evolving
public interface RawScanEngine {

  /**
   * @param queryModel plan and table information of the query
   * @param conf configuration of the job
   * @return raw results, one entry per partition
   */
  List<RawPartitionResult> execute(QueryModel queryModel, Configuration conf)
      throws IOException;
}
