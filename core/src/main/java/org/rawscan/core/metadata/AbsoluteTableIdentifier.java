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

package org.rawscan.core.metadata;

import java.io.Serializable;

import org.rawscan.core.constants.RawScanCommonConstants;

/**
 * Identifier class which holds the store path and the table identifier
 */
public class AbsoluteTableIdentifier implements Serializable {

  private static final long serialVersionUID = 4695047103484427506L;

  /**
   * path of the store
   */
  private final String storePath;

  private final TableIdentifier tableIdentifier;

  public AbsoluteTableIdentifier(String storePath, TableIdentifier tableIdentifier) {
    this.storePath = storePath;
    this.tableIdentifier = tableIdentifier;
  }

  public String getStorePath() {
    return storePath;
  }

  public TableIdentifier getTableIdentifier() {
    return tableIdentifier;
  }

  public String getTablePath() {
    return storePath + RawScanCommonConstants.FILE_SEPARATOR
        + tableIdentifier.getDatabaseName() + RawScanCommonConstants.FILE_SEPARATOR
        + tableIdentifier.getTableName();
  }

  @Override
  public String toString() {
    return getTablePath();
  }
}
