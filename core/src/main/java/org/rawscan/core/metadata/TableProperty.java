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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.rawscan.core.constants.RawScanCommonConstants;

import org.apache.commons.lang.StringUtils;

/**
 * Table level properties which affect how columns are stored
 */
public class TableProperty {

  private Map<String, String> tableProperties;
  private List<String> dictionaryExcludeColumns;

  public TableProperty(Map<String, String> tableProperties) {
    this.tableProperties = tableProperties;
    this.dictionaryExcludeColumns =
        extractColumns(RawScanCommonConstants.DICTIONARY_EXCLUDE);
  }

  /**
   * @return lower case names of the dimensions stored without dictionary
   */
  public List<String> getDictionaryExcludeColumns() {
    return dictionaryExcludeColumns;
  }

  public boolean isDictionaryExcluded(String columnName) {
    return dictionaryExcludeColumns.contains(columnName.toLowerCase(Locale.ROOT));
  }

  private List<String> extractColumns(String propertyName) {
    String columnsString = tableProperties.get(propertyName);
    if (StringUtils.isBlank(columnsString)) {
      return new ArrayList<>(0);
    }
    String[] columns =
        columnsString.toLowerCase(Locale.ROOT).split(RawScanCommonConstants.COMMA);
    List<String> result = new ArrayList<>(columns.length);
    for (String column : columns) {
      if (StringUtils.isNotBlank(column)) {
        result.add(column.trim());
      }
    }
    return result;
  }

}
