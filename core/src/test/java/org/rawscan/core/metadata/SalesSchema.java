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

import org.rawscan.common.exceptions.MalformedSchemaException;
import org.rawscan.core.constants.RawScanCommonConstants;
import org.rawscan.core.metadata.datatype.DataTypes;
import org.rawscan.core.metadata.schema.table.TableSchemaBuilder;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.plan.logical.AttributeReference;

/**
 * Schema used across tests: dimensions country, city, product and measures quantity,
 * revenue, price. country is stored without dictionary.
 */
public final class SalesSchema {

  public static final AttributeReference COUNTRY =
      new AttributeReference("country", DataTypes.STRING);
  public static final AttributeReference CITY = new AttributeReference("city", DataTypes.STRING);
  public static final AttributeReference PRODUCT =
      new AttributeReference("product", DataTypes.STRING);
  public static final AttributeReference QUANTITY =
      new AttributeReference("quantity", DataTypes.INT);
  public static final AttributeReference REVENUE =
      new AttributeReference("revenue", DataTypes.DOUBLE);
  public static final AttributeReference PRICE =
      new AttributeReference("price", DataTypes.createDecimalType(10, 2));

  private SalesSchema() {
  }

  public static TableSchemaIndex create() {
    try {
      return TableSchemaBuilder.newInstance()
          .databaseName("retail")
          .tableName("sales")
          .tableProperty(RawScanCommonConstants.DICTIONARY_EXCLUDE, "country")
          .dimension("country", DataTypes.STRING)
          .dimension("city", DataTypes.STRING)
          .dimension("product", DataTypes.STRING)
          .measure("quantity", DataTypes.INT)
          .measure("revenue", DataTypes.DOUBLE)
          .measure("price", DataTypes.createDecimalType(10, 2))
          .create();
    } catch (MalformedSchemaException e) {
      throw new IllegalStateException(e);
    }
  }
}
