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

package org.rawscan.hadoop.api;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.rawscan.common.annotations.InterfaceAudience;
import org.rawscan.common.exceptions.SchemaResolutionException;
import org.rawscan.common.logging.LogService;
import org.rawscan.common.logging.LogServiceFactory;
import org.rawscan.common.logging.impl.StandardLogService;
import org.rawscan.core.constants.RawScanCommonConstants;
import org.rawscan.core.metadata.AbsoluteTableIdentifier;
import org.rawscan.core.metadata.MetaStoreCatalog;
import org.rawscan.core.metadata.TableIdentifier;
import org.rawscan.core.metadata.schema.table.TableSchemaIndex;
import org.rawscan.core.plan.RawQueryPlan;
import org.rawscan.core.plan.RawQueryPlanner;
import org.rawscan.core.plan.logical.AttributeReference;
import org.rawscan.core.plan.logical.LogicalExpression;
import org.rawscan.core.scan.model.OutputSchema;
import org.rawscan.core.scan.result.DimensionKeyDecoder;
import org.rawscan.core.scan.result.ProjectedRowIterator;
import org.rawscan.core.scan.result.RawResultBatch;
import org.rawscan.core.scan.result.RawRowDecoder;
import org.rawscan.hadoop.QueryModel;
import org.rawscan.hadoop.RawPartitionResult;
import org.rawscan.hadoop.RawScanEngine;

import org.apache.hadoop.conf.Configuration;

/**
 * Raw scan of a table: plans the query once, hands it to the scan engine and decodes
 * what the engine returns.
 *
 * <p>{@link #executeRaw} returns one decoder per batch, used by consumers aggregating on
 * the dimension key. {@link #execute} materializes every row over the whole output,
 * including the columns added for residual predicates; the caller evaluates
 * {@link #getResidualPredicates()} on them and keeps the first
 * {@code getOutput().getProjectedCount()} values.
 */
@InterfaceAudience.User
public class RawTableScan {

  private static final LogService LOGGER =
      LogServiceFactory.getLogService(RawTableScan.class.getName());

  private final List<AttributeReference> attributes;

  private final TableIdentifier tableIdentifier;

  private final MetaStoreCatalog catalog;

  private final List<? extends LogicalExpression> dimensionPredicates;

  private final List<? extends LogicalExpression> aggregateExprs;

  private final Configuration conf;

  private final RawQueryPlanner planner;

  private TableSchemaIndex table;

  private RawQueryPlan rawQueryPlan;

  public RawTableScan(List<AttributeReference> attributes, TableIdentifier tableIdentifier,
      MetaStoreCatalog catalog, List<? extends LogicalExpression> dimensionPredicates,
      List<? extends LogicalExpression> aggregateExprs, Configuration conf) {
    this(attributes, tableIdentifier, catalog, dimensionPredicates, aggregateExprs, conf,
        new RawQueryPlanner());
  }

  public RawTableScan(List<AttributeReference> attributes, TableIdentifier tableIdentifier,
      MetaStoreCatalog catalog, List<? extends LogicalExpression> dimensionPredicates,
      List<? extends LogicalExpression> aggregateExprs, Configuration conf,
      RawQueryPlanner planner) {
    this.attributes = new ArrayList<>(attributes);
    this.tableIdentifier = tableIdentifier;
    this.catalog = catalog;
    this.dimensionPredicates = dimensionPredicates == null ?
        Collections.<LogicalExpression>emptyList() : dimensionPredicates;
    this.aggregateExprs = aggregateExprs;
    this.conf = conf;
    this.planner = planner;
  }

  /**
   * Plan the query on first call, later calls return the same plan. The query id is
   * taken from the configuration key {@value RawScanCommonConstants#QUERY_ID} when set.
   */
  public RawQueryPlan getRawQueryPlan() throws IOException, SchemaResolutionException {
    if (rawQueryPlan == null) {
      table = catalog.getTableSchema(tableIdentifier);
      rawQueryPlan = planner.plan(table, attributes, dimensionPredicates, aggregateExprs,
          conf.get(RawScanCommonConstants.QUERY_ID));
    }
    return rawQueryPlan;
  }

  /**
   * @return output columns of the scan, this order replaces the requested order
   */
  public OutputSchema getOutput() throws IOException, SchemaResolutionException {
    return getRawQueryPlan().getOutputSchema();
  }

  public List<LogicalExpression> getResidualPredicates()
      throws IOException, SchemaResolutionException {
    return getRawQueryPlan().getResidualPredicates();
  }

  public QueryModel createQueryModel() throws IOException, SchemaResolutionException {
    RawQueryPlan plan = getRawQueryPlan();
    AbsoluteTableIdentifier absoluteTableIdentifier =
        new AbsoluteTableIdentifier(catalog.getStorePath(), tableIdentifier);
    return QueryModel.createModel(absoluteTableIdentifier, plan, table,
        catalog.getTableCreationTime(tableIdentifier),
        catalog.getSchemaLastUpdatedTime(tableIdentifier));
  }

  /**
   * Run the scan and return one decoder per batch, in partition order
   */
  public List<RawRowDecoder> executeRaw(RawScanEngine engine, DimensionKeyDecoder keyDecoder)
      throws IOException, SchemaResolutionException {
    QueryModel queryModel = createQueryModel();
    List<RawPartitionResult> partitions = engine.execute(queryModel, conf);
    List<RawRowDecoder> decoders = new ArrayList<>();
    for (RawPartitionResult partition : partitions) {
      int rowCount = 0;
      Iterator<RawResultBatch> batches = partition.getBatches();
      while (batches.hasNext()) {
        RawResultBatch batch = batches.next();
        rowCount += batch.size();
        decoders.add(new RawRowDecoder(batch, keyDecoder));
      }
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(StandardLogService.partitionPrefix(partition.getPartitionIndex())
            + "query " + queryModel.getQueryId() + " returned " + rowCount + " raw rows");
      }
    }
    return decoders;
  }

  /**
   * Run the scan and materialize all rows over the whole output
   */
  public List<Object[]> execute(RawScanEngine engine, DimensionKeyDecoder keyDecoder)
      throws IOException, SchemaResolutionException {
    List<Object[]> rows = new ArrayList<>();
    for (RawRowDecoder decoder : executeRaw(engine, keyDecoder)) {
      Iterator<Object[]> iterator = new ProjectedRowIterator(decoder, true);
      while (iterator.hasNext()) {
        rows.add(iterator.next());
      }
    }
    LOGGER.info("Query " + getRawQueryPlan().getQueryPlan().getQueryId() + " returned "
        + rows.size() + " rows");
    return rows;
  }
}
