/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.geosync;

import org.apache.calcite.adapter.geosync.source.FeatureServiceLoader;
import org.apache.calcite.adapter.geosync.source.ShapefileArchiveLoader;
import org.apache.calcite.adapter.geosync.source.SourceFetcher;
import org.apache.calcite.adapter.geosync.store.RelationalSync;
import org.apache.calcite.adapter.geosync.store.StoreConnection;
import org.apache.calcite.adapter.geosync.store.SyncDescriptor;
import org.apache.calcite.adapter.geosync.table.GeoTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads every configured dataset and writes its tables to the store.
 *
 * <p>Each dataset is written by its own {@link RelationalSync#write} call. A
 * dataset that fails is reported in its {@link SyncResult} and does not stop
 * the others.
 */
public class GeoSyncPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(GeoSyncPipeline.class);

  private final GeoSyncConfig config;
  private final ShapefileArchiveLoader shapefileLoader;
  private final FeatureServiceLoader featureServiceLoader;
  private final RelationalSync sync;

  public GeoSyncPipeline(GeoSyncConfig config, SourceFetcher fetcher, RelationalSync sync) {
    this.config = config;
    this.shapefileLoader = new ShapefileArchiveLoader(fetcher);
    this.featureServiceLoader = new FeatureServiceLoader(fetcher);
    this.sync = sync;
  }

  /** Synchronizes all datasets, in configuration order. */
  public List<SyncResult> run() {
    List<SyncResult> results = new ArrayList<>();
    for (DatasetConfig dataset : config.getDatasets()) {
      results.add(syncDataset(dataset));
    }
    long failed = results.stream().filter(r -> !r.isSuccess()).count();
    LOGGER.info("Synchronized {} datasets, {} failed", results.size(), failed);
    return results;
  }

  /** Loads and writes one dataset, capturing its failure. */
  public SyncResult syncDataset(DatasetConfig dataset) {
    try {
      Map<String, GeoTable> tables = loadDataset(dataset);
      if (tables.isEmpty()) {
        LOGGER.warn("Dataset {} produced no tables", dataset.getName());
        return new SyncResult(dataset.getName(), Collections.emptyList(), null);
      }
      List<GeoTable> toWrite = new ArrayList<>(tables.values());
      List<SyncDescriptor> descriptors = new ArrayList<>();
      for (Map.Entry<String, GeoTable> entry : tables.entrySet()) {
        descriptors.add(descriptor(dataset, entry.getKey(), entry.getValue()));
      }
      sync.write(toWrite, descriptors);
      LOGGER.info("Dataset {} written as {}", dataset.getName(), tables.keySet());
      return new SyncResult(dataset.getName(), new ArrayList<>(tables.keySet()), null);
    } catch (ConnectionClosedException e) {
      throw e;
    } catch (GeoSyncException | IllegalArgumentException e) {
      LOGGER.error("Dataset {} failed: {}", dataset.getName(), e.getMessage(), e);
      return new SyncResult(dataset.getName(), Collections.emptyList(), e);
    }
  }

  Map<String, GeoTable> loadDataset(DatasetConfig dataset) {
    switch (dataset.getType()) {
    case SHAPEFILE:
      return shapefileLoader.load(dataset.getUrl(), dataset.getIdentityColumn(),
          dataset.tableNamer());
    case FEATURE_SERVICE:
      return featureServiceLoader.load(dataset.getEndpoints(), dataset.getLayout(),
          dataset.getNameCleanup());
    default:
      throw new AssertionError(dataset.getType());
    }
  }

  /**
   * Derives the descriptor of one table: keyed by the table's index attribute,
   * with the dataset's storage tags for the columns the table has.
   */
  static SyncDescriptor descriptor(DatasetConfig dataset, String tableName, GeoTable table) {
    String primary = table.getIndexColumn();
    if (primary == null) {
      throw new SchemaMismatchException("Table '" + tableName + "' of dataset '"
          + dataset.getName() + "' has no identity attribute");
    }
    Map<String, String> types = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : dataset.getColumnTypes().entrySet()) {
      if (table.hasColumn(entry.getKey())) {
        types.put(entry.getKey(), entry.getValue());
      }
    }
    return SyncDescriptor.builder()
        .tableName(tableName)
        .primaryAttribute(primary)
        .columnTypes(types)
        .persistIndex(dataset.isPersistIndex())
        .build();
  }

  /** Outcome of synchronizing one dataset. */
  public static final class SyncResult {
    private final String datasetName;
    private final List<String> tables;
    private final @Nullable RuntimeException error;

    SyncResult(String datasetName, List<String> tables, @Nullable RuntimeException error) {
      this.datasetName = datasetName;
      this.tables = Collections.unmodifiableList(tables);
      this.error = error;
    }

    public String getDatasetName() {
      return datasetName;
    }

    /** Names of the tables written; empty on failure. */
    public List<String> getTables() {
      return tables;
    }

    public @Nullable RuntimeException getError() {
      return error;
    }

    public boolean isSuccess() {
      return error == null;
    }

    @Override public String toString() {
      return isSuccess()
          ? datasetName + ": " + tables
          : datasetName + ": FAILED (" + error.getMessage() + ")";
    }
  }

  /**
   * Runs the pipeline.
   *
   * @param args Optional path of the configuration file; the classpath
   *     resource {@value GeoSyncConfig#DEFAULT_RESOURCE} otherwise
   */
  public static void main(String[] args) throws IOException {
    GeoSyncConfig config = args.length > 0
        ? GeoSyncConfig.load(Paths.get(args[0]))
        : GeoSyncConfig.loadResource(GeoSyncConfig.DEFAULT_RESOURCE);
    List<SyncResult> results;
    try (StoreConnection connection = new StoreConnection(config.getStore())) {
      GeoSyncPipeline pipeline =
          new GeoSyncPipeline(config, config.createFetcher(), new RelationalSync(connection));
      results = pipeline.run();
    }
    boolean failed = false;
    for (SyncResult result : results) {
      LOGGER.info("{}", result);
      failed |= !result.isSuccess();
    }
    if (failed) {
      System.exit(1);
    }
  }
}
