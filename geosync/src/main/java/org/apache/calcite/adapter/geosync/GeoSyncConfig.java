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

import org.apache.calcite.adapter.geosync.source.HttpSourceFetcher;
import org.apache.calcite.adapter.geosync.store.StoreConfig;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Pipeline configuration, read from {@code geosync.yaml}.
 *
 * <pre>{@code
 * store:
 *   host: ${GEOSYNC_DB_HOST:postgres}
 *   password: ${GEOSYNC_DB_PASSWORD:password}
 * fetch:
 *   readTimeoutMs: 300000
 * datasets:
 *   - name: uk-regions
 *     type: feature-service
 *     endpoints:
 *       regions: https://...
 * }</pre>
 */
public class GeoSyncConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(GeoSyncConfig.class);

  public static final String DEFAULT_RESOURCE = "geosync.yaml";

  private final StoreConfig store;
  private final int connectTimeoutMs;
  private final int readTimeoutMs;
  private final String userAgent;
  private final List<DatasetConfig> datasets;

  GeoSyncConfig(StoreConfig store, int connectTimeoutMs, int readTimeoutMs, String userAgent,
      List<DatasetConfig> datasets) {
    this.store = store;
    this.connectTimeoutMs = connectTimeoutMs;
    this.readTimeoutMs = readTimeoutMs;
    this.userAgent = userAgent;
    this.datasets = Collections.unmodifiableList(new ArrayList<>(datasets));
  }

  /** Loads a configuration file, resolving placeholders from the environment. */
  public static GeoSyncConfig load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      LOGGER.info("Loading configuration from {}", path);
      return fromJson(YamlUtils.parseYamlOrJson(in, path.getFileName().toString()),
          YamlUtils.ENVIRONMENT);
    }
  }

  /** Loads a configuration from the classpath. */
  public static GeoSyncConfig loadResource(String resource) throws IOException {
    try (InputStream in = GeoSyncConfig.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Configuration resource not found: " + resource);
      }
      LOGGER.info("Loading configuration from classpath resource {}", resource);
      return fromJson(YamlUtils.parseYamlOrJson(in, resource), YamlUtils.ENVIRONMENT);
    }
  }

  /**
   * Builds a configuration from a parsed tree.
   *
   * @param root Parsed configuration
   * @param lookup Resolves placeholder variables
   * @throws IllegalArgumentException if a dataset entry is invalid or two
   *     datasets share a name
   */
  public static GeoSyncConfig fromJson(JsonNode root, UnaryOperator<String> lookup) {
    JsonNode resolved = YamlUtils.resolvePlaceholders(root, lookup);
    StoreConfig store = StoreConfig.fromJson(resolved.get("store"));
    JsonNode fetch = resolved.path("fetch");
    List<DatasetConfig> datasets = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (JsonNode node : resolved.path("datasets")) {
      DatasetConfig dataset = DatasetConfig.fromJson(node);
      if (!names.add(dataset.getName())) {
        throw new IllegalArgumentException("Duplicate dataset name: " + dataset.getName());
      }
      datasets.add(dataset);
    }
    return new GeoSyncConfig(store,
        fetch.path("connectTimeoutMs").asInt(HttpSourceFetcher.DEFAULT_CONNECT_TIMEOUT_MS),
        fetch.path("readTimeoutMs").asInt(HttpSourceFetcher.DEFAULT_READ_TIMEOUT_MS),
        fetch.path("userAgent").asText(HttpSourceFetcher.DEFAULT_USER_AGENT),
        datasets);
  }

  public HttpSourceFetcher createFetcher() {
    return new HttpSourceFetcher(connectTimeoutMs, readTimeoutMs, userAgent);
  }

  public StoreConfig getStore() {
    return store;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public int getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public List<DatasetConfig> getDatasets() {
    return datasets;
  }
}
