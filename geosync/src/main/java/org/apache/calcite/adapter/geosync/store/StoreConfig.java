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
package org.apache.calcite.adapter.geosync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Properties;

/**
 * Connection parameters for the relational store.
 *
 * <p>Defaults address the PostgreSQL service of the reference deployment
 * (host {@code postgres}, port 5432, database {@code github_projects}). An
 * explicit {@code jdbcUrl} overrides host, port and database.
 */
public class StoreConfig {
  public static final String DEFAULT_HOST = "postgres";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_DATABASE = "github_projects";
  public static final String DEFAULT_USER = "postgres";
  public static final int DEFAULT_MAX_POOL_SIZE = 4;
  public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30000L;

  private final String jdbcUrl;
  private final String user;
  private final String password;
  private final @Nullable String schema;
  private final int maxPoolSize;
  private final long connectionTimeoutMs;

  public StoreConfig(String jdbcUrl, String user, String password, @Nullable String schema,
      int maxPoolSize, long connectionTimeoutMs) {
    if (maxPoolSize < 1) {
      throw new IllegalArgumentException("maxPoolSize must be positive: " + maxPoolSize);
    }
    this.jdbcUrl = jdbcUrl;
    this.user = user;
    this.password = password;
    this.schema = schema;
    this.maxPoolSize = maxPoolSize;
    this.connectionTimeoutMs = connectionTimeoutMs;
  }

  public StoreConfig(String jdbcUrl, String user, String password) {
    this(jdbcUrl, user, password, null, DEFAULT_MAX_POOL_SIZE, DEFAULT_CONNECTION_TIMEOUT_MS);
  }

  public static String postgresUrl(String host, int port, String database) {
    return "jdbc:postgresql://" + host + ":" + port + "/" + database;
  }

  /**
   * Reads the {@code store} section of the configuration. Placeholders must
   * already be resolved.
   */
  public static StoreConfig fromJson(@Nullable JsonNode node) {
    JsonNode store = node == null ? MissingNode.getInstance() : node;
    String jdbcUrl = text(store, "jdbcUrl", null);
    if (jdbcUrl == null) {
      jdbcUrl = postgresUrl(text(store, "host", DEFAULT_HOST),
          store.path("port").asInt(DEFAULT_PORT),
          text(store, "database", DEFAULT_DATABASE));
    }
    return new StoreConfig(jdbcUrl,
        text(store, "user", DEFAULT_USER),
        text(store, "password", ""),
        text(store, "schema", null),
        store.path("maxPoolSize").asInt(DEFAULT_MAX_POOL_SIZE),
        store.path("connectionTimeoutMs").asLong(DEFAULT_CONNECTION_TIMEOUT_MS));
  }

  private static @Nullable String text(JsonNode node, String field,
      @Nullable String defaultValue) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.asText().isEmpty()) {
      return defaultValue;
    }
    return value.asText();
  }

  /** Returns the properties used to configure the connection pool. */
  public Properties toPoolProperties(String poolName) {
    Properties props = new Properties();
    props.setProperty("jdbcUrl", jdbcUrl);
    props.setProperty("username", user);
    props.setProperty("password", password);
    props.setProperty("maximumPoolSize", String.valueOf(maxPoolSize));
    props.setProperty("connectionTimeout", String.valueOf(connectionTimeoutMs));
    props.setProperty("autoCommit", "true");
    props.setProperty("poolName", poolName);
    if (schema != null) {
      props.setProperty("schema", schema);
    }
    return props;
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public String getUser() {
    return user;
  }

  public String getPassword() {
    return password;
  }

  public @Nullable String getSchema() {
    return schema;
  }

  public int getMaxPoolSize() {
    return maxPoolSize;
  }

  public long getConnectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  @Override public String toString() {
    return "StoreConfig{jdbcUrl=" + jdbcUrl + ", user=" + user + ", schema=" + schema
        + ", maxPoolSize=" + maxPoolSize + "}";
  }
}
