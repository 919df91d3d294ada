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

import org.apache.calcite.adapter.geosync.ConnectionClosedException;
import org.apache.calcite.adapter.geosync.StoreException;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pooled handle to the relational store, shared by every read and write of a
 * pipeline run.
 *
 * <p>The pool is created on first use. Once disposed the handle is terminal:
 * borrowing a connection fails with {@link ConnectionClosedException}.
 * {@link #close()} disposes, so the handle can own a try-with-resources scope.
 */
public class StoreConnection implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(StoreConnection.class);

  private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

  /** Lifecycle of a store handle. */
  public enum State {
    UNCONNECTED, CONNECTED, DISPOSED
  }

  private final StoreConfig config;
  private final String poolName;
  private @Nullable HikariDataSource dataSource;
  private State state = State.UNCONNECTED;

  public StoreConnection(StoreConfig config) {
    this.config = config;
    this.poolName = "geosync-" + POOL_COUNTER.incrementAndGet();
  }

  public StoreConfig getConfig() {
    return config;
  }

  public synchronized State getState() {
    return state;
  }

  /**
   * Borrows a pooled connection. The caller closes it to return it to the pool.
   *
   * @throws ConnectionClosedException if this handle has been disposed
   */
  public Connection borrow() {
    HikariDataSource ds = dataSource();
    try {
      return ds.getConnection();
    } catch (SQLException e) {
      throw new StoreException("Could not obtain a connection to " + config.getJdbcUrl(), e);
    }
  }

  /**
   * Fails fast on a disposed handle, before any argument checks of the caller.
   *
   * @throws ConnectionClosedException if this handle has been disposed
   */
  public synchronized void ensureOpen() {
    if (state == State.DISPOSED) {
      throw new ConnectionClosedException("Store connection " + poolName + " has been disposed");
    }
  }

  private synchronized HikariDataSource dataSource() {
    switch (state) {
    case DISPOSED:
      throw new ConnectionClosedException("Store connection " + poolName + " has been disposed");
    case UNCONNECTED:
      dataSource = new HikariDataSource(new HikariConfig(config.toPoolProperties(poolName)));
      state = State.CONNECTED;
      LOGGER.info("Opened store connection pool {} to {}", poolName, config.getJdbcUrl());
      return dataSource;
    default:
      return dataSource;
    }
  }

  /** Releases the pool. Idempotent. */
  public synchronized void dispose() {
    if (state == State.DISPOSED) {
      return;
    }
    if (dataSource != null) {
      dataSource.close();
      dataSource = null;
    }
    state = State.DISPOSED;
    LOGGER.info("Disposed store connection pool {}", poolName);
  }

  @Override public void close() {
    dispose();
  }
}
