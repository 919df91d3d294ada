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

import org.apache.calcite.adapter.geosync.CorruptStoredGeometryException;
import org.apache.calcite.adapter.geosync.InvalidGeometryTextException;
import org.apache.calcite.adapter.geosync.PrimaryKeyViolationException;
import org.apache.calcite.adapter.geosync.SchemaMismatchException;
import org.apache.calcite.adapter.geosync.StoreException;
import org.apache.calcite.adapter.geosync.TableNotFoundException;
import org.apache.calcite.adapter.geosync.geometry.WktGeometryCodec;
import org.apache.calcite.adapter.geosync.table.AttributeType;
import org.apache.calcite.adapter.geosync.table.ColumnType;
import org.apache.calcite.adapter.geosync.table.GeoTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persists {@link GeoTable}s to a relational store and reads them back.
 *
 * <p>The store has no spatial type: the geometry column is written as
 * well-known text in a column named {@value #GEOMETRY_COLUMN} and decoded
 * on read. Writes replace the target table wholesale (drop, create, insert,
 * add primary key) so that a rerun of the pipeline yields a clean table.
 * Each table is written in its own transaction; there is no atomicity across
 * the tables of one {@link #write} call.
 *
 * <p>Calls run on connections borrowed from a shared {@link StoreConnection}.
 * Writers of the same table name must be serialized by the caller.
 */
public class RelationalSync {
  private static final Logger LOGGER = LoggerFactory.getLogger(RelationalSync.class);

  /** Name of the stored geometry column. */
  public static final String GEOMETRY_COLUMN = "geometry";

  private static final int BATCH_SIZE = 1000;

  private final StoreConnection connection;
  private final WktGeometryCodec codec;

  public RelationalSync(StoreConnection connection) {
    this(connection, new WktGeometryCodec());
  }

  public RelationalSync(StoreConnection connection, WktGeometryCodec codec) {
    this.connection = connection;
    this.codec = codec;
  }

  /**
   * Writes each table under its descriptor, in order. The caller's tables are
   * not modified.
   *
   * @param tables Tables to write, non-empty
   * @param descriptors One descriptor per table
   * @throws PrimaryKeyViolationException if a table holds duplicate or null
   *     values of its primary attribute
   * @throws org.apache.calcite.adapter.geosync.ConnectionClosedException if
   *     the store connection has been disposed
   */
  public void write(List<GeoTable> tables, List<SyncDescriptor> descriptors) {
    connection.ensureOpen();
    if (tables.isEmpty()) {
      throw new IllegalArgumentException("No tables to write");
    }
    if (tables.size() != descriptors.size()) {
      throw new IllegalArgumentException("Got " + tables.size() + " tables but "
          + descriptors.size() + " descriptors");
    }
    for (int i = 0; i < tables.size(); i++) {
      writeTable(tables.get(i), descriptors.get(i));
    }
  }

  private void writeTable(GeoTable table, SyncDescriptor descriptor) {
    String tableName = descriptor.getTableName();
    if (!GEOMETRY_COLUMN.equals(table.getGeometryColumn())) {
      throw new SchemaMismatchException("Geometry column of table '" + tableName
          + "' must be named '" + GEOMETRY_COLUMN + "', found '" + table.getGeometryColumn() + "'");
    }
    List<String> columns = new ArrayList<>();
    List<StorageType> types = new ArrayList<>();
    if (descriptor.isPersistIndex()) {
      if (table.hasColumn(descriptor.getIndexLabel())) {
        throw new SchemaMismatchException("Index label '" + descriptor.getIndexLabel()
            + "' clashes with a column of table '" + tableName + "'");
      }
      columns.add(descriptor.getIndexLabel());
      types.add(StorageType.BIGINT);
    }
    for (String column : table.getColumnNames()) {
      columns.add(column);
      types.add(storageType(table, descriptor, column));
    }
    String primary = descriptor.getPrimaryAttribute();
    if (!columns.contains(primary)) {
      throw new SchemaMismatchException("Primary attribute '" + primary
          + "' is not a column of table '" + tableName + "'");
    }

    Connection conn = connection.borrow();
    boolean keyStage = false;
    try {
      conn.setAutoCommit(false);
      try (Statement statement = conn.createStatement()) {
        statement.execute("DROP TABLE IF EXISTS " + quote(tableName));
        statement.execute(createTableSql(tableName, columns, types));
      }
      insertRows(conn, table, descriptor, columns, types);
      keyStage = true;
      try (Statement statement = conn.createStatement()) {
        statement.execute("ALTER TABLE " + quote(tableName) + " ADD PRIMARY KEY ("
            + quote(primary) + ")");
      }
      conn.commit();
      LOGGER.info("Wrote table {} ({} rows, primary key {})", tableName, table.size(), primary);
    } catch (SQLException e) {
      rollback(conn, e);
      if (keyStage && isKeyViolation(e)) {
        PrimaryKeyViolationException violation =
            new PrimaryKeyViolationException(tableName, primary, e);
        dropIfDuplicated(conn, tableName, primary, violation);
        throw violation;
      }
      throw new StoreException("Failed to write table '" + tableName + "'", e);
    } catch (RuntimeException e) {
      rollback(conn, e);
      throw e;
    } finally {
      release(conn);
    }
  }

  private static StorageType storageType(GeoTable table, SyncDescriptor descriptor,
      String column) {
    ColumnType columnType = table.getColumnType(column);
    if (columnType == ColumnType.GEOMETRY) {
      return StorageType.WKT;
    }
    String tag = descriptor.getColumnTypes().get(column);
    return tag == null ? StorageType.defaultFor(columnType) : StorageType.fromTag(tag);
  }

  private static String createTableSql(String tableName, List<String> columns,
      List<StorageType> types) {
    StringBuilder sql = new StringBuilder("CREATE TABLE ").append(quote(tableName)).append(" (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(quote(columns.get(i))).append(' ').append(types.get(i).getSqlType());
    }
    return sql.append(')').toString();
  }

  private void insertRows(Connection conn, GeoTable table, SyncDescriptor descriptor,
      List<String> columns, List<StorageType> types) throws SQLException {
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(quote(descriptor.getTableName()))
        .append(" (");
    for (int i = 0; i < columns.size(); i++) {
      sql.append(i > 0 ? ", " : "").append(quote(columns.get(i)));
    }
    sql.append(") VALUES (").append(String.join(", ", Collections.nCopies(columns.size(), "?")))
        .append(')');
    int offset = descriptor.isPersistIndex() ? 1 : 0;
    int geometryPosition = table.getColumnNames().indexOf(table.getGeometryColumn());
    try (PreparedStatement insert = conn.prepareStatement(sql.toString())) {
      int pending = 0;
      for (int row = 0; row < table.size(); row++) {
        Object[] values = table.getRow(row);
        Geometry geometry = (Geometry) values[geometryPosition];
        values[geometryPosition] = geometry == null ? null : codec.encode(geometry);
        if (descriptor.isPersistIndex()) {
          types.get(0).bind(insert, 1, (long) row);
        }
        for (int c = 0; c < values.length; c++) {
          types.get(c + offset).bind(insert, c + offset + 1, values[c]);
        }
        insert.addBatch();
        if (++pending == BATCH_SIZE) {
          insert.executeBatch();
          pending = 0;
        }
      }
      if (pending > 0) {
        insert.executeBatch();
      }
    }
    LOGGER.debug("Inserted {} rows into {}", table.size(), descriptor.getTableName());
  }

  /** SQLState class 23: 23505 unique violation, 23502 null in a key column. */
  static boolean isKeyViolation(SQLException e) {
    for (SQLException x = e; x != null; x = x.getNextException()) {
      String state = x.getSQLState();
      if ("23505".equals(state) || "23502".equals(state)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Drops the table if it holds duplicate or null keys. Stores with
   * transactional DDL have already restored the previous table on rollback;
   * others keep the freshly inserted rows.
   */
  private void dropIfDuplicated(Connection conn, String tableName, String primary,
      PrimaryKeyViolationException violation) {
    try {
      if (!tableExists(conn, tableName)) {
        return;
      }
      conn.setAutoCommit(true);
      try (Statement statement = conn.createStatement()) {
        boolean duplicated;
        try (ResultSet rs = statement.executeQuery("SELECT COUNT(*), COUNT(DISTINCT "
            + quote(primary) + ") FROM " + quote(tableName))) {
          rs.next();
          duplicated = rs.getLong(1) != rs.getLong(2);
        }
        if (duplicated) {
          statement.execute("DROP TABLE " + quote(tableName));
          LOGGER.warn("Dropped table {} after primary key violation on {}", tableName, primary);
        }
      }
    } catch (SQLException e) {
      violation.addSuppressed(e);
    }
  }

  /**
   * Reads a stored table.
   *
   * @param tableName Stored table name
   * @param typeMap Attribute to in-memory type tag; attributes absent keep the
   *     type inferred from the store
   * @param indexAttribute Attribute identifying rows, or null for positional
   *     identity
   * @throws TableNotFoundException if the table does not exist
   * @throws CorruptStoredGeometryException if a stored geometry is not valid
   *     well-known text
   */
  public GeoTable read(String tableName, Map<String, String> typeMap,
      @Nullable String indexAttribute) {
    connection.ensureOpen();
    GeoTable table;
    Connection conn = connection.borrow();
    try {
      if (!tableExists(conn, tableName)) {
        throw new TableNotFoundException(tableName);
      }
      List<String> keys = primaryKeyColumns(conn, tableName);
      table = select(conn, tableName, keys);
    } catch (SQLException e) {
      throw new StoreException("Failed to read table '" + tableName + "'", e);
    } finally {
      release(conn);
    }
    for (Map.Entry<String, String> entry : typeMap.entrySet()) {
      if (!table.hasColumn(entry.getKey())) {
        throw new SchemaMismatchException("Type map names attribute '" + entry.getKey()
            + "' which table '" + tableName + "' does not have");
      }
      table = table.withAttributeType(entry.getKey(), AttributeType.fromTag(entry.getValue()));
    }
    if (indexAttribute != null) {
      table = table.withIndex(indexAttribute);
    }
    LOGGER.debug("Read table {} ({} rows)", tableName, table.size());
    return table;
  }

  /** Reads a stored table with inferred types and positional identity. */
  public GeoTable read(String tableName) {
    return read(tableName, Collections.emptyMap(), null);
  }

  private GeoTable select(Connection conn, String tableName, List<String> keys)
      throws SQLException {
    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quote(tableName));
    if (!keys.isEmpty()) {
      sql.append(" ORDER BY ");
      for (int i = 0; i < keys.size(); i++) {
        sql.append(i > 0 ? ", " : "").append(quote(keys.get(i)));
      }
    }
    try (Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery(sql.toString())) {
      ResultSetMetaData meta = rs.getMetaData();
      int count = meta.getColumnCount();
      ColumnType[] types = new ColumnType[count];
      GeoTable.Builder builder = GeoTable.builder().srid(codec.getGeometryFactory().getSRID());
      boolean hasGeometry = false;
      for (int c = 1; c <= count; c++) {
        String name = meta.getColumnLabel(c);
        if (GEOMETRY_COLUMN.equals(name)) {
          types[c - 1] = ColumnType.GEOMETRY;
          hasGeometry = true;
          builder.geometryColumn(name);
        } else {
          types[c - 1] = inferType(tableName, name, meta.getColumnType(c));
          builder.column(name, types[c - 1]);
        }
      }
      if (!hasGeometry) {
        throw new SchemaMismatchException("Table '" + tableName + "' has no '"
            + GEOMETRY_COLUMN + "' column");
      }
      int row = 0;
      while (rs.next()) {
        Object[] values = new Object[count];
        for (int c = 1; c <= count; c++) {
          values[c - 1] = value(rs, c, types[c - 1], tableName, row);
        }
        builder.row(values);
        row++;
      }
      return builder.build();
    }
  }

  private @Nullable Object value(ResultSet rs, int column, ColumnType type, String tableName,
      int row) throws SQLException {
    switch (type) {
    case GEOMETRY:
      String text = rs.getString(column);
      if (text == null) {
        return null;
      }
      try {
        return codec.decode(text);
      } catch (InvalidGeometryTextException e) {
        throw new CorruptStoredGeometryException(tableName, row, e);
      }
    case INTEGER:
      long l = rs.getLong(column);
      return rs.wasNull() ? null : l;
    case FLOAT:
      double d = rs.getDouble(column);
      return rs.wasNull() ? null : d;
    default:
      return rs.getString(column);
    }
  }

  private static ColumnType inferType(String tableName, String column, int sqlType) {
    switch (sqlType) {
    case Types.TINYINT:
    case Types.SMALLINT:
    case Types.INTEGER:
    case Types.BIGINT:
      return ColumnType.INTEGER;
    case Types.REAL:
    case Types.FLOAT:
    case Types.DOUBLE:
    case Types.NUMERIC:
    case Types.DECIMAL:
      return ColumnType.FLOAT;
    case Types.CHAR:
    case Types.VARCHAR:
    case Types.LONGVARCHAR:
    case Types.NCHAR:
    case Types.NVARCHAR:
    case Types.LONGNVARCHAR:
    case Types.CLOB:
    case Types.NCLOB:
      return ColumnType.TEXT;
    default:
      throw new SchemaMismatchException("Column '" + column + "' of table '" + tableName
          + "' has unsupported SQL type " + sqlType);
    }
  }

  private static boolean tableExists(Connection conn, String tableName) throws SQLException {
    DatabaseMetaData meta = conn.getMetaData();
    try (ResultSet rs = meta.getTables(null, conn.getSchema(),
        escape(tableName, meta.getSearchStringEscape()), null)) {
      while (rs.next()) {
        if (tableName.equals(rs.getString("TABLE_NAME"))) {
          return true;
        }
      }
    }
    return false;
  }

  private static List<String> primaryKeyColumns(Connection conn, String tableName)
      throws SQLException {
    Map<Short, String> byPosition = new TreeMap<>();
    try (ResultSet rs = conn.getMetaData().getPrimaryKeys(null, conn.getSchema(), tableName)) {
      while (rs.next()) {
        byPosition.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
      }
    }
    return new ArrayList<>(byPosition.values());
  }

  private static String escape(String pattern, @Nullable String escape) {
    if (escape == null || escape.isEmpty()) {
      return pattern;
    }
    return pattern.replace(escape, escape + escape)
        .replace("_", escape + "_")
        .replace("%", escape + "%");
  }

  static String quote(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void release(Connection conn) {
    try (Connection c = conn) {
      if (!c.getAutoCommit()) {
        c.setAutoCommit(true);
      }
    } catch (SQLException e) {
      LOGGER.warn("Failed to return connection to the pool: {}", e.getMessage());
    }
  }

  /** Releases the store connection. Idempotent. */
  public void dispose() {
    connection.dispose();
  }
}
