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

import org.apache.calcite.adapter.geosync.table.AttributeType;
import org.apache.calcite.adapter.geosync.table.ColumnType;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Column type of a stored table, named by the storage tags a
 * {@link SyncDescriptor} uses.
 */
public enum StorageType {
  VARCHAR("VARCHAR", Types.VARCHAR, AttributeType.STRING, "text", "string", "varchar"),
  WKT("TEXT", Types.VARCHAR, AttributeType.STRING, "wkt"),
  SMALLINT("SMALLINT", Types.SMALLINT, AttributeType.INT16, "smallint", "int16"),
  INTEGER("INTEGER", Types.INTEGER, AttributeType.INT32, "integer", "int", "int32"),
  BIGINT("BIGINT", Types.BIGINT, AttributeType.INT64, "bigint", "int64"),
  REAL("REAL", Types.REAL, AttributeType.FLOAT32, "real", "float32"),
  DOUBLE("DOUBLE PRECISION", Types.DOUBLE, AttributeType.FLOAT64, "double", "float", "float64");

  private final String sqlType;
  private final int jdbcType;
  private final AttributeType attributeType;
  private final List<String> tags;

  StorageType(String sqlType, int jdbcType, AttributeType attributeType, String... tags) {
    this.sqlType = sqlType;
    this.jdbcType = jdbcType;
    this.attributeType = attributeType;
    this.tags = Arrays.asList(tags);
  }

  /** Returns the type used in CREATE TABLE. */
  public String getSqlType() {
    return sqlType;
  }

  /**
   * Resolves a storage tag, ignoring case.
   *
   * @throws IllegalArgumentException if the tag is not known
   */
  public static StorageType fromTag(String tag) {
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    for (StorageType type : values()) {
      if (type.tags.contains(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown storage type tag: " + tag);
  }

  /** Storage type for a column that its descriptor does not mention. */
  public static StorageType defaultFor(ColumnType columnType) {
    switch (columnType) {
    case TEXT:
      return VARCHAR;
    case INTEGER:
      return BIGINT;
    case FLOAT:
      return DOUBLE;
    case GEOMETRY:
      return WKT;
    default:
      throw new AssertionError(columnType);
    }
  }

  /**
   * Binds a value, converting it to this type first.
   *
   * @throws org.apache.calcite.adapter.geosync.SchemaMismatchException if the
   *     value does not fit
   */
  void bind(PreparedStatement statement, int parameter, @Nullable Object value)
      throws SQLException {
    Object converted = attributeType.coerce(value);
    if (converted == null) {
      statement.setNull(parameter, jdbcType);
      return;
    }
    switch (this) {
    case VARCHAR:
    case WKT:
      statement.setString(parameter, (String) converted);
      break;
    case SMALLINT:
      statement.setShort(parameter, (Short) converted);
      break;
    case INTEGER:
      statement.setInt(parameter, (Integer) converted);
      break;
    case BIGINT:
      statement.setLong(parameter, (Long) converted);
      break;
    case REAL:
      statement.setFloat(parameter, (Float) converted);
      break;
    case DOUBLE:
      statement.setDouble(parameter, (Double) converted);
      break;
    default:
      throw new AssertionError(this);
    }
  }
}
