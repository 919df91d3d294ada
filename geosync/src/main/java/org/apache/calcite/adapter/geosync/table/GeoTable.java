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
package org.apache.calcite.adapter.geosync.table;

import org.apache.calcite.adapter.geosync.SchemaMismatchException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical in-memory geospatial table: ordered, typed attribute columns plus
 * exactly one geometry column.
 *
 * <p>Row identity is either positional (the default) or the value of an index
 * attribute. An index attribute must hold unique, non-null values. The
 * geometry column may mix subtypes (for example Polygon and MultiPolygon).
 * Coordinates are in the reference system given by {@link #getSrid()}, which
 * is dataset-level metadata and never stored per value.
 *
 * <p>Instances are immutable; the {@code with*} methods return new tables.
 */
public final class GeoTable {
  /** Reference system of every dataset in this pipeline (WGS 84 lon/lat). */
  public static final int DEFAULT_SRID = 4326;

  private final List<String> columnNames;
  private final Map<String, ColumnType> columnTypes;
  private final String geometryColumn;
  private final List<Object[]> rows;
  private final @Nullable String indexColumn;
  private final Map<Object, Integer> indexPositions;
  private final int srid;

  private GeoTable(Map<String, ColumnType> columnTypes, List<Object[]> rows,
      @Nullable String indexColumn, int srid) {
    this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
    this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnTypes.keySet()));
    this.geometryColumn = findGeometryColumn(columnTypes);
    this.rows = Collections.unmodifiableList(rows);
    this.indexColumn = indexColumn;
    this.srid = srid;

    for (Object[] row : rows) {
      if (row.length != columnNames.size()) {
        throw new IllegalArgumentException("Row has " + row.length + " values but table has "
            + columnNames.size() + " columns");
      }
    }
    int geometryPosition = columnNames.indexOf(geometryColumn);
    for (Object[] row : rows) {
      Object value = row[geometryPosition];
      if (value != null && !(value instanceof Geometry)) {
        throw new IllegalArgumentException("Geometry column '" + geometryColumn
            + "' holds a " + value.getClass().getName());
      }
    }
    this.indexPositions = indexColumn == null ? Collections.emptyMap() : buildIndex(indexColumn);
  }

  private static String findGeometryColumn(Map<String, ColumnType> columnTypes) {
    String found = null;
    for (Map.Entry<String, ColumnType> entry : columnTypes.entrySet()) {
      if (entry.getValue() == ColumnType.GEOMETRY) {
        if (found != null) {
          throw new IllegalArgumentException("More than one geometry column: " + found
              + ", " + entry.getKey());
        }
        found = entry.getKey();
      }
    }
    if (found == null) {
      throw new IllegalArgumentException("Table has no geometry column");
    }
    return found;
  }

  private Map<Object, Integer> buildIndex(String column) {
    ColumnType type = columnTypes.get(column);
    if (type == null) {
      throw new SchemaMismatchException("Index attribute '" + column + "' is not a column");
    }
    if (type == ColumnType.GEOMETRY) {
      throw new SchemaMismatchException("Geometry column cannot be the index");
    }
    int position = columnNames.indexOf(column);
    Map<Object, Integer> positions = new HashMap<>();
    for (int i = 0; i < rows.size(); i++) {
      Object key = rows.get(i)[position];
      if (key == null) {
        throw new SchemaMismatchException("Null identity in row " + i + " of index '"
            + column + "'");
      }
      Integer previous = positions.put(key, i);
      if (previous != null) {
        throw new SchemaMismatchException("Duplicate identity '" + key + "' in index '"
            + column + "' (rows " + previous + " and " + i + ")");
      }
    }
    return positions;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return rows.size();
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public Map<String, ColumnType> getColumnTypes() {
    return columnTypes;
  }

  public boolean hasColumn(String name) {
    return columnTypes.containsKey(name);
  }

  public ColumnType getColumnType(String name) {
    ColumnType type = columnTypes.get(name);
    if (type == null) {
      throw new IllegalArgumentException("No such column: " + name);
    }
    return type;
  }

  public String getGeometryColumn() {
    return geometryColumn;
  }

  /** Returns the index attribute, or null when rows are identified by position. */
  public @Nullable String getIndexColumn() {
    return indexColumn;
  }

  public int getSrid() {
    return srid;
  }

  public @Nullable Object getValue(int row, String column) {
    return rows.get(row)[position(column)];
  }

  public @Nullable Geometry getGeometry(int row) {
    return (Geometry) rows.get(row)[position(geometryColumn)];
  }

  /** Returns a copy of the row's values in column order. */
  public Object[] getRow(int row) {
    return rows.get(row).clone();
  }

  public List<Object> getColumnValues(String column) {
    int position = position(column);
    List<Object> values = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      values.add(row[position]);
    }
    return values;
  }

  /** Returns the identity of a row: its index attribute value, or its position. */
  public Object getIndexValue(int row) {
    if (indexColumn == null) {
      return row;
    }
    return rows.get(row)[position(indexColumn)];
  }

  public List<Object> getIndexValues() {
    List<Object> values = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      values.add(getIndexValue(i));
    }
    return values;
  }

  /**
   * Finds the row with the given identity.
   *
   * @return the row position, or -1 if there is none
   */
  public int findRow(Object identity) {
    if (indexColumn == null) {
      if (identity instanceof Integer) {
        int position = (Integer) identity;
        return position >= 0 && position < rows.size() ? position : -1;
      }
      return -1;
    }
    Integer position = indexPositions.get(identity);
    return position == null ? -1 : position;
  }

  /** Returns a table identified by the given attribute. */
  public GeoTable withIndex(String column) {
    return new GeoTable(columnTypes, rows, column, srid);
  }

  /** Returns a table with positional row identity. */
  public GeoTable withPositionalIndex() {
    return new GeoTable(columnTypes, rows, null, srid);
  }

  /**
   * Returns a table in which the given attribute is converted to a type.
   *
   * @throws SchemaMismatchException if a value cannot be converted, or the
   *     column is the geometry column
   */
  public GeoTable withAttributeType(String column, AttributeType type) {
    ColumnType current = getColumnType(column);
    if (current == ColumnType.GEOMETRY) {
      throw new SchemaMismatchException("Cannot retype geometry column '" + column + "'");
    }
    int position = position(column);
    List<Object[]> converted = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      Object[] copy = row.clone();
      copy[position] = type.coerce(row[position]);
      converted.add(copy);
    }
    Map<String, ColumnType> types = new LinkedHashMap<>(columnTypes);
    types.put(column, type.getColumnType());
    return new GeoTable(types, converted, indexColumn, srid);
  }

  private int position(String column) {
    int position = columnNames.indexOf(column);
    if (position < 0) {
      throw new IllegalArgumentException("No such column: " + column);
    }
    return position;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GeoTable)) {
      return false;
    }
    GeoTable that = (GeoTable) o;
    if (srid != that.srid
        || !columnTypes.equals(that.columnTypes)
        || !columnNames.equals(that.columnNames)
        || !Objects.equals(indexColumn, that.indexColumn)
        || rows.size() != that.rows.size()) {
      return false;
    }
    for (int i = 0; i < rows.size(); i++) {
      if (!Arrays.deepEquals(rows.get(i), that.rows.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override public int hashCode() {
    int result = Objects.hash(columnNames, indexColumn, srid);
    for (Object[] row : rows) {
      result = 31 * result + Arrays.deepHashCode(row);
    }
    return result;
  }

  @Override public String toString() {
    return "GeoTable{columns=" + columnTypes + ", index=" + indexColumn
        + ", rows=" + rows.size() + ", srid=" + srid + "}";
  }

  /**
   * Builder for {@link GeoTable}. Columns are added in order; rows must supply
   * one value per column.
   */
  public static final class Builder {
    private final Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
    private final List<Object[]> rows = new ArrayList<>();
    private @Nullable String indexColumn;
    private int srid = DEFAULT_SRID;

    private Builder() {
    }

    public Builder column(String name, ColumnType type) {
      if (columnTypes.put(name, type) != null) {
        throw new IllegalArgumentException("Duplicate column: " + name);
      }
      return this;
    }

    public Builder geometryColumn(String name) {
      return column(name, ColumnType.GEOMETRY);
    }

    public Builder row(Object... values) {
      rows.add(values.clone());
      return this;
    }

    public Builder rows(List<Object[]> values) {
      for (Object[] row : values) {
        row(row);
      }
      return this;
    }

    public Builder index(@Nullable String column) {
      this.indexColumn = column;
      return this;
    }

    public Builder srid(int srid) {
      this.srid = srid;
      return this;
    }

    public GeoTable build() {
      return new GeoTable(columnTypes, new ArrayList<>(rows), indexColumn, srid);
    }
  }
}
