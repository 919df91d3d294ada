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
package org.apache.calcite.adapter.geosync.source;

import org.apache.calcite.adapter.geosync.SchemaMismatchException;
import org.apache.calcite.adapter.geosync.table.AttributeType;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Positional column layout of a boundary feature service.
 *
 * <p>A feature collection is read as its property columns in payload order
 * followed by the geometry. The columns at {@link #getDropPositions()} (object
 * identifiers, internal GUIDs) are removed and the remaining ones are renamed,
 * in order, to {@link #CANONICAL_COLUMNS}.
 */
public final class FeatureServiceLayout {
  public static final String CODE = "code";
  public static final String NAME = "name";
  public static final String GEOMETRY = "geometry";

  /** Canonical attribute vocabulary, in column order. */
  public static final List<String> CANONICAL_COLUMNS = Collections.unmodifiableList(
      Arrays.asList(CODE, NAME, "easting", "northing", "longitude", "latitude",
          "shape_area", "shape_length", GEOMETRY));

  private static final Map<String, AttributeType> CANONICAL_TYPES;

  static {
    Map<String, AttributeType> types = new LinkedHashMap<>();
    types.put(CODE, AttributeType.STRING);
    types.put(NAME, AttributeType.STRING);
    types.put("easting", AttributeType.INT64);
    types.put("northing", AttributeType.INT64);
    types.put("longitude", AttributeType.FLOAT64);
    types.put("latitude", AttributeType.FLOAT64);
    types.put("shape_area", AttributeType.FLOAT64);
    types.put("shape_length", AttributeType.FLOAT64);
    CANONICAL_TYPES = Collections.unmodifiableMap(types);
  }

  /**
   * Layout of the ONS boundary services: OBJECTID, code, name, BNG_E, BNG_N,
   * LONG, LAT, Shape__Area, Shape__Length, GlobalID, geometry.
   */
  private static final FeatureServiceLayout DEFAULT = new FeatureServiceLayout(11,
      Arrays.asList(0, 9));

  private final int expectedColumns;
  private final SortedSet<Integer> dropPositions;

  /**
   * Creates a layout.
   *
   * @param expectedColumns Number of raw columns, geometry included
   * @param dropPositions Zero-based positions of the columns to drop
   */
  public FeatureServiceLayout(int expectedColumns, Collection<Integer> dropPositions) {
    this.expectedColumns = expectedColumns;
    this.dropPositions = Collections.unmodifiableSortedSet(new TreeSet<>(dropPositions));
    for (int position : this.dropPositions) {
      if (position < 0 || position >= expectedColumns - 1) {
        throw new IllegalArgumentException("Drop position " + position
            + " is outside the property columns of a " + expectedColumns + "-column layout");
      }
    }
    if (expectedColumns - this.dropPositions.size() != CANONICAL_COLUMNS.size()) {
      throw new IllegalArgumentException("Layout keeps " + (expectedColumns
          - this.dropPositions.size()) + " columns but the vocabulary has "
          + CANONICAL_COLUMNS.size());
    }
  }

  public static FeatureServiceLayout defaultLayout() {
    return DEFAULT;
  }

  public int getExpectedColumns() {
    return expectedColumns;
  }

  public SortedSet<Integer> getDropPositions() {
    return dropPositions;
  }

  /** Returns the fixed-width type a canonical attribute is coerced to. */
  public static AttributeType canonicalType(String column) {
    AttributeType type = CANONICAL_TYPES.get(column);
    if (type == null) {
      throw new IllegalArgumentException("Not a canonical attribute: " + column);
    }
    return type;
  }

  /**
   * Checks the raw columns against this layout.
   *
   * @param rawColumns Property names in payload order followed by the geometry
   * @return Positions of the kept raw columns, one per canonical column
   * @throws SchemaMismatchException if the count does not match
   */
  public int[] keptPositions(List<String> rawColumns) {
    if (rawColumns.size() != expectedColumns) {
      throw new SchemaMismatchException("Expected " + expectedColumns
          + " columns (geometry included) but the payload has " + rawColumns.size()
          + ": " + rawColumns);
    }
    int[] kept = new int[CANONICAL_COLUMNS.size()];
    int k = 0;
    for (int i = 0; i < rawColumns.size(); i++) {
      if (!dropPositions.contains(i)) {
        kept[k++] = i;
      }
    }
    return kept;
  }

  @Override public String toString() {
    return "FeatureServiceLayout{columns=" + expectedColumns + ", drop=" + dropPositions + "}";
  }
}
