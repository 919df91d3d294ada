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
import org.apache.calcite.adapter.geosync.table.GeoTable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads boundary datasets published as GeoJSON feature collections.
 *
 * <p>Each endpoint becomes one {@link GeoTable} with the canonical vocabulary
 * of {@link FeatureServiceLayout}: code (text, the index), name (text, after
 * cleanup), easting and northing (int64), longitude, latitude, shape_area and
 * shape_length (float64) and geometry.
 *
 * <p>Services that page their results (ArcGIS reports
 * {@code exceededTransferLimit}) are followed with {@code resultOffset} until
 * the last page.
 */
public class FeatureServiceLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureServiceLoader.class);

  protected static final ObjectMapper MAPPER = new ObjectMapper();

  static final int DEFAULT_MAX_PAGES = 1000;

  private final SourceFetcher fetcher;
  private final GeometryFactory geometryFactory;
  private final int maxPages;

  public FeatureServiceLoader(SourceFetcher fetcher) {
    this(fetcher, new GeometryFactory(new PrecisionModel(), GeoTable.DEFAULT_SRID));
  }

  public FeatureServiceLoader(SourceFetcher fetcher, GeometryFactory geometryFactory) {
    this(fetcher, geometryFactory, DEFAULT_MAX_PAGES);
  }

  FeatureServiceLoader(SourceFetcher fetcher, GeometryFactory geometryFactory, int maxPages) {
    this.fetcher = fetcher;
    this.geometryFactory = geometryFactory;
    this.maxPages = maxPages;
  }

  /**
   * Loads every endpoint.
   *
   * @param endpoints Table name to feature collection URL
   * @return Tables keyed by the endpoint names, in the given order
   */
  public Map<String, GeoTable> load(Map<String, String> endpoints, FeatureServiceLayout layout,
      NameCleanup nameCleanup) {
    Map<String, GeoTable> tables = new LinkedHashMap<>();
    for (Map.Entry<String, String> endpoint : endpoints.entrySet()) {
      GeoTable table = loadEndpoint(endpoint.getValue(), layout, nameCleanup);
      tables.put(endpoint.getKey(), table);
      LOGGER.info("Loaded table {} ({} rows) from {}", endpoint.getKey(), table.size(),
          endpoint.getValue());
    }
    return tables;
  }

  /**
   * Loads a single feature collection, following pages.
   *
   * @throws SchemaMismatchException if the payload is not a feature collection,
   *     its columns do not match the layout, or the service still reports more
   *     features after the page limit
   */
  public GeoTable loadEndpoint(String url, FeatureServiceLayout layout, NameCleanup nameCleanup) {
    List<JsonNode> features = new ArrayList<>();
    String pageUrl = url;
    boolean complete = false;
    for (int page = 0; page < maxPages; page++) {
      JsonNode root = readJson(pageUrl, fetcher.fetch(pageUrl));
      JsonNode pageFeatures = root.get("features");
      if (pageFeatures == null || !pageFeatures.isArray()) {
        throw new SchemaMismatchException("Payload from " + pageUrl
            + " is not a feature collection (no 'features' array)");
      }
      pageFeatures.forEach(features::add);
      if (!exceededTransferLimit(root) || pageFeatures.size() == 0) {
        complete = true;
        break;
      }
      pageUrl = withResultOffset(url, features.size());
      LOGGER.debug("Transfer limit reached after {} features, fetching {}", features.size(),
          pageUrl);
    }
    if (!complete) {
      throw new SchemaMismatchException("Feature service at " + url
          + " still reports more features after " + maxPages + " pages ("
          + features.size() + " features)");
    }
    return toTable(url, features, layout, nameCleanup);
  }

  private GeoTable toTable(String url, List<JsonNode> features, FeatureServiceLayout layout,
      NameCleanup nameCleanup) {
    GeoTable.Builder builder = GeoTable.builder().srid(geometryFactory.getSRID());
    List<String> canonical = FeatureServiceLayout.CANONICAL_COLUMNS;
    for (String column : canonical) {
      if (FeatureServiceLayout.GEOMETRY.equals(column)) {
        builder.geometryColumn(column);
      } else {
        builder.column(column, FeatureServiceLayout.canonicalType(column).getColumnType());
      }
    }
    if (features.isEmpty()) {
      LOGGER.warn("Feature collection at {} is empty", url);
      return builder.index(FeatureServiceLayout.CODE).build();
    }

    List<String> propertyNames = new ArrayList<>();
    Iterator<String> names = features.get(0).path("properties").fieldNames();
    while (names.hasNext()) {
      propertyNames.add(names.next());
    }
    List<String> rawColumns = new ArrayList<>(propertyNames);
    rawColumns.add(FeatureServiceLayout.GEOMETRY);
    int[] kept = layout.keptPositions(rawColumns);

    GeoJsonReader geoJsonReader = new GeoJsonReader(geometryFactory);
    for (int f = 0; f < features.size(); f++) {
      JsonNode feature = features.get(f);
      JsonNode properties = feature.path("properties");
      if (properties.size() != propertyNames.size()) {
        throw new SchemaMismatchException("Feature " + f + " from " + url + " has "
            + properties.size() + " properties, expected " + propertyNames.size());
      }
      Object[] raw = new Object[rawColumns.size()];
      for (int i = 0; i < propertyNames.size(); i++) {
        JsonNode value = properties.get(propertyNames.get(i));
        if (value == null) {
          throw new SchemaMismatchException("Feature " + f + " from " + url
              + " lacks property " + propertyNames.get(i));
        }
        raw[i] = toValue(value);
      }
      raw[propertyNames.size()] = readGeometry(geoJsonReader, feature.get("geometry"), url, f);

      Object[] row = new Object[canonical.size()];
      for (int c = 0; c < canonical.size(); c++) {
        String column = canonical.get(c);
        Object value = raw[kept[c]];
        if (FeatureServiceLayout.GEOMETRY.equals(column)) {
          row[c] = value;
          continue;
        }
        value = FeatureServiceLayout.canonicalType(column).coerce(value);
        if (FeatureServiceLayout.NAME.equals(column)) {
          value = nameCleanup.apply((String) value);
        }
        row[c] = value;
      }
      builder.row(row);
    }
    return builder.index(FeatureServiceLayout.CODE).build();
  }

  private @Nullable Geometry readGeometry(GeoJsonReader reader, @Nullable JsonNode geometry,
      String url, int feature) {
    if (geometry == null || geometry.isNull()) {
      return null;
    }
    try {
      return reader.read(geometry.toString());
    } catch (ParseException | RuntimeException e) {
      throw new SchemaMismatchException("Feature " + feature + " from " + url
          + " has an invalid geometry: " + e.getMessage(), e);
    }
  }

  private static @Nullable Object toValue(JsonNode value) {
    if (value.isNull()) {
      return null;
    }
    if (value.isIntegralNumber()) {
      return value.canConvertToLong() ? (Object) value.longValue() : value.decimalValue();
    }
    if (value.isNumber()) {
      return value.doubleValue();
    }
    if (value.isTextual()) {
      return value.textValue();
    }
    return value.toString();
  }

  private static JsonNode readJson(String url, byte[] payload) {
    try {
      return MAPPER.readTree(payload);
    } catch (IOException e) {
      throw new SchemaMismatchException("Payload from " + url + " is not JSON: "
          + e.getMessage(), e);
    }
  }

  private static boolean exceededTransferLimit(JsonNode root) {
    return root.path("exceededTransferLimit").asBoolean(false)
        || root.path("properties").path("exceededTransferLimit").asBoolean(false);
  }

  static String withResultOffset(String url, int offset) {
    String stripped = url.replaceAll("([?&])resultOffset=\\d*&?", "$1");
    if (stripped.endsWith("&") || stripped.endsWith("?")) {
      stripped = stripped.substring(0, stripped.length() - 1);
    }
    return stripped + (stripped.contains("?") ? "&" : "?") + "resultOffset=" + offset;
  }
}
