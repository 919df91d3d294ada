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

import org.apache.calcite.adapter.geosync.source.FeatureServiceLayout;
import org.apache.calcite.adapter.geosync.source.NameCleanup;
import org.apache.calcite.adapter.geosync.source.ShapefileTableNamer;

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One entry of the {@code datasets} list: where a boundary dataset comes from
 * and how its tables are stored.
 */
public class DatasetConfig {
  /** Source format of a dataset. */
  public enum Type {
    SHAPEFILE, FEATURE_SERVICE;

    static Type fromTag(String tag) {
      switch (tag.trim().toLowerCase(Locale.ROOT)) {
      case "shapefile":
        return SHAPEFILE;
      case "feature-service":
      case "featureservice":
        return FEATURE_SERVICE;
      default:
        throw new IllegalArgumentException("Unknown dataset type: " + tag);
      }
    }
  }

  private final String name;
  private final Type type;
  private final @Nullable String url;
  private final Map<String, String> endpoints;
  private final @Nullable String identityColumn;
  private final String tablePrefix;
  private final Map<String, String> prefixes;
  private final FeatureServiceLayout layout;
  private final NameCleanup nameCleanup;
  private final Map<String, String> columnTypes;
  private final boolean persistIndex;

  DatasetConfig(String name, Type type, @Nullable String url, Map<String, String> endpoints,
      @Nullable String identityColumn, String tablePrefix, Map<String, String> prefixes,
      FeatureServiceLayout layout, NameCleanup nameCleanup, Map<String, String> columnTypes,
      boolean persistIndex) {
    this.name = name;
    this.type = type;
    this.url = url;
    this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    this.identityColumn = identityColumn;
    this.tablePrefix = tablePrefix;
    this.prefixes = Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
    this.layout = layout;
    this.nameCleanup = nameCleanup;
    this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
    this.persistIndex = persistIndex;
  }

  /**
   * Reads one dataset entry.
   *
   * @throws IllegalArgumentException if a required field is missing or invalid
   */
  public static DatasetConfig fromJson(JsonNode node) {
    String name = required(node, "name");
    Type type = Type.fromTag(required(node, "type"));
    String url = node.hasNonNull("url") ? node.get("url").asText() : null;
    Map<String, String> endpoints = stringMap(node.get("endpoints"));
    switch (type) {
    case SHAPEFILE:
      if (url == null) {
        throw new IllegalArgumentException("Shapefile dataset '" + name + "' needs a url");
      }
      if (!node.hasNonNull("identityColumn")) {
        throw new IllegalArgumentException("Shapefile dataset '" + name
            + "' needs an identityColumn");
      }
      break;
    default:
      if (endpoints.isEmpty()) {
        throw new IllegalArgumentException("Feature service dataset '" + name
            + "' needs endpoints");
      }
      break;
    }

    FeatureServiceLayout layout = FeatureServiceLayout.defaultLayout();
    JsonNode layoutNode = node.get("layout");
    if (layoutNode != null && !layoutNode.isNull()) {
      List<Integer> drops = new ArrayList<>();
      for (JsonNode drop : layoutNode.path("dropPositions")) {
        drops.add(drop.asInt());
      }
      layout = new FeatureServiceLayout(
          layoutNode.path("expectedColumns").asInt(layout.getExpectedColumns()), drops);
    }

    List<String> cleanupSpecs = new ArrayList<>();
    for (JsonNode rule : node.path("nameCleanup")) {
      cleanupSpecs.add(rule.asText());
    }

    return new DatasetConfig(name, type, url, endpoints,
        node.hasNonNull("identityColumn") ? node.get("identityColumn").asText() : null,
        node.path("tablePrefix").asText(""),
        stringMap(node.get("prefixes")),
        layout,
        cleanupSpecs.isEmpty() ? NameCleanup.none() : NameCleanup.of(cleanupSpecs),
        stringMap(node.get("columnTypes")),
        node.path("persistIndex").asBoolean(false));
  }

  private static String required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.asText().isEmpty()) {
      throw new IllegalArgumentException("Dataset entry lacks '" + field + "': " + node);
    }
    return value.asText();
  }

  private static Map<String, String> stringMap(@Nullable JsonNode node) {
    Map<String, String> map = new LinkedHashMap<>();
    if (node == null || !node.isObject()) {
      return map;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      map.put(field.getKey(), field.getValue().asText());
    }
    return map;
  }

  /** Returns the namer for tables of a shapefile archive. */
  public ShapefileTableNamer tableNamer() {
    return new ShapefileTableNamer(tablePrefix, prefixes);
  }

  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  public @Nullable String getUrl() {
    return url;
  }

  public Map<String, String> getEndpoints() {
    return endpoints;
  }

  public @Nullable String getIdentityColumn() {
    return identityColumn;
  }

  public String getTablePrefix() {
    return tablePrefix;
  }

  public Map<String, String> getPrefixes() {
    return prefixes;
  }

  public FeatureServiceLayout getLayout() {
    return layout;
  }

  public NameCleanup getNameCleanup() {
    return nameCleanup;
  }

  public Map<String, String> getColumnTypes() {
    return columnTypes;
  }

  public boolean isPersistIndex() {
    return persistIndex;
  }
}
