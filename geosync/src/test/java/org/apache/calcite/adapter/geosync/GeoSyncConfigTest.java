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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GeoSyncConfig} and {@link DatasetConfig}.
 */
@Tag("unit")
class GeoSyncConfigTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static JsonNode testYaml() throws IOException {
    try (InputStream in = GeoSyncConfigTest.class.getClassLoader()
        .getResourceAsStream("geosync-test.yaml")) {
      assertNotNull(in);
      return YamlUtils.parseYamlOrJson(in, "geosync-test.yaml");
    }
  }

  @Test
  void testParseTestConfiguration() throws IOException {
    Map<String, String> env = new HashMap<>();
    env.put("GEOSYNC_TEST_ARCHIVE", "boundaries-2024");
    GeoSyncConfig config = GeoSyncConfig.fromJson(testYaml(), env::get);

    assertEquals("jdbc:h2:mem:geosync_config;DB_CLOSE_DELAY=-1", config.getStore().getJdbcUrl());
    assertEquals("sa", config.getStore().getUser());
    assertEquals(2, config.getStore().getMaxPoolSize());
    assertEquals(1000, config.getConnectTimeoutMs());
    assertEquals("GeoSync-Test", config.getUserAgent());
    assertEquals(2, config.getDatasets().size());

    DatasetConfig postcodes = config.getDatasets().get(0);
    assertEquals(DatasetConfig.Type.SHAPEFILE, postcodes.getType());
    assertEquals("https://example.org/boundaries-2024.zip", postcodes.getUrl());
    assertEquals("name", postcodes.getIdentityColumn());
    assertFalse(postcodes.isPersistIndex());
    assertTrue(postcodes.getNameCleanup().getRuleTexts().isEmpty());
    assertEquals("uk_postcode_areas", postcodes.tableNamer().deriveName("Distribution/Areas.shp"));

    DatasetConfig regions = config.getDatasets().get(1);
    assertEquals(DatasetConfig.Type.FEATURE_SERVICE, regions.getType());
    assertEquals("https://example.org/regions/query?f=geojson",
        regions.getEndpoints().get("uk_regions"));
    assertEquals(11, regions.getLayout().getExpectedColumns());
    assertEquals(Arrays.asList(0, 9), Arrays.asList(
        regions.getLayout().getDropPositions().toArray(new Integer[0])));
    assertEquals(Arrays.asList("trim", "strip-suffix:(England)"),
        regions.getNameCleanup().getRuleTexts());
    assertEquals("London", regions.getNameCleanup().apply(" London (England) "));
    assertEquals("bigint", regions.getColumnTypes().get("easting"));
    assertTrue(regions.isPersistIndex());
  }

  @Test
  void testFetcherSettings() throws IOException {
    HttpSourceFetcher fetcher = GeoSyncConfig.fromJson(testYaml(), name -> null).createFetcher();
    assertNotNull(fetcher);
  }

  @Test
  void testLoadFromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("geosync.yaml");
    Files.write(file, ("store:\n  host: pg\n  password: ${GEOSYNC_CONFIG_TEST_PW:pw}\n"
        + "datasets: []\n").getBytes(StandardCharsets.UTF_8));

    GeoSyncConfig config = GeoSyncConfig.load(file);

    assertEquals("jdbc:postgresql://pg:5432/github_projects", config.getStore().getJdbcUrl());
    assertEquals("pw", config.getStore().getPassword());
    assertTrue(config.getDatasets().isEmpty());
  }

  @Test
  void testBundledConfiguration() throws IOException {
    GeoSyncConfig config = GeoSyncConfig.loadResource(GeoSyncConfig.DEFAULT_RESOURCE);

    assertFalse(config.getDatasets().isEmpty());
    for (DatasetConfig dataset : config.getDatasets()) {
      assertNotNull(dataset.getName());
    }
  }

  @Test
  void testMissingResource() {
    assertThrows(IOException.class, () -> GeoSyncConfig.loadResource("nope.yaml"));
  }

  @Test
  void testInvalidDatasets() throws IOException {
    UnaryOperator<String> none = name -> null;
    assertThrows(IllegalArgumentException.class, () -> GeoSyncConfig.fromJson(MAPPER.readTree(
        "{\"datasets\":[{\"name\":\"a\",\"type\":\"shapefile\",\"identityColumn\":\"n\"}]}"),
        none));
    assertThrows(IllegalArgumentException.class, () -> GeoSyncConfig.fromJson(MAPPER.readTree(
        "{\"datasets\":[{\"name\":\"a\",\"type\":\"feature-service\"}]}"), none));
    assertThrows(IllegalArgumentException.class, () -> GeoSyncConfig.fromJson(MAPPER.readTree(
        "{\"datasets\":[{\"name\":\"a\",\"type\":\"kml\"}]}"), none));
    assertThrows(IllegalArgumentException.class, () -> GeoSyncConfig.fromJson(MAPPER.readTree(
        "{\"datasets\":[{\"type\":\"shapefile\"}]}"), none));
    assertThrows(IllegalArgumentException.class, () -> GeoSyncConfig.fromJson(MAPPER.readTree(
        "{\"datasets\":[{\"name\":\"a\",\"type\":\"feature-service\",\"endpoints\":{\"t\":\"u\"}},"
            + "{\"name\":\"a\",\"type\":\"feature-service\",\"endpoints\":{\"t\":\"u\"}}]}"),
        none));
    assertThrows(IllegalArgumentException.class, () -> GeoSyncConfig.fromJson(MAPPER.readTree(
        "{\"datasets\":[{\"name\":\"a\",\"type\":\"feature-service\",\"endpoints\":{\"t\":\"u\"},"
            + "\"nameCleanup\":[\"shout\"]}]}"), none));
  }
}
