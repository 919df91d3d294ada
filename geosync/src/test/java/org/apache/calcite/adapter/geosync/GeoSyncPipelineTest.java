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

import org.apache.calcite.adapter.geosync.source.SourceFetcher;
import org.apache.calcite.adapter.geosync.store.RelationalSync;
import org.apache.calcite.adapter.geosync.store.StoreConnection;
import org.apache.calcite.adapter.geosync.store.SyncDescriptor;
import org.apache.calcite.adapter.geosync.table.ColumnType;
import org.apache.calcite.adapter.geosync.table.GeoTable;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the pipeline against in-memory sources and an H2 store.
 */
@Tag("integration")
class GeoSyncPipelineTest {
  private static final String REGIONS_URL = "https://example.org/regions/query?f=geojson";
  private static final String COUNTRIES_URL = "https://example.org/countries/query?f=geojson";

  private final Map<String, byte[]> responses = new HashMap<>();
  private final SourceFetcher fetcher = url -> {
    byte[] bytes = responses.get(url);
    if (bytes == null) {
      throw new SourceUnavailableException(url, "HTTP 404");
    }
    return bytes;
  };

  private GeoSyncConfig config;
  private StoreConnection connection;
  private RelationalSync sync;

  @BeforeEach
  void setUp() throws IOException {
    String yaml = "store:\n"
        + "  jdbcUrl: jdbc:h2:mem:pipeline_" + UUID.randomUUID().toString().replace("-", "")
        + ";DB_CLOSE_DELAY=-1\n"
        + "  user: sa\n"
        + "datasets:\n"
        + "  - name: postcodes\n"
        + "    type: shapefile\n"
        + "    url: https://example.org/missing.zip\n"
        + "    identityColumn: name\n"
        + "  - name: regions\n"
        + "    type: feature-service\n"
        + "    endpoints:\n"
        + "      uk_regions: " + REGIONS_URL + "\n"
        + "      uk_countries: " + COUNTRIES_URL + "\n"
        + "    nameCleanup: [trim, 'strip-suffix:(England)']\n"
        + "    columnTypes:\n"
        + "      easting: int32\n"
        + "      northing: int32\n"
        + "      unknown_column: text\n";
    JsonNode node = YamlUtils.parseYamlOrJson(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "pipeline.yaml");
    config = GeoSyncConfig.fromJson(node, name -> null);
    connection = new StoreConnection(config.getStore());
    sync = new RelationalSync(connection);

    responses.put(REGIONS_URL, featureCollection(
        feature(1, "E12000001", "North East (England)", 417313),
        feature(2, "E12000007", " London (England)", 517515)));
    responses.put(COUNTRIES_URL, featureCollection(
        feature(1, "W92000004", "Wales", 263405)));
  }

  @AfterEach
  void tearDown() {
    connection.close();
  }

  private static String feature(int id, String code, String name, int easting) {
    return "{\"type\":\"Feature\",\"properties\":{\"OBJECTID\":" + id
        + ",\"CD\":\"" + code + "\",\"NM\":\"" + name + "\",\"BNG_E\":" + easting
        + ",\"BNG_N\":549920,\"LONG\":-1.72824,\"LAT\":55.297,\"Shape__Area\":8.6E9"
        + ",\"Shape__Length\":1100000.5,\"GlobalID\":\"g" + id + "\"},"
        + "\"geometry\":{\"type\":\"Polygon\",\"coordinates\":"
        + "[[[0,0],[0," + id + "],[" + id + "," + id + "],[" + id + ",0],[0,0]]]}}";
  }

  private static byte[] featureCollection(String... features) {
    return ("{\"type\":\"FeatureCollection\",\"features\":[" + String.join(",", features) + "]}")
        .getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void testFailuresAreIsolatedPerDataset() {
    List<GeoSyncPipeline.SyncResult> results = new GeoSyncPipeline(config, fetcher, sync).run();

    assertEquals(2, results.size());
    GeoSyncPipeline.SyncResult postcodes = results.get(0);
    assertFalse(postcodes.isSuccess());
    assertTrue(postcodes.getError() instanceof SourceUnavailableException);
    assertTrue(postcodes.getTables().isEmpty());

    GeoSyncPipeline.SyncResult regions = results.get(1);
    assertTrue(regions.isSuccess(), regions::toString);
    assertEquals(Arrays.asList("uk_regions", "uk_countries"), regions.getTables());
  }

  @Test
  void testTablesAreReadable() {
    new GeoSyncPipeline(config, fetcher, sync).run();

    GeoTable regions = sync.read("uk_regions", Collections.singletonMap("easting", "int32"),
        "code");
    assertEquals(2, regions.size());
    assertEquals("North East", regions.getValue(regions.findRow("E12000001"), "name"));
    assertEquals("London", regions.getValue(regions.findRow("E12000007"), "name"));
    assertEquals(517515, regions.getValue(regions.findRow("E12000007"), "easting"));
    assertEquals(ColumnType.FLOAT, regions.getColumnType("shape_area"));
    assertEquals(1, sync.read("uk_countries").size());
  }

  @Test
  void testRerunIsIdempotent() {
    GeoSyncPipeline pipeline = new GeoSyncPipeline(config, fetcher, sync);
    pipeline.run();
    GeoTable first = sync.read("uk_regions", Collections.emptyMap(), "code");
    pipeline.run();

    assertEquals(first, sync.read("uk_regions", Collections.emptyMap(), "code"));
  }

  @Test
  void testDescriptorFollowsTableIdentity() {
    DatasetConfig regions = config.getDatasets().get(1);
    GeoTable table = GeoTable.builder()
        .column("code", ColumnType.TEXT)
        .column("easting", ColumnType.INTEGER)
        .geometryColumn("geometry")
        .row("E1", 1L, new GeometryFactory().createPoint(new Coordinate(0, 0)))
        .index("code")
        .build();

    SyncDescriptor descriptor = GeoSyncPipeline.descriptor(regions, "uk_regions", table);

    assertEquals("uk_regions", descriptor.getTableName());
    assertEquals("code", descriptor.getPrimaryAttribute());
    assertEquals(Collections.singletonMap("easting", "int32"), descriptor.getColumnTypes());
  }

  @Test
  void testTableWithoutIdentityIsRejected() {
    GeoTable positional = GeoTable.builder()
        .geometryColumn("geometry")
        .build();

    assertThrows(SchemaMismatchException.class,
        () -> GeoSyncPipeline.descriptor(config.getDatasets().get(1), "t", positional));
  }

  @Test
  void testClosedConnectionAbortsRun() {
    connection.dispose();

    assertThrows(ConnectionClosedException.class,
        () -> new GeoSyncPipeline(config, fetcher, sync).run());
  }
}
