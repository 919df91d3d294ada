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
import org.apache.calcite.adapter.geosync.CorruptStoredGeometryException;
import org.apache.calcite.adapter.geosync.PrimaryKeyViolationException;
import org.apache.calcite.adapter.geosync.SchemaMismatchException;
import org.apache.calcite.adapter.geosync.TableNotFoundException;
import org.apache.calcite.adapter.geosync.geometry.WktGeometryCodec;
import org.apache.calcite.adapter.geosync.table.ColumnType;
import org.apache.calcite.adapter.geosync.table.GeoTable;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Write/read round trips through an in-memory H2 store.
 */
@Tag("integration")
class RelationalSyncTest {
  private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

  private StoreConnection connection;
  private RelationalSync sync;

  @BeforeEach
  void setUp() {
    connection = new StoreConnection(H2Stores.newConfig());
    sync = new RelationalSync(connection);
  }

  @AfterEach
  void tearDown() {
    sync.dispose();
  }

  private static Polygon square(double x, double y, double size) {
    return FACTORY.createPolygon(new Coordinate[] {new Coordinate(x, y),
        new Coordinate(x, y + size), new Coordinate(x + size, y + size),
        new Coordinate(x + size, y), new Coordinate(x, y)});
  }

  private static GeoTable regions() {
    Polygon withHole = FACTORY.createPolygon(
        FACTORY.createLinearRing(square(-2.5, 51.25, 1.0).getCoordinates()),
        new LinearRing[] {FACTORY.createLinearRing(square(-2.0, 51.5, 0.125).getCoordinates())});
    return GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .column("label", ColumnType.TEXT)
        .column("population", ColumnType.INTEGER)
        .geometryColumn("geometry")
        .row("A", "Alpha", 5_481_431L, square(-1.7282412, 55.2970, 0.5))
        .row("B", "Bravo", 7_417_397L, withHole)
        .row("C", "Charlie", 2_669_941L,
            FACTORY.createMultiPolygon(new Polygon[] {square(0, 0, 1), square(3, 3, 1)}))
        .index("name")
        .build();
  }

  private static Map<String, String> types(String... pairs) {
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return map;
  }

  private long count(String sql) throws SQLException {
    try (Connection conn = connection.borrow();
         Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      rs.next();
      return rs.getLong(1);
    }
  }

  private void execute(String... sql) throws SQLException {
    try (Connection conn = connection.borrow();
         Statement statement = conn.createStatement()) {
      for (String s : sql) {
        statement.execute(s);
      }
    }
  }

  // ========== Round trips ==========

  @Test
  void testWriteThenReadByName() {
    GeoTable original = regions();
    sync.write(Collections.singletonList(original),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    GeoTable read = sync.read("t1", types("name", "string"), "name");

    assertEquals(3, read.size());
    assertEquals("name", read.getIndexColumn());
    assertEquals(Arrays.asList("A", "B", "C"), read.getIndexValues());
    for (Object id : Arrays.asList("A", "B", "C")) {
      Geometry expected = original.getGeometry(original.findRow(id));
      Geometry actual = read.getGeometry(read.findRow(id));
      assertTrue(WktGeometryCodec.sameGeometry(expected, actual), () -> "geometry of " + id);
    }
    assertEquals("Bravo", read.getValue(read.findRow("B"), "label"));
    assertEquals("Polygon", read.getGeometry(1).getGeometryType());
    assertEquals("MultiPolygon", read.getGeometry(2).getGeometryType());
    assertEquals(4326, read.getSrid());
  }

  @Test
  void testRoundTripGivesEqualTable() {
    sync.write(Collections.singletonList(regions()),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    assertEquals(regions(), sync.read("t1", Collections.emptyMap(), "name"));
  }

  @Test
  void testWriteDoesNotModifyCallerTable() {
    GeoTable table = regions();
    sync.write(Collections.singletonList(table),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    assertEquals(ColumnType.GEOMETRY, table.getColumnType("geometry"));
    assertTrue(table.getGeometry(0) instanceof Polygon);
    assertEquals(regions(), table);
  }

  @Test
  void testTwoTablesInOneWrite() throws SQLException {
    GeoTable countries = GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .column("label", ColumnType.TEXT)
        .column("population", ColumnType.INTEGER)
        .geometryColumn("geometry")
        .row("E", "England", 56_490_048L, square(-2, 52, 2))
        .row("W", "Wales", 3_107_494L, square(-4, 52, 1))
        .build();

    sync.write(Arrays.asList(regions(), countries),
        Arrays.asList(SyncDescriptor.of("uk_regions", "name"),
            SyncDescriptor.of("uk_countries", "name")));

    assertEquals(3, count("SELECT COUNT(*) FROM \"uk_regions\""));
    assertEquals(2, count("SELECT COUNT(*) FROM \"uk_countries\""));
    assertEquals(3, sync.read("uk_regions").size());
    assertEquals(2, sync.read("uk_countries").size());
  }

  @Test
  void testWriteIsIdempotent() {
    List<GeoTable> tables = Collections.singletonList(regions());
    List<SyncDescriptor> descriptors = Collections.singletonList(SyncDescriptor.of("t1", "name"));

    sync.write(tables, descriptors);
    GeoTable first = sync.read("t1", types("population", "int64"), "name");
    sync.write(tables, descriptors);
    GeoTable second = sync.read("t1", types("population", "int64"), "name");

    assertEquals(first, second);
    assertEquals(3, second.size());
  }

  @Test
  void testWriteReplacesExistingTable() {
    sync.write(Collections.singletonList(regions()),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));
    GeoTable smaller = GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .geometryColumn("geometry")
        .row("Z", square(9, 9, 1))
        .build();

    sync.write(Collections.singletonList(smaller),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    GeoTable read = sync.read("t1");
    assertEquals(1, read.size());
    assertEquals(Arrays.asList("name", "geometry"), read.getColumnNames());
  }

  @Test
  void testReadOrdersByPrimaryKey() {
    GeoTable shuffled = GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .geometryColumn("geometry")
        .row("C", square(2, 0, 1))
        .row("A", square(0, 0, 1))
        .row("B", square(1, 0, 1))
        .build();
    sync.write(Collections.singletonList(shuffled),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    assertEquals(Arrays.asList("A", "B", "C"), sync.read("t1").getColumnValues("name"));
  }

  @Test
  void testNullGeometryRoundTrip() {
    GeoTable table = GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .geometryColumn("geometry")
        .row("A", null)
        .build();
    sync.write(Collections.singletonList(table),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    assertNull(sync.read("t1").getGeometry(0));
  }

  // ========== Types ==========

  @Test
  void testInferredTypes() {
    sync.write(Collections.singletonList(regions()),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    GeoTable read = sync.read("t1");
    assertNull(read.getIndexColumn());
    assertEquals(ColumnType.TEXT, read.getColumnType("label"));
    assertEquals(ColumnType.INTEGER, read.getColumnType("population"));
    assertEquals(5_481_431L, read.getValue(0, "population"));
  }

  @Test
  void testCoercionToFixedWidthInteger() {
    SyncDescriptor descriptor = SyncDescriptor.builder()
        .tableName("t1")
        .primaryAttribute("name")
        .columnType("population", "int32")
        .columnType("label", "varchar")
        .build();
    sync.write(Collections.singletonList(regions()), Collections.singletonList(descriptor));

    GeoTable read = sync.read("t1", types("population", "int32"), "name");

    assertEquals(Arrays.asList(5_481_431, 7_417_397, 2_669_941),
        read.getColumnValues("population"));
  }

  @Test
  void testFloatStorage() {
    GeoTable table = GeoTable.builder()
        .column("code", ColumnType.TEXT)
        .column("latitude", ColumnType.FLOAT)
        .geometryColumn("geometry")
        .row("E1", 55.2970, square(0, 0, 1))
        .build();
    sync.write(Collections.singletonList(table),
        Collections.singletonList(SyncDescriptor.of("t2", "code")));

    GeoTable read = sync.read("t2", types("latitude", "float64"), "code");
    assertEquals(ColumnType.FLOAT, read.getColumnType("latitude"));
    assertEquals(55.2970, (Double) read.getValue(0, "latitude"), 0d);
  }

  @Test
  void testValueTooWideForStorageType() {
    SyncDescriptor descriptor = SyncDescriptor.builder()
        .tableName("t1")
        .primaryAttribute("name")
        .columnType("population", "int16")
        .build();

    assertThrows(SchemaMismatchException.class,
        () -> sync.write(Collections.singletonList(regions()),
            Collections.singletonList(descriptor)));
  }

  @Test
  void testPersistIndex() {
    SyncDescriptor descriptor = SyncDescriptor.builder()
        .tableName("t1")
        .primaryAttribute("name")
        .persistIndex(true)
        .build();
    sync.write(Collections.singletonList(regions()), Collections.singletonList(descriptor));

    GeoTable read = sync.read("t1");
    assertEquals("index", read.getColumnNames().get(0));
    assertEquals(Arrays.asList(0L, 1L, 2L), read.getColumnValues("index"));
  }

  // ========== Failures ==========

  @Test
  void testDuplicatePrimaryKey() throws SQLException {
    GeoTable duplicated = GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .geometryColumn("geometry")
        .row("A", square(0, 0, 1))
        .row("A", square(1, 0, 1))
        .build();

    PrimaryKeyViolationException e = assertThrows(PrimaryKeyViolationException.class,
        () -> sync.write(Collections.singletonList(duplicated),
            Collections.singletonList(SyncDescriptor.of("dup", "name"))));

    assertEquals("dup", e.getTableName());
    assertEquals("name", e.getKeyAttribute());
    // no table with duplicate keys survives
    if (count("SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = 'dup'") > 0) {
      assertEquals(count("SELECT COUNT(*) FROM \"dup\""),
          count("SELECT COUNT(DISTINCT \"name\") FROM \"dup\""));
    }
  }

  @Test
  void testUnknownPrimaryAttribute() {
    assertThrows(SchemaMismatchException.class,
        () -> sync.write(Collections.singletonList(regions()),
            Collections.singletonList(SyncDescriptor.of("t1", "code"))));
  }

  @Test
  void testGeometryColumnMustBeNamedGeometry() {
    GeoTable table = GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .geometryColumn("geom")
        .row("A", square(0, 0, 1))
        .build();

    assertThrows(SchemaMismatchException.class,
        () -> sync.write(Collections.singletonList(table),
            Collections.singletonList(SyncDescriptor.of("t1", "name"))));
  }

  @Test
  void testWriteArgumentsMustMatch() {
    assertThrows(IllegalArgumentException.class,
        () -> sync.write(Collections.emptyList(), Collections.emptyList()));
    assertThrows(IllegalArgumentException.class,
        () -> sync.write(Collections.singletonList(regions()), Collections.emptyList()));
  }

  @Test
  void testTableNotFound() {
    TableNotFoundException e = assertThrows(TableNotFoundException.class,
        () -> sync.read("missing", Collections.emptyMap(), null));
    assertTrue(e.getMessage().contains("missing"));
  }

  @Test
  void testCorruptStoredGeometry() throws SQLException {
    execute("CREATE TABLE \"bad\" (\"name\" VARCHAR PRIMARY KEY, \"geometry\" VARCHAR)",
        "INSERT INTO \"bad\" VALUES ('A', 'POINT (1 2)')",
        "INSERT INTO \"bad\" VALUES ('B', 'POLYGON ((0 0, 1')");

    CorruptStoredGeometryException e = assertThrows(CorruptStoredGeometryException.class,
        () -> sync.read("bad"));
    assertEquals("bad", e.getTableName());
    assertEquals(1, e.getRowNumber());
  }

  @Test
  void testStoredTableWithoutGeometry() throws SQLException {
    execute("CREATE TABLE \"plain\" (\"name\" VARCHAR)");

    assertThrows(SchemaMismatchException.class, () -> sync.read("plain"));
  }

  @Test
  void testTypeMapNamesUnknownAttribute() {
    sync.write(Collections.singletonList(regions()),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    assertThrows(SchemaMismatchException.class,
        () -> sync.read("t1", types("area", "float64"), null));
  }

  // ========== Lifecycle ==========

  @Test
  void testDisposalGating() {
    sync.write(Collections.singletonList(regions()),
        Collections.singletonList(SyncDescriptor.of("t1", "name")));

    sync.dispose();
    sync.dispose();

    assertThrows(ConnectionClosedException.class, () -> sync.read("t1"));
    assertThrows(ConnectionClosedException.class,
        () -> sync.write(Collections.singletonList(regions()),
            Collections.singletonList(SyncDescriptor.of("t1", "name"))));
    assertEquals(StoreConnection.State.DISPOSED, connection.getState());
  }

  @Test
  void testDisposalCheckedBeforeValidation() {
    GeoTable misnamed = GeoTable.builder()
        .column("name", ColumnType.TEXT)
        .geometryColumn("geom")
        .row("A", square(0, 0, 1))
        .build();
    sync.dispose();

    assertThrows(ConnectionClosedException.class,
        () -> sync.write(Collections.singletonList(misnamed),
            Collections.singletonList(SyncDescriptor.of("t1", "name"))));
    assertThrows(ConnectionClosedException.class,
        () -> sync.write(Collections.singletonList(regions()),
            Collections.singletonList(SyncDescriptor.of("t1", "missing"))));
    assertThrows(ConnectionClosedException.class,
        () -> sync.write(Collections.emptyList(), Collections.emptyList()));
    assertThrows(ConnectionClosedException.class,
        () -> sync.read("t1", types("nope", "int32"), null));
  }
}
