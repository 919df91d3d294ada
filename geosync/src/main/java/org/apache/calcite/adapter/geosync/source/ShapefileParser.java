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

import org.apache.calcite.adapter.geosync.MalformedArchiveException;
import org.apache.calcite.adapter.geosync.table.ColumnType;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.algorithm.PointLocation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses an ESRI shapefile set (.shp geometry plus .dbf attributes) into
 * features carrying JTS geometries.
 *
 * <p>Supported shape types are Null, Point, PolyLine, Polygon and MultiPoint,
 * each with its Z and M variants. Z ordinates are kept; measures are dropped.
 * Polygon rings follow the shapefile convention: clockwise rings are shells,
 * counter-clockwise rings are holes of the shell that contains them. A record
 * with one shell becomes a {@link Polygon}, a record with several a
 * MultiPolygon.
 *
 * <p>The attribute charset comes from the .cpg file when present and defaults
 * to ISO-8859-1.
 */
public final class ShapefileParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(ShapefileParser.class);

  /** Attribute key under which {@link ShapefileFeature#getAttribute} returns the geometry. */
  public static final String GEOMETRY_ATTRIBUTE = "_GEOMETRY_";

  private static final int FILE_CODE = 9994;
  private static final int HEADER_LENGTH = 100;

  private static final int NULL_SHAPE = 0;
  private static final int POINT = 1;
  private static final int POLYLINE = 3;
  private static final int POLYGON = 5;
  private static final int MULTIPOINT = 8;
  private static final int POINT_Z = 11;
  private static final int POLYLINE_Z = 13;
  private static final int POLYGON_Z = 15;
  private static final int MULTIPOINT_Z = 18;
  private static final int POINT_M = 21;
  private static final int POLYLINE_M = 23;
  private static final int POLYGON_M = 25;
  private static final int MULTIPOINT_M = 28;

  private ShapefileParser() {
  }

  /**
   * Parses the shapefile set {@code prefix}.shp / {@code prefix}.dbf in a
   * directory.
   *
   * @throws MalformedArchiveException if a component is missing or corrupt
   */
  public static Shapefile parse(File dir, String prefix, GeometryFactory geometryFactory) {
    File shpFile = findComponent(dir, prefix, "shp");
    File dbfFile = findComponent(dir, prefix, "dbf");
    if (shpFile == null) {
      throw new MalformedArchiveException("Missing " + prefix + ".shp in " + dir);
    }
    if (dbfFile == null) {
      throw new MalformedArchiveException("Shapefile " + prefix + " has no .dbf attribute table");
    }
    try {
      Charset charset = readCharset(findComponent(dir, prefix, "cpg"));
      DbfReader dbf = DbfReader.read(Files.readAllBytes(dbfFile.toPath()), charset);
      List<Geometry> geometries =
          readGeometries(Files.readAllBytes(shpFile.toPath()), geometryFactory, prefix);

      List<Object[]> records = dbf.getRecords();
      if (records.size() != geometries.size()) {
        throw new MalformedArchiveException("Shapefile " + prefix + " has " + geometries.size()
            + " shapes but " + records.size() + " attribute records");
      }
      List<ShapefileFeature> features = new ArrayList<>(records.size());
      int deleted = 0;
      for (int i = 0; i < records.size(); i++) {
        Object[] record = records.get(i);
        if (record == null) {
          deleted++;
          continue;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int f = 0; f < dbf.getFields().size(); f++) {
          attributes.put(dbf.getFields().get(f).name, record[f]);
        }
        features.add(new ShapefileFeature(attributes, geometries.get(i)));
      }
      if (deleted > 0) {
        LOGGER.warn("Skipped {} deleted records in {}", deleted, prefix);
      }

      List<String> names = new ArrayList<>();
      List<ColumnType> types = new ArrayList<>();
      for (DbfReader.Field field : dbf.getFields()) {
        names.add(field.name);
        types.add(field.columnType());
      }
      LOGGER.info("Parsed {} features with fields {} from {}", features.size(),
          dbf.getFields(), shpFile.getName());
      return new Shapefile(prefix, names, types, features);
    } catch (IOException e) {
      throw new MalformedArchiveException("Failed to read shapefile " + prefix + ": "
          + e.getMessage(), e);
    }
  }

  /** Finds a component file ignoring the case of its extension. */
  private static @Nullable File findComponent(File dir, String prefix, String extension) {
    File[] matches = dir.listFiles((d, name) -> name.equalsIgnoreCase(prefix + "." + extension));
    return matches == null || matches.length == 0 ? null : matches[0];
  }

  private static Charset readCharset(@Nullable File cpgFile) throws IOException {
    if (cpgFile == null) {
      return StandardCharsets.ISO_8859_1;
    }
    String name = new String(Files.readAllBytes(cpgFile.toPath()), StandardCharsets.US_ASCII).trim();
    try {
      return Charset.forName(name);
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Unknown charset '{}' in {}, using ISO-8859-1", name, cpgFile.getName());
      return StandardCharsets.ISO_8859_1;
    }
  }

  static List<Geometry> readGeometries(byte[] data, GeometryFactory factory, String prefix) {
    ByteBuffer buffer = ByteBuffer.wrap(data);
    if (data.length < HEADER_LENGTH || buffer.order(ByteOrder.BIG_ENDIAN).getInt(0) != FILE_CODE) {
      throw new MalformedArchiveException(prefix + ".shp is not a shapefile");
    }
    List<Geometry> geometries = new ArrayList<>();
    int position = HEADER_LENGTH;
    try {
      while (position + 8 <= data.length) {
        buffer.order(ByteOrder.BIG_ENDIAN);
        int contentLength = buffer.getInt(position + 4) * 2;
        int contentStart = position + 8;
        if (contentLength < 4 || contentStart + contentLength > data.length) {
          throw new MalformedArchiveException("Truncated record at offset " + position
              + " in " + prefix + ".shp");
        }
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(contentStart);
        geometries.add(readShape(buffer, factory, prefix));
        position = contentStart + contentLength;
      }
    } catch (BufferUnderflowException | IndexOutOfBoundsException e) {
      throw new MalformedArchiveException("Corrupt record at offset " + position + " in "
          + prefix + ".shp", e);
    }
    return geometries;
  }

  private static @Nullable Geometry readShape(ByteBuffer buffer, GeometryFactory factory,
      String prefix) {
    int shapeType = buffer.getInt();
    switch (shapeType) {
    case NULL_SHAPE:
      return null;
    case POINT:
    case POINT_M:
      return factory.createPoint(new Coordinate(buffer.getDouble(), buffer.getDouble()));
    case POINT_Z:
      return factory.createPoint(
          new Coordinate(buffer.getDouble(), buffer.getDouble(), buffer.getDouble()));
    case MULTIPOINT:
    case MULTIPOINT_M:
    case MULTIPOINT_Z: {
      skipBox(buffer);
      int numPoints = checkCount(buffer, buffer.getInt(), 2 * Double.BYTES, "point");
      Coordinate[] points = readPoints(buffer, numPoints);
      if (shapeType == MULTIPOINT_Z) {
        readZ(buffer, points);
      }
      return factory.createMultiPointFromCoords(points);
    }
    case POLYLINE:
    case POLYLINE_M:
    case POLYLINE_Z:
      return toLineal(readParts(buffer, shapeType == POLYLINE_Z), factory);
    case POLYGON:
    case POLYGON_M:
    case POLYGON_Z:
      return toPolygonal(readParts(buffer, shapeType == POLYGON_Z), factory, prefix);
    default:
      LOGGER.warn("Unsupported shape type {} in {}.shp, storing null geometry", shapeType, prefix);
      return null;
    }
  }

  private static void skipBox(ByteBuffer buffer) {
    buffer.position(buffer.position() + 4 * Double.BYTES);
  }

  /** Rejects a negative count, or one whose elements cannot fit in the rest of the record. */
  private static int checkCount(ByteBuffer buffer, int count, int elementBytes, String what) {
    if (count < 0 || (long) count * elementBytes > buffer.remaining()) {
      throw new MalformedArchiveException("Invalid " + what + " count " + count);
    }
    return count;
  }

  private static Coordinate[] readPoints(ByteBuffer buffer, int count) {
    Coordinate[] points = new Coordinate[count];
    for (int i = 0; i < count; i++) {
      points[i] = new Coordinate(buffer.getDouble(), buffer.getDouble());
    }
    return points;
  }

  /** Reads the Z range and values that follow the XY points of a Z shape. */
  private static void readZ(ByteBuffer buffer, Coordinate[] points) {
    buffer.position(buffer.position() + 2 * Double.BYTES);
    for (Coordinate point : points) {
      point.setZ(buffer.getDouble());
    }
  }

  private static List<Coordinate[]> readParts(ByteBuffer buffer, boolean hasZ) {
    skipBox(buffer);
    int numParts = buffer.getInt();
    int numPoints = buffer.getInt();
    checkCount(buffer, numParts, Integer.BYTES, "part");
    checkCount(buffer, numPoints, 2 * Double.BYTES, "point");
    int[] starts = new int[numParts];
    for (int i = 0; i < numParts; i++) {
      starts[i] = buffer.getInt();
      int previous = i == 0 ? 0 : starts[i - 1];
      if (starts[i] < previous || starts[i] > numPoints) {
        throw new MalformedArchiveException("Part " + i + " starts at point " + starts[i]
            + " (previous " + previous + ", " + numPoints + " points)");
      }
    }
    Coordinate[] points = readPoints(buffer, numPoints);
    if (hasZ) {
      readZ(buffer, points);
    }
    List<Coordinate[]> parts = new ArrayList<>(numParts);
    for (int i = 0; i < numParts; i++) {
      int end = i + 1 < numParts ? starts[i + 1] : numPoints;
      Coordinate[] part = new Coordinate[end - starts[i]];
      System.arraycopy(points, starts[i], part, 0, part.length);
      parts.add(part);
    }
    return parts;
  }

  private static @Nullable Geometry toLineal(List<Coordinate[]> parts, GeometryFactory factory) {
    List<LineString> lines = new ArrayList<>();
    for (Coordinate[] part : parts) {
      if (part.length >= 2) {
        lines.add(factory.createLineString(part));
      }
    }
    if (lines.isEmpty()) {
      return null;
    }
    if (lines.size() == 1) {
      return lines.get(0);
    }
    return factory.createMultiLineString(lines.toArray(new LineString[0]));
  }

  private static @Nullable Geometry toPolygonal(List<Coordinate[]> parts, GeometryFactory factory,
      String prefix) {
    List<Coordinate[]> shells = new ArrayList<>();
    List<Coordinate[]> holes = new ArrayList<>();
    for (Coordinate[] part : parts) {
      Coordinate[] ring = closeRing(part);
      if (ring.length < 4) {
        LOGGER.warn("Skipping degenerate ring with {} points in {}.shp", ring.length, prefix);
        continue;
      }
      if (Orientation.isCCW(ring)) {
        holes.add(ring);
      } else {
        shells.add(ring);
      }
    }
    if (shells.isEmpty()) {
      // Some writers ignore the winding convention; treat every ring as a shell
      shells.addAll(holes);
      holes.clear();
    }
    if (shells.isEmpty()) {
      return null;
    }

    List<List<LinearRing>> holesByShell = new ArrayList<>();
    for (int i = 0; i < shells.size(); i++) {
      holesByShell.add(new ArrayList<>());
    }
    for (Coordinate[] hole : holes) {
      int owner = findOwner(hole, shells);
      if (owner < 0) {
        shells.add(hole);
        holesByShell.add(new ArrayList<>());
      } else {
        holesByShell.get(owner).add(factory.createLinearRing(hole));
      }
    }

    Polygon[] polygons = new Polygon[shells.size()];
    for (int i = 0; i < shells.size(); i++) {
      polygons[i] = factory.createPolygon(factory.createLinearRing(shells.get(i)),
          holesByShell.get(i).toArray(new LinearRing[0]));
    }
    if (polygons.length == 1) {
      return polygons[0];
    }
    return factory.createMultiPolygon(polygons);
  }

  private static int findOwner(Coordinate[] hole, List<Coordinate[]> shells) {
    for (int i = 0; i < shells.size(); i++) {
      Coordinate[] shell = shells.get(i);
      for (Coordinate vertex : hole) {
        if (PointLocation.isInRing(vertex, shell)) {
          return i;
        }
      }
    }
    return -1;
  }

  private static Coordinate[] closeRing(Coordinate[] ring) {
    if (ring.length == 0 || ring[0].equals3D(ring[ring.length - 1])) {
      return ring;
    }
    Coordinate[] closed = new Coordinate[ring.length + 1];
    System.arraycopy(ring, 0, closed, 0, ring.length);
    closed[ring.length] = ring[0].copy();
    return closed;
  }

  /**
   * Callback that turns a parsed feature into a row of values.
   */
  @FunctionalInterface
  public interface AttributeMapper {
    Object[] map(ShapefileFeature feature);
  }

  /**
   * A parsed shapefile set: attribute field names and types in file order, and
   * its live (non-deleted) features.
   */
  public static final class Shapefile {
    private final String name;
    private final List<String> fieldNames;
    private final List<ColumnType> fieldTypes;
    private final List<ShapefileFeature> features;

    Shapefile(String name, List<String> fieldNames, List<ColumnType> fieldTypes,
        List<ShapefileFeature> features) {
      this.name = name;
      this.fieldNames = Collections.unmodifiableList(fieldNames);
      this.fieldTypes = Collections.unmodifiableList(fieldTypes);
      this.features = Collections.unmodifiableList(features);
    }

    public String getName() {
      return name;
    }

    public List<String> getFieldNames() {
      return fieldNames;
    }

    public List<ColumnType> getFieldTypes() {
      return fieldTypes;
    }

    public List<ShapefileFeature> getFeatures() {
      return features;
    }

    /** Maps every feature to a row. */
    public List<Object[]> map(AttributeMapper mapper) {
      List<Object[]> rows = new ArrayList<>(features.size());
      for (ShapefileFeature feature : features) {
        rows.add(mapper.map(feature));
      }
      return rows;
    }
  }

  /**
   * One shapefile record: its attributes by DBF field name and its geometry.
   */
  public static final class ShapefileFeature {
    private final Map<String, Object> attributes;
    private final @Nullable Geometry geometry;

    public ShapefileFeature(Map<String, Object> attributes, @Nullable Geometry geometry) {
      this.attributes = Collections.unmodifiableMap(attributes);
      this.geometry = geometry;
    }

    /**
     * Returns an attribute value, or the geometry for {@link #GEOMETRY_ATTRIBUTE}.
     */
    public @Nullable Object getAttribute(String name) {
      if (GEOMETRY_ATTRIBUTE.equals(name)) {
        return geometry;
      }
      return attributes.get(name);
    }

    public Map<String, Object> getAttributes() {
      return attributes;
    }

    public @Nullable Geometry getGeometry() {
      return geometry;
    }
  }
}
