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
package org.apache.calcite.adapter.geosync.geometry;

import org.apache.calcite.adapter.geosync.InvalidGeometryTextException;
import org.apache.calcite.adapter.geosync.table.GeoTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

/**
 * Converts geometries to and from well-known text.
 *
 * <p>Encoding is total and deterministic. Decoding a value produced by
 * {@link #encode} yields a geometry of the same subtype with the same vertex
 * sequence; coordinates agree to the precision of the decimal text, which for
 * longitude/latitude values is the full double precision.
 *
 * <p>The codec does not carry a reference system. Decoded geometries take the
 * SRID of the codec's factory, which the caller sets from dataset metadata.
 */
public class WktGeometryCodec {
  /** Coordinate tolerance used by {@link #sameGeometry}. */
  public static final double COORDINATE_TOLERANCE = 1e-9;

  private final GeometryFactory geometryFactory;

  public WktGeometryCodec() {
    this(GeoTable.DEFAULT_SRID);
  }

  public WktGeometryCodec(int srid) {
    this(new GeometryFactory(new PrecisionModel(), srid));
  }

  public WktGeometryCodec(GeometryFactory geometryFactory) {
    this.geometryFactory = geometryFactory;
  }

  public GeometryFactory getGeometryFactory() {
    return geometryFactory;
  }

  /**
   * Encodes a geometry as well-known text. Z ordinates are written when the
   * geometry has them.
   */
  public String encode(Geometry geometry) {
    // WKTWriter is not thread-safe, and is cheap to create
    return new WKTWriter(3).write(geometry);
  }

  /**
   * Decodes well-known text.
   *
   * @throws InvalidGeometryTextException on unbalanced coordinate groups, an
   *     unknown geometry keyword, non-numeric coordinates or unclosed rings
   */
  public Geometry decode(String text) {
    WKTReader reader = new WKTReader(geometryFactory);
    try {
      return reader.read(text);
    } catch (ParseException e) {
      throw new InvalidGeometryTextException("Invalid well-known text: " + abbreviate(text), e);
    } catch (IllegalArgumentException e) {
      // JTS rejects structurally invalid components such as unclosed rings here
      throw new InvalidGeometryTextException("Invalid geometry structure: " + abbreviate(text), e);
    }
  }

  /**
   * Returns whether two geometries are the same subtype with the same vertex
   * sequence, within {@link #COORDINATE_TOLERANCE}.
   */
  public static boolean sameGeometry(@Nullable Geometry a, @Nullable Geometry b) {
    if (a == null || b == null) {
      return a == b;
    }
    return a.getGeometryType().equals(b.getGeometryType())
        && a.equalsExact(b, COORDINATE_TOLERANCE);
  }

  private static String abbreviate(@Nullable String text) {
    if (text == null) {
      return "null";
    }
    return text.length() <= 80 ? text : text.substring(0, 77) + "...";
  }
}
