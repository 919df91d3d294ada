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

import org.apache.calcite.adapter.geosync.GeoSyncException;
import org.apache.calcite.adapter.geosync.MalformedArchiveException;
import org.apache.calcite.adapter.geosync.SchemaMismatchException;
import org.apache.calcite.adapter.geosync.table.AttributeType;
import org.apache.calcite.adapter.geosync.table.ColumnType;
import org.apache.calcite.adapter.geosync.table.GeoTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads every shapefile contained in a zipped archive into a
 * {@link GeoTable}.
 *
 * <p>The archive is fetched, extracted, written to a scratch directory and
 * parsed there. The scratch directory is removed on every exit path. Attribute
 * names are lower-cased; the identity column is matched ignoring case,
 * converted to text and becomes the table index. The geometry column is
 * always named {@value #GEOMETRY_COLUMN}.
 */
public class ShapefileArchiveLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(ShapefileArchiveLoader.class);

  public static final String GEOMETRY_COLUMN = "geometry";

  private final SourceFetcher fetcher;
  private final ArchiveExtractor extractor;
  private final GeometryFactory geometryFactory;
  private final @Nullable Path scratchRoot;

  public ShapefileArchiveLoader(SourceFetcher fetcher) {
    this(fetcher, new ZipArchiveExtractor(),
        new GeometryFactory(new PrecisionModel(), GeoTable.DEFAULT_SRID), null);
  }

  /**
   * Creates a loader.
   *
   * @param fetcher Fetches archives
   * @param extractor Expands fetched archives
   * @param geometryFactory Builds geometries; its SRID becomes the tables' SRID
   * @param scratchRoot Parent of scratch directories, or null for the system
   *     temporary directory
   */
  public ShapefileArchiveLoader(SourceFetcher fetcher, ArchiveExtractor extractor,
      GeometryFactory geometryFactory, @Nullable Path scratchRoot) {
    this.fetcher = fetcher;
    this.extractor = extractor;
    this.geometryFactory = geometryFactory;
    this.scratchRoot = scratchRoot;
  }

  /**
   * Fetches an archive and loads the shapefiles it contains.
   *
   * @param url Archive location
   * @param identityColumn Name attribute that identifies rows
   * @param namer Derives each table's name from its path in the archive
   * @return Tables keyed by derived name, in archive order
   * @throws org.apache.calcite.adapter.geosync.SourceUnavailableException if
   *     the archive cannot be fetched
   * @throws MalformedArchiveException if extraction fails or no shapefile is found
   * @throws SchemaMismatchException if a shapefile lacks the identity column
   */
  public Map<String, GeoTable> load(String url, String identityColumn, ShapefileTableNamer namer) {
    LOGGER.info("Loading shapefile archive from {}", url);
    byte[] archive = fetcher.fetch(url);
    return loadArchive(archive, identityColumn, namer);
  }

  /**
   * Loads the shapefiles of an archive that has already been fetched.
   */
  public Map<String, GeoTable> loadArchive(byte[] archive, String identityColumn,
      ShapefileTableNamer namer) {
    Map<String, byte[]> entries = extractor.extract(archive);

    List<String> shapefileEntries = new ArrayList<>();
    for (String name : entries.keySet()) {
      if (name.toLowerCase(Locale.ROOT).endsWith(".shp")) {
        shapefileEntries.add(name);
      }
    }
    if (shapefileEntries.isEmpty()) {
      throw new MalformedArchiveException("Archive contains no shapefile; entries: "
          + entries.keySet());
    }

    Path scratch = createScratchDirectory();
    try {
      writeEntries(scratch, entries);

      Map<String, GeoTable> tables = new LinkedHashMap<>();
      for (String entry : shapefileEntries) {
        String tableName = namer.deriveName(entry);
        if (tables.containsKey(tableName)) {
          throw new MalformedArchiveException("Shapefiles in archive map to the same table name '"
              + tableName + "'");
        }
        File dir = scratch.resolve(entry).getParent().toFile();
        String fileName = scratch.resolve(entry).getFileName().toString();
        String prefix = fileName.substring(0, fileName.length() - 4);

        ShapefileParser.Shapefile shapefile = ShapefileParser.parse(dir, prefix, geometryFactory);
        tables.put(tableName, toTable(shapefile, identityColumn));
        LOGGER.info("Loaded table {} ({} rows) from {}", tableName,
            shapefile.getFeatures().size(), entry);
      }
      return tables;
    } finally {
      deleteRecursively(scratch);
    }
  }

  private GeoTable toTable(ShapefileParser.Shapefile shapefile, String identityColumn) {
    List<String> fieldNames = shapefile.getFieldNames();
    GeoTable.Builder builder = GeoTable.builder().srid(geometryFactory.getSRID());
    String identity = null;
    List<String> seen = new ArrayList<>();
    for (int i = 0; i < fieldNames.size(); i++) {
      String column = fieldNames.get(i).toLowerCase(Locale.ROOT);
      if (seen.contains(column) || GEOMETRY_COLUMN.equals(column)) {
        throw new SchemaMismatchException("Attribute '" + fieldNames.get(i) + "' of "
            + shapefile.getName() + " clashes with another column");
      }
      seen.add(column);
      if (column.equalsIgnoreCase(identityColumn)) {
        identity = column;
      }
      builder.column(column, shapefile.getFieldTypes().get(i));
    }
    if (identity == null) {
      throw new SchemaMismatchException("Shapefile " + shapefile.getName()
          + " has no identity column '" + identityColumn + "'; fields: " + fieldNames);
    }
    builder.geometryColumn(GEOMETRY_COLUMN);

    builder.rows(shapefile.map(feature -> {
      Object[] row = new Object[fieldNames.size() + 1];
      for (int i = 0; i < fieldNames.size(); i++) {
        row[i] = feature.getAttribute(fieldNames.get(i));
      }
      row[fieldNames.size()] = feature.getAttribute(ShapefileParser.GEOMETRY_ATTRIBUTE);
      return row;
    }));

    return builder.build()
        .withAttributeType(identity, AttributeType.STRING)
        .withIndex(identity);
  }

  private Path createScratchDirectory() {
    try {
      if (scratchRoot != null) {
        Files.createDirectories(scratchRoot);
        return Files.createTempDirectory(scratchRoot, "geosync-shp-");
      }
      return Files.createTempDirectory("geosync-shp-");
    } catch (IOException e) {
      throw new GeoSyncException("Cannot create scratch directory: " + e.getMessage(), e);
    }
  }

  private static void writeEntries(Path scratch, Map<String, byte[]> entries) {
    Path root = scratch.normalize();
    for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
      Path target = root.resolve(entry.getKey()).normalize();
      if (!target.startsWith(root)) {
        throw new MalformedArchiveException("Archive entry escapes scratch directory: "
            + entry.getKey());
      }
      try {
        Files.createDirectories(target.getParent());
        Files.write(target, entry.getValue());
      } catch (IOException e) {
        throw new MalformedArchiveException("Failed to extract " + entry.getKey() + ": "
            + e.getMessage(), e);
      }
    }
    LOGGER.debug("Extracted {} entries to {}", entries.size(), scratch);
  }

  static void deleteRecursively(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder())
          .map(Path::toFile)
          .forEach(File::delete);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up scratch directory {}: {}", dir, e.getMessage());
    }
    if (Files.exists(dir)) {
      LOGGER.warn("Scratch directory {} could not be fully removed", dir);
    }
  }
}
