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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives store table names from shapefile paths inside an archive.
 *
 * <p>The longest configured directory prefix that matches the entry's
 * directory is replaced by its mapped name; remaining directories and the file
 * base name are lower-cased with every run of characters outside
 * {@code [a-z0-9]} collapsed to {@code _}. Parts are joined with {@code _}
 * after the optional table prefix. For example, with prefix {@code uk} and the
 * mapping {@code PostalBoundaries/SHP -> postcode},
 * {@code PostalBoundaries/SHP/Areas.shp} becomes {@code uk_postcode_areas}.
 */
public class ShapefileTableNamer {
  private final String tablePrefix;
  private final Map<String, String> directoryPrefixes;

  public ShapefileTableNamer() {
    this("", Collections.emptyMap());
  }

  /**
   * Creates a namer.
   *
   * @param tablePrefix Prefix for every derived name; may be empty
   * @param directoryPrefixes Archive directory path to name part; a mapping to
   *     the empty string drops the directory from the name
   */
  public ShapefileTableNamer(String tablePrefix, Map<String, String> directoryPrefixes) {
    this.tablePrefix = sanitize(tablePrefix);
    this.directoryPrefixes = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : directoryPrefixes.entrySet()) {
      this.directoryPrefixes.put(normalizeDirectory(entry.getKey()), sanitize(entry.getValue()));
    }
  }

  /**
   * Derives the table name for a shapefile entry path such as
   * {@code dir/sub/Name.shp}.
   *
   * @throws MalformedArchiveException if nothing usable remains of the name
   */
  public String deriveName(String entryPath) {
    String path = entryPath.replace('\\', '/');
    int slash = path.lastIndexOf('/');
    String directory = slash < 0 ? "" : path.substring(0, slash);
    String fileName = slash < 0 ? path : path.substring(slash + 1);
    int dot = fileName.lastIndexOf('.');
    String baseName = dot < 0 ? fileName : fileName.substring(0, dot);

    List<String> parts = new ArrayList<>();
    parts.add(tablePrefix);

    String remaining = normalizeDirectory(directory);
    String matched = longestMatch(remaining);
    if (matched != null) {
      parts.add(directoryPrefixes.get(matched));
      remaining = remaining.substring(matched.length());
    }
    for (String dir : remaining.split("/")) {
      parts.add(sanitize(dir));
    }
    parts.add(sanitize(baseName));

    StringBuilder name = new StringBuilder();
    for (String part : parts) {
      if (part.isEmpty()) {
        continue;
      }
      if (name.length() > 0) {
        name.append('_');
      }
      name.append(part);
    }
    if (name.length() == 0 || sanitize(baseName).isEmpty()) {
      throw new MalformedArchiveException("Cannot derive a table name from " + entryPath);
    }
    return name.toString();
  }

  private String longestMatch(String directory) {
    String best = null;
    for (String candidate : directoryPrefixes.keySet()) {
      boolean matches = candidate.isEmpty()
          || directory.equals(candidate)
          || directory.startsWith(candidate + "/");
      if (matches && (best == null || candidate.length() > best.length())) {
        best = candidate;
      }
    }
    return best;
  }

  private static String normalizeDirectory(String directory) {
    String normalized = directory.replace('\\', '/').toLowerCase(Locale.ROOT);
    while (normalized.startsWith("/")) {
      normalized = normalized.substring(1);
    }
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  static String sanitize(String part) {
    String lower = part.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    int start = 0;
    int end = lower.length();
    while (start < end && lower.charAt(start) == '_') {
      start++;
    }
    while (end > start && lower.charAt(end - 1) == '_') {
      end--;
    }
    return lower.substring(start, end);
  }
}
