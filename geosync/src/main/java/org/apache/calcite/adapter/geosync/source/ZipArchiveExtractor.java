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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Extracts ZIP archives in memory.
 *
 * <p>Directory entries are skipped. Entry names are normalized to forward
 * slashes; names that are absolute or climb out of the archive root are
 * rejected. Extraction stops with {@link MalformedArchiveException} once
 * the uncompressed entries exceed a byte limit.
 */
public class ZipArchiveExtractor implements ArchiveExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(ZipArchiveExtractor.class);

  /** Default limit on the total uncompressed size of an archive, 1 GiB. */
  public static final long DEFAULT_MAX_EXTRACTED_BYTES = 1L << 30;

  private final long maxExtractedBytes;

  public ZipArchiveExtractor() {
    this(DEFAULT_MAX_EXTRACTED_BYTES);
  }

  public ZipArchiveExtractor(long maxExtractedBytes) {
    if (maxExtractedBytes < 1) {
      throw new IllegalArgumentException("maxExtractedBytes must be positive: "
          + maxExtractedBytes);
    }
    this.maxExtractedBytes = maxExtractedBytes;
  }

  @Override public Map<String, byte[]> extract(byte[] archive) {
    Map<String, byte[]> entries = new LinkedHashMap<>();
    long total = 0;
    try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zis.getNextEntry()) != null) {
        if (entry.isDirectory()) {
          continue;
        }
        String name = normalize(entry.getName());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int len;
        while ((len = zis.read(buffer)) > 0) {
          total += len;
          if (total > maxExtractedBytes) {
            throw new MalformedArchiveException("Archive expands beyond "
                + maxExtractedBytes + " bytes at entry " + name);
          }
          out.write(buffer, 0, len);
        }
        entries.put(name, out.toByteArray());
        LOGGER.debug("Extracted: {} ({} bytes)", name, out.size());
        zis.closeEntry();
      }
    } catch (IOException e) {
      throw new MalformedArchiveException("Failed to extract archive: " + e.getMessage(), e);
    }
    if (entries.isEmpty()) {
      throw new MalformedArchiveException("Archive is empty or not a ZIP file");
    }
    LOGGER.info("Extracted {} entries from archive", entries.size());
    return entries;
  }

  static String normalize(String entryName) {
    String name = entryName.replace('\\', '/');
    if (name.startsWith("/") || name.matches("^[A-Za-z]:.*")) {
      throw new MalformedArchiveException("Absolute path in archive: " + entryName);
    }
    for (String part : name.split("/")) {
      if ("..".equals(part)) {
        throw new MalformedArchiveException("Archive entry escapes its root: " + entryName);
      }
    }
    return name;
  }
}
