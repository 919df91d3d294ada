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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ShapefileTableNamer}.
 */
@Tag("unit")
class ShapefileTableNamerTest {

  @Test
  void testPlainFileName() {
    ShapefileTableNamer namer = new ShapefileTableNamer();
    assertEquals("areas", namer.deriveName("Areas.shp"));
    assertEquals("lsoa_2021_e_w", namer.deriveName("LSOA 2021 (E&W).shp"));
  }

  @Test
  void testUnmappedDirectoriesContributeTheirNames() {
    ShapefileTableNamer namer = new ShapefileTableNamer();
    assertEquals("data_sub_dir_my_file", namer.deriveName("Data/Sub Dir/My-File.SHP"));
  }

  @Test
  void testMappedDirectoryPrefix() {
    ShapefileTableNamer namer = new ShapefileTableNamer("uk",
        Collections.singletonMap("PostalBoundaries/SHP", "postcode"));
    assertEquals("uk_postcode_areas", namer.deriveName("PostalBoundaries/SHP/Areas.shp"));
    assertEquals("uk_postcode_extra_districts",
        namer.deriveName("postalboundaries/shp/Extra/Districts.shp"));
    assertEquals("uk_other_areas", namer.deriveName("Other/Areas.shp"));
  }

  @Test
  void testLongestPrefixWins() {
    Map<String, String> prefixes = new LinkedHashMap<>();
    prefixes.put("Boundaries", "b");
    prefixes.put("Boundaries/Postal", "postcode");
    ShapefileTableNamer namer = new ShapefileTableNamer("", prefixes);
    assertEquals("postcode_sectors", namer.deriveName("Boundaries/Postal/Sectors.shp"));
    assertEquals("b_wards", namer.deriveName("Boundaries/Wards.shp"));
  }

  @Test
  void testDeterministic() {
    ShapefileTableNamer namer = new ShapefileTableNamer("uk",
        Collections.singletonMap("Distribution", "postcode"));
    assertEquals(namer.deriveName("Distribution/Areas.shp"),
        namer.deriveName("Distribution/Areas.shp"));
  }

  @Test
  void testUnusableName() {
    assertThrows(MalformedArchiveException.class,
        () -> new ShapefileTableNamer().deriveName("dir/___.shp"));
  }

  @Test
  void testSanitize() {
    assertEquals("a_b", ShapefileTableNamer.sanitize("__A  B__"));
    assertEquals("", ShapefileTableNamer.sanitize("--"));
  }
}
