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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link StoreConfig}.
 */
@Tag("unit")
class StoreConfigTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void testDefaultsAddressPostgresService() {
    StoreConfig config = StoreConfig.fromJson(null);

    assertEquals("jdbc:postgresql://postgres:5432/github_projects", config.getJdbcUrl());
    assertEquals("postgres", config.getUser());
    assertNull(config.getSchema());
    assertEquals(StoreConfig.DEFAULT_MAX_POOL_SIZE, config.getMaxPoolSize());
  }

  @Test
  void testHostPortDatabase() throws Exception {
    JsonNode node = MAPPER.readTree("{\"host\":\"db.internal\",\"port\":\"6543\","
        + "\"database\":\"geo\",\"user\":\"loader\",\"password\":\"s3cret\","
        + "\"schema\":\"reference\",\"maxPoolSize\":8}");

    StoreConfig config = StoreConfig.fromJson(node);

    assertEquals("jdbc:postgresql://db.internal:6543/geo", config.getJdbcUrl());
    assertEquals("loader", config.getUser());
    assertEquals("s3cret", config.getPassword());
    assertEquals("reference", config.getSchema());
    assertEquals(8, config.getMaxPoolSize());
  }

  @Test
  void testJdbcUrlOverrides() throws Exception {
    JsonNode node = MAPPER.readTree("{\"jdbcUrl\":\"jdbc:h2:mem:x\",\"host\":\"ignored\"}");

    assertEquals("jdbc:h2:mem:x", StoreConfig.fromJson(node).getJdbcUrl());
  }

  @Test
  void testPoolProperties() {
    StoreConfig config = new StoreConfig("jdbc:h2:mem:p", "sa", "pw", "PUBLIC", 3, 1000L);
    Properties props = config.toPoolProperties("geosync-test");

    assertEquals("jdbc:h2:mem:p", props.getProperty("jdbcUrl"));
    assertEquals("sa", props.getProperty("username"));
    assertEquals("3", props.getProperty("maximumPoolSize"));
    assertEquals("1000", props.getProperty("connectionTimeout"));
    assertEquals("PUBLIC", props.getProperty("schema"));
    assertEquals("geosync-test", props.getProperty("poolName"));
    assertFalse(config.toString().contains("pw"));
  }

  @Test
  void testInvalidPoolSize() {
    assertThrows(IllegalArgumentException.class,
        () -> new StoreConfig("jdbc:h2:mem:p", "sa", "", null, 0, 1000L));
  }
}
