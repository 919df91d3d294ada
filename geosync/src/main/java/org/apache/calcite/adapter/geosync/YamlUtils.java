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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility methods for reading YAML configuration.
 *
 * <p>YAML is parsed with SnakeYAML, so anchors and aliases are resolved, and
 * converted to a Jackson {@link JsonNode}. JSON input is read by Jackson
 * directly.
 */
public class YamlUtils {
  private static final Logger LOGGER = LoggerFactory.getLogger(YamlUtils.class);

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  /** Matches {@code ${VAR}} and {@code ${VAR:default}}. */
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?}");

  /** Environment first, then system properties. */
  public static final UnaryOperator<String> ENVIRONMENT = name -> {
    String value = System.getenv(name);
    return value != null ? value : System.getProperty(name);
  };

  private YamlUtils() {
  }

  /**
   * Parses a YAML or JSON stream.
   *
   * @param stream YAML or JSON data
   * @param resourceName Name of the resource; the extension selects the format
   * @throws IOException if the stream cannot be read or parsed
   */
  public static JsonNode parseYamlOrJson(InputStream stream, String resourceName)
      throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(500);
      Yaml yaml = new Yaml(loaderOptions);
      Object parsedYaml;
      try {
        parsedYaml = yaml.load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      return JSON_MAPPER.convertValue(parsedYaml, JsonNode.class);
    } else {
      return JSON_MAPPER.readTree(stream);
    }
  }

  /**
   * Returns a copy of a tree with {@code ${VAR:default}} placeholders in text
   * values replaced. A variable that the lookup does not know and that has no
   * default becomes the empty string.
   */
  public static JsonNode resolvePlaceholders(JsonNode node, UnaryOperator<String> lookup) {
    if (node == null) {
      return null;
    }
    if (node.isTextual()) {
      String text = node.textValue();
      return text.contains("${") ? TextNode.valueOf(resolve(text, lookup)) : node;
    }
    if (node.isObject()) {
      ObjectNode copy = JSON_MAPPER.createObjectNode();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        copy.set(field.getKey(), resolvePlaceholders(field.getValue(), lookup));
      }
      return copy;
    }
    if (node.isArray()) {
      ArrayNode copy = JSON_MAPPER.createArrayNode();
      for (JsonNode element : node) {
        copy.add(resolvePlaceholders(element, lookup));
      }
      return copy;
    }
    return node;
  }

  static String resolve(String value, UnaryOperator<String> lookup) {
    Matcher matcher = PLACEHOLDER.matcher(value);
    StringBuffer sb = new StringBuffer();
    while (matcher.find()) {
      String name = matcher.group(1).trim();
      String resolved = lookup.apply(name);
      if (resolved == null) {
        resolved = matcher.group(2);
      }
      if (resolved == null) {
        LOGGER.warn("Configuration variable {} is not set and has no default", name);
        resolved = "";
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}
