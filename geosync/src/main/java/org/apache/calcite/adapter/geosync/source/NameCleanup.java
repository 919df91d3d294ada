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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Ordered text cleanup rules applied to the name attribute of a dataset.
 *
 * <p>Rule syntax: {@code lowercase}, {@code uppercase}, {@code titlecase},
 * {@code trim} (collapses whitespace), {@code strip-suffix:<text>},
 * {@code strip-prefix:<text>}. The rules are re-applied until the value stops
 * changing, so applying a cleanup twice gives the same result as applying it
 * once.
 */
public final class NameCleanup implements UnaryOperator<String> {
  private static final NameCleanup NONE = new NameCleanup(Collections.emptyList(),
      Collections.emptyList());
  private static final int MAX_PASSES = 16;

  private final List<String> ruleTexts;
  private final List<UnaryOperator<String>> rules;

  private NameCleanup(List<String> ruleTexts, List<UnaryOperator<String>> rules) {
    this.ruleTexts = Collections.unmodifiableList(ruleTexts);
    this.rules = rules;
  }

  public static NameCleanup none() {
    return NONE;
  }

  /**
   * Parses rule texts.
   *
   * @throws IllegalArgumentException on an unknown rule
   */
  public static NameCleanup of(List<String> ruleTexts) {
    List<UnaryOperator<String>> rules = new ArrayList<>();
    for (String ruleText : ruleTexts) {
      rules.add(parseRule(ruleText));
    }
    return new NameCleanup(new ArrayList<>(ruleTexts), rules);
  }

  private static UnaryOperator<String> parseRule(String ruleText) {
    int colon = ruleText.indexOf(':');
    String keyword = (colon < 0 ? ruleText : ruleText.substring(0, colon)).trim().toLowerCase(Locale.ROOT);
    String argument = colon < 0 ? "" : ruleText.substring(colon + 1);
    switch (keyword) {
    case "lowercase":
      return s -> s.toLowerCase(Locale.ROOT);
    case "uppercase":
      return s -> s.toUpperCase(Locale.ROOT);
    case "titlecase":
      return NameCleanup::titleCase;
    case "trim":
      return s -> s.trim().replaceAll("\\s+", " ");
    case "strip-suffix":
      requireArgument(ruleText, argument);
      return s -> s.endsWith(argument) ? s.substring(0, s.length() - argument.length()).trim() : s;
    case "strip-prefix":
      requireArgument(ruleText, argument);
      return s -> s.startsWith(argument) ? s.substring(argument.length()).trim() : s;
    default:
      throw new IllegalArgumentException("Unknown name cleanup rule: " + ruleText);
    }
  }

  private static void requireArgument(String ruleText, String argument) {
    if (argument.isEmpty()) {
      throw new IllegalArgumentException("Rule needs text after ':': " + ruleText);
    }
  }

  static String titleCase(String s) {
    StringBuilder out = new StringBuilder(s.length());
    boolean startOfWord = true;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (Character.isWhitespace(c) || c == '-') {
        startOfWord = true;
        out.append(c);
      } else if (startOfWord) {
        out.append(Character.toUpperCase(c));
        startOfWord = false;
      } else {
        out.append(Character.toLowerCase(c));
      }
    }
    return out.toString();
  }

  @Override public @Nullable String apply(@Nullable String value) {
    if (value == null || rules.isEmpty()) {
      return value;
    }
    String current = value;
    for (int pass = 0; pass < MAX_PASSES; pass++) {
      String next = current;
      for (UnaryOperator<String> rule : rules) {
        next = rule.apply(next);
      }
      if (next.equals(current)) {
        return current;
      }
      current = next;
    }
    return current;
  }

  public List<String> getRuleTexts() {
    return ruleTexts;
  }

  @Override public String toString() {
    return "NameCleanup" + ruleTexts;
  }
}
