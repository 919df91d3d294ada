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
package org.apache.calcite.adapter.geosync.table;

import org.apache.calcite.adapter.geosync.SchemaMismatchException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * In-memory attribute type with a fixed width, named by the type tags callers
 * use in type maps ({@code "string"}, {@code "int32"}, {@code "float64"}, ...).
 *
 * <p>{@link #coerce(Object)} converts a value to the Java class of the type
 * and refuses conversions that would overflow the width or drop a fractional
 * part.
 */
public enum AttributeType {
  STRING(ColumnType.TEXT, "string", "str", "text", "object"),
  INT16(ColumnType.INTEGER, "int16", "smallint"),
  INT32(ColumnType.INTEGER, "int32", "integer"),
  INT64(ColumnType.INTEGER, "int64", "int", "bigint", "long"),
  FLOAT32(ColumnType.FLOAT, "float32", "real"),
  FLOAT64(ColumnType.FLOAT, "float64", "float", "double");

  private final ColumnType columnType;
  private final List<String> tags;

  AttributeType(ColumnType columnType, String... tags) {
    this.columnType = columnType;
    this.tags = Arrays.asList(tags);
  }

  public ColumnType getColumnType() {
    return columnType;
  }

  /**
   * Resolves a type tag, ignoring case.
   *
   * @throws IllegalArgumentException if the tag is not known
   */
  public static AttributeType fromTag(String tag) {
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    for (AttributeType type : values()) {
      if (type.tags.contains(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown attribute type tag: " + tag);
  }

  /**
   * Converts a value to this type. Nulls pass through.
   *
   * @throws SchemaMismatchException if the value cannot be represented
   */
  public @Nullable Object coerce(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    switch (this) {
    case STRING:
      return value instanceof String ? value : value.toString();
    case INT16:
      return (short) toLong(value, Short.MIN_VALUE, Short.MAX_VALUE);
    case INT32:
      return (int) toLong(value, Integer.MIN_VALUE, Integer.MAX_VALUE);
    case INT64:
      return toLong(value, Long.MIN_VALUE, Long.MAX_VALUE);
    case FLOAT32:
      return (float) toDouble(value);
    case FLOAT64:
      return toDouble(value);
    default:
      throw new AssertionError(this);
    }
  }

  private long toLong(Object value, long min, long max) {
    long result;
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      result = ((Number) value).longValue();
    } else {
      BigDecimal decimal = toDecimal(value);
      try {
        result = decimal.longValueExact();
      } catch (ArithmeticException e) {
        throw mismatch(value, e);
      }
    }
    if (result < min || result > max) {
      throw new SchemaMismatchException(
          "Value " + value + " does not fit in " + name().toLowerCase(Locale.ROOT));
    }
    return result;
  }

  private double toDouble(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw mismatch(value, e);
    }
  }

  private BigDecimal toDecimal(Object value) {
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw mismatch(value, null);
      }
      return BigDecimal.valueOf(d);
    }
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    try {
      return new BigDecimal(value.toString().trim());
    } catch (NumberFormatException e) {
      throw mismatch(value, e);
    }
  }

  private SchemaMismatchException mismatch(Object value, @Nullable Throwable cause) {
    String message = "Cannot convert '" + value + "' to " + name().toLowerCase(Locale.ROOT);
    return cause == null
        ? new SchemaMismatchException(message)
        : new SchemaMismatchException(message, cause);
  }
}
