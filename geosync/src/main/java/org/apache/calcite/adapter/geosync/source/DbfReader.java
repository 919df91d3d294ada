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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the attribute table (.dbf, dBase III) of a shapefile.
 *
 * <p>Supported field types: C (character), N and F (numeric), L (logical),
 * D (date). Other types are returned as trimmed text. Deleted records are kept
 * as {@code null} entries so that record positions stay aligned with the
 * shapes of the .shp file.
 */
final class DbfReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(DbfReader.class);

  private static final byte FIELD_TERMINATOR = 0x0D;
  private static final int FIELD_DESCRIPTOR_LENGTH = 32;

  private final List<Field> fields;
  private final List<Object[]> records;

  private DbfReader(List<Field> fields, List<Object[]> records) {
    this.fields = Collections.unmodifiableList(fields);
    this.records = Collections.unmodifiableList(records);
  }

  List<Field> getFields() {
    return fields;
  }

  /** Records in file order; deleted records are null. */
  List<Object[]> getRecords() {
    return records;
  }

  static DbfReader read(byte[] data, Charset charset) {
    ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    if (data.length < 32) {
      throw new MalformedArchiveException("DBF file too short: " + data.length + " bytes");
    }
    int recordCount = buffer.getInt(4);
    int headerLength = Short.toUnsignedInt(buffer.getShort(8));
    int recordLength = Short.toUnsignedInt(buffer.getShort(10));

    List<Field> fields = new ArrayList<>();
    int offset = 32;
    while (offset < headerLength && offset < data.length && data[offset] != FIELD_TERMINATOR) {
      if (offset + FIELD_DESCRIPTOR_LENGTH > data.length) {
        throw new MalformedArchiveException("Truncated DBF field descriptor at offset " + offset);
      }
      int nameLength = 0;
      while (nameLength < 11 && data[offset + nameLength] != 0) {
        nameLength++;
      }
      String name = new String(data, offset, nameLength, charset).trim();
      char type = (char) data[offset + 11];
      int length = Byte.toUnsignedInt(data[offset + 16]);
      int decimals = Byte.toUnsignedInt(data[offset + 17]);
      fields.add(new Field(name, type, length, decimals));
      offset += FIELD_DESCRIPTOR_LENGTH;
    }

    int fieldBytes = 1;
    for (Field field : fields) {
      fieldBytes += field.length;
    }
    if (!fields.isEmpty() && fieldBytes > recordLength) {
      throw new MalformedArchiveException("DBF fields need " + fieldBytes
          + " bytes per record but records are " + recordLength + " bytes");
    }

    List<Object[]> records = new ArrayList<>(Math.max(recordCount, 0));
    for (int r = 0; r < recordCount; r++) {
      int start = headerLength + r * recordLength;
      if (start + recordLength > data.length) {
        LOGGER.warn("DBF declares {} records but only {} are present", recordCount, r);
        break;
      }
      if (data[start] == '*') {
        records.add(null);
        continue;
      }
      Object[] values = new Object[fields.size()];
      int position = start + 1;
      for (int f = 0; f < fields.size(); f++) {
        Field field = fields.get(f);
        String raw = new String(data, position, field.length, charset);
        values[f] = field.parse(raw);
        position += field.length;
      }
      records.add(values);
    }
    return new DbfReader(fields, records);
  }

  /** A DBF column descriptor. */
  static final class Field {
    final String name;
    final char type;
    final int length;
    final int decimals;

    Field(String name, char type, int length, int decimals) {
      this.name = name;
      this.type = Character.toUpperCase(type);
      this.length = length;
      this.decimals = decimals;
    }

    ColumnType columnType() {
      switch (type) {
      case 'N':
        return decimals == 0 && length <= 18 ? ColumnType.INTEGER : ColumnType.FLOAT;
      case 'F':
        return ColumnType.FLOAT;
      default:
        return ColumnType.TEXT;
      }
    }

    @Nullable Object parse(String raw) {
      String value = raw.trim();
      if (value.isEmpty()) {
        return null;
      }
      switch (type) {
      case 'N':
      case 'F':
        if (value.chars().allMatch(c -> c == '*')) {
          return null;
        }
        try {
          if (columnType() == ColumnType.INTEGER) {
            return Long.parseLong(value);
          }
          return Double.parseDouble(value);
        } catch (NumberFormatException e) {
          throw new MalformedArchiveException("Bad numeric value '" + value + "' in field "
              + name, e);
        }
      case 'L':
        switch (value.charAt(0)) {
        case 'T':
        case 't':
        case 'Y':
        case 'y':
          return "true";
        case 'F':
        case 'f':
        case 'N':
        case 'n':
          return "false";
        default:
          return null;
        }
      case 'D':
        if (value.length() == 8) {
          return value.substring(0, 4) + "-" + value.substring(4, 6) + "-" + value.substring(6);
        }
        return value;
      default:
        return value;
      }
    }

    @Override public String toString() {
      return name + "(" + type + length + "." + decimals + ")";
    }
  }
}
