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

/**
 * Thrown by a read when a stored geometry value fails to decode. The whole
 * read fails; rows are never silently dropped.
 */
public class CorruptStoredGeometryException extends GeoSyncException {
  private final String tableName;
  private final int rowNumber;

  public CorruptStoredGeometryException(String tableName, int rowNumber,
      InvalidGeometryTextException cause) {
    super("Stored geometry in table '" + tableName + "' row " + rowNumber
        + " could not be decoded: " + cause.getMessage(), cause);
    this.tableName = tableName;
    this.rowNumber = rowNumber;
  }

  public String getTableName() {
    return tableName;
  }

  /** Zero-based position of the offending row in the read order. */
  public int getRowNumber() {
    return rowNumber;
  }
}
