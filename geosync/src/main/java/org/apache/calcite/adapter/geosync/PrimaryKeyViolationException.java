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
 * Thrown when the store rejects the primary key constraint of a written table
 * because the key attribute holds duplicate or null values.
 */
public class PrimaryKeyViolationException extends GeoSyncException {
  private final String tableName;
  private final String keyAttribute;

  public PrimaryKeyViolationException(String tableName, String keyAttribute, Throwable cause) {
    super("Primary key '" + keyAttribute + "' rejected for table '" + tableName + "': "
        + cause.getMessage(), cause);
    this.tableName = tableName;
    this.keyAttribute = keyAttribute;
  }

  public String getTableName() {
    return tableName;
  }

  public String getKeyAttribute() {
    return keyAttribute;
  }
}
