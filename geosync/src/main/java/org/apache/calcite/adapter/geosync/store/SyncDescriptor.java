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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of one table write: target table name, primary key attribute,
 * storage tag per attribute and whether the positional row identity becomes
 * a visible column.
 *
 * <p>Attributes missing from the tag map are stored with
 * {@link StorageType#defaultFor}. The geometry column is always stored as
 * well-known text whatever its tag says.
 */
public final class SyncDescriptor {
  public static final String DEFAULT_INDEX_LABEL = "index";

  private final String tableName;
  private final String primaryAttribute;
  private final Map<String, String> columnTypes;
  private final boolean persistIndex;
  private final String indexLabel;

  private SyncDescriptor(Builder builder) {
    this.tableName = Objects.requireNonNull(builder.tableName, "tableName");
    this.primaryAttribute = Objects.requireNonNull(builder.primaryAttribute, "primaryAttribute");
    this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columnTypes));
    this.persistIndex = builder.persistIndex;
    this.indexLabel = builder.indexLabel;
    for (String tag : columnTypes.values()) {
      StorageType.fromTag(tag);
    }
  }

  public static SyncDescriptor of(String tableName, String primaryAttribute) {
    return builder().tableName(tableName).primaryAttribute(primaryAttribute).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getTableName() {
    return tableName;
  }

  public String getPrimaryAttribute() {
    return primaryAttribute;
  }

  public Map<String, String> getColumnTypes() {
    return columnTypes;
  }

  public boolean isPersistIndex() {
    return persistIndex;
  }

  public String getIndexLabel() {
    return indexLabel;
  }

  @Override public String toString() {
    return "SyncDescriptor{table=" + tableName + ", primary=" + primaryAttribute
        + ", types=" + columnTypes + ", persistIndex=" + persistIndex + "}";
  }

  /** Builder for {@link SyncDescriptor}. */
  public static final class Builder {
    private String tableName;
    private String primaryAttribute;
    private final Map<String, String> columnTypes = new LinkedHashMap<>();
    private boolean persistIndex;
    private String indexLabel = DEFAULT_INDEX_LABEL;

    private Builder() {
    }

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder primaryAttribute(String primaryAttribute) {
      this.primaryAttribute = primaryAttribute;
      return this;
    }

    public Builder columnType(String attribute, String storageTag) {
      columnTypes.put(attribute, storageTag);
      return this;
    }

    public Builder columnTypes(Map<String, String> types) {
      columnTypes.putAll(types);
      return this;
    }

    public Builder persistIndex(boolean persistIndex) {
      this.persistIndex = persistIndex;
      return this;
    }

    public Builder indexLabel(String indexLabel) {
      this.indexLabel = indexLabel;
      return this;
    }

    public SyncDescriptor build() {
      return new SyncDescriptor(this);
    }
  }
}
