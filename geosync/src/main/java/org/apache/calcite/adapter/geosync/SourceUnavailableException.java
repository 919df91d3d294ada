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
 * Thrown when a source payload cannot be fetched: the host is unreachable or
 * the provider answered with a non-success status.
 */
public class SourceUnavailableException extends GeoSyncException {
  private final String url;

  public SourceUnavailableException(String url, String message) {
    super(message);
    this.url = url;
  }

  public SourceUnavailableException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  /** Returns the URL that could not be fetched. */
  public String getUrl() {
    return url;
  }
}
