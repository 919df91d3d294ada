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

import org.apache.calcite.adapter.geosync.SourceUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;

/**
 * Fetches source payloads over HTTP(S).
 */
public class HttpSourceFetcher implements SourceFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSourceFetcher.class);

  public static final int DEFAULT_CONNECT_TIMEOUT_MS = 30000;
  public static final int DEFAULT_READ_TIMEOUT_MS = 300000;
  public static final String DEFAULT_USER_AGENT = "Apache-Calcite-GeoSync/1.0";

  private final int connectTimeoutMs;
  private final int readTimeoutMs;
  private final String userAgent;

  public HttpSourceFetcher() {
    this(DEFAULT_CONNECT_TIMEOUT_MS, DEFAULT_READ_TIMEOUT_MS, DEFAULT_USER_AGENT);
  }

  /**
   * Creates a fetcher.
   *
   * @param connectTimeoutMs Connect timeout; 0 waits indefinitely
   * @param readTimeoutMs Read timeout; 0 waits indefinitely
   * @param userAgent User-Agent header sent with every request
   */
  public HttpSourceFetcher(int connectTimeoutMs, int readTimeoutMs, String userAgent) {
    this.connectTimeoutMs = connectTimeoutMs;
    this.readTimeoutMs = readTimeoutMs;
    this.userAgent = userAgent;
  }

  @Override public byte[] fetch(String urlString) {
    HttpURLConnection conn = null;
    try {
      URL url = URI.create(urlString).toURL();
      if (!"http".equals(url.getProtocol()) && !"https".equals(url.getProtocol())) {
        throw new SourceUnavailableException(urlString, "Not an HTTP URL: " + urlString);
      }
      conn = (HttpURLConnection) url.openConnection();
      conn.setRequestMethod("GET");
      conn.setConnectTimeout(connectTimeoutMs);
      conn.setReadTimeout(readTimeoutMs);
      // Some providers sit behind CDNs that reject bare requests
      conn.setRequestProperty("User-Agent", userAgent);
      conn.setRequestProperty("Accept", "application/zip, application/geo+json, application/json, */*");

      int responseCode = conn.getResponseCode();
      if (responseCode != HttpURLConnection.HTTP_OK) {
        throw new SourceUnavailableException(urlString,
            "HTTP " + responseCode + " for URL: " + urlString);
      }

      long expectedLength = conn.getContentLengthLong();
      LOGGER.info("Downloading {} ({} KB)", urlString, Math.max(expectedLength, 0) / 1024);

      byte[] payload;
      try (InputStream in = new BufferedInputStream(conn.getInputStream())) {
        payload = readFully(in);
      }

      if (expectedLength > 0 && payload.length != expectedLength) {
        throw new SourceUnavailableException(urlString, "Incomplete download: expected "
            + expectedLength + " bytes but got " + payload.length + " for URL: " + urlString);
      }
      LOGGER.debug("Downloaded {} bytes from {}", payload.length, urlString);
      return payload;
    } catch (IOException | IllegalArgumentException e) {
      throw new SourceUnavailableException(urlString,
          "Failed to fetch " + urlString + ": " + e.getMessage(), e);
    } finally {
      if (conn != null) {
        conn.disconnect();
      }
    }
  }

  private static byte[] readFully(InputStream in) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[8192];
    int bytesRead;
    while ((bytesRead = in.read(buffer)) != -1) {
      out.write(buffer, 0, bytesRead);
    }
    return out.toByteArray();
  }
}
