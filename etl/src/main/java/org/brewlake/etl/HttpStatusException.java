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
package org.brewlake.etl;

import java.io.IOException;

/**
 * Thrown when an HTTP request completes with a non-2xx status code.
 */
public class HttpStatusException extends IOException {

  private final int statusCode;
  private final String url;

  public HttpStatusException(int statusCode, String url, String body) {
    super("HTTP " + statusCode + " from " + url
        + (body != null && !body.isEmpty() ? ": " + abbreviate(body) : ""));
    this.statusCode = statusCode;
    this.url = url;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getUrl() {
    return url;
  }

  private static String abbreviate(String body) {
    return body.length() > 200 ? body.substring(0, 200) + "..." : body;
  }
}
