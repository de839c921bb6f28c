/*
 * Copyright 2024 The Board of Trustees of The Leland Stanford Junior University.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.susom.vertx.guard;

import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An immutable description of an HTTP response (status, headers, body) that
 * the security handlers can pass around before deciding to send it. Backends,
 * error handlers and the unauthorized signal all produce these, and the
 * handler that finally owns the request calls {@link #send(RoutingContext)}.
 *
 * @author garricko
 */
public final class Reply {
  private final int statusCode;
  private final MultiMap headers;
  private final String body;

  private Reply(int statusCode, MultiMap headers, String body) {
    this.statusCode = statusCode;
    this.headers = headers;
    this.body = body;
  }

  @Nonnull
  public static Reply status(int statusCode) {
    return new Reply(statusCode, MultiMap.caseInsensitiveMultiMap(), "");
  }

  @Nonnull
  public static Reply status(int statusCode, String body) {
    return status(statusCode).body(body);
  }

  /**
   * A 302 redirect to the provided location.
   */
  @Nonnull
  public static Reply redirect(@Nonnull String location) {
    return status(302).header("Location", location);
  }

  /**
   * The generic 403 used when nothing more specific is configured.
   */
  @Nonnull
  public static Reply forbidden() {
    return status(403, "403 Forbidden");
  }

  /**
   * Return a copy of this reply with the additional header.
   */
  @Nonnull
  public Reply header(@Nonnull String name, @Nonnull String value) {
    MultiMap copy = MultiMap.caseInsensitiveMultiMap().addAll(headers);
    copy.add(name, value);
    return new Reply(statusCode, copy, body);
  }

  @Nonnull
  public Reply body(@Nullable String body) {
    return new Reply(statusCode, headers, body == null ? "" : body);
  }

  public int statusCode() {
    return statusCode;
  }

  @Nullable
  public String header(@Nonnull String name) {
    return headers.get(name);
  }

  @Nonnull
  public String body() {
    return body;
  }

  /**
   * Write this reply to the response of the provided context and end it.
   */
  public void send(@Nonnull RoutingContext rc) {
    HttpServerResponse response = rc.response();
    response.setStatusCode(statusCode);
    for (Map.Entry<String, String> entry : headers) {
      response.headers().add(entry.getKey(), entry.getValue());
    }
    response.end(body);
  }

  @Override
  public String toString() {
    return "Reply{" + statusCode + " " + headers.entries() + "}";
  }
}
