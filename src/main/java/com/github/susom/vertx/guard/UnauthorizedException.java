/*
 * Copyright 2016 The Board of Trustees of The Leland Stanford Junior University.
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

import io.vertx.core.json.JsonObject;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Signal that the current request is not permitted. Throw this from anywhere
 * in a handler (or pass it to {@code RoutingContext.fail()} from async code)
 * and the {@link AuthorizationHandler} installed as a failure handler will
 * turn it into a response: the reply carried here if there is one, otherwise
 * whatever the authenticating backend produces for an unauthorized request.
 *
 * @author garricko
 */
public class UnauthorizedException extends RuntimeException {
  private final JsonObject metadata;
  private final Reply reply;

  /**
   * @param message this message is expected to be returned to the client
   *                so do not include sensitive information
   */
  public UnauthorizedException(String message) {
    this(message, new JsonObject(), null);
  }

  /**
   * @param message this message is expected to be returned to the client
   *                so do not include sensitive information
   * @param metadata additional details handed to the unauthorized handler
   */
  public UnauthorizedException(String message, JsonObject metadata) {
    this(message, metadata, null);
  }

  /**
   * @param reply sent to the client verbatim, bypassing any backend handler
   */
  public UnauthorizedException(@Nonnull Reply reply) {
    this("Unauthorized", new JsonObject(), reply);
  }

  public UnauthorizedException(String message, Throwable cause) {
    super(message, cause);
    this.metadata = new JsonObject().put("message", message);
    this.reply = null;
  }

  private UnauthorizedException(String message, JsonObject metadata, Reply reply) {
    super(message);
    this.metadata = metadata == null ? new JsonObject() : metadata.copy();
    if (message != null && !this.metadata.containsKey("message")) {
      this.metadata.put("message", message);
    }
    this.reply = reply;
  }

  /**
   * Details for the unauthorized handler. Always contains "message" when
   * a message was provided.
   */
  @Nonnull
  public JsonObject metadata() {
    return metadata.copy();
  }

  @Nullable
  public Reply reply() {
    return reply;
  }
}
