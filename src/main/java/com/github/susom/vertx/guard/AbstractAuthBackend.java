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

import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Shared unauthorized handling for the built-in backends. A request that is
 * already authenticated gets a 403 (it is who it says, but may not do this),
 * while an anonymous one gets a 401 plus the backend's challenge, if any.
 * A custom {@link UnauthorizedHandler} replaces both.
 *
 * @author garricko
 */
public abstract class AbstractAuthBackend<A> implements AuthBackend<A> {
  private final UnauthorizedHandler unauthorizedHandler;

  protected AbstractAuthBackend(@Nullable UnauthorizedHandler unauthorizedHandler) {
    this.unauthorizedHandler = unauthorizedHandler;
  }

  /**
   * Value for the WWW-Authenticate header on 401 replies, or null for none.
   */
  @Nullable
  protected String challenge() {
    return null;
  }

  @Nonnull
  @Override
  public Reply onUnauthorized(@Nonnull RoutingContext rc, @Nonnull JsonObject metadata) {
    if (unauthorizedHandler != null) {
      return unauthorizedHandler.handle(rc, metadata);
    }
    if (AuthContext.isAuthenticated(rc)) {
      return Reply.status(403, "Permission denied");
    }
    Reply reply = Reply.status(401, "Unauthorized");
    String challenge = challenge();
    if (challenge != null) {
      reply = reply.header("WWW-Authenticate", challenge);
    }
    return reply;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + name() + "}";
  }
}
