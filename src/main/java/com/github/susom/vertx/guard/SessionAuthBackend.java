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

import io.vertx.core.Future;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.Session;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Pick up an identity that a login handler previously put in the session.
 * This backend never inspects headers, so its parse step always matches.
 * Place a Vert.x {@code SessionHandler} in front of the authentication
 * handler, or configure a different session accessor.
 *
 * @author garricko
 */
public class SessionAuthBackend extends AbstractAuthBackend<RoutingContext> {
  private final String sessionKey;
  private final Function<RoutingContext, Session> sessionAccessor;

  private SessionAuthBackend(Builder builder) {
    super(builder.unauthorizedHandler);
    this.sessionKey = builder.sessionKey;
    this.sessionAccessor = builder.sessionAccessor;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Nonnull
  @Override
  public String name() {
    return "session";
  }

  @Nullable
  @Override
  public RoutingContext parse(@Nonnull RoutingContext rc) {
    return rc;
  }

  @Nonnull
  @Override
  public Future<Object> authenticate(@Nonnull RoutingContext rc, @Nonnull RoutingContext data) {
    Session session = sessionAccessor.apply(rc);
    if (session == null) {
      return Future.succeededFuture();
    }
    Object identity = session.get(sessionKey);
    return Future.succeededFuture(AuthContext.present(identity) ? identity : null);
  }

  public static class Builder {
    private String sessionKey = AuthContext.IDENTITY;
    private Function<RoutingContext, Session> sessionAccessor = RoutingContext::session;
    private UnauthorizedHandler unauthorizedHandler;

    /**
     * Session entry holding the identity (default "identity").
     */
    public Builder sessionKey(String sessionKey) {
      this.sessionKey = sessionKey;
      return this;
    }

    public Builder sessionAccessor(Function<RoutingContext, Session> sessionAccessor) {
      this.sessionAccessor = sessionAccessor;
      return this;
    }

    public Builder unauthorizedHandler(UnauthorizedHandler unauthorizedHandler) {
      this.unauthorizedHandler = unauthorizedHandler;
      return this;
    }

    public SessionAuthBackend build() {
      checkNotNull(sessionKey, "A session key is required");
      checkArgument(!sessionKey.isEmpty(), "The session key may not be empty");
      checkNotNull(sessionAccessor, "A session accessor is required");
      return new SessionAuthBackend(this);
    }
  }
}
