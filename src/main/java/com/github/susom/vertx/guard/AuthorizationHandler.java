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

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import javax.annotation.Nullable;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Failure handler that turns an {@link UnauthorizedException} into a response.
 * Install it with {@code route().failureHandler(...)}. The response comes from,
 * in order: the reply carried by the exception, the backend that authenticated
 * the request, the fallback configured here, or a plain 403.
 *
 * <p>Any other failure is passed along untouched to the next failure handler.</p>
 *
 * @author garricko
 */
public class AuthorizationHandler implements Handler<RoutingContext> {
  private static final Logger log = LoggerFactory.getLogger(AuthorizationHandler.class);
  private final UnauthorizedHandler fallback;

  /**
   * Use the authenticating backend, or a plain 403 for anonymous requests.
   */
  public AuthorizationHandler() {
    this((UnauthorizedHandler) null);
  }

  /**
   * Use the authenticating backend, or this backend for anonymous requests
   * (so they receive its challenge, e.g. a Basic realm).
   */
  public AuthorizationHandler(@Nullable AuthBackend<?> fallback) {
    this(fallback == null ? null : (UnauthorizedHandler) fallback::onUnauthorized);
  }

  public AuthorizationHandler(@Nullable UnauthorizedHandler fallback) {
    this.fallback = fallback;
  }

  @Override
  public void handle(RoutingContext rc) {
    UnauthorizedException unauthorized = ExceptionUtils.throwableOfType(rc.failure(), UnauthorizedException.class);
    if (unauthorized == null) {
      rc.next();
      return;
    }

    if (rc.response().ended()) {
      log.warn("Unauthorized signal after the response was already sent: {}", unauthorized.getMessage());
      return;
    }

    reply(rc, unauthorized).send(rc);
  }

  Reply reply(RoutingContext rc, UnauthorizedException unauthorized) {
    if (unauthorized.reply() != null) {
      return unauthorized.reply();
    }

    AuthBackend<?> backend = AuthContext.backend(rc);
    if (backend != null) {
      log.warn("Unauthorized ({}) for {} authenticated with {}", unauthorized.getMessage(), rc.request().path(),
          backend.name());
      return backend.onUnauthorized(rc, unauthorized.metadata());
    }

    log.warn("Unauthorized ({}) for {}", unauthorized.getMessage(), rc.request().path());
    if (fallback != null) {
      return fallback.handle(rc, unauthorized.metadata());
    }
    return Reply.forbidden();
  }
}
