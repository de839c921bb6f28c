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

import com.github.susom.database.Metric;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Try each configured backend in order and attach the first identity found to
 * the routing context (see {@link AuthContext}). This handler never rejects a
 * request: if nobody authenticates it, it simply continues anonymously and
 * later handlers (access rules, {@link UnauthorizedException}) decide whether
 * that matters.
 *
 * <p>If an identity function fails (as opposed to returning no identity), the
 * request is failed with that cause.</p>
 *
 * @author garricko
 */
public class AuthenticationHandler implements Handler<RoutingContext> {
  private static final Logger log = LoggerFactory.getLogger(AuthenticationHandler.class);
  private final List<AuthBackend<?>> backends;

  public AuthenticationHandler(@Nonnull List<? extends AuthBackend<?>> backends) {
    checkNotNull(backends, "Backends are required");
    checkArgument(!backends.isEmpty(), "At least one authentication backend is required");
    for (AuthBackend<?> backend : backends) {
      checkNotNull(backend, "Backends may not be null");
    }
    this.backends = Collections.unmodifiableList(new ArrayList<>(backends));
  }

  public static AuthenticationHandler create(AuthBackend<?>... backends) {
    return new AuthenticationHandler(Arrays.asList(backends));
  }

  public List<AuthBackend<?>> backends() {
    return backends;
  }

  @Override
  public void handle(RoutingContext rc) {
    // The event loop thread still carries whatever the previous request set
    AuthContext.logAs(AuthContext.identity(rc));
    if (AuthContext.isAuthenticated(rc)) {
      // Something earlier in the chain already did this
      rc.next();
      return;
    }
    attempt(rc, 0, new Metric(log.isDebugEnabled()));
  }

  private void attempt(RoutingContext rc, int index, Metric metric) {
    if (index >= backends.size()) {
      if (log.isTraceEnabled()) {
        log.trace("No backend authenticated {} {}", rc.request().path(), metric.getMessage());
      }
      AuthContext.logAs(null);
      rc.next();
      return;
    }

    AuthBackend<?> backend = backends.get(index);
    Future<Object> result;
    try {
      result = tryBackend(backend, rc);
    } catch (RuntimeException e) {
      rc.fail(e);
      return;
    }

    result.onComplete(r -> {
      metric.checkpoint(backend.name());
      if (r.failed()) {
        log.debug("Authentication backend {} failed", backend.name(), r.cause());
        rc.fail(r.cause());
      } else if (AuthContext.present(r.result())) {
        AuthContext.store(rc, r.result(), backend);
        if (log.isDebugEnabled()) {
          log.debug("Authenticated with {} {}", backend.name(), metric.getMessage());
        }
        rc.next();
      } else {
        attempt(rc, index + 1, metric);
      }
    });
  }

  private <A> Future<Object> tryBackend(AuthBackend<A> backend, RoutingContext rc) {
    A data = backend.parse(rc);
    if (data == null) {
      return Future.succeededFuture();
    }
    return backend.authenticate(rc, data);
  }
}
