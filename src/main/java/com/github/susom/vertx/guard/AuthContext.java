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

import io.vertx.ext.web.RoutingContext;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.MDC;

/**
 * Access to the authentication state stored in the routing context.
 *
 * @author garricko
 */
public final class AuthContext {
  /**
   * Context key holding the identity of the authenticated request.
   */
  public static final String IDENTITY = "identity";

  /**
   * Context key holding the {@link AuthBackend} that authenticated the request.
   */
  public static final String BACKEND = "authBackend";

  private AuthContext() {
  }

  /**
   * True if an identity has been attached to this request. Values that
   * represent "nothing" (null, {@code false}, an empty {@link Optional})
   * do not count.
   */
  public static boolean isAuthenticated(@Nonnull RoutingContext rc) {
    return identity(rc) != null;
  }

  @Nullable
  public static Object identity(@Nonnull RoutingContext rc) {
    Object identity = rc.get(IDENTITY);
    return present(identity) ? identity : null;
  }

  @Nullable
  public static AuthBackend<?> backend(@Nonnull RoutingContext rc) {
    Object backend = rc.get(BACKEND);
    if (backend instanceof AuthBackend) {
      return (AuthBackend<?>) backend;
    }
    return null;
  }

  /**
   * Attach an identity (and the backend that produced it) to the request.
   * If the identity is an {@link AuthenticatedUser} the logging context
   * gets its "userId".
   */
  public static void store(@Nonnull RoutingContext rc, @Nonnull Object identity, @Nullable AuthBackend<?> backend) {
    if (!present(identity)) {
      throw new IllegalArgumentException("Identity must not be null, false, or empty");
    }
    rc.put(IDENTITY, identity);
    if (backend != null) {
      rc.put(BACKEND, backend);
    }
    logAs(identity);
  }

  /**
   * Point the logging context "userId" at the identity, or clear it if the
   * identity is not an {@link AuthenticatedUser}.
   */
  static void logAs(@Nullable Object identity) {
    if (identity instanceof AuthenticatedUser) {
      MDC.put("userId", ((AuthenticatedUser) identity).getAuthenticatedAs());
    } else {
      MDC.remove("userId");
    }
  }

  static boolean present(@Nullable Object value) {
    if (value == null || Boolean.FALSE.equals(value)) {
      return false;
    }
    if (value instanceof Optional) {
      return ((Optional<?>) value).isPresent();
    }
    return true;
  }
}
