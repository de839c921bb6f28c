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
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One mechanism for establishing who a request belongs to. Authentication
 * happens in two phases so a backend can cheaply decline requests that do not
 * carry its kind of credentials before doing any real work.
 *
 * <p>Implementations are built once at startup and shared by all event loops,
 * so they must not hold mutable state.</p>
 *
 * @param <A> the credential data extracted by {@link #parse(RoutingContext)}
 * @author garricko
 */
public interface AuthBackend<A> {
  /**
   * Short name used in log messages (e.g. "basic").
   */
  @Nonnull
  String name();

  /**
   * Extract this backend's credentials from the request.
   *
   * @return the credentials, or null if they are missing or malformed
   *         (this should never throw for bad client input)
   */
  @Nullable
  A parse(@Nonnull RoutingContext rc);

  /**
   * Turn parsed credentials into an identity.
   *
   * @return a future completed with the identity, or with null if the
   *         credentials were not accepted; the future fails only for
   *         infrastructure problems (database down, etc.)
   */
  @Nonnull
  Future<Object> authenticate(@Nonnull RoutingContext rc, @Nonnull A data);

  /**
   * Build the response for a request that has been signalled as unauthorized.
   */
  @Nonnull
  Reply onUnauthorized(@Nonnull RoutingContext rc, @Nonnull JsonObject metadata);
}
