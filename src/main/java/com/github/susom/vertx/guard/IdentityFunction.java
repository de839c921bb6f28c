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
import io.vertx.core.Vertx;
import io.vertx.ext.web.RoutingContext;
import java.util.function.BiFunction;
import javax.annotation.Nonnull;

/**
 * Application supplied lookup that turns credentials into an identity. This
 * is where passwords get checked, opaque tokens get looked up, and so on.
 *
 * <p>Return a future completed with null (not a failed future) when the
 * credentials are simply not valid. Fail the future only for infrastructure
 * problems; those are not recovered here and fail the request.</p>
 *
 * @param <A> credential type produced by the backend's parse step
 */
@FunctionalInterface
public interface IdentityFunction<A> {
  @Nonnull
  Future<Object> identify(@Nonnull RoutingContext rc, @Nonnull A authData);

  /**
   * Adapt a lookup that completes immediately (in memory, cached, etc.).
   * Do not use this for anything that blocks.
   */
  static <A> IdentityFunction<A> of(BiFunction<RoutingContext, A, Object> lookup) {
    return (rc, authData) -> Future.succeededFuture(lookup.apply(rc, authData));
  }

  /**
   * Adapt a blocking lookup (JDBC, LDAP, ...) so it runs on a worker thread.
   */
  static <A> IdentityFunction<A> blocking(Vertx vertx, BiFunction<RoutingContext, A, Object> lookup) {
    return (rc, authData) -> VertxUtil.executeBlocking(vertx, () -> lookup.apply(rc, authData));
  }
}
