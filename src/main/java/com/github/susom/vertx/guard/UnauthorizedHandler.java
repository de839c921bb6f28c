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

/**
 * Produce the response for a request that was signalled as unauthorized.
 * Configure one on a backend to replace its default 401/403 replies.
 */
@FunctionalInterface
public interface UnauthorizedHandler {
  /**
   * @param rc the request being rejected
   * @param metadata details from the {@link UnauthorizedException} (may be empty, never null)
   */
  Reply handle(RoutingContext rc, JsonObject metadata);
}
