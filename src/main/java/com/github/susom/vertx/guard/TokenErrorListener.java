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

/**
 * Notified when a self-contained token was presented but failed verification.
 * The request still continues unauthenticated; this is only for observing
 * the failure (logging, metrics, marking the request).
 */
@FunctionalInterface
public interface TokenErrorListener {
  void tokenRejected(RoutingContext rc, TokenVerificationException error);
}
