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
import javax.annotation.Nonnull;

/**
 * Checks a self-contained token and returns the claims it carries.
 */
@FunctionalInterface
public interface TokenVerifier {
  /**
   * @return the verified claims (never null)
   * @throws TokenVerificationException if the token cannot be trusted
   */
  @Nonnull
  JsonObject verify(@Nonnull String token) throws TokenVerificationException;
}
