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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Represent a user that has been properly authenticated. Identity functions
 * may return any non-null value as the identity, but returning one of these
 * lets the built-in {@link RuleHandler#authority(String)} check work.
 *
 * @author garricko
 */
public class AuthenticatedUser {
  private final String authenticatedAs;
  private final String actingAs;
  private final String fullDisplayName;
  private final Set<String> authority;

  public AuthenticatedUser(String authenticatedAs, String actingAs, String fullDisplayName, Set<String> authority) {
    if (authenticatedAs == null) {
      throw new IllegalArgumentException("authenticatedAs is required");
    }
    this.authenticatedAs = authenticatedAs;
    this.actingAs = actingAs == null ? authenticatedAs : actingAs;
    this.fullDisplayName = fullDisplayName == null ? this.actingAs : fullDisplayName;
    this.authority = authority == null ? Collections.emptySet()
        : Collections.unmodifiableSet(new HashSet<>(authority));
  }

  /**
   * Build a user from token claims: "sub", optional "forsub", "name", and an
   * "authority" array.
   */
  @Nonnull
  public static AuthenticatedUser fromClaims(@Nonnull JsonObject claims) {
    Set<String> authority = new HashSet<>();
    JsonArray authorityArray = claims.getJsonArray("authority");
    if (authorityArray != null) {
      for (int i = 0; i < authorityArray.size(); i++) {
        authority.add(authorityArray.getString(i));
      }
    }
    return new AuthenticatedUser(claims.getString("sub"), claims.getString("forsub"), claims.getString("name"),
        authority);
  }

  @Nullable
  public static AuthenticatedUser from(@Nonnull RoutingContext rc) {
    Object identity = AuthContext.identity(rc);
    if (identity instanceof AuthenticatedUser) {
      return (AuthenticatedUser) identity;
    }
    return null;
  }

  @Nonnull
  public static AuthenticatedUser required(@Nonnull RoutingContext rc) {
    AuthenticatedUser user = from(rc);
    if (user == null) {
      throw new UnauthorizedException("No authenticated user");
    }
    return user;
  }

  public AuthenticatedUser store(@Nonnull RoutingContext rc) {
    AuthContext.store(rc, this, null);
    return this;
  }

  public boolean isAuthorized(String authority) {
    return this.authority.contains(authority);
  }

  public JsonObject principal() {
    return new JsonObject()
        .put("sub", authenticatedAs)
        .put("forsub", actingAs)
        .put("name", fullDisplayName)
        .put("authority", authority.stream().sorted().collect(Collectors.toList()));
  }

  public String getAuthenticatedAs() {
    return authenticatedAs;
  }

  public String getActingAs() {
    return actingAs;
  }

  public String getFullDisplayName() {
    return fullDisplayName;
  }

  public Set<String> getAuthority() {
    return authority;
  }

  @Override
  public String toString() {
    return "AuthenticatedUser{" + authenticatedAs + "}";
  }
}
