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
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Authenticate using the HTTP Basic scheme. The identity function is
 * responsible for checking the password. Anonymous requests that end up
 * unauthorized get a 401 with a {@code WWW-Authenticate: Basic realm="..."}
 * challenge.
 *
 * @author garricko
 */
public class BasicAuthBackend extends AbstractAuthBackend<BasicCredentials> {
  private final String realm;
  private final IdentityFunction<BasicCredentials> identityFunction;

  private BasicAuthBackend(Builder builder) {
    super(builder.unauthorizedHandler);
    this.realm = builder.realm;
    this.identityFunction = builder.identityFunction;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Nonnull
  @Override
  public String name() {
    return "basic";
  }

  @Nullable
  @Override
  public BasicCredentials parse(@Nonnull RoutingContext rc) {
    return BasicCredentials.parse(rc.request().getHeader("Authorization"));
  }

  @Nonnull
  @Override
  public Future<Object> authenticate(@Nonnull RoutingContext rc, @Nonnull BasicCredentials data) {
    return identityFunction.identify(rc, data);
  }

  @Override
  protected String challenge() {
    return "Basic realm=\"" + realm + "\"";
  }

  public String realm() {
    return realm;
  }

  public static class Builder {
    private String realm;
    private IdentityFunction<BasicCredentials> identityFunction;
    private UnauthorizedHandler unauthorizedHandler;

    public Builder realm(String realm) {
      this.realm = realm;
      return this;
    }

    public Builder identityFunction(IdentityFunction<BasicCredentials> identityFunction) {
      this.identityFunction = identityFunction;
      return this;
    }

    public Builder unauthorizedHandler(UnauthorizedHandler unauthorizedHandler) {
      this.unauthorizedHandler = unauthorizedHandler;
      return this;
    }

    public BasicAuthBackend build() {
      checkNotNull(realm, "A realm is required for Basic authentication");
      checkArgument(realm.indexOf('"') < 0, "The realm may not contain a double quote");
      checkNotNull(identityFunction, "An identity function is required for Basic authentication");
      return new BasicAuthBackend(this);
    }
  }
}
