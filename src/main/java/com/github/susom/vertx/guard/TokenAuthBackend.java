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
 * Authenticate with an opaque token sent as {@code Authorization: Token abc123}.
 * Both the header and the scheme word can be changed (e.g. "Bearer"). The
 * identity function looks the token up.
 *
 * @author garricko
 */
public class TokenAuthBackend extends AbstractAuthBackend<String> {
  public static final String DEFAULT_HEADER = "Authorization";
  public static final String DEFAULT_SCHEME = "Token";
  private final String header;
  private final String scheme;
  private final IdentityFunction<String> identityFunction;

  private TokenAuthBackend(Builder builder) {
    super(builder.unauthorizedHandler);
    this.header = builder.header;
    this.scheme = builder.scheme;
    this.identityFunction = builder.identityFunction;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Pull the token out of a header value of the form "scheme token". The
   * scheme comparison ignores case.
   *
   * @return the token, or null if the value is missing, has a different
   *         scheme, or the token part is empty
   */
  @Nullable
  public static String parseToken(@Nullable String headerValue, @Nonnull String scheme) {
    if (headerValue == null || headerValue.length() <= scheme.length()
        || !headerValue.regionMatches(true, 0, scheme, 0, scheme.length())
        || headerValue.charAt(scheme.length()) != ' ') {
      return null;
    }
    String token = headerValue.substring(scheme.length() + 1).trim();
    return token.isEmpty() ? null : token;
  }

  @Nonnull
  @Override
  public String name() {
    return "token";
  }

  @Nullable
  @Override
  public String parse(@Nonnull RoutingContext rc) {
    return parseToken(rc.request().getHeader(header), scheme);
  }

  @Nonnull
  @Override
  public Future<Object> authenticate(@Nonnull RoutingContext rc, @Nonnull String data) {
    return identityFunction.identify(rc, data);
  }

  public static class Builder {
    private String header = DEFAULT_HEADER;
    private String scheme = DEFAULT_SCHEME;
    private IdentityFunction<String> identityFunction;
    private UnauthorizedHandler unauthorizedHandler;

    public Builder header(String header) {
      this.header = header;
      return this;
    }

    public Builder scheme(String scheme) {
      this.scheme = scheme;
      return this;
    }

    public Builder identityFunction(IdentityFunction<String> identityFunction) {
      this.identityFunction = identityFunction;
      return this;
    }

    public Builder unauthorizedHandler(UnauthorizedHandler unauthorizedHandler) {
      this.unauthorizedHandler = unauthorizedHandler;
      return this;
    }

    public TokenAuthBackend build() {
      checkNotNull(header, "A header name is required");
      checkNotNull(scheme, "A token scheme is required");
      checkArgument(!scheme.isEmpty() && scheme.indexOf(' ') < 0, "The token scheme must be a single word");
      checkNotNull(identityFunction, "An identity function is required for token authentication");
      return new TokenAuthBackend(this);
    }
  }
}
