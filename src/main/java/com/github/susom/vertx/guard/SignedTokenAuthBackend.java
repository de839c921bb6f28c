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
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Authenticate with a self-contained (signed or encrypted) token carried the
 * same way as {@link TokenAuthBackend} tokens. No lookup is needed: the
 * {@link TokenVerifier} checks the token and the claims become the identity,
 * optionally mapped through a claims function (for example
 * {@link AuthenticatedUser#fromClaims(JsonObject)}).
 *
 * <p>A token that fails verification leaves the request unauthenticated.
 * The failure is reported to the {@link TokenErrorListener}, if any.</p>
 *
 * @author garricko
 */
public class SignedTokenAuthBackend extends AbstractAuthBackend<String> {
  private static final Logger log = LoggerFactory.getLogger(SignedTokenAuthBackend.class);
  private final String header;
  private final String scheme;
  private final TokenVerifier verifier;
  private final Function<JsonObject, Object> claimsToIdentity;
  private final TokenErrorListener errorListener;

  private SignedTokenAuthBackend(Builder builder) {
    super(builder.unauthorizedHandler);
    this.header = builder.header;
    this.scheme = builder.scheme;
    this.verifier = builder.verifier;
    this.claimsToIdentity = builder.claimsToIdentity;
    this.errorListener = builder.errorListener;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Nonnull
  @Override
  public String name() {
    return "signed-token";
  }

  @Nullable
  @Override
  public String parse(@Nonnull RoutingContext rc) {
    return TokenAuthBackend.parseToken(rc.request().getHeader(header), scheme);
  }

  @Nonnull
  @Override
  public Future<Object> authenticate(@Nonnull RoutingContext rc, @Nonnull String data) {
    Object identity;
    try {
      JsonObject claims = verifier.verify(data);
      try {
        identity = claimsToIdentity.apply(claims);
      } catch (RuntimeException e) {
        throw new TokenVerificationException("Token claims could not be mapped to an identity", e);
      }
    } catch (TokenVerificationException e) {
      rejected(rc, e);
      return Future.succeededFuture();
    }
    return Future.succeededFuture(identity);
  }

  private void rejected(RoutingContext rc, TokenVerificationException e) {
    if (errorListener == null) {
      log.debug("Rejected token: {}", e.getMessage());
    } else {
      errorListener.tokenRejected(rc, e);
    }
  }

  public static class Builder {
    private String header = TokenAuthBackend.DEFAULT_HEADER;
    private String scheme = TokenAuthBackend.DEFAULT_SCHEME;
    private TokenVerifier verifier;
    private Function<JsonObject, Object> claimsToIdentity = claims -> claims;
    private TokenErrorListener errorListener;
    private UnauthorizedHandler unauthorizedHandler;

    public Builder header(String header) {
      this.header = header;
      return this;
    }

    public Builder scheme(String scheme) {
      this.scheme = scheme;
      return this;
    }

    public Builder verifier(TokenVerifier verifier) {
      this.verifier = verifier;
      return this;
    }

    public Builder claimsToIdentity(Function<JsonObject, Object> claimsToIdentity) {
      this.claimsToIdentity = claimsToIdentity;
      return this;
    }

    public Builder onTokenError(TokenErrorListener errorListener) {
      this.errorListener = errorListener;
      return this;
    }

    public Builder unauthorizedHandler(UnauthorizedHandler unauthorizedHandler) {
      this.unauthorizedHandler = unauthorizedHandler;
      return this;
    }

    public SignedTokenAuthBackend build() {
      checkNotNull(header, "A header name is required");
      checkNotNull(scheme, "A token scheme is required");
      checkArgument(!scheme.isEmpty() && scheme.indexOf(' ') < 0, "The token scheme must be a single word");
      checkNotNull(verifier, "A token verifier is required");
      checkNotNull(claimsToIdentity, "A claims to identity function is required");
      return new SignedTokenAuthBackend(this);
    }
  }
}
