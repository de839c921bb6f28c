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

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Guard a single handler (or route) with one {@link RuleHandler}, without any
 * path matching. Denials are resolved like an access rule's: redirect, else
 * error handler, else the failure's reply, else 403.
 *
 * <pre>
 *   router.get("/reports").handler(Restrict.create(RuleHandler.authority("reports:read"), this::reports));
 * </pre>
 *
 * @author garricko
 */
public class Restrict implements Handler<RoutingContext> {
  private static final Logger log = LoggerFactory.getLogger(Restrict.class);
  private final RuleHandler handler;
  private final ErrorHandler onError;
  private final String redirect;
  private final Handler<RoutingContext> wrapped;

  private Restrict(Builder builder) {
    this.handler = builder.handler;
    this.onError = builder.onError;
    this.redirect = builder.redirect;
    this.wrapped = builder.wrapped;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Continue the route with {@code next()} when permitted.
   */
  public static Restrict create(RuleHandler handler) {
    return builder().handler(handler).build();
  }

  public static Restrict create(RuleHandler handler, Handler<RoutingContext> wrapped) {
    return builder().handler(handler).wrap(wrapped).build();
  }

  @Override
  public void handle(RoutingContext rc) {
    Decision decision = Decision.normalize(handler.evaluate(rc));
    if (decision.isSuccess()) {
      AccessRules.proceed(rc, wrapped);
    } else {
      log.warn("Restricted access denied for {} {}: {}", rc.request().method(), rc.request().path(), decision);
      AccessRules.deny(rc, (Decision.Failure) decision, redirect, onError, null);
    }
  }

  public static class Builder {
    private RuleHandler handler;
    private ErrorHandler onError;
    private String redirect;
    private Handler<RoutingContext> wrapped;

    public Builder handler(RuleHandler handler) {
      this.handler = handler;
      return this;
    }

    public Builder onError(ErrorHandler onError) {
      this.onError = onError;
      return this;
    }

    public Builder redirect(String location) {
      this.redirect = location;
      return this;
    }

    public Builder wrap(Handler<RoutingContext> wrapped) {
      this.wrapped = wrapped;
      return this;
    }

    @Nonnull
    public Restrict build() {
      checkNotNull(handler, "A rule handler is required");
      checkArgument(redirect == null || !redirect.isEmpty(), "The redirect location may not be empty");
      return new Restrict(this);
    }
  }
}
