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
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.RoutingContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Declarative authorization in front of a router (or a single handler). Rules
 * are tried in order and the first one covering the request decides; requests
 * no rule covers get the {@link Policy}.
 *
 * <p>When a rule denies a request, the response is chosen as follows: the
 * rule's redirect, else the rule's error handler, else the global error
 * handler, else the reply carried by the failure, else a plain 403.</p>
 *
 * <pre>
 *   router.route().handler(AuthenticationHandler.create(basic));
 *   router.route().handler(AccessRules.builder()
 *       .rule(AccessRule.builder().pattern("^/admin/.*").handler(RuleHandler.authority("admin")).build())
 *       .rule(AccessRule.builder().pattern("^/.*").handler(RuleHandler.authenticated()).build())
 *       .policy(Policy.ALLOW)
 *       .build());
 * </pre>
 *
 * @author garricko
 */
public class AccessRules implements Handler<RoutingContext> {
  private static final Logger log = LoggerFactory.getLogger(AccessRules.class);

  /**
   * Context key for the parameters captured by the matching rule's path pattern.
   */
  public static final String MATCH_PARAMS = "matchParams";

  private final List<AccessRule> rules;
  private final Policy policy;
  private final ErrorHandler onError;
  private final Handler<RoutingContext> wrapped;

  private AccessRules(Builder builder) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
    this.policy = builder.policy;
    this.onError = builder.onError;
    this.wrapped = builder.wrapped;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void handle(RoutingContext rc) {
    HttpMethod method = rc.request().method();
    String path = rc.normalizedPath();

    for (AccessRule rule : rules) {
      Map<String, String> params = rule.match(method, path);
      if (params != null) {
        log.trace("Access rule {} selected for {} {}", rule, method, path);
        rc.put(MATCH_PARAMS, params);
        Decision decision = Decision.normalize(rule.handler().evaluate(rc));
        if (decision.isSuccess()) {
          proceed(rc, wrapped);
        } else {
          log.warn("Access denied by rule {} for {} {}: {}", rule, method, path, decision);
          deny(rc, (Decision.Failure) decision, rule.redirect(), rule.onError(), onError);
        }
        return;
      }
    }

    if (policy == Policy.ALLOW) {
      proceed(rc, wrapped);
    } else {
      log.warn("Access denied for {} {}: no access rule matched", method, path);
      deny(rc, Decision.failure(), null, null, onError);
    }
  }

  public List<AccessRule> rules() {
    return rules;
  }

  public Policy policy() {
    return policy;
  }

  static void proceed(RoutingContext rc, @Nullable Handler<RoutingContext> wrapped) {
    if (wrapped == null) {
      rc.next();
    } else {
      wrapped.handle(rc);
    }
  }

  static void deny(RoutingContext rc, Decision.Failure failure, @Nullable String redirect,
                   @Nullable ErrorHandler ruleOnError, @Nullable ErrorHandler globalOnError) {
    Reply reply;
    if (redirect != null) {
      reply = Reply.redirect(redirect);
    } else if (ruleOnError != null) {
      reply = ruleOnError.handle(rc, failure);
    } else if (globalOnError != null) {
      reply = globalOnError.handle(rc, failure);
    } else {
      reply = failure.reply().orElse(null);
    }

    if (reply == null) {
      reply = Reply.forbidden();
    }
    reply.send(rc);
  }

  public static class Builder {
    private final List<AccessRule> rules = new ArrayList<>();
    private Policy policy;
    private ErrorHandler onError;
    private Handler<RoutingContext> wrapped;

    public Builder rule(AccessRule rule) {
      rules.add(rule);
      return this;
    }

    public Builder rules(AccessRule... rules) {
      return rules(Arrays.asList(rules));
    }

    public Builder rules(List<AccessRule> rules) {
      this.rules.addAll(rules);
      return this;
    }

    /**
     * Required: what happens when no rule covers a request.
     */
    public Builder policy(Policy policy) {
      this.policy = policy;
      return this;
    }

    /**
     * Response for denials whose rule has no error handler or redirect, and
     * for requests rejected by the policy.
     */
    public Builder onError(ErrorHandler onError) {
      this.onError = onError;
      return this;
    }

    /**
     * Call this handler for permitted requests instead of continuing the
     * route with {@code next()}.
     */
    public Builder wrap(Handler<RoutingContext> wrapped) {
      this.wrapped = wrapped;
      return this;
    }

    @Nonnull
    public AccessRules build() {
      checkNotNull(policy, "A policy (ALLOW or REJECT) is required for access rules");
      for (AccessRule rule : rules) {
        checkNotNull(rule, "Access rules may not be null");
      }
      return new AccessRules(this);
    }
  }
}
