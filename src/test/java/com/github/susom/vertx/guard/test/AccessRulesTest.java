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
package com.github.susom.vertx.guard.test;

import com.google.common.collect.ImmutableMap;
import com.github.susom.vertx.guard.AccessRule;
import com.github.susom.vertx.guard.AccessRules;
import com.github.susom.vertx.guard.AuthenticatedUser;
import com.github.susom.vertx.guard.AuthenticationHandler;
import com.github.susom.vertx.guard.AuthorizationHandler;
import com.github.susom.vertx.guard.Decision;
import com.github.susom.vertx.guard.IdentityFunction;
import com.github.susom.vertx.guard.Policy;
import com.github.susom.vertx.guard.Reply;
import com.github.susom.vertx.guard.Restrict;
import com.github.susom.vertx.guard.RuleHandler;
import com.github.susom.vertx.guard.TokenAuthBackend;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

import static com.github.susom.vertx.guard.test.HttpHarness.expect;

/**
 * Exercise the access rules and restrict handlers behind a real HTTP server.
 * Requests identify themselves with "Authorization: Token alice" (an admin)
 * or "Token bob" (no authority).
 */
@RunWith(VertxUnitRunner.class)
public class AccessRulesTest {
  private static final Map<String, AuthenticatedUser> USERS = ImmutableMap.of(
      "alice", new AuthenticatedUser("alice", "alice", "Alice", Collections.singleton("admin")),
      "bob", new AuthenticatedUser("bob", "bob", "Bob", Collections.<String>emptySet())
  );
  private static final String[] ALICE = { "Authorization", "Token alice" };
  private static final String[] BOB = { "Authorization", "Token bob" };
  private Vertx vertx;

  @Before
  public void setUp(TestContext context) {
    vertx = Vertx.vertx();
  }

  @After
  public void tearDown(TestContext context) {
    vertx.close(context.asyncAssertSuccess());
  }

  private Router router(Handler<RoutingContext> guard) {
    TokenAuthBackend tokens = TokenAuthBackend.builder()
        .identityFunction(IdentityFunction.of((rc, token) -> USERS.get(token)))
        .build();

    // Authentication runs ahead of the order(-1) routes some tests add
    Router router = Router.router(vertx);
    router.route().order(-20).handler(AuthenticationHandler.create(tokens));
    router.route().failureHandler(new AuthorizationHandler());
    router.route().handler(guard);
    router.route().handler(rc -> rc.response().end("reached " + rc.normalizedPath()));
    return router;
  }

  @Test
  public void adminAndAuthenticatedRules(TestContext context) {
    AccessRules rules = AccessRules.builder()
        .rule(AccessRule.builder().pattern("^/admin/.*").handler(RuleHandler.authority("admin")).build())
        .rule(AccessRule.builder().pattern("^/.*").handler(RuleHandler.authenticated()).build())
        .policy(Policy.ALLOW)
        .build();

    HttpHarness.start(vertx, router(rules)).compose(http ->
        expect(context, http.get("/admin/x"), 403, "403 Forbidden")
            .compose(r -> expect(context, http.get("/public"), 403, "403 Forbidden"))
            .compose(r -> expect(context, http.get("/public", BOB), 200, "reached /public"))
            .compose(r -> expect(context, http.get("/admin/x", BOB), 403, "403 Forbidden"))
            .compose(r -> expect(context, http.get("/admin/x", ALICE), 200, "reached /admin/x"))
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void emptyRulesWithAllowPolicy(TestContext context) {
    AccessRules rules = AccessRules.builder().policy(Policy.ALLOW).build();

    HttpHarness.start(vertx, router(rules)).compose(http ->
        expect(context, http.get("/anything"), 200, "reached /anything")
            .compose(r -> expect(context, http.request(HttpMethod.DELETE, "/a/b"), 200, "reached /a/b"))
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void emptyRulesWithRejectPolicy(TestContext context) {
    AccessRules rules = AccessRules.builder().policy(Policy.REJECT).build();
    AccessRules rulesWithHandler = AccessRules.builder().policy(Policy.REJECT)
        .onError((rc, failure) -> Reply.status(404, "Nothing here")).build();

    Router router = router(rules);
    router.get("/custom").order(-1).handler(rulesWithHandler);

    HttpHarness.start(vertx, router).compose(http ->
        expect(context, http.get("/anything", ALICE), 403, "403 Forbidden")
            .compose(r -> expect(context, http.get("/custom", ALICE), 404, "Nothing here"))
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void firstMatchingRuleDecides(TestContext context) {
    AtomicInteger secondEvaluated = new AtomicInteger();
    AccessRules rules = AccessRules.builder()
        .rule(AccessRule.builder().pattern("^/open/.*").predicate(rc -> true).build())
        .rule(AccessRule.builder().pattern("^/.*").predicate(rc -> {
          secondEvaluated.incrementAndGet();
          return false;
        }).build())
        .policy(Policy.REJECT)
        .build();

    HttpHarness.start(vertx, router(rules)).compose(http ->
        expect(context, http.get("/open/door"), 200, "reached /open/door")
            .map(r -> {
              context.assertEquals(0, secondEvaluated.get());
              return r;
            })
            .compose(r -> expect(context, http.get("/closed"), 403, null))
            .map(r -> {
              context.assertEquals(1, secondEvaluated.get());
              return r;
            })
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void denialResolution(TestContext context) {
    AccessRules rules = AccessRules.builder()
        .rule(AccessRule.builder().pattern("^/redirect$").predicate(rc -> Decision.failure("ignored"))
            .onError((rc, failure) -> Reply.status(500)).redirect("/login").build())
        .rule(AccessRule.builder().pattern("^/rule-handler$").predicate(rc -> Decision.failure("rule"))
            .onError((rc, failure) -> Reply.status(401, "rule says " + failure.message().orElse(""))).build())
        .rule(AccessRule.builder().pattern("^/global-handler$").predicate(rc -> Decision.failure("global"))
            .build())
        .policy(Policy.ALLOW)
        .onError((rc, failure) -> Reply.status(400, "global says " + failure.message().orElse("")))
        .build();
    AccessRules noHandlers = AccessRules.builder()
        .rule(AccessRule.builder().pattern("^/teapot$")
            .predicate(rc -> Decision.failure(Reply.status(418, "I'm a teapot"))).build())
        .policy(Policy.ALLOW)
        .build();

    Router router = router(rules);
    router.get("/teapot").order(-1).handler(noHandlers);

    HttpHarness.start(vertx, router).compose(http ->
        expect(context, http.get("/redirect"), 302, null)
            .map(r -> {
              context.assertEquals("/login", r.headers.get("Location"));
              return r;
            })
            .compose(r -> expect(context, http.get("/rule-handler"), 401, "rule says rule"))
            .compose(r -> expect(context, http.get("/global-handler"), 400, "global says global"))
            .compose(r -> expect(context, http.get("/teapot"), 418, "I'm a teapot"))
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void methodFilter(TestContext context) {
    AccessRules rules = AccessRules.builder()
        .rule(AccessRule.builder().pattern("^/data$").method(HttpMethod.POST, HttpMethod.PUT)
            .handler(RuleHandler.authority("admin")).build())
        .policy(Policy.ALLOW)
        .build();

    HttpHarness.start(vertx, router(rules)).compose(http ->
        expect(context, http.get("/data"), 200, "reached /data")
            .compose(r -> expect(context, http.request(HttpMethod.POST, "/data", BOB), 403, null))
            .compose(r -> expect(context, http.request(HttpMethod.PUT, "/data", ALICE), 200, "reached /data"))
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void matchParamsReachPredicates(TestContext context) {
    AccessRules rules = AccessRules.builder()
        .rule(AccessRule.builder().uri("/users/:userId/*").predicate(rc -> {
          Map<String, String> params = rc.get(AccessRules.MATCH_PARAMS);
          AuthenticatedUser user = AuthenticatedUser.from(rc);
          return user != null && user.getAuthenticatedAs().equals(params.get("userId"));
        }).build())
        .rule(AccessRule.builder().pattern("^/files/(?<name>[a-z]+)\\.txt$")
            .predicate(rc -> "public".equals(rc.<Map<String, String>>get(AccessRules.MATCH_PARAMS).get("name")))
            .build())
        .policy(Policy.ALLOW)
        .build();

    HttpHarness.start(vertx, router(rules)).compose(http ->
        expect(context, http.get("/users/alice/profile", ALICE), 200, "reached /users/alice/profile")
            .compose(r -> expect(context, http.get("/users/alice/profile", BOB), 403, null))
            .compose(r -> expect(context, http.get("/files/public.txt"), 200, null))
            .compose(r -> expect(context, http.get("/files/secret.txt"), 403, null))
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void wrappedHandler(TestContext context) {
    AccessRules rules = AccessRules.builder()
        .rule(AccessRule.builder().pattern("^/private$").handler(RuleHandler.authenticated()).build())
        .policy(Policy.ALLOW)
        .wrap(rc -> rc.response().end("wrapped"))
        .build();

    HttpHarness.start(vertx, router(rules)).compose(http ->
        expect(context, http.get("/private", BOB), 200, "wrapped")
            .compose(r -> expect(context, http.get("/private"), 403, "403 Forbidden"))
    ).onComplete(context.asyncAssertSuccess());
  }

  @Test
  public void restrict(TestContext context) {
    Router router = router(rc -> rc.next());
    router.get("/login-first").order(-1).handler(Restrict.builder()
        .handler(RuleHandler.authenticated()).redirect("/login").build());
    router.get("/admin").order(-1).handler(Restrict.create(RuleHandler.authority("admin"),
        rc -> rc.response().end("admin page")));
    router.get("/either").order(-1).handler(Restrict.builder()
        .handler(RuleHandler.or(RuleHandler.authority("admin"), RuleHandler.of(rc -> false)))
        .onError((rc, failure) -> Reply.status(403, failure.message().orElse("no message")))
        .build());

    HttpHarness.start(vertx, router).compose(http ->
        expect(context, http.get("/login-first"), 302, null)
            .compose(r -> expect(context, http.get("/login-first", BOB), 200, "reached /login-first"))
            .compose(r -> expect(context, http.get("/admin", BOB), 403, "403 Forbidden"))
            .compose(r -> expect(context, http.get("/admin", ALICE), 200, "admin page"))
            .compose(r -> expect(context, http.get("/either", ALICE), 200, "reached /either"))
            .compose(r -> expect(context, http.get("/either", BOB), 403, "no message"))
    ).onComplete(context.asyncAssertSuccess());
  }
}
