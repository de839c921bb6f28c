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

import com.google.common.collect.ImmutableList;
import io.vertx.ext.web.RoutingContext;
import java.util.Arrays;
import java.util.List;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decision procedure attached to an access rule. Leaves wrap a
 * {@link RulePredicate}; {@link #and}, {@link #or} and {@link #not} combine
 * other handlers into trees of any depth.
 *
 * @author garricko
 */
@FunctionalInterface
public interface RuleHandler {
  Decision evaluate(RoutingContext rc);

  static RuleHandler of(RulePredicate predicate) {
    checkNotNull(predicate, "A predicate is required");
    return rc -> Decision.normalize(predicate.test(rc));
  }

  static RuleHandler and(RuleHandler... handlers) {
    return and(Arrays.asList(handlers));
  }

  /**
   * Evaluate left to right and stop at the first failure, which is returned.
   * Succeeds if every handler succeeds (including when there are none).
   */
  static RuleHandler and(List<? extends RuleHandler> handlers) {
    List<RuleHandler> all = ImmutableList.copyOf(handlers);
    return rc -> {
      for (RuleHandler handler : all) {
        Decision decision = Decision.normalize(handler.evaluate(rc));
        if (!decision.isSuccess()) {
          return decision;
        }
      }
      return Decision.success();
    };
  }

  static RuleHandler or(RuleHandler... handlers) {
    return or(Arrays.asList(handlers));
  }

  /**
   * Evaluate left to right and stop at the first success. If everything
   * fails, the failure from the last handler is returned.
   */
  static RuleHandler or(List<? extends RuleHandler> handlers) {
    List<RuleHandler> all = ImmutableList.copyOf(handlers);
    return rc -> {
      Decision last = Decision.failure();
      for (RuleHandler handler : all) {
        Decision decision = Decision.normalize(handler.evaluate(rc));
        if (decision.isSuccess()) {
          return decision;
        }
        last = decision;
      }
      return last;
    };
  }

  /**
   * Succeed when the handler fails and vice versa. The failure produced
   * here carries no payload.
   */
  static RuleHandler not(RuleHandler handler) {
    checkNotNull(handler, "A handler is required");
    return rc -> Decision.normalize(handler.evaluate(rc)).isSuccess() ? Decision.failure() : Decision.success();
  }

  /**
   * Succeed if any backend attached an identity to the request.
   */
  static RuleHandler authenticated() {
    return rc -> AuthContext.isAuthenticated(rc) ? Decision.success() : Decision.failure("Authentication required");
  }

  /**
   * Succeed if the identity is an {@link AuthenticatedUser} that has been
   * granted the authority.
   */
  static RuleHandler authority(String authority) {
    checkNotNull(authority, "An authority is required");
    return rc -> {
      AuthenticatedUser user = AuthenticatedUser.from(rc);
      if (user == null) {
        return Decision.failure("Authentication required");
      }
      if (user.isAuthorized(authority)) {
        return Decision.success();
      }
      LoggerFactory.getLogger(RuleHandler.class).warn("RequiredAuthorityMissing=\"" + authority + "\" User="
          + user.principal().encode());
      return Decision.failure("Insufficient authority");
    };
  }
}
