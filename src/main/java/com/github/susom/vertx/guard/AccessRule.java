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

import io.vertx.core.http.HttpMethod;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One entry in an {@link AccessRules} list: which requests it covers (path,
 * and optionally method), the handler deciding whether they may proceed, and
 * optionally how to respond when they may not.
 *
 * @author garricko
 */
public final class AccessRule {
  private final PathMatcher matcher;
  private final Set<HttpMethod> methods;
  private final RuleHandler handler;
  private final ErrorHandler onError;
  private final String redirect;
  private final String description;

  private AccessRule(Builder builder) {
    this.matcher = builder.matcher;
    this.methods = Collections.unmodifiableSet(new HashSet<>(builder.methods));
    this.handler = builder.handler;
    this.onError = builder.onError;
    this.redirect = builder.redirect;
    this.description = builder.description;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return null if this rule does not cover the request, otherwise the
   *         parameters captured from the path
   */
  @Nullable
  public Map<String, String> match(@Nonnull HttpMethod method, @Nonnull String path) {
    if (!methods.isEmpty() && !methods.contains(method)) {
      return null;
    }
    return matcher.match(path);
  }

  @Nonnull
  public RuleHandler handler() {
    return handler;
  }

  @Nullable
  public ErrorHandler onError() {
    return onError;
  }

  @Nullable
  public String redirect() {
    return redirect;
  }

  /**
   * Methods this rule is limited to (empty means all methods).
   */
  @Nonnull
  public Set<HttpMethod> methods() {
    return methods;
  }

  @Override
  public String toString() {
    return description;
  }

  public static class Builder {
    private PathMatcher matcher;
    private final Set<HttpMethod> methods = new HashSet<>();
    private RuleHandler handler;
    private ErrorHandler onError;
    private String redirect;
    private String description;

    /**
     * Regular expression matched against the whole normalized path.
     */
    public Builder pattern(String regex) {
      description = regex;
      return matcher(PathMatcher.regex(regex));
    }

    /**
     * Any of several regular expressions.
     */
    public Builder patterns(String... regexes) {
      description = Arrays.toString(regexes);
      return matcher(PathMatcher.anyOf(regexes));
    }

    /**
     * Path template like {@code /users/:id}.
     */
    public Builder uri(String template) {
      description = template;
      return matcher(PathMatcher.template(template));
    }

    public Builder matcher(PathMatcher matcher) {
      this.matcher = matcher;
      return this;
    }

    public Builder method(HttpMethod... methods) {
      this.methods.addAll(Arrays.asList(methods));
      return this;
    }

    public Builder methods(Collection<HttpMethod> methods) {
      this.methods.addAll(methods);
      return this;
    }

    public Builder handler(RuleHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Shortcut for {@code handler(RuleHandler.of(predicate))}.
     */
    public Builder predicate(RulePredicate predicate) {
      return handler(RuleHandler.of(predicate));
    }

    public Builder onError(ErrorHandler onError) {
      this.onError = onError;
      return this;
    }

    /**
     * Redirect denied requests here instead of calling an error handler.
     */
    public Builder redirect(String location) {
      this.redirect = location;
      return this;
    }

    public AccessRule build() {
      checkNotNull(matcher, "An access rule needs a pattern, uri, or matcher");
      checkNotNull(handler, "An access rule needs a handler");
      checkArgument(redirect == null || !redirect.isEmpty(), "The redirect location may not be empty");
      for (HttpMethod method : methods) {
        checkNotNull(method, "Methods may not be null");
      }
      if (description == null) {
        description = String.valueOf(matcher);
      }
      if (!methods.isEmpty()) {
        description = methods + " " + description;
      }
      return new AccessRule(this);
    }
  }
}
