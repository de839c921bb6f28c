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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decide whether a request path is covered by an access rule, optionally
 * capturing named parameters from it.
 *
 * @author garricko
 */
@FunctionalInterface
public interface PathMatcher {
  /**
   * @return null if the path does not match, otherwise the named parameters
   *         captured from it (possibly empty)
   */
  @Nullable
  Map<String, String> match(String path);

  /**
   * Regular expression that must match the whole path. Named groups, as in
   * {@code ^/users/(?<id>[0-9]+)$}, are captured as parameters.
   */
  static PathMatcher regex(String regex) {
    return new RegexPathMatcher(regex);
  }

  /**
   * Path template such as {@code /users/:id/files/*}. A {@code :name}
   * segment matches one path segment and is captured; {@code *} matches
   * anything, including further slashes.
   */
  static PathMatcher template(String template) {
    return RegexPathMatcher.fromTemplate(template);
  }

  /**
   * Matches if any of the regular expressions match.
   */
  static PathMatcher anyOf(Collection<String> regexes) {
    checkNotNull(regexes, "Patterns are required");
    return anyOf(regexes.stream().map(PathMatcher::regex).toArray(PathMatcher[]::new));
  }

  /**
   * Matches with the first matcher that accepts the path.
   */
  static PathMatcher anyOf(PathMatcher... matchers) {
    List<PathMatcher> all = ImmutableList.copyOf(matchers);
    return path -> {
      for (PathMatcher matcher : all) {
        Map<String, String> params = matcher.match(path);
        if (params != null) {
          return params;
        }
      }
      return null;
    };
  }

  /**
   * Arbitrary test of the path. Captures nothing.
   */
  static PathMatcher predicate(Predicate<String> predicate) {
    checkNotNull(predicate, "A predicate is required");
    return path -> predicate.test(path) ? Collections.emptyMap() : null;
  }

  static PathMatcher any() {
    return path -> Collections.emptyMap();
  }

  /**
   * Convenience for building a set of regular expressions in one call.
   */
  static PathMatcher anyOf(String... regexes) {
    return anyOf(Arrays.stream(regexes).collect(Collectors.toList()));
  }
}
