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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Whole-path regular expression match, with named groups as parameters.
 */
class RegexPathMatcher implements PathMatcher {
  private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");
  private static final Pattern TEMPLATE_PARAM = Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");
  private final Pattern pattern;
  private final List<String> groupNames;

  RegexPathMatcher(String regex) {
    checkNotNull(regex, "A pattern is required");
    this.pattern = Pattern.compile(regex);

    // Candidates from the source text may be escaped literals, so keep only
    // names the compiled pattern actually defines
    Matcher empty = Pattern.compile("(?:" + regex + ")?").matcher("");
    empty.matches();
    List<String> names = new ArrayList<>();
    Matcher m = GROUP_NAME.matcher(regex);
    while (m.find()) {
      if (definesGroup(empty, m.group(1))) {
        names.add(m.group(1));
      }
    }
    this.groupNames = Collections.unmodifiableList(names);
  }

  private static boolean definesGroup(Matcher matched, String name) {
    try {
      matched.group(name);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  static RegexPathMatcher fromTemplate(String template) {
    checkNotNull(template, "A template is required");
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == ':' && (i == 0 || template.charAt(i - 1) == '/')) {
        int end = i + 1;
        while (end < template.length() && template.charAt(end) != '/') {
          end++;
        }
        String name = template.substring(i + 1, end);
        checkArgument(TEMPLATE_PARAM.matcher(name).matches(), "Invalid parameter name '" + name
            + "' in template: " + template);
        flush(literal, regex);
        regex.append("(?<").append(name).append(">[^/]+)");
        i = end;
      } else if (c == '*') {
        flush(literal, regex);
        regex.append(".*");
        i++;
      } else {
        literal.append(c);
        i++;
      }
    }
    flush(literal, regex);
    return new RegexPathMatcher(regex.toString());
  }

  private static void flush(StringBuilder literal, StringBuilder regex) {
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
      literal.setLength(0);
    }
  }

  @Override
  public Map<String, String> match(String path) {
    if (path == null) {
      return null;
    }
    Matcher m = pattern.matcher(path);
    if (!m.matches()) {
      return null;
    }
    if (groupNames.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, String> params = new HashMap<>();
    for (String name : groupNames) {
      String value = m.group(name);
      if (value != null) {
        params.put(name, value);
      }
    }
    return Collections.unmodifiableMap(params);
  }

  @Override
  public String toString() {
    return pattern.pattern();
  }
}
