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

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Username and password decoded from an HTTP Basic Authorization header.
 */
public final class BasicCredentials {
  private static final String SCHEME = "Basic ";
  private final String username;
  private final String password;

  public BasicCredentials(@Nonnull String username, @Nonnull String password) {
    this.username = username;
    this.password = password;
  }

  /**
   * Decode the value of an Authorization header. The scheme is matched
   * without regard to case, and the decoded value is split on the first
   * colon only, so passwords may contain colons.
   *
   * @return the credentials, or null if the header is missing, uses another
   *         scheme, is not valid base64, or has no colon
   */
  @Nullable
  public static BasicCredentials parse(@Nullable String authorization) {
    if (authorization == null || !authorization.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
      return null;
    }

    String encoded = authorization.substring(SCHEME.length()).trim();
    if (encoded.isEmpty()) {
      return null;
    }

    String decoded;
    try {
      decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return null;
    }

    int colon = decoded.indexOf(':');
    if (colon < 0) {
      return null;
    }
    return new BasicCredentials(decoded.substring(0, colon), decoded.substring(colon + 1));
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BasicCredentials)) {
      return false;
    }
    BasicCredentials that = (BasicCredentials) o;
    return username.equals(that.username) && password.equals(that.password);
  }

  @Override
  public int hashCode() {
    return Objects.hash(username, password);
  }

  @Override
  public String toString() {
    // Never log the password
    return "BasicCredentials{" + username + "}";
  }
}
