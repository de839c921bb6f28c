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

import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outcome of evaluating a {@link RuleHandler}: either {@link Success} or a
 * {@link Failure} that may carry a message or a complete replacement reply.
 */
public abstract class Decision {
  private static final Success SUCCESS = new Success();
  private static final Failure EMPTY_FAILURE = new Failure(null, null);

  private Decision() {
  }

  @Nonnull
  public static Success success() {
    return SUCCESS;
  }

  /**
   * A failure carrying nothing for the error handler.
   */
  @Nonnull
  public static Failure failure() {
    return EMPTY_FAILURE;
  }

  @Nonnull
  public static Failure failure(@Nullable String message) {
    return message == null ? EMPTY_FAILURE : new Failure(message, null);
  }

  @Nonnull
  public static Failure failure(@Nullable Reply reply) {
    return reply == null ? EMPTY_FAILURE : new Failure(null, reply);
  }

  /**
   * Interpret whatever a rule predicate returned. A Decision is kept as is;
   * null, {@code false} and an empty {@link Optional} are a failure without a
   * payload; anything else (including {@code true} or an identity) is success.
   */
  @Nonnull
  public static Decision normalize(@Nullable Object value) {
    if (value instanceof Decision) {
      return (Decision) value;
    }
    return AuthContext.present(value) ? SUCCESS : EMPTY_FAILURE;
  }

  public abstract boolean isSuccess();

  public static final class Success extends Decision {
    private Success() {
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public String toString() {
      return "Success";
    }
  }

  public static final class Failure extends Decision {
    private final String message;
    private final Reply reply;

    private Failure(String message, Reply reply) {
      this.message = message;
      this.reply = reply;
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Nonnull
    public Optional<String> message() {
      return Optional.ofNullable(message);
    }

    @Nonnull
    public Optional<Reply> reply() {
      return Optional.ofNullable(reply);
    }

    /**
     * True if there is a message or reply for the error handler.
     */
    public boolean hasPayload() {
      return message != null || reply != null;
    }

    @Override
    public String toString() {
      if (reply != null) {
        return "Failure{" + reply + "}";
      }
      return message == null ? "Failure" : "Failure{" + message + "}";
    }
  }
}
