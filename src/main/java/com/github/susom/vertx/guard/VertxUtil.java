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
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Helpers to keep the SLF4J MDC (e.g. "userId") attached to work that
 * hops between the event loop and worker threads.
 *
 * @author garricko
 */
public class VertxUtil {
  /**
   * Wrap a Handler in a way that will preserve the SLF4J MDC context.
   * The context from the current thread at the time of this method call
   * will be cached and restored within the wrapper at the time the
   * handler is invoked.
   */
  public static <T> Handler<T> mdc(Handler<T> handler) {
    Map<String, String> mdc = MDC.getCopyOfContextMap();

    return t -> {
      Map<String, String> restore = MDC.getCopyOfContextMap();
      try {
        if (mdc == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(mdc);
        }
        handler.handle(t);
      } finally {
        if (restore == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(restore);
        }
      }
    };
  }

  /**
   * Run blocking code on a worker thread (unordered), with the caller's
   * MDC visible to the blocking code.
   */
  public static <T> Future<T> executeBlocking(Vertx vertx, Callable<T> blocking) {
    Handler<Promise<T>> task = mdc(promise -> {
      try {
        promise.complete(blocking.call());
      } catch (Exception e) {
        promise.fail(e);
      }
    });
    return vertx.executeBlocking(task, false);
  }
}
