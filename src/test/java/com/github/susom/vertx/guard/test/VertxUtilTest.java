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

import com.github.susom.vertx.guard.VertxUtil;
import io.vertx.core.Vertx;
import io.vertx.ext.unit.Async;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Verify the SLF4J MDC follows work onto worker threads and back.
 *
 * @author garricko
 */
@RunWith(VertxUnitRunner.class)
public class VertxUtilTest {
  private static final Logger log = LoggerFactory.getLogger(VertxUtilTest.class);

  @Test
  public void testMdc(TestContext context) {
    Async async = context.async();

    Vertx vertx = Vertx.vertx();
    vertx.runOnContext(v -> {
      MDC.put("userId", "ivan");
      VertxUtil.executeBlocking(vertx, () -> {
        log.debug("Blocking lookup running");
        context.assertEquals("ivan", MDC.get("userId"));
        return "done";
      }).onComplete(VertxUtil.mdc(result -> {
        context.assertTrue(result.succeeded());
        context.assertEquals("done", result.result());
        context.assertEquals("ivan", MDC.get("userId"));
        vertx.close(closed -> async.complete());
      }));
      MDC.clear();
    });
  }

  @Test
  public void blockingFailure(TestContext context) {
    Vertx vertx = Vertx.vertx();
    VertxUtil.<String>executeBlocking(vertx, () -> {
      throw new IllegalStateException("lookup failed");
    }).onComplete(context.asyncAssertFailure(e -> {
      context.assertEquals("lookup failed", e.getMessage());
      vertx.close();
    }));
  }
}
