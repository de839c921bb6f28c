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

import com.github.susom.vertx.guard.BasicCredentials;
import com.github.susom.vertx.guard.TokenAuthBackend;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

/**
 * Parsing of the Authorization header for Basic and token schemes.
 */
@RunWith(JUnit4.class)
public class CredentialParsingTest {
  private static String basic(String userAndPassword) {
    return "Basic " + Base64.getEncoder().encodeToString(userAndPassword.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void basicSplitsOnFirstColonOnly() {
    BasicCredentials credentials = BasicCredentials.parse(basic("alice:pa:ss:word"));
    assertNotNull(credentials);
    assertEquals("alice", credentials.username());
    assertEquals("pa:ss:word", credentials.password());

    credentials = BasicCredentials.parse(basic("bob:"));
    assertNotNull(credentials);
    assertEquals("bob", credentials.username());
    assertEquals("", credentials.password());
  }

  @Test
  public void basicSchemeIgnoresCase() {
    String encoded = Base64.getEncoder().encodeToString("alice:secret".getBytes(StandardCharsets.UTF_8));
    assertEquals(new BasicCredentials("alice", "secret"), BasicCredentials.parse("basic " + encoded));
    assertEquals(new BasicCredentials("alice", "secret"), BasicCredentials.parse("BASIC " + encoded));
  }

  @Test
  public void malformedBasicIsAbsent() {
    assertNull(BasicCredentials.parse(null));
    assertNull(BasicCredentials.parse(""));
    assertNull(BasicCredentials.parse("Basic"));
    assertNull(BasicCredentials.parse("Basic "));
    assertNull(BasicCredentials.parse("Basic %%%not-base64%%%"));
    assertNull(BasicCredentials.parse("Bearer " + Base64.getEncoder().encodeToString("a:b".getBytes(StandardCharsets.UTF_8))));
    assertNull(BasicCredentials.parse(basic("no-colon-here")));
  }

  @Test
  public void credentialsNeverPrintPassword() {
    assertFalse(new BasicCredentials("alice", "secret").toString().contains("secret"));
  }

  @Test
  public void tokenParsing() {
    assertEquals("abc123", TokenAuthBackend.parseToken("Token abc123", "Token"));
    assertEquals("abc123", TokenAuthBackend.parseToken("token abc123", "Token"));
    assertEquals("abc.def.ghi", TokenAuthBackend.parseToken("Bearer abc.def.ghi", "Bearer"));

    assertNull(TokenAuthBackend.parseToken(null, "Token"));
    assertNull(TokenAuthBackend.parseToken("Token", "Token"));
    assertNull(TokenAuthBackend.parseToken("Token ", "Token"));
    assertNull(TokenAuthBackend.parseToken("Token    ", "Token"));
    assertNull(TokenAuthBackend.parseToken("Tokenabc123", "Token"));
    assertNull(TokenAuthBackend.parseToken("Bearer abc123", "Token"));
  }
}
