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

import com.github.susom.vertx.guard.JoseTokenVerifier;
import com.github.susom.vertx.guard.TokenAlgorithm;
import com.github.susom.vertx.guard.TokenEncryption;
import com.github.susom.vertx.guard.TokenVerificationException;
import com.nimbusds.jose.EncryptionMethod;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.DirectEncrypter;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.RSAEncrypter;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.EncryptedJWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Date;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

/**
 * Verify tokens produced directly with nimbus, the way a separate token
 * issuer would produce them.
 */
@RunWith(JUnit4.class)
public class JoseTokenVerifierTest {
  private static final byte[] SECRET = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);
  private static final byte[] OTHER_SECRET = "fedcba9876543210fedcba9876543210".getBytes(StandardCharsets.UTF_8);
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  private static JWTClaimsSet claims(Instant expires) {
    return new JWTClaimsSet.Builder()
        .subject("alice")
        .claim("authority", Collections.singletonList("admin"))
        .expirationTime(Date.from(expires))
        .build();
  }

  static String hs256(byte[] secret, JWTClaimsSet claims) throws Exception {
    SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
    jwt.sign(new MACSigner(secret));
    return jwt.serialize();
  }

  private JoseTokenVerifier hs256Verifier(long leeway) {
    return JoseTokenVerifier.builder().algorithm(TokenAlgorithm.HS256).secret(SECRET).leewaySeconds(leeway)
        .clock(clock).build();
  }

  @Test
  public void validSignedToken() throws Exception {
    JsonObject verified = hs256Verifier(0).verify(hs256(SECRET, claims(NOW.plusSeconds(60))));

    assertEquals("alice", verified.getString("sub"));
    assertEquals("admin", verified.getJsonArray("authority").getString(0));
  }

  @Test(expected = TokenVerificationException.class)
  public void expiredToken() throws Exception {
    hs256Verifier(0).verify(hs256(SECRET, claims(NOW.minusSeconds(10))));
  }

  @Test
  public void leewayCoversSmallSkew() throws Exception {
    String token = hs256(SECRET, claims(NOW.minusSeconds(10)));
    assertEquals("alice", hs256Verifier(30).verify(token).getString("sub"));
  }

  @Test
  public void notYetValid() throws Exception {
    JWTClaimsSet future = new JWTClaimsSet.Builder().subject("alice")
        .notBeforeTime(Date.from(NOW.plusSeconds(120))).build();

    try {
      hs256Verifier(0).verify(hs256(SECRET, future));
      fail("Should have rejected the token");
    } catch (TokenVerificationException e) {
      assertTrue(e.getMessage().startsWith("Token not valid before"));
    }
  }

  @Test(expected = TokenVerificationException.class)
  public void wrongSecret() throws Exception {
    hs256Verifier(0).verify(hs256(OTHER_SECRET, claims(NOW.plusSeconds(60))));
  }

  @Test(expected = TokenVerificationException.class)
  public void garbage() throws Exception {
    hs256Verifier(0).verify("not.a.token");
  }

  @Test
  public void algorithmMustMatch() throws Exception {
    SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS512), claims(NOW.plusSeconds(60)));
    jwt.sign(new MACSigner((new String(SECRET, StandardCharsets.UTF_8) + new String(SECRET, StandardCharsets.UTF_8))
        .getBytes(StandardCharsets.UTF_8)));

    try {
      hs256Verifier(0).verify(jwt.serialize());
      fail("Should have rejected the token");
    } catch (TokenVerificationException e) {
      assertTrue(e.getMessage().startsWith("Unexpected signature algorithm"));
    }
  }

  @Test
  public void directEncryption() throws Exception {
    EncryptedJWT jwt = new EncryptedJWT(new JWEHeader(JWEAlgorithm.DIR, EncryptionMethod.A256GCM),
        claims(NOW.plusSeconds(60)));
    jwt.encrypt(new DirectEncrypter(SECRET));

    JoseTokenVerifier verifier = JoseTokenVerifier.builder().algorithm(TokenAlgorithm.DIR)
        .encryption(TokenEncryption.A256GCM).secret(SECRET).clock(clock).build();
    assertEquals("alice", verifier.verify(jwt.serialize()).getString("sub"));

    // A signed token is not accepted by a verifier expecting encryption
    try {
      verifier.verify(hs256(SECRET, claims(NOW.plusSeconds(60))));
      fail("Should have rejected the token");
    } catch (TokenVerificationException e) {
      assertEquals("Expecting an encrypted token", e.getMessage());
    }
  }

  @Test
  public void rsaSignatureAndEncryption() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    KeyPair keys = generator.generateKeyPair();

    SignedJWT signed = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims(NOW.plusSeconds(60)));
    signed.sign(new RSASSASigner(keys.getPrivate()));
    JoseTokenVerifier rs256 = JoseTokenVerifier.builder().algorithm(TokenAlgorithm.RS256)
        .publicKey(keys.getPublic()).clock(clock).build();
    assertEquals("alice", rs256.verify(signed.serialize()).getString("sub"));

    EncryptedJWT encrypted = new EncryptedJWT(new JWEHeader(JWEAlgorithm.RSA_OAEP_256, EncryptionMethod.A128GCM),
        claims(NOW.plusSeconds(60)));
    encrypted.encrypt(new RSAEncrypter((RSAPublicKey) keys.getPublic()));
    JoseTokenVerifier oaep = JoseTokenVerifier.builder().algorithm(TokenAlgorithm.RSA_OAEP_256)
        .encryption(TokenEncryption.A128GCM).privateKey(keys.getPrivate()).clock(clock).build();
    assertEquals("alice", oaep.verify(encrypted.serialize()).getString("sub"));
  }

  @Test
  public void ecSignature() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(new ECGenParameterSpec("secp256r1"));
    KeyPair keys = generator.generateKeyPair();

    SignedJWT signed = new SignedJWT(new JWSHeader(JWSAlgorithm.ES256), claims(NOW.plusSeconds(60)));
    signed.sign(new ECDSASigner((ECPrivateKey) keys.getPrivate()));
    JoseTokenVerifier es256 = JoseTokenVerifier.builder().algorithm(TokenAlgorithm.ES256)
        .publicKey(keys.getPublic()).clock(clock).build();
    assertEquals("alice", es256.verify(signed.serialize()).getString("sub"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void shortSecretRejectedAtBuild() {
    JoseTokenVerifier.builder().algorithm(TokenAlgorithm.HS256).secret("short".getBytes(StandardCharsets.UTF_8))
        .build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void wrongKeyTypeRejectedAtBuild() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    JoseTokenVerifier.builder().algorithm(TokenAlgorithm.ES256).publicKey(generator.generateKeyPair().getPublic())
        .build();
  }

  @Test
  public void directSecretMustFitEncryption() {
    try {
      JoseTokenVerifier.builder().algorithm(TokenAlgorithm.DIR).encryption(TokenEncryption.A128GCM).secret(SECRET)
          .build();
      fail("A 256 bit secret should not be accepted for A128GCM");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("A128GCM"));
    }

    byte[] shorter = "0123456789abcdef".getBytes(StandardCharsets.UTF_8);
    assertNotNull(JoseTokenVerifier.builder().algorithm(TokenAlgorithm.DIR).encryption(TokenEncryption.A128GCM)
        .secret(shorter).build());
  }

  @Test(expected = NullPointerException.class)
  public void encryptionRequiredForDirect() {
    JoseTokenVerifier.builder().algorithm(TokenAlgorithm.DIR).secret(SECRET).build();
  }
}
