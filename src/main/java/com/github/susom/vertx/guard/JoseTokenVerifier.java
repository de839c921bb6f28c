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

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEDecrypter;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.DirectDecrypter;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.crypto.RSADecrypter;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.EncryptedJWT;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;
import io.vertx.core.json.JsonObject;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import javax.annotation.Nonnull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Verify signed (JWS) or encrypted (JWE) JSON Web Tokens using nimbus-jose-jwt.
 * Exactly one algorithm is accepted per verifier, and the token header must
 * declare it. Expiration ("exp") and not-before ("nbf") are enforced with an
 * optional leeway for clock skew.
 *
 * @author garricko
 */
public class JoseTokenVerifier implements TokenVerifier {
  private final TokenAlgorithm algorithm;
  private final TokenEncryption encryption;
  private final JWSVerifier jwsVerifier;
  private final JWEDecrypter jweDecrypter;
  private final long leewaySeconds;
  private final Clock clock;

  private JoseTokenVerifier(Builder builder, JWSVerifier jwsVerifier, JWEDecrypter jweDecrypter) {
    this.algorithm = builder.algorithm;
    this.encryption = builder.encryption;
    this.jwsVerifier = jwsVerifier;
    this.jweDecrypter = jweDecrypter;
    this.leewaySeconds = builder.leewaySeconds;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Nonnull
  @Override
  public JsonObject verify(@Nonnull String token) throws TokenVerificationException {
    JWT jwt;
    try {
      jwt = JWTParser.parse(token);
    } catch (ParseException e) {
      throw new TokenVerificationException("Token could not be parsed", e);
    }

    JWTClaimsSet claims;
    try {
      if (algorithm.isEncryption()) {
        claims = decrypt(jwt);
      } else {
        claims = verifySignature(jwt);
      }
    } catch (JOSEException | ParseException e) {
      throw new TokenVerificationException("Token could not be verified", e);
    }

    checkValidity(claims);
    return new JsonObject(claims.toJSONObject());
  }

  private JWTClaimsSet verifySignature(JWT jwt) throws JOSEException, ParseException, TokenVerificationException {
    if (!(jwt instanceof SignedJWT)) {
      throw new TokenVerificationException("Expecting a signed token");
    }
    SignedJWT signed = (SignedJWT) jwt;
    JWSHeader header = signed.getHeader();
    if (!algorithm.jose().equals(header.getAlgorithm())) {
      throw new TokenVerificationException("Unexpected signature algorithm " + header.getAlgorithm());
    }
    if (!signed.verify(jwsVerifier)) {
      throw new TokenVerificationException("Token signature is not valid");
    }
    return signed.getJWTClaimsSet();
  }

  private JWTClaimsSet decrypt(JWT jwt) throws JOSEException, ParseException, TokenVerificationException {
    if (!(jwt instanceof EncryptedJWT)) {
      throw new TokenVerificationException("Expecting an encrypted token");
    }
    EncryptedJWT encrypted = (EncryptedJWT) jwt;
    JWEHeader header = encrypted.getHeader();
    if (!algorithm.jose().equals(header.getAlgorithm())
        || !encryption.jose().equals(header.getEncryptionMethod())) {
      throw new TokenVerificationException("Unexpected encryption " + header.getAlgorithm() + "/"
          + header.getEncryptionMethod());
    }
    encrypted.decrypt(jweDecrypter);
    JWTClaimsSet claims = encrypted.getJWTClaimsSet();
    if (claims == null) {
      throw new TokenVerificationException("Encrypted token did not contain claims");
    }
    return claims;
  }

  private void checkValidity(JWTClaimsSet claims) throws TokenVerificationException {
    Instant now = clock.instant();

    Date expires = claims.getExpirationTime();
    if (expires != null && expires.toInstant().plusSeconds(leewaySeconds).isBefore(now)) {
      throw new TokenVerificationException("Token expired at " + expires.toInstant());
    }

    Date notBefore = claims.getNotBeforeTime();
    if (notBefore != null && notBefore.toInstant().minusSeconds(leewaySeconds).isAfter(now)) {
      throw new TokenVerificationException("Token not valid before " + notBefore.toInstant());
    }
  }

  public static class Builder {
    private TokenAlgorithm algorithm;
    private TokenEncryption encryption;
    private byte[] secret;
    private PublicKey publicKey;
    private PrivateKey privateKey;
    private long leewaySeconds;
    private Clock clock = Clock.systemUTC();

    public Builder algorithm(TokenAlgorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    /**
     * Content encryption, required for DIR and RSA_OAEP_256.
     */
    public Builder encryption(TokenEncryption encryption) {
      this.encryption = encryption;
      return this;
    }

    /**
     * Shared secret for HS* and DIR.
     */
    public Builder secret(byte[] secret) {
      this.secret = secret == null ? null : secret.clone();
      return this;
    }

    /**
     * Public key for RS* (RSA) and ES* (EC).
     */
    public Builder publicKey(PublicKey publicKey) {
      this.publicKey = publicKey;
      return this;
    }

    /**
     * Private key for RSA_OAEP_256.
     */
    public Builder privateKey(PrivateKey privateKey) {
      this.privateKey = privateKey;
      return this;
    }

    public Builder leewaySeconds(long leewaySeconds) {
      this.leewaySeconds = leewaySeconds;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JoseTokenVerifier build() {
      checkNotNull(algorithm, "A token algorithm is required");
      checkNotNull(clock, "A clock is required");
      checkArgument(leewaySeconds >= 0, "Leeway may not be negative");
      if (algorithm.isEncryption()) {
        checkNotNull(encryption, "Token encryption is required for " + algorithm);
      }

      try {
        switch (algorithm) {
        case HS256:
        case HS384:
        case HS512:
          checkNotNull(secret, "A secret is required for " + algorithm);
          return new JoseTokenVerifier(this, new MACVerifier(secret), null);
        case RS256:
        case RS384:
        case RS512:
          checkArgument(publicKey instanceof RSAPublicKey, "An RSA public key is required for " + algorithm);
          return new JoseTokenVerifier(this, new RSASSAVerifier((RSAPublicKey) publicKey), null);
        case ES256:
        case ES384:
        case ES512:
          checkArgument(publicKey instanceof ECPublicKey, "An EC public key is required for " + algorithm);
          return new JoseTokenVerifier(this, new ECDSAVerifier((ECPublicKey) publicKey), null);
        case DIR:
          checkNotNull(secret, "A secret is required for " + algorithm);
          DirectDecrypter direct = new DirectDecrypter(secret);
          checkArgument(direct.supportedEncryptionMethods().contains(encryption.jose()), "A " + (secret.length * 8)
              + " bit secret cannot be used with " + encryption + ", supported: "
              + direct.supportedEncryptionMethods());
          return new JoseTokenVerifier(this, null, direct);
        case RSA_OAEP_256:
          checkNotNull(privateKey, "A private key is required for " + algorithm);
          return new JoseTokenVerifier(this, null, new RSADecrypter(privateKey));
        default:
          throw new IllegalArgumentException("Unsupported token algorithm: " + algorithm);
        }
      } catch (JOSEException e) {
        throw new IllegalArgumentException("Invalid key for " + algorithm + ": " + e.getMessage(), e);
      }
    }
  }
}
