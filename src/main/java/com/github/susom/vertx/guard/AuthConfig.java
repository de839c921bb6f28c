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

import com.github.susom.database.Config;
import com.github.susom.database.ConfigInvalidException;
import com.github.susom.database.ConfigMissingException;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Build backends and access rules from configuration properties, so key
 * material and realms can live outside the code. Problems with the
 * configuration are reported here, at startup, never while serving requests.
 *
 * <pre>
 *   auth.basic.realm=API
 *   auth.session.key=identity
 *   auth.token.header=Authorization
 *   auth.token.scheme=Bearer
 *   auth.token.algorithm=HS256|HS384|HS512|RS256|...|ES512|DIR|RSA_OAEP_256
 *   auth.token.secret=...              (HS*, DIR; or auth.token.secret.base64)
 *   auth.token.public.key=...          (RS*, ES*: base64 X.509)
 *   auth.token.private.key=...         (RSA_OAEP_256: base64 PKCS#8)
 *   auth.token.encryption=A256GCM      (DIR, RSA_OAEP_256)
 *   auth.token.leeway.seconds=30
 *   auth.access.policy=allow|reject
 * </pre>
 *
 * @author garricko
 */
public class AuthConfig {
  private static final Logger log = LoggerFactory.getLogger(AuthConfig.class);
  private final Config config;

  public AuthConfig(Function<String, String> cfg) {
    config = Config.from().custom(cfg::apply).get();
  }

  public BasicAuthBackend basic(IdentityFunction<BasicCredentials> identityFunction) {
    return BasicAuthBackend.builder()
        .realm(config.getStringOrThrow("auth.basic.realm"))
        .identityFunction(identityFunction)
        .build();
  }

  public SessionAuthBackend session() {
    return SessionAuthBackend.builder()
        .sessionKey(config.getString("auth.session.key", AuthContext.IDENTITY))
        .build();
  }

  public TokenAuthBackend token(IdentityFunction<String> identityFunction) {
    return TokenAuthBackend.builder()
        .header(config.getString("auth.token.header", TokenAuthBackend.DEFAULT_HEADER))
        .scheme(config.getString("auth.token.scheme", TokenAuthBackend.DEFAULT_SCHEME))
        .identityFunction(identityFunction)
        .build();
  }

  /**
   * Self-contained token backend whose identity is the verified claims.
   */
  public SignedTokenAuthBackend signedToken() {
    return signedToken(claims -> claims);
  }

  public SignedTokenAuthBackend signedToken(Function<JsonObject, Object> claimsToIdentity) {
    return SignedTokenAuthBackend.builder()
        .header(config.getString("auth.token.header", TokenAuthBackend.DEFAULT_HEADER))
        .scheme(config.getString("auth.token.scheme", TokenAuthBackend.DEFAULT_SCHEME))
        .verifier(tokenVerifier())
        .claimsToIdentity(claimsToIdentity)
        .build();
  }

  public JoseTokenVerifier tokenVerifier() {
    TokenAlgorithm algorithm = enumValue(TokenAlgorithm.class, "auth.token.algorithm",
        config.getStringOrThrow("auth.token.algorithm"));

    JoseTokenVerifier.Builder builder = JoseTokenVerifier.builder()
        .algorithm(algorithm)
        .leewaySeconds(config.getInteger("auth.token.leeway.seconds", 0));

    if (algorithm.isEncryption()) {
      builder.encryption(enumValue(TokenEncryption.class, "auth.token.encryption",
          config.getStringOrThrow("auth.token.encryption")));
    }

    if (algorithm.isSymmetric()) {
      builder.secret(secret());
    } else if (algorithm == TokenAlgorithm.RSA_OAEP_256) {
      builder.privateKey(privateKey(config.getStringOrThrow("auth.token.private.key")));
    } else {
      String keyType = algorithm.name().startsWith("ES") ? "EC" : "RSA";
      builder.publicKey(publicKey(keyType, config.getStringOrThrow("auth.token.public.key")));
    }

    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new ConfigInvalidException("Invalid key material for auth.token.algorithm=" + algorithm + ": "
          + e.getMessage());
    }
  }

  /**
   * Read auth.access.policy as ALLOW or REJECT (required).
   */
  public Policy policy() {
    return enumValue(Policy.class, "auth.access.policy", config.getStringOrThrow("auth.access.policy"));
  }

  public AccessRules.Builder accessRules() {
    return AccessRules.builder().policy(policy());
  }

  private byte[] secret() {
    String base64 = config.getString("auth.token.secret.base64");
    if (base64 != null) {
      try {
        return Base64.getDecoder().decode(base64);
      } catch (IllegalArgumentException e) {
        throw new ConfigInvalidException("Property auth.token.secret.base64 is not valid base64");
      }
    }
    String secret = config.getString("auth.token.secret");
    if (secret == null) {
      throw new ConfigMissingException("Set auth.token.secret or auth.token.secret.base64");
    }
    return secret.getBytes(StandardCharsets.UTF_8);
  }

  private PublicKey publicKey(String keyType, String base64) {
    try {
      return KeyFactory.getInstance(keyType).generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(base64)));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      log.debug("Unable to read public key", e);
      throw new ConfigInvalidException("Property auth.token.public.key is not a base64 X.509 " + keyType + " key");
    }
  }

  private PrivateKey privateKey(String base64) {
    try {
      return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(Base64.getDecoder().decode(base64)));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      log.debug("Unable to read private key", e);
      throw new ConfigInvalidException("Property auth.token.private.key is not a base64 PKCS#8 RSA key");
    }
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String key, String value) {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new ConfigInvalidException("Property " + key + " was '" + value + "' but must be one of "
          + Arrays.toString(type.getEnumConstants()));
    }
  }
}
