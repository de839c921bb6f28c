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

import com.nimbusds.jose.Algorithm;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWSAlgorithm;

/**
 * The algorithms a self-contained token may be protected with. Signature
 * algorithms (HS*, RS*, ES*) verify a signed token; DIR and RSA_OAEP_256
 * decrypt an encrypted one and also need a {@link TokenEncryption}.
 */
public enum TokenAlgorithm {
  HS256(JWSAlgorithm.HS256),
  HS384(JWSAlgorithm.HS384),
  HS512(JWSAlgorithm.HS512),
  RS256(JWSAlgorithm.RS256),
  RS384(JWSAlgorithm.RS384),
  RS512(JWSAlgorithm.RS512),
  ES256(JWSAlgorithm.ES256),
  ES384(JWSAlgorithm.ES384),
  ES512(JWSAlgorithm.ES512),
  DIR(JWEAlgorithm.DIR),
  RSA_OAEP_256(JWEAlgorithm.RSA_OAEP_256);

  private final Algorithm jose;

  TokenAlgorithm(Algorithm jose) {
    this.jose = jose;
  }

  public Algorithm jose() {
    return jose;
  }

  public boolean isEncryption() {
    return jose instanceof JWEAlgorithm;
  }

  /**
   * True for algorithms keyed with a shared secret rather than a key pair.
   */
  public boolean isSymmetric() {
    return this == HS256 || this == HS384 || this == HS512 || this == DIR;
  }
}
