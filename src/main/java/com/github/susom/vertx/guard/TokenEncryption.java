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

import com.nimbusds.jose.EncryptionMethod;

/**
 * Content encryption for encrypted tokens.
 */
public enum TokenEncryption {
  A128GCM(EncryptionMethod.A128GCM),
  A256GCM(EncryptionMethod.A256GCM),
  A128CBC_HS256(EncryptionMethod.A128CBC_HS256),
  A256CBC_HS512(EncryptionMethod.A256CBC_HS512);

  private final EncryptionMethod jose;

  TokenEncryption(EncryptionMethod jose) {
    this.jose = jose;
  }

  public EncryptionMethod jose() {
    return jose;
  }
}
