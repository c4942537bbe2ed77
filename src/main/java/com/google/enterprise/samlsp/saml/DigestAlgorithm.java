// Copyright 2025 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.samlsp.saml;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The XML-DSig digest algorithms we can produce and verify.
 */
public enum DigestAlgorithm {
  SHA1("http://www.w3.org/2000/09/xmldsig#sha1"),
  SHA256("http://www.w3.org/2001/04/xmlenc#sha256"),
  SHA384("http://www.w3.org/2001/04/xmldsig-more#sha384"),
  SHA512("http://www.w3.org/2001/04/xmlenc#sha512");

  private final String uri;

  private DigestAlgorithm(String uri) {
    this.uri = uri;
  }

  @Nonnull
  public String getUri() {
    return uri;
  }

  @Nullable
  public static DigestAlgorithm forUri(@Nullable String uri) {
    for (DigestAlgorithm algorithm : values()) {
      if (algorithm.uri.equals(uri)) {
        return algorithm;
      }
    }
    return null;
  }
}
