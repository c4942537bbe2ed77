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
 * The XML-DSig signature algorithms we can produce and verify.
 */
public enum SignatureAlgorithm {
  RSA_SHA1("http://www.w3.org/2000/09/xmldsig#rsa-sha1", "SHA1withRSA"),
  RSA_SHA256("http://www.w3.org/2001/04/xmldsig-more#rsa-sha256", "SHA256withRSA"),
  RSA_SHA384("http://www.w3.org/2001/04/xmldsig-more#rsa-sha384", "SHA384withRSA"),
  RSA_SHA512("http://www.w3.org/2001/04/xmldsig-more#rsa-sha512", "SHA512withRSA");

  private final String uri;
  private final String jcaName;

  private SignatureAlgorithm(String uri, String jcaName) {
    this.uri = uri;
    this.jcaName = jcaName;
  }

  /** Gets the algorithm's URI, as it appears in {@code SigAlg} and {@code SignatureMethod}. */
  @Nonnull
  public String getUri() {
    return uri;
  }

  /** Gets the name under which the JCA knows this algorithm. */
  @Nonnull
  public String getJcaName() {
    return jcaName;
  }

  /**
   * Finds the algorithm with a given URI.
   *
   * @return The algorithm, or {@code null} if the URI isn't supported.
   */
  @Nullable
  public static SignatureAlgorithm forUri(@Nullable String uri) {
    for (SignatureAlgorithm algorithm : values()) {
      if (algorithm.uri.equals(uri)) {
        return algorithm;
      }
    }
    return null;
  }
}
