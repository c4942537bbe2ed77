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

package com.google.enterprise.samlsp.identity;

import com.google.common.base.Strings;
import com.google.enterprise.samlsp.config.AttributeNames;
import com.google.enterprise.samlsp.saml.Assertion;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Maps the attributes of a validated assertion onto a
 * {@link CanonicalIdentity}.
 */
@ParametersAreNonnullByDefault
public final class AttributeMapper {
  private static final Logger logger = Logger.getLogger(AttributeMapper.class.getName());

  // Non-instantiable class.
  private AttributeMapper() {
  }

  /**
   * Maps an assertion to an identity.  Each field takes the first value of
   * its configured attribute.  The user ID and email fall back to the NameID.
   * The display name falls back to "first last" when both are known, and
   * otherwise to the email.  Empty values count as absent.
   *
   * @param assertion A validated assertion.
   * @param names The attribute names to read.
   * @return The identity; never null.
   */
  @Nonnull
  public static CanonicalIdentity map(Assertion assertion, AttributeNames names) {
    if (assertion.getAttributes().isEmpty()) {
      logger.warning("Assertion " + assertion.getId()
          + " has no attributes; using the NameID for user information");
    }
    String nameId = Strings.emptyToNull(assertion.getNameId());
    String id = firstNonEmpty(getValue(assertion, names.getUserId()), nameId);
    String email = firstNonEmpty(getValue(assertion, names.getEmail()), nameId);
    String firstName = getValue(assertion, names.getFirstName());
    String lastName = getValue(assertion, names.getLastName());
    String displayName = getValue(assertion, names.getDisplayName());
    if (displayName == null) {
      displayName = (firstName != null && lastName != null)
          ? firstName + " " + lastName
          : email;
    }
    return CanonicalIdentity.make(id, email, firstName, lastName, displayName);
  }

  @Nullable
  private static String getValue(Assertion assertion, String name) {
    return Strings.emptyToNull(assertion.getFirstAttributeValue(name));
  }

  @Nullable
  private static String firstNonEmpty(@Nullable String first, @Nullable String second) {
    return (first != null) ? first : second;
  }
}
