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

package com.google.enterprise.samlsp.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * The names of the SAML attributes that carry each field of a user's
 * identity.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class AttributeNames {
  public static final String DEFAULT_USER_ID = "email";
  public static final String DEFAULT_EMAIL = "email";
  public static final String DEFAULT_FIRST_NAME = "firstName";
  public static final String DEFAULT_LAST_NAME = "lastName";
  public static final String DEFAULT_DISPLAY_NAME = "displayName";

  private static final AttributeNames DEFAULT = new AttributeNames(DEFAULT_USER_ID,
      DEFAULT_EMAIL, DEFAULT_FIRST_NAME, DEFAULT_LAST_NAME, DEFAULT_DISPLAY_NAME);

  @Nonnull private final String userId;
  @Nonnull private final String email;
  @Nonnull private final String firstName;
  @Nonnull private final String lastName;
  @Nonnull private final String displayName;

  private AttributeNames(String userId, String email, String firstName, String lastName,
      String displayName) {
    this.userId = userId;
    this.email = email;
    this.firstName = firstName;
    this.lastName = lastName;
    this.displayName = displayName;
  }

  @Nonnull
  public static AttributeNames make(String userId, String email, String firstName,
      String lastName, String displayName) {
    return new AttributeNames(
        Preconditions.checkNotNull(userId),
        Preconditions.checkNotNull(email),
        Preconditions.checkNotNull(firstName),
        Preconditions.checkNotNull(lastName),
        Preconditions.checkNotNull(displayName));
  }

  /**
   * Gets the default attribute names: {@code email} for both the user ID and
   * the email address, then {@code firstName}, {@code lastName} and
   * {@code displayName}.
   */
  @Nonnull
  public static AttributeNames getDefault() {
    return DEFAULT;
  }

  @Nonnull
  public String getUserId() {
    return userId;
  }

  @Nonnull
  public String getEmail() {
    return email;
  }

  @Nonnull
  public String getFirstName() {
    return firstName;
  }

  @Nonnull
  public String getLastName() {
    return lastName;
  }

  @Nonnull
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof AttributeNames)) { return false; }
    AttributeNames other = (AttributeNames) object;
    return userId.equals(other.userId)
        && email.equals(other.email)
        && firstName.equals(other.firstName)
        && lastName.equals(other.lastName)
        && displayName.equals(other.displayName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(userId, email, firstName, lastName, displayName);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("userId", userId)
        .add("email", email)
        .add("firstName", firstName)
        .add("lastName", lastName)
        .add("displayName", displayName)
        .toString();
  }
}
