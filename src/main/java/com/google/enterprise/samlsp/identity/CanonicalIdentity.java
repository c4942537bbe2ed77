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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * The identity record handed to the session layer after a successful login.
 * Its shape is shared with the other single-sign-on providers.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class CanonicalIdentity {
  public static final String SAML_PROVIDER = "saml";

  private static final Gson GSON = new GsonBuilder()
      .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
      .serializeNulls()
      .create();

  @Nullable private final String id;
  @Nullable private final String email;
  @Nullable private final String firstName;
  @Nullable private final String lastName;
  @Nullable private final String displayName;
  @Nonnull private final String provider;
  @Nonnull private final List<String> teamIds;

  private CanonicalIdentity(@Nullable String id, @Nullable String email,
      @Nullable String firstName, @Nullable String lastName, @Nullable String displayName,
      String provider, ImmutableList<String> teamIds) {
    this.id = id;
    this.email = email;
    this.firstName = firstName;
    this.lastName = lastName;
    this.displayName = displayName;
    this.provider = provider;
    this.teamIds = teamIds;
  }

  /**
   * Makes an identity for a SAML-authenticated user.  Team memberships are
   * provisioned separately, so the team list is always empty.
   */
  @Nonnull
  public static CanonicalIdentity make(@Nullable String id, @Nullable String email,
      @Nullable String firstName, @Nullable String lastName, @Nullable String displayName) {
    return new CanonicalIdentity(id, email, firstName, lastName, displayName, SAML_PROVIDER,
        ImmutableList.<String>of());
  }

  @Nullable
  public String getId() {
    return id;
  }

  @Nullable
  public String getEmail() {
    return email;
  }

  @Nullable
  public String getFirstName() {
    return firstName;
  }

  @Nullable
  public String getLastName() {
    return lastName;
  }

  @Nullable
  public String getDisplayName() {
    return displayName;
  }

  @Nonnull
  public String getProvider() {
    return provider;
  }

  @Nonnull
  public ImmutableList<String> getTeamIds() {
    return ImmutableList.copyOf(teamIds);
  }

  /**
   * Renders this identity as a JSON object with snake-case keys.
   */
  @Nonnull
  public String toJson() {
    return GSON.toJson(this);
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof CanonicalIdentity)) { return false; }
    CanonicalIdentity other = (CanonicalIdentity) object;
    return Objects.equals(id, other.id)
        && Objects.equals(email, other.email)
        && Objects.equals(firstName, other.firstName)
        && Objects.equals(lastName, other.lastName)
        && Objects.equals(displayName, other.displayName)
        && provider.equals(other.provider)
        && teamIds.equals(other.teamIds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, email, firstName, lastName, displayName, provider, teamIds);
  }

  @Override
  public String toString() {
    return "{CanonicalIdentity id: " + id + ", email: " + email + ", displayName: "
        + displayName + ", provider: " + provider + "}";
  }
}
