package com.example.rdsbroker.core.privileges;

import com.example.rdsbroker.core.errors.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;

/**
 * PostgreSQL binding parameters as supplied by the caller.
 *
 * <pre>{@code
 * {
 *   "is_owner": false,
 *   "default_privilege_policy": "revoke",
 *   "grant_privileges": [
 *     {"target_type": "table", "target_schema": "public", "target_name": "orders", "privilege": "SELECT"}
 *   ]
 * }
 * }</pre>
 *
 * @param isOwner whether the binding owns the database; absent means owner
 * @param defaultPrivilegePolicy {@code grant} or {@code revoke}, non-owners only
 * @param revokePrivileges revokes applied on top of a {@code grant} policy
 * @param grantPrivileges grants applied on top of a {@code revoke} policy
 */
public record PostgresBindParameters(
    @JsonProperty("is_owner") Boolean isOwner,
    @JsonProperty("default_privilege_policy") String defaultPrivilegePolicy,
    @JsonProperty("revoke_privileges") List<PrivilegeSpec> revokePrivileges,
    @JsonProperty("grant_privileges") List<PrivilegeSpec> grantPrivileges) {

  /** Parameters of a plain owner binding. */
  public static final PostgresBindParameters OWNER = new PostgresBindParameters(null, null, null, null);

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  /**
   * Parses raw JSON; null or blank input yields {@link #OWNER}.
   *
   * @throws ValidationException on malformed JSON or unknown fields
   */
  public static PostgresBindParameters parse(final String json) {
    if (json == null || json.isBlank()) return OWNER;
    try {
      final var parsed = MAPPER.readValue(json, PostgresBindParameters.class);
      return parsed == null ? OWNER : parsed;
    } catch (final JsonProcessingException e) {
      throw new ValidationException("invalid bind parameters: " + e.getOriginalMessage(), e);
    }
  }

  /** An absent {@code is_owner} counts as owner. */
  public boolean owner() {
    return isOwner == null || isOwner;
  }
}
