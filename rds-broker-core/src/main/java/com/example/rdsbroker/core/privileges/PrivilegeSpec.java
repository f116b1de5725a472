package com.example.rdsbroker.core.privileges;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One grant or revoke as supplied by the caller, before validation.
 *
 * <p>Fields are kept exactly as received; an absent field and an empty one are distinguished
 * because some target types reject a field's mere presence.
 *
 * @param targetType TABLE, SEQUENCE, DATABASE or SCHEMA, any case
 * @param targetSchema schema qualifier, may be null
 * @param targetName object name, may be null
 * @param privilege privilege verb, any case
 * @param columnNames column list, may be null
 */
public record PrivilegeSpec(
    @JsonProperty("target_type") String targetType,
    @JsonProperty("target_schema") String targetSchema,
    @JsonProperty("target_name") String targetName,
    @JsonProperty("privilege") String privilege,
    @JsonProperty("column_names") List<String> columnNames) {

  public static PrivilegeSpec table(final String schema, final String name, final String privilege) {
    return new PrivilegeSpec("TABLE", schema, name, privilege, null);
  }

  public static PrivilegeSpec columns(
      final String schema, final String name, final String privilege, final List<String> columns) {
    return new PrivilegeSpec("TABLE", schema, name, privilege, columns);
  }

  public static PrivilegeSpec sequence(
      final String schema, final String name, final String privilege) {
    return new PrivilegeSpec("SEQUENCE", schema, name, privilege, null);
  }

  public static PrivilegeSpec database(final String privilege) {
    return new PrivilegeSpec("DATABASE", null, null, privilege, null);
  }

  public static PrivilegeSpec schema(final String name, final String privilege) {
    return new PrivilegeSpec("SCHEMA", null, name, privilege, null);
  }
}
