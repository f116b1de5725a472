package com.example.rdsbroker.core.privileges;

import java.util.List;

/**
 * A {@link PrivilegeSpec} that passed {@link PrivilegeCompiler#validate}. Only the compiler can
 * create one, so statement generation never sees an unchecked spec.
 */
public final class ValidatedPrivilege {

  private final TargetType targetType;
  private final String schema;
  private final String name;
  private final String privilege;
  private final List<String> columns;

  ValidatedPrivilege(
      final TargetType targetType,
      final String schema,
      final String name,
      final String privilege,
      final List<String> columns) {
    this.targetType = targetType;
    this.schema = schema;
    this.name = name;
    this.privilege = privilege;
    this.columns = List.copyOf(columns);
  }

  public TargetType targetType() {
    return targetType;
  }

  /** Schema qualifier, null when unqualified. */
  public String schema() {
    return schema;
  }

  /** Object name, null for {@link TargetType#DATABASE}. */
  public String name() {
    return name;
  }

  /** Upper-cased verb. */
  public String privilege() {
    return privilege;
  }

  public List<String> columns() {
    return columns;
  }
}
