package com.example.rdsbroker.core.privileges;

import java.util.List;

/**
 * Validated outcome of a binding's parameters.
 *
 * @param owner whether the binding joins the database's manager group
 * @param policy default policy, null for owners
 * @param action action applied to {@code privileges}
 * @param privileges explicit privileges, empty for owners
 */
public record PrivilegePlan(
    boolean owner,
    DefaultPrivilegePolicy policy,
    PrivilegeAction action,
    List<ValidatedPrivilege> privileges) {

  static final PrivilegePlan OWNER = new PrivilegePlan(true, null, null, List.of());

  public PrivilegePlan {
    privileges = List.copyOf(privileges);
  }
}
