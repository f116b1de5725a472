package com.example.rdsbroker.core.privileges;

import static com.example.rdsbroker.core.privileges.PgQuoting.quoteIdentifier;
import static com.example.rdsbroker.core.privileges.PgQuoting.quoteLiteral;

import com.example.rdsbroker.core.errors.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Validates privilege specs and compiles them into PL/pgSQL blocks.
 *
 * <p>Every compiled statement is built from identifiers and literals that went through {@link
 * PgQuoting}, and is wrapped so that a missing table, column or schema is skipped instead of
 * aborting the binding. The blocks declare {@code username} and {@code dbname} as already-quoted
 * identifiers and are meant to run as {@code DO <literal>}.
 */
public final class PrivilegeCompiler {

  /** Minimum {@code server_version_num} for the {@code grant} default policy. */
  public static final int GRANT_POLICY_MIN_SERVER_VERSION = 100_000;

  private static final String SCHEMA_LOOP =
      "FOR r IN SELECT schema_name FROM information_schema.schemata"
          + " WHERE schema_name != 'information_schema' AND schema_name NOT LIKE 'pg_%' LOOP";

  private static final String GRANT_ALL =
      SCHEMA_LOOP
          + "\n\t\t\tEXECUTE 'GRANT ALL ON ALL TABLES IN SCHEMA ' || quote_ident(r.schema_name) || ' TO ' || username;"
          + "\n\t\t\tEXECUTE 'GRANT ALL ON ALL SEQUENCES IN SCHEMA ' || quote_ident(r.schema_name) || ' TO ' || username;"
          + "\n\t\t\tEXECUTE 'GRANT ALL ON SCHEMA ' || quote_ident(r.schema_name) || ' TO ' || username;"
          + "\n\t\tEND LOOP;"
          + "\n\n\t\tEXECUTE 'GRANT ALL ON DATABASE ' || dbname || ' TO ' || username;"
          + "\n\n\t\tEXECUTE 'ALTER DEFAULT PRIVILEGES GRANT ALL ON TABLES TO ' || username;"
          + "\n\t\tEXECUTE 'ALTER DEFAULT PRIVILEGES GRANT ALL ON SEQUENCES TO ' || username;"
          + "\n\t\tEXECUTE 'ALTER DEFAULT PRIVILEGES GRANT ALL ON SCHEMAS TO ' || username;";

  private static final String GRANT_CONNECT =
      "EXECUTE 'GRANT CONNECT ON DATABASE ' || dbname || ' TO ' || username;";

  private static final String BLOCK =
      "\n\tDECLARE\n\t\tusername text := %s;\n\t\tdbname text := %s;\n\t\tr RECORD;\n\tBEGIN\n\t\t%s\n\tEND";

  private static final String IGNORE_MISSING_OBJECTS =
      "BEGIN\n\t\t\t%s\n\t\tEXCEPTION\n\t\t\tWHEN undefined_column OR undefined_table OR invalid_schema_name THEN\n\t\t\t\tNULL;\n\t\tEND;";

  private PrivilegeCompiler() {}

  /**
   * Checks one spec against the rules of its target type.
   *
   * @throws ValidationException naming the offending field
   */
  public static ValidatedPrivilege validate(final PrivilegeSpec spec) {
    final var type =
        TargetType.parse(spec.targetType())
            .orElseThrow(
                () ->
                    new ValidationException(
                        "Unknown postgresql privilege target_type: " + spec.targetType()));
    final var privilege =
        spec.privilege() == null ? "" : spec.privilege().toUpperCase(Locale.ROOT);
    final var columns = spec.columnNames() == null ? List.<String>of() : spec.columnNames();

    switch (type) {
      case TABLE, SEQUENCE -> {
        requireName(type, spec.targetName());
        if (spec.targetSchema() != null && !spec.targetSchema().isEmpty()) {
          checkName(spec.targetSchema());
        }
        if (type == TargetType.SEQUENCE && spec.columnNames() != null) {
          throw senseless("column_names", type, "");
        }
        if (!columns.isEmpty()) {
          columns.forEach(PrivilegeCompiler::checkName);
          if (!type.allowsOnColumns(privilege)) {
            throw new ValidationException("Unknown postgresql column privilege: " + spec.privilege());
          }
        } else if (!type.allows(privilege)) {
          throw unknownPrivilege(type, spec.privilege());
        }
      }
      case DATABASE -> {
        if (spec.targetName() != null) throw senseless("target_name", type, "");
        if (spec.targetSchema() != null) throw senseless("target_schema", type, "");
        if (spec.columnNames() != null) throw senseless("column_names", type, "");
        if (!type.allows(privilege)) throw unknownPrivilege(type, spec.privilege());
      }
      case SCHEMA -> {
        requireName(type, spec.targetName());
        if (spec.targetSchema() != null) {
          throw senseless("target_schema", type, " (try target_name instead)");
        }
        if (spec.columnNames() != null) throw senseless("column_names", type, "");
        if (!type.allows(privilege)) throw unknownPrivilege(type, spec.privilege());
      }
    }

    final var schema =
        spec.targetSchema() == null || spec.targetSchema().isEmpty() ? null : spec.targetSchema();
    return new ValidatedPrivilege(type, schema, spec.targetName(), privilege, columns);
  }

  /**
   * Validates binding parameters as a whole.
   *
   * <p>Owners may carry neither a policy nor privileges. Non-owners need a policy; the privilege
   * list that contradicts it is rejected, and the {@code grant} policy needs PostgreSQL 10.
   *
   * @param serverVersionNum the server's {@code server_version_num}
   */
  public static PrivilegePlan plan(final PostgresBindParameters params, final int serverVersionNum) {
    if (params.owner()) {
      if (params.defaultPrivilegePolicy() != null && !params.defaultPrivilegePolicy().isEmpty()) {
        throw new ValidationException(
            "postgresql_user.default_privilege_policy makes no sense for owner");
      }
      if (params.revokePrivileges() != null) {
        throw new ValidationException("postgresql_user.revoke_privileges makes no sense for owner");
      }
      if (params.grantPrivileges() != null) {
        throw new ValidationException("postgresql_user.grant_privileges makes no sense for owner");
      }
      return PrivilegePlan.OWNER;
    }

    final var policy =
        DefaultPrivilegePolicy.parse(params.defaultPrivilegePolicy())
            .orElseThrow(
                () ->
                    new ValidationException(
                        "default_privilege_policy must be one of 'grant' or 'revoke'"));
    final List<PrivilegeSpec> specs;
    final PrivilegeAction action;
    if (policy == DefaultPrivilegePolicy.REVOKE) {
      if (params.revokePrivileges() != null) {
        throw new ValidationException(
            "revoke_privileges makes no sense with default_privilege_policy 'revoke'");
      }
      specs = params.grantPrivileges();
      action = PrivilegeAction.GRANT;
    } else {
      if (serverVersionNum < GRANT_POLICY_MIN_SERVER_VERSION) {
        throw new ValidationException(
            "default_privilege_policy 'grant' not supported for PostgreSQL versions <10");
      }
      if (params.grantPrivileges() != null) {
        throw new ValidationException(
            "grant_privileges makes no sense with default_privilege_policy 'grant'");
      }
      specs = params.revokePrivileges();
      action = PrivilegeAction.REVOKE;
    }

    final var validated = new ArrayList<ValidatedPrivilege>();
    if (specs != null) specs.forEach(spec -> validated.add(validate(spec)));
    return new PrivilegePlan(false, policy, action, validated);
  }

  /** Compiles one privilege into an exception-guarded PL/pgSQL statement. */
  public static String compile(final ValidatedPrivilege privilege, final PrivilegeAction action) {
    final var type = privilege.targetType();
    final var head = "EXECUTE '" + action + " " + privilege.privilege();
    final var tail = " " + action.preposition() + " ' || username;";

    final String statement;
    if (type == TargetType.TABLE && !privilege.columns().isEmpty()) {
      final var columns =
          privilege.columns().stream()
              .map(PgQuoting::quoteIdentifier)
              .collect(Collectors.joining(", "));
      statement =
          head
              + " (' || "
              + quoteLiteral(columns)
              + " || ') ON "
              + type
              + " ' || "
              + quoteLiteral(qualified(privilege))
              + " || '"
              + tail;
    } else if (type == TargetType.DATABASE) {
      statement = head + " ON " + type + " ' || dbname || '" + tail;
    } else if (type == TargetType.SCHEMA) {
      statement =
          head
              + " ON "
              + type
              + " ' || "
              + quoteLiteral(quoteIdentifier(privilege.name()))
              + " || '"
              + tail;
    } else {
      statement =
          head + " ON " + type + " ' || " + quoteLiteral(qualified(privilege)) + " || '" + tail;
    }
    return String.format(IGNORE_MISSING_OBJECTS, statement);
  }

  /**
   * Block establishing the default policy for a non-owner: everything under {@code grant}, then
   * CONNECT in both cases. Empty for owners.
   */
  public static String defaultPrivilegeBlock(
      final PrivilegePlan plan, final String username, final String dbname) {
    if (plan.owner()) return "";
    final var body =
        plan.policy() == DefaultPrivilegePolicy.GRANT
            ? GRANT_ALL + "\n\n\t\t" + GRANT_CONNECT
            : GRANT_CONNECT;
    return block(username, dbname, body);
  }

  /** Block applying a non-owner's explicit privileges; empty when there are none. */
  public static String assignmentBlock(
      final PrivilegePlan plan, final String username, final String dbname) {
    if (plan.owner() || plan.privileges().isEmpty()) return "";
    final var body =
        plan.privileges().stream()
            .map(privilege -> compile(privilege, plan.action()))
            .collect(Collectors.joining("\n\t\t"));
    return block(username, dbname, body);
  }

  private static String block(final String username, final String dbname, final String body) {
    return String.format(
        BLOCK, quoteLiteral(quoteIdentifier(username)), quoteLiteral(quoteIdentifier(dbname)), body);
  }

  private static String qualified(final ValidatedPrivilege privilege) {
    if (privilege.schema() == null) return quoteIdentifier(privilege.name());
    return quoteIdentifier(privilege.schema()) + "." + quoteIdentifier(privilege.name());
  }

  private static void requireName(final TargetType type, final String name) {
    if (name == null || name.isEmpty()) {
      throw new ValidationException(
          "Must provide a non-empty target_name for '"
              + type
              + "' postgresql privilege target_type");
    }
    checkName(name);
  }

  /** Names must be printable ASCII. */
  static void checkName(final String name) {
    if (name.isEmpty()) throw new ValidationException("Empty name");
    for (var i = 0; i < name.length(); i++) {
      final var c = name.charAt(i);
      if (c > 0x7f) {
        throw new ValidationException(
            "Non-ASCII characters in postgresql object names not (yet) supported: " + name);
      }
      if (c < 0x20 || c == 0x7f) {
        throw new ValidationException(
            "Control characters in postgresql object names not supported: "
                + name.replaceAll("\\p{Cntrl}", "?"));
      }
    }
  }

  private static ValidationException senseless(
      final String field, final TargetType type, final String hint) {
    return new ValidationException(
        field + " makes no sense for '" + type + "' postgresql privilege target_type" + hint);
  }

  private static ValidationException unknownPrivilege(final TargetType type, final String privilege) {
    return new ValidationException(
        "Unknown postgresql " + type.label() + " privilege: " + privilege);
  }
}
