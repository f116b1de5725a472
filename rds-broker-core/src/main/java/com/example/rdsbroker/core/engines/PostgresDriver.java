package com.example.rdsbroker.core.engines;

import static com.example.rdsbroker.core.privileges.PgQuoting.quoteIdentifier;
import static com.example.rdsbroker.core.privileges.PgQuoting.quoteLiteral;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.rdsbroker.core.credentials.Credential;
import com.example.rdsbroker.core.credentials.CredentialVault;
import com.example.rdsbroker.core.privileges.PostgresBindParameters;
import com.example.rdsbroker.core.privileges.PrivilegeCompiler;
import com.example.rdsbroker.core.privileges.PrivilegePlan;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PostgreSQL driver.
 *
 * <p>Every database gets a {@code <dbname>_manager} group that owns its objects. Owner bindings
 * join the group; an event trigger reassigns anything an owner creates to the group, so objects
 * survive the binding. Non-owner bindings get CONNECT plus whatever their {@link
 * PostgresBindParameters} compile to, and never CREATE.
 *
 * <p>Passwords handed out are kept, encrypted, in a state database on the same server so that
 * re-creating a binding returns the same login.
 */
public final class PostgresDriver implements EngineDriver {

  private static final System.Logger LOGGER = System.getLogger(PostgresDriver.class.getName());

  public static final String DEFAULT_STATE_DATABASE = "rds_broker_state";

  private static final Set<String> RACE_STATES = Set.of("XX000", "42710", "23505");
  private static final Retry.Policy CREATE_USER_RETRY = new Retry.Policy(10, 1_500L);

  private static final String SCHEMA_LOOP =
      "FOR r IN SELECT schema_name FROM information_schema.schemata"
          + " WHERE schema_name != 'information_schema' AND schema_name NOT LIKE 'pg_%' LOOP";

  private final DataSourceFactory factory;
  private final CredentialVault vault;
  private final String stateDatabase;

  private ConnectionSpec spec;
  private JdbcSession session;
  private PostgresStateStore state;

  public PostgresDriver(final DataSourceFactory factory, final CredentialVault vault) {
    this(factory, vault, DEFAULT_STATE_DATABASE);
  }

  public PostgresDriver(
      final DataSourceFactory factory, final CredentialVault vault, final String stateDatabase) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.vault = Objects.requireNonNull(vault, "vault");
    this.stateDatabase = Objects.requireNonNull(stateDatabase, "stateDatabase");
  }

  static String connectionUrl(final ConnectionSpec spec) {
    return String.format(
        "jdbc:postgresql://%s:%d/%s?sslmode=%s",
        spec.host(), spec.port(), spec.database(), spec.requireTls() ? "require" : "disable");
  }

  @Override
  public void open(final ConnectionSpec spec) {
    close();
    try {
      this.session = JdbcSession.open(factory, connectionUrl(spec), spec.username(), spec.password());
      this.spec = spec;
    } catch (final SQLException | RuntimeException e) {
      throw SqlErrors.onOpen(spec.username(), e);
    }
  }

  @Override
  public void close() {
    if (state != null) state.close();
    if (session != null) session.close();
    state = null;
    session = null;
  }

  @Override
  public Credential createUser(
      final String bindingId, final String database, final String bindParameters) {
    final var session = requireOpen();
    final var params = PostgresBindParameters.parse(bindParameters);
    final var username = CredentialVault.username(bindingId);
    try {
      final var serverVersion =
          session.queryInt("SELECT current_setting('server_version_num')::integer");
      final var plan = PrivilegeCompiler.plan(params, serverVersion);

      final var stored = state().fetchPassword(username);
      final var password = stored.orElseGet(vault::password);

      Retry.onException(
          () ->
              session.inTransaction(
                  conn -> {
                    createUser(session, username, password, database, plan);
                    return null;
                  }),
          e -> RACE_STATES.contains(e.getSQLState()),
          CREATE_USER_RETRY);

      if (stored.isEmpty()) state().storePassword(username, password);
      LOGGER.log(INFO, "Created user {0} on {1} (owner={2})", username, database, plan.owner());

      migrateLegacyOwnership(CredentialVault.legacyUsername(bindingId), database);
      return new Credential(username, password, database);
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to create user " + username, e);
    }
  }

  private void createUser(
      final JdbcSession session,
      final String username,
      final String password,
      final String database,
      final PrivilegePlan plan)
      throws SQLException {
    final var group = groupName(database);
    session.execute(doBlock(ensureGroup(group)));
    for (final var statement : ensureTrigger(group)) session.execute(statement);
    session.execute(doBlock(ensurePublicPrivileges(database)));

    final Function<String, String> ensureUser = pw -> doBlock(ensureUser(username, pw));
    session.execute(ensureUser.apply(password), ensureUser.apply("REDACTED"));

    if (plan.owner()) {
      session.execute("GRANT " + quoteIdentifier(group) + " TO " + quoteIdentifier(username));
    } else {
      final var defaults = PrivilegeCompiler.defaultPrivilegeBlock(plan, username, database);
      if (!defaults.isEmpty()) session.execute("DO " + quoteLiteral(defaults));
      final var assignments = PrivilegeCompiler.assignmentBlock(plan, username, database);
      if (!assignments.isEmpty()) session.execute("DO " + quoteLiteral(assignments));
      session.execute(doBlock(nonOwnerRestrictions(username, database)));
    }

    session.execute(doBlock(ensureGroupPrivileges(database, group)));
  }

  /** Hands objects still owned by a binding's pre-hash-change user to the manager group. */
  private void migrateLegacyOwnership(final String legacyUsername, final String database) {
    try {
      if (!session.exists(
          "SELECT EXISTS(SELECT 1 FROM pg_user WHERE usename = ?)", legacyUsername)) {
        return;
      }
      session.execute(
          "REASSIGN OWNED BY "
              + quoteIdentifier(legacyUsername)
              + " TO "
              + quoteIdentifier(groupName(database)));
      LOGGER.log(INFO, "Reassigned objects of legacy user {0}", legacyUsername);
    } catch (final SQLException e) {
      LOGGER.log(
          WARNING, "Could not migrate objects of legacy user {0}: {1}", legacyUsername, e.getMessage());
    }
  }

  @Override
  public void dropUser(final String bindingId, final String database) {
    final var session = requireOpen();
    final var username = CredentialVault.username(bindingId);
    final var legacy = CredentialVault.legacyUsername(bindingId);
    try {
      final var dropped =
          session.inTransaction(
              conn -> {
                if (dropRole(session, username, database)) return username;
                LOGGER.log(INFO, "User {0} does not exist, trying {1}", username, legacy);
                if (dropRole(session, legacy, database)) return legacy;
                LOGGER.log(INFO, "User {0} does not exist either", legacy);
                return null;
              });
      if (dropped != null) {
        state().delete(dropped);
        LOGGER.log(INFO, "Dropped user {0}", dropped);
      }
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to drop user " + username, e);
    }
  }

  private boolean dropRole(final JdbcSession session, final String username, final String database)
      throws SQLException {
    if (!session.exists("SELECT EXISTS(SELECT 1 FROM pg_user WHERE usename = ?)", username)) {
      return false;
    }
    // leftovers are reassigned then dropped; neither may spoil the transaction
    session.execute(
        swallowErrors(
            "REASSIGN OWNED BY "
                + quoteIdentifier(username)
                + " TO "
                + quoteIdentifier(groupName(database))));
    session.execute(swallowErrors("DROP OWNED BY " + quoteIdentifier(username) + " RESTRICT"));
    session.execute("DROP ROLE " + quoteIdentifier(username));
    return true;
  }

  @Override
  public void resetState() {
    final var session = requireOpen();
    LOGGER.log(DEBUG, "Resetting state");
    try {
      final var users =
          session.queryStrings(
              "SELECT usename FROM pg_user WHERE usesuper != true AND usename != current_user");
      session.inTransaction(
          conn -> {
            for (final var user : users) {
              session.execute("DROP OWNED BY " + quoteIdentifier(user));
              session.execute("DROP ROLE " + quoteIdentifier(user));
            }
            return null;
          });
      state().clear();
      LOGGER.log(INFO, "Dropped {0} users", users.size());
    } catch (final SQLException e) {
      throw SqlErrors.translate("failed to reset state", e);
    }
  }

  @Override
  public String uri(final ConnectionSpec spec) {
    final var uri =
        String.format(
            "postgres://%s:%s@%s:%d/%s",
            spec.username(), spec.password(), spec.host(), spec.port(), spec.database());
    return spec.requireTls() ? uri : uri + "?sslmode=disable";
  }

  @Override
  public String jdbcUri(final ConnectionSpec spec) {
    final var params = new TreeMap<String, String>();
    params.put("user", spec.username());
    params.put("password", spec.password());
    if (spec.requireTls()) params.put("ssl", "true");
    final var query =
        params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    return String.format(
        "jdbc:postgresql://%s:%d/%s?%s", spec.host(), spec.port(), spec.database(), query);
  }

  @Override
  public void createExtensions(final List<String> extensions) {
    final var session = requireOpen();
    for (final var extension : extensions) {
      try {
        session.execute("CREATE EXTENSION IF NOT EXISTS " + quoteIdentifier(extension));
      } catch (final SQLException e) {
        throw SqlErrors.translate("failed to create extension " + extension, e);
      }
    }
  }

  @Override
  public void dropExtensions(final List<String> extensions) {
    final var session = requireOpen();
    for (final var extension : extensions) {
      try {
        session.execute("DROP EXTENSION IF EXISTS " + quoteIdentifier(extension));
      } catch (final SQLException e) {
        throw SqlErrors.translate("failed to drop extension " + extension, e);
      }
    }
  }

  static String groupName(final String database) {
    return database + "_manager";
  }

  private JdbcSession requireOpen() {
    if (session == null) throw new IllegalStateException("driver is not open");
    return session;
  }

  private PostgresStateStore state() throws SQLException {
    if (state == null) {
      state = PostgresStateStore.open(session, factory, spec, stateDatabase, vault);
    }
    return state;
  }

  private static String doBlock(final String plpgsql) {
    return "DO " + quoteLiteral(plpgsql);
  }

  private static String swallowErrors(final String statement) {
    return doBlock(
        "\nBEGIN\n\tDECLARE\n\t\tmessage text;\n\tBEGIN\n\t\t"
            + statement
            + ";\n\tEXCEPTION\n\t\tWHEN OTHERS THEN\n"
            + "\t\t\tGET STACKED DIAGNOSTICS message = MESSAGE_TEXT;\n"
            + "\t\t\tRAISE WARNING 'swallowed ERROR: %', message;\n\tEND;\nEND;\n");
  }

  private static String ensureGroup(final String group) {
    return "\nbegin\n"
        + "\tIF NOT EXISTS (select 1 from pg_catalog.pg_roles where rolname = "
        + quoteLiteral(group)
        + ") THEN\n"
        + "\t\tCREATE ROLE "
        + quoteIdentifier(group)
        + ";\n"
        + "\tEND IF;\n"
        + "end\n";
  }

  private static List<String> ensureTrigger(final String group) {
    final var quotedGroup = quoteLiteral(quoteIdentifier(group));
    final var function =
        "\ndeclare\n"
            + "\tr record;\n"
            + "begin\n"
            + "\t-- pg < 10 has no default privileges for schemas, emulate them\n"
            + "\tIF current_setting('server_version_num')::integer < 100000 THEN\n"
            + "\t\tFOR r IN SELECT object_identity FROM pg_event_trigger_ddl_commands() WHERE command_tag = 'CREATE SCHEMA' LOOP\n"
            + "\t\t\tEXECUTE 'GRANT ALL ON SCHEMA ' || r.object_identity || ' TO ' || "
            + quotedGroup
            + ";\n"
            + "\t\t\tEXECUTE 'REVOKE ALL ON SCHEMA ' || r.object_identity || ' FROM PUBLIC';\n"
            + "\t\tEND LOOP;\n"
            + "\tEND IF;\n"
            + "\n"
            + "\tIF EXISTS (select 1 from pg_catalog.pg_roles where rolname = 'rds_superuser')\n"
            + "\tAND pg_has_role(current_user, 'rds_superuser', 'member') THEN\n"
            + "\t\tRETURN;\n"
            + "\tEND IF;\n"
            + "\n"
            + "\tIF NOT pg_has_role(current_user, "
            + quoteLiteral(group)
            + ", 'member') THEN\n"
            + "\t\tRETURN;\n"
            + "\tEND IF;\n"
            + "\n"
            + "\tIF EXISTS (SELECT 1 FROM pg_user WHERE usename = current_user and usesuper = true) THEN\n"
            + "\t\tRETURN;\n"
            + "\tEND IF;\n"
            + "\n"
            + "\tEXECUTE 'reassign owned by ' || quote_ident(current_user) || ' to ' || "
            + quotedGroup
            + ";\n"
            + "end\n";
    return List.of(
        "create or replace function reassign_owned() returns event_trigger language plpgsql as "
            + quoteLiteral(function),
        "drop event trigger if exists reassign_owned",
        "create event trigger reassign_owned on ddl_command_end execute procedure reassign_owned()");
  }

  private static String ensurePublicPrivileges(final String database) {
    return "\ndeclare\n"
        + "\tr record;\n"
        + "begin\n"
        + "\t-- PUBLIC must lose these before they can be restricted per user\n"
        + "\tALTER DEFAULT PRIVILEGES REVOKE ALL ON TABLES FROM PUBLIC;\n"
        + "\tALTER DEFAULT PRIVILEGES REVOKE ALL ON SEQUENCES FROM PUBLIC;\n"
        + "\tIF current_setting('server_version_num')::integer >= 100000 THEN\n"
        + "\t\tEXECUTE 'ALTER DEFAULT PRIVILEGES REVOKE ALL ON SCHEMAS FROM PUBLIC';\n"
        + "\tEND IF;\n"
        + "\n"
        + "\tREVOKE ALL ON DATABASE "
        + quoteIdentifier(database)
        + " FROM PUBLIC;\n"
        + "\n"
        + "\t-- privileges not controlled per user stay with PUBLIC\n"
        + "\tALTER DEFAULT PRIVILEGES GRANT ALL ON FUNCTIONS TO PUBLIC;\n"
        + "\tALTER DEFAULT PRIVILEGES GRANT ALL ON TYPES TO PUBLIC;\n"
        + "\n"
        + "\t"
        + SCHEMA_LOOP
        + "\n"
        + "\t\tEXECUTE 'REVOKE ALL ON ALL TABLES IN SCHEMA ' || quote_ident(r.schema_name) || ' FROM PUBLIC';\n"
        + "\t\tEXECUTE 'REVOKE ALL ON ALL SEQUENCES IN SCHEMA ' || quote_ident(r.schema_name) || ' FROM PUBLIC';\n"
        + "\t\tEXECUTE 'REVOKE ALL ON SCHEMA ' || quote_ident(r.schema_name) || ' FROM PUBLIC';\n"
        + "\t\tEXECUTE 'GRANT ALL ON ALL FUNCTIONS IN SCHEMA ' || quote_ident(r.schema_name) || ' TO PUBLIC';\n"
        + "\tEND LOOP;\n"
        + "\n"
        + "\tFOR r IN SELECT user_defined_type_schema, user_defined_type_name FROM information_schema.user_defined_types LOOP\n"
        + "\t\tEXECUTE 'GRANT ALL ON TYPE ' || quote_ident(r.user_defined_type_schema) || '.' || quote_ident(r.user_defined_type_name) || ' TO PUBLIC';\n"
        + "\tEND LOOP;\n"
        + "\n"
        + "\tFOR r IN SELECT domain_schema, domain_name FROM information_schema.domains LOOP\n"
        + "\t\tEXECUTE 'GRANT ALL ON DOMAIN ' || quote_ident(r.domain_schema) || '.' || quote_ident(r.domain_name) || ' TO PUBLIC';\n"
        + "\tEND LOOP;\n"
        + "\n"
        + "\tFOR r IN SELECT lanname FROM pg_catalog.pg_language WHERE lanpltrusted LOOP\n"
        + "\t\tEXECUTE 'GRANT ALL ON LANGUAGE ' || quote_ident(r.lanname) || ' TO PUBLIC';\n"
        + "\tEND LOOP;\n"
        + "end\n";
  }

  private static String ensureUser(final String username, final String password) {
    return "\nBEGIN\n"
        + "\tIF NOT EXISTS (SELECT 1 FROM pg_catalog.pg_user WHERE usename = "
        + quoteLiteral(username)
        + ") THEN\n"
        + "\t\tCREATE USER "
        + quoteIdentifier(username)
        + " WITH PASSWORD "
        + quoteLiteral(password)
        + ";\n"
        + "\tELSE\n"
        + "\t\tALTER USER "
        + quoteIdentifier(username)
        + " WITH PASSWORD "
        + quoteLiteral(password)
        + ";\n"
        + "\tEND IF;\n"
        + "END\n";
  }

  private static String ensureGroupPrivileges(final String database, final String group) {
    final var quotedGroup = quoteLiteral(quoteIdentifier(group));
    return "\ndeclare\n"
        + "\tr record;\n"
        + "begin\n"
        + "\t"
        + SCHEMA_LOOP
        + "\n"
        + "\t\tEXECUTE 'GRANT ALL ON ALL TABLES IN SCHEMA ' || quote_ident(r.schema_name) || ' TO ' || "
        + quotedGroup
        + ";\n"
        + "\t\tEXECUTE 'GRANT ALL ON ALL SEQUENCES IN SCHEMA ' || quote_ident(r.schema_name) || ' TO ' || "
        + quotedGroup
        + ";\n"
        + "\t\tEXECUTE 'GRANT ALL ON SCHEMA ' || quote_ident(r.schema_name) || ' TO ' || "
        + quotedGroup
        + ";\n"
        + "\tEND LOOP;\n"
        + "\n"
        + "\tGRANT ALL ON DATABASE "
        + quoteIdentifier(database)
        + " TO "
        + quoteIdentifier(group)
        + ";\n"
        + "\n"
        + "\tALTER DEFAULT PRIVILEGES GRANT ALL ON TABLES TO "
        + quoteIdentifier(group)
        + ";\n"
        + "\tALTER DEFAULT PRIVILEGES GRANT ALL ON SEQUENCES TO "
        + quoteIdentifier(group)
        + ";\n"
        + "\tIF current_setting('server_version_num')::integer >= 100000 THEN\n"
        + "\t\tEXECUTE 'ALTER DEFAULT PRIVILEGES GRANT ALL ON SCHEMAS TO ' || "
        + quotedGroup
        + ";\n"
        + "\tEND IF;\n"
        + "end\n";
  }

  private static String nonOwnerRestrictions(final String username, final String database) {
    return "\ndeclare\n"
        + "\tr record;\n"
        + "begin\n"
        + "\t-- CREATE would let non-owners own objects\n"
        + "\t"
        + SCHEMA_LOOP
        + "\n"
        + "\t\tEXECUTE 'REVOKE CREATE ON SCHEMA ' || quote_ident(r.schema_name) || ' FROM ' || "
        + quoteLiteral(quoteIdentifier(username))
        + ";\n"
        + "\tEND LOOP;\n"
        + "\n"
        + "\tREVOKE CREATE ON DATABASE "
        + quoteIdentifier(database)
        + " FROM "
        + quoteIdentifier(username)
        + ";\n"
        + "end\n";
  }

  @Override
  public String toString() {
    return "PostgresDriver[" + spec + "]";
  }
}
