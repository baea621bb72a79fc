/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.lazyconnect;

import java.util.Map;
import java.util.Optional;

import io.classicrouter.proxy.internal.SystemVariables;
import io.classicrouter.proxy.protocol.Value;

/**
 * Builds the statement that restores a client's session variables on a server connection.
 */
public final class SessionVariableStatements {

    static final String SESSION_TRACK_SYSTEM_VARIABLES = "session_track_system_variables";
    static final String STATEMENT_ID = "statement_id";

    private SessionVariableStatements() {
    }

    /**
     * Builds a single {@code SET @@SESSION.name = value, ...} statement for all variables.
     * <p>
     * {@code statement_id} is read-only and never set. {@code session_track_system_variables}
     * always comes first, so the server tracks the changes of all variables that follow.
     * </p>
     * <p>
     * With {@code needSessionTrackers}, the session trackers the router relies on are switched
     * on unless the client has set them itself.
     * </p>
     *
     * @param systemVariables variables to set
     * @param needSessionTrackers whether the server has to track session state changes
     * @return the statement, empty if there is nothing to set
     */
    public static Optional<String> setSessionVariables(SystemVariables systemVariables, boolean needSessionTrackers) {
        StringBuilder stmt = new StringBuilder();

        Value trackSystemVariables = systemVariables.get(SESSION_TRACK_SYSTEM_VARIABLES);
        if (needSessionTrackers) {
            setSessionVariable(stmt, SESSION_TRACK_SYSTEM_VARIABLES,
                    trackSystemVariables.isNull() ? Value.of("*") : trackSystemVariables);
        }
        else if (!trackSystemVariables.isNull()) {
            setSessionVariable(stmt, SESSION_TRACK_SYSTEM_VARIABLES, trackSystemVariables);
        }

        for (Map.Entry<String, Value> variable : systemVariables) {
            String name = variable.getKey();
            if (name.equals(SESSION_TRACK_SYSTEM_VARIABLES) || name.equals(STATEMENT_ID)) {
                continue;
            }
            setSessionVariable(stmt, name, variable.getValue());
        }

        if (needSessionTrackers) {
            setSessionVariableIfNotSet(stmt, systemVariables, "session_track_gtids", Value.of("OWN_GTID"));
            setSessionVariableIfNotSet(stmt, systemVariables, "session_track_transaction_info", Value.of("CHARACTERISTICS"));
            setSessionVariableIfNotSet(stmt, systemVariables, "session_track_state_change", Value.of("ON"));
        }

        return stmt.length() == 0 ? Optional.empty() : Optional.of(stmt.toString());
    }

    private static void setSessionVariable(StringBuilder stmt, String name, Value value) {
        if (stmt.length() == 0) {
            stmt.append("SET ");
        }
        else {
            stmt.append(",\n    ");
        }
        stmt.append("@@SESSION.").append(name).append(" = ").append(value.toSqlLiteral());
    }

    private static void setSessionVariableIfNotSet(StringBuilder stmt, SystemVariables systemVariables, String name, Value value) {
        if (systemVariables.get(name).isNull()) {
            setSessionVariable(stmt, name, value);
        }
    }
}
