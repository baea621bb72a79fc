/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.lazyconnect;

import org.junit.jupiter.api.Test;

import io.classicrouter.proxy.internal.SystemVariables;
import io.classicrouter.proxy.protocol.Value;

import static org.assertj.core.api.Assertions.assertThat;

class SessionVariableStatementsTest {

    private final SystemVariables systemVariables = new SystemVariables();

    @Test
    void nothingToSet() {
        assertThat(SessionVariableStatements.setSessionVariables(systemVariables, false)).isEmpty();
    }

    @Test
    void onlyStatementIdIsNothingToSet() {
        systemVariables.set("statement_id", Value.of("7"));

        assertThat(SessionVariableStatements.setSessionVariables(systemVariables, false)).isEmpty();
    }

    @Test
    void oneAssignmentPerVariable() {
        systemVariables.set("sql_mode", Value.of("ANSI"));
        systemVariables.set("autocommit", Value.of("1"));
        systemVariables.set("time_zone", Value.NULL);
        systemVariables.set("statement_id", Value.of("7"));

        assertThat(SessionVariableStatements.setSessionVariables(systemVariables, false))
                .contains("SET @@SESSION.autocommit = '1',\n" +
                        "    @@SESSION.sql_mode = 'ANSI',\n" +
                        "    @@SESSION.time_zone = NULL");
    }

    @Test
    void valuesAreQuoted() {
        systemVariables.set("init_connect", Value.of("it's a \\ path"));

        assertThat(SessionVariableStatements.setSessionVariables(systemVariables, false))
                .contains("SET @@SESSION.init_connect = 'it\\'s a \\\\ path'");
    }

    @Test
    void trackedSystemVariablesComeFirst() {
        systemVariables.set("autocommit", Value.of("0"));
        systemVariables.set("session_track_system_variables", Value.of("time_zone"));

        assertThat(SessionVariableStatements.setSessionVariables(systemVariables, false))
                .contains("SET @@SESSION.session_track_system_variables = 'time_zone',\n" +
                        "    @@SESSION.autocommit = '0'");
    }

    @Test
    void sessionTrackersAreSwitchedOn() {
        assertThat(SessionVariableStatements.setSessionVariables(systemVariables, true))
                .contains("SET @@SESSION.session_track_system_variables = '*',\n" +
                        "    @@SESSION.session_track_gtids = 'OWN_GTID',\n" +
                        "    @@SESSION.session_track_transaction_info = 'CHARACTERISTICS',\n" +
                        "    @@SESSION.session_track_state_change = 'ON'");
    }

    @Test
    void clientsSessionTrackersAreKept() {
        systemVariables.set("session_track_system_variables", Value.of("sql_mode"));
        systemVariables.set("session_track_gtids", Value.of("ALL_GTIDS"));
        systemVariables.set("session_track_state_change", Value.NULL);

        assertThat(SessionVariableStatements.setSessionVariables(systemVariables, true))
                .contains("SET @@SESSION.session_track_system_variables = 'sql_mode',\n" +
                        "    @@SESSION.session_track_gtids = 'ALL_GTIDS',\n" +
                        "    @@SESSION.session_track_state_change = NULL,\n" +
                        "    @@SESSION.session_track_transaction_info = 'CHARACTERISTICS',\n" +
                        "    @@SESSION.session_track_state_change = 'ON'");
    }
}
