/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.lazyconnect;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.classicrouter.proxy.protocol.Eof;
import io.classicrouter.proxy.protocol.OkMessage;
import io.classicrouter.proxy.protocol.Row;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.Value;

import static org.assertj.core.api.Assertions.assertThat;

class FailedQueryHandlerTest {

    private final List<ServerError> failures = new ArrayList<>();
    private final FailedQueryHandler handler = new FailedQueryHandler(failures::add, "SET @@SESSION.sql_mode = 'ANSI'");

    @Test
    void successIsIgnored() {
        handler.onOk(new OkMessage(0, 0, 0, 0));
        handler.onColumnCount(1);
        handler.onRow(Row.of(Value.of("1")));
        handler.onRowEnd(new Eof(0, 0));

        assertThat(failures).isEmpty();
    }

    @Test
    void errorFails() {
        ServerError error = new ServerError(1231, "Variable 'sql_mode' can't be set to the value of 'X'", "42000");

        handler.onError(error);

        assertThat(failures).containsExactly(error);
    }
}
