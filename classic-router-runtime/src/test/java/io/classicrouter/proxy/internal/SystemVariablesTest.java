/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.classicrouter.proxy.protocol.Value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SystemVariablesTest {

    private final SystemVariables sysvars = new SystemVariables();

    @Test
    void untrackedVariableReadsAsNull() {
        assertThat(sysvars.get("sql_mode")).isEqualTo(Value.NULL);
        assertThat(sysvars.find("sql_mode")).isEmpty();
        assertThat(sysvars.isEmpty()).isTrue();
    }

    @Test
    void nullValueIsTracked() {
        sysvars.set("character_set_results", Value.NULL);

        assertThat(sysvars.get("character_set_results").isNull()).isTrue();
        assertThat(sysvars.find("character_set_results")).contains(Value.NULL);
        assertThat(sysvars.size()).isEqualTo(1);
    }

    @Test
    void setReplaces() {
        sysvars.set("autocommit", Value.of("ON"));
        sysvars.set("autocommit", Value.of("OFF"));

        assertThat(sysvars.get("autocommit")).isEqualTo(Value.of("OFF"));
        assertThat(sysvars.size()).isEqualTo(1);
    }

    @Test
    void iteratesByName() {
        sysvars.set("time_zone", Value.of("+00:00"));
        sysvars.set("autocommit", Value.of("ON"));
        sysvars.set("sql_mode", Value.of("ANSI"));

        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Value> entry : sysvars) {
            names.add(entry.getKey());
        }

        assertThat(names).containsExactly("autocommit", "sql_mode", "time_zone");
    }

    @Test
    void iterationIsReadOnly() {
        sysvars.set("autocommit", Value.of("ON"));

        var iterator = sysvars.iterator();
        iterator.next();

        assertThatThrownBy(iterator::remove).isInstanceOf(UnsupportedOperationException.class);
    }
}
