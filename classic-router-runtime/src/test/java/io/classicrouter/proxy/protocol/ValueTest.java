/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValueTest {

    @Test
    void nullIsRenderedAsKeyword() {
        assertThat(Value.NULL.toSqlLiteral()).isEqualTo("NULL");
        assertThat(Value.NULL.isNull()).isTrue();
        assertThat(Value.NULL.asOptional()).isEmpty();
    }

    @Test
    void stringIsSingleQuoted() {
        assertThat(Value.of("utf8mb4").toSqlLiteral()).isEqualTo("'utf8mb4'");
        assertThat(Value.of("").toSqlLiteral()).isEqualTo("''");
    }

    @Test
    void quotesAndBackslashesAreEscaped() {
        assertThat(Value.of("O'Brien").toSqlLiteral()).isEqualTo("'O\\'Brien'");
        assertThat(Value.of("C:\\tmp").toSqlLiteral()).isEqualTo("'C:\\\\tmp'");
    }

    @Test
    void textNullIsNotSqlNull() {
        assertThat(Value.of("NULL")).isNotEqualTo(Value.NULL);
        assertThat(Value.of("NULL").toSqlLiteral()).isEqualTo("'NULL'");
    }

    @Test
    void identifierQuoting() {
        assertThat(SqlQuoting.quoted("sql_mode", '`')).isEqualTo("`sql_mode`");
        assertThat(SqlQuoting.quoted("a`b", '`')).isEqualTo("`a\\`b`");
        assertThat(SqlQuoting.quoted("uuid:1-5", '"')).isEqualTo("\"uuid:1-5\"");
    }
}
