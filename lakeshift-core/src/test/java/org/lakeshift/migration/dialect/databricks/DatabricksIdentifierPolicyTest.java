package org.lakeshift.migration.dialect.databricks;

import org.lakeshift.exception.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabricksIdentifierPolicyTest {

    private final DatabricksIdentifierPolicy policy = new DatabricksIdentifierPolicy();

    @ParameterizedTest
    @ValueSource(strings = {"main", "_lakeshift_migrations", "Sales2024", "a"})
    void acceptsPlainIdentifiers(String raw) {
        assertThat(policy.isValid(raw)).isTrue();
        assertThat(policy.requireValid("catalog", raw)).isEqualTo(raw);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1abc", "with-dash", "a.b", "x; DROP TABLE y", "`quoted`"})
    void rejectsEverythingElse(String raw) {
        assertThat(policy.isValid(raw)).isFalse();
        assertThatThrownBy(() -> policy.requireValid("schema", raw))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("Invalid schema identifier '" + raw + "'");
    }

    @Test
    void nullIsInvalid() {
        assertThat(policy.isValid(null)).isFalse();
    }
}
