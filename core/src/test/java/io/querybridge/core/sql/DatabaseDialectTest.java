package io.querybridge.core.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.querybridge.core.error.ConfigValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DatabaseDialect")
class DatabaseDialectTest {

    private final DatabaseDialectFactory factory = new DatabaseDialectFactory();
    private final DatabaseDialect postgres = factory.dialect(DatabaseType.POSTGRESQL);
    private final DatabaseDialect mysql = factory.dialect(DatabaseType.MYSQL);
    private final DatabaseDialect sqlite = factory.dialect(DatabaseType.SQLITE);

    @Nested
    @DisplayName("identifiers and literals")
    class Identifiers {

        @Test
        @DisplayName("dotted names are quoted per part")
        void quotesDottedNames() {
            assertThat(postgres.quoteIdentifier("public.users")).isEqualTo("\"public\".\"users\"");
            assertThat(mysql.quoteIdentifier("shop.orders")).isEqualTo("`shop`.`orders`");
        }

        @Test
        @DisplayName("names outside the identifier grammar are refused")
        void rejectsInvalidNames() {
            assertThat(postgres.isValidIdentifier("a.b.c")).isFalse();
            assertThatThrownBy(() -> postgres.quoteIdentifier("users;drop"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid identifier: users;drop");
        }

        @Test
        @DisplayName("MySQL literals escape backslashes as well as quotes")
        void literals() {
            assertThat(postgres.quoteLiteral("it's")).isEqualTo("'it''s'");
            assertThat(mysql.quoteLiteral("it's \\ here")).isEqualTo("'it''s \\\\ here'");
        }
    }

    @Test
    @DisplayName("placeholders follow the dialect")
    void placeholders() {
        assertThat(postgres.placeholder(0)).isEqualTo("$1");
        assertThat(postgres.placeholder(4)).isEqualTo("$5");
        assertThat(mysql.placeholder(3)).isEqualTo("?");
        assertThat(sqlite.placeholder(0)).isEqualTo("?");
    }

    @Test
    @DisplayName("LIMIT omits a zero OFFSET and rejects bad bounds")
    void limitClause() {
        assertThat(postgres.limitClause(10, 0)).isEqualTo("LIMIT 10");
        assertThat(postgres.limitClause(10, 5)).isEqualTo("LIMIT 10 OFFSET 5");
        assertThatThrownBy(() -> postgres.limitClause(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> postgres.limitClause(5, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("JOIN types are normalized and validated")
    void joins() {
        assertThat(mysql.joinClause(" left ", "`stock`", "a = b")).isEqualTo("LEFT JOIN `stock` ON a = b");
        assertThatThrownBy(() -> mysql.joinClause("CROSS", "`stock`", "a = b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("full-text predicates per dialect")
    void fullText() {
        assertThat(postgres.searchPredicate("\"body\"", "$1", true))
                .isEqualTo("to_tsvector(\"body\") @@ plainto_tsquery($1)");
        assertThat(sqlite.searchPredicate("\"body\"", "?", true)).isEqualTo("\"body\" MATCH ?");
        assertThat(sqlite.searchPredicate("\"body\"", "?", false)).isEqualTo("LOWER(\"body\") LIKE LOWER(?)");
    }

    @ParameterizedTest(name = "{0} accepts {1}: {2}")
    @CsvSource({
        "POSTGRESQL, postgresql://db/catalog, true",
        "POSTGRESQL, postgres://db/catalog, true",
        "POSTGRESQL, mysql://db/catalog, false",
        "MYSQL, mysql://db/catalog, true",
        "SQLITE, sqlite:catalog, true",
        "SQLITE, /var/data/catalog.db, true",
        "SQLITE, /var/data/catalog.txt, false"
    })
    @DisplayName("connection string shapes")
    void connectionStrings(DatabaseType type, String connectionString, boolean valid) {
        assertThat(factory.dialect(type).isValidConnectionString(connectionString)).isEqualTo(valid);
    }

    @Test
    @DisplayName("credentials and password parameters are redacted")
    void redaction() {
        assertThat(DatabaseDialect.redactConnectionString("mysql://app:secret@db/catalog?password=x&ssl=true"))
                .isEqualTo("mysql://***:***@db/catalog?password=***&ssl=true");
        assertThat(DatabaseDialect.redactConnectionString(null)).isNull();
    }

    @Test
    @DisplayName("MySQL features depend on the server version")
    void mysqlVersionFeatures() {
        DialectFeatures legacy = factory.dialect(DatabaseType.MYSQL, "5.7.42").features();
        DialectFeatures ancient = factory.dialect(DatabaseType.MYSQL, "4.1").features();

        assertThat(legacy.windowFunctions()).isFalse();
        assertThat(legacy.cte()).isFalse();
        assertThat(legacy.json()).isTrue();
        assertThat(ancient.json()).isFalse();
        assertThat(mysql.features().windowFunctions()).isTrue();
    }

    @Test
    @DisplayName("factory caches one dialect per type and version")
    void factoryCaches() {
        DatabaseDialectFactory fresh = new DatabaseDialectFactory();

        DatabaseDialect first = fresh.dialect(DatabaseType.MYSQL, "8.0");
        DatabaseDialect second = fresh.dialect(DatabaseType.MYSQL, " 8.0 ");
        fresh.dialect(DatabaseType.MYSQL);

        assertThat(second).isSameAs(first);
        assertThat(fresh.size()).isEqualTo(2);
        assertThat(first).hasToString("mysql-8.0");
    }

    @Test
    @DisplayName("database type identifiers accept the postgres alias")
    void typeIds() {
        assertThat(DatabaseType.fromId(" Postgres ")).isEqualTo(DatabaseType.POSTGRESQL);
        assertThat(DatabaseType.fromId("sqlite")).isEqualTo(DatabaseType.SQLITE);
        assertThatThrownBy(() -> DatabaseType.fromId("oracle"))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessage("Unsupported database type: oracle");
    }
}
