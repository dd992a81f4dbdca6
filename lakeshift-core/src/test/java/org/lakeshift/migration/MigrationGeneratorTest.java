package org.lakeshift.migration;

import org.lakeshift.exception.CodegenException;
import org.lakeshift.migration.differs.SchemaDiffer;
import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lakeshift.testing.Tables.column;
import static org.lakeshift.testing.Tables.notNull;
import static org.lakeshift.testing.Tables.table;
import static org.lakeshift.testing.Tables.users;

class MigrationGeneratorTest {

    private MigrationGenerator generator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:30:00Z"), ZoneOffset.UTC);
        generator = new MigrationGenerator(clock);
    }

    @Test
    @DisplayName("헤더는 설명/생성 시각/치환 변수 안내를 포함")
    void headerLines() {
        String sql = generator.generate(List.of(Change.of("users", new ChangeDetail.CreateTable(users()))), "Create users");

        assertThat(sql).startsWith("-- Migration: Auto-generated\n"
                + "-- Description: Create users\n"
                + "-- Generated: 2024-01-15T10:30:00\n"
                + "\n"
                + "-- Variable substitution: ${catalog}, ${schema}\n"
                + "\n");
    }

    @Test
    void createTableBlock() {
        String sql = generator.generate(new SchemaDiffer().diff(SchemaModel.empty(), SchemaModel.of(users())), "init");

        assertThat(sql).contains("-- create_table: users\n"
                + "CREATE TABLE IF NOT EXISTS ${catalog}.${schema}.users (\n"
                + "    id BIGINT NOT NULL,\n"
                + "    email STRING,\n"
                + "    CONSTRAINT pk_users PRIMARY KEY (id) NORELY\n"
                + ") USING DELTA;");
    }

    @Test
    @DisplayName("clustering 이 있으면 PARTITIONED BY 는 출력하지 않음")
    void createTableWithLayoutPropertiesAndComment() {
        TableModel events = table("events", notNull("id", "BIGINT"), column("day", "DATE"))
                .liquidClustering(List.of("day", "id"))
                .partitionedBy(List.of("day"))
                .tableProperties(Map.of("delta.enableChangeDataFeed", "true"))
                .comment("User's events")
                .build();

        String sql = generator.generate(List.of(Change.of("events", new ChangeDetail.CreateTable(events))), "events");

        assertThat(sql).contains(") USING DELTA\n"
                + "CLUSTER BY (day, id)\n"
                + "TBLPROPERTIES ('delta.enableChangeDataFeed' = 'true')\n"
                + "COMMENT 'User''s events';");
        assertThat(sql).doesNotContain("PARTITIONED BY");
    }

    @Test
    void partitionedCreateTable() {
        TableModel events = table("events", column("day", "DATE")).partitionedBy(List.of("day")).build();

        String sql = generator.generate(List.of(Change.of("events", new ChangeDetail.CreateTable(events))), "events");

        assertThat(sql).contains(") USING DELTA\nPARTITIONED BY (day);");
    }

    @Test
    void columnDefinitionIncludesGeneratedDefaultAndComment() {
        ColumnModel created = ColumnModel.builder().name("created_date").type("DATE")
                .generated("ALWAYS AS (CAST(created_at AS DATE))").build();
        ColumnModel status = ColumnModel.builder().name("status").type("STRING").nullable(false)
                .defaultValue("'active'").comment("it's the status").build();
        TableModel t = table("t", created, status).build();

        String sql = generator.generate(List.of(Change.of("t", new ChangeDetail.CreateTable(t))), "t");

        assertThat(sql).contains("    created_date DATE GENERATED ALWAYS AS (CAST(created_at AS DATE)),\n");
        assertThat(sql).contains("    status STRING NOT NULL DEFAULT 'active' COMMENT 'it''s the status'\n");
    }

    @Test
    @DisplayName("unsupported 변경이 하나라도 있으면 전체 배치 거부")
    void unsupportedChangesRejectWholeBatch() {
        TableModel before = table("events", column("day", "DATE"), column("n", "BIGINT")).partitionedBy(List.of("day")).build();
        TableModel after = table("events", column("day", "DATE"), column("n", "INT"), column("extra", "STRING"))
                .partitionedBy(List.of("n")).build();
        List<Change> changes = new SchemaDiffer().diff(SchemaModel.of(before), SchemaModel.of(after));

        assertThatThrownBy(() -> generator.generate(changes, "bad"))
                .isInstanceOf(CodegenException.class)
                .hasMessageStartingWith("Cannot generate migration - unsupported changes:")
                .hasMessageContaining("-- ERROR: alter_column_type: events.n: Type change from BIGINT to INT")
                .hasMessageContaining("-- ERROR: alter_partitioning: events: Cannot change partitioning for table 'events'")
                .satisfies(e -> assertThat(((CodegenException) e).getErrors()).hasSize(2));
    }

    @Test
    @DisplayName("같은 타입 변경이 여러 테이블에 있어도 오류 줄로 구분된다")
    void rejectedChangesNameTheirTableAndColumn() {
        List<Change> changes = new SchemaDiffer().diff(
                SchemaModel.of(table("orders", column("qty", "BIGINT")).build(), table("users", column("qty", "BIGINT")).build()),
                SchemaModel.of(table("orders", column("qty", "INT")).build(), table("users", column("qty", "INT")).build()));

        assertThatThrownBy(() -> generator.generate(changes, "narrow"))
                .isInstanceOf(CodegenException.class)
                .hasMessageContaining("-- ERROR: alter_column_type: orders.qty: Type change from BIGINT to INT")
                .hasMessageContaining("-- ERROR: alter_column_type: users.qty: Type change from BIGINT to INT");
    }

    @Test
    void nonNullableColumnWithoutDefaultCannotBeAdded() {
        List<Change> changes = List.of(Change.of("users", new ChangeDetail.AddColumn(notNull("age", "INT"))));

        assertThatThrownBy(() -> generator.generate(changes, "x"))
                .isInstanceOf(CodegenException.class)
                .hasMessage("Cannot add non-nullable column 'age' without a default.");
    }

    @Test
    void addColumnWithDefault() {
        ColumnModel age = ColumnModel.builder().name("age").type("INT").nullable(false).defaultValue("0").build();

        String sql = generator.generate(List.of(Change.of("users", new ChangeDetail.AddColumn(age))), "x");

        assertThat(sql).contains("ALTER TABLE ${catalog}.${schema}.users ADD COLUMN IF NOT EXISTS age INT NOT NULL DEFAULT 0;");
    }

    @Test
    @DisplayName("destructive 변경은 경고 블록과 column mapping 안내를 출력")
    void destructiveWarningAndColumnMappingNote() {
        TableModel before = table("users", notNull("id", "BIGINT"), column("legacy", "STRING")).build();
        TableModel after = table("users", notNull("id", "BIGINT")).build();
        List<Change> changes = new SchemaDiffer().diff(SchemaModel.of(before), SchemaModel.of(after));

        String sql = generator.generate(changes, "drop legacy");

        assertThat(sql).contains("-- WARNING: This migration contains destructive changes:\n--   - drop_column: users\n");
        assertThat(sql).contains("-- drop_column: users\n"
                + "-- Requires: delta.columnMapping.mode = 'name'\n"
                + "ALTER TABLE ${catalog}.${schema}.users DROP COLUMN IF EXISTS legacy;");
    }

    @Test
    void dropTableIsRenderedAsComment() {
        Change drop = Change.builder().tableName("old").detail(new ChangeDetail.DropTable()).destructive(true).build();

        String sql = generator.generate(List.of(drop), "cleanup");

        assertThat(sql).contains("-- DROP TABLE IF EXISTS ${catalog}.${schema}.old;");
        assertThat(sql).doesNotContain("\nDROP TABLE");
    }

    @Test
    void clusteringChangesCarryOptimizeNote() {
        String sql = generator.generate(List.of(
                Change.of("events", new ChangeDetail.AlterClustering(List.of("a"), List.of("b", "a"))),
                Change.of("logs", new ChangeDetail.AlterClustering(List.of("a"), List.of()))), "cluster");

        assertThat(sql).contains("ALTER TABLE ${catalog}.${schema}.events CLUSTER BY (b, a);\n"
                + "-- Note: Run OPTIMIZE to apply clustering changes");
        assertThat(sql).contains("ALTER TABLE ${catalog}.${schema}.logs CLUSTER BY NONE;");
    }

    @Test
    void alterStatements() {
        String sql = generator.generate(List.of(
                Change.of("t", new ChangeDetail.AlterColumnType("n", "INT", "BIGINT")),
                Change.of("t", new ChangeDetail.AlterColumnNullability("n", true, false)),
                Change.of("t", new ChangeDetail.AlterColumnNullability("m", false, true)),
                Change.of("t", new ChangeDetail.AlterColumnDefault("n", "1", null)),
                Change.of("t", new ChangeDetail.AlterTableProperties(Map.of("owner", "o'neil")))), "alter");

        assertThat(sql)
                .contains("ALTER TABLE ${catalog}.${schema}.t ALTER COLUMN n TYPE BIGINT;")
                .contains("ALTER TABLE ${catalog}.${schema}.t ALTER COLUMN n SET NOT NULL;")
                .contains("ALTER TABLE ${catalog}.${schema}.t ALTER COLUMN m DROP NOT NULL;")
                .contains("ALTER TABLE ${catalog}.${schema}.t ALTER COLUMN n DROP DEFAULT;")
                .contains("ALTER TABLE ${catalog}.${schema}.t SET TBLPROPERTIES ('owner' = 'o''neil');");
    }
}
