package org.lakeshift.schema;

import org.lakeshift.model.CheckConstraintModel;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.ForeignKeyModel;
import org.lakeshift.model.PrimaryKeyModel;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lakeshift.testing.Tables.column;
import static org.lakeshift.testing.Tables.table;

class SchemaExporterTest {

    @TempDir
    Path tempDir;

    private final SchemaExporter exporter = new SchemaExporter();

    @Test
    @DisplayName("기본값인 필드는 생략")
    void omitsDefaults() {
        String yaml = exporter.exportTable(table("t", column("x", "INT")).build());

        assertThat(yaml).isEqualTo("table: t\ncolumns:\n- name: x\n  type: INT\n");
    }

    @Test
    void keyOrderFollowsSchemaFormat() {
        TableModel t = table("t", column("x", "INT"))
                .comment("c")
                .primaryKey(PrimaryKeyModel.of(List.of("x"), false))
                .liquidClustering(List.of("x"))
                .build();

        Map<String, Object> data = exporter.tableToMap(t);

        assertThat(data.keySet()).containsExactly("table", "comment", "columns", "primary_key", "liquid_clustering");
        assertThat(((Map<?, ?>) data.get("primary_key")).containsKey("rely")).isFalse();
    }

    @Test
    @DisplayName("내보낸 YAML 을 다시 로드하면 같은 스키마")
    void exportThenLoadRoundTrips() throws IOException {
        TableModel users = table("users",
                ColumnModel.builder().name("id").type("BIGINT").nullable(false).build(),
                ColumnModel.builder().name("status").type("STRING").defaultValue("'active'").comment("it's state").build(),
                ColumnModel.builder().name("org_id").type("BIGINT").foreignKey(ForeignKeyModel.of("orgs", "id")).build(),
                ColumnModel.builder().name("day").type("DATE").generated("ALWAYS AS (CAST(ts AS DATE))").build())
                .primaryKey(PrimaryKeyModel.of(List.of("id"), true))
                .checkConstraints(List.of(CheckConstraintModel.of("valid_status", "status IN ('active', 'closed')")))
                .partitionedBy(List.of("day"))
                .tableProperties(Map.of("delta.enableChangeDataFeed", "true"))
                .comment("Users")
                .build();
        TableModel orgs = table("orgs", column("id", "BIGINT")).build();
        SchemaModel schema = SchemaModel.of(users, orgs);

        List<Path> written = exporter.exportToDirectory(schema, tempDir.resolve("out"));

        assertThat(written).extracting(p -> p.getFileName().toString()).containsExactly("orgs.yaml", "users.yaml");
        SchemaModel reloaded = new SchemaLoader().load(tempDir.resolve("out"));
        assertThat(reloaded.getTable("users")).contains(users);
        assertThat(reloaded.getTable("orgs")).contains(orgs);
    }
}
