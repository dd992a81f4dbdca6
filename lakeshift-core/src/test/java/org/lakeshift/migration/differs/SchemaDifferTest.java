package org.lakeshift.migration.differs;

import org.lakeshift.exception.DiffException;
import org.lakeshift.exception.UnsupportedChangeException;
import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.ChangeType;
import org.lakeshift.model.PrimaryKeyModel;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lakeshift.testing.Tables.column;
import static org.lakeshift.testing.Tables.notNull;
import static org.lakeshift.testing.Tables.table;
import static org.lakeshift.testing.Tables.users;

class SchemaDifferTest {

    private SchemaDiffer differ;

    @BeforeEach
    void setUp() {
        differ = new SchemaDiffer();
    }

    @Test
    @DisplayName("동일한 스키마는 변경 사항이 없어야 함")
    void identicalSchemasProduceNoChanges() {
        SchemaModel schema = SchemaModel.of(users(), table("orders", notNull("id", "BIGINT")).build());

        assertThat(differ.diff(schema, schema)).isEmpty();
    }

    @Test
    void emptyToEmptyIsEmpty() {
        assertThat(differ.diff(SchemaModel.empty(), SchemaModel.empty())).isEmpty();
    }

    @Test
    @DisplayName("새 테이블은 CREATE_TABLE 하나로만 표현")
    void newTableIsSingleCreate() {
        List<Change> changes = differ.diff(SchemaModel.empty(), SchemaModel.of(users()));

        assertThat(changes).hasSize(1);
        Change change = changes.get(0);
        assertThat(change.getType()).isEqualTo(ChangeType.CREATE_TABLE);
        assertThat(change.getTableName()).isEqualTo("users");
        assertThat(((ChangeDetail.CreateTable) change.getDetail()).table()).isEqualTo(users());
    }

    @Test
    @DisplayName("선언에서 빠진 테이블은 삭제하지 않음")
    void tablesMissingFromTargetAreIgnored() {
        SchemaModel source = SchemaModel.of(users(), table("legacy", column("x", "INT")).build());

        assertThat(differ.diff(source, SchemaModel.of(users()))).isEmpty();
    }

    @Test
    void createTablesAreOrderedByName() {
        SchemaModel target = SchemaModel.of(
                table("zeta", column("a", "INT")).build(),
                table("alpha", column("a", "INT")).build(),
                table("mid", column("a", "INT")).build());

        assertThat(differ.diff(SchemaModel.empty(), target))
                .extracting(Change::getTableName)
                .containsExactly("alpha", "mid", "zeta");
    }

    @Test
    @DisplayName("변경 목록은 우선순위 순으로 정렬")
    void changesAreSortedByPriority() {
        TableModel before = table("users", notNull("id", "BIGINT"), column("legacy", "STRING"))
                .tableProperties(Map.of(TableModel.COLUMN_MAPPING_MODE_PROPERTY, "name"))
                .build();
        TableModel after = table("users", notNull("id", "BIGINT"), column("email", "STRING"))
                .primaryKey(PrimaryKeyModel.of(List.of("id"), true))
                .liquidClustering(List.of("id"))
                .tableProperties(Map.of(TableModel.COLUMN_MAPPING_MODE_PROPERTY, "name"))
                .build();
        SchemaModel source = SchemaModel.of(before);
        SchemaModel target = SchemaModel.of(after, table("audit", column("id", "BIGINT")).build());

        List<Change> changes = differ.diff(source, target);

        assertThat(changes).extracting(Change::getType).containsExactly(
                ChangeType.CREATE_TABLE,
                ChangeType.ADD_COLUMN,
                ChangeType.SET_PRIMARY_KEY,
                ChangeType.ALTER_CLUSTERING,
                ChangeType.DROP_COLUMN);
        for (int i = 1; i < changes.size(); i++) {
            assertThat(changes.get(i - 1).getType().priority())
                    .isLessThanOrEqualTo(changes.get(i).getType().priority());
        }
    }

    @Test
    void diffIsDeterministic() {
        TableModel before = table("t", column("a", "INT"), column("b", "INT")).build();
        TableModel after = table("t", column("c", "INT"), column("d", "INT"), column("a", "BIGINT")).build();

        List<Change> first = differ.diff(SchemaModel.of(before), SchemaModel.of(after));
        List<Change> second = differ.diff(SchemaModel.of(before), SchemaModel.of(after));

        assertThat(first).extracting(Change::label).isEqualTo(second.stream().map(Change::label).toList());
        assertThat(first).extracting(c -> c.getDetail().toString())
                .isEqualTo(second.stream().map(c -> c.getDetail().toString()).toList());
    }

    @Test
    @DisplayName("target 기준으로 diff 하면 target 과 같은 스키마가 된다")
    void diffAgainstSelfAfterCreateIsEmpty() {
        SchemaModel target = SchemaModel.of(users());
        List<Change> changes = differ.diff(SchemaModel.empty(), target);

        SchemaModel applied = SchemaModel.of(changes.stream()
                .map(c -> ((ChangeDetail.CreateTable) c.getDetail()).table())
                .toList());

        assertThat(differ.diff(applied, target)).isEmpty();
    }

    @Test
    @DisplayName("differ 내부 오류는 테이블 이름과 함께 DiffException 으로 감싼다")
    void componentFailureIsWrappedInDiffException() {
        TableComponentDiffer broken = (source, target, changes) -> {
            throw new IllegalStateException("boom");
        };
        SchemaDiffer failing = new SchemaDiffer(List.of(broken));
        SchemaModel schema = SchemaModel.of(users());

        assertThatThrownBy(() -> failing.diff(schema, schema))
                .isInstanceOf(DiffException.class)
                .hasMessageContaining("users")
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void lakeshiftExceptionsPassThroughUnwrapped() {
        TableComponentDiffer rejecting = (source, target, changes) -> {
            throw new UnsupportedChangeException(ChangeType.ALTER_COLUMN_TYPE, "nope");
        };
        SchemaModel schema = SchemaModel.of(users());

        assertThatThrownBy(() -> new SchemaDiffer(List.of(rejecting)).diff(schema, schema))
                .isInstanceOf(UnsupportedChangeException.class);
    }
}
