package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.ChangeType;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.TableModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lakeshift.testing.Tables.column;
import static org.lakeshift.testing.Tables.notNull;
import static org.lakeshift.testing.Tables.table;

class ColumnDifferTest {

    private ColumnDiffer columnDiffer;
    private List<Change> changes;

    @BeforeEach
    void setUp() {
        columnDiffer = new ColumnDiffer();
        changes = new ArrayList<>();
    }

    @Test
    @DisplayName("새로운 컬럼은 ADD_COLUMN 으로 감지")
    void detectsAddedColumn() {
        TableModel before = table("users", notNull("id", "BIGINT")).build();
        TableModel after = table("users", notNull("id", "BIGINT"), column("email", "STRING")).build();

        columnDiffer.diff(before, after, changes);

        assertThat(changes).hasSize(1);
        Change change = changes.get(0);
        assertThat(change.getType()).isEqualTo(ChangeType.ADD_COLUMN);
        assertThat(((ChangeDetail.AddColumn) change.getDetail()).column().getName()).isEqualTo("email");
        assertThat(change.isDestructive()).isFalse();
    }

    @Test
    @DisplayName("삭제된 컬럼은 destructive + column mapping 필요")
    void droppedColumnIsDestructive() {
        TableModel before = table("users", notNull("id", "BIGINT"), column("legacy", "STRING")).build();
        TableModel after = table("users", notNull("id", "BIGINT")).build();

        columnDiffer.diff(before, after, changes);

        assertThat(changes).hasSize(1);
        Change change = changes.get(0);
        assertThat(change.getType()).isEqualTo(ChangeType.DROP_COLUMN);
        assertThat(change.isDestructive()).isTrue();
        assertThat(change.isRequiresColumnMapping()).isTrue();
        assertThat(change.isUnsupported()).isFalse();
    }

    @Test
    void addedColumnsAreOrderedByName() {
        TableModel before = table("t", column("id", "INT")).build();
        TableModel after = table("t", column("id", "INT"), column("zip", "STRING"), column("age", "INT")).build();

        columnDiffer.diff(before, after, changes);

        assertThat(changes).extracting(c -> ((ChangeDetail.AddColumn) c.getDetail()).column().getName())
                .containsExactly("age", "zip");
    }

    @Test
    @DisplayName("INT -> BIGINT 확장은 지원")
    void wideningTypeChangeIsSupported() {
        columnDiffer.diff(table("t", column("n", "INT")).build(), table("t", column("n", "BIGINT")).build(), changes);

        assertThat(changes).hasSize(1);
        Change change = changes.get(0);
        assertThat(change.getType()).isEqualTo(ChangeType.ALTER_COLUMN_TYPE);
        assertThat(change.isUnsupported()).isFalse();
        ChangeDetail.AlterColumnType detail = (ChangeDetail.AlterColumnType) change.getDetail();
        assertThat(detail.fromType()).isEqualTo("INT");
        assertThat(detail.toType()).isEqualTo("BIGINT");
    }

    @Test
    @DisplayName("BIGINT -> INT 축소는 unsupported")
    void narrowingTypeChangeIsUnsupported() {
        columnDiffer.diff(table("t", column("n", "BIGINT")).build(), table("t", column("n", "INT")).build(), changes);

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).isUnsupported()).isTrue();
        assertThat(changes.get(0).getErrorMessage()).contains("BIGINT").contains("INT");
    }

    @Test
    void decimalReparameterisationIsUnsupported() {
        columnDiffer.diff(table("t", column("amount", "DECIMAL(10,2)")).build(),
                table("t", column("amount", "DECIMAL(12,2)")).build(), changes);

        assertThat(changes).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(ChangeType.ALTER_COLUMN_TYPE);
            assertThat(c.isUnsupported()).isTrue();
        });
    }

    @Test
    @DisplayName("공백/대소문자만 다른 타입은 변경이 아님")
    void typeSpellingDifferencesAreIgnored() {
        columnDiffer.diff(table("t", column("amount", "decimal(10, 2)")).build(),
                table("t", column("amount", "DECIMAL(10,2)")).build(), changes);

        assertThat(changes).isEmpty();
    }

    @Test
    void detectsNullabilityAndDefaultChanges() {
        ColumnModel before = ColumnModel.builder().name("status").type("STRING").build();
        ColumnModel after = ColumnModel.builder().name("status").type("STRING").nullable(false).defaultValue("'active'").build();

        columnDiffer.diff(table("t", before).build(), table("t", after).build(), changes);

        assertThat(changes).extracting(Change::getType)
                .containsExactly(ChangeType.ALTER_COLUMN_NULLABILITY, ChangeType.ALTER_COLUMN_DEFAULT);
        ChangeDetail.AlterColumnNullability nullability = (ChangeDetail.AlterColumnNullability) changes.get(0).getDetail();
        assertThat(nullability.fromNullable()).isTrue();
        assertThat(nullability.toNullable()).isFalse();
        ChangeDetail.AlterColumnDefault def = (ChangeDetail.AlterColumnDefault) changes.get(1).getDetail();
        assertThat(def.fromDefault()).isNull();
        assertThat(def.toDefault()).isEqualTo("'active'");
    }
}
