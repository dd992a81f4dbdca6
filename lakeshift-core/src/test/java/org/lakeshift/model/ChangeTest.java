package org.lakeshift.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeTest {

    @Test
    void labelUsesWireNameAndTable() {
        Change change = Change.of("users", new ChangeDetail.DropColumn("email"));

        assertThat(change.getType()).isEqualTo(ChangeType.DROP_COLUMN);
        assertThat(change.label()).isEqualTo("drop_column: users");
    }

    @Test
    @DisplayName("unsupported 변경은 에러 메시지가 필수")
    void unsupportedRequiresErrorMessage() {
        assertThatThrownBy(() -> Change.builder()
                .tableName("t")
                .detail(new ChangeDetail.DropColumn("c"))
                .unsupported(true)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void priorityOrderFollowsDependencies() {
        assertThat(ChangeType.CREATE_TABLE.priority()).isLessThan(ChangeType.ADD_COLUMN.priority());
        assertThat(ChangeType.ADD_COLUMN.priority()).isLessThan(ChangeType.ALTER_COLUMN_TYPE.priority());
        assertThat(ChangeType.SET_PRIMARY_KEY.priority()).isLessThan(ChangeType.ALTER_CLUSTERING.priority());
        assertThat(ChangeType.DROP_PRIMARY_KEY.priority()).isLessThan(ChangeType.DROP_COLUMN.priority());
        assertThat(ChangeType.DROP_COLUMN.priority()).isLessThan(ChangeType.DROP_TABLE.priority());
    }
}
