package org.lakeshift.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Foreign key reference of a single column.
 * <p>
 * Informational only: the engine never checks referential integrity. Useful for query
 * hints, BI tooling and documentation.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class ForeignKeyModel {
    @JsonProperty("table")
    private final String table;
    @JsonProperty("column")
    private final String column;

    public static ForeignKeyModel of(String table, String column) {
        return ForeignKeyModel.builder().table(table).column(column).build();
    }
}
