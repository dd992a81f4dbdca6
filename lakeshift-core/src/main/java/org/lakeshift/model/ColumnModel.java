package org.lakeshift.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

@Getter
@Builder(toBuilder = true)
@Jacksonized
@EqualsAndHashCode
@ToString
public class ColumnModel {
    @JsonProperty("name")
    private final String name;
    // 원본 표기 유지, 비교는 normalizedType() 기준
    @JsonProperty("type")
    @EqualsAndHashCode.Exclude
    private final String type;
    @JsonProperty("nullable")
    @Builder.Default private final boolean nullable = true;
    @JsonProperty("default")
    private final String defaultValue;
    @JsonProperty("generated")
    private final String generated;
    @JsonProperty("check")
    private final String check;
    @JsonProperty("foreign_key")
    private final ForeignKeyModel foreignKey;
    @JsonProperty("comment")
    private final String comment;

    /**
     * Type in the form used for every comparison: upper case, no whitespace.
     * {@code decimal(10, 2)} and {@code DECIMAL(10,2)} normalize to the same value.
     */
    @EqualsAndHashCode.Include
    public String normalizedType() {
        return normalizeType(type);
    }

    public static String normalizeType(String type) {
        if (type == null) return null;
        return type.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }
}
