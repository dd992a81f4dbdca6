package org.lakeshift.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Named CHECK constraint. Unlike keys, the engine enforces it on every write.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class CheckConstraintModel {
    @JsonProperty("name")
    private final String name;
    @JsonProperty("expression")
    private final String expression;

    public static CheckConstraintModel of(String name, String expression) {
        return CheckConstraintModel.builder().name(name).expression(expression).build();
    }
}
