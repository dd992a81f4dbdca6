package org.lakeshift.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Primary key definition. Uniqueness is not enforced by the engine; {@code rely} only tells
 * the optimizer it may trust it.
 * <p>
 * Two keys are equal only when they list the same columns in the same order and carry the
 * same rely flag.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class PrimaryKeyModel {
    @JsonProperty("columns")
    @Builder.Default private final List<String> columns = new ArrayList<>();
    @JsonProperty("rely")
    @Builder.Default private final boolean rely = false;

    public static PrimaryKeyModel of(List<String> columns, boolean rely) {
        return PrimaryKeyModel.builder().columns(new ArrayList<>(columns)).rely(rely).build();
    }
}
