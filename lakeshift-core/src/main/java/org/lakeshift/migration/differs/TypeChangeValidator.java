package org.lakeshift.migration.differs;

import org.lakeshift.model.ColumnModel;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether Delta can change a column type in place.
 * <p>
 * Only widening conversions on the allow-list are accepted. A change of parameters on the
 * same base type, e.g. {@code DECIMAL(10,2)} to {@code DECIMAL(12,2)}, has no widening path
 * and is rejected as well.
 */
public class TypeChangeValidator {

    private static final Map<String, Set<String>> WIDENING = Map.of(
            "TINYINT", Set.of("SMALLINT", "INT", "BIGINT"),
            "SMALLINT", Set.of("INT", "BIGINT"),
            "INT", Set.of("BIGINT"),
            "FLOAT", Set.of("DOUBLE")
    );

    /**
     * @return empty when the change is allowed, otherwise the reason it is not
     */
    public Optional<String> validate(String fromType, String toType) {
        String from = ColumnModel.normalizeType(fromType);
        String to = ColumnModel.normalizeType(toType);
        if (from.equals(to)) {
            return Optional.empty();
        }
        if (WIDENING.getOrDefault(baseType(from), Set.of()).contains(baseType(to))) {
            return Optional.empty();
        }
        return Optional.of("Type change from " + fromType + " to " + toType
                + " is not supported. Only widening conversions are allowed.");
    }

    public boolean isSupported(String fromType, String toType) {
        return validate(fromType, toType).isEmpty();
    }

    static String baseType(String normalizedType) {
        int paren = normalizedType.indexOf('(');
        return paren < 0 ? normalizedType : normalizedType.substring(0, paren);
    }
}
