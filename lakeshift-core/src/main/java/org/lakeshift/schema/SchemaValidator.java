package org.lakeshift.schema;

import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that every declared table and column exists in the live schema with the declared
 * type and nullability. Extra tables and columns in the database are ignored.
 */
public class SchemaValidator {

    public ValidationResult validate(SchemaModel declared, SchemaModel live) {
        List<ValidationIssue> issues = new ArrayList<>();

        declared.getTables().forEach((tableName, declaredTable) -> {
            Optional<TableModel> liveTable = live.getTable(tableName);
            if (liveTable.isEmpty()) {
                issues.add(new ValidationIssue(tableName, null, ValidationIssue.Kind.MISSING_TABLE,
                        "Table '" + tableName + "' not found in database"));
                return;
            }
            Map<String, ColumnModel> liveColumns = liveTable.get().columnsByName();
            for (ColumnModel expected : declaredTable.getColumns()) {
                validateColumn(tableName, expected, liveColumns.get(expected.getName()), issues);
            }
        });

        return new ValidationResult(issues);
    }

    private void validateColumn(String table, ColumnModel expected, ColumnModel actual, List<ValidationIssue> issues) {
        String name = expected.getName();
        if (actual == null) {
            issues.add(new ValidationIssue(table, name, ValidationIssue.Kind.MISSING_COLUMN,
                    "Column '" + name + "' missing from table '" + table + "'"));
            return;
        }
        if (!expected.normalizedType().equals(actual.normalizedType())) {
            issues.add(new ValidationIssue(table, name, ValidationIssue.Kind.TYPE_MISMATCH,
                    "Column '" + name + "' type mismatch: expected " + expected.getType() + ", got " + actual.getType()));
            return;
        }
        if (expected.isNullable() != actual.isNullable()) {
            issues.add(new ValidationIssue(table, name, ValidationIssue.Kind.CONSTRAINT_MISMATCH,
                    "Column '" + name + "' nullable mismatch: expected " + nullability(expected)
                            + ", got " + nullability(actual)));
        }
    }

    private static String nullability(ColumnModel column) {
        return column.isNullable() ? "nullable" : "NOT NULL";
    }
}
