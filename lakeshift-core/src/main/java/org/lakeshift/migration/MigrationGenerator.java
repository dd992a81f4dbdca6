package org.lakeshift.migration;

import org.lakeshift.exception.CodegenException;
import org.lakeshift.migration.dialect.databricks.DatabricksMigrationVisitor;
import org.lakeshift.migration.spi.visitor.ChangeVisitor;
import org.lakeshift.model.Change;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns an ordered change batch into the text of one migration file.
 * <p>
 * The batch is all-or-nothing: if any change is unsupported nothing is rendered and the
 * resulting {@link CodegenException} lists every offending change.
 */
public class MigrationGenerator {
    static final String REQUIRES_COLUMN_MAPPING = "-- Requires: delta.columnMapping.mode = 'name'";

    private final ChangeVisitor<String> visitor;
    private final Clock clock;

    public MigrationGenerator() {
        this(new DatabricksMigrationVisitor(), Clock.systemDefaultZone());
    }

    public MigrationGenerator(Clock clock) {
        this(new DatabricksMigrationVisitor(), clock);
    }

    public MigrationGenerator(ChangeVisitor<String> visitor, Clock clock) {
        this.visitor = Objects.requireNonNull(visitor, "visitor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String generate(List<Change> changes, String description) {
        rejectUnsupported(changes);

        List<String> lines = new ArrayList<>();
        lines.add("-- Migration: Auto-generated");
        lines.add("-- Description: " + description);
        lines.add("-- Generated: " + LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        lines.add("");
        lines.add("-- Variable substitution: " + Placeholders.CATALOG + ", " + Placeholders.SCHEMA);
        lines.add("");

        List<Change> destructive = changes.stream().filter(Change::isDestructive).toList();
        if (!destructive.isEmpty()) {
            lines.add("-- WARNING: This migration contains destructive changes:");
            destructive.forEach(c -> lines.add("--   - " + c.label()));
            lines.add("");
        }

        for (Change change : changes) {
            lines.add("-- " + change.label());
            if (change.isRequiresColumnMapping()) {
                lines.add(REQUIRES_COLUMN_MAPPING);
            }
            lines.add(change.accept(visitor));
            lines.add("");
        }

        return String.join("\n", lines);
    }

    private void rejectUnsupported(List<Change> changes) {
        List<String> errors = changes.stream()
                .filter(Change::isUnsupported)
                .map(c -> c.qualifiedLabel() + ": " + c.getErrorMessage())
                .toList();
        if (errors.isEmpty()) {
            return;
        }
        StringBuilder message = new StringBuilder("Cannot generate migration - unsupported changes:");
        errors.forEach(e -> message.append("\n-- ERROR: ").append(e));
        throw new CodegenException(message.toString(), errors);
    }
}
