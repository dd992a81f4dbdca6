package org.lakeshift.migration.contributor;

/**
 * Contributes lines inside the parentheses of {@code CREATE TABLE}. Each line ends with {@code ",\n"}.
 */
public interface TableBodyContributor extends DdlContributor {
}
