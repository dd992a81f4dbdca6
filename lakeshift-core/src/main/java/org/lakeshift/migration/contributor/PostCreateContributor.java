package org.lakeshift.migration.contributor;

/**
 * Contributes clauses after {@code USING DELTA}. Each clause starts on a new line.
 */
public interface PostCreateContributor extends DdlContributor {
}
