package org.lakeshift.migration.contributor.create;

import org.lakeshift.migration.contributor.PostCreateContributor;
import org.lakeshift.migration.spi.dialect.DdlDialect;

import java.util.List;

/**
 * Liquid clustering wins over partitioning; a table never gets both clauses.
 */
public record DataLayoutContributor(List<String> clustering, List<String> partitions) implements PostCreateContributor {
    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        if (clustering != null && !clustering.isEmpty()) {
            sb.append('\n').append(dialect.getClusterByClause(clustering));
        } else if (partitions != null && !partitions.isEmpty()) {
            sb.append('\n').append(dialect.getPartitionedByClause(partitions));
        }
    }
}
