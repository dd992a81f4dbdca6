package org.lakeshift.migration.contributor.create;

import org.lakeshift.migration.contributor.PostCreateContributor;
import org.lakeshift.migration.spi.dialect.DdlDialect;

public record TableCommentContributor(String comment) implements PostCreateContributor {
    @Override
    public int priority() {
        return 30; // 항상 마지막
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        if (comment != null && !comment.isEmpty()) {
            sb.append('\n').append(dialect.getTableCommentClause(comment));
        }
    }
}
