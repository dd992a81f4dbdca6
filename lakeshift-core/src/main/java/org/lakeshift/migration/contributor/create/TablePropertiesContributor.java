package org.lakeshift.migration.contributor.create;

import org.lakeshift.migration.contributor.PostCreateContributor;
import org.lakeshift.migration.spi.dialect.DdlDialect;

import java.util.Map;

public record TablePropertiesContributor(Map<String, String> properties) implements PostCreateContributor {
    @Override
    public int priority() {
        return 20;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        if (properties != null && !properties.isEmpty()) {
            sb.append('\n').append(dialect.getTablePropertiesClause(properties));
        }
    }
}
