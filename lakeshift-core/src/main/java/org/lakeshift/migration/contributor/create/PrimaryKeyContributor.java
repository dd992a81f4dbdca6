package org.lakeshift.migration.contributor.create;

import org.lakeshift.migration.contributor.TableBodyContributor;
import org.lakeshift.migration.spi.dialect.DdlDialect;
import org.lakeshift.model.PrimaryKeyModel;

public record PrimaryKeyContributor(String table, PrimaryKeyModel primaryKey) implements TableBodyContributor {
    @Override
    public int priority() {
        return 50; // 컬럼 뒤
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        if (primaryKey == null || primaryKey.getColumns().isEmpty()) {
            return;
        }
        sb.append("    ").append(dialect.getPrimaryKeyDefinitionSql(table, primaryKey)).append(",\n");
    }
}
