package org.lakeshift.migration.contributor.create;

import org.lakeshift.migration.contributor.TableBodyContributor;
import org.lakeshift.migration.spi.dialect.DdlDialect;
import org.lakeshift.model.ColumnModel;

import java.util.List;

public record ColumnContributor(List<ColumnModel> columns) implements TableBodyContributor {
    @Override
    public int priority() {
        return 40; // Column 정의
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ColumnModel c : columns) {
            sb.append("    ").append(dialect.getColumnDefinitionSql(c)).append(",\n");
        }
    }
}
