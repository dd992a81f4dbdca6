package org.lakeshift.migration;

import org.lakeshift.migration.contributor.DdlContributor;
import org.lakeshift.migration.contributor.PostCreateContributor;
import org.lakeshift.migration.contributor.TableBodyContributor;
import org.lakeshift.migration.contributor.create.ColumnContributor;
import org.lakeshift.migration.contributor.create.DataLayoutContributor;
import org.lakeshift.migration.contributor.create.PrimaryKeyContributor;
import org.lakeshift.migration.contributor.create.TableCommentContributor;
import org.lakeshift.migration.contributor.create.TablePropertiesContributor;
import org.lakeshift.migration.spi.dialect.DdlDialect;
import org.lakeshift.model.TableModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CreateTableBuilder {
    private final String table;
    private final DdlDialect dialect;
    private final List<DdlContributor> body = new ArrayList<>();
    private final List<DdlContributor> post = new ArrayList<>();

    public CreateTableBuilder(String table, DdlDialect dialect) {
        this.table = table;
        this.dialect = dialect;
    }

    public <T extends DdlContributor> CreateTableBuilder add(T c) {
        if (c instanceof TableBodyContributor) {
            body.add(c);
        } else if (c instanceof PostCreateContributor) {
            post.add(c);
        } else {
            throw new IllegalArgumentException("Unsupported contributor type: " + c.getClass().getName());
        }
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        sb.append(dialect.closeCreateTable());

        post.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        return sb.append(';').toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int len = sb.length();
        if (len >= 2 && sb.charAt(len - 2) == ',' && sb.charAt(len - 1) == '\n') {
            sb.setLength(len - 2);
        }
    }

    public CreateTableBuilder defaultsFrom(TableModel t) {
        // 1) 컬럼 & PK
        this.add(new ColumnContributor(t.getColumns()));
        this.add(new PrimaryKeyContributor(t.getName(), t.getPrimaryKey()));
        // 2) USING DELTA 이후 절
        this.add(new DataLayoutContributor(t.getLiquidClustering(), t.getPartitionedBy()));
        this.add(new TablePropertiesContributor(t.getTableProperties()));
        this.add(new TableCommentContributor(t.getComment()));
        return this;
    }
}
