package org.lakeshift.migration.contributor;

import org.lakeshift.migration.spi.dialect.DdlDialect;

public interface DdlContributor {
    int priority();

    void contribute(StringBuilder sb, DdlDialect dialect);
}
