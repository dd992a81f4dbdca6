package org.lakeshift.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.lakeshift.model.CheckConstraintModel;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Writes tables back to the YAML format {@link SchemaLoader} reads. Fields holding their
 * default value are left out.
 */
public class SchemaExporter {
    private final ObjectMapper yamlMapper;

    public SchemaExporter() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
    }

    public String exportTable(TableModel table) {
        try {
            return yamlMapper.writeValueAsString(tableToMap(table));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to export table " + table.getName(), e);
        }
    }

    /**
     * Writes one {@code <table>.yaml} per table, in table name order.
     *
     * @return the files written
     */
    public List<Path> exportToDirectory(SchemaModel schema, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        for (String name : new TreeSet<>(schema.tableNames())) {
            TableModel table = schema.getTable(name).orElseThrow();
            Path file = outputDir.resolve(name + ".yaml");
            Files.writeString(file, exportTable(table), StandardCharsets.UTF_8);
            written.add(file);
        }
        return written;
    }

    Map<String, Object> tableToMap(TableModel table) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("table", table.getName());
        if (table.getComment() != null) {
            data.put("comment", table.getComment());
        }
        data.put("columns", table.getColumns().stream().map(this::columnToMap).toList());

        if (table.getPrimaryKey() != null) {
            Map<String, Object> pk = new LinkedHashMap<>();
            pk.put("columns", table.getPrimaryKey().getColumns());
            if (table.getPrimaryKey().isRely()) {
                pk.put("rely", true);
            }
            data.put("primary_key", pk);
        }
        if (!table.getCheckConstraints().isEmpty()) {
            List<Map<String, Object>> checks = new ArrayList<>();
            for (CheckConstraintModel cc : table.getCheckConstraints()) {
                Map<String, Object> check = new LinkedHashMap<>();
                check.put("name", cc.getName());
                check.put("expression", cc.getExpression());
                checks.add(check);
            }
            data.put("check_constraints", checks);
        }
        if (!table.getLiquidClustering().isEmpty()) {
            data.put("liquid_clustering", table.getLiquidClustering());
        }
        if (!table.getPartitionedBy().isEmpty()) {
            data.put("partitioned_by", table.getPartitionedBy());
        }
        if (!table.getTableProperties().isEmpty()) {
            data.put("table_properties", table.getTableProperties());
        }
        return data;
    }

    private Map<String, Object> columnToMap(ColumnModel col) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", col.getName());
        data.put("type", col.getType());
        if (!col.isNullable()) {
            data.put("nullable", false);
        }
        if (col.getDefaultValue() != null) {
            data.put("default", col.getDefaultValue());
        }
        if (col.getGenerated() != null) {
            data.put("generated", col.getGenerated());
        }
        if (col.getCheck() != null) {
            data.put("check", col.getCheck());
        }
        if (col.getForeignKey() != null) {
            Map<String, Object> fk = new LinkedHashMap<>();
            fk.put("table", col.getForeignKey().getTable());
            fk.put("column", col.getForeignKey().getColumn());
            data.put("foreign_key", fk);
        }
        if (col.getComment() != null) {
            data.put("comment", col.getComment());
        }
        return data;
    }
}
