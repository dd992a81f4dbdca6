package org.lakeshift.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.lakeshift.exception.SchemaLoadException;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads the declared schema from YAML.
 * <p>
 * A schema path is either a directory holding one table per {@code *.yaml} / {@code *.yml}
 * file, or a single file with a top-level {@code tables:} list. Unknown keys fail the load.
 */
public class SchemaLoader {

    record SchemaDocument(@JsonProperty("tables") List<TableModel> tables) {
    }

    private final ObjectMapper yamlMapper;

    public SchemaLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public SchemaModel load(Path schemaPath) {
        if (Files.isRegularFile(schemaPath)) {
            SchemaDocument document = read(schemaPath, SchemaDocument.class);
            List<TableModel> tables = document == null || document.tables() == null ? List.of() : document.tables();
            return toSchema(tables, schemaPath);
        }
        if (Files.isDirectory(schemaPath)) {
            List<TableModel> tables = new ArrayList<>();
            for (Path file : listYamlFiles(schemaPath)) {
                TableModel table = read(file, TableModel.class);
                if (table == null) {
                    throw new SchemaLoadException("Schema file '" + file + "' is empty");
                }
                tables.add(table);
            }
            return toSchema(tables, schemaPath);
        }
        throw new SchemaLoadException("Schema path does not exist: " + schemaPath);
    }

    private SchemaModel toSchema(List<TableModel> tables, Path source) {
        Map<String, TableModel> byName = new LinkedHashMap<>();
        for (TableModel table : tables) {
            table.validate();
            if (byName.putIfAbsent(table.getName(), table) != null) {
                throw new SchemaLoadException("Duplicate table '" + table.getName() + "' in " + source);
            }
        }
        return new SchemaModel(byName);
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return yamlMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to parse " + file + ": " + e.getMessage(), e);
        }
    }

    private List<Path> listYamlFiles(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to list schema directory " + directory + ": " + e.getMessage(), e);
        }
    }
}
