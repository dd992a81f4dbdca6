package org.lakeshift.cli;

import org.lakeshift.config.MigrationSettings;
import org.lakeshift.migration.MigrationGenerator;
import org.lakeshift.migration.differs.SchemaDiffer;
import org.lakeshift.migration.output.SqlMigrationWriter;
import org.lakeshift.model.Change;
import org.lakeshift.model.SchemaModel;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@CommandLine.Command(
        name = "generate",
        description = "스키마 차이로부터 마이그레이션 SQL 생성"
)
public class GenerateCommand extends AbstractLakeshiftCommand {

    @CommandLine.Parameters(index = "0", description = "Migration description, used in the header and file name")
    String description;

    @CommandLine.Option(names = "--online", description = "Diff against the live schema instead of an empty one")
    boolean online;

    @CommandLine.Option(names = "--allow-destructive", description = "Allow column drops and other destructive changes")
    boolean allowDestructive;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "0..1")
    Destination destination;

    /** 출력 대상은 하나만 지정할 수 있다. 둘 다 없으면 stdout. */
    static class Destination {
        @CommandLine.Option(names = {"-o", "--output"}, required = true, description = "Write the SQL to this file")
        Path output;

        @CommandLine.Option(names = "--write", required = true,
                description = "Write V<next>__<description>.sql into the migrations directory")
        boolean write;
    }

    public GenerateCommand() {
        super();
    }

    GenerateCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int run(MigrationSettings settings) throws Exception {
        SchemaModel declared = loadDeclared(settings);
        SchemaModel current = online ? introspect(settings) : SchemaModel.empty();
        List<Change> changes = new SchemaDiffer().diff(current, declared);

        if (changes.isEmpty()) {
            System.out.println("No changes to generate");
            return ExitCodes.OK;
        }
        if (!allowDestructive && changes.stream().anyMatch(Change::isDestructive)) {
            System.err.println("Error: destructive changes detected. Use --allow-destructive to proceed.");
            changes.stream().filter(Change::isDestructive)
                    .forEach(c -> System.err.println("  - " + c.label()));
            return ExitCodes.ERROR;
        }

        String sql = new MigrationGenerator(context.clock()).generate(changes, description);

        if (destination != null && destination.output != null) {
            Path target = context.resolve(destination.output);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, sql, StandardCharsets.UTF_8);
            System.out.println("Migration written to " + target);
        } else if (destination != null && destination.write) {
            Path written = new SqlMigrationWriter().write(sql, description, settings.getMigrationsDir());
            System.out.println("Migration written to " + written);
        } else {
            System.out.println(sql);
        }
        return ExitCodes.OK;
    }

    @Override
    protected String errorLabel() {
        return "Generate error";
    }
}
