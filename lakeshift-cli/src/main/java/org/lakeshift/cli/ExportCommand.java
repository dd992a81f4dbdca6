package org.lakeshift.cli;

import org.lakeshift.config.MigrationSettings;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.schema.SchemaExporter;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;

@CommandLine.Command(
        name = "export",
        description = "실제 스키마를 테이블별 YAML 파일로 내보내기"
)
public class ExportCommand extends AbstractLakeshiftCommand {

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output directory (defaults to the schema directory)")
    Path output;

    public ExportCommand() {
        super();
    }

    ExportCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int run(MigrationSettings settings) throws Exception {
        SchemaModel live = introspect(settings);
        if (live.isEmpty()) {
            System.out.println("No tables found in " + settings.getCatalog() + "." + settings.getSchema());
            return ExitCodes.OK;
        }
        Path target = output != null ? context.resolve(output) : settings.getSchemaDir();
        List<Path> written = new SchemaExporter().exportToDirectory(live, target);
        System.out.println("Exported " + written.size() + " tables to " + target);
        written.forEach(p -> System.out.println("  - " + p.getFileName()));
        return ExitCodes.OK;
    }

    @Override
    protected String errorLabel() {
        return "Export error";
    }
}
