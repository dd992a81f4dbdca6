package org.lakeshift.cli;

import org.lakeshift.config.MigrationSettings;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;
import org.lakeshift.schema.SchemaValidator;
import org.lakeshift.schema.ValidationIssue;
import org.lakeshift.schema.ValidationResult;
import picocli.CommandLine;

@CommandLine.Command(
        name = "validate",
        description = "YAML 스키마 검증 (--online 이면 실제 스키마와 비교)"
)
public class ValidateCommand extends AbstractLakeshiftCommand {

    @CommandLine.Option(names = "--online", description = "Also check the live schema against the declared one")
    boolean online;

    public ValidateCommand() {
        super();
    }

    ValidateCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int run(MigrationSettings settings) {
        SchemaModel declared = loadDeclared(settings);
        System.out.println("Validated " + declared.getTables().size() + " tables:");
        for (TableModel table : declared.getTables().values()) {
            System.out.println("  - " + table.getName() + " (" + table.getColumns().size() + " columns)");
        }
        if (!online) {
            return ExitCodes.OK;
        }

        ValidationResult result = new SchemaValidator().validate(declared, introspect(settings));
        if (result.ok()) {
            System.out.println("Live schema matches declared schema");
            return ExitCodes.OK;
        }
        System.out.println("Found " + result.issues().size() + " issues:");
        for (ValidationIssue issue : result.issues()) {
            System.out.println("  [" + issue.kind().wireName() + "] " + issue.message());
        }
        return ExitCodes.ERROR;
    }

    @Override
    protected String errorLabel() {
        return "Validation error";
    }
}
