package org.lakeshift.cli;

import org.lakeshift.config.MigrationSettings;
import org.lakeshift.migration.differs.SchemaDiffer;
import org.lakeshift.model.Change;
import org.lakeshift.model.SchemaModel;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "diff",
        description = "선언된 YAML 스키마와 현재 스키마의 차이를 출력"
)
public class DiffCommand extends AbstractLakeshiftCommand {

    @CommandLine.Option(names = "--online", description = "Compare against the live schema instead of an empty one")
    boolean online;

    public DiffCommand() {
        super();
    }

    DiffCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int run(MigrationSettings settings) {
        SchemaModel declared = loadDeclared(settings);
        SchemaModel current = online ? introspect(settings) : SchemaModel.empty();
        List<Change> changes = new SchemaDiffer().diff(current, declared);

        if (changes.isEmpty()) {
            System.out.println("No changes detected");
            return ExitCodes.OK;
        }
        System.out.println("Found " + changes.size() + " changes (" + (online ? "online" : "offline") + " mode):");
        for (Change change : changes) {
            System.out.println(describe(change));
        }
        return ExitCodes.OK;
    }

    static String describe(Change change) {
        StringBuilder sb = new StringBuilder("  ");
        if (change.isUnsupported()) sb.append("[UNSUPPORTED] ");
        else if (change.isDestructive()) sb.append("[DESTRUCTIVE] ");
        sb.append(change.label());
        if (change.isUnsupported()) sb.append(" - ").append(change.getErrorMessage());
        return sb.toString();
    }

    @Override
    protected String errorLabel() {
        return "Diff error";
    }
}
