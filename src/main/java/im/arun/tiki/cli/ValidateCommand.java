package im.arun.tiki.cli;

import im.arun.tiki.exception.TikiException;
import im.arun.tiki.exception.TikiSyntaxException;
import im.arun.tiki.service.TikiService;
import im.arun.tiki.service.ValidationReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Validate Tiki file syntax")
public class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private TikiCLI parent;

    @Parameters(index = "0", description = "Path to .tiki file")
    private Path file;

    @Option(names = {"--verbose", "-v"}, description = "Show detailed validation information")
    private boolean verbose;

    @Override
    public Integer call() {
        TikiService service = parent.createService();

        ValidationReport report;
        try {
            report = service.validate(file);
        } catch (TikiSyntaxException e) {
            parent.err.println("✗ Invalid Tiki file: " + file);
            parent.err.println("Error: " + e.getMessage());
            if (verbose) {
                parent.err.println("Tip: Check the syntax around line " + e.getLineNumber());
            }
            return 1;
        } catch (TikiException e) {
            parent.err.println("✗ Validation failed: " + file);
            parent.err.println("Error: " + e.getMessage());
            return 1;
        }

        parent.out.println("✓ Valid Tiki file: " + file);
        parent.out.println("Concepts: " + report.getConceptCount());

        if (verbose) {
            parent.out.println("Root concept: " + report.getRootTitle());
            parent.out.println("Max depth: " + report.getMaxDepth());
            parent.out.println(service.getStyledRenderer()
                .render(report.getDocument().getRoot(), null, "Parsed Structure:"));
        }
        return 0;
    }
}
