package im.arun.tiki.cli;

import im.arun.tiki.exception.TikiException;
import im.arun.tiki.exception.TikiExportException;
import im.arun.tiki.model.TikiDocument;
import im.arun.tiki.render.ExportFormat;
import im.arun.tiki.service.TikiService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "export", description = "Export Tiki file to other formats")
public class ExportCommand implements Callable<Integer> {

    @ParentCommand
    private TikiCLI parent;

    @Parameters(index = "0", description = "Path to .tiki file")
    private Path file;

    @Option(names = {"--format"}, description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "tree")
    private ExportFormat format;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    public Integer call() {
        TikiService service = parent.createService();

        TikiDocument document;
        try {
            document = service.parseFile(file);
        } catch (TikiException e) {
            parent.err.println("Parse Error: " + e.getMessage());
            return 1;
        }
        parent.err.println("Parsed: " + file);

        try {
            service.export(document, format, output, parent.out);
        } catch (TikiExportException e) {
            parent.err.println("Export Error: " + e.getMessage());
            return 1;
        }

        if (output != null) {
            parent.out.println("Exported to: " + output);
        }
        return 0;
    }
}
