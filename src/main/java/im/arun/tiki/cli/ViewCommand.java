package im.arun.tiki.cli;

import im.arun.tiki.exception.TikiException;
import im.arun.tiki.model.TikiDocument;
import im.arun.tiki.navigator.ConsoleNavigator;
import im.arun.tiki.navigator.ConsoleNavigatorView;
import im.arun.tiki.navigator.TreeNavigator;
import im.arun.tiki.service.TikiService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "view", description = "View Tiki file interactively")
public class ViewCommand implements Callable<Integer> {

    @ParentCommand
    private TikiCLI parent;

    @Parameters(index = "0", description = "Path to .tiki file")
    private Path file;

    @Override
    public Integer call() {
        if (!Files.exists(file)) {
            parent.err.println("Error: File not found: " + file);
            return 1;
        }

        TikiService service = parent.createService();
        parent.out.println("Loading Tiki file: " + file);

        TikiDocument document;
        try {
            document = service.parseFile(file);
        } catch (TikiException e) {
            parent.err.println("Error loading Tiki file: " + e.getMessage());
            return 1;
        }

        ConsoleNavigatorView view = new ConsoleNavigatorView(parent.out, service.getStyledRenderer());
        TreeNavigator navigator = new TreeNavigator(document.getRoot(), view, service.getStyledRenderer());
        try {
            new ConsoleNavigator(navigator, parent.out)
                .run(new InputStreamReader(parent.in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            parent.err.println("Error: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
