package im.arun.tiki.cli;

import im.arun.tiki.config.ConfigLoader;
import im.arun.tiki.config.TikiConfig;
import im.arun.tiki.service.TikiService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Tiki using Picocli.
 */
@Command(
    name = "tiki",
    description = "Tiki Hierarchical Specification Language Tools",
    mixinStandardHelpOptions = true,
    version = "Tiki 0.1.0",
    subcommands = {
        ViewCommand.class,
        ExportCommand.class,
        ValidateCommand.class
    }
)
public class TikiCLI implements Callable<Integer> {

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--frontmatter-lines"}, description = "Lines from the top in which a --- frontmatter block may start")
    private Integer frontmatterLines;

    @Option(names = {"--fence"}, description = "Code fence token")
    private String codeFence;

    @Option(names = {"--no-color"}, description = "Disable ANSI styling")
    private boolean noColor;

    final PrintStream out;
    final PrintStream err;
    final InputStream in;

    public TikiCLI() {
        this(System.out, System.err, System.in);
    }

    public TikiCLI(PrintStream out, PrintStream err, InputStream in) {
        this.out = out;
        this.err = err;
        this.in = in;
    }

    @Override
    public Integer call() {
        // No subcommand given
        new CommandLine(this).usage(err);
        return 1;
    }

    TikiService createService() {
        Map<String, Object> overrides = new HashMap<>();
        if (frontmatterLines != null) {
            overrides.put("frontmatterLineLimit", frontmatterLines);
        }
        if (codeFence != null) {
            overrides.put("codeFence", codeFence);
        }
        if (noColor) {
            overrides.put("styled", false);
        }
        TikiConfig config = new ConfigLoader(configPath).load(overrides);
        return new TikiService(config);
    }

    public static CommandLine commandLine(TikiCLI cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new TikiCLI()).execute(args);
        System.exit(exitCode);
    }
}
