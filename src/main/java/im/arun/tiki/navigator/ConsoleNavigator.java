package im.arun.tiki.navigator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;

/**
 * Line-command loop driving a {@link TreeNavigator}. Single-threaded: read a command, apply it,
 * redraw through the view.
 */
public class ConsoleNavigator {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleNavigator.class);

    static final String HELP = String.join("\n",
        "Tiki Navigator Help",
        "",
        "Navigation:",
        "  j / k      move down / up through visible concepts",
        "  first/last jump to the first / last visible concept",
        "  d, Enter   show concept details",
        "  e          expand/collapse selected concept",
        "",
        "Search & Jump:",
        "  /text      search concepts by title or ID",
        "  g <id>     jump to a concept ID (e.g. g *1**2)",
        "  r          redraw the tree",
        "",
        "General:",
        "  q          quit navigator",
        "  ?          show this help");

    private final TreeNavigator navigator;
    private final PrintStream out;

    public ConsoleNavigator(TreeNavigator navigator, PrintStream out) {
        this.navigator = navigator;
        this.out = out;
    }

    /**
     * Runs until {@code q} or end of input.
     */
    public void run(Reader input) throws IOException {
        BufferedReader reader = new BufferedReader(input);
        navigator.refresh();
        prompt();

        String line;
        while ((line = reader.readLine()) != null) {
            if (!handle(line.strip())) {
                break;
            }
            prompt();
        }
        logger.debug("Navigator session ended");
    }

    /**
     * Applies one command. Returns false when the session should end.
     */
    boolean handle(String command) {
        if (command.isEmpty() || command.equals("d")) {
            out.println(navigator.details());
            return true;
        }
        if (command.startsWith("/")) {
            navigator.search(command.substring(1));
            return true;
        }
        if (command.startsWith("g ") || command.equals("g")) {
            navigator.jumpToId(command.substring(1));
            return true;
        }

        switch (command) {
            case "q":
                return false;
            case "j":
                navigator.moveDown();
                break;
            case "k":
                navigator.moveUp();
                break;
            case "first":
                navigator.selectFirst();
                break;
            case "last":
                navigator.selectLast();
                break;
            case "e":
                navigator.toggleExpand();
                navigator.refresh();
                break;
            case "r":
                navigator.refresh();
                break;
            case "?":
                out.println(HELP);
                break;
            default:
                out.println("Unknown command: " + command + " (? for help)");
        }
        return true;
    }

    private void prompt() {
        out.print("tiki> ");
        out.flush();
    }
}
