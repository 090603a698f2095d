package im.arun.tiki.service;

import im.arun.tiki.config.TikiConfig;
import im.arun.tiki.exception.TikiException;
import im.arun.tiki.exception.TikiExportException;
import im.arun.tiki.model.TikiDocument;
import im.arun.tiki.parser.TikiParser;
import im.arun.tiki.render.AsciiTreeRenderer;
import im.arun.tiki.render.ExportFormat;
import im.arun.tiki.render.JsonExporter;
import im.arun.tiki.render.StyledTreeRenderer;
import im.arun.tiki.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Help.Ansi;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point tying parsing and rendering together for the command line.
 */
public class TikiService {
    private static final Logger logger = LoggerFactory.getLogger(TikiService.class);

    private final TikiConfig config;
    private final TikiParser parser;
    private final AsciiTreeRenderer asciiRenderer;
    private final StyledTreeRenderer styledRenderer;
    private final StyledTreeRenderer plainTreeRenderer;
    private final JsonExporter jsonExporter;

    public TikiService(TikiConfig config) {
        this.config = config;
        this.parser = new TikiParser(config);
        this.asciiRenderer = new AsciiTreeRenderer(config.getCollapseMarker());
        this.styledRenderer = new StyledTreeRenderer(config.isStyled() ? Ansi.AUTO : Ansi.OFF, config.getCollapseMarker());
        this.plainTreeRenderer = new StyledTreeRenderer(Ansi.OFF, config.getCollapseMarker());
        this.jsonExporter = new JsonExporter(config.isPrettyJson());
    }

    public TikiConfig getConfig() {
        return config;
    }

    public StyledTreeRenderer getStyledRenderer() {
        return styledRenderer;
    }

    public TikiDocument parseFile(Path path) throws TikiException {
        return parser.parseFile(path);
    }

    /**
     * Parses the file and summarizes it. Parse failures propagate unchanged.
     */
    public ValidationReport validate(Path path) throws TikiException {
        TikiDocument document = parser.parseFile(path);
        return new ValidationReport(document,
            TreeUtils.countConcepts(document.getRoot()),
            TreeUtils.maxDepth(document.getRoot()));
    }

    public String render(TikiDocument document, ExportFormat format) throws TikiExportException {
        return render(document, format, styledRenderer);
    }

    private String render(TikiDocument document, ExportFormat format, StyledTreeRenderer treeRenderer)
            throws TikiExportException {
        switch (format) {
            case json:
                return jsonExporter.toJson(document);
            case ascii:
                return asciiRenderer.render(document.getRoot());
            case tree:
                String heading = document.getName() != null ? "Tiki Specification: " + document.getName() : null;
                return treeRenderer.render(document.getRoot(), null, heading);
            default:
                throw new TikiExportException("Unsupported export format: " + format);
        }
    }

    /**
     * Renders {@code document} and writes it to {@code output}, or to {@code out} when no path is given.
     */
    public void export(TikiDocument document, ExportFormat format, Path output, PrintStream out)
            throws TikiExportException {
        if (output == null) {
            out.println(render(document, format));
            return;
        }

        // Files never get escape codes
        String content = render(document, format, plainTreeRenderer);

        try {
            Files.writeString(output, content + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TikiExportException("Failed to write " + output + ": " + e.getMessage(), e);
        }
        logger.info("Exported {} as {} to {}", document.getName(), format, output);
    }
}
