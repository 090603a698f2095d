package im.arun.tiki.render;

/**
 * Output formats offered by {@code tiki export}.
 */
public enum ExportFormat {
    /** Structured JSON document. */
    json,
    /** Plain box-drawing tree. */
    ascii,
    /** Styled tree for terminal display. */
    tree
}
