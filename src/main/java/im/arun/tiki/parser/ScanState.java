package im.arun.tiki.parser;

/**
 * Line scanner states.
 */
enum ScanState {
    NORMAL,
    IN_FRONTMATTER,
    IN_CODE_BLOCK
}
