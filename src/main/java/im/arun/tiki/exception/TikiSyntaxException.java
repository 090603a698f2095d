package im.arun.tiki.exception;

import lombok.Getter;

/**
 * A structural violation in the document. The parse is aborted and no tree is returned.
 */
@Getter
public class TikiSyntaxException extends TikiException {

    private final String reason;
    private final int lineNumber;
    private final String lineContent;

    public TikiSyntaxException(String reason, int lineNumber, String lineContent) {
        super(String.format("Line %d: %s\n  > %s", lineNumber, reason, lineContent));
        this.reason = reason;
        this.lineNumber = lineNumber;
        this.lineContent = lineContent;
    }
}
