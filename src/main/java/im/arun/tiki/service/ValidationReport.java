package im.arun.tiki.service;

import im.arun.tiki.model.TikiDocument;
import lombok.Value;

/**
 * Summary of a successfully parsed document.
 */
@Value
public class ValidationReport {
    TikiDocument document;
    int conceptCount;
    int maxDepth;

    public String getRootTitle() {
        return document.getRoot().getTitle();
    }
}
