package com.phillippitts.strokecoach.exception;

/**
 * Thrown when the reference corpus directory cannot be read during a reload.
 */
public class ReferenceCorpusException extends StrokeCoachException {

    private final String corpusPath;

    public ReferenceCorpusException(String corpusPath, Throwable cause) {
        super("Reference corpus unreadable at path: " + corpusPath, cause);
        this.corpusPath = corpusPath;
    }

    public String getCorpusPath() {
        return corpusPath;
    }
}
