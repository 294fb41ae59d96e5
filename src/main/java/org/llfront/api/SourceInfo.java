package org.llfront.api;

/**
 * A pure data class representing a position in the source text.
 *
 * @param fileName The logical name of the parsed text.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
