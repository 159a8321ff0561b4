package org.irnorm.compiler.api;

/**
 * A pure data class representing a position in the host-language source.
 * The normalizer never interprets it; it only carries it along for diagnostics.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number.
 * @param columnNumber The column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Position used for synthesized nodes and hand-built trees. */
    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", 0, 0);

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
