package io.pagecraft.core.model;

/**
 * Position of a tag's opening delimiter in the template source. Lines and columns are 1-based.
 *
 * @param line   line number
 * @param column column number within the line
 */
public record Location(int line, int column) {

    public Location {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column must be positive, got: " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
