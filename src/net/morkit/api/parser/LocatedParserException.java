package net.morkit.api.parser;

/**
 * A ParserException that points at a place in a named input.
 * The message of such an exception is prefixed with the source name (if
 * any), line, and column of the location; the unprefixed text is available
 * via getDetail().
 */
public class LocatedParserException extends ParserException {

    private final String sourceName;
    private final TextLocation location;
    private final String detail;

    public LocatedParserException(String sourceName, TextLocation pos,
                                  String detail) {
        super(formatMessage(sourceName, pos, detail));
        this.sourceName = sourceName;
        this.location = pos;
        this.detail = detail;
    }
    public LocatedParserException(String sourceName, TextLocation pos,
                                  String detail, Throwable cause) {
        super(formatMessage(sourceName, pos, detail), cause);
        this.sourceName = sourceName;
        this.location = pos;
        this.detail = detail;
    }

    /**
     * The label of the input this exception pertains to, or null.
     * For files, this is usually the file name.
     */
    public String getSourceName() {
        return sourceName;
    }

    /**
     * The location of the problem, or null if unknown.
     */
    public TextLocation getLocation() {
        return location;
    }

    /**
     * The human-readable description of the problem without the location
     * prefix.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Format a message in the "name:line:column: detail" form.
     * Absent components are left out.
     */
    public static String formatMessage(String sourceName, TextLocation pos,
                                       String detail) {
        StringBuilder sb = new StringBuilder();
        if (sourceName != null) sb.append(sourceName).append(':');
        if (pos != null)
            sb.append(pos.getLine()).append(':').append(pos.getColumn())
              .append(':');
        if (sb.length() != 0) sb.append(' ');
        sb.append(detail);
        return sb.toString();
    }

}
