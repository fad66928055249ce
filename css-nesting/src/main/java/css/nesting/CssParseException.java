package css.nesting;

/// Exception thrown when style sheet text cannot be read into a tree.
public class CssParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int position;
    private final String source;

    public CssParseException(String message) {
        super(message);
        this.position = -1;
        this.source = null;
    }

    /// Creates a parse exception pointing at an offset in the source text.
    public CssParseException(String message, String source, int position) {
        super(formatMessage(message, source, position));
        this.position = position;
        this.source = source;
    }

    /// Offset in the source where the error was detected, or -1 if unknown.
    public int position() {
        return position;
    }

    /// The text being parsed, or null if unknown.
    public String source() {
        return source;
    }

    private static String formatMessage(String message, String source, int position) {
        if (source == null || position < 0) {
            return message;
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        if (position < source.length()) {
            sb.append(" (near '").append(source.charAt(position)).append("')");
        } else {
            sb.append(" (end of input)");
        }
        return sb.toString();
    }
}
