package org.pragmatica.markdown.tree;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Boundary markers around a clause inside a contract. Rendering emits them and compiled
 * contract templates require them, byte for byte.
 *
 * <p>In CommonMark form the same marker is the info string of a fenced code block:
 * {@code <clause src="..." clauseid="...">}.
 */
public final class ClauseMarkers {
    public static final String OPENING_PREFIX = "\n``` <clause src=";
    public static final String CLAUSE_ID = " clauseid=";
    public static final String OPENING_SUFFIX = ">\n";
    public static final String CLOSING = "\n```\n";

    private static final Pattern INFO = Pattern.compile("<clause src=\"([^\"]*)\" clauseid=\"([^\"]*)\">");

    /**
     * Clause reference read back from a code block info string.
     */
    public record ClauseInfo(String src, String clauseId) {}

    private ClauseMarkers() {}

    public static String opening(String src, String clauseId) {
        return OPENING_PREFIX + quote(src) + CLAUSE_ID + quote(clauseId) + OPENING_SUFFIX;
    }

    public static String wrap(String src, String clauseId, String content) {
        return opening(src, clauseId) + content + CLOSING;
    }

    /**
     * Info string of the fenced code block standing for a clause.
     */
    public static String info(String src, String clauseId) {
        return "<clause src=" + quote(src) + CLAUSE_ID + quote(clauseId) + ">";
    }

    public static Optional<ClauseInfo> parseInfo(String info) {
        if (info == null) {
            return Optional.empty();
        }
        var matcher = INFO.matcher(info.strip());
        return matcher.matches()
               ? Optional.of(new ClauseInfo(matcher.group(1), matcher.group(2)))
               : Optional.empty();
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }
}
