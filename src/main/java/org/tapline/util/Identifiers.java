package org.tapline.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shortens identifiers (request strings, compiler names) so that they stay stable when the
 * project directory moves: every absolute path segment becomes relative to the context.
 */
public final class Identifiers {

    /** Segments are separated by {@code |}, {@code !} or a space; separators are kept. */
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[|! ]");
    private static final Pattern REGEXP_LITERAL = Pattern.compile("^/.*/$");
    private static final Pattern ABSOLUTE_PATH = Pattern.compile("^(?:[a-zA-Z]:\\\\|[a-zA-Z]:/|/)");

    private Identifiers() {
    }

    /**
     * Rewrites every absolute path contained in {@code identifier} relative to {@code context},
     * using {@code /} as separator.
     *
     * @param context    the absolute project directory.
     * @param identifier a compiler name or request string.
     * @return the shortened identifier; unchanged if it contains no absolute path.
     */
    public static String makePathsRelative(String context, String identifier) {
        if (identifier == null || identifier.isEmpty() || context == null || context.isEmpty()) {
            return identifier;
        }
        StringBuilder result = new StringBuilder();
        Matcher matcher = SEGMENT_SEPARATOR.matcher(identifier);
        int start = 0;
        while (matcher.find()) {
            result.append(shorten(context, identifier.substring(start, matcher.start())));
            result.append(matcher.group());
            start = matcher.end();
        }
        result.append(shorten(context, identifier.substring(start)));
        return result.toString();
    }

    static boolean looksLikeAbsolutePath(String segment) {
        if (REGEXP_LITERAL.matcher(segment).matches()) {
            return false;
        }
        return ABSOLUTE_PATH.matcher(segment).find();
    }

    private static String shorten(String context, String segment) {
        return looksLikeAbsolutePath(segment) ? relative(context, segment) : segment;
    }

    /**
     * Computes the relative path from {@code from} to {@code to}; both absolute.
     */
    static String relative(String from, String to) {
        List<String> fromParts = split(from);
        List<String> toParts = split(to);
        int common = 0;
        while (common < fromParts.size() && common < toParts.size()
                && fromParts.get(common).equals(toParts.get(common))) {
            common++;
        }
        List<String> parts = new ArrayList<>();
        for (int i = common; i < fromParts.size(); i++) {
            parts.add("..");
        }
        parts.addAll(toParts.subList(common, toParts.size()));
        return String.join("/", parts);
    }

    private static List<String> split(String path) {
        List<String> parts = new ArrayList<>();
        for (String part : path.replace('\\', '/').split("/")) {
            if (!part.isEmpty() && !part.equals(".")) {
                parts.add(part);
            }
        }
        return parts;
    }
}
