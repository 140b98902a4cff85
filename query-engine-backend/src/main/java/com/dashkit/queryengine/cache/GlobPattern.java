package com.dashkit.queryengine.cache;

import java.util.regex.Pattern;

/**
 * Redis-style glob matcher for cache keys.
 *
 * <p>Supports {@code *} (any run), {@code ?} (one character), {@code [abc]} / {@code [a-z]} /
 * {@code [^a]} classes and {@code \} escapes. Everything else matches literally. Reversed
 * ranges are swapped and an empty class matches nothing.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    public boolean matches(String key) {
        return key != null && regex.matcher(key).matches();
    }

    public String getGlob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder re = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    re.append(".*");
                    break;
                case '?':
                    re.append('.');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        i++;
                        re.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        re.append("\\\\");
                    }
                    break;
                case '[':
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        re.append("\\[");
                        break;
                    }
                    re.append(characterClass(glob.substring(i + 1, close)));
                    i = close;
                    break;
                default:
                    re.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return re.toString();
    }

    private static String characterClass(String body) {
        boolean negated = body.startsWith("^") || body.startsWith("!");
        int start = negated ? 1 : 0;
        if (start == body.length()) {
            // an empty class matches nothing; negated, it matches any single character
            return negated ? "." : "(?!)";
        }
        StringBuilder cls = new StringBuilder(negated ? "[^" : "[");
        int j = start;
        while (j < body.length()) {
            char c = body.charAt(j);
            if (c == '\\' && j + 1 < body.length()) {
                j++;
                c = body.charAt(j);
            }
            if (j + 2 < body.length() && body.charAt(j + 1) == '-') {
                char end = body.charAt(j + 2);
                cls.append(classLiteral((char) Math.min(c, end)))
                        .append('-')
                        .append(classLiteral((char) Math.max(c, end)));
                j += 3;
            } else {
                cls.append(classLiteral(c));
                j++;
            }
        }
        return cls.append(']').toString();
    }

    private static String classLiteral(char c) {
        return Character.isLetterOrDigit(c) ? String.valueOf(c) : "\\" + c;
    }

    @Override
    public String toString() {
        return glob;
    }
}
