package io.invoiceops.utils;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style filename pattern: {@code *}, {@code ?}, {@code [abc]} and {@code [!abc]}.
 * Matching is case-insensitive.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob must not be null");
        return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL));
    }

    public boolean matches(String name) {
        return name != null && regex.matcher(name).matches();
    }

    /**
     * Basename of an object key.
     */
    public static String basename(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!') {
                        j++;
                    }
                    if (j < n && glob.charAt(j) == ']') {
                        j++;
                    }
                    while (j < n && glob.charAt(j) != ']') {
                        j++;
                    }
                    if (j >= n) {
                        // unterminated class is a literal bracket
                        sb.append("\\[");
                    } else {
                        String body = glob.substring(i, j).replace("\\", "\\\\");
                        i = j + 1;
                        if (body.startsWith("!")) {
                            body = "^" + body.substring(1);
                        } else if (body.startsWith("^")) {
                            body = "\\" + body;
                        }
                        sb.append('[').append(body).append(']');
                    }
                }
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
