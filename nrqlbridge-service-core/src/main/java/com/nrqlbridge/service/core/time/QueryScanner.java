package com.nrqlbridge.service.core.time;

/**
 * Tracks literal state while walking NRQL text so keyword searches only see query structure.
 *
 * <p>{@link #mask(String)} returns a copy of the text with the same length in which the contents
 * of string literals ({@code '...'}, {@code "..."}), backtick-quoted identifiers and {@code --}
 * line comments are replaced by {@value #MASK}. Match offsets found in the mask are valid offsets
 * into the original text.
 */
public final class QueryScanner {

    public static final char MASK = '_';

    private QueryScanner() {}

    public static String mask(String query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringBuilder masked = new StringBuilder(query.length());
        char quote = 0;
        boolean inLineComment = false;

        for (int i = 0; i < query.length(); i++) {
            char c = query.charAt(i);
            char n = (i + 1) < query.length() ? query.charAt(i + 1) : '\0';

            if (inLineComment) {
                if (c == '\n') {
                    inLineComment = false;
                    masked.append(c);
                } else {
                    masked.append(MASK);
                }
                continue;
            }

            if (quote != 0) {
                if (c == '\\' && quote != '`' && n != '\0') {
                    masked.append(MASK).append(MASK);
                    i++;
                    continue;
                }
                if (c == quote) {
                    // doubled quote inside a literal is an escaped quote
                    if (n == quote && quote != '`') {
                        masked.append(MASK).append(MASK);
                        i++;
                        continue;
                    }
                    quote = 0;
                    masked.append(c);
                    continue;
                }
                masked.append(MASK);
                continue;
            }

            if (c == '-' && n == '-') {
                inLineComment = true;
                masked.append(MASK).append(MASK);
                i++;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            }
            masked.append(c);
        }
        return masked.toString();
    }

    /** Offset of the first {@code --} outside literals, or {@code -1} when the text has none. */
    public static int commentStart(String line) {
        if (line == null) {
            return -1;
        }
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            char n = (i + 1) < line.length() ? line.charAt(i + 1) : '\0';
            if (quote != 0) {
                if (c == '\\' && quote != '`' && n != '\0') {
                    i++;
                } else if (c == quote) {
                    if (n == quote && quote != '`') {
                        i++;
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }
            if (c == '-' && n == '-') {
                return i;
            }
            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            }
        }
        return -1;
    }
}
