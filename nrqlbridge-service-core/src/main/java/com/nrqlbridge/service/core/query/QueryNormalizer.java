package com.nrqlbridge.service.core.query;

import com.nrqlbridge.service.core.time.QueryScanner;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens multi-line editor text into a single NRQL line: comments and blank lines are dropped,
 * lines are joined with a space and whitespace runs outside string literals collapse to one space.
 */
public final class QueryNormalizer {

    private QueryNormalizer() {}

    public static String normalize(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String line : queryText.replace("\r", "").split("\n")) {
            int comment = QueryScanner.commentStart(line);
            String code = (comment >= 0 ? line.substring(0, comment) : line).trim();
            if (!code.isEmpty()) {
                kept.add(code);
            }
        }
        return collapseWhitespace(String.join(" ", kept));
    }

    private static String collapseWhitespace(String text) {
        String masked = QueryScanner.mask(text);
        StringBuilder out = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int i = 0; i < text.length(); i++) {
            // literal contents are masked, so whitespace in the mask is structural
            if (Character.isWhitespace(masked.charAt(i))) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace && out.length() > 0) {
                out.append(' ');
            }
            pendingSpace = false;
            out.append(text.charAt(i));
        }
        return out.toString();
    }
}
