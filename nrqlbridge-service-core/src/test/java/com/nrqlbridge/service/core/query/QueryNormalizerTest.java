package com.nrqlbridge.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QueryNormalizerTest {

    @Test
    void flattensEditorTextToOneLine() {
        String raw = "SELECT count(*)\n-- comment line\nFROM Transaction\r\n\n  WHERE  a = 'x  y'   -- trailing\n"
                + "SINCE 1 hour ago";

        assertThat(QueryNormalizer.normalize(raw))
                .isEqualTo("SELECT count(*) FROM Transaction WHERE a = 'x  y' SINCE 1 hour ago");
    }

    @Test
    void keepsDashesInsideLiterals() {
        assertThat(QueryNormalizer.normalize("SELECT count(*) FROM PageView WHERE url = 'a--b'"))
                .isEqualTo("SELECT count(*) FROM PageView WHERE url = 'a--b'");
    }

    @Test
    void collapsesTabsAndRuns() {
        assertThat(QueryNormalizer.normalize("SELECT\t*   FROM\tLog")).isEqualTo("SELECT * FROM Log");
    }

    @Test
    void commentOnlyTextNormalizesToEmpty() {
        assertThat(QueryNormalizer.normalize("-- nothing here\n   \n")).isEmpty();
        assertThat(QueryNormalizer.normalize(null)).isEmpty();
    }
}
