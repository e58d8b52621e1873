package com.github.dimitryivaniuta.edgeguard.protection.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorDetailsTest {

    @Test
    void stripsMarkupAndQuotes() {
        assertThat(ErrorDetails.sanitize("<script>alert(\"x\")</script> 'bad' `cmd` \\n"))
                .isEqualTo("scriptalert(x)/script bad cmd n");
    }

    @Test
    void collapsesWhitespaceAndControlCharacters() {
        assertThat(ErrorDetails.sanitize("  line1\r\n\tline2\u0000\u0007end  "))
                .isEqualTo("line1 line2 end");
    }

    @Test
    void truncatesToMaxLength() {
        assertThat(ErrorDetails.sanitize("a".repeat(1000))).hasSize(ErrorDetails.MAX_LENGTH);
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(ErrorDetails.sanitize(null)).isEmpty();
    }
}
