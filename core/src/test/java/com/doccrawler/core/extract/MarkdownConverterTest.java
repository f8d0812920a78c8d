package com.doccrawler.core.extract;

import com.doccrawler.core.error.ConversionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarkdownConverterTest {

    private final MarkdownConverter converter = new MarkdownConverter();

    @Test
    void normalizes_whitespace_and_line_endings() throws Exception {
        String out = converter.convert("Title  \r\n\r\n\r\n\r\nBody\t\rEnd\n\n");
        assertThat(out).isEqualTo("Title\n\nBody\nEnd");
    }

    @Test
    void record_delimiter_lines_are_rewritten() throws Exception {
        String out = converter.convert("above\n---\nbelow\n  -----  \nend --- inline");
        assertThat(out).isEqualTo("above\n***\nbelow\n***\nend --- inline");
    }

    @Test
    void blank_input_is_rejected() {
        assertThatThrownBy(() -> converter.convert("  \n ")).isInstanceOf(ConversionException.class);
        assertThatThrownBy(() -> converter.convert(null)).isInstanceOf(ConversionException.class);
    }

    @Test
    void binary_input_is_rejected() {
        assertThatThrownBy(() -> converter.convert("PK\u0003\u0004data")).isInstanceOf(ConversionException.class);
    }
}
