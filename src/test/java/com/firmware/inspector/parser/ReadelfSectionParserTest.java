package com.firmware.inspector.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.firmware.inspector.model.Section;

import static org.assertj.core.api.Assertions.*;

class ReadelfSectionParserTest {

    private static final String OUTPUT = """
            There are 6 section headers, starting at offset 0x2f4a8:

            Section Headers:
              [Nr] Name              Type            Addr     Off    Size   ES Flg Lk Inf Al
              [ 0]                   NULL            00000000 000000 000000 00      0   0  0
              [ 1] .isr_vector       PROGBITS        08000000 010000 000188 00   A  0   0  4
              [ 2] .text             PROGBITS        08000190 010190 00a4c0 00  AX  0   0 16
              [ 3] .data             PROGBITS        20000000 020000 000120 00  WA  0   0  4
              [ 4] .bss              NOBITS          20000120 020120 000a40 00  WA  0   0  8
              [ 5] .comment          PROGBITS        00000000 020120 000045 01  MS  0   0  1
            Key to Flags:
              W (write), A (alloc), X (execute), M (merge), S (strings), I (info),
            """;

    private final ReadelfSectionParser parser = new ReadelfSectionParser();

    @Test
    void testParseSectionHeaders() {
        List<Section> sections = parser.parse(OUTPUT);

        assertThat(sections).extracting(Section::getName)
                .containsExactly(".isr_vector", ".text", ".data", ".bss", ".comment");
        assertThat(sections).extracting(Section::getId)
                .containsExactly("sec_1", "sec_2", "sec_3", "sec_4", "sec_5");

        Section text = sections.get(1);
        assertThat(text.getVmaStart()).isEqualTo(0x08000190L);
        assertThat(text.getSize()).isEqualTo(0xa4c0L);
        assertThat(text.getFlags().isAlloc()).isTrue();
        assertThat(text.getFlags().isExec()).isTrue();
        assertThat(text.getFlags().isWrite()).isFalse();
    }

    @Test
    void testParseWritableAndNonAllocSections() {
        List<Section> sections = parser.parse(OUTPUT);

        assertThat(sections.get(3).getFlags().isWrite()).isTrue();
        assertThat(sections.get(4).getFlags().isAlloc()).isFalse();
    }

    @Test
    void testSectionContainsAddress() {
        Section data = parser.parse(OUTPUT).get(2);

        assertThat(data.contains(0x20000000L)).isTrue();
        assertThat(data.contains(0x2000011fL)).isTrue();
        assertThat(data.contains(0x20000120L)).isFalse();
    }

    @Test
    void testParseOutputWithoutSections() {
        assertThat(parser.parse("readelf: Error: Not an ELF file")).isEmpty();
    }
}
