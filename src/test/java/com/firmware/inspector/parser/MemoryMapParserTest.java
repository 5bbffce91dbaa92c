package com.firmware.inspector.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.firmware.inspector.model.AddressType;
import com.firmware.inspector.model.LogicalBlock;
import com.firmware.inspector.model.MemoryMap;
import com.firmware.inspector.model.SectionRule;

import static org.assertj.core.api.Assertions.*;

class MemoryMapParserTest {

    private final MemoryMapParser parser = new MemoryMapParser();

    @Test
    void testParseBlocksAndRules() {
        MemoryMap map = parse("""
                # flash image with a RAM copy of .data
                block flash_code  code  flash  exec
                block flash_data  data  flash  load
                block sram_data   data  sram

                rule prefix .text   code
                rule equals .data   data
                rule regex  ^\\.ram data
                """);

        assertThat(map.hasErrors()).isFalse();
        assertThat(map.getWarnings()).isEmpty();
        assertThat(map.getBlocks()).extracting(LogicalBlock::getId)
                .containsExactly("flash_code", "flash_data", "sram_data");
        assertThat(map.getBlocks()).extracting(LogicalBlock::getRole)
                .containsExactly(AddressType.EXEC, AddressType.LOAD, AddressType.RUNTIME);
        assertThat(map.blocksFor("data")).extracting(LogicalBlock::getWindowId).containsExactly("flash", "sram");

        assertThat(map.getRules()).extracting(SectionRule::getKind)
                .containsExactly(SectionRule.MatchKind.PREFIX, SectionRule.MatchKind.EQUALS, SectionRule.MatchKind.REGEX);
        assertThat(map.ruleFor(".text.startup")).map(SectionRule::getCategoryId).contains("code");
        assertThat(map.ruleFor(".ramfunc")).map(SectionRule::getCategoryId).contains("data");
        assertThat(map.ruleFor(".data.init")).isEmpty();
    }

    @Test
    void testFirstMatchingRuleWins() {
        MemoryMap map = parse("""
                block a  fast  itcm
                block b  code  flash
                rule suffix .fast  fast
                rule prefix .text  code
                """);

        assertThat(map.ruleFor(".text.fast")).map(SectionRule::getCategoryId).contains("fast");
    }

    @Test
    void testParseErrorsCarryLineNumbers() {
        MemoryMap map = parse("""
                block flash_code code flash
                block flash_code code flash
                rule contains .text code
                rule regex ([ code
                """);

        assertThat(map.getErrors()).hasSize(3);
        assertThat(map.getErrors().get(0)).startsWith("Line 2:").contains("Duplicate block id");
        assertThat(map.getErrors().get(1)).startsWith("Line 3:");
        assertThat(map.getErrors().get(2)).startsWith("Line 4:").contains("Invalid regex");
    }

    @Test
    void testRuleCategoryWithoutBlocksIsWarned() {
        MemoryMap map = parse("rule prefix .ccm ccm\n");

        assertThat(map.hasErrors()).isFalse();
        assertThat(map.getWarnings()).containsExactly("No logical blocks defined for category ccm.");
    }

    private MemoryMap parse(String text) {
        return parser.parse(List.of(text.split("\n")));
    }
}
