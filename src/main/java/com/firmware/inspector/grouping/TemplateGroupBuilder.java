package com.firmware.inspector.grouping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.grouping.model.GroupSymbolSummary;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;
import com.firmware.inspector.model.Symbol;

/**
 * Rolls symbols up into template groups and, within each group, specializations.
 *
 * The build is a single left-to-right pass: every symbol lands in exactly one group and one
 * specialization. Groups come out in order of first occurrence. Non-template symbols each form
 * their own group keyed by {@value #NON_TEMPLATE_GROUP_PREFIX} plus the symbol name, so symbols
 * that share a plain name share a group regardless of where they live.
 *
 * Instances hold no per-build state and may be shared between threads.
 */
public class TemplateGroupBuilder {
    private static final Logger log = LoggerFactory.getLogger(TemplateGroupBuilder.class);

    public static final String NON_TEMPLATE_GROUP_PREFIX = "[non-template]";

    static final String UNKNOWN_SECTION = "unknown-section";
    static final String UNKNOWN_ADDRESS = "unknown-addr";

    private final SignatureParser signatureParser;

    public TemplateGroupBuilder() {
        this(new SignatureParser());
    }

    public TemplateGroupBuilder(SignatureParser signatureParser) {
        this.signatureParser = signatureParser;
    }

    public List<TemplateGroupSummary> build(List<Symbol> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return List.of();
        }

        Map<String, GroupAccumulator> groups = new LinkedHashMap<>();

        for (Symbol symbol : symbols) {
            String name = symbol.getName() != null ? symbol.getName() : "";
            Optional<TemplateSignature> signature = signatureParser.parse(name);

            String groupId = signature
                    .map(TemplateSignature::getGroupName)
                    .orElse(NON_TEMPLATE_GROUP_PREFIX + " " + name);
            String specializationKey = signature
                    .map(TemplateSignature::getSpecializationKey)
                    .orElse(null);

            GroupAccumulator group = groups.computeIfAbsent(groupId, id -> new GroupAccumulator(
                    id,
                    signature.map(TemplateSignature::getGroupName).orElse(symbol.getName()),
                    signature.isPresent()));

            group.add(toSummary(symbol, specializationKey), locationKey(symbol));
        }

        List<TemplateGroupSummary> result = new ArrayList<>(groups.size());
        for (GroupAccumulator group : groups.values()) {
            result.add(group.finish());
        }

        log.debug("Grouped {} symbols into {} groups", symbols.size(), result.size());
        return List.copyOf(result);
    }

    /**
     * Identifies the memory a symbol occupies: {@code section:address}, preferring the address
     * of the symbol's primary location. Missing parts become fixed placeholders, so symbols
     * without any location metadata all share one key.
     */
    static String locationKey(Symbol symbol) {
        String section = symbol.getSectionId() != null ? symbol.getSectionId() : UNKNOWN_SECTION;

        Long addr = symbol.getPrimaryLocation() != null ? symbol.getPrimaryLocation().getAddr() : null;
        if (addr == null) {
            addr = symbol.getAddr();
        }

        return section + ":" + (addr != null ? addr.toString() : UNKNOWN_ADDRESS);
    }

    private static GroupSymbolSummary toSummary(Symbol symbol, String specializationKey) {
        String mangled = symbol.getMangledName();
        return GroupSymbolSummary.builder()
                .symbolId(symbol.getId())
                .name(symbol.getName())
                .mangledName(mangled == null || mangled.isEmpty() ? null : mangled)
                .sizeBytes(normalizeSize(symbol.getSize()))
                .specializationKey(specializationKey)
                .sectionId(symbol.getSectionId())
                .blockId(symbol.getBlockId())
                .windowId(symbol.getWindowId())
                .addr(symbol.getAddr())
                .primaryLocation(symbol.getPrimaryLocation())
                .build();
    }

    private static long normalizeSize(Long size) {
        return size != null && size > 0 ? size : 0;
    }
}
