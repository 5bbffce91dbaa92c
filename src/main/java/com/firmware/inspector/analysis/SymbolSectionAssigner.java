package com.firmware.inspector.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.model.Section;
import com.firmware.inspector.model.SectionBlockAssignment;
import com.firmware.inspector.model.Symbol;
import com.firmware.inspector.model.SymbolKind;
import com.firmware.inspector.model.SymbolLocation;
import com.firmware.inspector.parser.NmSymbol;

/**
 * Turns raw nm rows into {@link Symbol}s placed in the section that contains their address.
 *
 * When the section has block assignments, the symbol gets one location per block at the same
 * offset, and the location in the section's primary block becomes its primary location.
 *
 * Rows that agree on address, size and display name are merged into the first one: binding
 * flags are OR-ed and differing raw names are kept as aliases. With {@code nm --demangle} the
 * raw name equals the display name, so aliases only appear when rows carry separate raw names.
 */
public class SymbolSectionAssigner {
    private static final Logger log = LoggerFactory.getLogger(SymbolSectionAssigner.class);

    public List<Symbol> assign(List<NmSymbol> nmSymbols, List<Section> sections, InspectionDiagnostics diagnostics) {
        Map<String, Symbol> byIdentity = new LinkedHashMap<>();
        int merged = 0;

        for (int index = 0; index < nmSymbols.size(); index++) {
            NmSymbol row = nmSymbols.get(index);
            Section section = findSection(sections, row.getAddress());
            if (section == null && !sections.isEmpty()) {
                diagnostics.warn("Symbol %s at 0x%s does not fall within any known section."
                        .formatted(row.getName(), Long.toHexString(row.getAddress())));
            }

            Symbol symbol = toSymbol(row, index, section);
            String identity = row.getAddress() + ":" + row.getSize() + ":" + row.getName();

            Symbol existing = byIdentity.get(identity);
            if (existing == null) {
                byIdentity.put(identity, symbol);
            } else {
                byIdentity.put(identity, mergeInto(existing, symbol));
                merged++;
            }
        }

        if (merged > 0) {
            log.debug("Merged {} duplicate nm rows", merged);
        }
        return new ArrayList<>(byIdentity.values());
    }

    private static Section findSection(List<Section> sections, long address) {
        for (Section section : sections) {
            if (section.contains(address)) {
                return section;
            }
        }
        return null;
    }

    private static Symbol toSymbol(NmSymbol row, int index, Section section) {
        char typeCode = row.getTypeCode();
        SectionBlockAssignment primaryAssignment = section != null ? section.primaryAssignment() : null;

        List<SymbolLocation> locations = new ArrayList<>();
        SymbolLocation primaryLocation = null;
        if (section != null) {
            long offset = row.getAddress() - section.getVmaStart();
            for (SectionBlockAssignment assignment : section.getBlockAssignments()) {
                if (offset < 0 || offset >= assignment.getSize()) {
                    continue;
                }
                SymbolLocation location = SymbolLocation.builder()
                        .windowId(assignment.getWindowId())
                        .blockId(assignment.getBlockId())
                        .addressType(assignment.getAddressType())
                        .addr(assignment.getAddress() + offset)
                        .build();
                locations.add(location);
                if (primaryLocation == null && assignment == primaryAssignment) {
                    primaryLocation = location;
                }
            }
        }
        if (primaryLocation == null && !locations.isEmpty()) {
            primaryLocation = locations.get(0);
        }

        String blockId = primaryLocation != null ? primaryLocation.getBlockId()
                : primaryAssignment != null ? primaryAssignment.getBlockId() : null;
        String windowId = primaryLocation != null ? primaryLocation.getWindowId()
                : primaryAssignment != null ? primaryAssignment.getWindowId() : null;

        return Symbol.builder()
                .id("sym_" + index)
                .name(row.getName())
                .mangledName(row.getRawName())
                .kind(SymbolKind.fromTypeCode(typeCode))
                .addr(row.getAddress())
                .size(row.getSize())
                .sectionId(section != null ? section.getId() : null)
                .blockId(blockId)
                .windowId(windowId)
                .primaryLocation(primaryLocation)
                .locations(locations)
                .source(row.getSource())
                .weak(typeCode == 'w' || typeCode == 'W')
                .staticBinding(Character.isLowerCase(typeCode))
                .build();
    }

    private static Symbol mergeInto(Symbol existing, Symbol duplicate) {
        Set<String> aliases = new LinkedHashSet<>(existing.getAliases());
        String rawName = duplicate.getMangledName();
        if (rawName != null && !rawName.equals(existing.getMangledName())) {
            aliases.add(rawName);
        }

        Set<SymbolLocation> locations = new LinkedHashSet<>(existing.getLocations());
        locations.addAll(duplicate.getLocations());
        SymbolLocation primaryLocation = existing.getPrimaryLocation() != null
                ? existing.getPrimaryLocation() : duplicate.getPrimaryLocation();

        return existing.toBuilder()
                .primaryLocation(primaryLocation)
                .blockId(existing.getBlockId() != null ? existing.getBlockId()
                        : primaryLocation != null ? primaryLocation.getBlockId() : null)
                .windowId(existing.getWindowId() != null ? existing.getWindowId()
                        : primaryLocation != null ? primaryLocation.getWindowId() : null)
                .clearLocations()
                .locations(locations)
                .weak(existing.isWeak() || duplicate.isWeak())
                .staticBinding(existing.isStaticBinding() || duplicate.isStaticBinding())
                .source(existing.getSource() != null ? existing.getSource() : duplicate.getSource())
                .clearAliases()
                .aliases(aliases)
                .build();
    }
}
