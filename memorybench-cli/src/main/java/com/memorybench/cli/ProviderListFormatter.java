package com.memorybench.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memorybench.capability.CoreOperations;
import com.memorybench.manifest.ManifestJson;
import com.memorybench.manifest.ProviderManifest;
import com.memorybench.registry.LoadedProviderEntry;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/** Renders registered providers as a text table or as JSON. */
final class ProviderListFormatter {

    static final String EMPTY_MESSAGE = "No providers configured.\n\n"
            + "To add a provider, create providers/<name>/manifest.json";

    private static final String[] HEADERS = {"Name", "Type", "Version", "Core Ops"};
    private static final String GAP = "  ";

    private ProviderListFormatter() {
    }

    static String formatTable(List<LoadedProviderEntry> providers) {
        if (providers.isEmpty()) {
            return EMPTY_MESSAGE;
        }
        List<String[]> rows = new ArrayList<>();
        for (LoadedProviderEntry entry : providers) {
            ProviderManifest manifest = entry.manifest();
            rows.add(new String[] {
                entry.name(),
                manifest.getProvider().getType().value(),
                manifest.getProvider().getVersion(),
                coreOps(manifest.getCapabilities().getCoreOperations())
            });
        }

        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            widths[i] = HEADERS[i].length();
            for (String[] row : rows) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        String header = line(HEADERS, widths);
        sb.append(header).append('\n');
        sb.append("-".repeat(header.length()));
        for (String[] row : rows) {
            sb.append('\n').append(line(row, widths));
        }
        return sb.toString();
    }

    static String formatJson(List<LoadedProviderEntry> providers) {
        ObjectMapper mapper = ManifestJson.mapper();
        ObjectNode root = mapper.createObjectNode();
        ArrayNode list = root.putArray("providers");
        for (LoadedProviderEntry entry : providers) {
            ProviderManifest manifest = entry.manifest();
            ObjectNode node = list.addObject();
            node.put("name", entry.name());
            node.put("type", manifest.getProvider().getType().value());
            node.put("version", manifest.getProvider().getVersion());
            node.set("capabilities", mapper.valueToTree(manifest.getCapabilities()));
            node.set("semantic_properties", mapper.valueToTree(manifest.getSemanticProperties()));
            node.set("conformance_tests", mapper.valueToTree(manifest.getConformanceTests()));
            node.put("manifest_hash", entry.manifestHash());
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String coreOps(CoreOperations core) {
        List<String> ops = new ArrayList<>();
        if (core.isAddMemory()) ops.add("add");
        if (core.isRetrieveMemory()) ops.add("retrieve");
        if (core.isDeleteMemory()) ops.add("delete");
        return ops.isEmpty() ? "-" : String.join(",", ops);
    }

    private static String line(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) sb.append(GAP);
            // last column is not padded
            sb.append(i == cells.length - 1 ? cells[i] : pad(cells[i], widths[i]));
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
