package com.openforge.sidekick.tool;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text rendering for model listings and model descriptions.
 *
 * Categories (first match wins):
 *   coding      — id contains "code" or "coder"
 *   specialized — id contains "db", "os", "math" or "embedding"
 *   general     — everything else
 */
final class ModelCatalog {

    private static final List<String> SPECIALIZED_MARKERS = List.of("db", "os", "math", "embedding");

    private ModelCatalog() {}

    static String render(List<String> modelIds, String address, String recommendedModel) {
        List<String> coding      = new ArrayList<>();
        List<String> general     = new ArrayList<>();
        List<String> specialized = new ArrayList<>();

        for (String id : modelIds) {
            String lower = id.toLowerCase(Locale.ROOT);
            if (lower.contains("code") || lower.contains("coder")) {
                coding.add(id);
            } else if (SPECIALIZED_MARKERS.stream().anyMatch(lower::contains)) {
                specialized.add(id);
            } else {
                general.add(id);
            }
        }

        StringBuilder sb = new StringBuilder()
                .append("🤖 Available models in LM Studio (").append(address).append("):\n\n");

        if (!coding.isEmpty()) {
            sb.append("💻 **Coding Models** (Great for sidekick tasks):\n");
            for (String id : coding) {
                sb.append("  - ").append(id);
                if (id.contains(recommendedModel)) sb.append(" ⭐ RECOMMENDED");
                sb.append('\n');
            }
            sb.append('\n');
        }
        if (!general.isEmpty()) {
            sb.append("🌐 **General Models**:\n");
            general.forEach(id -> sb.append("  - ").append(id).append('\n'));
            sb.append('\n');
        }
        if (!specialized.isEmpty()) {
            sb.append("🔧 **Specialized Models**:\n");
            specialized.forEach(id -> sb.append("  - ").append(id).append('\n'));
        }
        return sb.toString();
    }

    /** Capability hint for the currently loaded model; empty when nothing specific applies. */
    static String capabilities(String modelName) {
        String lower = modelName.toLowerCase(Locale.ROOT);
        if (lower.contains("coder")) {
            return """
                    💡 This is a coding model - perfect for:
                      • Code generation and refactoring
                      • Debugging and optimization
                      • Documentation tasks
                    """;
        }
        if (lower.contains("instruct")) {
            return """
                    💡 This is an instruction-following model - great for:
                      • General Q&A and explanations
                      • Task automation
                      • Content generation
                    """;
        }
        return "";
    }
}
