package com.openforge.sidekick.llm.model;

import java.util.List;

/**
 * Response of {@code GET /v1/models}:
 *   {"object":"list","data":[{"id":"qwen2.5-coder-32b-instruct","object":"model","owned_by":"organization_owner"}]}
 */
public record ModelList(
        String object,
        List<ModelInfo> data
) {

    /** Model ids in backend order; never null. */
    public List<String> ids() {
        if (data == null) return List.of();
        return data.stream()
                .filter(m -> m != null && m.id() != null)
                .map(ModelInfo::id)
                .toList();
    }

    public record ModelInfo(
            String id,
            String object,
            String ownedBy
    ) {}
}
