package com.retailops.tools.impl;

import com.retailops.knowledge.KnowledgeIndex;
import com.retailops.knowledge.KnowledgeSection;
import com.retailops.tools.ActionRequest;
import com.retailops.tools.GatewayToolComponent;
import com.retailops.tools.ReadTool;
import com.retailops.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@GatewayToolComponent
@RequiredArgsConstructor
public class FetchTool implements ReadTool {

    private final KnowledgeIndex index;

    @Override
    public String name() {
        return "fetch";
    }

    @Override
    public String description() {
        return "Fetch the full text of a doc section by id (from search results).";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "id", Map.of("type", "string", "minLength", 1,
                                "description", "Section id, e.g. 'doc:Returns_and_Holds_Policy#section-3'")
                ),
                "required", List.of("id")
        );
    }

    @Override
    public Map<String, Object> read(ActionRequest request) {
        KnowledgeSection section = index.fetch(ToolArgs.str(request.arguments(), "id"));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", section.id());
        out.put("title", section.title());
        out.put("url", section.url());
        out.put("content", section.content());
        return out;
    }
}
