package com.retailops.tools.impl;

import com.retailops.config.GatewayProperties;
import com.retailops.knowledge.KnowledgeIndex;
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
public class SearchTool implements ReadTool {

    private final KnowledgeIndex index;
    private final GatewayProperties props;

    @Override
    public String name() {
        return "search";
    }

    @Override
    public String description() {
        return "Search RetailNext policy and playbook docs. Returns section ids, titles and citation urls.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of("type", "string", "description", "Free-text query, e.g. 'store hold window'")
                ),
                "required", List.of("query")
        );
    }

    @Override
    public Map<String, Object> read(ActionRequest request) {
        String query = ToolArgs.str(request.arguments(), "query");
        List<Map<String, Object>> results = index.search(query, props.getKnowledge().getSearchLimit()).stream()
                .map(s -> {
                    Map<String, Object> hit = new LinkedHashMap<>();
                    hit.put("id", s.id());
                    hit.put("title", s.title());
                    hit.put("url", s.url());
                    return hit;
                })
                .toList();
        return Map.of("results", results);
    }
}
