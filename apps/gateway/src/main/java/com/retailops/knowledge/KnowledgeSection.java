package com.retailops.knowledge;

public record KnowledgeSection(String id, String title, String url, String content) {}
