package com.retailops.tools;

import java.util.Map;

public interface WriteTool extends GatewayTool {

    @Override
    default ToolClassification classification() {
        return ToolClassification.WRITE;
    }

    /**
     * Human-readable description of what {@link #execute} would do with these arguments.
     * Must not contact the backend.
     */
    String describeEffect(Map<String, Object> args);

    /**
     * Perform the write against RetailCore. Called at most once per ledger key.
     */
    WriteOutcome execute(ActionRequest request, String idempotencyKey);

    /** 后端拒绝时给调用方的替代建议；null 则使用默认文案 */
    default String rejectionFallback(Map<String, Object> args) {
        return null;
    }

    record WriteOutcome(String status, String id, Map<String, Object> data) {}
}
