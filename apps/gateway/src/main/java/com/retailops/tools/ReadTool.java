package com.retailops.tools;

import java.util.Map;

public interface ReadTool extends GatewayTool {

    @Override
    default ToolClassification classification() {
        return ToolClassification.READ;
    }

    Map<String, Object> read(ActionRequest request);
}
