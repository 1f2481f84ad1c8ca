package com.retailops.service;

import com.retailops.api.dto.ToolCallRequest;
import com.retailops.api.dto.ToolResult;
import com.retailops.ledger.LedgerEntry;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

public interface ToolCallService {

    /** 执行一次工具调用；失败也以结构化结果返回，不发 error 信号 */
    Mono<ToolResult> call(ToolCallRequest request, String headerRole);

    List<Map<String, Object>> catalog();

    Mono<LedgerEntry> ledgerEntry(String key);
}
