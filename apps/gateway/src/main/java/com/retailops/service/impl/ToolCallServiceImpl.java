package com.retailops.service.impl;

import com.retailops.api.dto.ToolCallRequest;
import com.retailops.api.dto.ToolResult;
import com.retailops.ledger.IdempotencyLedger;
import com.retailops.ledger.LedgerEntry;
import com.retailops.service.ToolCallService;
import com.retailops.tools.ToolRegistry;
import com.retailops.tools.ToolRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ToolCallServiceImpl implements ToolCallService {

    private final ToolRouter router;
    private final ToolRegistry registry;
    private final IdempotencyLedger ledger;

    @Override
    public Mono<ToolResult> call(ToolCallRequest request, String headerRole) {
        // 路由内部会阻塞在后端调用上，放到 boundedElastic；
        // 订阅方断开也不会打断已经开始的写操作
        return Mono.fromCallable(() -> router.handle(request, headerRole))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(result -> log.debug("[CALL-DONE] tool={} status={}", result.tool(), result.status()));
    }

    @Override
    public List<Map<String, Object>> catalog() {
        return registry.catalog();
    }

    @Override
    public Mono<LedgerEntry> ledgerEntry(String key) {
        return Mono.justOrEmpty(ledger.lookup(key));
    }
}
