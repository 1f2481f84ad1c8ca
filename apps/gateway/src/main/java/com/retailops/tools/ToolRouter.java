package com.retailops.tools;

import com.retailops.api.dto.ToolCallRequest;
import com.retailops.api.dto.ToolResult;
import com.retailops.auth.RoleContext;
import com.retailops.auth.RoleContextExtractor;
import com.retailops.confirm.ConfirmationStateMachine;
import com.retailops.confirm.Preview;
import com.retailops.confirm.ValidatedRequest;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import com.retailops.ledger.BeginOutcome;
import com.retailops.ledger.IdempotencyKeys;
import com.retailops.ledger.IdempotencyLedger;
import com.retailops.ledger.LedgerEntry;
import com.retailops.ledger.LedgerStatus;
import com.retailops.tools.support.ArgumentValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Single entry point for a tool call:
 * <ol>
 *   <li>resolve role, look up and authorize the tool, validate arguments;</li>
 *   <li>READ: call the backend and return {@code ok};</li>
 *   <li>WRITE: replay from the ledger if the key already succeeded, otherwise issue a preview
 *   (no token) or confirm the token, claim the ledger key and execute once.</li>
 * </ol>
 * Every failure comes back as a structured {@link ToolResult}; nothing is thrown to the caller.
 * Blocking: call from a worker thread, not an event loop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolRouter {

    static final String ARG_ROLE = "role";
    static final String ARG_CONFIRM_TOKEN = "confirm_token";
    static final String ARG_CONFIRMATION_TOKEN = "confirmation_token";
    static final String ARG_IDEMPOTENCY_KEY = "idempotency_key";

    // 控制参数：不属于工具参数，不参与 canonical 计算
    private static final Set<String> CONTROL_KEYS =
            Set.of(ARG_ROLE, ARG_CONFIRM_TOKEN, ARG_CONFIRMATION_TOKEN, ARG_IDEMPOTENCY_KEY);

    private final RoleContextExtractor roles;
    private final ToolRegistry registry;
    private final ArgumentValidator validator;
    private final ConfirmationStateMachine confirmations;
    private final IdempotencyKeys keys;
    private final IdempotencyLedger ledger;
    private final Clock clock;

    public ToolResult handle(ToolCallRequest call, String headerRole) {
        String toolName = call == null ? null : call.name();
        log.debug("[ROUTER] tool={} headerRole={}", toolName, headerRole);
        if (call == null || toolName == null || toolName.isBlank()) {
            return ToolResult.error(toolName,
                    new GatewayException(ErrorKind.UNKNOWN_TOOL, "Tool name is required."));
        }
        try {
            // 1) 拆出控制参数
            Map<String, Object> raw = call.arguments() == null ? Map.of() : call.arguments();
            String argRole = text(raw.get(ARG_ROLE));
            String token = firstText(call.confirmationToken(), raw.get(ARG_CONFIRMATION_TOKEN), raw.get(ARG_CONFIRM_TOKEN));
            String clientKey = firstText(call.idempotencyKey(), raw.get(ARG_IDEMPOTENCY_KEY));

            Map<String, Object> args = new LinkedHashMap<>();
            raw.forEach((k, v) -> {
                if (v != null && !CONTROL_KEYS.contains(k)) args.put(k, v);
            });

            // 2) 角色 -> 工具 -> 授权 -> 参数
            RoleContext role = roles.extract(headerRole, argRole);
            ToolDefinition definition = registry.lookup(toolName);
            registry.authorize(definition, role);
            Map<String, Object> validated = validator.validate(definition, args);
            GatewayTool tool = registry.tool(definition.name());
            tool.validate(validated);

            ActionRequest request = new ActionRequest(definition.name(), role, validated, token, clientKey);
            if (!definition.isWrite()) {
                return read((ReadTool) tool, request);
            }
            return write((WriteTool) tool, request);
        } catch (GatewayException ex) {
            log.debug("[ROUTER-ERR] tool={} kind={} msg={}", toolName, ex.kind(), ex.getMessage());
            return ToolResult.error(toolName, ex);
        }
    }

    private ToolResult read(ReadTool tool, ActionRequest request) {
        Map<String, Object> data = tool.read(request);
        log.debug("[EXEC-OK] tool={} branch=read", request.tool());
        return ToolResult.ok(request.tool(), data);
    }

    private ToolResult write(WriteTool tool, ActionRequest request) {
        Optional<String> derived = keys.derive(request);

        // 1) 账本命中：重放或 in-flight
        if (derived.isPresent()) {
            Optional<ToolResult> settled = fromLedger(request.tool(), derived.get(), ledger.lookup(derived.get()));
            if (settled.isPresent()) {
                return settled.get();
            }
        }

        // 2) 没有 token：只出预览
        if (!request.hasConfirmationToken()) {
            Preview preview = confirmations.preview(request, tool.describeEffect(request.arguments()));
            return ToolResult.preview(preview);
        }

        // 3) 校验 token，抢占账本 key，执行一次
        String key = derived.orElseThrow(() -> new IllegalStateException("confirmed write without ledger key"));
        ValidatedRequest confirmed = confirmations.confirm(request.confirmationToken(), request, key);
        if (confirmed.repeat()) {
            return repeatedConfirm(request.tool(), confirmed.ledgerKey());
        }

        BeginOutcome begin = ledger.begin(key, request.tool());
        if (begin.type() != BeginOutcome.Type.PROCEED) {
            return fromLedger(request.tool(), key, Optional.of(begin.entry()))
                    .orElseThrow(() -> new IllegalStateException("ledger refused " + key + " without a settled entry"));
        }
        return execute(tool, confirmed, key);
    }

    /** token 已被确认过：只按首次确认绑定的 key 查账本，绝不再执行 */
    private ToolResult repeatedConfirm(String tool, String key) {
        Optional<LedgerEntry> entry = ledger.lookup(key);
        Optional<ToolResult> settled = fromLedger(tool, key, entry);
        if (settled.isPresent()) {
            return settled.get();
        }
        if (entry.isEmpty()) {
            // 首个确认方已消费 token，还没来得及登记账本
            log.debug("[LEDGER-PENDING] tool={} key={} claimed=false", tool, key);
            return inFlight(tool, key);
        }
        throw new GatewayException(ErrorKind.TOKEN_NOT_FOUND,
                "Confirmation token was already used for " + tool + " and that attempt failed ("
                        + entry.get().errorKind() + "). Request a new preview.");
    }

    private ToolResult execute(WriteTool tool, ValidatedRequest confirmed, String key) {
        ActionRequest request = confirmed.request();
        WriteTool.WriteOutcome outcome;
        try {
            outcome = tool.execute(request, key);
        } catch (GatewayException ex) {
            if (ex.kind() == ErrorKind.BACKEND_AMBIGUOUS) {
                // 结果未知：保持 PENDING，等人工核对
                log.warn("[EXEC-AMBIGUOUS] tool={} key={} msg={}", request.tool(), key, ex.getMessage());
            } else {
                ledger.fail(key, ex.kind(), ex.getMessage());
            }
            GatewayException reported = ex;
            if (ex.kind() == ErrorKind.BACKEND_REJECTED) {
                String fallback = tool.rejectionFallback(request.arguments());
                if (fallback != null) {
                    reported = new GatewayException(ex.kind(), ex.getMessage(), fallback, ex);
                }
            }
            return ToolResult.error(request.tool(), reported, key);
        } catch (RuntimeException ex) {
            log.error("[EXEC-ERR] tool={} key={} ex={}: {}", request.tool(), key,
                    ex.getClass().getSimpleName(), ex.getMessage(), ex);
            return ToolResult.error(request.tool(), new GatewayException(ErrorKind.BACKEND_AMBIGUOUS,
                    "Unexpected failure while executing " + request.tool() + "; the write may or may not have been applied.",
                    null, ex), key);
        }

        ToolResult result = ToolResult.executed(request.tool(), outcome.status(), outcome.id(), clock.instant(),
                key, outcome.data());
        ledger.complete(key, result);
        log.info("[EXEC-OK] tool={} status={} id={} key={}", request.tool(), outcome.status(), outcome.id(), key);
        return result;
    }

    private Optional<ToolResult> fromLedger(String tool, String key, Optional<LedgerEntry> entry) {
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        LedgerEntry e = entry.get();
        if (e.status() == LedgerStatus.SUCCEEDED && e.result() != null) {
            log.debug("[LEDGER-HIT] tool={} key={} reused=true", tool, key);
            return Optional.of(e.result().asReplay());
        }
        if (e.status() == LedgerStatus.PENDING) {
            log.debug("[LEDGER-PENDING] tool={} key={}", tool, key);
            return Optional.of(inFlight(tool, key));
        }
        return Optional.empty();
    }

    private static ToolResult inFlight(String tool, String key) {
        return ToolResult.error(tool, new GatewayException(ErrorKind.IN_FLIGHT,
                tool + " with this idempotency key is still in flight or awaiting verification."), key);
    }

    private static String firstText(Object... candidates) {
        for (Object candidate : candidates) {
            String s = text(candidate);
            if (s != null) return s;
        }
        return null;
    }

    private static String text(Object value) {
        if (value == null) return null;
        String s = Objects.toString(value).trim();
        return s.isEmpty() ? null : s;
    }
}
