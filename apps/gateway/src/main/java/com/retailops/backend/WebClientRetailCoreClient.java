package com.retailops.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.auth.Role;
import com.retailops.backend.dto.*;
import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * RetailCore over HTTP/JSON.
 *
 * <p>Retry policy:</p>
 * <ul>
 *   <li>reads: retried with backoff on connect failures, timeouts and 5xx;</li>
 *   <li>writes: retried only when the connection was never established, i.e. the request
 *   provably did not reach RetailCore. Any later failure is BACKEND_AMBIGUOUS.</li>
 * </ul>
 */
@Component
@Slf4j
public class WebClientRetailCoreClient implements RetailCoreClient {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final GatewayProperties props;

    public WebClientRetailCoreClient(WebClient retailCoreWebClient, ObjectMapper mapper, GatewayProperties props) {
        this.webClient = retailCoreWebClient;
        this.mapper = mapper;
        this.props = props;
    }

    @Override
    public InventoryAvailability lookupInventory(InventoryQuery query, Role role) {
        Mono<ResponseEntity<InventoryAvailability>> call = webClient.get()
                .uri(b -> b.path("/inventory/lookup")
                        .queryParam("sku", query.sku())
                        .queryParam("store_id", query.storeId())
                        .queryParam("radius_miles", query.radiusMiles())
                        .build())
                .header(props.getRoleHeader(), role.wireName())
                .retrieve()
                .toEntity(InventoryAvailability.class);

        ResponseEntity<InventoryAvailability> resp = read("lookupInventory", call);
        InventoryAvailability body = resp.getBody() != null
                ? resp.getBody()
                : new InventoryAvailability(query.sku(), query.storeId(), query.radiusMiles(), null, 0);
        return body.withUpstreamStatus(resp.getStatusCode().value());
    }

    @Override
    public Reservation reserveItem(ReserveItemCommand command, Role role, String idempotencyKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sku", command.sku());
        payload.put("store_id", command.storeId());
        payload.put("qty", command.qty());
        payload.put("confirm", true);

        ResponseEntity<Reservation> resp = write("reserveItem", post("/reserve", payload, role, idempotencyKey)
                .toEntity(Reservation.class));
        Reservation body = resp.getBody();
        return body != null ? body
                : new Reservation(null, command.sku(), command.storeId(), command.qty(), "reserved", null, null, null);
    }

    @Override
    public Transfer createTransfer(TransferCommand command, Role role, String idempotencyKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from_store", command.fromStore());
        payload.put("to_store", command.toStore());
        payload.put("sku", command.sku());
        payload.put("qty", command.qty());
        if (StringUtils.hasText(command.reason())) {
            payload.put("reason", command.reason());
        }
        payload.put("confirm", true);

        ResponseEntity<Transfer> resp = write("createTransfer", post("/transfer", payload, role, idempotencyKey)
                .toEntity(Transfer.class));
        Transfer body = resp.getBody();
        return body != null ? body
                : new Transfer(null, command.fromStore(), command.toStore(), command.sku(), command.qty(), "created", null, null);
    }

    @Override
    public Ticket createTicket(TicketCommand command, Role role, String idempotencyKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("store_id", command.storeId());
        payload.put("category", command.category());
        payload.put("severity", command.severity());
        payload.put("description", command.description());

        ResponseEntity<Ticket> resp = write("createTicket", post("/tickets", payload, role, idempotencyKey)
                .toEntity(Ticket.class));
        Ticket body = resp.getBody();
        return body != null ? body
                : new Ticket(null, command.storeId(), command.category(), command.severity(), "open", null);
    }

    // ======= 执行与分类 =======

    private WebClient.ResponseSpec post(String path, Map<String, Object> payload, Role role, String idempotencyKey) {
        return webClient.post()
                .uri(path)
                .header(props.getRoleHeader(), role.wireName())
                .headers(h -> {
                    if (StringUtils.hasText(idempotencyKey)) h.set(IDEMPOTENCY_HEADER, idempotencyKey);
                })
                .bodyValue(payload)
                .retrieve();
    }

    private <T> T read(String op, Mono<T> call) {
        Duration timeout = props.getBackend().getReadTimeout();
        log.debug("[BACKEND-CALL] op={} kind=read timeout={}", op, timeout);
        return call
                .timeout(timeout)
                .retryWhen(retrySpec(op, WebClientRetailCoreClient::isRetryableRead))
                .onErrorMap(ex -> classify(op, false, ex))
                .block();
    }

    private <T> T write(String op, Mono<T> call) {
        Duration timeout = props.getBackend().getWriteTimeout();
        log.debug("[BACKEND-CALL] op={} kind=write timeout={}", op, timeout);
        return call
                .timeout(timeout)
                .retryWhen(retrySpec(op, WebClientRetailCoreClient::isConnectFailure))
                .onErrorMap(ex -> classify(op, true, ex))
                .block();
    }

    private Retry retrySpec(String op, Predicate<Throwable> retryable) {
        GatewayProperties.Retry r = props.getBackend().getRetry();
        return Retry.backoff(Math.max(0, r.getMaxAttempts()), Duration.ofMillis(Math.max(1, r.getBackoffMs())))
                .filter(retryable)
                .doBeforeRetry(signal -> log.warn("[BACKEND-RETRY] op={} attempt={} cause={}",
                        op, signal.totalRetries() + 1, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    BackendException classify(String op, boolean write, Throwable ex) {
        if (ex instanceof BackendException be) {
            return be;
        }
        BackendException out;
        if (ex instanceof WebClientResponseException w) {
            int status = w.getStatusCode().value();
            String detail = detail(op, w);
            if (w.getStatusCode().is4xxClientError()) {
                out = new BackendException(ErrorKind.BACKEND_REJECTED, op, status,
                        "RetailCore rejected " + op + " (" + status + "): " + detail, w);
            } else if (write) {
                out = new BackendException(ErrorKind.BACKEND_AMBIGUOUS, op, status,
                        "RetailCore answered " + status + " to " + op + "; the write may or may not have been applied.", w);
            } else {
                out = new BackendException(ErrorKind.BACKEND_UNAVAILABLE, op, status,
                        "RetailCore failed " + op + " (" + status + "): " + detail, w);
            }
        } else if (ex instanceof TimeoutException) {
            out = write
                    ? new BackendException(ErrorKind.BACKEND_AMBIGUOUS, op, 0,
                    "RetailCore did not answer " + op + " within " + props.getBackend().getWriteTimeout()
                            + "; the write may or may not have been applied.", ex)
                    : new BackendException(ErrorKind.BACKEND_TIMEOUT, op, 0,
                    "RetailCore did not answer " + op + " within " + props.getBackend().getReadTimeout() + ".", ex);
        } else if (isConnectFailure(ex)) {
            out = new BackendException(ErrorKind.BACKEND_UNAVAILABLE, op, 0,
                    "RetailCore is unreachable at " + props.getBackend().getBaseUrl() + ": " + rootMessage(ex), ex);
        } else if (write) {
            out = new BackendException(ErrorKind.BACKEND_AMBIGUOUS, op, 0,
                    "Transport failure during " + op + " after the request was sent: " + rootMessage(ex), ex);
        } else {
            out = new BackendException(ErrorKind.BACKEND_UNAVAILABLE, op, 0,
                    "Transport failure during " + op + ": " + rootMessage(ex), ex);
        }
        log.error("[BACKEND-ERR] op={} write={} kind={} status={} msg={}",
                out.operation(), write, out.kind(), out.upstreamStatus(), out.getMessage());
        return out;
    }

    static boolean isRetryableRead(Throwable ex) {
        if (ex instanceof TimeoutException || ex instanceof WebClientRequestException) return true;
        return ex instanceof WebClientResponseException w && w.getStatusCode().is5xxServerError();
    }

    /** 连接都没建立起来：请求必然没有到达 RetailCore */
    static boolean isConnectFailure(Throwable ex) {
        if (!(ex instanceof WebClientRequestException)) return false;
        for (Throwable t = ex.getCause(); t != null; t = t.getCause()) {
            if (t instanceof ConnectException || t instanceof UnknownHostException) return true;
        }
        return false;
    }

    private String detail(String op, WebClientResponseException w) {
        String raw = w.getResponseBodyAsString();
        if (!StringUtils.hasText(raw)) {
            return w.getStatusText();
        }
        try {
            JsonNode node = mapper.readTree(raw);
            JsonNode detail = node.path("detail");
            return detail.isMissingNode() || detail.isNull() ? raw : detail.isTextual() ? detail.asText() : detail.toString();
        } catch (Exception e) {
            log.debug("[BACKEND-ERR] op={} error body is not JSON: {}", op, raw);
            return raw;
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
