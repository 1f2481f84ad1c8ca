package com.retailops.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Gateway settings bound from {@code retail.gateway.*}.
 *
 * <p>Defaults: previews live for minutes, ledger entries for a day. Override through
 * {@code application.yml} or environment variables (e.g. {@code RETAIL_GATEWAY_BACKEND_BASE_URL}).</p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "retail.gateway")
public class GatewayProperties {

    /** 传输层角色头 */
    @NotBlank(message = "retail.gateway.role-header 不能为空")
    private String roleHeader = "X-DEMO-ROLE";

    @Valid
    private Confirm confirm = new Confirm();
    @Valid
    private Ledger ledger = new Ledger();
    @Valid
    private Backend backend = new Backend();
    @Valid
    private Guardrails guardrails = new Guardrails();
    @Valid
    private Knowledge knowledge = new Knowledge();
    private Catalog catalog = new Catalog();

    @Data
    public static class Confirm {
        /** preview token 有效期 */
        @NotNull
        private Duration previewTtl = Duration.ofMinutes(5);
        /** 过期 preview 的定时清理间隔（毫秒） */
        private long sweepIntervalMs = 60_000;
    }

    @Data
    public static class Ledger {
        @NotNull
        private Duration retention = Duration.ofHours(24);
        @Min(1)
        private long maximumSize = 100_000;
    }

    @Data
    public static class Backend {
        @NotBlank(message = "retail.gateway.backend.base-url 不能为空")
        private String baseUrl = "http://retailcore:8080";
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(15);
        @Valid
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        @Min(0)
        private int maxAttempts = 2;
        @Min(1)
        private long backoffMs = 200;
    }

    @Data
    public static class Guardrails {
        @Min(1)
        private int minQty = 1;
        @Min(1)
        private int maxQty = 20;
    }

    @Data
    public static class Knowledge {
        /** Spring resource pattern for markdown docs, e.g. {@code file:/srv/docs/*.md} */
        @NotBlank
        private String docsPattern = "classpath*:knowledge/*.md";
        @NotBlank
        private String citationRoot = "https://retailnext.internal/docs";
        @Min(1)
        private int searchLimit = 5;
    }

    @Data
    public static class Catalog {
        private String productsCsv = "classpath:data/products.csv";
    }
}
