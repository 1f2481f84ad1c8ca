package com.retailops.catalog;

import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Known SKUs from the {@code sku} column of {@code products.csv}.
 * When the file is missing the guard is disabled and every SKU passes through to RetailCore.
 */
@Component
@Slf4j
public class SkuCatalog {

    private static final String SKU_COLUMN = "sku";

    private final GatewayProperties props;
    private final ResourceLoader loader = new DefaultResourceLoader();
    private volatile Set<String> skus = Set.of();
    private volatile boolean enabled;

    public SkuCatalog(GatewayProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void load() throws IOException {
        String location = props.getCatalog().getProductsCsv();
        Resource resource = loader.getResource(location);
        if (!resource.exists()) {
            log.warn("[catalog] {} not found, SKU guardrail disabled", location);
            return;
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .build();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (header == null || header.isEmpty()) {
                log.warn("[catalog] {} is empty, SKU guardrail disabled", location);
                return;
            }
            if (!header.containsKey(SKU_COLUMN)) {
                throw new IllegalStateException("products csv " + location + " has no 'sku' column: " + header.keySet());
            }
            Set<String> loaded = new HashSet<>();
            for (CSVRecord record : parser) {
                if (!record.isSet(SKU_COLUMN)) continue;
                String sku = record.get(SKU_COLUMN);
                if (!sku.isEmpty()) loaded.add(sku);
            }
            this.skus = Collections.unmodifiableSet(loaded);
            this.enabled = true;
            log.info("[catalog] loaded {} sku(s) from {}", loaded.size(), location);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isKnown(String sku) {
        return !enabled || (sku != null && skus.contains(sku));
    }

    public void requireKnown(String sku) {
        if (!isKnown(sku)) {
            throw new GatewayException(ErrorKind.INVALID_ARGUMENTS,
                    "Unknown SKU '" + sku + "'. Use a SKU from the product catalog.",
                    "Check the SKU spelling or search the catalog before retrying.");
        }
    }
}
