package com.retailops.tools.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonCanonicalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void keysAreSortedAtEveryLevel() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("z", 1);
        nested.put("a", 2);
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("store_id", "ST002");
        args.put("meta", nested);
        args.put("items", List.of(nested));

        assertThat(JsonCanonicalizer.canonicalize(mapper, args))
                .isEqualTo("{\"items\":[{\"a\":2,\"z\":1}],\"meta\":{\"a\":2,\"z\":1},\"store_id\":\"ST002\"}");
    }

    @Test
    void equivalentNumbersCanonicalizeAlike() {
        assertThat(JsonCanonicalizer.canonicalize(mapper, Map.of("qty", 2)))
                .isEqualTo(JsonCanonicalizer.canonicalize(mapper, Map.of("qty", 2.0)))
                .isEqualTo("{\"qty\":2}");
        assertThat(JsonCanonicalizer.canonicalize(mapper, Map.of("radius_miles", 12.50)))
                .isEqualTo("{\"radius_miles\":12.5}");
    }

    @Test
    void nullValuesAreDropped() {
        Map<String, Object> args = new HashMap<>();
        args.put("reason", null);
        args.put("qty", 1);

        assertThat(JsonCanonicalizer.canonicalize(mapper, args)).isEqualTo("{\"qty\":1}");
        assertThat(JsonCanonicalizer.canonicalize(mapper, null)).isEqualTo("{}");
    }
}
