package com.retailops.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.auth.Role;
import com.retailops.auth.RoleContext;
import com.retailops.tools.ActionRequest;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyKeysTest {

    private final IdempotencyKeys keys = new IdempotencyKeys(new ObjectMapper());
    private final RoleContext associate = new RoleContext(Role.ASSOCIATE, RoleContext.Source.HEADER);

    @Test
    void noTokenAndNoClientKeyMeansNoKey() {
        ActionRequest request = new ActionRequest("reserve_item", associate, Map.of("qty", 1), null, null);
        assertThat(keys.derive(request)).isEmpty();
    }

    @Test
    void argumentOrderDoesNotChangeTheKey() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("sku", "AST-LIN-BLZ-SND-M");
        a.put("store_id", "ST002");
        a.put("qty", 1);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("qty", 1);
        b.put("store_id", "ST002");
        b.put("sku", "AST-LIN-BLZ-SND-M");

        String ka = keys.derive(new ActionRequest("reserve_item", associate, a, "T1", null)).orElseThrow();
        String kb = keys.derive(new ActionRequest("reserve_item", associate, b, "T1", null)).orElseThrow();

        assertThat(ka).isEqualTo(kb).hasSize(64);
    }

    @Test
    void clientKeyTakesPrecedenceOverToken() {
        Map<String, Object> args = Map.of("qty", 1);
        String withT1 = keys.derive(new ActionRequest("reserve_item", associate, args, "T1", "order-77")).orElseThrow();
        String withT2 = keys.derive(new ActionRequest("reserve_item", associate, args, "T2", "order-77")).orElseThrow();
        String tokenOnly = keys.derive(new ActionRequest("reserve_item", associate, args, "T1", null)).orElseThrow();

        assertThat(withT1).isEqualTo(withT2);
        assertThat(tokenOnly).isNotEqualTo(withT1);
    }

    @Test
    void differentArgumentsGiveDifferentKeys() {
        String one = keys.derive(new ActionRequest("reserve_item", associate, Map.of("qty", 1), "T1", null)).orElseThrow();
        String two = keys.derive(new ActionRequest("reserve_item", associate, Map.of("qty", 2), "T1", null)).orElseThrow();
        assertThat(one).isNotEqualTo(two);
    }
}
