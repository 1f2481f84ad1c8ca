package com.retailops.tools.support;

import com.retailops.auth.Role;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import com.retailops.tools.ToolClassification;
import com.retailops.tools.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArgumentValidatorTest {

    private final ArgumentValidator validator = new ArgumentValidator();

    private final ToolDefinition reserve = new ToolDefinition("reserve_item", "test", ToolClassification.WRITE,
            EnumSet.of(Role.ASSOCIATE),
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "sku", Map.of("type", "string", "minLength", 1),
                            "store_id", Map.of("type", "string", "minLength", 1),
                            "qty", Map.of("type", "integer", "minimum", 1, "maximum", 20),
                            "radius_miles", Map.of("type", "number", "exclusiveMinimum", 0, "default", 25.0)
                    ),
                    "required", List.of("sku", "store_id", "qty")
            ));

    @Test
    void coercesNumericStringsAndTrims() {
        Map<String, Object> out = validator.validate(reserve,
                Map.of("sku", " AST-LIN-BLZ-SND-M ", "store_id", "ST002", "qty", "3"));

        assertThat(out)
                .containsEntry("sku", "AST-LIN-BLZ-SND-M")
                .containsEntry("qty", 3)
                .containsEntry("radius_miles", 25.0);
    }

    @Test
    void wholeDoubleIsAcceptedAsInteger() {
        Map<String, Object> out = validator.validate(reserve, Map.of("sku", "A", "store_id", "S", "qty", 2.0));
        assertThat(out.get("qty")).isEqualTo(2);
    }

    @Test
    void qtyOutsideGuardrailIsRejected() {
        assertThatThrownBy(() -> validator.validate(reserve, Map.of("sku", "A", "store_id", "S", "qty", 0)))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("qty")
                .extracting(e -> ((GatewayException) e).kind())
                .isEqualTo(ErrorKind.INVALID_ARGUMENTS);

        assertThatThrownBy(() -> validator.validate(reserve, Map.of("sku", "A", "store_id", "S", "qty", 21)))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("<= 20");
    }

    @Test
    void missingRequiredAndUnexpectedKeysAreAllReported() {
        Map<String, Object> args = new HashMap<>();
        args.put("sku", "A");
        args.put("colour", "red");

        assertThatThrownBy(() -> validator.validate(reserve, args))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("missing required argument 'store_id'")
                .hasMessageContaining("missing required argument 'qty'")
                .hasMessageContaining("unexpected argument 'colour'");
    }

    @Test
    void fractionalQtyAndNonPositiveRadiusAreRejected() {
        assertThatThrownBy(() -> validator.validate(reserve, Map.of("sku", "A", "store_id", "S", "qty", 1.5)))
                .hasMessageContaining("'qty' must be an integer");
        assertThatThrownBy(() -> validator.validate(reserve,
                Map.of("sku", "A", "store_id", "S", "qty", 1, "radius_miles", 0)))
                .hasMessageContaining("'radius_miles' must be > 0");
    }

    @Test
    void blankRequiredStringIsRejected() {
        assertThatThrownBy(() -> validator.validate(reserve, Map.of("sku", "   ", "store_id", "S", "qty", 1)))
                .hasMessageContaining("'sku' must not be empty");
    }
}
