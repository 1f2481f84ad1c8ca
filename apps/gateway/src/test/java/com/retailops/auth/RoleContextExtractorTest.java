package com.retailops.auth;

import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleContextExtractorTest {

    private final RoleContextExtractor extractor = new RoleContextExtractor();

    @Test
    void headerOnlyIsAccepted() {
        RoleContext ctx = extractor.extract("associate", null);
        assertThat(ctx.role()).isEqualTo(Role.ASSOCIATE);
        assertThat(ctx.source()).isEqualTo(RoleContext.Source.HEADER);
    }

    @Test
    void argumentOnlyIsAcceptedCaseInsensitively() {
        RoleContext ctx = extractor.extract(null, "  MERCH ");
        assertThat(ctx.role()).isEqualTo(Role.MERCH);
        assertThat(ctx.source()).isEqualTo(RoleContext.Source.ARGUMENT);
    }

    @Test
    void matchingHeaderAndArgument() {
        RoleContext ctx = extractor.extract("Support", "support");
        assertThat(ctx.role()).isEqualTo(Role.SUPPORT);
        assertThat(ctx.source()).isEqualTo(RoleContext.Source.BOTH);
    }

    @Test
    void missingRoleIsUnauthenticated() {
        assertThatThrownBy(() -> extractor.extract(null, " "))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).kind())
                .isEqualTo(ErrorKind.UNAUTHENTICATED_ROLE);
    }

    @Test
    void unknownRoleIsUnauthenticated() {
        assertThatThrownBy(() -> extractor.extract("admin", null))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("admin")
                .extracting(e -> ((GatewayException) e).kind())
                .isEqualTo(ErrorKind.UNAUTHENTICATED_ROLE);
    }

    @Test
    void disagreeingRolesAreRejected() {
        assertThatThrownBy(() -> extractor.extract("associate", "merch"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).kind())
                .isEqualTo(ErrorKind.ROLE_MISMATCH);
    }
}
