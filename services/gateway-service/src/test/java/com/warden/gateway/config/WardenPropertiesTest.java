package com.warden.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.security.ClientKeyStrategy;
import com.warden.security.PrivilegeLevel;
import com.warden.security.RoutePolicy;
import com.warden.security.RouteTable;
import com.warden.security.SigningKeyException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WardenProperties")
class WardenPropertiesTest {

    private static final WardenProperties.Jwt JWT =
            new WardenProperties.Jwt("properties-test-secret-0123456789abcdef", null, null, null);

    @Test
    @DisplayName("applies defaults for optional sections")
    void defaults() {
        var props = new WardenProperties(null, JWT, null, null, null, 0, null);

        assertThat(props.serviceName()).isEqualTo("warden-gateway");
        assertThat(props.rateLimit().maxRequests()).isEqualTo(3);
        assertThat(props.rateLimit().window()).isEqualTo(Duration.ofSeconds(20));
        assertThat(props.rateLimit().purgeInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(props.routes()).isEmpty();
        assertThat(props.clientKeyStrategy()).isEqualTo(ClientKeyStrategy.SOURCE_ADDRESS);
        assertThat(props.bcryptStrength()).isEqualTo(10);
        assertThat(props.seed().enabled()).isFalse();
        assertThat(props.tokenConfig().accessTokenTtl()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("turns route entries into a RouteTable")
    void routeTable() {
        var props = new WardenProperties("svc", JWT, null, List.of(
                new WardenProperties.Route("/open", RoutePolicy.Kind.NONE, null, null),
                new WardenProperties.Route("/pw", RoutePolicy.Kind.PASSWORD, "Password123", null),
                new WardenProperties.Route("/admin", RoutePolicy.Kind.TOKEN, null, 2),
                new WardenProperties.Route("/any-token", RoutePolicy.Kind.TOKEN, null, null)),
                null, 4, null);

        RouteTable table = props.routeTable();

        assertThat(table.policyFor("/open")).contains(RoutePolicy.none());
        assertThat(table.policyFor("/pw")).contains(RoutePolicy.password("Password123"));
        assertThat(table.policyFor("/admin")).contains(RoutePolicy.token(PrivilegeLevel.ADMIN));
        assertThat(table.policyFor("/any-token")).contains(RoutePolicy.token(PrivilegeLevel.GUEST));
    }

    @Test
    @DisplayName("rejects a password route without a password")
    void passwordRouteWithoutPassword() {
        var props = new WardenProperties("svc", JWT, null, List.of(
                new WardenProperties.Route("/pw", RoutePolicy.Kind.PASSWORD, null, null)),
                null, 4, null);

        assertThatThrownBy(props::routeTable).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("refuses a weak signing secret when building the token configuration")
    void weakSecret() {
        var props = new WardenProperties("svc", new WardenProperties.Jwt("short", null, null, null),
                null, null, null, 4, null);

        assertThatThrownBy(props::tokenConfig).isInstanceOf(SigningKeyException.class);
    }

    @Test
    @DisplayName("never prints secrets")
    void toStringMasksSecrets() {
        var props = new WardenProperties("svc", JWT, null, List.of(
                new WardenProperties.Route("/pw", RoutePolicy.Kind.PASSWORD, "Password123", null)),
                null, 4, new WardenProperties.Seed(true, "user-pass-1", "admin-pass-1"));

        assertThat(props.toString())
                .doesNotContain(JWT.secret())
                .doesNotContain("Password123")
                .doesNotContain("user-pass-1")
                .doesNotContain("admin-pass-1");
    }
}
