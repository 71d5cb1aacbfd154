package io.stackwarden.orchestrator.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stackwarden.stack.model.NetworkDeclaration;
import io.stackwarden.stack.model.NetworkDefinition;
import io.stackwarden.stack.model.ResolvedService;
import io.stackwarden.stack.model.ResolvedStack;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NetworkResolverTest {

    private final NetworkResolver resolver = new NetworkResolver();

    @Test
    void managedNetworksAreScopedByStackIdentity() {
        NetworkDefinition backend = resolver.resolve("shop-blue", "backend", NetworkDeclaration.managed());

        assertFalse(backend.external());
        assertEquals("shop-blue_backend", backend.resolvedName());
        assertEquals("shop-blue_default", resolver.defaultNetwork("shop-blue").resolvedName());
    }

    @Test
    void externalNetworksKeepTheirName() {
        NetworkDefinition proxy = resolver.resolve("shop", "proxy", NetworkDeclaration.external("traefik_public"));
        NetworkDefinition unnamed = resolver.resolve("shop", "proxy", NetworkDeclaration.external(" "));

        assertTrue(proxy.external());
        assertEquals("traefik_public", proxy.resolvedName());
        assertEquals("proxy", unnamed.resolvedName());
    }

    @Test
    void resolvingTwiceGivesTheSameNames() {
        ResolvedStack stack = new ResolvedStack("shop", "1.0.0", "web shop",
            List.of(ResolvedService.builder("api", "img").build()),
            Map.of("backend", NetworkDeclaration.managed(), "edge", NetworkDeclaration.external("edge_net")),
            null, null, false);

        Map<String, NetworkDefinition> first = resolver.resolve(stack);
        Map<String, NetworkDefinition> second = resolver.resolve(stack);

        assertEquals(first, second);
        assertThat(first).containsOnlyKeys("backend", "edge");
        assertEquals("web_shop_backend", first.get("backend").resolvedName());
        assertEquals("edge_net", first.get("edge").resolvedName());
    }
}
