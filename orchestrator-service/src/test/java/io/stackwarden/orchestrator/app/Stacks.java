package io.stackwarden.orchestrator.app;

import io.stackwarden.stack.model.ResolvedService;
import io.stackwarden.stack.model.ResolvedStack;
import java.util.List;

/**
 * Stack descriptions shared by the lifecycle tests.
 */
final class Stacks {

    private Stacks() {
    }

    /**
     * {@code db <- api}, with {@code gateway} as ingress and no declared dependencies.
     */
    static ResolvedStack shop(String version) {
        return shop(version, false);
    }

    static ResolvedStack shop(String version, boolean rollbackDisabled) {
        List<ResolvedService> services = List.of(
            ResolvedService.builder("gateway", "registry.local:5000/shop/gateway").port("8080:80").build(),
            ResolvedService.builder("api", "registry.local:5000/shop/api").version(version).dependsOn("db").build(),
            ResolvedService.builder("db", "postgres:16").volume("data", "/var/lib/postgresql/data")
                .ignoreDuringMaintenance(true).build());
        return new ResolvedStack("shop", version, null, services, null, null, "gateway", rollbackDisabled);
    }
}
