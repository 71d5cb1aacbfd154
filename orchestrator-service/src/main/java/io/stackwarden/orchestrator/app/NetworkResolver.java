package io.stackwarden.orchestrator.app;

import io.stackwarden.stack.model.DockerNames;
import io.stackwarden.stack.model.NetworkDeclaration;
import io.stackwarden.stack.model.NetworkDefinition;
import io.stackwarden.stack.model.ResolvedStack;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps logical network names of a stack to runtime names. Managed networks are scoped by the stack
 * identity so stacks sharing a host stay isolated; external networks keep their name.
 */
public class NetworkResolver {

    public static final String DEFAULT_NETWORK = "default";

    public Map<String, NetworkDefinition> resolve(ResolvedStack stack) {
        String identity = stack.effectiveIdentity();
        Map<String, NetworkDefinition> resolved = new TreeMap<>();
        stack.networks().forEach((name, declaration) -> resolved.put(name, resolve(identity, name, declaration)));
        return resolved;
    }

    public NetworkDefinition resolve(String stackIdentity, String logicalName, NetworkDeclaration declaration) {
        if (declaration != null && declaration.external()) {
            String externalName = declaration.externalName();
            return new NetworkDefinition(true,
                externalName == null || externalName.isBlank() ? logicalName : externalName);
        }
        return new NetworkDefinition(false, DockerNames.networkName(stackIdentity, logicalName));
    }

    public NetworkDefinition defaultNetwork(String stackIdentity) {
        return resolve(stackIdentity, DEFAULT_NETWORK, NetworkDeclaration.managed());
    }
}
