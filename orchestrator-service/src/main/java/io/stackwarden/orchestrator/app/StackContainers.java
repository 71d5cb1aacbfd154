package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.stack.model.DeploymentStep;
import io.stackwarden.stack.model.StackLabels;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label sets identifying the containers and networks owned by a stack.
 */
final class StackContainers {

    private StackContainers() {
    }

    static Map<String, String> selector(StackKey key) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(StackLabels.STACK, key.stackName());
        labels.put(StackLabels.ENVIRONMENT, key.environmentId());
        return labels;
    }

    static Map<String, String> containerLabels(StackKey key, DeploymentStep step) {
        Map<String, String> labels = selector(key);
        labels.put(StackLabels.CONTEXT, step.contextName());
        if (step.ignoreDuringMaintenance()) {
            labels.put(StackLabels.MAINTENANCE, StackLabels.MAINTENANCE_IGNORE);
        }
        if (step.init()) {
            labels.put(StackLabels.LIFECYCLE, StackLabels.LIFECYCLE_INIT);
        }
        return labels;
    }

    static boolean initContainer(Map<String, String> labels) {
        return StackLabels.LIFECYCLE_INIT.equals(labels.get(StackLabels.LIFECYCLE));
    }

    static boolean ignoredDuringMaintenance(Map<String, String> labels) {
        return StackLabels.MAINTENANCE_IGNORE.equals(labels.get(StackLabels.MAINTENANCE));
    }
}
