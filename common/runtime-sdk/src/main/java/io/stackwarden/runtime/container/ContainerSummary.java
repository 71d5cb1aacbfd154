package io.stackwarden.runtime.container;

import java.util.Locale;
import java.util.Map;

/**
 * Container as returned by a listing. {@code status} is the runtime's human readable status line,
 * for example {@code Up 5 minutes (healthy)}.
 */
public record ContainerSummary(String id,
                               String name,
                               String image,
                               String state,
                               String status,
                               Map<String, String> labels) {

  public ContainerSummary {
    labels = labels == null || labels.isEmpty() ? Map.of() : Map.copyOf(labels);
    state = state == null ? "" : state.toLowerCase(Locale.ROOT);
  }

  public boolean running() {
    return "running".equals(state);
  }

  public String label(String key) {
    return labels.get(key);
  }

  /**
   * Health check status embedded in the status line, or {@code null} when the image defines none.
   */
  public String healthStatus() {
    if (status == null) {
      return null;
    }
    String lower = status.toLowerCase(Locale.ROOT);
    if (lower.contains("(unhealthy)")) {
      return "unhealthy";
    }
    if (lower.contains("(healthy)")) {
      return "healthy";
    }
    if (lower.contains("(health: starting)")) {
      return "starting";
    }
    return null;
  }
}
