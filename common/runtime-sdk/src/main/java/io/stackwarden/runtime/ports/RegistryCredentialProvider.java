package io.stackwarden.runtime.ports;

import io.stackwarden.runtime.container.RegistryCredentials;
import java.util.Optional;

/**
 * Looks up credentials for the registry hosting an image. Absence means an anonymous pull.
 */
@FunctionalInterface
public interface RegistryCredentialProvider {

  Optional<RegistryCredentials> credentialsFor(String image);

  static RegistryCredentialProvider anonymous() {
    return image -> Optional.empty();
  }
}
