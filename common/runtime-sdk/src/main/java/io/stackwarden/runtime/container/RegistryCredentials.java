package io.stackwarden.runtime.container;

import java.util.Objects;

public record RegistryCredentials(String username, String password, String serverAddress) {

  public RegistryCredentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  @Override
  public String toString() {
    return "RegistryCredentials[username=" + username + ", serverAddress=" + serverAddress + "]";
  }
}
