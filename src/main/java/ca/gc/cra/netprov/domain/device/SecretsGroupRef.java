package ca.gc.cra.netprov.domain.device;

import ca.gc.cra.netprov.validation.Strings;

/**
 * Named reference to a bundle of credential secrets resolved through the secret store.
 *
 * @param name secrets group name; trimmed, never blank
 * @since 0.1.0
 */
public record SecretsGroupRef(String name) {
  public SecretsGroupRef {
    name = Strings.requireNonBlank("secretsGroup", name);
  }

  @Override
  public String toString() {
    return name;
  }
}
