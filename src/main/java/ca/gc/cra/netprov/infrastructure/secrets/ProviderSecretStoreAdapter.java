package ca.gc.cra.netprov.infrastructure.secrets;

import ca.gc.cra.netprov.application.port.secrets.SecretAccessType;
import ca.gc.cra.netprov.application.port.secrets.SecretStoreException;
import ca.gc.cra.netprov.application.port.secrets.SecretStorePort;
import ca.gc.cra.netprov.application.port.secrets.SecretType;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.domain.device.SecretsGroupRef;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SecretStorePort} backed by secrets groups declared in configuration.
 * <p><strong>Role:</strong> Infrastructure adapter wired by the composition root.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse {@code secretsGroups.<group>.<accessType>.<secretType>=<reference>} entries.</li>
 *   <li>Expand {@code {{ obj.name }}}, {@code {{ obj.address }}} and {@code {{ obj.driver }}} (or
 *   {@code device.*}) against the target.</li>
 *   <li>Resolve {@code env:VARIABLE} through the environment and {@code file:PATH} by reading a UTF-8 text file
 *   with trailing line breaks removed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 * <p><strong>Security:</strong> Exception and log messages name references, never values.</p>
 *
 * @since 0.1.0
 */
public final class ProviderSecretStoreAdapter implements SecretStorePort {
  /** Configuration prefix of secrets-group entries. */
  public static final String PREFIX = "secretsGroups.";

  private static final Logger log = LoggerFactory.getLogger(ProviderSecretStoreAdapter.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z_]+)\\.([A-Za-z_]+)\\s*}}");

  private final Map<String, String> references;
  private final UnaryOperator<String> environment;

  /**
   * Creates an adapter reading the process environment.
   *
   * @param config flattened configuration; only {@code secretsGroups.*} keys are used
   */
  public ProviderSecretStoreAdapter(Map<String, String> config) {
    this(config, System::getenv);
  }

  /**
   * Creates an adapter with an explicit environment lookup.
   *
   * @param config flattened configuration; only {@code secretsGroups.*} keys are used
   * @param environment variable lookup returning {@code null} for unset variables
   * @throws IllegalArgumentException if an entry is malformed
   */
  public ProviderSecretStoreAdapter(Map<String, String> config, UnaryOperator<String> environment) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.references = parse(config == null ? Map.of() : config);
    log.debug("Loaded {} secrets-group references", references.size());
  }

  @Override
  public String secretValue(
      SecretsGroupRef group, SecretAccessType accessType, SecretType secretType, DeviceTarget context)
      throws SecretStoreException {
    Objects.requireNonNull(group, "group");
    String key = key(group.name(), accessType, secretType);
    String reference = references.get(key);
    if (reference == null) {
      if (references.keySet().stream().noneMatch(k -> k.startsWith(group.name() + "."))) {
        throw new SecretStoreException("secrets group " + group.name() + " is not defined");
      }
      throw new SecretStoreException(
          "secrets group " + group.name() + " has no " + accessType + "/" + secretType + " secret");
    }
    String expanded = expand(reference, context);
    if (expanded.startsWith("env:")) {
      String variable = expanded.substring("env:".length());
      String value = environment.apply(variable);
      if (value == null) {
        throw new SecretStoreException("environment variable " + variable + " is not set");
      }
      return value;
    }
    Path file = Path.of(expanded.substring("file:".length()));
    try {
      return stripTrailingLineBreaks(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new SecretStoreException("secret file " + file + " is not readable", ex);
    }
  }

  private static Map<String, String> parse(Map<String, String> config) {
    Map<String, String> parsed = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : config.entrySet()) {
      if (!entry.getKey().startsWith(PREFIX)) {
        continue;
      }
      String[] parts = entry.getKey().substring(PREFIX.length()).split("\\.");
      if (parts.length != 3 || parts[0].isBlank()) {
        throw new IllegalArgumentException(
            "secrets group entry must be secretsGroups.<group>.<accessType>.<secretType>: " + entry.getKey());
      }
      String reference = entry.getValue() == null ? "" : entry.getValue().trim();
      boolean knownProvider = reference.startsWith("env:") || reference.startsWith("file:");
      if (!knownProvider || reference.indexOf(':') == reference.length() - 1) {
        throw new IllegalArgumentException(entry.getKey() + " must reference env:VARIABLE or file:PATH");
      }
      parsed.put(
          key(parts[0], SecretAccessType.fromString(parts[1]), SecretType.fromString(parts[2])), reference);
    }
    return Map.copyOf(parsed);
  }

  private static String expand(String reference, DeviceTarget context) throws SecretStoreException {
    Matcher matcher = PLACEHOLDER.matcher(reference);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String scope = matcher.group(1);
      if (!scope.equals("obj") && !scope.equals("device")) {
        throw new SecretStoreException("unsupported template scope in secret reference: " + scope);
      }
      if (context == null) {
        throw new SecretStoreException("secret reference requires a device context");
      }
      String value = switch (matcher.group(2)) {
        case "name" -> context.name();
        case "address" -> context.managementAddress();
        case "driver" -> context.driver();
        default -> throw new SecretStoreException(
            "unsupported template field in secret reference: " + matcher.group(2));
      };
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private static String key(String group, SecretAccessType accessType, SecretType secretType) {
    return group + "." + accessType + "." + secretType;
  }

  private static String stripTrailingLineBreaks(String value) {
    int end = value.length();
    while (end > 0 && (value.charAt(end - 1) == '\n' || value.charAt(end - 1) == '\r')) {
      end--;
    }
    return value.substring(0, end);
  }
}
