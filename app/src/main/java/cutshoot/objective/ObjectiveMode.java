package cutshoot.objective;

import cutshoot.core.InvalidInputException;
import java.util.Locale;

/** Backend-selection objective variants. */
public enum ObjectiveMode {
  /** Exactly one backend per partition; minimise its queue plus execution time. */
  SINGLE_SELECT("single_select"),
  /** Any non-empty subset, shots split evenly; minimise the slowest selected backend. */
  JOINT_UNIFORM("joint_uniform"),
  /** {@link #JOINT_UNIFORM} plus the price and reliability penalty. */
  JOINT_QOS("joint_qos"),
  /** {@link #JOINT_QOS} with the shot split itself optimised. */
  JOINT_NONUNIFORM("joint_nonuniform");

  private final String configKey;

  ObjectiveMode(String configKey) {
    this.configKey = configKey;
  }

  public String configKey() {
    return configKey;
  }

  public boolean singleBackend() {
    return this == SINGLE_SELECT;
  }

  public boolean usesQos() {
    return this == JOINT_QOS || this == JOINT_NONUNIFORM;
  }

  /** Whether shots are split evenly unless the caller asks otherwise. */
  public boolean defaultUniformSplit() {
    return this != JOINT_NONUNIFORM;
  }

  public static ObjectiveMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return SINGLE_SELECT;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (ObjectiveMode mode : values()) {
      if (mode.configKey.equals(normalized)) {
        return mode;
      }
    }
    return switch (normalized) {
      case "single" -> SINGLE_SELECT;
      case "uniform" -> JOINT_UNIFORM;
      case "qos" -> JOINT_QOS;
      case "nonuniform", "non_uniform" -> JOINT_NONUNIFORM;
      default -> throw new InvalidInputException("Invalid objective mode: " + raw);
    };
  }
}
