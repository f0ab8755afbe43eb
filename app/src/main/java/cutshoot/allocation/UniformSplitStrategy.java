package cutshoot.allocation;

import cutshoot.core.InvalidInputException;
import java.util.Locale;

/** How the {@code budget / selected_count} share of an even split is kept linear. */
public enum UniformSplitStrategy {
  /** One-hot count indicator per partition; {@code 1/k} becomes a constant coefficient. */
  LOOKUP_TABLE,
  /** One solve per common selected count {@code k}; the best feasible solve wins. */
  ENUMERATE;

  public static UniformSplitStrategy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return LOOKUP_TABLE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
      case "lookup_table", "lookup" -> LOOKUP_TABLE;
      case "enumerate", "enumeration" -> ENUMERATE;
      default -> throw new InvalidInputException("Invalid uniform split strategy: " + raw);
    };
  }
}
