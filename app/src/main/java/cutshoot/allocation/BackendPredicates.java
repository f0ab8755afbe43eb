package cutshoot.allocation;

import cutshoot.core.InvalidInputException;
import cutshoot.core.model.Backend;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Built-in {@link BackendPredicate} rules.
 *
 * <p>A backend without a region never satisfies {@link RegionIn}. A missing reliability is read as
 * fully reliable and a missing price as free, matching the penalty terms.
 */
public final class BackendPredicates {
  private BackendPredicates() {}

  public static BackendPredicate regionIn(Collection<String> regions) {
    return new RegionIn(normalize(regions, "region_in"));
  }

  public static BackendPredicate excludeIds(Collection<String> ids) {
    return new ExcludeIds(Set.copyOf(ids));
  }

  public static BackendPredicate minReliability(double threshold) {
    return new MinReliability(threshold);
  }

  public static BackendPredicate maxPrice(double limit) {
    return new MaxPrice(limit);
  }

  /** Whether every predicate admits the backend. */
  public static boolean admitsAll(List<BackendPredicate> predicates, Backend backend) {
    for (BackendPredicate predicate : predicates) {
      if (!predicate.admits(backend)) {
        return false;
      }
    }
    return true;
  }

  /** Descriptions of the predicates that reject {@code backend}. */
  public static List<String> rejections(List<BackendPredicate> predicates, Backend backend) {
    return predicates.stream()
        .filter(predicate -> !predicate.admits(backend))
        .map(BackendPredicate::describe)
        .collect(Collectors.toList());
  }

  private static Set<String> normalize(Collection<String> values, String name) {
    InvalidInputException.require(
        values != null && !values.isEmpty(), name + " needs at least one value");
    Set<String> normalized = new TreeSet<>();
    for (String value : values) {
      normalized.add(value.trim().toLowerCase(Locale.ROOT));
    }
    return Set.copyOf(normalized);
  }

  /** Admits backends whose region tag is one of {@code regions} (case-insensitive). */
  public record RegionIn(Set<String> regions) implements BackendPredicate {
    @Override
    public boolean admits(Backend backend) {
      return backend
          .regionIfKnown()
          .map(region -> regions.contains(region.trim().toLowerCase(Locale.ROOT)))
          .orElse(false);
    }

    @Override
    public String describe() {
      return "region_in" + new TreeSet<>(regions);
    }
  }

  public record ExcludeIds(Set<String> ids) implements BackendPredicate {
    @Override
    public boolean admits(Backend backend) {
      return !ids.contains(backend.id());
    }

    @Override
    public String describe() {
      return "exclude_ids" + new TreeSet<>(ids);
    }
  }

  public record MinReliability(double threshold) implements BackendPredicate {
    public MinReliability {
      InvalidInputException.require(
          threshold >= 0 && threshold <= 1, "min_reliability must lie in [0,1]: " + threshold);
    }

    @Override
    public boolean admits(Backend backend) {
      return backend.reliabilityIfKnown().orElse(1.0) >= threshold;
    }

    @Override
    public String describe() {
      return "min_reliability(" + threshold + ")";
    }
  }

  public record MaxPrice(double limit) implements BackendPredicate {
    public MaxPrice {
      InvalidInputException.require(
          Double.isFinite(limit) && limit >= 0, "max_price must be non-negative: " + limit);
    }

    @Override
    public boolean admits(Backend backend) {
      return backend.priceIfKnown().orElse(0.0) <= limit;
    }

    @Override
    public String describe() {
      return "max_price(" + limit + ")";
    }
  }
}
