package cutshoot.allocation;

import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.core.model.Backend;
import java.util.ArrayList;
import java.util.List;

/** Infeasibility causes derivable from the request alone. */
public final class AllocationPrechecks {
  private AllocationPrechecks() {}

  /** Predicates leaving no backend at all. */
  public static List<ScheduleDiagnostic> predicateReasons(
      List<Backend> backends, List<BackendPredicate> predicates) {
    List<String> excluded = new ArrayList<>();
    for (Backend backend : backends) {
      List<String> rejections = BackendPredicates.rejections(predicates, backend);
      if (rejections.isEmpty()) {
        return List.of();
      }
      excluded.add(backend.id() + " " + rejections);
    }
    return List.of(ScheduleDiagnostic.predicatesExcludeAll(excluded));
  }

  /** Predicate and capacity checks per partition demand. */
  public static List<ScheduleDiagnostic> infeasibilityReasons(AllocationRequest request) {
    List<ScheduleDiagnostic> reasons =
        new ArrayList<>(predicateReasons(request.backends(), request.predicates()));
    if (!reasons.isEmpty()) {
      return reasons;
    }
    int largest = largestAdmittedCapacity(request.backends(), request.predicates());
    for (PartitionDemand demand : request.demands()) {
      if (demand.size() > largest) {
        reasons.add(
            ScheduleDiagnostic.noBackendCapacity(demand.partition(), demand.size(), largest));
      }
    }
    return reasons;
  }

  /** Largest capacity among admitted backends, {@code -1} when none is admitted. */
  public static int largestAdmittedCapacity(
      List<Backend> backends, List<BackendPredicate> predicates) {
    int largest = -1;
    for (Backend backend : backends) {
      if (BackendPredicates.admitsAll(predicates, backend)) {
        largest = Math.max(largest, backend.capacity());
      }
    }
    return largest;
  }
}
