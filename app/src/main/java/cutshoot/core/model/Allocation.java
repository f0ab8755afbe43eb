package cutshoot.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/** Partition index to the backends that run it and the shots each one receives. */
public record Allocation(Map<Integer, List<ShotAssignment>> assignments) {

  public Allocation {
    Objects.requireNonNull(assignments, "assignments");
    Map<Integer, List<ShotAssignment>> copy = new TreeMap<>();
    assignments.forEach(
        (partition, list) -> {
          if (list == null || list.isEmpty()) {
            throw new IllegalArgumentException(
                "partition " + partition + " needs at least one backend");
          }
          copy.put(partition, List.copyOf(list));
        });
    assignments = Collections.unmodifiableMap(copy);
  }

  public Set<Integer> partitions() {
    return assignments.keySet();
  }

  public List<ShotAssignment> assignments(int partition) {
    return assignments.getOrDefault(partition, List.of());
  }

  public int totalShots(int partition) {
    return assignments(partition).stream().mapToInt(ShotAssignment::shots).sum();
  }

  public List<String> selectedBackends(int partition) {
    return assignments(partition).stream().map(ShotAssignment::backendId).toList();
  }

  public boolean usesBackend(String backendId) {
    return assignments.values().stream()
        .flatMap(List::stream)
        .anyMatch(assignment -> assignment.backendId().equals(backendId));
  }
}
