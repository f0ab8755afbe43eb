package cutshoot.allocation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.core.InvalidInputException;
import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.DiagnosticReason;
import cutshoot.core.model.Allocation;
import cutshoot.core.model.Backend;
import cutshoot.core.model.ShotAssignment;
import cutshoot.objective.ObjectiveMode;
import cutshoot.objective.ObjectiveTerm;
import cutshoot.objective.QosWeights;
import cutshoot.testing.TestDefaults;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class MilpBackendAllocatorTest {
  private static final List<Backend> FIVE_BACKENDS =
      List.of(
          Backend.of("qpu_0", 10, 1, 10),
          Backend.of("qpu_1", 20, 4, 10),
          Backend.of("qpu_2", 15, 3, 10),
          Backend.of("qpu_3", 30, 1, 10),
          Backend.of("qpu_4", 10, 3, 10));

  private final MilpBackendAllocator allocator =
      new MilpBackendAllocator(TestDefaults.solverSettings());

  @Test
  void singleSelectPicksFastestTurnaround() {
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(FIVE_BACKENDS)
            .addDemand(0, 4, 1000)
            .mode(ObjectiveMode.SINGLE_SELECT)
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(SolveStatus.OPTIMAL, result.status(), "Single partition solves optimally");
    assertEquals(11.0, result.objectiveValue(), 1e-6, "qpu_0: queue 1 + execution 10");
    assertEquals(
        List.of(new ShotAssignment("qpu_0", 1000)),
        result.allocation().assignments(0),
        "Whole budget on one backend");
    assertEquals(11.0, result.makespan(), 1e-6, "Makespan equals the single busy time");
  }

  @Test
  void singleSelectSpreadsPartitionsOverBackends() {
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(FIVE_BACKENDS)
            .addDemand(0, 4, 100)
            .addDemand(1, 4, 100)
            .mode(ObjectiveMode.SINGLE_SELECT)
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(13.0, result.objectiveValue(), 1e-6, "qpu_0 and qpu_4 in parallel");
    assertEquals(
        Set.of("qpu_0", "qpu_4"),
        Set.of(
            result.allocation().selectedBackends(0).get(0),
            result.allocation().selectedBackends(1).get(0)),
        "Each partition gets its own fast backend");
  }

  @Test
  void jointUniformAgreesAcrossSplitStrategies() {
    AllocationRequest lookup =
        AllocationRequest.builder()
            .backends(FIVE_BACKENDS)
            .addDemand(0, 4, 1000)
            .mode(ObjectiveMode.JOINT_UNIFORM)
            .strategy(UniformSplitStrategy.LOOKUP_TABLE)
            .build();
    AllocationRequest enumerate =
        lookup.toBuilder().strategy(UniformSplitStrategy.ENUMERATE).build();

    AllocationResult viaLookup = allocator.allocate(lookup);
    AllocationResult viaEnumeration = allocator.allocate(enumerate);

    assertEquals(8.0, viaLookup.objectiveValue(), 1e-6, "Best even split has makespan 8");
    assertEquals(
        viaLookup.objectiveValue(),
        viaEnumeration.objectiveValue(),
        1e-6,
        "Both linearisations reach the same optimum");
    Allocation allocation = viaLookup.allocation();
    assertEquals(1000, allocation.totalShots(0), "The whole budget is distributed");
    int[] shots = allocation.assignments(0).stream().mapToInt(ShotAssignment::shots).toArray();
    assertTrue(
        shots[0] - shots[shots.length - 1] <= 1, "Even split differs by at most one shot");
  }

  @Test
  void nonUniformSplitBalancesBusyTimes() {
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(FIVE_BACKENDS)
            .addDemand(0, 4, 100)
            .mode(ObjectiveMode.JOINT_NONUNIFORM)
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(100, result.allocation().totalShots(0), "Shot counts add up to the budget");
    assertTrue(
        result.objectiveValue() >= 5.2 && result.objectiveValue() <= 5.6,
        "Makespan close to the fractional optimum 5.24, got " + result.objectiveValue());
    assertTrue(
        result.allocation().assignments(0).stream().allMatch(a -> a.shots() > 0),
        "Selected backends receive at least one shot");
  }

  @Test
  void pricePenaltySteersQosModeToTheCheapBackend() {
    List<Backend> priced =
        List.of(
            Backend.builder("A").executionTime(10).capacity(4).price(1.0).build(),
            Backend.builder("B").executionTime(10).capacity(4).price(10.0).build());
    AllocationRequest qos =
        AllocationRequest.builder()
            .backends(priced)
            .addDemand(0, 2, 100)
            .mode(ObjectiveMode.JOINT_QOS)
            .qosWeights(new QosWeights(20.0, 0.0))
            .build();
    AllocationRequest plain = qos.toBuilder().mode(ObjectiveMode.JOINT_UNIFORM).build();

    AllocationResult withPenalty = allocator.allocate(qos);
    AllocationResult withoutPenalty = allocator.allocate(plain);

    assertEquals(List.of("A"), withPenalty.allocation().selectedBackends(0), "A is cheaper");
    assertEquals(12.0, withPenalty.objectiveValue(), 1e-6, "10 + 20 * (1 / 10)");
    assertEquals(
        2.0, withPenalty.termValues().get(ObjectiveTerm.QOS), 1e-6, "Unweighted QoS penalty");
    assertEquals(
        2, withoutPenalty.allocation().selectedBackends(0).size(), "Both share the work");
    assertEquals(5.0, withoutPenalty.objectiveValue(), 1e-6, "Half the execution time each");
  }

  @Test
  void reliabilityPenaltyAvoidsUnreliableBackend() {
    List<Backend> backends =
        List.of(
            Backend.builder("A").executionTime(10).capacity(4).reliability(0.2).build(),
            Backend.builder("B").executionTime(10).capacity(4).reliability(1.0).build());
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(backends)
            .addDemand(0, 2, 100)
            .mode(ObjectiveMode.JOINT_QOS)
            .qosWeights(new QosWeights(0.0, 20.0))
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(List.of("B"), result.allocation().selectedBackends(0), "B never fails");
    assertEquals(10.0, result.objectiveValue(), 1e-6, "No penalty on a fully reliable backend");
  }

  @Test
  void predicatesShrinkTheCandidateSet() {
    List<Backend> backends =
        List.of(
            Backend.builder("eu").executionTime(50).capacity(8).region("eu").build(),
            Backend.builder("us").executionTime(5).capacity(8).region("us").build());
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(backends)
            .addDemand(0, 3, 10)
            .addPredicate(BackendPredicates.regionIn(List.of("EU")))
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(List.of("eu"), result.allocation().selectedBackends(0), "Only eu is admitted");
    assertFalse(result.allocation().usesBackend("us"), "Excluded backend stays idle");
  }

  @Test
  void admittedCapacityTooSmallIsDiagnosedPerPartition() {
    List<Backend> backends =
        List.of(
            Backend.builder("eu").executionTime(1).capacity(2).region("eu").build(),
            Backend.builder("us").executionTime(1).capacity(8).region("us").build());
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(backends)
            .addDemand(0, 3, 10)
            .addPredicate(BackendPredicates.regionIn(List.of("eu")))
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(SolveStatus.INFEASIBLE, result.status(), "No admitted backend can host size 3");
    assertEquals(
        DiagnosticReason.NO_BACKEND_CAPACITY,
        result.diagnostics().get(0).reason(),
        "Capacity diagnostic");
    assertEquals(0, result.diagnostics().get(0).partitionIndex(), "Partition 0 is named");
  }

  @Test
  void predicatesExcludingEverythingAreReported() {
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(FIVE_BACKENDS)
            .addDemand(0, 1, 10)
            .addPredicate(BackendPredicates.regionIn(List.of("eu")))
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(
        DiagnosticReason.PREDICATES_EXCLUDE_ALL,
        result.diagnostics().get(0).reason(),
        "No backend carries a region tag");
  }

  @Test
  void postProcessingTimeIsChargedAsConstant() {
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(FIVE_BACKENDS)
            .addDemand(0, 4, 100)
            .postProcessingTime(7.5)
            .build();

    AllocationResult result = allocator.allocate(request);

    assertEquals(18.5, result.objectiveValue(), 1e-6, "11 + 7.5");
    assertEquals(11.0, result.makespan(), 1e-6, "Makespan excludes recombination");
  }

  @Test
  void rejectsDuplicateIdsAndPartitions() {
    assertThrows(
        InvalidInputException.class,
        () ->
            AllocationRequest.builder()
                .addBackend(Backend.of("a", 1, 0, 1))
                .addBackend(Backend.of("a", 2, 0, 1))
                .addDemand(0, 1, 1)
                .build(),
        "Backend ids are unique");
    assertThrows(
        InvalidInputException.class,
        () ->
            AllocationRequest.builder()
                .addBackend(Backend.of("a", 1, 0, 1))
                .addDemand(0, 1, 1)
                .addDemand(0, 1, 1)
                .build(),
        "Partition indices are unique");
  }

  @Test
  void uniformShotsGiveRemainderToFirstBackends() {
    assertArrayEquals(
        new int[] {4, 3, 3}, AllocationFormulation.uniformShots(10, 3), "10 over 3 backends");
    assertArrayEquals(
        new int[] {5, 5}, AllocationFormulation.uniformShots(10, 2), "Exact division");
    assertEquals(0, AllocationFormulation.uniformShots(10, 0).length, "No backend, no shots");
  }
}
