package cutshoot.allocation;

import com.google.ortools.linearsolver.MPVariable;
import cutshoot.core.InvalidInputException;
import cutshoot.core.model.Allocation;
import cutshoot.core.model.Backend;
import cutshoot.core.model.ShotAssignment;
import cutshoot.milp.LinearExpression;
import cutshoot.milp.Linearization;
import cutshoot.milp.Linearization.EpigraphTerm;
import cutshoot.milp.MilpModel;
import cutshoot.objective.ObjectiveComposer;
import cutshoot.objective.ObjectiveTerm;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;

/**
 * Backend selection and shot split variables for a set of partition slots.
 *
 * <p>{@code sel[c][q]} selects backend {@code q} for slot {@code c}. The share of the budget a
 * selected backend runs is kept linear: the whole budget ({@link ShotSplit#SINGLE}), a sum of
 * {@code sel AND count_k} products weighted by {@code 1/k} (lookup table), {@code sel / k} for a
 * common count fixed per solve (enumeration) or {@code n[c][q] / budget} with integer shot
 * counts. Backend busy time is {@code queue * used + sum_c exec * share} and the makespan is
 * its epigraph over used backends.
 *
 * <p>Slots either carry a fixed size (sequential pipeline) or a size variable plus an activity
 * indicator owned by a partition formulation in the same model (combined optimiser).
 */
public final class AllocationFormulation {
  private final AllocationRequest request;
  private final List<Slot> slots;
  private final ShotSplit split;
  private final int commonCount;
  private final List<Backend> backends;
  private final boolean[][] eligible;
  private final MPVariable[][] sel;
  private final MPVariable[][] shots;
  private final List<List<List<ShareTerm>>> shares = new ArrayList<>();

  /**
   * One partition as seen by the allocation model.
   *
   * @param fixedSize size when known up front; ignored when {@code sizeVariable} is set
   * @param sizeUpperBound bound on {@code sizeVariable}, used by capacity and product constraints
   * @param active indicator that the partition is non-empty, or null when it always is
   */
  public record Slot(
      int partition,
      int shots,
      int fixedSize,
      MPVariable sizeVariable,
      int sizeUpperBound,
      MPVariable active) {

    public static Slot fixed(PartitionDemand demand) {
      return new Slot(demand.partition(), demand.shots(), demand.size(), null, demand.size(), null);
    }

    public static Slot variable(
        int partition, int shots, MPVariable size, int sizeUpperBound, MPVariable active) {
      return new Slot(partition, shots, 0, size, sizeUpperBound, active);
    }

    boolean hasFixedSize() {
      return sizeVariable == null;
    }
  }

  private record ShareTerm(MPVariable variable, double coefficient) {}

  private AllocationFormulation(AllocationRequest request, List<Slot> slots, int commonCount) {
    this.request = request;
    this.slots = List.copyOf(slots);
    this.split = request.shotSplit();
    this.commonCount = commonCount;
    this.backends = request.backends();
    this.eligible = new boolean[slots.size()][backends.size()];
    this.sel = new MPVariable[slots.size()][backends.size()];
    this.shots = new MPVariable[slots.size()][backends.size()];
  }

  /**
   * Adds the allocation part to {@code model} and registers its latency and QoS terms.
   *
   * @param commonCount selected backends per partition for {@link
   *     UniformSplitStrategy#ENUMERATE}; ignored otherwise
   */
  public static AllocationFormulation build(
      MilpModel model,
      AllocationRequest request,
      List<Slot> slots,
      ObjectiveComposer composer,
      int commonCount) {
    boolean variableSizes = slots.stream().anyMatch(slot -> !slot.hasFixedSize());
    requireLinear(request, variableSizes);
    AllocationFormulation formulation = new AllocationFormulation(request, slots, commonCount);
    formulation.addSelection(model);
    formulation.addSplit(model);
    if (composer.isEnabled(ObjectiveTerm.LATENCY)) {
      formulation.addLatency(model, composer);
    }
    if (request.mode().usesQos()
        && composer.isEnabled(ObjectiveTerm.QOS)
        && !request.qosWeights().isZero()) {
      formulation.addQos(composer);
    }
    return formulation;
  }

  /**
   * Rejects an optimised shot split combined with size-dependent execution time on variable-size
   * partitions: the product of two integer variables is not linear.
   */
  public static void requireLinear(AllocationRequest request, boolean variableSizes) {
    if (!variableSizes || request.shotSplit() != ShotSplit.OPTIMIZED) {
      return;
    }
    for (Backend backend : request.backends()) {
      InvalidInputException.require(
          !(backend.isSizeDependent() && request.admits(backend)),
          "optimised shot split cannot be combined with size-dependent execution time of backend "
              + backend.id());
    }
  }

  /** Highest selected count any slot can reach given predicates and fixed sizes. */
  public static int maxSelectable(AllocationRequest request, List<Slot> slots) {
    int best = 0;
    for (Slot slot : slots) {
      int count = 0;
      for (Backend backend : request.backends()) {
        boolean fits = !slot.hasFixedSize() || backend.canHost(slot.fixedSize());
        if (request.admits(backend) && fits) {
          count++;
        }
      }
      best = Math.max(best, Math.min(count, slot.shots()));
    }
    return best;
  }

  private void addSelection(MilpModel model) {
    for (int c = 0; c < slots.size(); c++) {
      Slot slot = slots.get(c);
      for (int q = 0; q < backends.size(); q++) {
        Backend backend = backends.get(q);
        sel[c][q] = model.boolVar("sel_" + slot.partition() + "_" + backend.id());
        boolean admitted = request.admits(backend);
        eligible[c][q] =
            admitted && (!slot.hasFixedSize() || backend.canHost(slot.fixedSize()));
        if (!eligible[c][q]) {
          model.forbid(sel[c][q]);
        } else if (!slot.hasFixedSize() && backend.capacity() < slot.sizeUpperBound()) {
          // d <= cap_q + U (1 - sel)
          int upper = slot.sizeUpperBound();
          model.addLessOrEqual(
              LinearExpression.of(slot.sizeVariable()).add(sel[c][q], upper),
              backend.capacity() + upper,
              "cap_" + slot.partition() + "_" + backend.id());
        }
      }
    }
  }

  private void addSplit(MilpModel model) {
    for (int c = 0; c < slots.size(); c++) {
      addSlotSplit(model, c);
    }
  }

  private void addSlotSplit(MilpModel model, int c) {
    Slot slot = slots.get(c);
    List<List<ShareTerm>> slotShares = new ArrayList<>();
    for (int q = 0; q < backends.size(); q++) {
      slotShares.add(new ArrayList<>());
    }
    shares.add(slotShares);
    String tag = "split_" + slot.partition();
    LinearExpression selected = selectedCount(c);

    switch (split) {
      case SINGLE -> {
        model.addEqual(selected.addScaled(activeExpression(slot), -1.0), 0.0, tag);
        forEachEligible(c, q -> slotShares.get(q).add(new ShareTerm(sel[c][q], 1.0)));
      }
      case UNIFORM -> {
        if (request.strategy() == UniformSplitStrategy.ENUMERATE) {
          model.addEqual(
              selected.addScaled(activeExpression(slot), -commonCount), 0.0, tag + "_fixed");
          forEachEligible(
              c, q -> slotShares.get(q).add(new ShareTerm(sel[c][q], 1.0 / commonCount)));
        } else {
          addLookupTable(model, c, slot, selected, slotShares, tag);
        }
      }
      case OPTIMIZED -> addShotVariables(model, c, slot, slotShares, tag);
      default -> throw new IllegalStateException("unknown split " + split);
    }
  }

  private void addLookupTable(
      MilpModel model,
      int c,
      Slot slot,
      LinearExpression selected,
      List<List<ShareTerm>> slotShares,
      String tag) {
    int maxCount = 0;
    for (int q = 0; q < backends.size(); q++) {
      if (eligible[c][q]) {
        maxCount++;
      }
    }
    // every selected backend needs at least one shot
    maxCount = Math.min(maxCount, slot.shots());
    MPVariable[] count = new MPVariable[maxCount + 1];
    LinearExpression oneHot = LinearExpression.empty();
    LinearExpression weighted = LinearExpression.empty();
    for (int k = 1; k <= maxCount; k++) {
      count[k] = model.boolVar("cnt_" + slot.partition() + "_" + k);
      oneHot.add(count[k], 1.0);
      weighted.add(count[k], k);
    }
    // exactly one count for an active slot, none otherwise
    model.addEqual(oneHot.addScaled(activeExpression(slot), -1.0), 0.0, tag + "_onehot");
    model.addEqual(weighted.addScaled(selected, -1.0), 0.0, tag + "_count");
    for (int q = 0; q < backends.size(); q++) {
      if (!eligible[c][q]) {
        continue;
      }
      for (int k = 1; k <= maxCount; k++) {
        MPVariable both =
            Linearization.and(
                model,
                sel[c][q],
                count[k],
                "w_" + slot.partition() + "_" + backends.get(q).id() + "_" + k);
        slotShares.get(q).add(new ShareTerm(both, 1.0 / k));
      }
    }
  }

  private void addShotVariables(
      MilpModel model, int c, Slot slot, List<List<ShareTerm>> slotShares, String tag) {
    int budget = slot.shots();
    LinearExpression total = LinearExpression.empty();
    for (int q = 0; q < backends.size(); q++) {
      String name = "n_" + slot.partition() + "_" + backends.get(q).id();
      shots[c][q] = model.intVar(0, budget, name);
      if (!eligible[c][q]) {
        model.forbid(shots[c][q]);
        continue;
      }
      // selected iff at least one shot
      model.addLessOrEqual(
          LinearExpression.of(shots[c][q]).add(sel[c][q], -budget), 0.0, name + "_ub");
      model.addGreaterOrEqual(
          LinearExpression.of(shots[c][q]).add(sel[c][q], -1.0), 0.0, name + "_lb");
      total.add(shots[c][q], 1.0);
      slotShares.get(q).add(new ShareTerm(shots[c][q], 1.0 / budget));
    }
    model.addEqual(total.addScaled(activeExpression(slot), -budget), 0.0, tag + "_budget");
  }

  private void addLatency(MilpModel model, ObjectiveComposer composer) {
    List<EpigraphTerm> terms = new ArrayList<>();
    double largestBound = 0.0;
    for (int q = 0; q < backends.size(); q++) {
      Backend backend = backends.get(q);
      MPVariable used = model.boolVar("used_" + backend.id());
      LinearExpression busy = LinearExpression.of(used, backend.queueTime());
      LinearExpression anySelected = LinearExpression.of(used, -1.0);
      double bound = backend.queueTime();
      boolean reachable = false;
      for (int c = 0; c < slots.size(); c++) {
        if (!eligible[c][q]) {
          continue;
        }
        reachable = true;
        Slot slot = slots.get(c);
        model.addGreaterOrEqual(
            LinearExpression.of(used).add(sel[c][q], -1.0),
            0.0,
            "used_" + backend.id() + "_" + slot.partition());
        anySelected.add(sel[c][q], 1.0);
        addExecution(model, busy, slot, backend, shares.get(c).get(q));
        bound += backend.executionTimeFor(slot.sizeUpperBound());
      }
      if (!reachable) {
        model.forbid(used);
        continue;
      }
      model.addGreaterOrEqual(anySelected, 0.0, "used_" + backend.id() + "_any");
      terms.add(new EpigraphTerm(busy, used, bound));
      largestBound = Math.max(largestBound, bound);
    }
    MPVariable makespan = Linearization.epigraph(model, terms, "makespan");
    composer.addTerm(ObjectiveTerm.LATENCY, LinearExpression.of(makespan), largestBound);
  }

  private void addExecution(
      MilpModel model, LinearExpression busy, Slot slot, Backend backend, List<ShareTerm> terms) {
    double base =
        slot.hasFixedSize() ? backend.executionTimeFor(slot.fixedSize()) : backend.executionTime();
    for (ShareTerm term : terms) {
      busy.add(term.variable(), base * term.coefficient());
      if (!slot.hasFixedSize() && backend.isSizeDependent()) {
        // d * share for a binary share variable
        MPVariable product =
            Linearization.boundedProduct(
                model,
                LinearExpression.of(slot.sizeVariable()),
                slot.sizeUpperBound(),
                term.variable(),
                "dx_" + term.variable().name());
        busy.add(product, backend.executionTimePerUnit() * term.coefficient());
      }
    }
  }

  private void addQos(ObjectiveComposer composer) {
    double maxPrice = 0.0;
    for (Backend backend : backends) {
      if (request.admits(backend)) {
        maxPrice = Math.max(maxPrice, backend.priceIfKnown().orElse(0.0));
      }
    }
    double priceWeight = request.qosWeights().priceWeight();
    double reliabilityWeight = request.qosWeights().reliabilityWeight();
    LinearExpression penalty = LinearExpression.empty();
    for (int c = 0; c < slots.size(); c++) {
      for (int q = 0; q < backends.size(); q++) {
        if (!eligible[c][q]) {
          continue;
        }
        Backend backend = backends.get(q);
        if (maxPrice > 0.0) {
          double normalizedPrice = backend.priceIfKnown().orElse(0.0) / maxPrice;
          for (ShareTerm term : shares.get(c).get(q)) {
            penalty.add(term.variable(), priceWeight * normalizedPrice * term.coefficient());
          }
        }
        double unreliability = 1.0 - backend.reliabilityIfKnown().orElse(1.0);
        penalty.add(sel[c][q], reliabilityWeight * unreliability);
      }
    }
    composer.addTerm(ObjectiveTerm.QOS, penalty);
  }

  private LinearExpression selectedCount(int c) {
    LinearExpression sum = LinearExpression.empty();
    for (int q = 0; q < backends.size(); q++) {
      sum.add(sel[c][q], 1.0);
    }
    return sum;
  }

  private static LinearExpression activeExpression(Slot slot) {
    return slot.active() == null
        ? LinearExpression.constant(1.0)
        : LinearExpression.of(slot.active());
  }

  private void forEachEligible(int c, IntConsumer action) {
    for (int q = 0; q < backends.size(); q++) {
      if (eligible[c][q]) {
        action.accept(q);
      }
    }
  }

  /** Reads selections and shot counts at the current solution. */
  public AllocationSolution extract(MilpModel model) {
    Map<Integer, List<ShotAssignment>> assignments = new LinkedHashMap<>();
    double[] busy = new double[backends.size()];
    boolean[] used = new boolean[backends.size()];
    for (int c = 0; c < slots.size(); c++) {
      Slot slot = slots.get(c);
      if (slot.active() != null && !model.isSet(slot.active())) {
        continue;
      }
      int size = slot.hasFixedSize() ? slot.fixedSize() : model.intValue(slot.sizeVariable());
      List<Integer> chosen = new ArrayList<>();
      for (int q = 0; q < backends.size(); q++) {
        if (eligible[c][q] && model.isSet(sel[c][q])) {
          chosen.add(q);
        }
      }
      int[] counts = shotCounts(model, c, slot, chosen);
      List<ShotAssignment> list = new ArrayList<>();
      for (int i = 0; i < chosen.size(); i++) {
        int q = chosen.get(i);
        if (counts[i] <= 0) {
          continue;
        }
        Backend backend = backends.get(q);
        list.add(new ShotAssignment(backend.id(), counts[i]));
        double share =
            split == ShotSplit.OPTIMIZED ? (double) counts[i] / slot.shots() : 1.0 / chosen.size();
        busy[q] += backend.executionTimeFor(size) * share;
        used[q] = true;
      }
      assignments.put(slot.partition(), list);
    }
    Map<String, Double> busyTimes = new LinkedHashMap<>();
    double longest = 0.0;
    for (int q = 0; q < backends.size(); q++) {
      if (used[q]) {
        double total = backends.get(q).queueTime() + busy[q];
        busyTimes.put(backends.get(q).id(), total);
        longest = Math.max(longest, total);
      }
    }
    return new AllocationSolution(new Allocation(assignments), busyTimes, longest);
  }

  private int[] shotCounts(MilpModel model, int c, Slot slot, List<Integer> chosen) {
    if (split == ShotSplit.OPTIMIZED) {
      int[] counts = new int[chosen.size()];
      for (int i = 0; i < chosen.size(); i++) {
        counts[i] = model.intValue(shots[c][chosen.get(i)]);
      }
      return counts;
    }
    return uniformShots(slot.shots(), chosen.size());
  }

  /**
   * Even integer split: {@code budget / k} each, the first {@code budget mod k} receive one more.
   */
  public static int[] uniformShots(int budget, int selectedCount) {
    if (selectedCount <= 0) {
      return new int[0];
    }
    int[] counts = new int[selectedCount];
    int base = budget / selectedCount;
    int extra = budget % selectedCount;
    for (int i = 0; i < selectedCount; i++) {
      counts[i] = base + (i < extra ? 1 : 0);
    }
    return counts;
  }
}
