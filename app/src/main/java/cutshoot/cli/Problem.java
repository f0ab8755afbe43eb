package cutshoot.cli;

import cutshoot.core.ScheduleOptions;
import cutshoot.core.model.Backend;
import cutshoot.core.model.WorkloadGraph;
import java.util.List;
import java.util.Objects;

/** Graph, backend pool and options loaded from a problem file or an example. */
record Problem(WorkloadGraph graph, List<Backend> backends, ScheduleOptions options) {

  Problem {
    Objects.requireNonNull(graph, "graph");
    backends = List.copyOf(backends);
    options = options == null ? ScheduleOptions.defaults() : options;
  }

  Problem withOptions(ScheduleOptions replacement) {
    return new Problem(graph, backends, replacement);
  }
}
