package cutshoot.allocation;

import cutshoot.core.model.Backend;

/** Hard eligibility rule; a backend that is not admitted can never receive shots. */
public interface BackendPredicate {

  boolean admits(Backend backend);

  /** Short human-readable form used in diagnostics and logs. */
  String describe();
}
