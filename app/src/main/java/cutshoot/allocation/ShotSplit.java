package cutshoot.allocation;

/** Shape of the shot split the allocation model encodes. */
enum ShotSplit {
  /** One backend per partition takes the whole budget. */
  SINGLE,
  /** The budget is divided evenly among the selected backends. */
  UNIFORM,
  /** Per-backend shot counts are decision variables. */
  OPTIMIZED
}
