package cutshoot.core.model;

/** Shots of one partition that run on one backend; always strictly positive. */
public record ShotAssignment(String backendId, int shots) {

  public ShotAssignment {
    if (backendId == null || backendId.isBlank()) {
      throw new IllegalArgumentException("backendId must be non-blank");
    }
    if (shots <= 0) {
      throw new IllegalArgumentException("an assignment needs a positive shot count: " + shots);
    }
  }
}
