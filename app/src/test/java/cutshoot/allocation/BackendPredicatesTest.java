package cutshoot.allocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.core.InvalidInputException;
import cutshoot.core.model.Backend;
import java.util.List;
import org.junit.jupiter.api.Test;

final class BackendPredicatesTest {
  private final Backend tagged =
      Backend.builder("tagged")
          .capacity(4)
          .price(5.0)
          .reliability(0.7)
          .region(" EU ")
          .build();
  private final Backend bare = Backend.of("bare", 1, 0, 4);

  @Test
  void regionMatchIsCaseInsensitiveAndRequiresATag() {
    BackendPredicate predicate = BackendPredicates.regionIn(List.of("eu", "us"));

    assertTrue(predicate.admits(tagged), "Trimmed, lower-cased region matches");
    assertFalse(predicate.admits(bare), "Untagged backends never match a region");
  }

  @Test
  void missingMetricsAreReadOptimistically() {
    assertTrue(BackendPredicates.minReliability(0.99).admits(bare), "Unknown reliability is 1");
    assertFalse(BackendPredicates.minReliability(0.8).admits(tagged), "0.7 < 0.8");
    assertTrue(BackendPredicates.maxPrice(0.0).admits(bare), "Unknown price is 0");
    assertFalse(BackendPredicates.maxPrice(4.0).admits(tagged), "5 > 4");
  }

  @Test
  void rejectionsNameTheFailingPredicates() {
    List<BackendPredicate> predicates =
        List.of(
            BackendPredicates.excludeIds(List.of("tagged")),
            BackendPredicates.maxPrice(10.0),
            BackendPredicates.minReliability(0.9));

    List<String> rejections = BackendPredicates.rejections(predicates, tagged);

    assertEquals(
        List.of("exclude_ids[tagged]", "min_reliability(0.9)"),
        rejections,
        "Only the failing predicates are listed");
    assertFalse(BackendPredicates.admitsAll(predicates, tagged), "Conjunction fails");
  }

  @Test
  void rejectsInvalidThresholds() {
    assertThrows(
        InvalidInputException.class,
        () -> BackendPredicates.minReliability(1.5),
        "Reliability threshold lies in [0,1]");
    assertThrows(
        InvalidInputException.class,
        () -> BackendPredicates.regionIn(List.of()),
        "Region list must not be empty");
  }
}
