package cutshoot.objective;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.core.InvalidInputException;
import org.junit.jupiter.api.Test;

final class ObjectiveModeTest {

  @Test
  void parsesConfigKeysAndAliases() {
    assertEquals(ObjectiveMode.JOINT_QOS, ObjectiveMode.parse("joint_qos"), "Config key");
    assertEquals(ObjectiveMode.JOINT_NONUNIFORM, ObjectiveMode.parse("Non-Uniform"), "Alias");
    assertEquals(ObjectiveMode.SINGLE_SELECT, ObjectiveMode.parse(null), "Default mode");
    assertThrows(
        InvalidInputException.class, () -> ObjectiveMode.parse("fastest"), "Unknown mode");
  }

  @Test
  void onlyNonUniformOptimisesTheSplitByDefault() {
    assertTrue(ObjectiveMode.JOINT_UNIFORM.defaultUniformSplit(), "Even split");
    assertTrue(ObjectiveMode.JOINT_QOS.defaultUniformSplit(), "Even split");
    assertFalse(ObjectiveMode.JOINT_NONUNIFORM.defaultUniformSplit(), "Optimised split");
    assertTrue(ObjectiveMode.SINGLE_SELECT.singleBackend(), "One backend per partition");
    assertFalse(ObjectiveMode.JOINT_UNIFORM.usesQos(), "No penalty without QoS");
  }
}
