package ca.gc.cra.netmap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FusionConfigTest {

  @Test
  void emptyOptionsGiveDefaults() {
    assertEquals(FusionConfig.defaults(), FusionConfig.fromMap(Map.of()));
  }

  @Test
  void readsEveryKey() {
    FusionConfig config = FusionConfig.fromMap(Map.of(
        "stalenessWindow", "PT12H",
        "confirmThreshold", "3",
        "adjacencyConfidenceStep", "0.4",
        "routeConfidenceStep", "0.2",
        "trustedSources", " 10.0.0.5 , jump-01,,",
        "sweepInterval", "1m"));

    assertEquals(Duration.ofHours(12), config.stalenessWindow());
    assertEquals(3, config.confirmThreshold());
    assertEquals(0.4, config.adjacencyConfidenceStep());
    assertEquals(0.2, config.routeConfidenceStep());
    assertEquals(Set.of("10.0.0.5", "jump-01"), config.trustedSources());
    assertEquals(Duration.ofMinutes(1), config.sweepInterval());
  }

  @Test
  void stepsMustLieInsideUnitInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> FusionConfig.fromMap(Map.of("adjacencyConfidenceStep", "1.0")));
    assertThrows(IllegalArgumentException.class,
        () -> FusionConfig.fromMap(Map.of("routeConfidenceStep", "0")));
  }

  @Test
  void rejectsZeroThresholdAndBadDurations() {
    assertThrows(IllegalArgumentException.class, () -> FusionConfig.fromMap(Map.of("confirmThreshold", "0")));
    assertThrows(IllegalArgumentException.class, () -> FusionConfig.fromMap(Map.of("stalenessWindow", "soon")));
  }
}
