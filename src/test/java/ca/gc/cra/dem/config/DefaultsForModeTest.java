package ca.gc.cra.dem.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void gridDefaultsMatchGridConfig() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("grid");

    assertEquals("waffles_dem", defaults.get("name"));
    assertEquals("mean", defaults.get("module"));
    assertEquals("10", defaults.get("extendProc"));
    assertEquals("-9999.0", defaults.get("nodata"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("COMPOUND", defaults.get("weightPropagation"));
    assertEquals("10", defaults.get("sims"));
  }

  @Test
  void uncertaintyDefaultsUseIdwEngine() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Uncertainty ");

    assertEquals("idw", defaults.get("engine"));
    assertEquals("95.0", defaults.get("uncPercentile"));
    assertEquals("BINNED_STD", defaults.get("fitInput"));
    assertFalse(defaults.containsKey("module"));
  }

  @Test
  void catalogAndSpatialDefaults() {
    assertEquals("list", DefaultsForMode.asFlatMap("catalog").get("action"));
    assertEquals("3", DefaultsForMode.asFlatMap("spatial").get("workers"));
  }

  @Test
  void gridDefaultsParseIntoAConfig() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("grid"));
    options.put("datalist", "a.datalist");
    options.put("region", "0/1/0/1");
    options.put("inc", "1s");

    GridConfig config = GridConfig.fromMap(options);

    assertEquals(GridModule.MEAN, config.module());
    assertEquals(UncertaintyConfig.defaults(), UncertaintyConfig.fromMap(options));
    assertEquals(ResolverConfig.defaults(), ResolverConfig.fromMap(options));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
