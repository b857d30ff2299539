package ca.gc.cra.continuum.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void precedenceIsCliThenEnvThenYamlThenDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("license.mode", "stop", "store.kind", "file", "engine.url", "http://yaml")),
        Map.of("engine.url", "http://env"),
        Map.of("license.mode", "degrade"),
        Map.of("license.mode", "degrade", "store.kind", "auto", "engine.url", "", "input.maxLength", "1000"),
        warnings::add);

    assertEquals("degrade", merged.get("license.mode"));
    assertEquals("http://env", merged.get("engine.url"));
    assertEquals("file", merged.get("store.kind"));
    assertEquals("1000", merged.get("input.maxLength"));
    assertEquals(List.of("CLI overrides configured value for key: license.mode"), warnings);
  }

  @Test
  void cliOnlyKeysDoNotWarn() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of(), Map.of("input.maxLength", "10"), Map.of("input.maxLength", "1000"),
        warnings::add);

    assertTrue(warnings.isEmpty());
  }
}
