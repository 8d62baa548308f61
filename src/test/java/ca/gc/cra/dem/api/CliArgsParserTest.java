package ca.gc.cra.dem.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsAndStripsDashes() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"--inc=1s", "-name=coast", "datalist=a.datalist"});

    assertEquals(List.of("inc", "name", "datalist"), List.copyOf(map.keySet()));
    assertEquals("1s", map.get("inc"));
    assertEquals("coast", map.get("name"));
  }

  @Test
  void valueKeepsEverythingAfterFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"param.args=-R{region} -I{inc} -G{out}"});

    assertEquals("-R{region} -I{inc} -G{out}", map.get("param.args"));
  }

  @Test
  void lastRepeatedKeyWins() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"module=num", "--module=idw"});

    assertEquals(Map.of("module", "idw"), map);
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"region="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"name=a\u0007b"}));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {" ", null}).isEmpty());
  }
}
