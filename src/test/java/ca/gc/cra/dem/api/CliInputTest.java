package ca.gc.cra.dem.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromSettings() {
    CliInput input = CliInput.parse(new String[] {"-v", "--Dry-Run", "inc=1s", "--region=0/1/0/1", " "});

    assertTrue(input.verbose());
    assertFalse(input.quiet());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag(" --DRY-RUN "));
    assertArrayEquals(new String[] {"inc=1s", "--region=0/1/0/1"}, input.keyValueArgs());
  }

  @Test
  void recognisesHelpAndQuietAliases() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-H"}).help());
    assertTrue(CliInput.parse(new String[] {"-q"}).quiet());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void emptyInputHasNoFlags() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.flags().isEmpty());
    assertFalse(input.hasFlag(null));
    assertArrayEquals(new String[0], input.keyValueArgs());
  }
}
