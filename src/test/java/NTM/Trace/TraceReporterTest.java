package NTM.Trace;

import NTM.Model.Configuration;
import NTM.Model.Level;
import NTM.Model.Move;
import NTM.Model.Outcome;
import NTM.Simulation.SimulationResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

public class TraceReporterTest {
  private static final List<Level> LEVELS = List.of(
      new Level(0, List.of(Configuration.initial("q0", "ab"))),
      new Level(1, List.of(
          new Configuration(Configuration.initial("q0", "ab").tape().write('a', Move.RIGHT), "q1"),
          new Configuration(Configuration.initial("q0", "ab").tape().write('x', Move.STAY), "qacc"))));

  @Test
  void testAccepted() {
    SimulationResult r = new SimulationResult(Outcome.ACCEPTED, 1, 20, LEVELS, 3, 2);
    String expected = "Machine: demo\n"
        + "Input String: ab\n"
        + "\n"
        + "Depth of Tree of configurations: 1\n"
        + "Accepted in 1 transitions.\n"
        + "\n"
        + "Trace:\n"
        + "Depth 0:\n"
        + "  ('', 'q0', 'ab')\n"
        + "Depth 1:\n"
        + "  ('a', 'q1', 'b')\n"
        + "  ('', 'qacc', 'xb')\n"
        + "Total transitions: 3\n"
        + "Total non-leaf nodes: 2\n"
        + "Nondeterminism: 1.50\n"
        + TraceReporter.SEPARATOR + "\n";
    Assertions.assertEquals(expected, TraceReporter.render("demo", "ab", r));
  }

  @Test
  void testRejectedVerdict() {
    SimulationResult r = new SimulationResult(Outcome.REJECTED, 0, 20, LEVELS.subList(0, 1), 1, 1);
    Assertions.assertEquals("Rejected in 0 transitions.\nDepth of Tree of configurations: 0\n\n",
        TraceReporter.verdict(r));
    Assertions.assertTrue(TraceReporter.trace(r).contains("Nondeterminism: 1.00\n"));
  }

  @Test
  void testInconclusiveStillTraces() {
    SimulationResult r = new SimulationResult(Outcome.DEPTH_EXHAUSTED, 1, 1, LEVELS, 2, 1);
    String text = TraceReporter.render("demo", "ab", r);
    Assertions.assertTrue(text.contains("Max depth reached. Halting simulation.\n"));
    Assertions.assertTrue(text.contains("Result: inconclusive after 1 levels.\n"));
    Assertions.assertFalse(text.contains("Accepted"));
    Assertions.assertFalse(text.contains("Rejected"));
    Assertions.assertTrue(text.contains("Depth 1:\n"));
    Assertions.assertTrue(text.endsWith(TraceReporter.SEPARATOR + "\n"));
  }

  @Test
  void testRatioFormatting() {
    Assertions.assertEquals("Undefined (no non-leaf nodes)", TraceReporter.formatRatio(OptionalDouble.empty()));
    Assertions.assertEquals("1.43", TraceReporter.formatRatio(OptionalDouble.of(10.0 / 7)));
    Assertions.assertEquals("2.00", TraceReporter.formatRatio(OptionalDouble.of(2)));

    SimulationResult r = new SimulationResult(Outcome.DEPTH_EXHAUSTED, 0, 0, LEVELS.subList(0, 1), 0, 0);
    Assertions.assertTrue(TraceReporter.trace(r).contains("Nondeterminism: Undefined (no non-leaf nodes)\n"));
  }
}
