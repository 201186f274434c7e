package NTM;

import NTM.Model.MachineDefinition;
import NTM.Simulation.SimulationResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class TraceTMCommandLineTest {
  @Test
  void testRunWritesTraceFile(@TempDir Path dir) throws IOException {
    MachineDefinition m = MachineFormat.getMachineResource("machines/check_a_plus.csv");
    Path output = dir.resolve("trace.txt");
    SimulationResult r = TraceTMCommandLine.run(m, "aaa", TraceTM.DEFAULT_MAX_DEPTH, output.toString());
    Assertions.assertTrue(r.isAccepted());

    String text = Files.readString(output, StandardCharsets.UTF_8);
    Assertions.assertTrue(text.startsWith("Machine: a plus (nondeterministic)\nInput String: aaa\n"));
    Assertions.assertTrue(text.contains("Accepted in 4 transitions."));
  }

  @Test
  void testForeignSymbolStillWritesTrace(@TempDir Path dir) throws IOException {
    MachineDefinition m = MachineFormat.getMachineResource("machines/check_a_plus_DTM.csv");
    Path output = dir.resolve("trace.txt");
    SimulationResult r = TraceTMCommandLine.run(m, "ab", TraceTM.DEFAULT_MAX_DEPTH, output.toString());
    Assertions.assertTrue(r.isRejected());
    Assertions.assertTrue(Files.readString(output, StandardCharsets.UTF_8).contains("Rejected in 1 transitions."));
  }

  @Test
  void testExamplesAreDecided(@TempDir Path dir) {
    for (TraceTMCommandLine.Example example : TraceTMCommandLine.EXAMPLES) {
      MachineDefinition m = MachineFormat.getMachineResource(example.resource());
      SimulationResult r = TraceTMCommandLine.run(m, example.input(), example.maxDepth(),
          dir.resolve(example.output()).toString());
      Assertions.assertTrue(r.isAccepted(), example.resource());
    }
  }
}
