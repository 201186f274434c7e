package NTM.Model;

import java.util.List;

/**
 * Full frontier at one depth, in the order the configurations were produced.
 */
public record Level(int depth, List<Configuration> configurations) {

  public Level {
    configurations = List.copyOf(configurations);
  }

  public int size() {
    return configurations.size();
  }

  public boolean isEmpty() {
    return configurations.isEmpty();
  }
}
