package NTM.Model;

import java.io.Serial;

/**
 * Machine definition is missing fields or is structurally wrong. Fatal for the run.
 */
public class MalformedDefinitionException extends Exception {
  @Serial
  private static final long serialVersionUID = 1L;

  public MalformedDefinitionException(String message) {
    super(message);
  }

  public MalformedDefinitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
