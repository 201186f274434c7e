package NTM.Model;

public enum Move {
  LEFT, RIGHT, STAY;

  /**
   * "L" and "R" move the head; any other token keeps it in place.
   */
  public static Move fromToken(String token) {
    return switch (token) {
      case "L" -> LEFT;
      case "R" -> RIGHT;
      default -> STAY;
    };
  }

  public String token() {
    return switch (this) {
      case LEFT -> "L";
      case RIGHT -> "R";
      case STAY -> "S";
    };
  }
}
