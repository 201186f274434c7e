package NTM.Model;

/**
 * Tape split at the head, held as two persistent stacks of cells.
 * The top of {@code left} is the cell before the head, so popping walks back towards the origin;
 * the top of {@code right} is the head cell, followed by the cells to its right.
 * A write pushes or pops at most three cells and shares every other cell with the source tape,
 * so a step costs O(1) whatever the tape length.
 * The right stack is never empty: the tape is blank-filled to the right.
 */
public final class Tape {
  public static final char BLANK = '_';

  private static final Cell BLANK_TAIL = new Cell(BLANK, null);

  private final Cell left;   // null at the origin
  private final Cell right;

  private Tape(Cell left, Cell right) {
    this.left = left;
    this.right = right;
  }

  public static Tape ofInput(CharSequence input) {
    return of("", input);
  }

  /**
   * @param left - cells before the head, origin first
   * @param right - head cell followed by the cells to its right; empty means a single blank
   */
  public static Tape of(CharSequence left, CharSequence right) {
    Cell l = null;
    for (int i = 0; i < left.length(); i++) {
      l = new Cell(left.charAt(i), l);
    }
    Cell r = null;
    for (int i = right.length() - 1; i >= 0; i--) {
      r = new Cell(right.charAt(i), r);
    }
    return new Tape(l, r == null ? BLANK_TAIL : r);
  }

  public char head() {
    return right.symbol;
  }

  /**
   * Overwrite the head cell and move the head.
   * Moving left at the origin leaves the head on the origin.
   * @param symbol - symbol written under the head
   * @param move - head movement after writing
   * @return new tape; this one is unchanged
   */
  public Tape write(char symbol, Move move) {
    // drop the head cell; what remains is the tail, blank if nothing is left
    final Cell tail = right.next == null ? BLANK_TAIL : right.next;

    return switch (move) {
      case RIGHT -> new Tape(new Cell(symbol, left), tail);
      case STAY -> new Tape(left, new Cell(symbol, tail));
      case LEFT -> left == null
          ? new Tape(null, new Cell(symbol, tail))
          : new Tape(left.next, new Cell(left.symbol, new Cell(symbol, tail)));
    };
  }

  public int rightLength() {
    return right.size;
  }

  public String leftContents() {
    if (left == null) {
      return "";
    }
    final char[] cells = new char[left.size];
    int i = cells.length;
    for (Cell c = left; c != null; c = c.next) {
      cells[--i] = c.symbol;
    }
    return new String(cells);
  }

  /**
   * @return head cell first, then the cells to its right
   */
  public String rightContents() {
    final StringBuilder sb = new StringBuilder(right.size);
    for (Cell c = right; c != null; c = c.next) {
      sb.append(c.symbol);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Tape other)) return false;
    return Cell.sameCells(left, other.left) && Cell.sameCells(right, other.right);
  }

  @Override
  public int hashCode() {
    return 31 * Cell.hash(left) + Cell.hash(right);
  }

  @Override
  public String toString() {
    return leftContents() + "[" + head() + "]" + rightContents().substring(1);
  }

  /**
   * Immutable stack node. Nodes are shared between tapes, so they are never modified.
   */
  private static final class Cell {
    final char symbol;
    final Cell next;
    final int size;

    Cell(char symbol, Cell next) {
      this.symbol = symbol;
      this.next = next;
      this.size = next == null ? 1 : next.size + 1;
    }

    static boolean sameCells(Cell a, Cell b) {
      if (size(a) != size(b)) {
        return false;
      }
      // shared tails end the walk early
      while (a != b) {
        if (a.symbol != b.symbol) {
          return false;
        }
        a = a.next;
        b = b.next;
      }
      return true;
    }

    static int hash(Cell c) {
      int h = 1;
      for (; c != null; c = c.next) {
        h = 31 * h + c.symbol;
      }
      return h;
    }

    static int size(Cell c) {
      return c == null ? 0 : c.size;
    }
  }
}
