package syncc.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Activation condition of a stream: either the node's base clock, or a parent clock sampled on a boolean variable.
 * A stream on {@code ck on c} carries a value at the instants where {@code ck} is active and {@code c} is true
 * ({@code ck on not c}: where c is false).
 */
public final class Clock {
  public static final Clock BASE = new Clock(null, null, true);

  private final Clock parent;
  private final String variable;
  private final boolean polarity;

  private Clock(Clock parent, String variable, boolean polarity) {
    this.parent = parent;
    this.variable = variable;
    this.polarity = polarity;
  }

  /** Constructs {@code parent on variable} (polarity true) or {@code parent on not variable} (polarity false). */
  public static Clock on(Clock parent, String variable, boolean polarity) {
    Objects.requireNonNull(parent);
    Objects.requireNonNull(variable);
    return new Clock(parent, variable, polarity);
  }

  public boolean isBase() { return parent == null; }
  public Clock getParent() { return parent; }
  public String getVariable() { return variable; }
  public boolean getPolarity() { return polarity; }

  /** A single sampling level of a clock. */
  public static record Guard(String variable, boolean polarity) {}

  /**
   * Returns the sampling levels of this clock, outermost (closest to base) first.
   */
  public List<Guard> guards() {
    ArrayList<Guard> ret = new ArrayList<>();
    for (Clock cur = this; !cur.isBase(); cur = cur.parent)
      ret.add(new Guard(cur.variable, cur.polarity));
    Collections.reverse(ret);
    return ret;
  }

  /** Variables the clock samples on, outermost first. */
  public List<String> variables() { return guards().stream().map(Guard::variable).toList(); }

  /** Replaces every sampling variable according to the given renaming (used when instantiating interface clocks). */
  public Clock rename(UnaryOperator<String> renaming) {
    if (isBase())
      return this;
    return on(parent.rename(renaming), renaming.apply(variable), polarity);
  }

  /**
   * Parses the textual form produced by {@link #toString()}, e.g. {@code base on c on not d}.
   * An empty or null string denotes the base clock.
   */
  public static Clock parse(String text) {
    if (text == null || text.isBlank())
      return BASE;
    String[] words = text.trim().split("\\s+");
    if (!words[0].equals("base"))
      throw new IllegalArgumentException("Clock must start with 'base': " + text);
    Clock ret = BASE;
    int i = 1;
    while (i < words.length) {
      if (!words[i].equals("on") || i + 1 >= words.length)
        throw new IllegalArgumentException("Malformed clock: " + text);
      boolean polarity = true;
      i++;
      if (words[i].equals("not")) {
        polarity = false;
        i++;
        if (i >= words.length)
          throw new IllegalArgumentException("Malformed clock: " + text);
      }
      ret = on(ret, words[i], polarity);
      i++;
    }
    return ret;
  }

  @Override
  public int hashCode() {
    return Objects.hash(parent, variable, polarity);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Clock other = (Clock)obj;
    return polarity == other.polarity && Objects.equals(variable, other.variable) && Objects.equals(parent, other.parent);
  }
  @Override
  public String toString() {
    if (isBase())
      return "base";
    return parent.toString() + (polarity ? " on " : " on not ") + variable;
  }
}
