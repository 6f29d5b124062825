package syncc.schedule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Tarjan's strongly connected components over a graph with vertices {@code 0..n-1}.
 */
class StronglyConnected {
  private final List<? extends Collection<Integer>> successors;
  private final int[] index;
  private final int[] lowlink;
  private final boolean[] onStack;
  private final ArrayDeque<Integer> stack = new ArrayDeque<>();
  private final List<List<Integer>> components = new ArrayList<>();
  private int nextIndex = 0;

  private StronglyConnected(List<? extends Collection<Integer>> successors) {
    this.successors = successors;
    int n = successors.size();
    index = new int[n];
    lowlink = new int[n];
    onStack = new boolean[n];
    Arrays.fill(index, -1);
  }

  /**
   * Returns all components. Each component is sorted, components are ordered by their smallest vertex.
   */
  static List<List<Integer>> components(List<? extends Collection<Integer>> successors) {
    StronglyConnected scc = new StronglyConnected(successors);
    for (int v = 0; v < successors.size(); ++v) {
      if (scc.index[v] == -1)
        scc.visit(v);
    }
    scc.components.forEach(component -> component.sort(Comparator.naturalOrder()));
    scc.components.sort(Comparator.comparing(component -> component.get(0)));
    return scc.components;
  }

  /** Returns the components that contain a cycle (more than one vertex, or a self loop). */
  static List<List<Integer>> cyclicComponents(List<? extends Collection<Integer>> successors) {
    return components(successors).stream()
        .filter(component -> component.size() > 1 || successors.get(component.get(0)).contains(component.get(0)))
        .toList();
  }

  private void visit(int v) {
    index[v] = nextIndex;
    lowlink[v] = nextIndex;
    nextIndex++;
    stack.push(v);
    onStack[v] = true;
    for (int w : successors.get(v)) {
      if (index[w] == -1) {
        visit(w);
        lowlink[v] = Math.min(lowlink[v], lowlink[w]);
      } else if (onStack[w]) {
        lowlink[v] = Math.min(lowlink[v], index[w]);
      }
    }
    if (lowlink[v] == index[v]) {
      ArrayList<Integer> component = new ArrayList<>();
      int w;
      do {
        w = stack.pop();
        onStack[w] = false;
        component.add(w);
      } while (w != v);
      components.add(component);
    }
  }
}
