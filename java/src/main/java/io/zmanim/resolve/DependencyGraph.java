package io.zmanim.resolve;

import io.zmanim.ZmanimException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference graph of a formula set. Each key gets an integer id in insertion order; edges run
 * from a formula to the formulas it references. References to keys outside the set are not
 * edges.
 */
public final class DependencyGraph {
  private final List<String> keys;
  private final Map<String, Integer> ids;
  private final int[][] dependencies;
  private final int[][] dependents;

  private DependencyGraph(
      List<String> keys, Map<String, Integer> ids, int[][] dependencies, int[][] dependents) {
    this.keys = keys;
    this.ids = ids;
    this.dependencies = dependencies;
    this.dependents = dependents;
  }

  /**
   * Builds the graph of a formula set.
   *
   * @param references the keys each formula references, by formula key
   * @return the graph
   */
  public static DependencyGraph of(Map<String, ? extends Set<String>> references) {
    List<String> keys = new ArrayList<>(references.keySet());
    Map<String, Integer> ids = new HashMap<>();
    for (int i = 0; i < keys.size(); i++) {
      ids.put(keys.get(i), i);
    }

    int n = keys.size();
    int[][] dependencies = new int[n][];
    List<List<Integer>> reverse = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      reverse.add(new ArrayList<>());
    }
    for (int i = 0; i < n; i++) {
      List<Integer> deps = new ArrayList<>();
      for (String ref : references.get(keys.get(i))) {
        Integer target = ids.get(ref);
        if (target != null && !deps.contains(target)) {
          deps.add(target);
          reverse.get(target).add(i);
        }
      }
      dependencies[i] = deps.stream().mapToInt(Integer::intValue).toArray();
    }
    int[][] dependents = new int[n][];
    for (int i = 0; i < n; i++) {
      dependents[i] = reverse.get(i).stream().mapToInt(Integer::intValue).toArray();
    }
    return new DependencyGraph(Collections.unmodifiableList(keys), ids, dependencies, dependents);
  }

  /** Returns the number of formulas. */
  public int size() {
    return keys.size();
  }

  /** Returns the formula keys, indexed by id. */
  public List<String> keys() {
    return keys;
  }

  /**
   * Returns the id of a key.
   *
   * @param key the formula key
   * @return the id, or -1 if the key is not in the graph
   */
  public int id(String key) {
    return ids.getOrDefault(key, -1);
  }

  /** Returns the number of in-set formulas the formula with the given id references. */
  public int dependencyCount(int id) {
    return dependencies[id].length;
  }

  /** Returns the ids of the formulas that reference the formula with the given id. */
  public int[] dependents(int id) {
    return dependents[id].clone();
  }

  /**
   * Orders the formulas so that every formula comes after the formulas it references.
   *
   * <p>Kahn's algorithm over the ids; ties keep insertion order.
   *
   * @return the keys in evaluation order
   * @throws ZmanimException with the cycle path if the graph has a cycle
   */
  public List<String> topologicalOrder() throws ZmanimException {
    int n = keys.size();
    int[] remaining = new int[n];
    Deque<Integer> ready = new ArrayDeque<>();
    for (int i = 0; i < n; i++) {
      remaining[i] = dependencies[i].length;
      if (remaining[i] == 0) {
        ready.add(i);
      }
    }

    List<String> order = new ArrayList<>(n);
    while (!ready.isEmpty()) {
      int id = ready.poll();
      order.add(keys.get(id));
      for (int dependent : dependents[id]) {
        if (--remaining[dependent] == 0) {
          ready.add(dependent);
        }
      }
    }

    if (order.size() < n) {
      throw ZmanimException.circular(findCycle(remaining));
    }
    return Collections.unmodifiableList(order);
  }

  /** Walks dependency edges among the unsorted ids until one repeats. */
  private List<String> findCycle(int[] remaining) {
    int start = 0;
    while (remaining[start] == 0) {
      start++;
    }

    // Every unsorted node has an unsorted dependency, so the walk must revisit a node.
    List<Integer> path = new ArrayList<>();
    int[] position = new int[keys.size()];
    Arrays.fill(position, -1);
    int current = start;
    while (position[current] < 0) {
      position[current] = path.size();
      path.add(current);
      int next = -1;
      for (int dep : dependencies[current]) {
        if (remaining[dep] > 0) {
          next = dep;
          break;
        }
      }
      current = next;
    }

    List<String> cycle = new ArrayList<>();
    for (int i = position[current]; i < path.size(); i++) {
      cycle.add(keys.get(path.get(i)));
    }
    return cycle;
  }
}
