package io.zmanim.resolve;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.ErrorKind;
import io.zmanim.ZmanimException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class DependencyGraphTest {

  @Test
  void testDependenciesComeFirst() throws ZmanimException {
    Map<String, Set<String>> refs = new LinkedHashMap<>();
    refs.put("tzeis", Set.of("shkia"));
    refs.put("shkia", Set.of());
    refs.put("plag", Set.of("tzeis", "alos"));
    refs.put("alos", Set.of());
    DependencyGraph graph = DependencyGraph.of(refs);
    List<String> order = graph.topologicalOrder();
    assertEquals(List.of("shkia", "alos", "tzeis", "plag"), order);
  }

  @Test
  void testIndependentFormulasKeepInsertionOrder() throws ZmanimException {
    Map<String, Set<String>> refs = new LinkedHashMap<>();
    refs.put("c", Set.of());
    refs.put("a", Set.of());
    refs.put("b", Set.of());
    DependencyGraph graph = DependencyGraph.of(refs);
    assertEquals(List.of("c", "a", "b"), graph.topologicalOrder());
  }

  @Test
  void testReferencesOutsideTheSetAreNotEdges() throws ZmanimException {
    Map<String, Set<String>> refs = new LinkedHashMap<>();
    refs.put("a", Set.of("external"));
    refs.put("b", Set.of("a"));
    DependencyGraph graph = DependencyGraph.of(refs);
    assertEquals(0, graph.dependencyCount(graph.id("a")));
    assertEquals(1, graph.dependencyCount(graph.id("b")));
    assertArrayEquals(new int[] {graph.id("b")}, graph.dependents(graph.id("a")));
    assertEquals(-1, graph.id("external"));
    assertEquals(List.of("a", "b"), graph.topologicalOrder());
  }

  @Test
  void testTwoFormulaCycle() {
    Map<String, Set<String>> refs = new LinkedHashMap<>();
    refs.put("zman_a", Set.of("zman_b"));
    refs.put("zman_b", Set.of("zman_a"));
    DependencyGraph graph = DependencyGraph.of(refs);
    ZmanimException e = assertThrows(ZmanimException.class, graph::topologicalOrder);
    assertEquals(ErrorKind.CIRCULAR_REFERENCE, e.kind());
    assertEquals(List.of("zman_a", "zman_b"), e.cyclePath());
    assertEquals("circular reference: zman_a -> zman_b -> zman_a", e.getMessage());
  }

  @Test
  void testSelfReference() {
    DependencyGraph graph = DependencyGraph.of(Map.of("a", Set.of("a")));
    ZmanimException e = assertThrows(ZmanimException.class, graph::topologicalOrder);
    assertEquals(ErrorKind.CIRCULAR_REFERENCE, e.kind());
    assertEquals(List.of("a"), e.cyclePath());
  }

  @Test
  void testCycleBehindAcyclicPrefix() {
    Map<String, Set<String>> refs = new LinkedHashMap<>();
    refs.put("root", Set.of());
    refs.put("x", Set.of("root", "z"));
    refs.put("y", Set.of("x"));
    refs.put("z", Set.of("y"));
    DependencyGraph graph = DependencyGraph.of(refs);
    ZmanimException e = assertThrows(ZmanimException.class, graph::topologicalOrder);
    assertEquals(List.of("x", "z", "y"), e.cyclePath());
  }

  @Test
  void testEmptyGraph() throws ZmanimException {
    assertEquals(List.of(), DependencyGraph.of(Map.of()).topologicalOrder());
  }
}
