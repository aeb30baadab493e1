package io.zmanim.resolve;

import io.zmanim.ZmanimException;
import io.zmanim.ast.Expr;
import io.zmanim.ast.ReferenceCollector;
import io.zmanim.display.Display;
import io.zmanim.eval.EvaluationContext;
import io.zmanim.eval.Executor;
import io.zmanim.eval.FailureValue;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a set of formulas that reference each other.
 *
 * <p>The reference graph is checked for cycles before anything is evaluated. A formula whose
 * evaluation fails does not stop the batch: its error is recorded and its dependents see a
 * {@link FailureValue} in its place, so {@code first_valid} can still fall back past it.
 *
 * <p>With a parallelism of one, formulas run in topological order on the calling thread.
 * Otherwise each formula is submitted to a fixed pool, created with the resolver, as soon as
 * its last dependency has completed. Call {@link #shutdown()} to release the pool.
 */
public final class DependencyResolver implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

  private final Executor executor;
  private final int parallelism;
  private final ExecutorService pool;

  /**
   * Creates a resolver.
   *
   * @param executor the executor that evaluates each formula
   * @param parallelism the number of worker threads, 1 for single-threaded resolution
   */
  public DependencyResolver(Executor executor, int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
    }
    this.executor = executor;
    this.parallelism = parallelism;
    this.pool = parallelism == 1 ? null : Executors.newFixedThreadPool(parallelism, workers());
  }

  /** Creates a single-threaded resolver. */
  public DependencyResolver(Executor executor) {
    this(executor, 1);
  }

  /** Returns the number of worker threads, 1 when formulas run on the calling thread. */
  public int parallelism() {
    return parallelism;
  }

  /**
   * Resolves a formula set.
   *
   * <p>Values already resolved in {@code ctx} are visible to every formula, so callers can
   * supply formulas evaluated elsewhere.
   *
   * @param formulas the parsed formulas by key
   * @param ctx the day and place to evaluate at
   * @return the per-key results
   * @throws ZmanimException with {@code CIRCULAR_REFERENCE} if the formulas reference each
   *     other in a cycle
   * @throws IllegalStateException if the resolver has been shut down
   */
  public Resolution resolve(Map<String, Expr> formulas, EvaluationContext ctx)
      throws ZmanimException {
    if (pool != null && pool.isShutdown()) {
      throw new IllegalStateException("resolver has been shut down");
    }
    Map<String, Set<String>> references = new LinkedHashMap<>();
    for (Map.Entry<String, Expr> entry : formulas.entrySet()) {
      references.put(entry.getKey(), ReferenceCollector.references(entry.getValue()));
    }
    DependencyGraph graph = DependencyGraph.of(references);
    List<String> order = graph.topologicalOrder();
    log.debug("resolving {} formulas for {} in order {}", order.size(), ctx.date(), order);

    Map<String, Value> values = new ConcurrentHashMap<>(ctx.resolvedValues());
    Map<String, Instant> times = new ConcurrentHashMap<>();
    Map<String, ZmanimException> errors = new ConcurrentHashMap<>();
    Batch batch = new Batch(executor, formulas, ctx.withResolved(values), values, times, errors);

    if (pool == null || order.size() < 2) {
      for (String key : order) {
        batch.evaluate(key);
      }
    } else {
      runParallel(graph, batch);
    }

    Map<String, Instant> orderedTimes = new LinkedHashMap<>();
    Map<String, ZmanimException> orderedErrors = new LinkedHashMap<>();
    for (String key : order) {
      if (times.containsKey(key)) {
        orderedTimes.put(key, times.get(key));
      } else {
        orderedErrors.put(key, errors.get(key));
      }
    }
    return new Resolution(order, orderedTimes, orderedErrors);
  }

  private void runParallel(DependencyGraph graph, Batch batch) {
    int n = graph.size();
    AtomicInteger[] pending = new AtomicInteger[n];
    for (int i = 0; i < n; i++) {
      pending[i] = new AtomicInteger(graph.dependencyCount(i));
    }
    AtomicInteger remaining = new AtomicInteger(n);
    CompletableFuture<Void> done = new CompletableFuture<>();

    ReadyCountScheduler scheduler =
        new ReadyCountScheduler(graph, batch, pool, pending, remaining, done);
    try {
      for (int i = 0; i < n; i++) {
        if (pending[i].get() == 0) {
          scheduler.submit(i);
        }
      }
      done.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw e;
    }
  }

  /**
   * Shuts down the worker pool, waiting for running formulas to finish. A single-threaded
   * resolver has nothing to release.
   */
  public void shutdown() {
    if (pool == null) {
      return;
    }
    pool.shutdown();
    try {
      if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("resolver pool did not stop within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Same as {@link #shutdown()}. */
  @Override
  public void close() {
    shutdown();
  }

  /** Daemon worker threads, so an engine that is never closed does not keep the JVM alive. */
  private static ThreadFactory workers() {
    AtomicInteger count = new AtomicInteger();
    return task -> {
      Thread thread = new Thread(task, "zmanim-resolver-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  /** Submits each formula once its dependencies have completed. */
  private static final class ReadyCountScheduler {
    private final DependencyGraph graph;
    private final Batch batch;
    private final ExecutorService pool;
    private final AtomicInteger[] pending;
    private final AtomicInteger remaining;
    private final CompletableFuture<Void> done;

    ReadyCountScheduler(
        DependencyGraph graph,
        Batch batch,
        ExecutorService pool,
        AtomicInteger[] pending,
        AtomicInteger remaining,
        CompletableFuture<Void> done) {
      this.graph = graph;
      this.batch = batch;
      this.pool = pool;
      this.pending = pending;
      this.remaining = remaining;
      this.done = done;
    }

    void submit(int id) {
      pool.execute(
          () -> {
            try {
              batch.evaluate(graph.keys().get(id));
            } catch (RuntimeException e) {
              done.completeExceptionally(e);
              return;
            }
            for (int dependent : graph.dependents(id)) {
              if (pending[dependent].decrementAndGet() == 0) {
                submit(dependent);
              }
            }
            if (remaining.decrementAndGet() == 0) {
              done.complete(null);
            }
          });
    }
  }

  /** Shared state of one resolution pass. */
  private static final class Batch {
    private final Executor executor;
    private final Map<String, Expr> formulas;
    private final EvaluationContext ctx;
    private final Map<String, Value> values;
    private final Map<String, Instant> times;
    private final Map<String, ZmanimException> errors;

    Batch(
        Executor executor,
        Map<String, Expr> formulas,
        EvaluationContext ctx,
        Map<String, Value> values,
        Map<String, Instant> times,
        Map<String, ZmanimException> errors) {
      this.executor = executor;
      this.formulas = formulas;
      this.ctx = ctx;
      this.values = values;
      this.times = times;
      this.errors = errors;
    }

    void evaluate(String key) {
      Expr expr = formulas.get(key);
      try {
        Instant time = executor.evaluateTime(expr, ctx);
        times.put(key, time);
        values.put(key, new TimeValue(time));
      } catch (ZmanimException e) {
        log.warn(
            "formula {} failed on {}: {} [{}]",
            key,
            ctx.date(),
            e.getMessage(),
            Display.render(expr));
        errors.put(key, e);
        values.put(key, new FailureValue("@" + key + " failed: " + e.getMessage()));
      }
    }
  }
}
