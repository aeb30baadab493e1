package io.zmanim;

import io.zmanim.ast.Expr;
import io.zmanim.astro.GeoLocation;
import io.zmanim.eval.BaseRegistry;
import io.zmanim.eval.EngineOptions;
import io.zmanim.eval.EvaluationContext;
import io.zmanim.eval.Executor;
import io.zmanim.eval.FailureValue;
import io.zmanim.eval.TimeValue;
import io.zmanim.eval.Value;
import io.zmanim.filter.EventVisibilityFilter;
import io.zmanim.lexer.Lexer;
import io.zmanim.lexer.Token;
import io.zmanim.lexer.TokenKind;
import io.zmanim.parser.Parser;
import io.zmanim.resolve.DependencyResolver;
import io.zmanim.resolve.Resolution;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for calculating zmanim from formulas.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ZmanimEngine engine = new ZmanimEngine();
 * GeoLocation jerusalem = new GeoLocation(31.7683, 35.2137, 754.0, ZoneId.of("Asia/Jerusalem"));
 * CalculationResult alos =
 *     engine.calculate(Formula.of("alos", "solar(16.1, before_sunrise)"), today, jerusalem);
 * alos.time().ifPresent(System.out::println);
 * }</pre>
 *
 * <p>An engine holds no per-calculation state and may be shared between threads. An engine
 * created with a parallelism above one owns a worker pool; {@link #close()} it when done.
 */
public final class ZmanimEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ZmanimEngine.class);

  private final EngineOptions options;
  private final Executor executor;
  private final DependencyResolver resolver;
  private final ParseCache parseCache;

  /** Creates an engine with the defaults from {@link EngineConfig}. */
  public ZmanimEngine() {
    this(EngineOptions.DEFAULT, EngineConfig.RESOLVER_PARALLELISM);
  }

  /**
   * Creates an engine.
   *
   * @param options per-publisher evaluation options
   * @param parallelism worker threads for {@link #calculateDay}, 1 for single-threaded
   */
  public ZmanimEngine(EngineOptions options, int parallelism) {
    this(options, parallelism, EngineConfig.PARSE_CACHE_SIZE);
  }

  /**
   * Creates an engine.
   *
   * @param options per-publisher evaluation options
   * @param parallelism worker threads for {@link #calculateDay}, 1 for single-threaded
   * @param parseCacheSize most recently used formula texts whose trees are kept
   */
  public ZmanimEngine(EngineOptions options, int parallelism, int parseCacheSize) {
    if (parseCacheSize < 1) {
      throw new IllegalArgumentException(
          "parse cache size must be at least 1, got " + parseCacheSize);
    }
    this.options = options;
    this.executor = new Executor(BaseRegistry.standard());
    this.resolver = new DependencyResolver(executor, parallelism);
    this.parseCache = new ParseCache(parseCacheSize);
  }

  /**
   * Creates a location in the {@link EngineConfig#DEFAULT_ZONE default zone}.
   *
   * @param latitude degrees north
   * @param longitude degrees east
   * @param elevation meters above sea level, or null for sea level
   * @return the location
   */
  public static GeoLocation location(double latitude, double longitude, Double elevation) {
    return new GeoLocation(latitude, longitude, elevation, EngineConfig.DEFAULT_ZONE);
  }

  /**
   * Parses formula text, reusing the tree of an identical text parsed recently.
   *
   * @param source the formula text
   * @return the expression tree
   * @throws ZmanimException if the text does not parse
   */
  public Expr parse(String source) throws ZmanimException {
    Expr cached = parseCache.get(source);
    if (cached != null) {
      return cached;
    }
    Expr parsed = Parser.parse(source);
    parseCache.put(source, parsed);
    return parsed;
  }

  /** Returns the number of formula texts whose trees are cached. */
  public int cachedFormulaCount() {
    return parseCache.size();
  }

  /**
   * Calculates a formula with no references and no event filtering.
   *
   * @param formula the formula
   * @param date the local date
   * @param location the location
   * @return the result
   */
  public CalculationResult calculate(Formula formula, LocalDate date, GeoLocation location) {
    return calculate(formula, date, location, Map.of(), Set.of());
  }

  /**
   * Calculates one formula.
   *
   * @param formula the formula
   * @param date the local date
   * @param location the location
   * @param references the times of the formulas it references, by key
   * @param activeEventCodes the event codes active on {@code date}
   * @return the result; hidden if the formula's tags exclude the day
   */
  public CalculationResult calculate(
      Formula formula,
      LocalDate date,
      GeoLocation location,
      Map<String, Instant> references,
      Set<String> activeEventCodes) {
    if (!EventVisibilityFilter.shouldShow(formula.tags(), activeEventCodes)) {
      return CalculationResult.hidden(formula.key());
    }
    try {
      Expr expr = parse(formula.source());
      Map<String, Value> resolved = new LinkedHashMap<>();
      references.forEach((key, time) -> resolved.put(key, new TimeValue(time)));
      EvaluationContext ctx =
          EvaluationContext.create(date, location, options).withResolved(resolved);
      Instant time = executor.evaluateTime(expr, ctx);
      return CalculationResult.success(
          formula.key(), time.atZone(location.zone()), formula.rounding());
    } catch (ZmanimException e) {
      log.warn(
          "formula {} failed on {}: {} [{}]",
          formula.key(),
          date,
          e.getMessage(),
          formula.source());
      return CalculationResult.failure(formula.key(), e);
    }
  }

  /**
   * Calculates a formula set for one day.
   *
   * <p>Formulas whose tags exclude the day are reported hidden and are not evaluated; a formula
   * that references a hidden one gets a reference error. Every other formula is parsed, then
   * the set is resolved in dependency order. A formula that fails to parse or evaluate gets an
   * error result and appears as a failure to the formulas that reference it.
   *
   * @param formulas the formula set
   * @param date the local date
   * @param location the location
   * @param activeEventCodes the event codes active on {@code date}
   * @return the results in input order
   * @throws ZmanimException with {@code CIRCULAR_REFERENCE} if the visible formulas reference
   *     each other in a cycle; nothing is evaluated in that case
   */
  public DayResult calculateDay(
      Collection<Formula> formulas,
      LocalDate date,
      GeoLocation location,
      Set<String> activeEventCodes)
      throws ZmanimException {
    Map<String, CalculationResult> results = new LinkedHashMap<>();
    Map<String, Expr> parsed = new LinkedHashMap<>();
    Map<String, Value> failedParses = new LinkedHashMap<>();
    Map<String, Formula> byKey = new LinkedHashMap<>();

    for (Formula formula : formulas) {
      byKey.put(formula.key(), formula);
      if (!EventVisibilityFilter.shouldShow(formula.tags(), activeEventCodes)) {
        results.put(formula.key(), CalculationResult.hidden(formula.key()));
        continue;
      }
      results.put(formula.key(), null);
      try {
        parsed.put(formula.key(), parse(formula.source()));
      } catch (ZmanimException e) {
        log.warn(
            "formula {} does not parse: {} [{}]", formula.key(), e.getMessage(), formula.source());
        results.put(formula.key(), CalculationResult.failure(formula.key(), e));
        failedParses.put(
            formula.key(), new FailureValue("@" + formula.key() + " failed: " + e.getMessage()));
      }
    }
    log.debug(
        "calculating {} of {} formulas on {} at {}",
        parsed.size(),
        formulas.size(),
        date,
        location);

    EvaluationContext ctx =
        EvaluationContext.create(date, location, options).withResolved(failedParses);
    Resolution resolution = resolver.resolve(parsed, ctx);
    for (String key : resolution.order()) {
      Formula formula = byKey.get(key);
      Optional<Instant> time = resolution.time(key);
      if (time.isPresent()) {
        results.put(
            key,
            CalculationResult.success(key, time.get().atZone(location.zone()), formula.rounding()));
      } else {
        results.put(key, CalculationResult.failure(key, resolution.error(key).orElseThrow()));
      }
    }
    return new DayResult(date, results);
  }

  /**
   * Checks a formula before it is published: it must parse, and every {@code @key} it
   * references must be one of {@code availableKeys} and not the formula itself.
   *
   * @param key the formula's own key
   * @param source the formula text
   * @param availableKeys the keys the formula may reference
   * @throws ZmanimException describing the first problem found
   */
  public void validate(String key, String source, Set<String> availableKeys)
      throws ZmanimException {
    // Drafts are parsed without caching; only published formulas reach parse().
    Parser.parse(source);
    List<Token> tokens = Lexer.tokenize(source);
    for (Token tok : tokens) {
      if (tok.kind() != TokenKind.REFERENCE) {
        continue;
      }
      String ref = tok.lexeme();
      if (ref.equals(key)) {
        throw ZmanimException.reference(
            "formula @" + key + " references itself", tok.span(), source, null);
      }
      if (!availableKeys.contains(ref)) {
        String closest = Parser.suggest(ref, availableKeys);
        throw ZmanimException.reference(
            "undefined reference: @" + ref,
            tok.span(),
            source,
            closest == null ? null : "@" + closest);
      }
    }
  }

  /** Stops the resolver's worker pool, if the engine has one. */
  @Override
  public void close() {
    resolver.shutdown();
  }

  /** Least recently used formula trees, bounded. */
  private static final class ParseCache {
    private final Map<String, Expr> entries;

    ParseCache(int capacity) {
      this.entries =
          new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Expr> eldest) {
              return size() > capacity;
            }
          };
    }

    synchronized Expr get(String source) {
      return entries.get(source);
    }

    synchronized void put(String source, Expr expr) {
      entries.put(source, expr);
    }

    synchronized int size() {
      return entries.size();
    }
  }
}
