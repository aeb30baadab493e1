package io.zmanim.eval;

import io.zmanim.ZmanimException;
import io.zmanim.ast.ArithmeticOperator;
import io.zmanim.ast.Base;
import io.zmanim.ast.BaseArg;
import io.zmanim.ast.BinaryOp;
import io.zmanim.ast.Call;
import io.zmanim.ast.Comparison;
import io.zmanim.ast.ConditionVar;
import io.zmanim.ast.Conditional;
import io.zmanim.ast.DateLit;
import io.zmanim.ast.Direction;
import io.zmanim.ast.DirectionArg;
import io.zmanim.ast.DurationLit;
import io.zmanim.ast.Expr;
import io.zmanim.ast.ExprVisitor;
import io.zmanim.ast.FunctionName;
import io.zmanim.ast.Logical;
import io.zmanim.ast.LogicalOperator;
import io.zmanim.ast.MonthName;
import io.zmanim.ast.NumberLit;
import io.zmanim.ast.Primitive;
import io.zmanim.ast.PrimitiveRef;
import io.zmanim.ast.Reference;
import io.zmanim.ast.StringLit;
import io.zmanim.astro.GeoLocation;
import io.zmanim.astro.SolarAngleSolver;
import io.zmanim.astro.SolarDay;
import io.zmanim.display.Display;
import io.zmanim.parser.ArgumentRules;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Year;
import java.util.Optional;

/**
 * Evaluates expressions against an {@link EvaluationContext}.
 *
 * <p>Evaluation is a single recursive walk with no state beyond the context. Failures are values
 * and propagate through operators; type mismatches and unresolved references are thrown.
 */
public final class Executor {
  /** Minutes in the twelve-hour equinox day that proportional offsets are scaled from. */
  static final double EQUINOX_DAY_MINUTES = 720.0;

  private final BaseRegistry bases;

  /** Creates an executor with the built-in base rules. */
  public Executor() {
    this(BaseRegistry.standard());
  }

  /**
   * Creates an executor.
   *
   * @param bases the day-boundary rules for {@code proportional_hours}
   */
  public Executor(BaseRegistry bases) {
    this.bases = bases;
  }

  /**
   * Evaluates an expression.
   *
   * @param expr the expression
   * @param ctx the evaluation context
   * @return the value, possibly a {@link FailureValue}
   * @throws ZmanimException on type errors and unresolved references, and with {@code TYPE}
   *     when time arithmetic leaves the range of {@link Instant} or {@link Duration}
   */
  public Value evaluate(Expr expr, EvaluationContext ctx) throws ZmanimException {
    try {
      return expr.accept(new Evaluation(ctx));
    } catch (ArithmeticException | DateTimeException e) {
      throw ZmanimException.type("time arithmetic out of range: " + e.getMessage());
    }
  }

  /**
   * Evaluates a formula body, which must produce a time.
   *
   * @param expr the formula body
   * @param ctx the evaluation context
   * @return the instant
   * @throws ZmanimException with {@code EVAL} if the formula produced a failure, or on type
   *     errors and unresolved references
   */
  public Instant evaluateTime(Expr expr, EvaluationContext ctx) throws ZmanimException {
    Value value = evaluate(expr, ctx);
    if (value instanceof FailureValue failure) {
      throw ZmanimException.eval(failure.reason());
    }
    if (!(value instanceof TimeValue time)) {
      throw ZmanimException.type("formula must produce a time, found " + value.typeName());
    }
    return time.instant();
  }

  private final class Evaluation implements ExprVisitor<Value, ZmanimException> {
    private final EvaluationContext ctx;

    Evaluation(EvaluationContext ctx) {
      this.ctx = ctx;
    }

    @Override
    public Value visitPrimitive(PrimitiveRef node) {
      return ctx.primitive(node.primitive());
    }

    @Override
    public Value visitNumber(NumberLit node) {
      return new NumberValue(node.value());
    }

    @Override
    public Value visitDuration(DurationLit node) {
      return new DurationValue(node.toDuration());
    }

    @Override
    public Value visitDate(DateLit node) throws ZmanimException {
      int year = ctx.date().getYear();
      if (node.month() == MonthName.FEBRUARY && node.day() == 29 && !Year.isLeap(year)) {
        throw ZmanimException.type("date 29-Feb does not exist in " + year);
      }
      return new NumberValue(
          LocalDate.of(year, node.month().toMonth(), node.day()).getDayOfYear());
    }

    @Override
    public Value visitString(StringLit node) {
      return new TextValue(node.value());
    }

    @Override
    public Value visitBinary(BinaryOp node) throws ZmanimException {
      Value lhs = node.lhs().accept(this);
      if (lhs.isFailure()) {
        return lhs;
      }
      Value rhs = node.rhs().accept(this);
      if (rhs.isFailure()) {
        return rhs;
      }
      return arithmetic(node.op(), lhs, rhs);
    }

    @Override
    public Value visitCall(Call node) throws ZmanimException {
      FunctionName fn = node.function();
      return switch (fn) {
        case SOLAR -> solar(node);
        case SEASONAL_SOLAR -> seasonalSolar(node);
        case PROPORTIONAL_HOURS -> proportionalHours(node);
        case PROPORTIONAL_MINUTES -> proportionalMinutes(node);
        case MIDPOINT -> midpoint(node);
        case EARLIER_OF, LATER_OF -> pick(node, fn == FunctionName.EARLIER_OF);
        case FIRST_VALID -> firstValid(node);
      };
    }

    @Override
    public Value visitDirection(DirectionArg node) throws ZmanimException {
      throw ZmanimException.type(
          "direction '" + node.direction() + "' can only be used as a function argument");
    }

    @Override
    public Value visitBase(BaseArg node) throws ZmanimException {
      throw ZmanimException.type(
          "base '" + node.base() + "' can only be used as a function argument");
    }

    @Override
    public Value visitReference(Reference node) throws ZmanimException {
      Optional<Value> value = ctx.resolved(node.key());
      if (value.isEmpty()) {
        throw ZmanimException.reference(node.key());
      }
      return value.get();
    }

    @Override
    public Value visitConditional(Conditional node) throws ZmanimException {
      for (Conditional.Branch branch : node.branches()) {
        Value condition = branch.condition().accept(this);
        if (condition.isFailure()) {
          return condition;
        }
        if (requireBoolean(condition, "if condition")) {
          return branch.body().accept(this);
        }
      }
      if (node.otherwise() != null) {
        return node.otherwise().accept(this);
      }
      return new FailureValue("no branch of the conditional applies on " + ctx.date());
    }

    @Override
    public Value visitComparison(Comparison node) throws ZmanimException {
      Value lhs = node.lhs().accept(this);
      if (lhs.isFailure()) {
        return lhs;
      }
      Value rhs = node.rhs().accept(this);
      if (rhs.isFailure()) {
        return rhs;
      }

      int cmp;
      if (lhs instanceof NumberValue a && rhs instanceof NumberValue b) {
        cmp = Double.compare(a.value(), b.value());
      } else if (lhs instanceof DurationValue a && rhs instanceof DurationValue b) {
        cmp = a.duration().compareTo(b.duration());
      } else if (lhs instanceof TimeValue a && rhs instanceof TimeValue b) {
        cmp = a.instant().compareTo(b.instant());
      } else if (lhs instanceof TextValue a && rhs instanceof TextValue b) {
        if (!node.op().isEquality()) {
          throw ZmanimException.type("text values can only be compared with == and !=");
        }
        cmp = a.value().equals(b.value()) ? 0 : 1;
      } else {
        throw ZmanimException.type(
            "cannot compare " + lhs.typeName() + " with " + rhs.typeName());
      }
      return BooleanValue.of(node.op().test(cmp));
    }

    @Override
    public Value visitLogical(Logical node) throws ZmanimException {
      Value first = node.operands().get(0).accept(this);
      if (first.isFailure()) {
        return first;
      }
      boolean left = requireBoolean(first, "operand of '" + node.op() + "'");
      if (node.op() == LogicalOperator.NOT) {
        return BooleanValue.of(!left);
      }
      if (node.op() == LogicalOperator.AND && !left) {
        return BooleanValue.FALSE;
      }
      if (node.op() == LogicalOperator.OR && left) {
        return BooleanValue.TRUE;
      }
      Value second = node.operands().get(1).accept(this);
      if (second.isFailure()) {
        return second;
      }
      return BooleanValue.of(requireBoolean(second, "operand of '" + node.op() + "'"));
    }

    @Override
    public Value visitConditionVar(ConditionVar node) {
      LocalDate date = ctx.date();
      return switch (node.variable()) {
        case LATITUDE -> new NumberValue(ctx.location().latitude());
        case LONGITUDE -> new NumberValue(ctx.location().longitude());
        case DAY_LENGTH -> ctx.dayLength();
        case MONTH -> new NumberValue(date.getMonthValue());
        case DAY -> new NumberValue(date.getDayOfMonth());
        case DAY_OF_YEAR, DATE -> new NumberValue(date.getDayOfYear());
        case SEASON -> new TextValue(ctx.season().toString());
      };
    }

    // Functions

    private Value solar(Call node) throws ZmanimException {
      Value degrees = numberArgument(node.function(), node.args().get(0));
      if (degrees.isFailure()) {
        return degrees;
      }
      double deg = ((NumberValue) degrees).value();
      Direction direction = directionArgument(node.function(), node.args().get(1));
      GeoLocation loc = ctx.location();
      return SolarAngleSolver.depression(
              ctx.date(), loc.latitude(), loc.longitude(), deg, direction.isMorning())
          .<Value>map(TimeValue::new)
          .orElseGet(() -> notReached(node));
    }

    private Value seasonalSolar(Call node) throws ZmanimException {
      Value degrees = numberArgument(node.function(), node.args().get(0));
      if (degrees.isFailure()) {
        return degrees;
      }
      double deg = ((NumberValue) degrees).value();
      boolean morning =
          directionArgument(node.function(), node.args().get(1))
              == Direction.BEFORE_VISIBLE_SUNRISE;
      Primitive anchor = morning ? Primitive.VISIBLE_SUNRISE : Primitive.VISIBLE_SUNSET;

      // Offset between the horizon and the angle on the equinox, scaled by today's day length.
      SolarDay equinox = ctx.equinoxDay();
      GeoLocation loc = ctx.location();
      Optional<Instant> equinoxAnchor = equinox.get(anchor);
      Optional<Instant> equinoxAngle =
          SolarAngleSolver.depression(
              equinox.date(), loc.latitude(), loc.longitude(), deg, morning);
      if (equinoxAnchor.isEmpty() || equinoxAngle.isEmpty()) {
        return notReached(node);
      }
      Duration equinoxOffset = Duration.between(equinoxAngle.get(), equinoxAnchor.get()).abs();

      Value dayLength = ctx.dayLength();
      if (dayLength.isFailure()) {
        return dayLength;
      }
      Value today = ctx.primitive(anchor);
      if (today.isFailure()) {
        return today;
      }
      double ratio =
          ((DurationValue) dayLength).duration().toNanos() / (EQUINOX_DAY_MINUTES * 60e9);
      Duration offset = scale(equinoxOffset, ratio);
      Instant base = ((TimeValue) today).instant();
      return new TimeValue(morning ? base.minus(offset) : base.plus(offset));
    }

    private Value proportionalHours(Call node) throws ZmanimException {
      Value hours = numberArgument(node.function(), node.args().get(0));
      if (hours.isFailure()) {
        return hours;
      }
      Expr baseExpr = node.args().get(1);
      if (!(baseExpr instanceof BaseArg base)) {
        throw ZmanimException.type(node.function() + "() second argument must be a base");
      }

      DayBounds bounds;
      if (base.base() == Base.CUSTOM) {
        Value start = timeArgument(Base.CUSTOM + "() start", base.start());
        if (start.isFailure()) {
          return start;
        }
        Value end = timeArgument(Base.CUSTOM + "() end", base.end());
        if (end.isFailure()) {
          return end;
        }
        bounds = new DayBounds(((TimeValue) start).instant(), ((TimeValue) end).instant());
      } else {
        BaseRegistry.BoundsRule rule =
            bases
                .rule(base.base())
                .orElseThrow(() -> ZmanimException.type("unknown base '" + base.base() + "'"));
        Optional<DayBounds> resolved = rule.bounds(ctx);
        if (resolved.isEmpty()) {
          return new FailureValue(
              "day boundaries for " + base.base() + " are undefined on " + ctx.date());
        }
        bounds = resolved.get();
      }
      return new TimeValue(bounds.at(((NumberValue) hours).value()));
    }

    private Value proportionalMinutes(Call node) throws ZmanimException {
      Value minutes = numberArgument(node.function(), node.args().get(0));
      if (minutes.isFailure()) {
        return minutes;
      }
      boolean before =
          directionArgument(node.function(), node.args().get(1))
              == Direction.BEFORE_VISIBLE_SUNRISE;
      Value dayLength = ctx.dayLength();
      if (dayLength.isFailure()) {
        return dayLength;
      }
      Value anchor = ctx.primitive(before ? Primitive.VISIBLE_SUNRISE : Primitive.VISIBLE_SUNSET);
      if (anchor.isFailure()) {
        return anchor;
      }
      Duration offset =
          scale(
              ((DurationValue) dayLength).duration(),
              ((NumberValue) minutes).value() / EQUINOX_DAY_MINUTES);
      Instant t = ((TimeValue) anchor).instant();
      return new TimeValue(before ? t.minus(offset) : t.plus(offset));
    }

    private Value midpoint(Call node) throws ZmanimException {
      Value first = timeArgument(node.function() + "() argument", node.args().get(0));
      if (first.isFailure()) {
        return first;
      }
      Value second = timeArgument(node.function() + "() argument", node.args().get(1));
      if (second.isFailure()) {
        return second;
      }
      Instant a = ((TimeValue) first).instant();
      Instant b = ((TimeValue) second).instant();
      return new TimeValue(a.plus(Duration.between(a, b).dividedBy(2)));
    }

    private Value pick(Call node, boolean earlier) throws ZmanimException {
      Value first = timeArgument(node.function() + "() argument", node.args().get(0));
      if (first.isFailure()) {
        return first;
      }
      Value second = timeArgument(node.function() + "() argument", node.args().get(1));
      if (second.isFailure()) {
        return second;
      }
      Instant a = ((TimeValue) first).instant();
      Instant b = ((TimeValue) second).instant();
      boolean firstWins = earlier ? !a.isAfter(b) : !a.isBefore(b);
      return firstWins ? first : second;
    }

    private Value firstValid(Call node) throws ZmanimException {
      for (Expr arg : node.args()) {
        Value value = arg.accept(this);
        if (!value.isFailure()) {
          return value;
        }
      }
      return new FailureValue(
          "first_valid(): all " + node.args().size() + " alternatives failed on " + ctx.date());
    }

    // Helpers

    private Value numberArgument(FunctionName fn, Expr arg) throws ZmanimException {
      Value value = arg.accept(this);
      if (value.isFailure()) {
        return value;
      }
      if (!(value instanceof NumberValue number)) {
        throw ZmanimException.type(
            fn + "() first argument must be a number, found " + value.typeName());
      }
      Optional<String> error = ArgumentRules.checkNumber(fn, number.value());
      if (error.isPresent()) {
        throw ZmanimException.type(error.get());
      }
      return number;
    }

    private Direction directionArgument(FunctionName fn, Expr arg) throws ZmanimException {
      if (!(arg instanceof DirectionArg dir)) {
        throw ZmanimException.type(fn + "() second argument must be a direction");
      }
      Optional<String> error = ArgumentRules.checkDirection(fn, dir.direction());
      if (error.isPresent()) {
        throw ZmanimException.type(error.get());
      }
      return dir.direction();
    }

    private Value timeArgument(String what, Expr arg) throws ZmanimException {
      Value value = arg.accept(this);
      if (value.isFailure() || value instanceof TimeValue) {
        return value;
      }
      throw ZmanimException.type(what + " must be a time, found " + value.typeName());
    }

    private boolean requireBoolean(Value value, String what) throws ZmanimException {
      if (!(value instanceof BooleanValue b)) {
        throw ZmanimException.type(what + " must be a condition, found " + value.typeName());
      }
      return b.value();
    }

    private FailureValue notReached(Call node) {
      return new FailureValue(
          Display.render(node)
              + " is not reached on "
              + ctx.date()
              + " at latitude "
              + ctx.location().latitude());
    }
  }

  // Arithmetic

  private static Value arithmetic(ArithmeticOperator op, Value lhs, Value rhs)
      throws ZmanimException {
    switch (op) {
      case ADD -> {
        if (lhs instanceof TimeValue t && rhs instanceof DurationValue d) {
          return new TimeValue(t.instant().plus(d.duration()));
        }
        if (lhs instanceof DurationValue d && rhs instanceof TimeValue t) {
          return new TimeValue(t.instant().plus(d.duration()));
        }
        if (lhs instanceof DurationValue a && rhs instanceof DurationValue b) {
          return new DurationValue(a.duration().plus(b.duration()));
        }
        if (lhs instanceof NumberValue a && rhs instanceof NumberValue b) {
          return new NumberValue(a.value() + b.value());
        }
        if (lhs instanceof TimeValue && rhs instanceof TimeValue) {
          throw ZmanimException.type("cannot add two times");
        }
      }
      case SUBTRACT -> {
        if (lhs instanceof TimeValue t && rhs instanceof DurationValue d) {
          return new TimeValue(t.instant().minus(d.duration()));
        }
        if (lhs instanceof TimeValue a && rhs instanceof TimeValue b) {
          return new DurationValue(Duration.between(b.instant(), a.instant()));
        }
        if (lhs instanceof DurationValue a && rhs instanceof DurationValue b) {
          return new DurationValue(a.duration().minus(b.duration()));
        }
        if (lhs instanceof NumberValue a && rhs instanceof NumberValue b) {
          return new NumberValue(a.value() - b.value());
        }
      }
      case MULTIPLY -> {
        if (lhs instanceof DurationValue d && rhs instanceof NumberValue n) {
          return new DurationValue(scale(d.duration(), n.value()));
        }
        if (lhs instanceof NumberValue n && rhs instanceof DurationValue d) {
          return new DurationValue(scale(d.duration(), n.value()));
        }
        if (lhs instanceof NumberValue a && rhs instanceof NumberValue b) {
          return new NumberValue(a.value() * b.value());
        }
      }
      case DIVIDE -> {
        if (rhs instanceof NumberValue n && n.value() == 0) {
          throw ZmanimException.type("division by zero");
        }
        if (lhs instanceof DurationValue d && rhs instanceof NumberValue n) {
          return new DurationValue(scale(d.duration(), 1 / n.value()));
        }
        if (lhs instanceof NumberValue a && rhs instanceof NumberValue b) {
          return new NumberValue(a.value() / b.value());
        }
      }
    }
    throw ZmanimException.type(
        "cannot apply '" + op + "' to " + lhs.typeName() + " and " + rhs.typeName());
  }

  private static Duration scale(Duration duration, double factor) throws ZmanimException {
    // toNanos() overflows past about 292 years
    double nanos = (duration.getSeconds() * 1e9 + duration.getNano()) * factor;
    if (Double.isNaN(nanos) || Math.abs(nanos) >= Long.MAX_VALUE) {
      throw ZmanimException.type("duration overflow");
    }
    return Duration.ofNanos(Math.round(nanos));
  }
}
