package io.zmanim.parser;

import io.zmanim.Span;
import io.zmanim.ZmanimException;
import io.zmanim.ast.ArithmeticOperator;
import io.zmanim.ast.Base;
import io.zmanim.ast.BaseArg;
import io.zmanim.ast.BinaryOp;
import io.zmanim.ast.Call;
import io.zmanim.ast.Comparison;
import io.zmanim.ast.ComparisonOperator;
import io.zmanim.ast.ConditionVar;
import io.zmanim.ast.ConditionVariable;
import io.zmanim.ast.Conditional;
import io.zmanim.ast.DateLit;
import io.zmanim.ast.Direction;
import io.zmanim.ast.DirectionArg;
import io.zmanim.ast.DurationLit;
import io.zmanim.ast.Expr;
import io.zmanim.ast.FunctionName;
import io.zmanim.ast.Logical;
import io.zmanim.ast.LogicalOperator;
import io.zmanim.ast.MonthName;
import io.zmanim.ast.NumberLit;
import io.zmanim.ast.Primitive;
import io.zmanim.ast.PrimitiveRef;
import io.zmanim.ast.Reference;
import io.zmanim.ast.StringLit;
import io.zmanim.lexer.Lexer;
import io.zmanim.lexer.Token;
import io.zmanim.lexer.TokenKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Recursive descent parser for zmanim formulas.
 *
 * <p>Precedence, loosest first: {@code ||}, {@code &&}, {@code !}, comparison, {@code + -},
 * {@code * /}, unary minus. Literal arguments and operand types are checked while the tree is
 * built, so a formula that parses never adds two times or asks for 95 degrees.
 */
public final class Parser {
  private static final Pattern DURATION_PART =
      Pattern.compile("(\\d+(?:\\.\\d+)?|\\.\\d+)(min|hr|h)");

  private static final Map<TokenKind, ComparisonOperator> COMPARISONS =
      Map.of(
          TokenKind.GT, ComparisonOperator.GT,
          TokenKind.LT, ComparisonOperator.LT,
          TokenKind.GE, ComparisonOperator.GE,
          TokenKind.LE, ComparisonOperator.LE,
          TokenKind.EQ, ComparisonOperator.EQ,
          TokenKind.NE, ComparisonOperator.NE);

  private static final List<String> FUNCTION_NAMES =
      Arrays.stream(FunctionName.values()).map(FunctionName::toString).collect(Collectors.toList());

  private static final List<String> IDENTIFIER_NAMES =
      Stream.of(
              Arrays.stream(Primitive.values()).map(Primitive::toString),
              Stream.of("sunrise", "sunset", "before_sunrise", "after_sunrise", "after_sunset"),
              Arrays.stream(Direction.values()).map(Direction::toString),
              Arrays.stream(Base.values()).map(Base::toString),
              Arrays.stream(ConditionVariable.values()).map(ConditionVariable::toString))
          .flatMap(s -> s)
          .collect(Collectors.toList());

  /** An expression with the source span it came from and its static type. */
  private record Parsed(Expr expr, Span span, StaticType type) {}

  private record Arguments(List<Parsed> items, Span span) {}

  private final String input;
  private final List<Token> tokens;
  private int pos;

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses and checks a formula.
   *
   * @param input the formula text
   * @return the expression tree
   * @throws ZmanimException on lexical, grammatical or static type errors
   */
  public static Expr parse(String input) throws ZmanimException {
    if (input == null || input.trim().isEmpty()) {
      throw ZmanimException.parse("empty formula", new Span(0, 0), input, null);
    }

    List<Token> tokens = Lexer.tokenize(input);
    if (tokens.isEmpty()) {
      throw ZmanimException.parse("empty formula", new Span(0, input.length()), input, null);
    }

    return new Parser(input, tokens).parseFormula();
  }

  private Expr parseFormula() throws ZmanimException {
    Parsed body = check(TokenKind.IF) ? parseConditional(true) : parseOr();

    Token extra = peek();
    if (extra != null) {
      throw parseError("unexpected token '" + extra.lexeme() + "'", extra.span());
    }
    if (body.type() != StaticType.TIME) {
      throw typeError("formula must produce a time, found " + body.type(), body.span());
    }
    // A parenthesised conditional is still the whole formula.
    if (body.expr() instanceof Conditional && ((Conditional) body.expr()).otherwise() == null) {
      throw ZmanimException.parse(
          "if expression must end with an else branch",
          Span.at(body.span().end()),
          input,
          "else { ... }");
    }
    return body.expr();
  }

  // Conditions

  private Parsed parseOr() throws ZmanimException {
    Parsed left = parseAnd();
    while (check(TokenKind.OR)) {
      Token op = advance();
      Parsed right = parseAnd();
      left = logical(LogicalOperator.OR, op, left, right);
    }
    return left;
  }

  private Parsed parseAnd() throws ZmanimException {
    Parsed left = parseNot();
    while (check(TokenKind.AND)) {
      Token op = advance();
      Parsed right = parseNot();
      left = logical(LogicalOperator.AND, op, left, right);
    }
    return left;
  }

  private Parsed parseNot() throws ZmanimException {
    if (check(TokenKind.NOT)) {
      Token op = advance();
      Parsed operand = parseNot();
      requireBoolean(operand, "operand of '!'");
      return new Parsed(
          new Logical(LogicalOperator.NOT, List.of(operand.expr())),
          op.span().to(operand.span()),
          StaticType.BOOLEAN);
    }
    return parseComparison();
  }

  private Parsed logical(LogicalOperator op, Token opToken, Parsed left, Parsed right)
      throws ZmanimException {
    requireBoolean(left, "left side of '" + opToken.lexeme() + "'");
    requireBoolean(right, "right side of '" + opToken.lexeme() + "'");
    return new Parsed(
        new Logical(op, List.of(left.expr(), right.expr())),
        left.span().to(right.span()),
        StaticType.BOOLEAN);
  }

  private Parsed parseComparison() throws ZmanimException {
    Parsed left = parseAdditive();
    Token tok = peek();
    if (tok == null || !COMPARISONS.containsKey(tok.kind())) {
      return left;
    }
    pos++;
    ComparisonOperator op = COMPARISONS.get(tok.kind());
    Parsed right = parseAdditive();
    if (!StaticType.comparable(op, left.type(), right.type())) {
      String message =
          left.type() == StaticType.TEXT && right.type() == StaticType.TEXT
              ? "text values can only be compared with == and !="
              : "cannot compare " + left.type() + " with " + right.type();
      throw typeError(message, tok.span());
    }
    return new Parsed(
        new Comparison(op, left.expr(), right.expr()),
        left.span().to(right.span()),
        StaticType.BOOLEAN);
  }

  // Arithmetic

  private Parsed parseAdditive() throws ZmanimException {
    Parsed left = parseMultiplicative();
    while (check(TokenKind.PLUS) || check(TokenKind.MINUS)) {
      Token op = advance();
      Parsed right = parseMultiplicative();
      ArithmeticOperator operator =
          op.kind() == TokenKind.PLUS ? ArithmeticOperator.ADD : ArithmeticOperator.SUBTRACT;
      left = arithmetic(operator, op, left, right);
    }
    return left;
  }

  private Parsed parseMultiplicative() throws ZmanimException {
    Parsed left = parseUnary();
    while (check(TokenKind.STAR) || check(TokenKind.SLASH)) {
      Token op = advance();
      Parsed right = parseUnary();
      ArithmeticOperator operator =
          op.kind() == TokenKind.STAR ? ArithmeticOperator.MULTIPLY : ArithmeticOperator.DIVIDE;
      left = arithmetic(operator, op, left, right);
    }
    return left;
  }

  private Parsed arithmetic(ArithmeticOperator op, Token opToken, Parsed left, Parsed right)
      throws ZmanimException {
    Optional<StaticType> result = StaticType.arithmetic(op, left.type(), right.type());
    if (result.isEmpty()) {
      if (op == ArithmeticOperator.ADD
          && left.type() == StaticType.TIME
          && right.type() == StaticType.TIME) {
        throw ZmanimException.type(
            "cannot add two times", opToken.span(), input, "midpoint(a, b)");
      }
      throw typeError(
          "cannot apply '" + op + "' to " + left.type() + " and " + right.type(), opToken.span());
    }
    if (op == ArithmeticOperator.DIVIDE
        && right.expr() instanceof NumberLit
        && ((NumberLit) right.expr()).value() == 0) {
      throw typeError("division by zero", right.span());
    }
    return new Parsed(
        new BinaryOp(op, left.expr(), right.expr()), left.span().to(right.span()), result.get());
  }

  private Parsed parseUnary() throws ZmanimException {
    if (!check(TokenKind.MINUS)) {
      return parsePrimary();
    }
    Token minus = advance();
    Parsed operand = parseUnary();
    Span span = minus.span().to(operand.span());
    if (operand.expr() instanceof NumberLit) {
      double value = ((NumberLit) operand.expr()).value();
      return new Parsed(new NumberLit(0.0 - value), span, StaticType.NUMBER);
    }
    if (operand.expr() instanceof DurationLit) {
      double minutes = ((DurationLit) operand.expr()).minutes();
      return new Parsed(new DurationLit(0.0 - minutes), span, StaticType.DURATION);
    }
    throw parseError("unary minus can only be applied to numbers and durations", minus.span());
  }

  // Primaries

  private Parsed parsePrimary() throws ZmanimException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("unexpected end of formula", endSpan());
    }

    switch (tok.kind()) {
      case NUMBER -> {
        pos++;
        return new Parsed(new NumberLit(tok.numberVal()), tok.span(), StaticType.NUMBER);
      }
      case DURATION -> {
        pos++;
        return new Parsed(new DurationLit(decodeDuration(tok)), tok.span(), StaticType.DURATION);
      }
      case DATE -> {
        pos++;
        return new Parsed(decodeDate(tok), tok.span(), StaticType.NUMBER);
      }
      case STRING -> {
        pos++;
        return new Parsed(new StringLit(tok.lexeme()), tok.span(), StaticType.TEXT);
      }
      case REFERENCE -> {
        pos++;
        return new Parsed(new Reference(tok.lexeme()), tok.span(), StaticType.TIME);
      }
      case LPAREN -> {
        pos++;
        Parsed inner = parseOr();
        Token close = expect(TokenKind.RPAREN, "')'");
        return new Parsed(inner.expr(), tok.span().to(close.span()), inner.type());
      }
      case IF -> {
        return parseConditional(false);
      }
      case IDENT -> {
        return parseIdentifier(tok);
      }
      default -> throw parseError("unexpected token '" + tok.lexeme() + "'", tok.span());
    }
  }

  private Parsed parseIdentifier(Token tok) throws ZmanimException {
    String name = tok.lexeme();
    pos++;

    if (check(TokenKind.LPAREN)) {
      if (name.equals(Base.CUSTOM.toString())) {
        return parseCustomBase(tok);
      }
      Optional<FunctionName> fn = FunctionName.parse(name);
      if (fn.isEmpty()) {
        throw ZmanimException.parse(
            "unknown function '" + name + "'", tok.span(), input, suggest(name, FUNCTION_NAMES));
      }
      return parseCall(fn.get(), tok);
    }

    Optional<Primitive> primitive = Primitive.parse(name);
    if (primitive.isPresent()) {
      return new Parsed(new PrimitiveRef(primitive.get()), tok.span(), StaticType.TIME);
    }
    Optional<Direction> direction = Direction.parse(name);
    if (direction.isPresent()) {
      return new Parsed(new DirectionArg(direction.get()), tok.span(), StaticType.DIRECTION);
    }
    Optional<Base> base = Base.parse(name);
    if (base.isPresent()) {
      if (base.get() == Base.CUSTOM) {
        throw parseError("expected '(' after 'custom'", endSpan(tok));
      }
      return new Parsed(BaseArg.of(base.get()), tok.span(), StaticType.BASE);
    }
    Optional<ConditionVariable> variable = ConditionVariable.parse(name);
    if (variable.isPresent()) {
      return new Parsed(
          new ConditionVar(variable.get()), tok.span(), StaticType.of(variable.get()));
    }
    if (FunctionName.parse(name).isPresent()) {
      throw parseError("expected '(' after function name '" + name + "'", endSpan(tok));
    }
    throw ZmanimException.parse(
        "unknown identifier '" + name + "'", tok.span(), input, suggest(name, IDENTIFIER_NAMES));
  }

  private Parsed parseCall(FunctionName fn, Token nameToken) throws ZmanimException {
    Arguments args = parseArguments();
    Span span = nameToken.span().to(args.span());
    int count = args.items().size();
    if (!fn.accepts(count)) {
      String expected = fn.isVariadic() ? "at least " + fn.arity() : String.valueOf(fn.arity());
      throw parseError(
          fn + "() expects " + expected + " arguments, got " + count, span);
    }

    checkCallArguments(fn, args.items());

    List<Expr> exprs = new ArrayList<>();
    for (Parsed arg : args.items()) {
      exprs.add(arg.expr());
    }
    return new Parsed(new Call(fn, exprs), span, StaticType.TIME);
  }

  private void checkCallArguments(FunctionName fn, List<Parsed> args) throws ZmanimException {
    switch (fn) {
      case SOLAR, SEASONAL_SOLAR, PROPORTIONAL_MINUTES -> {
        checkNumberArgument(fn, args.get(0));
        Parsed dir = args.get(1);
        requireType(dir, StaticType.DIRECTION, fn + "() second argument");
        Optional<String> error =
            ArgumentRules.checkDirection(fn, ((DirectionArg) dir.expr()).direction());
        if (error.isPresent()) {
          throw ZmanimException.type(
              error.get(), dir.span(), input, "before_visible_sunrise or after_visible_sunset");
        }
      }
      case PROPORTIONAL_HOURS -> {
        checkNumberArgument(fn, args.get(0));
        requireType(args.get(1), StaticType.BASE, fn + "() second argument");
      }
      case MIDPOINT, EARLIER_OF, LATER_OF, FIRST_VALID -> {
        for (Parsed arg : args) {
          requireType(arg, StaticType.TIME, fn + "() argument");
        }
      }
    }
  }

  private void checkNumberArgument(FunctionName fn, Parsed arg) throws ZmanimException {
    requireType(arg, StaticType.NUMBER, fn + "() first argument");
    if (arg.expr() instanceof NumberLit) {
      Optional<String> error = ArgumentRules.checkNumber(fn, ((NumberLit) arg.expr()).value());
      if (error.isPresent()) {
        throw typeError(error.get(), arg.span());
      }
    }
  }

  private Parsed parseCustomBase(Token nameToken) throws ZmanimException {
    Arguments args = parseArguments();
    Span span = nameToken.span().to(args.span());
    if (args.items().size() != 2) {
      throw parseError(
          "custom() expects 2 arguments (start, end), got " + args.items().size(), span);
    }
    Parsed start = args.items().get(0);
    Parsed end = args.items().get(1);
    requireType(start, StaticType.TIME, "custom() start");
    requireType(end, StaticType.TIME, "custom() end");
    return new Parsed(new BaseArg(Base.CUSTOM, start.expr(), end.expr()), span, StaticType.BASE);
  }

  private Arguments parseArguments() throws ZmanimException {
    Token open = expect(TokenKind.LPAREN, "'('");
    List<Parsed> items = new ArrayList<>();
    if (!check(TokenKind.RPAREN)) {
      items.add(parseOr());
      while (check(TokenKind.COMMA)) {
        pos++;
        items.add(parseOr());
      }
    }
    Token close = expect(TokenKind.RPAREN, "',' or ')'");
    return new Arguments(items, open.span().to(close.span()));
  }

  private Parsed parseConditional(boolean requireElse) throws ZmanimException {
    Token ifToken = expect(TokenKind.IF, "'if'");
    List<Conditional.Branch> branches = new ArrayList<>();
    Expr otherwise = null;
    StaticType type = null;
    Span last;

    while (true) {
      expect(TokenKind.LPAREN, "'(' after 'if'");
      Parsed condition = parseOr();
      expect(TokenKind.RPAREN, "')'");
      requireBoolean(condition, "if condition");

      expect(TokenKind.LBRACE, "'{'");
      Parsed body = parseOr();
      last = expect(TokenKind.RBRACE, "'}'").span();
      type = unify(type, body);
      branches.add(new Conditional.Branch(condition.expr(), body.expr()));

      if (!check(TokenKind.ELSE)) {
        break;
      }
      pos++;
      if (check(TokenKind.IF)) {
        pos++;
        continue;
      }

      expect(TokenKind.LBRACE, "'{' or 'if' after 'else'");
      Parsed other = parseOr();
      last = expect(TokenKind.RBRACE, "'}'").span();
      type = unify(type, other);
      otherwise = other.expr();
      break;
    }

    if (otherwise == null && requireElse) {
      throw ZmanimException.parse(
          "if expression must end with an else branch",
          Span.at(last.end()),
          input,
          "else { ... }");
    }
    return new Parsed(new Conditional(branches, otherwise), ifToken.span().to(last), type);
  }

  private StaticType unify(StaticType current, Parsed branch) throws ZmanimException {
    if (branch.type() == StaticType.BOOLEAN
        || branch.type() == StaticType.DIRECTION
        || branch.type() == StaticType.BASE) {
      throw typeError("branch must produce a value, found " + branch.type(), branch.span());
    }
    if (current != null && current != branch.type()) {
      throw typeError(
          "all branches must produce the same type: expected "
              + current
              + ", found "
              + branch.type(),
          branch.span());
    }
    return branch.type();
  }

  // Literals

  private double decodeDuration(Token tok) throws ZmanimException {
    double minutes = 0;
    for (String part : tok.lexeme().trim().split("\\s+")) {
      Matcher m = DURATION_PART.matcher(part);
      int at = 0;
      while (at < part.length()) {
        m.region(at, part.length());
        if (!m.lookingAt()) {
          throw parseError("malformed duration '" + tok.lexeme() + "'", tok.span());
        }
        double amount = Double.parseDouble(m.group(1));
        minutes += m.group(2).equals("min") ? amount : amount * 60;
        at = m.end();
      }
    }
    if (minutes > DurationLit.MAX_MINUTES) {
      throw parseError(
          "malformed duration '" + tok.lexeme() + "': longer than "
              + ArgumentRules.format(Math.floor(DurationLit.MAX_MINUTES)) + "min",
          tok.span());
    }
    return minutes;
  }

  private DateLit decodeDate(Token tok) throws ZmanimException {
    String[] parts = tok.lexeme().split("-");
    int day = Integer.parseInt(parts[0]);
    MonthName month =
        MonthName.fromAbbreviation(parts[1])
            .orElseThrow(() -> parseError("invalid month in '" + tok.lexeme() + "'", tok.span()));
    if (day < 1 || day > month.toMonth().maxLength()) {
      throw parseError("invalid date literal '" + tok.lexeme() + "'", tok.span());
    }
    return new DateLit(day, month);
  }

  // Helper methods

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private boolean check(TokenKind kind) {
    Token tok = peek();
    return tok != null && tok.kind() == kind;
  }

  private Token advance() {
    return tokens.get(pos++);
  }

  private Token expect(TokenKind kind, String description) throws ZmanimException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected " + description + " but reached end of formula", endSpan());
    }
    if (tok.kind() != kind) {
      throw parseError("expected " + description + " but got '" + tok.lexeme() + "'", tok.span());
    }
    pos++;
    return tok;
  }

  private void requireType(Parsed arg, StaticType expected, String what)
      throws ZmanimException {
    if (arg.type() != expected) {
      throw typeError(what + " must be a " + expected + ", found " + arg.type(), arg.span());
    }
  }

  private void requireBoolean(Parsed arg, String what) throws ZmanimException {
    if (arg.type() != StaticType.BOOLEAN) {
      throw typeError(what + " must be a condition, found " + arg.type(), arg.span());
    }
  }

  private Span endSpan() {
    if (tokens.isEmpty()) {
      return new Span(0, 0);
    }
    return endSpan(tokens.get(tokens.size() - 1));
  }

  private static Span endSpan(Token tok) {
    return Span.at(tok.span().end());
  }

  private ZmanimException parseError(String message, Span span) {
    return ZmanimException.parse(message, span, input, null);
  }

  private ZmanimException typeError(String message, Span span) {
    return ZmanimException.type(message, span, input, null);
  }

  /**
   * Returns the candidate closest to a misspelled name.
   *
   * @param name the name as written
   * @param candidates the known names
   * @return the closest candidate within two edits, or null if none is that close
   */
  public static String suggest(String name, Collection<String> candidates) {
    String best = null;
    int bestDistance = 3;
    for (String candidate : candidates) {
      int d = editDistance(name, candidate);
      if (d < bestDistance) {
        bestDistance = d;
        best = candidate;
      }
    }
    return best;
  }

  private static int editDistance(String a, String b) {
    int[] prev = new int[b.length() + 1];
    int[] cur = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      cur[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = cur;
      cur = tmp;
    }
    return prev[b.length()];
  }
}
