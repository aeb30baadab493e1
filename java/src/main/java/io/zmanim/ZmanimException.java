package io.zmanim;

import java.util.List;
import java.util.Optional;

/** Exception thrown for errors in formula lexing, parsing, type checking and evaluation. */
public final class ZmanimException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The formula text. */
  private final String input;

  /** An optional suggestion for fixing the error. */
  private final String suggestion;

  /** The keys forming a reference cycle, in dependency order. */
  private final List<String> cyclePath;

  private ZmanimException(
      ErrorKind kind,
      String message,
      Span span,
      String input,
      String suggestion,
      List<String> cyclePath) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.suggestion = suggestion;
    this.cyclePath = cyclePath;
  }

  /**
   * Creates a new lexer error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the formula text
   * @return a new ZmanimException for a lexer error
   */
  public static ZmanimException lex(String message, Span span, String input) {
    return new ZmanimException(ErrorKind.LEX, message, span, input, null, List.of());
  }

  /**
   * Creates a new parser error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the formula text
   * @param suggestion an optional suggestion for fixing the error
   * @return a new ZmanimException for a parser error
   */
  public static ZmanimException parse(
      String message, Span span, String input, String suggestion) {
    return new ZmanimException(ErrorKind.PARSE, message, span, input, suggestion, List.of());
  }

  /**
   * Creates a type error found while checking a parsed formula.
   *
   * @param message the error message
   * @param span the location of the offending call or operator
   * @param input the formula text
   * @param suggestion an optional suggestion for fixing the error
   * @return a new ZmanimException for a type error
   */
  public static ZmanimException type(
      String message, Span span, String input, String suggestion) {
    return new ZmanimException(ErrorKind.TYPE, message, span, input, suggestion, List.of());
  }

  /**
   * Creates a type error found during evaluation, where no source position is known.
   *
   * @param message the error message
   * @return a new ZmanimException for a type error
   */
  public static ZmanimException type(String message) {
    return new ZmanimException(ErrorKind.TYPE, message, null, null, null, List.of());
  }

  /**
   * Creates a new reference error.
   *
   * @param key the unresolved formula key
   * @return a new ZmanimException for a reference error
   */
  public static ZmanimException reference(String key) {
    return new ZmanimException(
        ErrorKind.REFERENCE, "undefined reference: @" + key, null, null, null, List.of());
  }

  /**
   * Creates a reference error with a position and a suggestion, as reported by validation.
   *
   * @param message the error message
   * @param span the location of the reference
   * @param input the formula text
   * @param suggestion an optional suggestion for fixing the error
   * @return a new ZmanimException for a reference error
   */
  public static ZmanimException reference(
      String message, Span span, String input, String suggestion) {
    return new ZmanimException(ErrorKind.REFERENCE, message, span, input, suggestion, List.of());
  }

  /**
   * Creates a circular reference error.
   *
   * @param cyclePath the keys forming the cycle, each depending on the next
   * @return a new ZmanimException for a circular reference
   */
  public static ZmanimException circular(List<String> cyclePath) {
    String chain = String.join(" -> ", cyclePath);
    if (!cyclePath.isEmpty()) {
      chain = chain + " -> " + cyclePath.get(0);
    }
    return new ZmanimException(
        ErrorKind.CIRCULAR_REFERENCE,
        "circular reference: " + chain,
        null,
        null,
        null,
        List.copyOf(cyclePath));
  }

  /**
   * Creates a new evaluation error, used when a failure reaches the top of a formula.
   *
   * @param message the error message
   * @return a new ZmanimException for an evaluation error
   */
  public static ZmanimException eval(String message) {
    return new ZmanimException(ErrorKind.EVAL, message, null, null, null, List.of());
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the formula text, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Returns the keys of the reference cycle for {@link ErrorKind#CIRCULAR_REFERENCE} errors.
   *
   * @return the cycle path, empty for every other kind
   */
  public List<String> cyclePath() {
    return cyclePath;
  }

  /**
   * Formats a rich error message with underline and optional suggestion.
   *
   * <p>For errors with span and input, produces output like:
   *
   * <pre>
   * error: cannot add two times (1:17)
   *   visible_sunrise + visible_sunset
   *                   ^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span == null || input == null) {
      return "error: " + getMessage();
    }

    // Only the line holding the span is echoed.
    int[] lc = span.lineColumn(input);
    int offset = Math.min(span.start(), input.length());
    int lineStart = input.lastIndexOf('\n', Math.max(0, offset - 1)) + 1;
    int lineEnd = input.indexOf('\n', lineStart);
    String line = lineEnd < 0 ? input.substring(lineStart) : input.substring(lineStart, lineEnd);

    StringBuilder sb = new StringBuilder();
    sb.append("error: ")
        .append(getMessage())
        .append(" (")
        .append(lc[0])
        .append(':')
        .append(lc[1])
        .append(")\n");
    sb.append("  ").append(line).append("\n");
    sb.append(" ".repeat(lc[1] - 1 + 2));
    sb.append("^".repeat(span.length()));

    if (suggestion != null && !suggestion.isEmpty()) {
      sb.append(" try: \"").append(suggestion).append("\"");
    }

    return sb.toString();
  }
}
