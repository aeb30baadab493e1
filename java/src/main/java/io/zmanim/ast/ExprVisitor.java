package io.zmanim.ast;

/**
 * Visitor over every {@link Expr} node type.
 *
 * @param <R> the result type
 * @param <E> the checked exception a visit may throw
 */
public interface ExprVisitor<R, E extends Exception> {
  R visitPrimitive(PrimitiveRef node) throws E;

  R visitNumber(NumberLit node) throws E;

  R visitDuration(DurationLit node) throws E;

  R visitDate(DateLit node) throws E;

  R visitString(StringLit node) throws E;

  R visitBinary(BinaryOp node) throws E;

  R visitCall(Call node) throws E;

  R visitDirection(DirectionArg node) throws E;

  R visitBase(BaseArg node) throws E;

  R visitReference(Reference node) throws E;

  R visitConditional(Conditional node) throws E;

  R visitComparison(Comparison node) throws E;

  R visitLogical(Logical node) throws E;

  R visitConditionVar(ConditionVar node) throws E;
}
