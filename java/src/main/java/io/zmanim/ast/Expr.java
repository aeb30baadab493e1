package io.zmanim.ast;

/**
 * Sealed interface for formula expressions.
 *
 * <p>Time-valued expressions:
 *
 * <ul>
 *   <li>{@link PrimitiveRef} - "visible_sunrise"
 *   <li>{@link Call} - "solar(16.1, before_sunrise)"
 *   <li>{@link Reference} - "@alos_hashachar"
 *   <li>{@link BinaryOp} - "visible_sunset + 40min"
 *   <li>{@link Conditional} - "if (latitude &gt; 50) { ... } else { ... }"
 * </ul>
 *
 * <p>Literals ({@link NumberLit}, {@link DurationLit}, {@link DateLit}, {@link StringLit}),
 * function arguments ({@link DirectionArg}, {@link BaseArg}) and condition nodes ({@link
 * Comparison}, {@link Logical}, {@link ConditionVar}) complete the tree.
 */
public sealed interface Expr
    permits PrimitiveRef,
        NumberLit,
        DurationLit,
        DateLit,
        StringLit,
        BinaryOp,
        Call,
        DirectionArg,
        BaseArg,
        Reference,
        Conditional,
        Comparison,
        Logical,
        ConditionVar {

  /**
   * Dispatches to the visitor method for this node type.
   *
   * @param visitor the visitor
   * @param <R> the result type
   * @param <E> the exception type the visitor may throw
   * @return the visitor's result
   * @throws E if the visitor throws
   */
  <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E;
}
