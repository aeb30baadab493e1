package io.zmanim.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Collects the {@code @key} references of an expression, in source order. */
public final class ReferenceCollector implements ExprVisitor<Void, RuntimeException> {
  private final Set<String> keys = new LinkedHashSet<>();

  private ReferenceCollector() {}

  /**
   * Returns the distinct keys an expression references.
   *
   * @param expr the expression
   * @return the referenced keys in order of first appearance
   */
  public static Set<String> references(Expr expr) {
    ReferenceCollector collector = new ReferenceCollector();
    expr.accept(collector);
    return Collections.unmodifiableSet(collector.keys);
  }

  @Override
  public Void visitPrimitive(PrimitiveRef node) {
    return null;
  }

  @Override
  public Void visitNumber(NumberLit node) {
    return null;
  }

  @Override
  public Void visitDuration(DurationLit node) {
    return null;
  }

  @Override
  public Void visitDate(DateLit node) {
    return null;
  }

  @Override
  public Void visitString(StringLit node) {
    return null;
  }

  @Override
  public Void visitBinary(BinaryOp node) {
    node.lhs().accept(this);
    node.rhs().accept(this);
    return null;
  }

  @Override
  public Void visitCall(Call node) {
    for (Expr arg : node.args()) {
      arg.accept(this);
    }
    return null;
  }

  @Override
  public Void visitDirection(DirectionArg node) {
    return null;
  }

  @Override
  public Void visitBase(BaseArg node) {
    if (node.start() != null) {
      node.start().accept(this);
      node.end().accept(this);
    }
    return null;
  }

  @Override
  public Void visitReference(Reference node) {
    keys.add(node.key());
    return null;
  }

  @Override
  public Void visitConditional(Conditional node) {
    for (Conditional.Branch branch : node.branches()) {
      branch.condition().accept(this);
      branch.body().accept(this);
    }
    if (node.otherwise() != null) {
      node.otherwise().accept(this);
    }
    return null;
  }

  @Override
  public Void visitComparison(Comparison node) {
    node.lhs().accept(this);
    node.rhs().accept(this);
    return null;
  }

  @Override
  public Void visitLogical(Logical node) {
    for (Expr operand : node.operands()) {
      operand.accept(this);
    }
    return null;
  }

  @Override
  public Void visitConditionVar(ConditionVar node) {
    return null;
  }
}
