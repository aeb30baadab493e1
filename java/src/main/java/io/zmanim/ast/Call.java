package io.zmanim.ast;

import java.util.List;

/**
 * A call to a built-in function.
 *
 * @param function the function
 * @param args the arguments
 */
public record Call(FunctionName function, List<Expr> args) implements Expr {
  public Call {
    args = List.copyOf(args);
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitCall(this);
  }
}
