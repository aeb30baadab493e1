package io.zmanim.display;

import io.zmanim.ast.ArithmeticOperator;
import io.zmanim.ast.BaseArg;
import io.zmanim.ast.BinaryOp;
import io.zmanim.ast.Call;
import io.zmanim.ast.Comparison;
import io.zmanim.ast.ConditionVar;
import io.zmanim.ast.Conditional;
import io.zmanim.ast.DateLit;
import io.zmanim.ast.DirectionArg;
import io.zmanim.ast.DurationLit;
import io.zmanim.ast.Expr;
import io.zmanim.ast.ExprVisitor;
import io.zmanim.ast.Logical;
import io.zmanim.ast.LogicalOperator;
import io.zmanim.ast.NumberLit;
import io.zmanim.ast.PrimitiveRef;
import io.zmanim.ast.Reference;
import io.zmanim.ast.StringLit;
import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders expressions as canonical formula text. Aliases are written in their explicit form
 * ({@code sunrise} as {@code visible_sunrise}) and parentheses appear only where precedence needs
 * them, so parsing the output yields an equal tree.
 */
public final class Display {
  private static final int CONDITIONAL = 0;
  private static final int OR = 1;
  private static final int AND = 2;
  private static final int NOT = 3;
  private static final int COMPARISON = 4;
  private static final int ADDITIVE = 5;
  private static final int MULTIPLICATIVE = 6;
  private static final int ATOM = 7;

  private static final Renderer RENDERER = new Renderer();

  private Display() {}

  /**
   * Renders an expression as canonical formula text.
   *
   * @param expr the expression to render
   * @return the canonical text
   */
  public static String render(Expr expr) {
    return render(expr, CONDITIONAL);
  }

  private static String render(Expr expr, int minPrecedence) {
    String text = expr.accept(RENDERER);
    return precedence(expr) < minPrecedence ? "(" + text + ")" : text;
  }

  private static int precedence(Expr expr) {
    if (expr instanceof Conditional) {
      return CONDITIONAL;
    }
    if (expr instanceof Logical) {
      LogicalOperator op = ((Logical) expr).op();
      return op == LogicalOperator.OR ? OR : op == LogicalOperator.AND ? AND : NOT;
    }
    if (expr instanceof Comparison) {
      return COMPARISON;
    }
    if (expr instanceof BinaryOp) {
      ArithmeticOperator op = ((BinaryOp) expr).op();
      return op == ArithmeticOperator.ADD || op == ArithmeticOperator.SUBTRACT
          ? ADDITIVE
          : MULTIPLICATIVE;
    }
    return ATOM;
  }

  /**
   * Formats a number in plain decimal notation without trailing zeros.
   *
   * @param value the number
   * @return the text, e.g. "16.1" or "72"
   */
  public static String formatNumber(double value) {
    if (value == 0) {
      return "0";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static final class Renderer implements ExprVisitor<String, RuntimeException> {
    @Override
    public String visitPrimitive(PrimitiveRef node) {
      return node.primitive().toString();
    }

    @Override
    public String visitNumber(NumberLit node) {
      return formatNumber(node.value());
    }

    @Override
    public String visitDuration(DurationLit node) {
      return formatNumber(node.minutes()) + "min";
    }

    @Override
    public String visitDate(DateLit node) {
      return node.day() + "-" + node.month();
    }

    @Override
    public String visitString(StringLit node) {
      return "\"" + node.value() + "\"";
    }

    @Override
    public String visitBinary(BinaryOp node) {
      int prec = precedence(node);
      return render(node.lhs(), prec) + " " + node.op() + " " + render(node.rhs(), prec + 1);
    }

    @Override
    public String visitCall(Call node) {
      return node.function()
          + "("
          + node.args().stream().map(Display::render).collect(Collectors.joining(", "))
          + ")";
    }

    @Override
    public String visitDirection(DirectionArg node) {
      return node.direction().toString();
    }

    @Override
    public String visitBase(BaseArg node) {
      if (node.start() == null) {
        return node.base().toString();
      }
      return node.base() + "(" + render(node.start()) + ", " + render(node.end()) + ")";
    }

    @Override
    public String visitReference(Reference node) {
      return "@" + node.key();
    }

    @Override
    public String visitConditional(Conditional node) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < node.branches().size(); i++) {
        Conditional.Branch branch = node.branches().get(i);
        if (i > 0) {
          sb.append(" else ");
        }
        sb.append("if (")
            .append(render(branch.condition()))
            .append(") { ")
            .append(render(branch.body()))
            .append(" }");
      }
      if (node.otherwise() != null) {
        sb.append(" else { ").append(render(node.otherwise())).append(" }");
      }
      return sb.toString();
    }

    @Override
    public String visitComparison(Comparison node) {
      return render(node.lhs(), ADDITIVE) + " " + node.op() + " " + render(node.rhs(), ADDITIVE);
    }

    @Override
    public String visitLogical(Logical node) {
      if (node.op() == LogicalOperator.NOT) {
        return "!" + render(node.operands().get(0), ATOM);
      }
      int prec = precedence(node);
      return render(node.operands().get(0), prec)
          + " "
          + node.op()
          + " "
          + render(node.operands().get(1), prec + 1);
    }

    @Override
    public String visitConditionVar(ConditionVar node) {
      return node.variable().toString();
    }
  }
}
