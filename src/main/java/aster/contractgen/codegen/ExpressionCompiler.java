package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import aster.contractgen.support.ErrorMessages;
import aster.contractgen.support.GenerationException;

/**
 * 表达式渲染：纯结构递归，无副作用。
 *
 * <p>二元运算的子节点仅当其本身是算术或逻辑运算时才加括号；字面量、引用与长度表达式从不加括号。</p>
 */
public final class ExpressionCompiler {
  private ExpressionCompiler() {}

  public static final String CONTAINS_HELPER = "sequenceContains";

  public static String render(Expr expression) {
    if (expression instanceof VarRef v) {
      return ReservedNames.translate(v.name());
    }
    if (expression instanceof MappingRef m) {
      return render(m.map()) + "[" + render(m.key()) + "]";
    }
    if (expression instanceof IntConst i) {
      return Long.toString(i.value());
    }
    if (expression instanceof StringLiteral s) {
      return "\"" + s.value() + "\"";
    }
    if (expression instanceof BoolConst b) {
      return Boolean.toString(b.value());
    }
    if (expression instanceof TimeUnitE t) {
      return t.unit().keyword();
    }
    if (expression instanceof ArithmeticOperation a) {
      return renderArithmetic(a);
    }
    if (expression instanceof LogicalOperation l) {
      if (l.operator() == LogicalOperator.IN) {
        return containsCall(l.right(), l.left());
      }
      if (l.operator() == LogicalOperator.NOT_IN) {
        return "!(" + containsCall(l.right(), l.left()) + ")";
      }
      return renderBinaryLogical(l);
    }
    if (expression instanceof SequenceSize s) {
      return render(s.sequence()) + ".length";
    }
    throw new GenerationException("Unknown expression: " + expression);
  }

  /** 目标语言没有序列成员运算符，统一调用合成的辅助函数。 */
  static String containsCall(Expr sequence, Expr element) {
    return CONTAINS_HELPER + "(" + render(sequence) + ", " + render(element) + ")";
  }

  private static String renderArithmetic(ArithmeticOperation a) {
    String op = switch (a.operator()) {
      case PLUS -> " + ";
      case MINUS -> " - ";
      // 乘以时间单位时使用 Solidity 的时长字面量写法，如 "3 days"
      case MULTIPLY -> a.right() instanceof TimeUnitE ? " " : " * ";
      case DIVIDE -> " / ";
    };
    return operand(a.left()) + op + operand(a.right());
  }

  static String renderBinaryLogical(LogicalOperation l) {
    String op = switch (l.operator()) {
      case LESS_THAN -> " < ";
      case LESS_THAN_OR_EQUAL -> " <= ";
      case EQUAL -> " == ";
      case NOT_EQUAL -> " != ";
      case GREATER_THAN_OR_EQUAL -> " >= ";
      case GREATER_THAN -> " > ";
      case AND -> " && ";
      case OR -> " || ";
      case IN, NOT_IN -> throw new GenerationException(ErrorMessages.membershipInBinaryRenderer(l));
    };
    return operand(l.left()) + op + operand(l.right());
  }

  static boolean isOperation(Expr e) {
    return e instanceof ArithmeticOperation || e instanceof LogicalOperation;
  }

  private static String operand(Expr e) {
    return isOperation(e) ? "(" + render(e) + ")" : render(e);
  }

  /** 赋值目标：变量名不经保留名翻译。 */
  public static String renderAssignable(Assignable target) {
    if (target instanceof VarRef v) {
      return v.name();
    }
    MappingRef m = (MappingRef) target;
    return render(m.map()) + "[" + render(m.key()) + "]";
  }
}
