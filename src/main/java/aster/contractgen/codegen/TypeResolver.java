package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import aster.contractgen.support.ErrorMessages;
import aster.contractgen.support.GenerationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在字段、迁移参数与保留标识符构成的作用域内推导表达式类型。
 *
 * <p>仅用于确定成员判断辅助函数的元素类型；输入已通过上游类型检查，无法解析时视为内部错误。</p>
 */
final class TypeResolver {
  private final Map<String, DataType> scope = new LinkedHashMap<>();

  TypeResolver(List<Variable> fields, List<Variable> parameters) {
    for (Variable f : fields) scope.put(f.name(), f.type());
    // 参数遮蔽同名字段
    for (Variable p : parameters) scope.put(p.name(), p.type());
  }

  DataType typeOf(Expr expression) {
    if (expression instanceof VarRef v) {
      DataType t = scope.get(v.name());
      if (t == null) t = ReservedNames.typeOf(v.name());
      if (t == null) throw new GenerationException(ErrorMessages.unresolvedName(v.name()));
      return t;
    }
    if (expression instanceof MappingRef m) {
      DataType container = typeOf(m.map());
      if (container instanceof MappingT mt) return mt.value();
      if (container instanceof SequenceT st) return st.element();
      throw new GenerationException(ErrorMessages.typeExpected("Mapping", m));
    }
    if (expression instanceof IntConst || expression instanceof SequenceSize) return new IntT();
    if (expression instanceof StringLiteral) return new StringT();
    if (expression instanceof BoolConst || expression instanceof LogicalOperation) return new BoolT();
    if (expression instanceof TimeUnitE) return new TimespanT();
    if (expression instanceof ArithmeticOperation a) {
      DataType left = typeOf(a.left());
      DataType right = typeOf(a.right());
      if (left instanceof TimestampT || right instanceof TimestampT) return new TimestampT();
      if (left instanceof TimespanT || right instanceof TimespanT) return new TimespanT();
      return new IntT();
    }
    throw new GenerationException("Unknown expression: " + expression);
  }

  /** 序列操作数的元素类型。 */
  DataType elementTypeOf(Expr sequence) {
    DataType t = typeOf(sequence);
    if (t instanceof SequenceT s) return s.element();
    throw new GenerationException(ErrorMessages.typeExpected("Sequence", sequence));
  }
}
