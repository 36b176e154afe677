package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import aster.contractgen.support.GenerationException;

/**
 * 将抽象数据类型降级为 Solidity 类型文本。
 *
 * <p>{@code payable} 只影响 Identity 叶子，并沿映射值类型与序列元素类型向下传递；映射键始终按非 payable 输出。</p>
 */
public final class TypeLowering {
  private TypeLowering() {}

  public static String lower(DataType type, boolean payable) {
    if (type instanceof IdentityT) return payable ? "address payable" : "address";
    if (type instanceof IntT) return "int";
    if (type instanceof StringT) return "bytes32";
    if (type instanceof TimestampT) return "uint";
    if (type instanceof BoolT) return "bool";
    if (type instanceof TimespanT) return "uint";
    if (type instanceof MappingT m) {
      return "mapping(" + lower(m.key(), false) + " => " + lower(m.value(), payable) + ")";
    }
    if (type instanceof SequenceT s) {
      return lower(s.element(), payable) + "[]";
    }
    throw new GenerationException("Unknown data type: " + type);
  }

  public static String lower(DataType type) {
    return lower(type, false);
  }
}
