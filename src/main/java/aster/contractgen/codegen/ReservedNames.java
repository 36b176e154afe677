package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 前端 DSL 保留标识符到 Solidity 表达式的固定映射。
 *
 * <p>该表是 DSL 词汇与生成器之间的契约，修改会导致生成代码无法编译或语义错误。</p>
 */
public final class ReservedNames {
  private ReservedNames() {}

  public static final String SENDER = "sender";
  public static final String TOKENS = "tokens";

  private static final Map<String, String> TRANSLATIONS;
  private static final Map<String, DataType> TYPES;

  static {
    Map<String, String> t = new LinkedHashMap<>();
    t.put("balance", "balance");
    t.put("now", "now");
    t.put(SENDER, "msg.sender");
    t.put(TOKENS, "int(msg.value)");
    TRANSLATIONS = Map.copyOf(t);

    Map<String, DataType> ty = new LinkedHashMap<>();
    ty.put("balance", new IntT());
    ty.put("now", new TimestampT());
    ty.put(SENDER, new IdentityT());
    ty.put(TOKENS, new IntT());
    TYPES = Map.copyOf(ty);
  }

  /** 以参数形式出现在 DSL 中、但在 Solidity 中为内建值的名称。 */
  public static final Set<String> BUILTIN_PARAMS = Set.of(TOKENS);

  /** 保留名返回对应表达式，其余名称原样返回。 */
  public static String translate(String name) {
    return TRANSLATIONS.getOrDefault(name, name);
  }

  public static String sender() {
    return TRANSLATIONS.get(SENDER);
  }

  /** 保留名的数据类型；非保留名返回 null。 */
  public static DataType typeOf(String name) {
    return TYPES.get(name);
  }
}
