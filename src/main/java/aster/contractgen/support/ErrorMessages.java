package aster.contractgen.support;

/**
 * 错误消息统一生成工具。
 *
 * <p>生成器的内部不变量被破坏时，需要给出能定位到具体节点的诊断信息。所有消息均提供中英文双语描述，
 * 英文部分保持稳定关键字，测试按英文关键字断言。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * 自动迁移缺少守卫条件。
   *
   * @param transition 迁移名称
   * @return 诊断消息
   */
  public static String autoTransitionMissingGuard(String transition) {
    String english = "auto transition has no guard: " + transition;
    String message = bilingual("自动迁移缺少守卫条件：" + transition, english);
    return withHint(message, "检查上游校验器是否强制自动迁移携带守卫", "Upstream validation must require a guard on auto transitions");
  }

  /**
   * 自动迁移缺少源状态。
   */
  public static String autoTransitionMissingOrigin(String transition) {
    String english = "auto transition has no origin: " + transition;
    String message = bilingual("自动迁移缺少源状态：" + transition, english);
    return withHint(message, "初始迁移不能标记为自动", "The initial transition cannot be marked auto");
  }

  /**
   * 存在多个没有源状态的迁移。
   *
   * @param first 第一个初始迁移
   * @param second 第二个初始迁移
   * @return 诊断消息
   */
  public static String multipleInitialTransitions(String first, String second) {
    String english = "more than one transition without origin: " + first + ", " + second;
    String message = bilingual("存在多个缺少源状态的迁移：" + first + "，" + second, english);
    return withHint(message, "只有初始迁移可以省略源状态", "Only the initial transition may omit its origin");
  }

  /**
   * 迁移引用了未声明的状态。
   */
  public static String undeclaredState(String transition, String state) {
    String english = "transition " + transition + " references undeclared state " + state;
    return bilingual("迁移 " + transition + " 引用了未声明的状态 " + state, english);
  }

  /**
   * 成员判断运算符进入了通用二元逻辑运算渲染分支。
   *
   * @param node 出错的表达式节点
   * @return 诊断消息
   */
  public static String membershipInBinaryRenderer(Object node) {
    String english = "membership operator reached generic binary renderer: " + node;
    return bilingual("成员判断运算符不应进入通用二元运算渲染：" + node, english);
  }

  /**
   * 表达式中引用的名称无法解析。
   */
  public static String unresolvedName(String name) {
    String english = "cannot resolve name: " + name;
    String message = bilingual("无法解析名称：" + name, english);
    return withHint(message, "确认该名称为字段、参数或保留标识符", "Ensure the name is a field, a parameter or a reserved identifier");
  }

  /**
   * 操作数类型与期望不符。
   *
   * @param expected 期望类型描述
   * @param node 出错的表达式节点
   * @return 诊断消息
   */
  public static String typeExpected(String expected, Object node) {
    String english = "expected " + expected + " operand: " + node;
    return bilingual("操作数应为 " + expected + "：" + node, english);
  }
}
