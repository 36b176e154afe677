package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 授权子句编译：审批记录字段、记录调用者审批的语句、以及守卫整个迁移体的布尔检查。
 *
 * <p>带参数的迁移按参数元组哈希隔离审批状态，参数不同的调用互不共享审批。
 * 审批记录字段名为 {@code __<迁移名>_<引用名>Approved}。</p>
 */
public final class AuthorizationCompiler {
  private AuthorizationCompiler() {}

  public static final String ALL_APPROVED_HELPER = "allApproved";

  // ============================================================
  // 审批记录字段
  // ============================================================

  /**
   * 需要持久化审批记录的叶子项：单个 all-of 项，或组合子句的全部叶子。
   * 单个身份项与单个 any-of 项直接比较调用者，无需记录。
   */
  public static List<AuthTerm> bookkeepingTerms(Transition transition) {
    if (transition.authorized() == null) {
      return List.of();
    }
    Set<AuthTerm> terms = transition.authorized().flatten();
    if (terms.size() == 1) {
      AuthTerm only = terms.iterator().next();
      return only instanceof AuthAll ? List.of(only) : List.of();
    }
    return List.copyOf(terms);
  }

  public static String approvalFieldName(Transition transition, AuthTerm term) {
    // 只有非初始迁移可以带授权，校验器保证其存在源状态
    return "__" + transition.name() + "_" + term.referencedName() + "Approved";
  }

  public static String approvalFieldType(Transition transition, AuthTerm term) {
    boolean perIdentity = term instanceof AuthAll;
    if (!UsageAnalysis.isParameterized(transition)) {
      return perIdentity ? "mapping(address => bool)" : "bool";
    }
    return perIdentity ? "mapping(bytes32 => mapping(address => bool))" : "mapping(bytes32 => bool)";
  }

  /** 按迁移、再按叶子项的顺序声明审批记录字段。 */
  public static void writeFields(SourceWriter out, StateMachine machine) {
    for (Transition t : machine.transitions()) {
      for (AuthTerm term : bookkeepingTerms(t)) {
        out.line(approvalFieldType(t, term) + " private " + approvalFieldName(t, term) + ";");
      }
    }
  }

  /** 对参数元组做哈希，作为审批记录的作用域键。 */
  public static String paramHash(Transition transition) {
    String args = UsageAnalysis.effectiveParameters(transition).stream()
        .map(Variable::name)
        .collect(Collectors.joining(", "));
    return "keccak256(abi.encodePacked(" + args + "))";
  }

  /** 当前调用者在该叶子项下的审批记录位置（可赋值）。 */
  public static String approvalRef(Transition transition, AuthTerm term) {
    String ref = approvalScope(transition, term);
    return term instanceof AuthAll ? ref + "[" + ReservedNames.sender() + "]" : ref;
  }

  // 去掉调用者下标的部分，all-of 项以此遍历全部成员
  private static String approvalScope(Transition transition, AuthTerm term) {
    String name = approvalFieldName(transition, term);
    return UsageAnalysis.isParameterized(transition) ? name + "[" + paramHash(transition) + "]" : name;
  }

  // ============================================================
  // 授权检查
  // ============================================================

  /**
   * 输出授权检查。未通过时提前 return，迁移体不执行，状态不变。
   */
  public static void writeCheck(SourceWriter out, Transition transition) {
    AuthExpr clause = transition.authorized();
    if (clause == null) {
      return;
    }
    Set<AuthTerm> terms = clause.flatten();
    String sender = ReservedNames.sender();
    if (terms.size() == 1) {
      AuthTerm term = terms.iterator().next();
      if (term instanceof IdentityLiteral id) {
        out.open("if (" + sender + " != " + ReservedNames.translate(id.identity()) + ") {");
      } else if (term instanceof AuthAny any) {
        out.open("if (!" + ExpressionCompiler.CONTAINS_HELPER + "(" + any.collectionName() + ", " + sender + ")) {");
      } else {
        AuthAll all = (AuthAll) term;
        // 审批跨调用累积，直到迁移真正触发
        out.line(approvalRef(transition, all) + " = true;");
        out.open("if (!" + allApprovedCall(transition, all) + ") {");
      }
      out.line("return;");
      out.close();
      return;
    }

    for (AuthTerm term : terms) {
      out.open("if (" + membershipTest(term) + ") {");
      out.line(approvalRef(transition, term) + " = true;");
      out.close();
    }
    out.open("if (!(" + renderClause(transition, clause, 0) + ")) {");
    out.line("return;");
    out.close();
  }

  private static String membershipTest(AuthTerm term) {
    String sender = ReservedNames.sender();
    if (term instanceof IdentityLiteral id) {
      return sender + " == " + ReservedNames.translate(id.identity());
    }
    return ExpressionCompiler.CONTAINS_HELPER + "(" + term.referencedName() + ", " + sender + ")";
  }

  private static String allApprovedCall(Transition transition, AuthAll term) {
    String field = approvalFieldName(transition, term);
    if (UsageAnalysis.isParameterized(transition)) {
      return ALL_APPROVED_HELPER + "(" + term.collectionName() + ", " + field + ", " + paramHash(transition) + ")";
    }
    return ALL_APPROVED_HELPER + "(" + term.collectionName() + ", " + field + ")";
  }

  /**
   * 将授权表达式渲染为对审批记录的布尔判断，嵌套的组合子句加括号。
   */
  static String renderClause(Transition transition, AuthExpr expr, int depth) {
    if (expr instanceof AuthAll all) {
      return allApprovedCall(transition, all);
    }
    if (expr instanceof AuthTerm term) {
      return approvalRef(transition, term);
    }
    AuthCombination c = (AuthCombination) expr;
    String op = c.operator() == AuthOperator.AND ? " && " : " || ";
    String text = renderClause(transition, c.left(), depth + 1) + op + renderClause(transition, c.right(), depth + 1);
    return depth > 0 ? "(" + text + ")" : text;
  }

  // ============================================================
  // 自环迁移的审批重置
  // ============================================================

  /**
   * 自环迁移成功执行后清空审批记录，否则旧审批会在下一轮直接满足条件。
   */
  public static void writeReset(SourceWriter out, Transition transition) {
    for (AuthTerm term : bookkeepingTerms(transition)) {
      if (term instanceof AuthAll all) {
        String collection = all.collectionName();
        out.open("for (uint i = 0; i < " + collection + ".length; i++) {");
        out.line(approvalScope(transition, term) + "[" + collection + "[i]] = false;");
        out.close();
      } else {
        out.line(approvalRef(transition, term) + " = false;");
      }
    }
  }
}
