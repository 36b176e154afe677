package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于使用情况的分析：payable 推断、成员判断元素类型收集、all-of 辅助函数需求、自动迁移分组。
 *
 * <p>所有结果集合均保持首次出现顺序，保证相同输入产出逐字节相同的合约。</p>
 */
public final class UsageAnalysis {
  private UsageAnalysis() {}

  // ------------------------------------------------------------ parameters

  /** 去掉 Solidity 内建参数（如 tokens）后的参数列表。 */
  public static List<Variable> effectiveParameters(Transition transition) {
    List<Variable> result = new ArrayList<>();
    for (Variable p : transition.parameters()) {
      if (!ReservedNames.BUILTIN_PARAMS.contains(p.name())) result.add(p);
    }
    return result;
  }

  /** 至少有一个非内建参数时，审批记录按参数哈希隔离。 */
  public static boolean isParameterized(Transition transition) {
    return !effectiveParameters(transition).isEmpty();
  }

  /** 声明了 tokens 参数的迁移需要接收转账。 */
  public static boolean receivesValue(Transition transition) {
    for (Variable p : transition.parameters()) {
      if (ReservedNames.TOKENS.equals(p.name())) return true;
    }
    return false;
  }

  // --------------------------------------------------------------- payable

  /**
   * 在 {@code scope} 内找出作为转账目的地出现过的名称。
   */
  public static Set<String> payableNames(Collection<Stmt> statements, Set<String> scope) {
    Set<String> names = new LinkedHashSet<>();
    for (Stmt s : statements) {
      if (s instanceof Send send) collectNames(send.destination(), names);
    }
    names.retainAll(scope);
    return names;
  }

  public static Set<String> payableFields(StateMachine machine) {
    Set<String> fieldNames = new LinkedHashSet<>();
    for (Variable f : machine.fields()) fieldNames.add(f.name());
    return payableNames(allStatements(machine), fieldNames);
  }

  public static Set<String> payableParameters(Transition transition) {
    Set<String> paramNames = new LinkedHashSet<>();
    for (Variable p : effectiveParameters(transition)) paramNames.add(p.name());
    return payableNames(transition.body(), paramNames);
  }

  private static void collectNames(Expr e, Set<String> out) {
    if (e instanceof VarRef v) {
      out.add(v.name());
    } else if (e instanceof MappingRef m) {
      collectNames(m.map(), out);
      collectNames(m.key(), out);
    } else if (e instanceof ArithmeticOperation a) {
      collectNames(a.left(), out);
      collectNames(a.right(), out);
    } else if (e instanceof LogicalOperation l) {
      collectNames(l.left(), out);
      collectNames(l.right(), out);
    } else if (e instanceof SequenceSize s) {
      collectNames(s.sequence(), out);
    }
  }

  static List<Stmt> allStatements(StateMachine machine) {
    List<Stmt> all = new ArrayList<>();
    for (Transition t : machine.transitions()) all.addAll(t.body());
    return all;
  }

  // ------------------------------------------------------------ membership

  /**
   * sequenceContains 的一种实例化：序列元素类型，以及该序列是否按 payable 降级。
   * {@code address payable[]} 不能隐式转换为 {@code address[]}，两者需要各自的重载。
   */
  public record MembershipType(DataType element, boolean payable) {
    /** 序列参数的元素类型文本，也是去重键。 */
    public String sequenceElement() {
      return TypeLowering.lower(element, payable);
    }
  }

  /**
   * 需要 sequenceContains 辅助函数的实例化：所有 in / not in 表达式涉及的序列，
   * 以及 any-of / all-of 授权项引用的集合，后者排在最后。
   */
  public static Set<MembershipType> membershipTypes(StateMachine machine) {
    Set<MembershipType> types = new LinkedHashSet<>();
    Set<String> payableFields = payableFields(machine);
    for (Transition t : machine.transitions()) {
      TypeResolver resolver = new TypeResolver(machine.fields(), t.parameters());
      Set<String> payable = payableScope(t, payableFields);
      for (Expr e : expressionsOf(t)) collectMembershipTypes(e, resolver, payable, types);
    }
    for (Transition t : machine.transitions()) {
      if (t.authorized() == null) continue;
      Set<String> payable = payableScope(t, payableFields);
      for (AuthTerm term : t.authorized().flatten()) {
        if (term instanceof AuthAny || term instanceof AuthAll) {
          types.add(new MembershipType(new IdentityT(), payable.contains(term.referencedName())));
        }
      }
    }
    return types;
  }

  // 迁移内可见的 payable 名称：参数遮蔽同名字段
  private static Set<String> payableScope(Transition t, Set<String> payableFields) {
    Set<String> scope = new LinkedHashSet<>(payableFields);
    for (Variable p : t.parameters()) scope.remove(p.name());
    scope.addAll(payableParameters(t));
    return scope;
  }

  private static void collectMembershipTypes(Expr e, TypeResolver resolver, Set<String> payable, Set<MembershipType> out) {
    if (e instanceof LogicalOperation l) {
      if (l.operator().isMembership()) {
        String root = rootName(l.right());
        out.add(new MembershipType(resolver.elementTypeOf(l.right()), root != null && payable.contains(root)));
      }
      collectMembershipTypes(l.left(), resolver, payable, out);
      collectMembershipTypes(l.right(), resolver, payable, out);
    } else if (e instanceof ArithmeticOperation a) {
      collectMembershipTypes(a.left(), resolver, payable, out);
      collectMembershipTypes(a.right(), resolver, payable, out);
    } else if (e instanceof MappingRef m) {
      collectMembershipTypes(m.map(), resolver, payable, out);
      collectMembershipTypes(m.key(), resolver, payable, out);
    } else if (e instanceof SequenceSize s) {
      collectMembershipTypes(s.sequence(), resolver, payable, out);
    }
  }

  // 序列操作数所属的字段或参数名；payable 沿映射值向下传递，因此取映射链的根
  private static String rootName(Expr e) {
    if (e instanceof VarRef v) return v.name();
    if (e instanceof MappingRef m) return rootName(m.map());
    return null;
  }

  /** 迁移中出现的全部顶层表达式：守卫与语句中的表达式。 */
  static List<Expr> expressionsOf(Transition t) {
    List<Expr> exprs = new ArrayList<>();
    if (t.guard() != null) exprs.add(t.guard());
    for (Stmt s : t.body()) {
      if (s instanceof Assignment a) {
        exprs.add(a.left());
        exprs.add(a.right());
      } else if (s instanceof Send send) {
        exprs.add(send.destination());
        exprs.add(send.amount());
        if (send.source() != null) exprs.add(send.source());
      } else if (s instanceof SequenceAppend app) {
        exprs.add(app.sequence());
        exprs.add(app.element());
      } else if (s instanceof SequenceClear c) {
        exprs.add(c.sequence());
      }
    }
    return exprs;
  }

  // ----------------------------------------------------------- allApproved

  /**
   * 带 / 不带参数的迁移中 all-of 授权项引用的集合，按降级后的元素类型文本收集
   * （{@code address} 或 {@code address payable}），保持首次出现顺序。
   */
  public static Set<String> allOfApproverTypes(StateMachine machine, boolean parameterized) {
    Set<String> types = new LinkedHashSet<>();
    Set<String> payableFields = payableFields(machine);
    for (Transition t : machine.transitions()) {
      if (t.authorized() == null || isParameterized(t) != parameterized) continue;
      Set<String> payable = payableScope(t, payableFields);
      for (AuthTerm term : t.authorized().flatten()) {
        if (term instanceof AuthAll) {
          types.add(TypeLowering.lower(new IdentityT(), payable.contains(term.referencedName())));
        }
      }
    }
    return types;
  }

  /** 是否有（不）带参数的迁移使用了 all-of 授权项。 */
  public static boolean usesAllOf(StateMachine machine, boolean parameterized) {
    return !allOfApproverTypes(machine, parameterized).isEmpty();
  }

  // ---------------------------------------------------------------- auto

  /** 按源状态分组的自动迁移，保持声明顺序。 */
  public static Map<String, List<Transition>> autoTransitionsByOrigin(StateMachine machine) {
    Map<String, List<Transition>> byOrigin = new LinkedHashMap<>();
    for (Transition t : machine.transitions()) {
      if (t.auto()) byOrigin.computeIfAbsent(t.origin(), k -> new ArrayList<>()).add(t);
    }
    return byOrigin;
  }
}
