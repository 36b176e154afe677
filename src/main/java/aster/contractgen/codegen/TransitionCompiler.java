package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import aster.contractgen.support.ErrorMessages;
import aster.contractgen.support.GenerationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 每个迁移编译为一个过程；没有源状态的迁移编译为构造函数。
 *
 * <p>过程体顺序：源状态检查、自动迁移插入、守卫、授权、目标状态更新、迁移体、自环时的审批重置。
 * 不适用的步骤直接跳过。</p>
 */
public final class TransitionCompiler {
  private TransitionCompiler() {}

  public static final String CURRENT_STATE_VAR = "__currentState";

  /**
   * @param autoTransitions 按源状态分组的自动迁移
   */
  public static void write(SourceWriter out, Transition transition, Map<String, List<Transition>> autoTransitions) {
    out.beginProcedure();
    out.open(header(transition));

    if (transition.origin() != null) {
      out.line("require(" + CURRENT_STATE_VAR + " == State." + transition.origin() + ");");
      writeAutoInterposition(out, transition, autoTransitions.getOrDefault(transition.origin(), List.of()));
    }

    if (transition.guard() != null) {
      out.line("require(" + ExpressionCompiler.render(transition.guard()) + ");");
    }

    AuthorizationCompiler.writeCheck(out, transition);

    if (!transition.isSelfLoop()) {
      out.line(CURRENT_STATE_VAR + " = State." + transition.destination() + ";");
    }

    StatementCompiler.writeAll(out, transition.body());

    if (transition.isSelfLoop()) {
      AuthorizationCompiler.writeReset(out, transition);
    }
    out.close();
  }

  static String header(Transition transition) {
    List<Variable> params = UsageAnalysis.effectiveParameters(transition);
    Set<String> payableParams = UsageAnalysis.payableParameters(transition);
    String paramList = params.stream()
        .map(p -> TypeLowering.lower(p.type(), payableParams.contains(p.name())) + " " + p.name())
        .collect(Collectors.joining(", "));
    String payable = UsageAnalysis.receivesValue(transition) ? "payable " : "";
    if (transition.isInitial()) {
      return "constructor(" + paramList + ") public " + payable + "{";
    }
    return "function " + transition.name() + "(" + paramList + ") public " + payable + "{";
  }

  /**
   * 与当前迁移同源的其他自动迁移按声明顺序组成 if / else if 链；第一个守卫成立的自动迁移
   * 执行其状态更新与迁移体后立即返回，当前迁移本身不再执行。
   */
  private static void writeAutoInterposition(SourceWriter out, Transition transition, List<Transition> candidates) {
    List<Transition> others = new ArrayList<>();
    for (Transition t : candidates) {
      if (!t.equals(transition)) others.add(t);
    }
    for (int i = 0; i < others.size(); i++) {
      Transition auto = others.get(i);
      if (auto.guard() == null) {
        throw new GenerationException(ErrorMessages.autoTransitionMissingGuard(auto.name()));
      }
      String condition = "(" + ExpressionCompiler.render(auto.guard()) + ") {";
      if (i == 0) {
        out.open("if " + condition);
      } else {
        out.reopen("} else if " + condition);
      }
      if (!auto.isSelfLoop()) {
        out.line(CURRENT_STATE_VAR + " = State." + auto.destination() + ";");
      }
      StatementCompiler.writeAll(out, auto.body());
      out.line("return;");
    }
    if (!others.isEmpty()) {
      out.close();
    }
  }
}
