package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按使用情况合成辅助函数：每种降级后的序列类型一个成员判断函数，以及不带参数 / 带参数哈希两种全员审批判断函数。
 * payable 序列与普通序列在 Solidity 中互不兼容，各自生成重载。
 */
public final class HelperSynthesizer {
  private HelperSynthesizer() {}

  /** 按输出顺序返回需要的辅助函数文本。 */
  public static List<String> helpersFor(StateMachine machine) {
    List<String> helpers = new ArrayList<>();
    // Timestamp 与 Timespan 同降级为 uint，按降级后的文本去重
    Set<String> instantiated = new LinkedHashSet<>();
    for (UsageAnalysis.MembershipType type : UsageAnalysis.membershipTypes(machine)) {
      if (instantiated.add(type.sequenceElement())) {
        helpers.add(sequenceContains(type.element(), type.payable()));
      }
    }
    for (String approver : UsageAnalysis.allOfApproverTypes(machine, false)) {
      helpers.add(allApproved(false, approver));
    }
    for (String approver : UsageAnalysis.allOfApproverTypes(machine, true)) {
      helpers.add(allApproved(true, approver));
    }
    return helpers;
  }

  /**
   * @param approverType 审批人集合的元素类型文本，集合作为转账目的地时为 {@code address payable}
   */
  public static String allApproved(boolean parameterized, String approverType) {
    HelperTemplate template = parameterized ? HelperTemplate.ALL_APPROVED_WITH_PARAMS : HelperTemplate.ALL_APPROVED;
    return template.render(Map.of("approver", approverType));
  }

  public static String sequenceContains(DataType elementType) {
    return sequenceContains(elementType, false);
  }

  /**
   * 序列按 payable 降级时，被查找的元素仍取非 payable 类型，{@code address payable} 可隐式转换为 {@code address}。
   */
  public static String sequenceContains(DataType elementType, boolean payableSequence) {
    return HelperTemplate.SEQUENCE_CONTAINS.render(Map.of(
        "sequenceType", TypeLowering.lower(elementType, payableSequence),
        "type", TypeLowering.lower(elementType)));
  }
}
