package aster.contractgen.codegen;

import java.util.Map;

/**
 * 按需合成的辅助函数模板，{@code {{name}}} 为替换点。
 */
public enum HelperTemplate {
  SEQUENCE_CONTAINS("""
      function sequenceContains({{sequenceType}}[] storage sequence, {{type}} element) private view returns (bool) {
          for (uint i = 0; i < sequence.length; i++) {
              if (sequence[i] == element) {
                  return true;
              }
          }
          return false;
      }"""),

  ALL_APPROVED("""
      function allApproved({{approver}}[] storage approvers, mapping(address => bool) storage approvals) private view returns (bool) {
          for (uint i = 0; i < approvers.length; i++) {
              if (!approvals[approvers[i]]) {
                  return false;
              }
          }
          return true;
      }"""),

  ALL_APPROVED_WITH_PARAMS("""
      function allApproved({{approver}}[] storage approvers, mapping(bytes32 => mapping(address => bool)) storage approvals,
                           bytes32 paramHash) private view returns (bool) {
          for (uint i = 0; i < approvers.length; i++) {
              if (!approvals[paramHash][approvers[i]]) {
                  return false;
              }
          }
          return true;
      }""");

  private final String template;

  HelperTemplate(String template) {
    this.template = template;
  }

  public String render(Map<String, String> substitutions) {
    String text = template;
    for (Map.Entry<String, String> e : substitutions.entrySet()) {
      text = text.replace("{{" + e.getKey() + "}}", e.getValue());
    }
    if (text.contains("{{")) {
      throw new IllegalArgumentException("Unbound placeholder in helper " + name() + ": " + text);
    }
    return text;
  }
}
