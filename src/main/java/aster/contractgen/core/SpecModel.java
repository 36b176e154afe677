package aster.contractgen.core;

import com.fasterxml.jackson.annotation.*;
import java.util.*;

/**
 * 状态机规约的输入模型（由上游校验器产出，生成器只读消费）。
 *
 * <p>所有节点均为不可变 record，列表在构造时做防御性拷贝，缺省列表归一化为空列表。
 * 多态节点通过 {@code kind} 属性区分，便于从 JSON 加载。</p>
 */
public final class SpecModel {
  private SpecModel() {}

  public record Specification(String name, StateMachine stateMachine) {
    public Specification {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(stateMachine, "stateMachine");
    }
  }

  public record StateMachine(List<String> states, List<Variable> fields, List<Transition> transitions) {
    public StateMachine {
      // 状态保持声明顺序并去重，保证枚举输出稳定
      states = states == null ? List.of() : List.copyOf(new LinkedHashSet<>(states));
      fields = fields == null ? List.of() : List.copyOf(fields);
      transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
  }

  public record Variable(String name, DataType type) {
    public Variable {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
    }
  }

  public record Transition(String name, String origin, String destination, List<Variable> parameters,
                           Expr guard, AuthExpr authorized, List<Stmt> body, boolean auto) {
    public Transition {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(destination, "destination");
      parameters = parameters == null ? List.of() : List.copyOf(parameters);
      body = body == null ? List.of() : List.copyOf(body);
    }

    @JsonIgnore
    public boolean isInitial() { return origin == null; }

    @JsonIgnore
    public boolean isSelfLoop() { return origin != null && origin.equals(destination); }
  }

  // ---------------------------------------------------------------- types

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = IdentityT.class, name = "Identity"),
    @JsonSubTypes.Type(value = IntT.class, name = "Int"),
    @JsonSubTypes.Type(value = StringT.class, name = "String"),
    @JsonSubTypes.Type(value = TimestampT.class, name = "Timestamp"),
    @JsonSubTypes.Type(value = BoolT.class, name = "Bool"),
    @JsonSubTypes.Type(value = TimespanT.class, name = "Timespan"),
    @JsonSubTypes.Type(value = MappingT.class, name = "Mapping"),
    @JsonSubTypes.Type(value = SequenceT.class, name = "Sequence")
  })
  public sealed interface DataType permits IdentityT, IntT, StringT, TimestampT, BoolT, TimespanT, MappingT, SequenceT {}
  @JsonTypeName("Identity") public record IdentityT() implements DataType {}
  @JsonTypeName("Int") public record IntT() implements DataType {}
  @JsonTypeName("String") public record StringT() implements DataType {}
  @JsonTypeName("Timestamp") public record TimestampT() implements DataType {}
  @JsonTypeName("Bool") public record BoolT() implements DataType {}
  @JsonTypeName("Timespan") public record TimespanT() implements DataType {}
  @JsonTypeName("Mapping") public record MappingT(DataType key, DataType value) implements DataType {}
  @JsonTypeName("Sequence") public record SequenceT(DataType element) implements DataType {}

  // ---------------------------------------------------------- expressions

  public enum ArithmeticOperator { PLUS, MINUS, MULTIPLY, DIVIDE }

  public enum LogicalOperator {
    LESS_THAN, LESS_THAN_OR_EQUAL, EQUAL, NOT_EQUAL, GREATER_THAN_OR_EQUAL, GREATER_THAN, AND, OR, IN, NOT_IN;

    public boolean isMembership() { return this == IN || this == NOT_IN; }
  }

  public enum TimeUnit {
    SECOND("seconds"), MINUTE("minutes"), HOUR("hours"), DAY("days"), WEEK("weeks");

    private final String keyword;

    TimeUnit(String keyword) { this.keyword = keyword; }

    public String keyword() { return keyword; }
  }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = VarRef.class, name = "VarRef"),
    @JsonSubTypes.Type(value = MappingRef.class, name = "MappingRef"),
    @JsonSubTypes.Type(value = IntConst.class, name = "Int"),
    @JsonSubTypes.Type(value = StringLiteral.class, name = "String"),
    @JsonSubTypes.Type(value = BoolConst.class, name = "Bool"),
    @JsonSubTypes.Type(value = TimeUnitE.class, name = "TimeUnit"),
    @JsonSubTypes.Type(value = ArithmeticOperation.class, name = "Arithmetic"),
    @JsonSubTypes.Type(value = LogicalOperation.class, name = "Logical"),
    @JsonSubTypes.Type(value = SequenceSize.class, name = "SequenceSize")
  })
  public sealed interface Expr permits Assignable, IntConst, StringLiteral, BoolConst, TimeUnitE,
      ArithmeticOperation, LogicalOperation, SequenceSize {}

  /** 可作为赋值目标的表达式子集。 */
  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = VarRef.class, name = "VarRef"),
    @JsonSubTypes.Type(value = MappingRef.class, name = "MappingRef")
  })
  public sealed interface Assignable extends Expr permits VarRef, MappingRef {}

  @JsonTypeName("VarRef") public record VarRef(String name) implements Assignable {}
  @JsonTypeName("MappingRef") public record MappingRef(Expr map, Expr key) implements Assignable {}
  @JsonTypeName("Int") public record IntConst(long value) implements Expr {}
  @JsonTypeName("String") public record StringLiteral(String value) implements Expr {}
  @JsonTypeName("Bool") public record BoolConst(boolean value) implements Expr {}
  @JsonTypeName("TimeUnit") public record TimeUnitE(TimeUnit unit) implements Expr {}
  @JsonTypeName("Arithmetic")
  public record ArithmeticOperation(Expr left, ArithmeticOperator operator, Expr right) implements Expr {}
  @JsonTypeName("Logical")
  public record LogicalOperation(Expr left, LogicalOperator operator, Expr right) implements Expr {}
  @JsonTypeName("SequenceSize") public record SequenceSize(Expr sequence) implements Expr {}

  // ----------------------------------------------------------- statements

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Assignment.class, name = "Assignment"),
    @JsonSubTypes.Type(value = Send.class, name = "Send"),
    @JsonSubTypes.Type(value = SequenceAppend.class, name = "SequenceAppend"),
    @JsonSubTypes.Type(value = SequenceClear.class, name = "SequenceClear")
  })
  public sealed interface Stmt permits Assignment, Send, SequenceAppend, SequenceClear {}
  @JsonTypeName("Assignment") public record Assignment(Assignable left, Expr right) implements Stmt {}
  /** {@code source} 为空表示不从字段扣减。金额非负由上游校验保证。 */
  @JsonTypeName("Send") public record Send(Expr destination, Expr amount, Assignable source) implements Stmt {}
  @JsonTypeName("SequenceAppend") public record SequenceAppend(Expr sequence, Expr element) implements Stmt {}
  @JsonTypeName("SequenceClear") public record SequenceClear(Expr sequence) implements Stmt {}

  // -------------------------------------------------------- authorization

  public enum AuthOperator { AND, OR }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = IdentityLiteral.class, name = "Identity"),
    @JsonSubTypes.Type(value = AuthAny.class, name = "Any"),
    @JsonSubTypes.Type(value = AuthAll.class, name = "All"),
    @JsonSubTypes.Type(value = AuthCombination.class, name = "Combination")
  })
  public sealed interface AuthExpr permits AuthTerm, AuthCombination {
    /** 按从左到右顺序收集叶子项（去重）。 */
    default Set<AuthTerm> flatten() {
      Set<AuthTerm> terms = new LinkedHashSet<>();
      collectTerms(this, terms);
      return Collections.unmodifiableSet(terms);
    }

    private static void collectTerms(AuthExpr expr, Set<AuthTerm> out) {
      if (expr instanceof AuthCombination c) {
        collectTerms(c.left(), out);
        collectTerms(c.right(), out);
      } else {
        out.add((AuthTerm) expr);
      }
    }
  }

  public sealed interface AuthTerm extends AuthExpr permits IdentityLiteral, AuthAny, AuthAll {
    /** 用于推导审批记录字段名。 */
    @JsonIgnore
    String referencedName();
  }

  @JsonTypeName("Identity")
  public record IdentityLiteral(String identity) implements AuthTerm {
    @Override public String referencedName() { return identity; }
  }

  @JsonTypeName("Any")
  public record AuthAny(String collectionName) implements AuthTerm {
    @Override public String referencedName() { return collectionName; }
  }

  @JsonTypeName("All")
  public record AuthAll(String collectionName) implements AuthTerm {
    @Override public String referencedName() { return collectionName; }
  }

  @JsonTypeName("Combination")
  public record AuthCombination(AuthExpr left, AuthOperator operator, AuthExpr right) implements AuthExpr {}
}
