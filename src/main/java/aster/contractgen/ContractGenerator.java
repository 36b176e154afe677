package aster.contractgen;

import aster.contractgen.codegen.AuthorizationCompiler;
import aster.contractgen.codegen.HelperSynthesizer;
import aster.contractgen.codegen.SourceWriter;
import aster.contractgen.codegen.TransitionCompiler;
import aster.contractgen.codegen.TypeLowering;
import aster.contractgen.codegen.UsageAnalysis;
import aster.contractgen.core.SpecModel.*;
import aster.contractgen.support.ContractGenConfig;
import aster.contractgen.support.ErrorMessages;
import aster.contractgen.support.GenerationException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 合约生成器
 * <p>
 * 将已通过校验的状态机规约降级为 Solidity 合约源码。
 * <p>
 * 输出顺序固定：
 * <pre>
 * 版本声明 → contract 头 → State 枚举 → 公共字段 → 当前状态字段 → 审批记录字段
 *         → 各迁移过程（初始迁移为构造函数）→ 成员判断辅助函数 → 全员审批辅助函数
 * </pre>
 * <p>
 * 生成器本身只持有不可变配置，缩进等渲染状态保存在每次调用独立创建的 {@link SourceWriter} 中，
 * 可在多个线程间共享同一实例。
 */
public final class ContractGenerator {

    private static final Logger LOGGER = Logger.getLogger(ContractGenerator.class.getName());

    private final String solidityVersion;
    private final String indentUnit;

    public ContractGenerator() {
        this(ContractGenConfig.SOLIDITY_VERSION, SourceWriter.DEFAULT_INDENT);
    }

    public ContractGenerator(String solidityVersion, String indentUnit) {
        this.solidityVersion = solidityVersion;
        this.indentUnit = indentUnit;
    }

    /**
     * 生成合约源码
     *
     * @param specification 已校验的规约
     * @return 合约源码
     * @throws GenerationException 输入违反生成器依赖的不变量时抛出
     */
    public String generate(Specification specification) {
        StateMachine machine = specification.stateMachine();
        checkInvariants(machine);

        SourceWriter out = new SourceWriter(indentUnit);
        out.line("pragma solidity >=" + solidityVersion + ";");
        out.blankLine();
        out.open("contract " + specification.name() + " {");

        writeStateEnum(out, machine.states());

        Set<String> payableFields = UsageAnalysis.payableFields(machine);
        for (Variable field : machine.fields()) {
            out.line(TypeLowering.lower(field.type(), payableFields.contains(field.name())) + " public " + field.name() + ";");
        }
        out.line("State public " + TransitionCompiler.CURRENT_STATE_VAR + ";");
        AuthorizationCompiler.writeFields(out, machine);

        Map<String, List<Transition>> autoTransitions = UsageAnalysis.autoTransitionsByOrigin(machine);
        for (Transition transition : machine.transitions()) {
            out.blankLine();
            TransitionCompiler.write(out, transition, autoTransitions);
        }

        List<String> helpers = HelperSynthesizer.helpersFor(machine);
        for (String helper : helpers) {
            out.blankLine();
            out.lines(helper);
        }

        out.close();

        LOGGER.log(Level.FINE, "生成合约 {0}：{1} 个状态，{2} 个迁移，{3} 个辅助函数",
                new Object[]{specification.name(), machine.states().size(), machine.transitions().size(), helpers.size()});
        return out.toString();
    }

    private static void writeStateEnum(SourceWriter out, List<String> states) {
        out.open("enum State {");
        for (int i = 0; i < states.size(); i++) {
            out.line(i < states.size() - 1 ? states.get(i) + "," : states.get(i));
        }
        out.close();
    }

    /**
     * 校验生成器依赖的结构不变量。这些条件应由上游校验器保证，违反时立即中止。
     */
    private static void checkInvariants(StateMachine machine) {
        Transition initial = null;
        for (Transition t : machine.transitions()) {
            if (t.isInitial()) {
                if (initial != null) {
                    throw new GenerationException(ErrorMessages.multipleInitialTransitions(initial.name(), t.name()));
                }
                initial = t;
            } else if (!machine.states().contains(t.origin())) {
                throw new GenerationException(ErrorMessages.undeclaredState(t.name(), t.origin()));
            }
            if (!machine.states().contains(t.destination())) {
                throw new GenerationException(ErrorMessages.undeclaredState(t.name(), t.destination()));
            }
            if (t.auto()) {
                if (t.origin() == null) {
                    throw new GenerationException(ErrorMessages.autoTransitionMissingOrigin(t.name()));
                }
                if (t.guard() == null) {
                    throw new GenerationException(ErrorMessages.autoTransitionMissingGuard(t.name()));
                }
            }
        }
    }
}
