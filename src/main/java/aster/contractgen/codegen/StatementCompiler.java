package aster.contractgen.codegen;

import aster.contractgen.core.SpecModel.*;
import aster.contractgen.support.GenerationException;
import java.util.List;

/**
 * 语句渲染。
 *
 * <p>带资金来源的转账展开为三步：金额绑定到临时变量、来源字段扣减、转账。金额只求值一次，
 * 且扣减必须先于转账可见，防止转账重入时读到扣减前的余额。转账金额非负由上游校验保证。</p>
 */
public final class StatementCompiler {
  private StatementCompiler() {}

  public static void writeAll(SourceWriter out, List<Stmt> statements) {
    for (Stmt s : statements) {
      write(out, s);
    }
  }

  public static void write(SourceWriter out, Stmt statement) {
    if (statement instanceof Assignment a) {
      out.line(ExpressionCompiler.renderAssignable(a.left()) + " = " + ExpressionCompiler.render(a.right()) + ";");
    } else if (statement instanceof Send s) {
      writeSend(out, s);
    } else if (statement instanceof SequenceAppend a) {
      out.line(ExpressionCompiler.render(a.sequence()) + ".push(" + ExpressionCompiler.render(a.element()) + ");");
    } else if (statement instanceof SequenceClear c) {
      out.line("delete " + ExpressionCompiler.render(c.sequence()) + ";");
    } else {
      throw new GenerationException("Unknown statement: " + statement);
    }
  }

  private static void writeSend(SourceWriter out, Send send) {
    String destination = ExpressionCompiler.isOperation(send.destination())
        ? "(" + ExpressionCompiler.render(send.destination()) + ")"
        : ExpressionCompiler.render(send.destination());
    if (send.source() == null) {
      out.line(destination + ".transfer(uint(" + ExpressionCompiler.render(send.amount()) + "));");
      return;
    }
    String temp = out.freshTemporary();
    String source = ExpressionCompiler.renderAssignable(send.source());
    out.line("int " + temp + " = " + ExpressionCompiler.render(send.amount()) + ";");
    out.line(source + " = " + source + " - " + temp + ";");
    out.line(destination + ".transfer(uint(" + temp + "));");
  }
}
