package aster.contractgen.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static aster.contractgen.SpecFixtures.*;
import static aster.contractgen.core.SpecModel.ArithmeticOperator.*;
import static org.junit.jupiter.api.Assertions.*;

public class StatementCompilerTest {

  private SourceWriter out;

  @BeforeEach
  public void setUp() {
    out = new SourceWriter();
    out.beginProcedure();
  }

  @Test
  public void testAssignment() {
    StatementCompiler.write(out, assign(ref("highestBid"), ref("tokens")));
    StatementCompiler.write(out, assign(at(ref("bids"), ref("sender")), arith(at(ref("bids"), ref("sender")), PLUS, ref("tokens"))));
    assertEquals("highestBid = int(msg.value);\n"
        + "bids[msg.sender] = bids[msg.sender] + int(msg.value);\n", out.toString());
  }

  @Test
  public void testSendWithoutSource() {
    StatementCompiler.write(out, send(ref("seller"), ref("price")));
    assertEquals("seller.transfer(uint(price));\n", out.toString());
  }

  @Test
  public void testSendParenthesizesCompositeDestination() {
    StatementCompiler.write(out, send(at(ref("payees"), arith(ref("i"), PLUS, num(1))), num(5)));
    StatementCompiler.write(out, send(arith(ref("a"), PLUS, ref("b")), num(5)));
    assertEquals("payees[i + 1].transfer(uint(5));\n"
        + "(a + b).transfer(uint(5));\n", out.toString());
  }

  @Test
  public void testSendWithSourceBindsAmountOnce() {
    // 金额表达式只出现一次，扣减先于转账
    StatementCompiler.write(out, send(ref("sender"), at(ref("deposits"), ref("sender")), at(ref("deposits"), ref("sender"))));
    List<String> lines = out.toString().lines().toList();
    assertEquals(List.of(
        "int __temporary = deposits[msg.sender];",
        "deposits[msg.sender] = deposits[msg.sender] - __temporary;",
        "msg.sender.transfer(uint(__temporary));"), lines);
  }

  @Test
  public void testSendWithSourceFixedAmount() {
    StatementCompiler.write(out, send(ref("beneficiary"), num(50), ref("escrow")));
    String text = out.toString();
    assertTrue(text.contains("int __temporary = 50;"));
    assertTrue(text.contains("escrow = escrow - __temporary;"));
    assertTrue(text.indexOf("escrow = escrow - __temporary;") < text.indexOf("beneficiary.transfer(uint(__temporary));"),
        "扣减必须先于转账");
    assertEquals(1, text.split("50", -1).length - 1, "金额表达式只能求值一次");
  }

  @Test
  public void testTemporariesAreFreshWithinProcedure() {
    StatementCompiler.writeAll(out, List.of(
        send(ref("a"), num(1), ref("pool")),
        send(ref("b"), num(2), ref("pool"))));
    String text = out.toString();
    assertTrue(text.contains("int __temporary = 1;"));
    assertTrue(text.contains("int __temporary1 = 2;"));
    assertTrue(text.contains("b.transfer(uint(__temporary1));"));

    out.beginProcedure();
    assertEquals("__temporary", out.freshTemporary(), "新过程重新编号");
  }

  @Test
  public void testSequenceMutations() {
    StatementCompiler.write(out, append(ref("bidders"), ref("sender")));
    StatementCompiler.write(out, clear(ref("bidders")));
    assertEquals("bidders.push(msg.sender);\ndelete bidders;\n", out.toString());
  }

  @Test
  public void testIndentationFollowsWriterDepth() {
    out.open("if (x) {");
    StatementCompiler.write(out, clear(ref("s")));
    out.close();
    assertEquals("if (x) {\n    delete s;\n}\n", out.toString());
  }
}
