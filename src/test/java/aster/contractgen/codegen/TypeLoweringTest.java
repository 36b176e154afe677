package aster.contractgen.codegen;

import org.junit.jupiter.api.Test;

import static aster.contractgen.SpecFixtures.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TypeLoweringTest {

  @Test
  public void testPrimitiveTypes() {
    assertEquals("address", TypeLowering.lower(IDENTITY, false));
    assertEquals("int", TypeLowering.lower(INT, false));
    assertEquals("bytes32", TypeLowering.lower(STRING, false));
    assertEquals("uint", TypeLowering.lower(TIMESTAMP, false));
    assertEquals("bool", TypeLowering.lower(BOOL, false));
    assertEquals("uint", TypeLowering.lower(TIMESPAN, false));
  }

  @Test
  public void testPayableOnlyAffectsIdentity() {
    assertEquals("address payable", TypeLowering.lower(IDENTITY, true));
    assertEquals("int", TypeLowering.lower(INT, true));
    assertEquals("bytes32", TypeLowering.lower(STRING, true));
    assertEquals("bool", TypeLowering.lower(BOOL, true));
    assertEquals("mapping(int => bool)", TypeLowering.lower(map(INT, BOOL), true));
  }

  @Test
  public void testCompositeTypes() {
    assertEquals("address[]", TypeLowering.lower(seq(IDENTITY), false));
    assertEquals("mapping(address => int)", TypeLowering.lower(map(IDENTITY, INT), false));
  }

  @Test
  public void testNestedCompositesPropagatePayableToValues() {
    assertEquals("mapping(address => mapping(bytes32 => address payable[]))",
        TypeLowering.lower(map(IDENTITY, map(STRING, seq(IDENTITY))), true));
    assertEquals("mapping(address => mapping(bytes32 => address[]))",
        TypeLowering.lower(map(IDENTITY, map(STRING, seq(IDENTITY))), false));
    assertEquals("address payable[][]", TypeLowering.lower(seq(seq(IDENTITY)), true));
  }

  @Test
  public void testDeterministic() {
    var type = map(TIMESTAMP, seq(map(IDENTITY, TIMESPAN)));
    assertEquals(TypeLowering.lower(type, true), TypeLowering.lower(type, true));
    assertEquals("mapping(uint => mapping(address => uint)[])", TypeLowering.lower(type));
  }
}
