package exm.swiftsyntax.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.swiftsyntax.tree.SwiftTypes.FunctionType;
import exm.swiftsyntax.tree.SwiftTypes.PrimType;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;
import exm.swiftsyntax.tree.SwiftTypes.TypeKind;

public class SwiftTypesTest {

  @Test
  public void testStructuralEquality() {
    SwiftType a = SwiftTypes.dictionary(SwiftTypes.stringType(),
                    SwiftTypes.array(SwiftTypes.optional(
                                     SwiftTypes.custom("Dog"))));
    SwiftType b = SwiftTypes.dictionary(SwiftTypes.stringType(),
                    SwiftTypes.array(SwiftTypes.optional(
                                     SwiftTypes.custom("Dog"))));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, SwiftTypes.dictionary(SwiftTypes.stringType(),
                    SwiftTypes.array(SwiftTypes.custom("Dog"))));
  }

  @Test
  public void testPrimitivesAreFreshButEqual() {
    SwiftType x = SwiftTypes.intType();
    SwiftType y = SwiftTypes.intType();
    assertNotSame(x, y);
    assertEquals(x, y);
    assertEquals(SwiftTypes.primitive(PrimType.INTEGER), x);
    assertNotEquals(SwiftTypes.floatType(), x);
  }

  @Test
  public void testCustomNotPrimitive() {
    assertNotEquals(SwiftTypes.custom("Int"), SwiftTypes.intType());
  }

  @Test
  public void testKinds() {
    assertEquals(TypeKind.PRIMITIVE, SwiftTypes.boolType().kind());
    assertEquals(TypeKind.OPTIONAL,
                 SwiftTypes.optional(SwiftTypes.boolType()).kind());
    assertEquals(TypeKind.TUPLE, SwiftTypes.tuple().kind());
    assertEquals(TypeKind.CUSTOM, SwiftTypes.custom("T").kind());
  }

  @Test
  public void testFunctionTypeChildren() {
    SwiftType p1 = SwiftTypes.intType();
    SwiftType p2 = SwiftTypes.stringType();
    SwiftType result = SwiftTypes.boolType();
    FunctionType f = SwiftTypes.function(Arrays.asList(p1, p2), result);
    List<SyntaxNode> children = f.children();
    assertEquals(3, children.size());
    assertSame(p1, children.get(0));
    assertSame(p2, children.get(1));
    assertSame(result, children.get(2));
    assertTrue(SwiftTypes.intType().children().isEmpty());
  }

  @Test
  public void testToString() {
    assertEquals("[String: Int?]",
        SwiftTypes.dictionary(SwiftTypes.stringType(),
                   SwiftTypes.optional(SwiftTypes.intType())).toString());
  }
}
