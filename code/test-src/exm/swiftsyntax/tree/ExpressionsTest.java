package exm.swiftsyntax.tree;

import static exm.swiftsyntax.tree.Expressions.binary;
import static exm.swiftsyntax.tree.Expressions.call;
import static exm.swiftsyntax.tree.Expressions.identifier;
import static exm.swiftsyntax.tree.Expressions.intLit;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.swiftsyntax.tree.Expressions.Argument;
import exm.swiftsyntax.tree.Expressions.ArrayExpression;
import exm.swiftsyntax.tree.Expressions.CallExpression;
import exm.swiftsyntax.tree.Expressions.CastKind;
import exm.swiftsyntax.tree.Expressions.ExprKind;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Expressions.TrailingClosure;
import exm.swiftsyntax.tree.Expressions.TypeCastingExpression;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;

public class ExpressionsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testGenericArgumentsAbsentVersusEmpty() {
    Expression callee = identifier("make");
    CallExpression none = new CallExpression(callee,
        Collections.<Argument>emptyList(), null,
        Collections.<TrailingClosure>emptyList());
    CallExpression empty = new CallExpression(identifier("make"),
        Collections.<Argument>emptyList(),
        Collections.<SwiftType>emptyList(),
        Collections.<TrailingClosure>emptyList());
    assertFalse(none.hasGenericTypeArguments());
    assertNull(none.genericTypeArguments());
    assertTrue(empty.hasGenericTypeArguments());
    assertNotEquals(none, empty);
  }

  @Test
  public void testCallChildrenInOrder() {
    Expression callee = identifier("f");
    Expression arg = intLit(1);
    CallExpression c = call(callee, Argument.unlabelled(arg));
    List<SyntaxNode> children = c.children();
    assertEquals(2, children.size());
    assertSame(callee, children.get(0));
    assertSame(arg, children.get(1).children().get(0));
  }

  @Test
  public void testNullListElementRejected() {
    exception.expect(NullPointerException.class);
    new ArrayExpression(Arrays.<Expression>asList(intLit(1), null));
  }

  @Test
  public void testNullRequiredChildRejected() {
    exception.expect(NullPointerException.class);
    binary(identifier("a"), "+", null);
  }

  @Test
  public void testCastKeywords() {
    assertEquals("as", CastKind.AS.keyword());
    assertEquals("as?", CastKind.CONDITIONAL.keyword());
    assertEquals("as!", CastKind.FORCED.keyword());
    TypeCastingExpression cast = new TypeCastingExpression(
        identifier("pet"), CastKind.FORCED, SwiftTypes.custom("Dog"));
    assertEquals("pet as! Dog", cast.toString());
    assertEquals(ExprKind.TYPE_CASTING, cast.kind());
  }

  @Test
  public void testStructuralEquality() {
    Expression a = binary(identifier("a"), "+", intLit(1));
    Expression b = binary(identifier("a"), "+", intLit(1));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, binary(identifier("a"), "-", intLit(1)));
  }

  @Test
  public void testToStringPrintsSource() {
    assertEquals("a + 1", binary(identifier("a"), "+", intLit(1)).toString());
  }

  @Test
  public void testArgumentsImmutable() {
    CallExpression c = call(identifier("f"), Argument.unlabelled(intLit(1)));
    exception.expect(UnsupportedOperationException.class);
    c.arguments().clear();
  }
}
