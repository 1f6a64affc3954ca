package exm.swiftsyntax.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.swiftsyntax.common.exceptions.SyntaxRuntimeError;
import exm.swiftsyntax.tree.Literal.LiteralKind;

public class LiteralTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testAccessors() {
    assertEquals(42L, Literal.createIntLit(42).getIntLit());
    assertEquals(2.5, Literal.createFloatLit(2.5).getFloatLit(), 0.0);
    assertTrue(Literal.createBoolLit(true).getBoolLit());
    assertEquals("hi", Literal.createStringLit("hi").getStringLit());
    assertEquals('x', Literal.createCharLit('x').getCharLit());
    assertTrue(Literal.createNil().isNil());
    assertFalse(Literal.createIntLit(0).isNil());
    assertEquals(LiteralKind.CHARACTER, Literal.createCharLit('x').getKind());
  }

  @Test
  public void testWrongKindAccessor() {
    exception.expect(SyntaxRuntimeError.class);
    exception.expectMessage("getStringLit for INTEGER");
    Literal.createIntLit(1).getStringLit();
  }

  @Test
  public void testNilHasNoValue() {
    exception.expect(SyntaxRuntimeError.class);
    Literal.createNil().getBoolLit();
  }

  @Test
  public void testNaNEqualsNaN() {
    Literal a = Literal.createFloatLit(Double.NaN);
    Literal b = Literal.createFloatLit(0.0 / 0.0);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    // Distinguished, unlike ==
    assertNotEquals(Literal.createFloatLit(0.0),
                    Literal.createFloatLit(-0.0));
  }

  @Test
  public void testKindMatters() {
    assertNotEquals(Literal.createIntLit(1), Literal.createFloatLit(1.0));
    assertNotEquals(Literal.createCharLit('a'),
                    Literal.createStringLit("a"));
    assertEquals(Literal.createNil(), Literal.createNil());
  }

  @Test
  public void testCharOutsideBmp() {
    Literal l = Literal.createCharLit(0x1F600);
    assertEquals(0x1F600, l.getCharLit());
  }

  @Test
  public void testInvalidCodePoint() {
    exception.expect(IllegalArgumentException.class);
    Literal.createCharLit(0x110000);
  }

  @Test
  public void testSurrogateCodePoint() {
    exception.expect(IllegalArgumentException.class);
    exception.expectMessage("Invalid code point: 55296");
    Literal.createCharLit(0xD800);
  }

  @Test
  public void testLowSurrogateCodePoint() {
    exception.expect(IllegalArgumentException.class);
    Literal.createCharLit(0xDFFF);
  }

  @Test
  public void testCodePointsAroundSurrogates() {
    assertEquals(0xD7FF, Literal.createCharLit(0xD7FF).getCharLit());
    assertEquals(0xE000, Literal.createCharLit(0xE000).getCharLit());
  }

  @Test
  public void testNullString() {
    exception.expect(NullPointerException.class);
    Literal.createStringLit(null);
  }
}
