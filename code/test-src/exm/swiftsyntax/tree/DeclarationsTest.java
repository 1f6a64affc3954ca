package exm.swiftsyntax.tree;

import static exm.swiftsyntax.tree.Expressions.identifier;
import static exm.swiftsyntax.tree.Expressions.intLit;
import static exm.swiftsyntax.tree.Expressions.stringLit;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.swiftsyntax.common.exceptions.SyntaxRuntimeError;
import exm.swiftsyntax.tree.Declarations.ClassDeclaration;
import exm.swiftsyntax.tree.Declarations.DeinitializerDeclaration;
import exm.swiftsyntax.tree.Declarations.EnumAssociatedValue;
import exm.swiftsyntax.tree.Declarations.EnumCase;
import exm.swiftsyntax.tree.Declarations.FunDeclaration;
import exm.swiftsyntax.tree.Declarations.FunctionParameter;
import exm.swiftsyntax.tree.Declarations.GenericsDeclaration;
import exm.swiftsyntax.tree.Declarations.InitializerDeclaration;
import exm.swiftsyntax.tree.Declarations.PropertyDeclaration;
import exm.swiftsyntax.tree.Declarations.PropertyKind;
import exm.swiftsyntax.tree.Declarations.StoredProperty;
import exm.swiftsyntax.tree.Declarations.TypeParameter;
import exm.swiftsyntax.tree.ImportSymbol.SymbolKind;

public class DeclarationsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static FunDeclaration draw(StatementSequence body) {
    return new FunDeclaration("draw", null,
        Collections.<FunctionParameter>emptyList(), null, false,
        AccessControl.defaultLevel(), body);
  }

  @Test
  public void testBodyAbsentVersusEmpty() {
    FunDeclaration requirementLike = draw(null);
    FunDeclaration empty = draw(StatementSequence.empty());
    assertFalse(requirementLike.hasBody());
    assertTrue(empty.hasBody());
    assertTrue(empty.body().isEmpty());
    assertNotEquals(requirementLike, empty);
  }

  @Test
  public void testInitializerNeedsBody() {
    exception.expect(NullPointerException.class);
    new InitializerDeclaration(null,
        Collections.<FunctionParameter>emptyList(), null, false, false,
        AccessControl.INTERNAL);
  }

  @Test
  public void testDefaultAccess() {
    assertEquals(AccessControl.INTERNAL, AccessControl.defaultLevel());
    assertEquals("fileprivate", AccessControl.FILE_PRIVATE.keyword());
  }

  @Test
  public void testClassChildrenOrder() {
    GenericsDeclaration generics = new GenericsDeclaration(
        Arrays.asList(new TypeParameter("T", null)));
    StoredProperty prop = new StoredProperty(false, "n",
                                             SwiftTypes.intType(), null);
    FunDeclaration method = draw(StatementSequence.empty());
    InitializerDeclaration init = new InitializerDeclaration(null,
        Collections.<FunctionParameter>emptyList(),
        StatementSequence.empty(), false, false, AccessControl.INTERNAL);
    DeinitializerDeclaration deinit = new DeinitializerDeclaration(
                                              StatementSequence.empty());
    ClassDeclaration c = new ClassDeclaration("Box", generics, null,
        Collections.<String>emptyList(),
        Arrays.<PropertyDeclaration>asList(prop), Arrays.asList(method),
        Arrays.asList(init), deinit);

    List<SyntaxNode> children = c.children();
    assertEquals(5, children.size());
    assertSame(generics, children.get(0));
    assertSame(prop, children.get(1));
    assertSame(method, children.get(2));
    assertSame(init, children.get(3));
    assertSame(deinit, children.get(4));
    assertFalse(c.hasSuperclass());
    assertEquals(PropertyKind.STORED, c.properties().get(0).kind());
  }

  @Test
  public void testCorpusClassEquality() {
    ClassDeclaration a = SampleTrees.corpusDog();
    ClassDeclaration b = SampleTrees.corpusDog();
    assertNotSame(a, b);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals("Animal", a.superclass());
    assertEquals(1, a.initializers().size());
  }

  @Test
  public void testMembersImmutable() {
    ClassDeclaration c = SampleTrees.corpusDog();
    exception.expect(UnsupportedOperationException.class);
    c.properties().add(new StoredProperty(true, "age",
                                          SwiftTypes.intType(), null));
  }

  @Test
  public void testImportWholeModule() {
    ImportSymbol sym = ImportSymbol.entireModule();
    assertTrue(sym.isEntireModule());
    assertEquals(SymbolKind.ENTIRE_MODULE, sym.kind());
    exception.expect(SyntaxRuntimeError.class);
    sym.name();
  }

  @Test
  public void testImportNamedSymbol() {
    ImportSymbol sym = ImportSymbol.named(SymbolKind.STRUCT, "Date");
    assertFalse(sym.isEntireModule());
    assertEquals("Date", sym.name());
    assertEquals(sym, ImportSymbol.named(SymbolKind.STRUCT, "Date"));
    assertNotEquals(sym, ImportSymbol.named(SymbolKind.CLASS, "Date"));
  }

  @Test
  public void testNamedSymbolCannotBeWholeModule() {
    exception.expect(IllegalArgumentException.class);
    ImportSymbol.named(SymbolKind.ENTIRE_MODULE, "Foundation");
  }

  @Test
  public void testEnumCaseWithBothPayloadsAccepted() {
    EnumCase c = new EnumCase("odd",
        Arrays.asList(new EnumAssociatedValue(null, SwiftTypes.intType())),
        stringLit("odd"));
    assertTrue(c.hasRawValue());
    assertEquals(1, c.associatedValues().size());
    assertEquals(2, c.children().size());
  }

  @Test
  public void testDefaultValueIsExpression() {
    FunctionParameter p = new FunctionParameter("by", "step",
        SwiftTypes.intType(), intLit(1), false, false);
    assertEquals(intLit(1), p.defaultValue());
    assertEquals(FunctionParameter.simple("x", SwiftTypes.intType()),
                 FunctionParameter.simple("x", SwiftTypes.intType()));
    assertNotEquals(p, new FunctionParameter("by", "step",
        SwiftTypes.intType(), identifier("one"), false, false));
  }
}
