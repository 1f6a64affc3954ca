package exm.swiftsyntax.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.printer.SwiftPrinter;
import exm.swiftsyntax.tree.Declarations.ClassDeclaration;
import exm.swiftsyntax.tree.Declarations.DeclKind;
import exm.swiftsyntax.tree.Declarations.Declaration;
import exm.swiftsyntax.tree.Declarations.PropertyDeclaration;
import exm.swiftsyntax.tree.Declarations.PropertyKind;
import exm.swiftsyntax.tree.Declarations.StructDeclaration;
import exm.swiftsyntax.tree.Expressions.ExprKind;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Patterns.Pattern;
import exm.swiftsyntax.tree.Patterns.PatternKind;
import exm.swiftsyntax.tree.Statements.Statement;
import exm.swiftsyntax.tree.Statements.StmtKind;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;
import exm.swiftsyntax.tree.SwiftTypes.TypeKind;
import exm.swiftsyntax.walk.SyntaxWalker;

/**
 * Check that the sample trees cover every variant, and that printing
 * and walking handle each of them.
 */
public class ExhaustivenessTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ExhaustivenessTest.log", true);
  }

  @Test
  public void testTypeKinds() throws Exception {
    EnumSet<TypeKind> seen = EnumSet.noneOf(TypeKind.class);
    for (SwiftType t: SampleTrees.allTypes()) {
      seen.add(t.kind());
      checkNode(t, SwiftPrinter.print(t));
    }
    assertEquals(EnumSet.allOf(TypeKind.class), seen);
  }

  @Test
  public void testExprKinds() throws Exception {
    EnumSet<ExprKind> seen = EnumSet.noneOf(ExprKind.class);
    for (Expression e: SampleTrees.allExpressions()) {
      seen.add(e.kind());
      checkNode(e, SwiftPrinter.print(e));
    }
    assertEquals(EnumSet.allOf(ExprKind.class), seen);
  }

  @Test
  public void testPatternKinds() throws Exception {
    EnumSet<PatternKind> seen = EnumSet.noneOf(PatternKind.class);
    for (Pattern p: SampleTrees.allPatterns()) {
      seen.add(p.kind());
      checkNode(p, SwiftPrinter.print(p));
    }
    assertEquals(EnumSet.allOf(PatternKind.class), seen);
  }

  @Test
  public void testStmtKinds() throws Exception {
    EnumSet<StmtKind> seen = EnumSet.noneOf(StmtKind.class);
    for (Statement s: SampleTrees.allStatements()) {
      seen.add(s.kind());
      checkNode(s, SwiftPrinter.print(s));
    }
    assertEquals(EnumSet.allOf(StmtKind.class), seen);
  }

  @Test
  public void testDeclKinds() throws Exception {
    EnumSet<DeclKind> seen = EnumSet.noneOf(DeclKind.class);
    EnumSet<PropertyKind> props = EnumSet.noneOf(PropertyKind.class);
    for (Declaration d: SampleTrees.allDeclarations()) {
      seen.add(d.kind());
      checkNode(d, SwiftPrinter.print(d));
      if (d instanceof StructDeclaration) {
        for (PropertyDeclaration p: ((StructDeclaration) d).properties()) {
          props.add(p.kind());
        }
      } else if (d instanceof ClassDeclaration) {
        for (PropertyDeclaration p: ((ClassDeclaration) d).properties()) {
          props.add(p.kind());
        }
      }
    }
    assertEquals(EnumSet.allOf(DeclKind.class), seen);
    assertEquals(EnumSet.allOf(PropertyKind.class), props);
  }

  private static void checkNode(SyntaxNode node, String printed)
      throws Exception {
    assertFalse(printed.isEmpty());
    assertTrue(SyntaxWalker.countNodes(node) >= 1);
    SyntaxWalker.checkExclusiveOwnership(node);
  }
}
