package exm.swiftsyntax.walk;

import static exm.swiftsyntax.tree.Expressions.binary;
import static exm.swiftsyntax.tree.Expressions.boolLit;
import static exm.swiftsyntax.tree.Expressions.identifier;
import static exm.swiftsyntax.tree.Expressions.intLit;
import static exm.swiftsyntax.tree.Expressions.unary;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.common.exceptions.MalformedTreeException;
import exm.swiftsyntax.tree.Expressions.BinaryExpression;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.SampleTrees;
import exm.swiftsyntax.tree.StatementSequence;
import exm.swiftsyntax.tree.Statements.IfStatement;
import exm.swiftsyntax.tree.Statements.Statement;
import exm.swiftsyntax.tree.SyntaxNode;

public class SyntaxWalkerTest {

  private static final int DEEP = 10000;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SyntaxWalkerTest.log", true);
  }

  @Test
  public void testDeepUnaryChain() throws Exception {
    Expression e = identifier("x");
    for (int i = 0; i < DEEP; i++) {
      e = unary("-", e);
    }
    assertEquals(DEEP + 1, SyntaxWalker.countNodes(e));
    assertEquals(DEEP, SyntaxWalker.maxDepth(e));
    SyntaxWalker.checkExclusiveOwnership(e);
  }

  @Test
  public void testDeepIfNesting() throws Exception {
    Statement s = new IfStatement(boolLit(true), StatementSequence.empty(),
                                  null);
    for (int i = 1; i < DEEP; i++) {
      s = new IfStatement(boolLit(true), StatementSequence.of(s), null);
    }
    StatementSequence root = StatementSequence.of(s);
    // Each level: if, condition, body
    assertEquals(3 * DEEP + 1, SyntaxWalker.countNodes(root));
    assertEquals(2 * DEEP, SyntaxWalker.maxDepth(root));
    SyntaxWalker.checkExclusiveOwnership(root);
  }

  private static Expression negationChain(Expression leaf, int depth) {
    Expression e = leaf;
    for (int i = 0; i < depth; i++) {
      e = unary("-", e);
    }
    return e;
  }

  @Test
  public void testDeepChainEquality() {
    Expression a = negationChain(identifier("x"), DEEP);
    Expression b = negationChain(identifier("x"), DEEP);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    // Cached hash is stable
    assertEquals(a.hashCode(), a.hashCode());

    Expression c = negationChain(identifier("y"), DEEP);
    assertNotEquals(a, c);
    assertNotEquals(c, a);
    Expression shorter = negationChain(identifier("x"), DEEP - 1);
    assertNotEquals(a, shorter);
  }

  @Test
  public void testDeepNestingEquality() {
    Statement s1 = new IfStatement(boolLit(true), StatementSequence.empty(),
                                   null);
    Statement s2 = new IfStatement(boolLit(true), StatementSequence.empty(),
                                   null);
    for (int i = 1; i < DEEP; i++) {
      s1 = new IfStatement(boolLit(true), StatementSequence.of(s1), null);
      s2 = new IfStatement(boolLit(true), StatementSequence.of(s2), null);
    }
    assertEquals(s1.hashCode(), s2.hashCode());
    assertEquals(s1, s2);
    Statement s3 = new IfStatement(boolLit(false), StatementSequence.of(s2),
                                   null);
    assertNotEquals(new IfStatement(boolLit(true), StatementSequence.of(s1),
                                    null), s3);
  }

  @Test
  public void testDeeperThan() {
    Expression e = negationChain(identifier("x"), DEEP);
    assertTrue(SyntaxWalker.deeperThan(e, DEEP - 1));
    assertFalse(SyntaxWalker.deeperThan(e, DEEP));
    assertFalse(SyntaxWalker.deeperThan(identifier("x"), 0));
    assertEquals(1000, SyntaxWalker.depthLimit());
  }

  @Test
  public void testPreOrder() {
    Expression a = identifier("a");
    Expression b = identifier("b");
    Expression c = intLit(1);
    BinaryExpression inner = binary(a, "+", b);
    BinaryExpression root = binary(inner, "*", c);

    final List<SyntaxNode> nodes = new ArrayList<SyntaxNode>();
    final List<Integer> depths = new ArrayList<Integer>();
    SyntaxWalker.walk(root, new SyntaxWalker.Listener() {
      @Override
      public void visit(SyntaxNode node, int depth) {
        nodes.add(node);
        depths.add(depth);
      }
    });

    assertEquals(5, nodes.size());
    assertSame(root, nodes.get(0));
    assertSame(inner, nodes.get(1));
    assertSame(a, nodes.get(2));
    assertSame(b, nodes.get(3));
    assertSame(c, nodes.get(4));
    assertEquals(0, (int) depths.get(0));
    assertEquals(1, (int) depths.get(1));
    assertEquals(2, (int) depths.get(2));
    assertEquals(2, (int) depths.get(3));
    assertEquals(1, (int) depths.get(4));
  }

  @Test
  public void testSingleNode() {
    assertEquals(1, SyntaxWalker.countNodes(identifier("x")));
    assertEquals(0, SyntaxWalker.maxDepth(identifier("x")));
    assertEquals(1, SyntaxWalker.countNodes(StatementSequence.empty()));
  }

  @Test
  public void testSharedSubtreeDetected() {
    Expression shared = binary(identifier("a"), "+", identifier("b"));
    Expression root = binary(shared, "*", unary("-", shared));
    try {
      SyntaxWalker.checkExclusiveOwnership(root);
      fail("Shared subtree should be detected");
    } catch (MalformedTreeException e) {
      assertTrue(e.getMessage(),
                 e.getMessage().contains("BinaryExpression"));
    }
  }

  @Test
  public void testSharedStatementDetected() {
    Statement stmt = new IfStatement(boolLit(false),
                                     StatementSequence.empty(), null);
    StatementSequence seq = StatementSequence.of(stmt, stmt);
    try {
      SyntaxWalker.checkExclusiveOwnership(seq);
      fail("Shared statement should be detected");
    } catch (MalformedTreeException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("depth 1"));
    }
  }

  @Test
  public void testEqualDistinctSubtreesAllowed() throws Exception {
    Expression root = binary(binary(identifier("a"), "+", identifier("b")),
                 "*", binary(identifier("a"), "+", identifier("b")));
    SyntaxWalker.checkExclusiveOwnership(root);
  }

  @Test
  public void testSampleTreesAreExclusivelyOwned() throws Exception {
    SyntaxWalker.checkExclusiveOwnership(SampleTrees.corpusDog());
    SyntaxWalker.checkExclusiveOwnership(SampleTrees.corpusSwitch());
    SyntaxWalker.checkExclusiveOwnership(SampleTrees.callWithEverything());
  }
}
