package exm.swiftsyntax.printer;

import static exm.swiftsyntax.tree.Expressions.binary;
import static exm.swiftsyntax.tree.Expressions.call;
import static exm.swiftsyntax.tree.Expressions.floatLit;
import static exm.swiftsyntax.tree.Expressions.identifier;
import static exm.swiftsyntax.tree.Expressions.intLit;
import static exm.swiftsyntax.tree.Expressions.member;
import static exm.swiftsyntax.tree.Expressions.nil;
import static exm.swiftsyntax.tree.Expressions.stringLit;
import static exm.swiftsyntax.tree.Expressions.unary;
import static exm.swiftsyntax.tree.Statements.assign;
import static exm.swiftsyntax.tree.Statements.decl;
import static exm.swiftsyntax.tree.Statements.expr;
import static exm.swiftsyntax.tree.Statements.returnStmt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.apache.log4j.Level;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.common.Settings;
import exm.swiftsyntax.common.exceptions.SyntaxRuntimeError;
import exm.swiftsyntax.tree.AccessControl;
import exm.swiftsyntax.tree.Declarations.ComputedProperty;
import exm.swiftsyntax.tree.Declarations.EnumAssociatedValue;
import exm.swiftsyntax.tree.Declarations.EnumCase;
import exm.swiftsyntax.tree.Declarations.EnumDeclaration;
import exm.swiftsyntax.tree.Declarations.FunDeclaration;
import exm.swiftsyntax.tree.Declarations.FunctionParameter;
import exm.swiftsyntax.tree.Declarations.ImportDeclaration;
import exm.swiftsyntax.tree.Declarations.InitializerDeclaration;
import exm.swiftsyntax.tree.Declarations.InitializerRequirement;
import exm.swiftsyntax.tree.Declarations.MethodRequirement;
import exm.swiftsyntax.tree.Declarations.PropertyDeclaration;
import exm.swiftsyntax.tree.Declarations.PropertyRequirement;
import exm.swiftsyntax.tree.Declarations.PropertySetter;
import exm.swiftsyntax.tree.Declarations.ProtocolDeclaration;
import exm.swiftsyntax.tree.Declarations.StoredProperty;
import exm.swiftsyntax.tree.Declarations.StructDeclaration;
import exm.swiftsyntax.tree.Expressions.Argument;
import exm.swiftsyntax.tree.Expressions.CallExpression;
import exm.swiftsyntax.tree.Expressions.CastKind;
import exm.swiftsyntax.tree.Expressions.ClosureExpression;
import exm.swiftsyntax.tree.Expressions.ClosureParameter;
import exm.swiftsyntax.tree.Expressions.DictionaryEntry;
import exm.swiftsyntax.tree.Expressions.DictionaryExpression;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Expressions.KeyPathExpression;
import exm.swiftsyntax.tree.Expressions.TrailingClosure;
import exm.swiftsyntax.tree.Expressions.TypeCastingExpression;
import exm.swiftsyntax.tree.ImportSymbol;
import exm.swiftsyntax.tree.ImportSymbol.SymbolKind;
import exm.swiftsyntax.tree.Literal;
import exm.swiftsyntax.tree.Patterns;
import exm.swiftsyntax.tree.Patterns.Pattern;
import exm.swiftsyntax.tree.Patterns.TuplePattern;
import exm.swiftsyntax.tree.SampleTrees;
import exm.swiftsyntax.tree.StatementSequence;
import exm.swiftsyntax.tree.Statements.BreakStatement;
import exm.swiftsyntax.tree.Statements.Case;
import exm.swiftsyntax.tree.Statements.DoCatchStatement;
import exm.swiftsyntax.tree.Statements.ForLoopStatement;
import exm.swiftsyntax.tree.Statements.GuardStatement;
import exm.swiftsyntax.tree.Statements.IfStatement;
import exm.swiftsyntax.tree.Statements.RepeatWhileLoopStatement;
import exm.swiftsyntax.tree.Statements.ReturnStatement;
import exm.swiftsyntax.tree.Statements.SwitchStatement;
import exm.swiftsyntax.tree.Statements.WhileLoopStatement;
import exm.swiftsyntax.tree.SwiftTypes;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;

public class SwiftPrinterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SwiftPrinterTest.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testCorpusLet() {
    assertEquals("let a: Int = 5",
                 SwiftPrinter.print(SampleTrees.corpusLet()));
  }

  @Test
  public void testCorpusFunction() {
    assertEquals("func greet(person: String, loudly: Bool = false) " +
                 "-> String {\n" +
                 "    return person\n" +
                 "}",
                 SwiftPrinter.print(SampleTrees.corpusGreet()));
  }

  @Test
  public void testCorpusSwitch() {
    assertEquals("switch value {\n" +
                 "case .some(let x):\n" +
                 "    return x\n" +
                 "default:\n" +
                 "    return 0\n" +
                 "}",
                 SwiftPrinter.print(SampleTrees.corpusSwitch()));
  }

  @Test
  public void testCorpusClass() {
    assertEquals("class Dog: Animal {\n" +
                 "    var name: String\n" +
                 "    init(name: String) {\n" +
                 "        self.name = name\n" +
                 "        super.init()\n" +
                 "    }\n" +
                 "}",
                 SwiftPrinter.print(SampleTrees.corpusDog()));
  }

  @Test
  public void testToStringUsesPrinter() {
    assertEquals("let a: Int = 5", SampleTrees.corpusLet().toString());
    assertEquals("[String: Int]",
        SwiftTypes.dictionary(SwiftTypes.stringType(),
                              SwiftTypes.intType()).toString());
  }

  @Test
  public void testIndentWidthSetting() {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "2");
    assertEquals("func greet(person: String, loudly: Bool = false) " +
                 "-> String {\n" +
                 "  return person\n" +
                 "}",
                 SwiftPrinter.print(SampleTrees.corpusGreet()));
  }

  @Test
  public void testBadIndentWidthFallsBack() {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "wide");
    assertEquals("while x {\n    break\n}",
        SwiftPrinter.print(new WhileLoopStatement(identifier("x"),
                StatementSequence.of(new BreakStatement(null)))));
  }

  @Test
  public void testElseIfChain() {
    IfStatement inner = new IfStatement(identifier("b"),
        StatementSequence.of(expr(identifier("y"))),
        StatementSequence.of(expr(identifier("z"))));
    IfStatement outer = new IfStatement(identifier("a"),
        StatementSequence.of(expr(identifier("x"))),
        StatementSequence.of(inner));
    assertEquals("if a {\n" +
                 "    x\n" +
                 "} else if b {\n" +
                 "    y\n" +
                 "} else {\n" +
                 "    z\n" +
                 "}",
                 SwiftPrinter.print(outer));
  }

  @Test
  public void testElseWithIfAndMoreIsABlock() {
    IfStatement inner = new IfStatement(identifier("b"),
        StatementSequence.of(expr(identifier("y"))), null);
    IfStatement outer = new IfStatement(identifier("a"),
        StatementSequence.empty(),
        StatementSequence.of(inner, new BreakStatement(null)));
    assertEquals("if a {\n" +
                 "} else {\n" +
                 "    if b {\n" +
                 "        y\n" +
                 "    }\n" +
                 "    break\n" +
                 "}",
                 SwiftPrinter.print(outer));
  }

  @Test
  public void testParenthesizesCompoundOperands() {
    Expression sumTimes = binary(binary(identifier("a"), "+", identifier("b")),
                                 "*", identifier("c"));
    assertEquals("(a + b) * c", SwiftPrinter.print(sumTimes));

    Expression plusProduct = binary(identifier("a"), "+",
        binary(identifier("b"), "*", identifier("c")));
    assertEquals("a + (b * c)", SwiftPrinter.print(plusProduct));

    assertEquals("-(a + b)", SwiftPrinter.print(
        unary("-", binary(identifier("a"), "+", identifier("b")))));
    assertEquals("-(-x)",
                 SwiftPrinter.print(unary("-", unary("-", identifier("x")))));
    assertEquals("-x + 1", SwiftPrinter.print(
        binary(unary("-", identifier("x")), "+", intLit(1))));

    Expression cast = new TypeCastingExpression(
        binary(identifier("a"), "??", identifier("b")),
        CastKind.CONDITIONAL, SwiftTypes.custom("Dog"));
    assertEquals("(a ?? b) as? Dog", SwiftPrinter.print(cast));
    assertEquals("((a ?? b) as? Dog).bark()", SwiftPrinter.print(
        call(member(cast, "bark"))));
  }

  @Test
  public void testCallShapes() {
    CallExpression plain = call(identifier("move"),
        Argument.unlabelled(identifier("piece")),
        Argument.labelled("to", intLit(3)),
        new Argument(null, identifier("buffer"), false, true));
    assertEquals("move(piece, to: 3, &buffer)", SwiftPrinter.print(plain));

    CallExpression generic = new CallExpression(identifier("decode"),
        Collections.<Argument>emptyList(),
        Arrays.<SwiftType>asList(SwiftTypes.custom("User")),
        Collections.<TrailingClosure>emptyList());
    assertEquals("decode<User>()", SwiftPrinter.print(generic));
  }

  @Test
  public void testTrailingClosures() {
    ClosureExpression work = new ClosureExpression(
        Collections.<ClosureParameter>emptyList(), null, false,
        StatementSequence.of(expr(call(identifier("work")))));
    ClosureExpression done = new ClosureExpression(
        Collections.<ClosureParameter>emptyList(), null, true,
        StatementSequence.of(expr(call(identifier("done")))));
    CallExpression run = new CallExpression(identifier("run"),
        Collections.<Argument>emptyList(), null,
        Arrays.asList(new TrailingClosure(null, work),
                      new TrailingClosure("completion", done)));
    assertEquals("run {\n" +
                 "    work()\n" +
                 "} completion: {\n" +
                 "    done()\n" +
                 "}",
                 SwiftPrinter.print(run));
  }

  @Test
  public void testLabelledFirstTrailingClosure() {
    ClosureExpression work = new ClosureExpression(
        Collections.<ClosureParameter>emptyList(), null, false,
        StatementSequence.of(expr(call(identifier("work")))));
    CallExpression run = new CallExpression(identifier("run"),
        Collections.<Argument>emptyList(), null,
        Arrays.asList(new TrailingClosure("body", work)));
    assertEquals("run {\n    work()\n}", SwiftPrinter.print(run));
    // Dropped label is reported
    assertFalse(Logging.addEmitted(Level.WARN, "Label \"body\" of the " +
        "first trailing closure is not printed: Swift has no syntax for it"));
  }

  @Test
  public void testClosureSignatures() {
    ClosureExpression untyped = new ClosureExpression(
        Arrays.asList(new ClosureParameter("a", null),
                      new ClosureParameter("b", null)),
        null, false,
        StatementSequence.of(returnStmt(binary(identifier("a"), "<",
                                               identifier("b")))));
    assertEquals("{ a, b in\n    return a < b\n}",
                 SwiftPrinter.print(untyped));

    assertEquals("{ (x: Int) -> Int in\n    return x * 2\n}",
                 SwiftPrinter.print(SampleTrees.closure()));
  }

  @Test
  public void testLiterals() {
    assertEquals("\"a\\\"b\\\\c\\n\\t\"",
                 SwiftPrinter.print(stringLit("a\"b\\c\n\t")));
    assertEquals("\"\\0\\u{1}\\r\"",
                 SwiftPrinter.print(stringLit("\u0000\u0001\r")));
    assertEquals("\"é\"", SwiftPrinter.print(stringLit("é")));
    assertEquals("2.5", SwiftPrinter.print(floatLit(2.5)));
    assertEquals("Double.infinity",
                 SwiftPrinter.print(floatLit(Double.POSITIVE_INFINITY)));
    assertEquals("-Double.infinity",
                 SwiftPrinter.print(floatLit(Double.NEGATIVE_INFINITY)));
    assertEquals("Double.nan", SwiftPrinter.print(floatLit(Double.NaN)));
    assertEquals("-42", SwiftPrinter.print(intLit(-42)));
    assertEquals("nil",
                 SwiftPrinter.print(nil()));
    assertEquals("\"x\"", SwiftPrinter.print(Patterns.literal(
                                     Literal.createCharLit('x'))));
  }

  @Test
  public void testCollections() {
    assertEquals("[:]", SwiftPrinter.print(new DictionaryExpression(
        Collections.<DictionaryEntry>emptyList())));
    assertEquals("[\"a\": 1, \"b\": 2]", SwiftPrinter.print(
        new DictionaryExpression(Arrays.asList(
            new DictionaryEntry(stringLit("a"), intLit(1)),
            new DictionaryEntry(stringLit("b"), intLit(2))))));
    assertEquals("\\Person.name.count", SwiftPrinter.print(
        new KeyPathExpression("Person", Arrays.asList("name", "count"))));
    assertEquals("\\.count", SwiftPrinter.print(
        new KeyPathExpression(null, Arrays.asList("count"))));
  }

  @Test
  public void testTypes() {
    assertEquals("(() -> Int)?", SwiftPrinter.print(SwiftTypes.optional(
        SwiftTypes.function(Collections.<SwiftType>emptyList(),
                            SwiftTypes.intType()))));
    assertEquals("[[String]]", SwiftPrinter.print(
        SwiftTypes.array(SwiftTypes.array(SwiftTypes.stringType()))));
    assertEquals("(Int, Character)", SwiftPrinter.print(
        SwiftTypes.tuple(SwiftTypes.intType(),
                         SwiftTypes.characterType())));
  }

  @Test
  public void testPatterns() {
    Pattern p = new TuplePattern(Arrays.<Pattern>asList(
        Patterns.binding("a"), Patterns.wildcard(),
        Patterns.enumCase("Color", "red")));
    assertEquals("(let a, _, Color.red)", SwiftPrinter.print(p));
  }

  @Test
  public void testOtherStatements() {
    assertEquals("for i in 0..<n {\n}", SwiftPrinter.print(
        new ForLoopStatement("i", ForLoopStatement.RangeKind.HALF_OPEN,
            intLit(0), identifier("n"), StatementSequence.empty())));
    assertEquals("for i in 1...(n - 1) {\n}", SwiftPrinter.print(
        new ForLoopStatement("i", intLit(1),
            binary(identifier("n"), "-", intLit(1)),
            StatementSequence.empty())));
    assertEquals("repeat {\n    tick()\n} while running",
        SwiftPrinter.print(new RepeatWhileLoopStatement(
            StatementSequence.of(expr(call(identifier("tick")))),
            identifier("running"))));
    assertEquals("guard ok else {\n    return\n}",
        SwiftPrinter.print(new GuardStatement(identifier("ok"),
            StatementSequence.of(new ReturnStatement(null)))));
    assertEquals("do {\n    try()\n} catch {\n    log()\n}",
        SwiftPrinter.print(new DoCatchStatement(
            StatementSequence.of(expr(call(identifier("try")))),
            StatementSequence.of(expr(call(identifier("log")))))));
  }

  @Test
  public void testStatementSequence() {
    assertEquals("let a: Int = 5\nreturn a", SwiftPrinter.print(
        StatementSequence.of(
            decl(SampleTrees.corpusLet()),
            returnStmt(identifier("a")))));
    assertEquals("", SwiftPrinter.print(StatementSequence.empty()));
  }

  @Test
  public void testFunctionWithoutBody() {
    FunDeclaration requirement = new FunDeclaration("area", null,
        Collections.<FunctionParameter>emptyList(), SwiftTypes.floatType(),
        false, AccessControl.INTERNAL, null);
    assertEquals("func area() -> Float", SwiftPrinter.print(requirement));

    FunDeclaration empty = new FunDeclaration("reset", null,
        Collections.<FunctionParameter>emptyList(), null, true,
        AccessControl.PUBLIC, StatementSequence.empty());
    assertEquals("public func reset() throws {\n}",
                 SwiftPrinter.print(empty));
  }

  @Test
  public void testParameterShapes() {
    FunDeclaration f = new FunDeclaration("sum", null, Arrays.asList(
        new FunctionParameter("_", "values", SwiftTypes.intType(), null,
                              true, false),
        new FunctionParameter("into", "total", SwiftTypes.intType(), null,
                              false, true),
        new FunctionParameter("same", "same", SwiftTypes.intType(), null,
                              false, false)),
        null, false, AccessControl.INTERNAL, null);
    assertEquals("func sum(_ values: Int..., into total: inout Int, " +
                 "same same: Int)", SwiftPrinter.print(f));
  }

  @Test
  public void testLabelEqualToNameIsKept() {
    FunDeclaration greet = new FunDeclaration("greet", null, Arrays.asList(
        new FunctionParameter("person", "person", SwiftTypes.stringType(),
                              null, false, false)),
        null, false, AccessControl.INTERNAL, null);
    assertEquals("func greet(person person: String)",
                 SwiftPrinter.print(greet));
    FunDeclaration unlabelled = new FunDeclaration("greet", null,
        Arrays.asList(FunctionParameter.simple("person",
                                               SwiftTypes.stringType())),
        null, false, AccessControl.INTERNAL, null);
    assertEquals("func greet(person: String)",
                 SwiftPrinter.print(unlabelled));
  }

  @Test
  public void testNegativeLiteralOperands() {
    assertEquals("-(-5)", SwiftPrinter.print(unary("-", intLit(-5))));
    assertEquals("-(-0.0)", SwiftPrinter.print(unary("-", floatLit(-0.0))));
    assertEquals("-5", SwiftPrinter.print(unary("-", intLit(5))));
    assertEquals("(-5).magnitude",
                 SwiftPrinter.print(member(intLit(-5), "magnitude")));
    assertEquals("(-2.5).rounded()",
        SwiftPrinter.print(call(member(floatLit(-2.5), "rounded"))));
    assertEquals("(-Double.infinity).isFinite", SwiftPrinter.print(
        member(floatLit(Double.NEGATIVE_INFINITY), "isFinite")));
    assertEquals("Double.nan.isNaN",
        SwiftPrinter.print(member(floatLit(Double.NaN), "isNaN")));
    assertEquals("a - -5",
        SwiftPrinter.print(binary(identifier("a"), "-", intLit(-5))));
  }

  @Test
  public void testInitializerModifiers() {
    InitializerDeclaration init = new InitializerDeclaration(null,
        Collections.<FunctionParameter>emptyList(),
        StatementSequence.empty(), true, true, AccessControl.PRIVATE);
    assertEquals("private convenience init?() {\n}",
                 SwiftPrinter.print(init));
  }

  @Test
  public void testComputedProperties() {
    StructDeclaration rect = new StructDeclaration("Rect", null,
        Collections.<String>emptyList(),
        Arrays.<PropertyDeclaration>asList(
            new StoredProperty(false, "w", SwiftTypes.floatType(), null),
            new ComputedProperty("area", SwiftTypes.floatType(),
                StatementSequence.of(returnStmt(binary(identifier("w"), "*",
                                                       identifier("w")))),
                null),
            new ComputedProperty("side", SwiftTypes.floatType(),
                StatementSequence.of(returnStmt(identifier("w"))),
                new PropertySetter("v", StatementSequence.of(
                    assign(identifier("w"), identifier("v")))))),
        Collections.<FunDeclaration>emptyList(),
        Collections.<InitializerDeclaration>emptyList());
    assertEquals("struct Rect {\n" +
                 "    var w: Float\n" +
                 "    var area: Float {\n" +
                 "        return w * w\n" +
                 "    }\n" +
                 "    var side: Float {\n" +
                 "        get {\n" +
                 "            return w\n" +
                 "        }\n" +
                 "        set(v) {\n" +
                 "            w = v\n" +
                 "        }\n" +
                 "    }\n" +
                 "}",
                 SwiftPrinter.print(rect));
  }

  @Test
  public void testEnum() {
    EnumDeclaration planet = new EnumDeclaration("Planet", null,
        SwiftTypes.intType(), Arrays.asList("CaseIterable"),
        Arrays.asList(
            new EnumCase("mercury",
                Collections.<EnumAssociatedValue>emptyList(), intLit(1)),
            new EnumCase("venus",
                Collections.<EnumAssociatedValue>emptyList(), null)));
    assertEquals("enum Planet: Int, CaseIterable {\n" +
                 "    case mercury = 1\n" +
                 "    case venus\n" +
                 "}",
                 SwiftPrinter.print(planet));
  }

  @Test
  public void testEnumCaseWithAssociatedValuesAndRawValue() {
    // Not legal Swift, but representable; printed as given
    EnumDeclaration odd = new EnumDeclaration("Odd", null, null,
        Collections.<String>emptyList(),
        Arrays.asList(new EnumCase("both", Arrays.asList(
            new EnumAssociatedValue("n", SwiftTypes.intType())),
            intLit(1))));
    assertEquals("enum Odd {\n    case both(n: Int) = 1\n}",
                 SwiftPrinter.print(odd));
  }

  @Test
  public void testProtocol() {
    ProtocolDeclaration shape = new ProtocolDeclaration("Shape",
        Arrays.asList("Drawable"),
        Arrays.asList(new PropertyRequirement("area",
                                              SwiftTypes.floatType(), true),
                      new PropertyRequirement("name",
                                              SwiftTypes.stringType(), false)),
        Arrays.asList(new MethodRequirement("scale",
            Arrays.asList(new FunctionParameter("by", "factor",
                SwiftTypes.floatType(), null, false, false)),
            null, true)),
        Arrays.asList(new InitializerRequirement(Arrays.asList(
            FunctionParameter.simple("size", SwiftTypes.intType())), true)));
    assertEquals("protocol Shape: Drawable {\n" +
                 "    var area: Float { get }\n" +
                 "    var name: String { get set }\n" +
                 "    init?(size: Int)\n" +
                 "    mutating func scale(by factor: Float)\n" +
                 "}",
                 SwiftPrinter.print(shape));
  }

  @Test
  public void testImports() {
    assertEquals("import Foundation", SwiftPrinter.print(
        new ImportDeclaration("Foundation", ImportSymbol.entireModule())));
    assertEquals("import class UIKit.UIView", SwiftPrinter.print(
        new ImportDeclaration("UIKit",
            ImportSymbol.named(SymbolKind.CLASS, "UIView"))));
  }

  @Test
  public void testEmptyCaseBodyWarns() {
    SwitchStatement sw = new SwitchStatement(identifier("code"),
        Arrays.asList(new Case(Arrays.<Pattern>asList(
                                 Patterns.literal(Literal.createIntLit(404))),
                               null, StatementSequence.empty()),
                      new Case(Arrays.<Pattern>asList(
                                 Patterns.literal(Literal.createIntLit(500))),
                               null, StatementSequence.of(
                                   new BreakStatement(null)))),
        StatementSequence.empty());
    String text = SwiftPrinter.print(sw);
    assertTrue(text, text.contains("case 404:\n"));
    assertFalse(Logging.addEmitted(Level.WARN, "Switch case \"case 404\" " +
                "has an empty body, which Swift does not allow"));
    assertFalse(Logging.addEmitted(Level.WARN, "Switch case \"default\" " +
                "has an empty body, which Swift does not allow"));
    // Non-empty cases are not reported
    assertTrue(Logging.addEmitted(Level.WARN, "Switch case \"case 500\" " +
                "has an empty body, which Swift does not allow"));
  }

  private static Expression negationChain(int depth) {
    Expression e = identifier("x");
    for (int i = 0; i < depth; i++) {
      e = unary("-", e);
    }
    return e;
  }

  @Test
  public void testTooDeepToPrint() {
    Expression deep = negationChain(10000);
    try {
      SwiftPrinter.print(deep);
      fail("Expected depth limit to be enforced");
    } catch (SyntaxRuntimeError e) {
      assertTrue(e.getMessage(),
                 e.getMessage().contains(Settings.MAX_DEPTH));
    }
    // toString summarizes instead of failing, so assertion messages work
    assertEquals("<UnaryExpression: 10001 nodes, deeper than " +
                 "swiftsyntax.max-depth 1000>", deep.toString());
    StatementSequence seq = StatementSequence.of(expr(deep));
    assertTrue(seq.toString(), seq.toString().startsWith(
                                      "<StatementSequence: 10003 nodes"));
  }

  @Test
  public void testDepthLimitSetting() {
    Settings.set(Settings.MAX_DEPTH, "3");
    assertEquals("-(-(-x))", SwiftPrinter.print(negationChain(3)));
    try {
      SwiftPrinter.print(negationChain(4));
      fail("Expected depth limit to be enforced");
    } catch (SyntaxRuntimeError e) {
      assertTrue(e.getMessage(), e.getMessage().contains("3"));
    }
    Settings.set(Settings.MAX_DEPTH, "500");
    // "-(" and ")" per level, "-x" innermost
    assertEquals(500 * 3 - 1,
                 SwiftPrinter.print(negationChain(500)).length());
  }

  @Test
  public void testEverySampleHasOutput() {
    for (SwiftType t: SampleTrees.allTypes()) {
      assertFalse(SwiftPrinter.print(t).isEmpty());
    }
    for (Expression e: SampleTrees.allExpressions()) {
      assertFalse(SwiftPrinter.print(e).isEmpty());
    }
  }
}
