package exm.swiftsyntax.tree;

import static exm.swiftsyntax.tree.Expressions.binary;
import static exm.swiftsyntax.tree.Expressions.boolLit;
import static exm.swiftsyntax.tree.Expressions.call;
import static exm.swiftsyntax.tree.Expressions.identifier;
import static exm.swiftsyntax.tree.Expressions.intLit;
import static exm.swiftsyntax.tree.Expressions.member;
import static exm.swiftsyntax.tree.Expressions.stringLit;
import static exm.swiftsyntax.tree.Statements.assign;
import static exm.swiftsyntax.tree.Statements.expr;
import static exm.swiftsyntax.tree.Statements.returnStmt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.swiftsyntax.tree.Declarations.ClassDeclaration;
import exm.swiftsyntax.tree.Declarations.ComputedProperty;
import exm.swiftsyntax.tree.Declarations.Declaration;
import exm.swiftsyntax.tree.Declarations.DeinitializerDeclaration;
import exm.swiftsyntax.tree.Declarations.EnumAssociatedValue;
import exm.swiftsyntax.tree.Declarations.EnumCase;
import exm.swiftsyntax.tree.Declarations.EnumDeclaration;
import exm.swiftsyntax.tree.Declarations.ExtensionDeclaration;
import exm.swiftsyntax.tree.Declarations.FunDeclaration;
import exm.swiftsyntax.tree.Declarations.FunctionParameter;
import exm.swiftsyntax.tree.Declarations.GenericsDeclaration;
import exm.swiftsyntax.tree.Declarations.ImportDeclaration;
import exm.swiftsyntax.tree.Declarations.InitializerDeclaration;
import exm.swiftsyntax.tree.Declarations.InitializerRequirement;
import exm.swiftsyntax.tree.Declarations.LetDeclaration;
import exm.swiftsyntax.tree.Declarations.MethodRequirement;
import exm.swiftsyntax.tree.Declarations.PropertyDeclaration;
import exm.swiftsyntax.tree.Declarations.PropertyRequirement;
import exm.swiftsyntax.tree.Declarations.PropertySetter;
import exm.swiftsyntax.tree.Declarations.ProtocolDeclaration;
import exm.swiftsyntax.tree.Declarations.StoredProperty;
import exm.swiftsyntax.tree.Declarations.StructDeclaration;
import exm.swiftsyntax.tree.Declarations.TypeAliasDeclaration;
import exm.swiftsyntax.tree.Declarations.TypeParameter;
import exm.swiftsyntax.tree.Declarations.VarDeclaration;
import exm.swiftsyntax.tree.Expressions.Argument;
import exm.swiftsyntax.tree.Expressions.ArrayExpression;
import exm.swiftsyntax.tree.Expressions.AssignmentExpression;
import exm.swiftsyntax.tree.Expressions.CallExpression;
import exm.swiftsyntax.tree.Expressions.CastKind;
import exm.swiftsyntax.tree.Expressions.ClosureExpression;
import exm.swiftsyntax.tree.Expressions.ClosureParameter;
import exm.swiftsyntax.tree.Expressions.ConditionalExpression;
import exm.swiftsyntax.tree.Expressions.DictionaryEntry;
import exm.swiftsyntax.tree.Expressions.DictionaryExpression;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Expressions.KeyPathExpression;
import exm.swiftsyntax.tree.Expressions.PatternMatchExpression;
import exm.swiftsyntax.tree.Expressions.SelfExpression;
import exm.swiftsyntax.tree.Expressions.SubscriptExpression;
import exm.swiftsyntax.tree.Expressions.SuperExpression;
import exm.swiftsyntax.tree.Expressions.TrailingClosure;
import exm.swiftsyntax.tree.Expressions.TupleExpression;
import exm.swiftsyntax.tree.Expressions.TypeCastingExpression;
import exm.swiftsyntax.tree.ImportSymbol.SymbolKind;
import exm.swiftsyntax.tree.Patterns.Pattern;
import exm.swiftsyntax.tree.Patterns.TuplePattern;
import exm.swiftsyntax.tree.Patterns.TypePattern;
import exm.swiftsyntax.tree.Statements.BreakStatement;
import exm.swiftsyntax.tree.Statements.Case;
import exm.swiftsyntax.tree.Statements.ContinueStatement;
import exm.swiftsyntax.tree.Statements.DoCatchStatement;
import exm.swiftsyntax.tree.Statements.ForLoopStatement;
import exm.swiftsyntax.tree.Statements.ForLoopStatement.RangeKind;
import exm.swiftsyntax.tree.Statements.GuardStatement;
import exm.swiftsyntax.tree.Statements.IfStatement;
import exm.swiftsyntax.tree.Statements.RepeatWhileLoopStatement;
import exm.swiftsyntax.tree.Statements.ReturnStatement;
import exm.swiftsyntax.tree.Statements.Statement;
import exm.swiftsyntax.tree.Statements.SwitchStatement;
import exm.swiftsyntax.tree.Statements.ThrowStatement;
import exm.swiftsyntax.tree.Statements.WhileLoopStatement;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;

/**
 * Trees shared by tests.  Every call builds new node objects, so
 * samples never share subtrees.
 */
public class SampleTrees {

  /** let a: Int = 5 */
  public static LetDeclaration corpusLet() {
    return new LetDeclaration("a", SwiftTypes.intType(), intLit(5));
  }

  /** func greet(person: String, loudly: Bool = false) -> String */
  public static FunDeclaration corpusGreet() {
    List<FunctionParameter> params = Arrays.asList(
        FunctionParameter.simple("person", SwiftTypes.stringType()),
        new FunctionParameter(null, "loudly", SwiftTypes.boolType(),
                              boolLit(false), false, false));
    return new FunDeclaration("greet", null, params,
        SwiftTypes.stringType(), false, AccessControl.INTERNAL,
        StatementSequence.of(returnStmt(identifier("person"))));
  }

  /** switch value { case .some(let x): return x default: return 0 } */
  public static SwitchStatement corpusSwitch() {
    Case someCase = new Case(
        Arrays.<Pattern>asList(Patterns.enumCase(null, "some",
                                                 Patterns.binding("x"))),
        null, StatementSequence.of(returnStmt(identifier("x"))));
    return new SwitchStatement(identifier("value"),
        Arrays.asList(someCase),
        StatementSequence.of(returnStmt(intLit(0))));
  }

  /** class Dog: Animal { var name: String; init(name: String) {...} } */
  public static ClassDeclaration corpusDog() {
    StatementSequence initBody = StatementSequence.of(
        assign(member(new SelfExpression(), "name"), identifier("name")),
        expr(call(member(new SuperExpression(), "init"))));
    InitializerDeclaration init = new InitializerDeclaration(null,
        Arrays.asList(FunctionParameter.simple("name",
                                               SwiftTypes.stringType())),
        initBody, false, false, AccessControl.INTERNAL);
    return new ClassDeclaration("Dog", null, "Animal",
        Collections.<String>emptyList(),
        Arrays.<PropertyDeclaration>asList(new StoredProperty(false, "name",
                                           SwiftTypes.stringType(), null)),
        Collections.<FunDeclaration>emptyList(), Arrays.asList(init), null);
  }

  public static List<SwiftType> allTypes() {
    return Arrays.<SwiftType>asList(
        SwiftTypes.intType(),
        SwiftTypes.optional(SwiftTypes.stringType()),
        SwiftTypes.array(SwiftTypes.floatType()),
        SwiftTypes.dictionary(SwiftTypes.stringType(),
                              SwiftTypes.boolType()),
        SwiftTypes.tuple(SwiftTypes.intType(), SwiftTypes.characterType()),
        SwiftTypes.function(Arrays.<SwiftType>asList(SwiftTypes.intType()),
                            SwiftTypes.boolType()),
        SwiftTypes.custom("Animal"));
  }

  public static ClosureExpression closure() {
    return new ClosureExpression(
        Arrays.asList(new ClosureParameter("x", SwiftTypes.intType())),
        SwiftTypes.intType(), true,
        StatementSequence.of(returnStmt(binary(identifier("x"), "*",
                                               intLit(2)))));
  }

  public static CallExpression callWithEverything() {
    return new CallExpression(identifier("transform"),
        Arrays.asList(Argument.labelled("over", identifier("xs")),
                      new Argument(null, identifier("ys"), true, false),
                      new Argument("into", identifier("out"), false, true)),
        Arrays.<SwiftType>asList(SwiftTypes.intType()),
        Arrays.asList(new TrailingClosure(null, closure()),
                      new TrailingClosure("onError", closure())));
  }

  public static List<Expression> allExpressions() {
    return Arrays.<Expression>asList(
        new SelfExpression(),
        new SuperExpression(),
        identifier("x"),
        stringLit("hello"),
        binary(identifier("a"), "+", intLit(1)),
        Expressions.unary("!", identifier("done")),
        callWithEverything(),
        closure(),
        new SubscriptExpression(identifier("xs"), intLit(0)),
        new ConditionalExpression(identifier("c"), intLit(1), intLit(2)),
        new TupleExpression(Arrays.<Expression>asList(intLit(1),
                                                      stringLit("one"))),
        new ArrayExpression(Arrays.<Expression>asList(intLit(1), intLit(2))),
        new DictionaryExpression(Arrays.asList(
            new DictionaryEntry(stringLit("k"), Expressions.floatLit(1.5)))),
        member(identifier("point"), "x"),
        new TypeCastingExpression(identifier("pet"), CastKind.CONDITIONAL,
                                  SwiftTypes.custom("Dog")),
        new PatternMatchExpression(identifier("range"), identifier("n")),
        new KeyPathExpression("Person", Arrays.asList("name", "count")),
        new AssignmentExpression(identifier("y"), Expressions.nil()));
  }

  public static List<Pattern> allPatterns() {
    return Arrays.<Pattern>asList(
        Patterns.literal(Literal.createIntLit(1)),
        Patterns.binding("x"),
        new TuplePattern(Arrays.<Pattern>asList(Patterns.binding("a"),
                                                Patterns.wildcard())),
        Patterns.enumCase("Optional", "some", Patterns.binding("v")),
        Patterns.wildcard(),
        new TypePattern(SwiftTypes.custom("Dog")));
  }

  public static List<Statement> allStatements() {
    return Arrays.<Statement>asList(
        new BreakStatement(null),
        new ContinueStatement("outer"),
        expr(call(identifier("run"))),
        Statements.decl(new VarDeclaration("count", null, intLit(0))),
        new ReturnStatement(null),
        new IfStatement(identifier("ok"),
            StatementSequence.of(expr(call(identifier("go")))),
            StatementSequence.of(new BreakStatement(null))),
        new ForLoopStatement("i", RangeKind.HALF_OPEN, intLit(0),
            identifier("n"), StatementSequence.of(
                expr(call(identifier("step"),
                          Argument.unlabelled(identifier("i")))))),
        new WhileLoopStatement(identifier("running"),
            StatementSequence.of(new ContinueStatement(null))),
        new RepeatWhileLoopStatement(StatementSequence.empty(),
            boolLit(false)),
        corpusSwitch(),
        new GuardStatement(identifier("ready"),
            StatementSequence.of(new ReturnStatement(null))),
        new ThrowStatement(member(identifier("Failure"), "timeout")),
        new DoCatchStatement(
            StatementSequence.of(expr(call(identifier("attempt")))),
            StatementSequence.of(expr(call(identifier("recover"))))),
        assign(identifier("total"), binary(identifier("total"), "+",
                                           intLit(1))));
  }

  public static List<Declaration> allDeclarations() {
    List<Declaration> decls = new ArrayList<Declaration>();

    GenericsDeclaration generics = new GenericsDeclaration(Arrays.asList(
        new TypeParameter("T", SwiftTypes.custom("Equatable")),
        new TypeParameter("U", null)));
    decls.add(new FunDeclaration("find", generics,
        Arrays.asList(new FunctionParameter("in", "items",
            SwiftTypes.array(SwiftTypes.custom("T")), null, false, false)),
        SwiftTypes.optional(SwiftTypes.intType()), true,
        AccessControl.PUBLIC,
        StatementSequence.of(returnStmt(Expressions.nil()))));

    decls.add(new VarDeclaration("count", SwiftTypes.intType(), null));
    decls.add(corpusLet());

    decls.add(new StructDeclaration("Rect", null,
        Arrays.asList("Shape"),
        Arrays.<PropertyDeclaration>asList(
            new StoredProperty(true, "width", SwiftTypes.floatType(),
                               Expressions.floatLit(1.0)),
            new ComputedProperty("area", SwiftTypes.floatType(),
                StatementSequence.of(returnStmt(binary(identifier("width"),
                                        "*", identifier("width")))),
                new PropertySetter("v", StatementSequence.empty()))),
        Arrays.asList(new FunDeclaration("describe", null,
            Collections.<FunctionParameter>emptyList(),
            SwiftTypes.stringType(), false, AccessControl.PRIVATE,
            StatementSequence.of(returnStmt(stringLit("rect"))))),
        Arrays.asList(new InitializerDeclaration(null,
            Collections.<FunctionParameter>emptyList(),
            StatementSequence.empty(), false, false,
            AccessControl.INTERNAL))));

    decls.add(new EnumDeclaration("Planet", null, SwiftTypes.intType(),
        Arrays.asList("CaseIterable"),
        Arrays.asList(
            new EnumCase("mercury", Collections.<EnumAssociatedValue>emptyList(),
                         intLit(1)),
            new EnumCase("venus", Collections.<EnumAssociatedValue>emptyList(),
                         null),
            new EnumCase("rogue", Arrays.asList(
                new EnumAssociatedValue("mass", SwiftTypes.floatType()),
                new EnumAssociatedValue(null, SwiftTypes.stringType())),
                null))));

    decls.add(new ClassDeclaration("Dog", null, "Animal",
        Arrays.asList("Codable"),
        Arrays.<PropertyDeclaration>asList(new StoredProperty(false, "name",
            SwiftTypes.stringType(), stringLit("Rex"))),
        Collections.<FunDeclaration>emptyList(),
        Collections.<InitializerDeclaration>emptyList(),
        new DeinitializerDeclaration(StatementSequence.of(
            expr(call(identifier("cleanup")))))));

    decls.add(new ProtocolDeclaration("Shape", Arrays.asList("Drawable"),
        Arrays.asList(new PropertyRequirement("area",
                                              SwiftTypes.floatType(), true)),
        Arrays.asList(new MethodRequirement("scale",
            Arrays.asList(new FunctionParameter("by", "factor",
                SwiftTypes.floatType(), null, false, false)),
            null, true)),
        Arrays.asList(new InitializerRequirement(
            Arrays.asList(FunctionParameter.simple("size",
                                                   SwiftTypes.intType())),
            true))));

    decls.add(new ExtensionDeclaration("Int",
        Arrays.asList("Describable"),
        Collections.<PropertyDeclaration>emptyList(),
        Arrays.asList(new FunDeclaration("describe", null,
            Collections.<FunctionParameter>emptyList(),
            SwiftTypes.stringType(), false, AccessControl.INTERNAL, null)),
        Collections.<InitializerDeclaration>emptyList()));

    decls.add(new TypeAliasDeclaration("Callback",
        SwiftTypes.function(Collections.<SwiftType>emptyList(),
                            SwiftTypes.custom("Void"))));

    decls.add(new ImportDeclaration("Foundation",
                                    ImportSymbol.entireModule()));
    decls.add(new ImportDeclaration("UIKit",
        ImportSymbol.named(SymbolKind.CLASS, "UIView")));

    decls.add(new InitializerDeclaration(null,
        Arrays.asList(new FunctionParameter(null, "values",
            SwiftTypes.intType(), null, true, false)),
        StatementSequence.of(new ReturnStatement(null)), true, true,
        AccessControl.FILE_PRIVATE));

    decls.add(new DeinitializerDeclaration(StatementSequence.empty()));
    return decls;
  }
}
