/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.swiftsyntax.serialize;

import java.util.List;

import org.apache.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.common.Settings;
import exm.swiftsyntax.common.exceptions.InvalidOptionException;
import exm.swiftsyntax.common.exceptions.MalformedTreeException;
import exm.swiftsyntax.common.exceptions.SyntaxRuntimeError;
import exm.swiftsyntax.tree.Declarations;
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
import exm.swiftsyntax.tree.Declarations.ProtocolDeclaration;
import exm.swiftsyntax.tree.Declarations.StoredProperty;
import exm.swiftsyntax.tree.Declarations.StructDeclaration;
import exm.swiftsyntax.tree.Declarations.TypeAliasDeclaration;
import exm.swiftsyntax.tree.Declarations.TypeParameter;
import exm.swiftsyntax.tree.Declarations.VarDeclaration;
import exm.swiftsyntax.tree.Expressions;
import exm.swiftsyntax.tree.Expressions.Argument;
import exm.swiftsyntax.tree.Expressions.ArrayExpression;
import exm.swiftsyntax.tree.Expressions.AssignmentExpression;
import exm.swiftsyntax.tree.Expressions.BinaryExpression;
import exm.swiftsyntax.tree.Expressions.CallExpression;
import exm.swiftsyntax.tree.Expressions.ClosureExpression;
import exm.swiftsyntax.tree.Expressions.ClosureParameter;
import exm.swiftsyntax.tree.Expressions.ConditionalExpression;
import exm.swiftsyntax.tree.Expressions.DictionaryEntry;
import exm.swiftsyntax.tree.Expressions.DictionaryExpression;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Expressions.IdentifierExpression;
import exm.swiftsyntax.tree.Expressions.KeyPathExpression;
import exm.swiftsyntax.tree.Expressions.LiteralExpression;
import exm.swiftsyntax.tree.Expressions.MemberAccessExpression;
import exm.swiftsyntax.tree.Expressions.PatternMatchExpression;
import exm.swiftsyntax.tree.Expressions.SelfExpression;
import exm.swiftsyntax.tree.Expressions.SubscriptExpression;
import exm.swiftsyntax.tree.Expressions.SuperExpression;
import exm.swiftsyntax.tree.Expressions.TrailingClosure;
import exm.swiftsyntax.tree.Expressions.TupleExpression;
import exm.swiftsyntax.tree.Expressions.TypeCastingExpression;
import exm.swiftsyntax.tree.Expressions.UnaryExpression;
import exm.swiftsyntax.tree.ImportSymbol;
import exm.swiftsyntax.tree.Literal;
import exm.swiftsyntax.tree.Patterns;
import exm.swiftsyntax.tree.Patterns.EnumCasePattern;
import exm.swiftsyntax.tree.Patterns.IdentifierPattern;
import exm.swiftsyntax.tree.Patterns.LiteralPattern;
import exm.swiftsyntax.tree.Patterns.Pattern;
import exm.swiftsyntax.tree.Patterns.TuplePattern;
import exm.swiftsyntax.tree.Patterns.TypePattern;
import exm.swiftsyntax.tree.Patterns.WildcardPattern;
import exm.swiftsyntax.tree.StatementSequence;
import exm.swiftsyntax.tree.Statements;
import exm.swiftsyntax.tree.Statements.AssignmentStatement;
import exm.swiftsyntax.tree.Statements.BreakStatement;
import exm.swiftsyntax.tree.Statements.Case;
import exm.swiftsyntax.tree.Statements.ContinueStatement;
import exm.swiftsyntax.tree.Statements.DeclarationStatement;
import exm.swiftsyntax.tree.Statements.DoCatchStatement;
import exm.swiftsyntax.tree.Statements.ExpressionStatement;
import exm.swiftsyntax.tree.Statements.ForLoopStatement;
import exm.swiftsyntax.tree.Statements.GuardStatement;
import exm.swiftsyntax.tree.Statements.IfStatement;
import exm.swiftsyntax.tree.Statements.RepeatWhileLoopStatement;
import exm.swiftsyntax.tree.Statements.ReturnStatement;
import exm.swiftsyntax.tree.Statements.Statement;
import exm.swiftsyntax.tree.Statements.SwitchStatement;
import exm.swiftsyntax.tree.Statements.ThrowStatement;
import exm.swiftsyntax.tree.Statements.WhileLoopStatement;
import exm.swiftsyntax.tree.SwiftTypes;
import exm.swiftsyntax.tree.SwiftTypes.ArrayType;
import exm.swiftsyntax.tree.SwiftTypes.CustomType;
import exm.swiftsyntax.tree.SwiftTypes.DictionaryType;
import exm.swiftsyntax.tree.SwiftTypes.FunctionType;
import exm.swiftsyntax.tree.SwiftTypes.OptionalType;
import exm.swiftsyntax.tree.SwiftTypes.PrimitiveType;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;
import exm.swiftsyntax.tree.SwiftTypes.TupleType;
import exm.swiftsyntax.tree.SyntaxNode;
import exm.swiftsyntax.walk.SyntaxWalker;

/**
 * Converts syntax trees to JSON.
 *
 * Each union value becomes an object whose "kind" field holds the
 * variant's kind name.  Other fields are named after the model's
 * accessors.  Absent optional fields are left out entirely, while
 * empty sequences are written as [].  {@link TreeReader} inverts this.
 */
public class TreeWriter implements SwiftTypes.Visitor<JSONObject>,
    Expressions.Visitor<JSONObject>, Statements.Visitor<JSONObject>,
    Patterns.Visitor<JSONObject>, Declarations.Visitor<JSONObject> {

  private static final Logger logger = Logging.getLogger();

  private static final TreeWriter INSTANCE = new TreeWriter();

  private TreeWriter() {
  }

  public static JSONObject toJSON(Declaration decl)
      throws MalformedTreeException {
    checkTree(decl);
    return decl.accept(INSTANCE);
  }

  public static JSONObject toJSON(Statement stmt)
      throws MalformedTreeException {
    checkTree(stmt);
    return stmt.accept(INSTANCE);
  }

  public static JSONArray toJSON(StatementSequence seq)
      throws MalformedTreeException {
    checkTree(seq);
    return INSTANCE.block(seq);
  }

  public static JSONObject toJSON(Expression expr)
      throws MalformedTreeException {
    checkTree(expr);
    return expr.accept(INSTANCE);
  }

  public static JSONObject toJSON(Pattern pattern)
      throws MalformedTreeException {
    checkTree(pattern);
    return pattern.accept(INSTANCE);
  }

  public static JSONObject toJSON(SwiftType type)
      throws MalformedTreeException {
    checkTree(type);
    return type.accept(INSTANCE);
  }

  /**
   * Reject trees deeper than the depth limit, and shared subtrees if so
   * configured.  A shared subtree would be written out twice and read
   * back as two separate copies.
   */
  private static void checkTree(SyntaxNode root)
      throws MalformedTreeException {
    int limit = SyntaxWalker.depthLimit();
    if (SyntaxWalker.deeperThan(root, limit)) {
      throw new MalformedTreeException("Cannot write " +
          root.getClass().getSimpleName() + ": tree is deeper than " +
          Settings.MAX_DEPTH + " " + limit);
    }
    boolean check;
    try {
      check = Settings.getBoolean(Settings.WALK_CHECK_OWNERSHIP);
    } catch (InvalidOptionException e) {
      Logging.uniqueWarn(e.getMessage() + ", checking ownership anyway");
      check = true;
    }
    if (check) {
      SyntaxWalker.checkExclusiveOwnership(root);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Writing " + root.getClass().getSimpleName() +
                   " with " + SyntaxWalker.countNodes(root) + " nodes");
    }
  }

  private static JSONObject node(Enum<?> kind) {
    JSONObject obj = new JSONObject();
    obj.put("kind", kind.name());
    return obj;
  }

  private JSONArray block(StatementSequence seq) {
    JSONArray arr = new JSONArray();
    for (Statement stmt: seq) {
      arr.put(stmt.accept(this));
    }
    return arr;
  }

  private JSONArray types(List<SwiftType> types) {
    JSONArray arr = new JSONArray();
    for (SwiftType t: types) {
      arr.put(t.accept(this));
    }
    return arr;
  }

  private JSONArray exprs(List<Expression> exprs) {
    JSONArray arr = new JSONArray();
    for (Expression e: exprs) {
      arr.put(e.accept(this));
    }
    return arr;
  }

  private JSONArray patterns(List<Pattern> patterns) {
    JSONArray arr = new JSONArray();
    for (Pattern p: patterns) {
      arr.put(p.accept(this));
    }
    return arr;
  }

  private JSONObject optType(SwiftType type) {
    return type == null ? null : type.accept(this);
  }

  private JSONObject optExpr(Expression expr) {
    return expr == null ? null : expr.accept(this);
  }

  private JSONArray optBlock(StatementSequence seq) {
    return seq == null ? null : block(seq);
  }

  /* Types */

  @Override
  public JSONObject visitPrimitive(PrimitiveType type) {
    JSONObject obj = node(type.kind());
    obj.put("primType", type.primType().name());
    return obj;
  }

  @Override
  public JSONObject visitOptional(OptionalType type) {
    JSONObject obj = node(type.kind());
    obj.put("wrapped", type.wrapped().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitArray(ArrayType type) {
    JSONObject obj = node(type.kind());
    obj.put("elementType", type.elementType().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitDictionary(DictionaryType type) {
    JSONObject obj = node(type.kind());
    obj.put("keyType", type.keyType().accept(this));
    obj.put("valueType", type.valueType().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitTuple(TupleType type) {
    JSONObject obj = node(type.kind());
    obj.put("elementTypes", types(type.elementTypes()));
    return obj;
  }

  @Override
  public JSONObject visitFunction(FunctionType type) {
    JSONObject obj = node(type.kind());
    obj.put("parameterTypes", types(type.parameterTypes()));
    obj.put("resultType", type.resultType().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitCustom(CustomType type) {
    JSONObject obj = node(type.kind());
    obj.put("name", type.name());
    return obj;
  }

  /* Literals */

  static JSONObject literal(Literal lit) {
    JSONObject obj = node(lit.getKind());
    switch (lit.getKind()) {
      case INTEGER:
        obj.put("value", lit.getIntLit());
        break;
      case FLOAT:
        // Text form survives NaN and infinities, which JSON numbers don't
        obj.put("value", Double.toString(lit.getFloatLit()));
        break;
      case BOOL:
        obj.put("value", lit.getBoolLit());
        break;
      case STRING:
        obj.put("value", lit.getStringLit());
        break;
      case CHARACTER:
        obj.put("value", lit.getCharLit());
        break;
      case NIL:
        break;
      default:
        throw new SyntaxRuntimeError("Unknown literal kind " +
                                     lit.getKind());
    }
    return obj;
  }

  /* Expressions */

  @Override
  public JSONObject visitSelf(SelfExpression expr) {
    return node(expr.kind());
  }

  @Override
  public JSONObject visitSuper(SuperExpression expr) {
    return node(expr.kind());
  }

  @Override
  public JSONObject visitIdentifier(IdentifierExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("name", expr.name());
    return obj;
  }

  @Override
  public JSONObject visitLiteral(LiteralExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("literal", literal(expr.literal()));
    return obj;
  }

  @Override
  public JSONObject visitBinary(BinaryExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("left", expr.left().accept(this));
    obj.put("operator", expr.operator().symbol());
    obj.put("right", expr.right().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitUnary(UnaryExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("operator", expr.operator().symbol());
    obj.put("operand", expr.operand().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitCall(CallExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("callee", expr.callee().accept(this));
    JSONArray args = new JSONArray();
    for (Argument arg: expr.arguments()) {
      JSONObject a = new JSONObject();
      a.putOpt("label", arg.label());
      a.put("value", arg.value().accept(this));
      a.put("variadic", arg.isVariadic());
      a.put("inout", arg.isInout());
      args.put(a);
    }
    obj.put("arguments", args);
    if (expr.hasGenericTypeArguments()) {
      obj.put("genericTypeArguments", types(expr.genericTypeArguments()));
    }
    JSONArray trailing = new JSONArray();
    for (TrailingClosure tc: expr.trailingClosures()) {
      JSONObject t = new JSONObject();
      t.putOpt("label", tc.label());
      t.put("closure", tc.closure().accept(this));
      trailing.put(t);
    }
    obj.put("trailingClosures", trailing);
    return obj;
  }

  @Override
  public JSONObject visitClosure(ClosureExpression expr) {
    JSONObject obj = node(expr.kind());
    JSONArray params = new JSONArray();
    for (ClosureParameter param: expr.parameters()) {
      JSONObject p = new JSONObject();
      p.put("name", param.name());
      p.putOpt("typeAnnotation", optType(param.typeAnnotation()));
      params.put(p);
    }
    obj.put("parameters", params);
    obj.putOpt("returnType", optType(expr.returnType()));
    obj.put("escaping", expr.isEscaping());
    obj.put("body", block(expr.body()));
    return obj;
  }

  @Override
  public JSONObject visitSubscript(SubscriptExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("target", expr.target().accept(this));
    obj.put("index", expr.index().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitConditional(ConditionalExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("condition", expr.condition().accept(this));
    obj.put("trueExpression", expr.trueExpression().accept(this));
    obj.put("falseExpression", expr.falseExpression().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitTuple(TupleExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("elements", exprs(expr.elements()));
    return obj;
  }

  @Override
  public JSONObject visitArray(ArrayExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("elements", exprs(expr.elements()));
    return obj;
  }

  @Override
  public JSONObject visitDictionary(DictionaryExpression expr) {
    JSONObject obj = node(expr.kind());
    JSONArray entries = new JSONArray();
    for (DictionaryEntry entry: expr.entries()) {
      JSONObject e = new JSONObject();
      e.put("key", entry.key().accept(this));
      e.put("value", entry.value().accept(this));
      entries.put(e);
    }
    obj.put("entries", entries);
    return obj;
  }

  @Override
  public JSONObject visitMemberAccess(MemberAccessExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("target", expr.target().accept(this));
    obj.put("member", expr.member());
    return obj;
  }

  @Override
  public JSONObject visitTypeCasting(TypeCastingExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("expression", expr.expression().accept(this));
    obj.put("castKind", expr.castKind().name());
    obj.put("targetType", expr.targetType().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitPatternMatch(PatternMatchExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("pattern", expr.pattern().accept(this));
    obj.put("expression", expr.expression().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitKeyPath(KeyPathExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.putOpt("typeName", expr.typeName());
    obj.put("path", new JSONArray(expr.path()));
    return obj;
  }

  @Override
  public JSONObject visitAssignment(AssignmentExpression expr) {
    JSONObject obj = node(expr.kind());
    obj.put("target", expr.target().accept(this));
    obj.put("value", expr.value().accept(this));
    return obj;
  }

  /* Patterns */

  @Override
  public JSONObject visitLiteral(LiteralPattern pattern) {
    JSONObject obj = node(pattern.kind());
    obj.put("value", literal(pattern.value()));
    return obj;
  }

  @Override
  public JSONObject visitIdentifier(IdentifierPattern pattern) {
    JSONObject obj = node(pattern.kind());
    obj.put("name", pattern.identifier().getName());
    return obj;
  }

  @Override
  public JSONObject visitTuple(TuplePattern pattern) {
    JSONObject obj = node(pattern.kind());
    obj.put("elements", patterns(pattern.elements()));
    return obj;
  }

  @Override
  public JSONObject visitEnumCase(EnumCasePattern pattern) {
    JSONObject obj = node(pattern.kind());
    obj.putOpt("enumName", pattern.enumName());
    obj.put("caseName", pattern.caseName());
    obj.put("associatedValues", patterns(pattern.associatedValues()));
    return obj;
  }

  @Override
  public JSONObject visitWildcard(WildcardPattern pattern) {
    return node(pattern.kind());
  }

  @Override
  public JSONObject visitType(TypePattern pattern) {
    JSONObject obj = node(pattern.kind());
    obj.put("type", pattern.type().accept(this));
    return obj;
  }

  /* Statements */

  @Override
  public JSONObject visitBreak(BreakStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.putOpt("label", stmt.label());
    return obj;
  }

  @Override
  public JSONObject visitContinue(ContinueStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.putOpt("label", stmt.label());
    return obj;
  }

  @Override
  public JSONObject visitExpression(ExpressionStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("expression", stmt.expression().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitDeclaration(DeclarationStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("declaration", stmt.declaration().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitReturn(ReturnStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.putOpt("expression", optExpr(stmt.expression()));
    return obj;
  }

  @Override
  public JSONObject visitIf(IfStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("condition", stmt.condition().accept(this));
    obj.put("body", block(stmt.body()));
    obj.putOpt("elseBody", optBlock(stmt.elseBody()));
    return obj;
  }

  @Override
  public JSONObject visitForLoop(ForLoopStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("variable", stmt.variable());
    obj.put("rangeKind", stmt.rangeKind().name());
    obj.put("rangeStart", stmt.rangeStart().accept(this));
    obj.put("rangeEnd", stmt.rangeEnd().accept(this));
    obj.put("body", block(stmt.body()));
    return obj;
  }

  @Override
  public JSONObject visitWhileLoop(WhileLoopStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("condition", stmt.condition().accept(this));
    obj.put("body", block(stmt.body()));
    return obj;
  }

  @Override
  public JSONObject visitRepeatWhileLoop(RepeatWhileLoopStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("body", block(stmt.body()));
    obj.put("condition", stmt.condition().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitSwitch(SwitchStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("expression", stmt.expression().accept(this));
    JSONArray cases = new JSONArray();
    for (Case c: stmt.cases()) {
      JSONObject co = new JSONObject();
      co.put("patterns", patterns(c.patterns()));
      co.putOpt("guardExpression", optExpr(c.guardExpression()));
      co.put("body", block(c.body()));
      cases.put(co);
    }
    obj.put("cases", cases);
    obj.putOpt("defaultCase", optBlock(stmt.defaultCase()));
    return obj;
  }

  @Override
  public JSONObject visitGuard(GuardStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("condition", stmt.condition().accept(this));
    obj.put("body", block(stmt.body()));
    return obj;
  }

  @Override
  public JSONObject visitThrow(ThrowStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("expression", stmt.expression().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitDoCatch(DoCatchStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("body", block(stmt.body()));
    obj.put("catchBody", block(stmt.catchBody()));
    return obj;
  }

  @Override
  public JSONObject visitAssignment(AssignmentStatement stmt) {
    JSONObject obj = node(stmt.kind());
    obj.put("target", stmt.target().accept(this));
    obj.put("value", stmt.value().accept(this));
    return obj;
  }

  /* Declarations */

  private JSONObject generics(GenericsDeclaration generics) {
    if (generics == null) {
      return null;
    }
    JSONArray params = new JSONArray();
    for (TypeParameter tp: generics.typeParameters()) {
      JSONObject p = new JSONObject();
      p.put("name", tp.name());
      p.putOpt("constraint", optType(tp.constraint()));
      params.put(p);
    }
    JSONObject obj = new JSONObject();
    obj.put("typeParameters", params);
    return obj;
  }

  private JSONArray parameters(List<FunctionParameter> params) {
    JSONArray arr = new JSONArray();
    for (FunctionParameter param: params) {
      JSONObject p = new JSONObject();
      p.putOpt("label", param.label());
      p.put("internalName", param.internalName());
      p.put("type", param.type().accept(this));
      p.putOpt("defaultValue", optExpr(param.defaultValue()));
      p.put("variadic", param.isVariadic());
      p.put("inout", param.isInout());
      arr.put(p);
    }
    return arr;
  }

  private JSONArray properties(List<PropertyDeclaration> props) {
    JSONArray arr = new JSONArray();
    for (PropertyDeclaration prop: props) {
      JSONObject p = node(prop.kind());
      p.put("name", prop.name());
      switch (prop.kind()) {
        case STORED: {
          StoredProperty stored = (StoredProperty) prop;
          p.put("constant", stored.isConstant());
          p.putOpt("type", optType(stored.type()));
          p.putOpt("initialValue", optExpr(stored.initialValue()));
          break;
        }
        case COMPUTED: {
          ComputedProperty computed = (ComputedProperty) prop;
          p.put("type", computed.type().accept(this));
          p.put("getter", block(computed.getter()));
          if (computed.hasSetter()) {
            JSONObject setter = new JSONObject();
            setter.putOpt("parameterName",
                          computed.setter().parameterName());
            setter.put("body", block(computed.setter().body()));
            p.put("setter", setter);
          }
          break;
        }
        default:
          throw new SyntaxRuntimeError("Unknown property kind " +
                                       prop.kind());
      }
      arr.put(p);
    }
    return arr;
  }

  private JSONArray methods(List<FunDeclaration> methods) {
    JSONArray arr = new JSONArray();
    for (FunDeclaration m: methods) {
      arr.put(m.accept(this));
    }
    return arr;
  }

  private JSONArray initializers(List<InitializerDeclaration> inits) {
    JSONArray arr = new JSONArray();
    for (InitializerDeclaration init: inits) {
      arr.put(init.accept(this));
    }
    return arr;
  }

  @Override
  public JSONObject visitFunction(FunDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.putOpt("generics", generics(decl.generics()));
    obj.put("parameters", parameters(decl.parameters()));
    obj.putOpt("returnType", optType(decl.returnType()));
    obj.put("throwing", decl.isThrowing());
    obj.put("accessControl", decl.accessControl().name());
    obj.putOpt("body", optBlock(decl.body()));
    return obj;
  }

  @Override
  public JSONObject visitVar(VarDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.putOpt("type", optType(decl.type()));
    obj.putOpt("initialValue", optExpr(decl.initialValue()));
    return obj;
  }

  @Override
  public JSONObject visitLet(LetDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.putOpt("type", optType(decl.type()));
    obj.putOpt("initialValue", optExpr(decl.initialValue()));
    return obj;
  }

  @Override
  public JSONObject visitStruct(StructDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.putOpt("generics", generics(decl.generics()));
    obj.put("conformances", new JSONArray(decl.conformances()));
    obj.put("properties", properties(decl.properties()));
    obj.put("methods", methods(decl.methods()));
    obj.put("initializers", initializers(decl.initializers()));
    return obj;
  }

  @Override
  public JSONObject visitEnum(EnumDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.putOpt("generics", generics(decl.generics()));
    obj.putOpt("rawType", optType(decl.rawType()));
    obj.put("conformances", new JSONArray(decl.conformances()));
    JSONArray cases = new JSONArray();
    for (EnumCase c: decl.cases()) {
      JSONObject co = new JSONObject();
      co.put("name", c.name());
      JSONArray values = new JSONArray();
      for (EnumAssociatedValue v: c.associatedValues()) {
        JSONObject vo = new JSONObject();
        vo.putOpt("label", v.label());
        vo.put("type", v.type().accept(this));
        values.put(vo);
      }
      co.put("associatedValues", values);
      co.putOpt("rawValue", optExpr(c.rawValue()));
      cases.put(co);
    }
    obj.put("cases", cases);
    return obj;
  }

  @Override
  public JSONObject visitClass(ClassDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.putOpt("generics", generics(decl.generics()));
    obj.putOpt("superclass", decl.superclass());
    obj.put("conformances", new JSONArray(decl.conformances()));
    obj.put("properties", properties(decl.properties()));
    obj.put("methods", methods(decl.methods()));
    obj.put("initializers", initializers(decl.initializers()));
    if (decl.hasDeinitializer()) {
      obj.put("deinitializer", decl.deinitializer().accept(this));
    }
    return obj;
  }

  @Override
  public JSONObject visitProtocol(ProtocolDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.put("inheritedProtocols", new JSONArray(decl.inheritedProtocols()));
    JSONArray props = new JSONArray();
    for (PropertyRequirement req: decl.propertyRequirements()) {
      JSONObject r = new JSONObject();
      r.put("name", req.name());
      r.put("type", req.type().accept(this));
      r.put("readOnly", req.isReadOnly());
      props.put(r);
    }
    obj.put("propertyRequirements", props);
    JSONArray methods = new JSONArray();
    for (MethodRequirement req: decl.methodRequirements()) {
      JSONObject r = new JSONObject();
      r.put("name", req.name());
      r.put("parameters", parameters(req.parameters()));
      r.putOpt("returnType", optType(req.returnType()));
      r.put("mutating", req.isMutating());
      methods.put(r);
    }
    obj.put("methodRequirements", methods);
    JSONArray inits = new JSONArray();
    for (InitializerRequirement req: decl.initializerRequirements()) {
      JSONObject r = new JSONObject();
      r.put("parameters", parameters(req.parameters()));
      r.put("failable", req.isFailable());
      inits.put(r);
    }
    obj.put("initializerRequirements", inits);
    return obj;
  }

  @Override
  public JSONObject visitExtension(ExtensionDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("typeName", decl.typeName());
    obj.put("conformances", new JSONArray(decl.conformances()));
    obj.put("properties", properties(decl.properties()));
    obj.put("methods", methods(decl.methods()));
    obj.put("initializers", initializers(decl.initializers()));
    return obj;
  }

  @Override
  public JSONObject visitTypeAlias(TypeAliasDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("name", decl.name());
    obj.put("target", decl.target().accept(this));
    return obj;
  }

  @Override
  public JSONObject visitImport(ImportDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("module", decl.module());
    ImportSymbol symbol = decl.symbol();
    JSONObject so = node(symbol.kind());
    if (!symbol.isEntireModule()) {
      so.put("name", symbol.name());
    }
    obj.put("symbol", so);
    return obj;
  }

  @Override
  public JSONObject visitInitializer(InitializerDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.putOpt("generics", generics(decl.generics()));
    obj.put("parameters", parameters(decl.parameters()));
    obj.put("body", block(decl.body()));
    obj.put("failable", decl.isFailable());
    obj.put("convenience", decl.isConvenience());
    obj.put("accessControl", decl.accessControl().name());
    return obj;
  }

  @Override
  public JSONObject visitDeinitializer(DeinitializerDeclaration decl) {
    JSONObject obj = node(decl.kind());
    obj.put("body", block(decl.body()));
    return obj;
  }
}
