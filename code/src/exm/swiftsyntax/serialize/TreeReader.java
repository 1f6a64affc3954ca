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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.common.Settings;
import exm.swiftsyntax.common.exceptions.MalformedTreeException;
import exm.swiftsyntax.tree.AccessControl;
import exm.swiftsyntax.tree.Declarations.ClassDeclaration;
import exm.swiftsyntax.tree.Declarations.ComputedProperty;
import exm.swiftsyntax.tree.Declarations.DeclKind;
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
import exm.swiftsyntax.tree.Declarations.PropertyKind;
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
import exm.swiftsyntax.tree.Expressions.BinaryExpression;
import exm.swiftsyntax.tree.Expressions.CallExpression;
import exm.swiftsyntax.tree.Expressions.CastKind;
import exm.swiftsyntax.tree.Expressions.ClosureExpression;
import exm.swiftsyntax.tree.Expressions.ClosureParameter;
import exm.swiftsyntax.tree.Expressions.ConditionalExpression;
import exm.swiftsyntax.tree.Expressions.DictionaryEntry;
import exm.swiftsyntax.tree.Expressions.DictionaryExpression;
import exm.swiftsyntax.tree.Expressions.ExprKind;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Expressions.IdentifierExpression;
import exm.swiftsyntax.tree.Expressions.InfixIdentifier;
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
import exm.swiftsyntax.tree.Expressions.UnaryIdentifier;
import exm.swiftsyntax.tree.Identifier;
import exm.swiftsyntax.tree.ImportSymbol;
import exm.swiftsyntax.tree.ImportSymbol.SymbolKind;
import exm.swiftsyntax.tree.Literal;
import exm.swiftsyntax.tree.Literal.LiteralKind;
import exm.swiftsyntax.tree.Patterns.EnumCasePattern;
import exm.swiftsyntax.tree.Patterns.IdentifierPattern;
import exm.swiftsyntax.tree.Patterns.LiteralPattern;
import exm.swiftsyntax.tree.Patterns.Pattern;
import exm.swiftsyntax.tree.Patterns.PatternKind;
import exm.swiftsyntax.tree.Patterns.TuplePattern;
import exm.swiftsyntax.tree.Patterns.TypePattern;
import exm.swiftsyntax.tree.Patterns.WildcardPattern;
import exm.swiftsyntax.tree.StatementSequence;
import exm.swiftsyntax.tree.Statements.AssignmentStatement;
import exm.swiftsyntax.tree.Statements.BreakStatement;
import exm.swiftsyntax.tree.Statements.Case;
import exm.swiftsyntax.tree.Statements.ContinueStatement;
import exm.swiftsyntax.tree.Statements.DeclarationStatement;
import exm.swiftsyntax.tree.Statements.DoCatchStatement;
import exm.swiftsyntax.tree.Statements.ExpressionStatement;
import exm.swiftsyntax.tree.Statements.ForLoopStatement;
import exm.swiftsyntax.tree.Statements.ForLoopStatement.RangeKind;
import exm.swiftsyntax.tree.Statements.GuardStatement;
import exm.swiftsyntax.tree.Statements.IfStatement;
import exm.swiftsyntax.tree.Statements.RepeatWhileLoopStatement;
import exm.swiftsyntax.tree.Statements.ReturnStatement;
import exm.swiftsyntax.tree.Statements.Statement;
import exm.swiftsyntax.tree.Statements.StmtKind;
import exm.swiftsyntax.tree.Statements.SwitchStatement;
import exm.swiftsyntax.tree.Statements.ThrowStatement;
import exm.swiftsyntax.tree.Statements.WhileLoopStatement;
import exm.swiftsyntax.tree.SwiftTypes.ArrayType;
import exm.swiftsyntax.tree.SwiftTypes.CustomType;
import exm.swiftsyntax.tree.SwiftTypes.DictionaryType;
import exm.swiftsyntax.tree.SwiftTypes.FunctionType;
import exm.swiftsyntax.tree.SwiftTypes.OptionalType;
import exm.swiftsyntax.tree.SwiftTypes.PrimType;
import exm.swiftsyntax.tree.SwiftTypes.PrimitiveType;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;
import exm.swiftsyntax.tree.SwiftTypes.TupleType;
import exm.swiftsyntax.tree.SwiftTypes.TypeKind;
import exm.swiftsyntax.walk.SyntaxWalker;

/**
 * Rebuilds syntax trees from the JSON written by {@link TreeWriter}.
 *
 * Input is untrusted: unknown kinds, missing required fields and values
 * of the wrong JSON type are reported as {@link MalformedTreeException}
 * with the path of the offending field, e.g. body[2].expression.left.
 */
public class TreeReader {

  private static final Logger logger = Logging.getLogger();

  private TreeReader() {
  }

  /* ---------------------------------------------------------------- */
  /* Field access                                                     */
  /* ---------------------------------------------------------------- */

  private static String sub(String path, String field) {
    return path.isEmpty() ? field : path + "." + field;
  }

  private static String elem(String path, int i) {
    return path + "[" + i + "]";
  }

  /** @return the field's value, or null if absent or JSON null */
  private static Object opt(JSONObject obj, String field) {
    Object val = obj.opt(field);
    return val == JSONObject.NULL ? null : val;
  }

  private static Object required(JSONObject obj, String field, String path)
      throws MalformedTreeException {
    Object val = opt(obj, field);
    if (val == null) {
      throw new MalformedTreeException(path,
                        "missing required field \"" + field + "\"");
    }
    return val;
  }

  private static JSONObject object(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    return asObject(required(obj, field, path), sub(path, field));
  }

  private static JSONObject optObject(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    Object val = opt(obj, field);
    return val == null ? null : asObject(val, sub(path, field));
  }

  private static JSONObject asObject(Object val, String path)
      throws MalformedTreeException {
    if (!(val instanceof JSONObject)) {
      throw new MalformedTreeException(path, "expected object");
    }
    return (JSONObject) val;
  }

  private static JSONArray array(JSONObject obj, String field, String path)
      throws MalformedTreeException {
    return asArray(required(obj, field, path), sub(path, field));
  }

  private static JSONArray optArray(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    Object val = opt(obj, field);
    return val == null ? null : asArray(val, sub(path, field));
  }

  private static JSONArray asArray(Object val, String path)
      throws MalformedTreeException {
    if (!(val instanceof JSONArray)) {
      throw new MalformedTreeException(path, "expected array");
    }
    return (JSONArray) val;
  }

  private static String string(JSONObject obj, String field, String path)
      throws MalformedTreeException {
    return asString(required(obj, field, path), sub(path, field));
  }

  private static String optString(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    Object val = opt(obj, field);
    return val == null ? null : asString(val, sub(path, field));
  }

  private static String asString(Object val, String path)
      throws MalformedTreeException {
    if (!(val instanceof String)) {
      throw new MalformedTreeException(path, "expected string");
    }
    return (String) val;
  }

  private static boolean bool(JSONObject obj, String field, String path)
      throws MalformedTreeException {
    Object val = required(obj, field, path);
    if (!(val instanceof Boolean)) {
      throw new MalformedTreeException(sub(path, field), "expected boolean");
    }
    return (Boolean) val;
  }

  private static long integer(JSONObject obj, String field, String path)
      throws MalformedTreeException {
    Object val = required(obj, field, path);
    if (val instanceof Integer || val instanceof Long) {
      return ((Number) val).longValue();
    }
    throw new MalformedTreeException(sub(path, field),
                                     "expected 64-bit integer");
  }

  private static List<String> strings(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, field, path);
    String arrPath = sub(path, field);
    List<String> result = new ArrayList<String>(arr.length());
    for (int i = 0; i < arr.length(); i++) {
      result.add(asString(arr.opt(i), elem(arrPath, i)));
    }
    return result;
  }

  private static <E extends Enum<E>> E enumValue(Class<E> enumClass,
      JSONObject obj, String field, String path)
          throws MalformedTreeException {
    String text = string(obj, field, path);
    try {
      return Enum.valueOf(enumClass, text);
    } catch (IllegalArgumentException e) {
      throw new MalformedTreeException(sub(path, field),
            "unknown " + enumClass.getSimpleName() + " \"" + text + "\"");
    }
  }

  private static <E extends Enum<E>> E kind(Class<E> enumClass,
      JSONObject obj, String path) throws MalformedTreeException {
    return enumValue(enumClass, obj, "kind", path);
  }

  /* ---------------------------------------------------------------- */
  /* Entry points                                                     */
  /* ---------------------------------------------------------------- */

  public static Declaration readDeclaration(JSONObject obj)
      throws MalformedTreeException {
    checkNesting(obj);
    Declaration decl = declaration(obj, "");
    logger.trace("Read " + decl.kind() + " declaration");
    return decl;
  }

  public static Statement readStatement(JSONObject obj)
      throws MalformedTreeException {
    checkNesting(obj);
    return statement(obj, "");
  }

  public static StatementSequence readStatements(JSONArray arr)
      throws MalformedTreeException {
    checkNesting(arr);
    return block(arr, "");
  }

  public static Expression readExpression(JSONObject obj)
      throws MalformedTreeException {
    checkNesting(obj);
    return expression(obj, "");
  }

  public static Pattern readPattern(JSONObject obj)
      throws MalformedTreeException {
    checkNesting(obj);
    return pattern(obj, "");
  }

  public static SwiftType readType(JSONObject obj)
      throws MalformedTreeException {
    checkNesting(obj);
    return type(obj, "");
  }

  /* ---------------------------------------------------------------- */
  /* Nesting limit                                                    */
  /* ---------------------------------------------------------------- */

  /**
   * Deepest JSON nesting accepted.  A tree level takes at most two JSON
   * levels (an array and an object), plus a few for the root and for
   * leaf objects like literals.
   */
  static int nestingLimit() {
    return 2 * SyntaxWalker.depthLimit() + 4;
  }

  private static MalformedTreeException tooDeep(int limit) {
    return new MalformedTreeException("", "JSON nesting exceeds " + limit +
          " levels (" + Settings.MAX_DEPTH + " " +
          SyntaxWalker.depthLimit() + ")");
  }

  /**
   * Check the nesting depth of JSON text without parsing it, since the
   * JSON parser itself recurses once per level.
   */
  static void checkNesting(String text) throws MalformedTreeException {
    int limit = nestingLimit();
    int depth = 0;
    boolean inString = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (c == '\\') {
          i++;
        } else if (c == '"') {
          inString = false;
        }
      } else if (c == '"') {
        inString = true;
      } else if (c == '{' || c == '[') {
        depth++;
        if (depth > limit) {
          throw tooDeep(limit);
        }
      } else if (c == '}' || c == ']') {
        depth--;
      }
    }
  }

  /** A JSON value waiting to be checked */
  private static class PendingValue {
    final Object value;
    final int depth;

    PendingValue(Object value, int depth) {
      this.value = value;
      this.depth = depth;
    }
  }

  private static void checkNesting(Object root)
      throws MalformedTreeException {
    int limit = nestingLimit();
    Deque<PendingValue> stack = new ArrayDeque<PendingValue>();
    stack.push(new PendingValue(root, 1));
    while (!stack.isEmpty()) {
      PendingValue curr = stack.pop();
      if (curr.depth > limit) {
        throw tooDeep(limit);
      }
      if (curr.value instanceof JSONObject) {
        JSONObject obj = (JSONObject) curr.value;
        Iterator<String> keys = obj.keys();
        while (keys.hasNext()) {
          pushIfNested(stack, obj.opt(keys.next()), curr.depth + 1);
        }
      } else if (curr.value instanceof JSONArray) {
        JSONArray arr = (JSONArray) curr.value;
        for (int i = 0; i < arr.length(); i++) {
          pushIfNested(stack, arr.opt(i), curr.depth + 1);
        }
      }
    }
  }

  private static void pushIfNested(Deque<PendingValue> stack, Object val,
                                   int depth) {
    if (val instanceof JSONObject || val instanceof JSONArray) {
      stack.push(new PendingValue(val, depth));
    }
  }

  /* ---------------------------------------------------------------- */
  /* Types                                                            */
  /* ---------------------------------------------------------------- */

  private static SwiftType type(JSONObject obj, String path)
      throws MalformedTreeException {
    TypeKind kind = kind(TypeKind.class, obj, path);
    switch (kind) {
      case PRIMITIVE:
        return new PrimitiveType(enumValue(PrimType.class, obj, "primType",
                                           path));
      case OPTIONAL:
        return new OptionalType(type(obj, "wrapped", path));
      case ARRAY:
        return new ArrayType(type(obj, "elementType", path));
      case DICTIONARY:
        return new DictionaryType(type(obj, "keyType", path),
                                  type(obj, "valueType", path));
      case TUPLE:
        return new TupleType(types(obj, "elementTypes", path));
      case FUNCTION:
        return new FunctionType(types(obj, "parameterTypes", path),
                                type(obj, "resultType", path));
      case CUSTOM:
        return new CustomType(string(obj, "name", path));
      default:
        throw new MalformedTreeException(path, "unhandled type kind " + kind);
    }
  }

  private static SwiftType type(JSONObject obj, String field, String path)
      throws MalformedTreeException {
    return type(object(obj, field, path), sub(path, field));
  }

  private static SwiftType optType(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    JSONObject val = optObject(obj, field, path);
    return val == null ? null : type(val, sub(path, field));
  }

  private static List<SwiftType> types(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, field, path);
    String arrPath = sub(path, field);
    List<SwiftType> result = new ArrayList<SwiftType>(arr.length());
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      result.add(type(asObject(arr.opt(i), p), p));
    }
    return result;
  }

  /* ---------------------------------------------------------------- */
  /* Literals and expressions                                         */
  /* ---------------------------------------------------------------- */

  private static Literal literal(JSONObject obj, String field, String path)
      throws MalformedTreeException {
    String litPath = sub(path, field);
    JSONObject lit = object(obj, field, path);
    LiteralKind kind = kind(LiteralKind.class, lit, litPath);
    switch (kind) {
      case INTEGER:
        return Literal.createIntLit(integer(lit, "value", litPath));
      case FLOAT: {
        String text = string(lit, "value", litPath);
        try {
          return Literal.createFloatLit(Double.parseDouble(text));
        } catch (NumberFormatException e) {
          throw new MalformedTreeException(sub(litPath, "value"),
                                  "invalid float literal \"" + text + "\"");
        }
      }
      case BOOL:
        return Literal.createBoolLit(bool(lit, "value", litPath));
      case STRING:
        return Literal.createStringLit(string(lit, "value", litPath));
      case CHARACTER: {
        long codePoint = integer(lit, "value", litPath);
        if (codePoint < 0 || codePoint > Character.MAX_CODE_POINT ||
            (codePoint >= Character.MIN_SURROGATE &&
             codePoint <= Character.MAX_SURROGATE)) {
          throw new MalformedTreeException(sub(litPath, "value"),
                                  "invalid code point " + codePoint);
        }
        return Literal.createCharLit((int) codePoint);
      }
      case NIL:
        return Literal.createNil();
      default:
        throw new MalformedTreeException(litPath,
                                         "unhandled literal kind " + kind);
    }
  }

  private static Expression expression(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    return expression(object(obj, field, path), sub(path, field));
  }

  private static Expression optExpression(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    JSONObject val = optObject(obj, field, path);
    return val == null ? null : expression(val, sub(path, field));
  }

  private static List<Expression> expressions(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, field, path);
    String arrPath = sub(path, field);
    List<Expression> result = new ArrayList<Expression>(arr.length());
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      result.add(expression(asObject(arr.opt(i), p), p));
    }
    return result;
  }

  private static Expression expression(JSONObject obj, String path)
      throws MalformedTreeException {
    ExprKind kind = kind(ExprKind.class, obj, path);
    switch (kind) {
      case SELF:
        return new SelfExpression();
      case SUPER:
        return new SuperExpression();
      case IDENTIFIER:
        return new IdentifierExpression(
                          new Identifier(string(obj, "name", path)));
      case LITERAL:
        return new LiteralExpression(literal(obj, "literal", path));
      case BINARY:
        return new BinaryExpression(expression(obj, "left", path),
                  new InfixIdentifier(string(obj, "operator", path)),
                  expression(obj, "right", path));
      case UNARY:
        return new UnaryExpression(
                  new UnaryIdentifier(string(obj, "operator", path)),
                  expression(obj, "operand", path));
      case CALL:
        return call(obj, path);
      case CLOSURE:
        return closure(obj, path);
      case SUBSCRIPT:
        return new SubscriptExpression(expression(obj, "target", path),
                                       expression(obj, "index", path));
      case CONDITIONAL:
        return new ConditionalExpression(expression(obj, "condition", path),
                  expression(obj, "trueExpression", path),
                  expression(obj, "falseExpression", path));
      case TUPLE:
        return new TupleExpression(expressions(obj, "elements", path));
      case ARRAY:
        return new ArrayExpression(expressions(obj, "elements", path));
      case DICTIONARY: {
        JSONArray arr = array(obj, "entries", path);
        String arrPath = sub(path, "entries");
        List<DictionaryEntry> entries = new ArrayList<DictionaryEntry>();
        for (int i = 0; i < arr.length(); i++) {
          String p = elem(arrPath, i);
          JSONObject e = asObject(arr.opt(i), p);
          entries.add(new DictionaryEntry(expression(e, "key", p),
                                          expression(e, "value", p)));
        }
        return new DictionaryExpression(entries);
      }
      case MEMBER_ACCESS:
        return new MemberAccessExpression(expression(obj, "target", path),
                                          string(obj, "member", path));
      case TYPE_CASTING:
        return new TypeCastingExpression(expression(obj, "expression", path),
                  enumValue(CastKind.class, obj, "castKind", path),
                  type(obj, "targetType", path));
      case PATTERN_MATCH:
        return new PatternMatchExpression(expression(obj, "pattern", path),
                                      expression(obj, "expression", path));
      case KEY_PATH:
        return new KeyPathExpression(optString(obj, "typeName", path),
                                     strings(obj, "path", path));
      case ASSIGNMENT:
        return new AssignmentExpression(expression(obj, "target", path),
                                        expression(obj, "value", path));
      default:
        throw new MalformedTreeException(path,
                                    "unhandled expression kind " + kind);
    }
  }

  private static CallExpression call(JSONObject obj, String path)
      throws MalformedTreeException {
    Expression callee = expression(obj, "callee", path);

    JSONArray argArr = array(obj, "arguments", path);
    String argPath = sub(path, "arguments");
    List<Argument> args = new ArrayList<Argument>(argArr.length());
    for (int i = 0; i < argArr.length(); i++) {
      String p = elem(argPath, i);
      JSONObject a = asObject(argArr.opt(i), p);
      args.add(new Argument(optString(a, "label", p),
                            expression(a, "value", p),
                            bool(a, "variadic", p), bool(a, "inout", p)));
    }

    List<SwiftType> generics = null;
    if (opt(obj, "genericTypeArguments") != null) {
      generics = types(obj, "genericTypeArguments", path);
    }

    JSONArray tcArr = array(obj, "trailingClosures", path);
    String tcPath = sub(path, "trailingClosures");
    List<TrailingClosure> trailing = new ArrayList<TrailingClosure>();
    for (int i = 0; i < tcArr.length(); i++) {
      String p = elem(tcPath, i);
      JSONObject t = asObject(tcArr.opt(i), p);
      JSONObject c = object(t, "closure", p);
      String cPath = sub(p, "closure");
      if (kind(ExprKind.class, c, cPath) != ExprKind.CLOSURE) {
        throw new MalformedTreeException(cPath, "expected CLOSURE");
      }
      trailing.add(new TrailingClosure(optString(t, "label", p),
                                       closure(c, cPath)));
    }
    return new CallExpression(callee, args, generics, trailing);
  }

  private static ClosureExpression closure(JSONObject obj, String path)
      throws MalformedTreeException {
    JSONArray arr = array(obj, "parameters", path);
    String arrPath = sub(path, "parameters");
    List<ClosureParameter> params = new ArrayList<ClosureParameter>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject po = asObject(arr.opt(i), p);
      params.add(new ClosureParameter(string(po, "name", p),
                                      optType(po, "typeAnnotation", p)));
    }
    return new ClosureExpression(params, optType(obj, "returnType", path),
                                 bool(obj, "escaping", path),
                                 block(obj, "body", path));
  }

  /* ---------------------------------------------------------------- */
  /* Patterns                                                         */
  /* ---------------------------------------------------------------- */

  private static List<Pattern> patterns(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, field, path);
    String arrPath = sub(path, field);
    List<Pattern> result = new ArrayList<Pattern>(arr.length());
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      result.add(pattern(asObject(arr.opt(i), p), p));
    }
    return result;
  }

  private static Pattern pattern(JSONObject obj, String path)
      throws MalformedTreeException {
    PatternKind kind = kind(PatternKind.class, obj, path);
    switch (kind) {
      case LITERAL:
        return new LiteralPattern(literal(obj, "value", path));
      case IDENTIFIER:
        return new IdentifierPattern(
                        new Identifier(string(obj, "name", path)));
      case TUPLE:
        return new TuplePattern(patterns(obj, "elements", path));
      case ENUM_CASE:
        return new EnumCasePattern(optString(obj, "enumName", path),
                                   string(obj, "caseName", path),
                                   patterns(obj, "associatedValues", path));
      case WILDCARD:
        return new WildcardPattern();
      case TYPE:
        return new TypePattern(type(obj, "type", path));
      default:
        throw new MalformedTreeException(path,
                                      "unhandled pattern kind " + kind);
    }
  }

  /* ---------------------------------------------------------------- */
  /* Statements                                                       */
  /* ---------------------------------------------------------------- */

  private static StatementSequence block(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    return block(array(obj, field, path), sub(path, field));
  }

  private static StatementSequence optBlock(JSONObject obj, String field,
      String path) throws MalformedTreeException {
    JSONArray arr = optArray(obj, field, path);
    return arr == null ? null : block(arr, sub(path, field));
  }

  private static StatementSequence block(JSONArray arr, String path)
      throws MalformedTreeException {
    List<Statement> stmts = new ArrayList<Statement>(arr.length());
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(path, i);
      stmts.add(statement(asObject(arr.opt(i), p), p));
    }
    return new StatementSequence(stmts);
  }

  private static Statement statement(JSONObject obj, String path)
      throws MalformedTreeException {
    StmtKind kind = kind(StmtKind.class, obj, path);
    switch (kind) {
      case BREAK:
        return new BreakStatement(optString(obj, "label", path));
      case CONTINUE:
        return new ContinueStatement(optString(obj, "label", path));
      case EXPRESSION:
        return new ExpressionStatement(expression(obj, "expression", path));
      case DECLARATION:
        return new DeclarationStatement(declaration(
                  object(obj, "declaration", path),
                  sub(path, "declaration")));
      case RETURN:
        return new ReturnStatement(optExpression(obj, "expression", path));
      case IF:
        return new IfStatement(expression(obj, "condition", path),
                               block(obj, "body", path),
                               optBlock(obj, "elseBody", path));
      case FOR_LOOP:
        return new ForLoopStatement(string(obj, "variable", path),
                  enumValue(RangeKind.class, obj, "rangeKind", path),
                  expression(obj, "rangeStart", path),
                  expression(obj, "rangeEnd", path),
                  block(obj, "body", path));
      case WHILE_LOOP:
        return new WhileLoopStatement(expression(obj, "condition", path),
                                      block(obj, "body", path));
      case REPEAT_WHILE_LOOP:
        return new RepeatWhileLoopStatement(block(obj, "body", path),
                                      expression(obj, "condition", path));
      case SWITCH:
        return switchStatement(obj, path);
      case GUARD:
        return new GuardStatement(expression(obj, "condition", path),
                                  block(obj, "body", path));
      case THROW:
        return new ThrowStatement(expression(obj, "expression", path));
      case DO_CATCH:
        return new DoCatchStatement(block(obj, "body", path),
                                    block(obj, "catchBody", path));
      case ASSIGNMENT:
        return new AssignmentStatement(expression(obj, "target", path),
                                       expression(obj, "value", path));
      default:
        throw new MalformedTreeException(path,
                                    "unhandled statement kind " + kind);
    }
  }

  private static SwitchStatement switchStatement(JSONObject obj,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, "cases", path);
    String arrPath = sub(path, "cases");
    List<Case> cases = new ArrayList<Case>(arr.length());
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject c = asObject(arr.opt(i), p);
      cases.add(new Case(patterns(c, "patterns", p),
                         optExpression(c, "guardExpression", p),
                         block(c, "body", p)));
    }
    return new SwitchStatement(expression(obj, "expression", path), cases,
                               optBlock(obj, "defaultCase", path));
  }

  /* ---------------------------------------------------------------- */
  /* Declarations                                                     */
  /* ---------------------------------------------------------------- */

  private static Declaration declaration(JSONObject obj, String path)
      throws MalformedTreeException {
    DeclKind kind = kind(DeclKind.class, obj, path);
    switch (kind) {
      case FUNCTION:
        return function(obj, path);
      case VAR:
        return new VarDeclaration(string(obj, "name", path),
                                  optType(obj, "type", path),
                                  optExpression(obj, "initialValue", path));
      case LET:
        return new LetDeclaration(string(obj, "name", path),
                                  optType(obj, "type", path),
                                  optExpression(obj, "initialValue", path));
      case STRUCT:
        return new StructDeclaration(string(obj, "name", path),
                  generics(obj, path), strings(obj, "conformances", path),
                  properties(obj, path), methods(obj, path),
                  initializers(obj, path));
      case ENUM:
        return enumDeclaration(obj, path);
      case CLASS: {
        JSONObject deinit = optObject(obj, "deinitializer", path);
        DeinitializerDeclaration d = null;
        if (deinit != null) {
          String p = sub(path, "deinitializer");
          expectKind(deinit, DeclKind.DEINITIALIZER, p);
          d = new DeinitializerDeclaration(block(deinit, "body", p));
        }
        return new ClassDeclaration(string(obj, "name", path),
                  generics(obj, path), optString(obj, "superclass", path),
                  strings(obj, "conformances", path), properties(obj, path),
                  methods(obj, path), initializers(obj, path), d);
      }
      case PROTOCOL:
        return protocol(obj, path);
      case EXTENSION:
        return new ExtensionDeclaration(string(obj, "typeName", path),
                  strings(obj, "conformances", path), properties(obj, path),
                  methods(obj, path), initializers(obj, path));
      case TYPE_ALIAS:
        return new TypeAliasDeclaration(string(obj, "name", path),
                                        type(obj, "target", path));
      case IMPORT:
        return new ImportDeclaration(string(obj, "module", path),
                                     importSymbol(obj, path));
      case INITIALIZER:
        return initializer(obj, path);
      case DEINITIALIZER:
        return new DeinitializerDeclaration(block(obj, "body", path));
      default:
        throw new MalformedTreeException(path,
                                  "unhandled declaration kind " + kind);
    }
  }

  private static void expectKind(JSONObject obj, DeclKind expected,
      String path) throws MalformedTreeException {
    DeclKind actual = kind(DeclKind.class, obj, path);
    if (actual != expected) {
      throw new MalformedTreeException(path, "expected " + expected +
                                       " but was " + actual);
    }
  }

  private static GenericsDeclaration generics(JSONObject obj, String path)
      throws MalformedTreeException {
    JSONObject g = optObject(obj, "generics", path);
    if (g == null) {
      return null;
    }
    String gPath = sub(path, "generics");
    JSONArray arr = array(g, "typeParameters", gPath);
    String arrPath = sub(gPath, "typeParameters");
    List<TypeParameter> params = new ArrayList<TypeParameter>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject tp = asObject(arr.opt(i), p);
      params.add(new TypeParameter(string(tp, "name", p),
                                   optType(tp, "constraint", p)));
    }
    return new GenericsDeclaration(params);
  }

  private static List<FunctionParameter> parameters(JSONObject obj,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, "parameters", path);
    String arrPath = sub(path, "parameters");
    List<FunctionParameter> params = new ArrayList<FunctionParameter>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject po = asObject(arr.opt(i), p);
      params.add(new FunctionParameter(optString(po, "label", p),
                string(po, "internalName", p), type(po, "type", p),
                optExpression(po, "defaultValue", p),
                bool(po, "variadic", p), bool(po, "inout", p)));
    }
    return params;
  }

  private static FunDeclaration function(JSONObject obj, String path)
      throws MalformedTreeException {
    return new FunDeclaration(string(obj, "name", path),
              generics(obj, path), parameters(obj, path),
              optType(obj, "returnType", path), bool(obj, "throwing", path),
              enumValue(AccessControl.class, obj, "accessControl", path),
              optBlock(obj, "body", path));
  }

  private static InitializerDeclaration initializer(JSONObject obj,
      String path) throws MalformedTreeException {
    return new InitializerDeclaration(generics(obj, path),
              parameters(obj, path), block(obj, "body", path),
              bool(obj, "failable", path), bool(obj, "convenience", path),
              enumValue(AccessControl.class, obj, "accessControl", path));
  }

  private static List<PropertyDeclaration> properties(JSONObject obj,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, "properties", path);
    String arrPath = sub(path, "properties");
    List<PropertyDeclaration> props = new ArrayList<PropertyDeclaration>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject po = asObject(arr.opt(i), p);
      PropertyKind kind = kind(PropertyKind.class, po, p);
      switch (kind) {
        case STORED:
          props.add(new StoredProperty(bool(po, "constant", p),
                    string(po, "name", p), optType(po, "type", p),
                    optExpression(po, "initialValue", p)));
          break;
        case COMPUTED: {
          PropertySetter setter = null;
          JSONObject so = optObject(po, "setter", p);
          if (so != null) {
            String sp = sub(p, "setter");
            setter = new PropertySetter(optString(so, "parameterName", sp),
                                        block(so, "body", sp));
          }
          props.add(new ComputedProperty(string(po, "name", p),
                    type(po, "type", p), block(po, "getter", p), setter));
          break;
        }
        default:
          throw new MalformedTreeException(p,
                                  "unhandled property kind " + kind);
      }
    }
    return props;
  }

  private static List<FunDeclaration> methods(JSONObject obj, String path)
      throws MalformedTreeException {
    JSONArray arr = array(obj, "methods", path);
    String arrPath = sub(path, "methods");
    List<FunDeclaration> methods = new ArrayList<FunDeclaration>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject m = asObject(arr.opt(i), p);
      expectKind(m, DeclKind.FUNCTION, p);
      methods.add(function(m, p));
    }
    return methods;
  }

  private static List<InitializerDeclaration> initializers(JSONObject obj,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, "initializers", path);
    String arrPath = sub(path, "initializers");
    List<InitializerDeclaration> inits =
                                  new ArrayList<InitializerDeclaration>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject io = asObject(arr.opt(i), p);
      expectKind(io, DeclKind.INITIALIZER, p);
      inits.add(initializer(io, p));
    }
    return inits;
  }

  private static EnumDeclaration enumDeclaration(JSONObject obj,
      String path) throws MalformedTreeException {
    JSONArray arr = array(obj, "cases", path);
    String arrPath = sub(path, "cases");
    List<EnumCase> cases = new ArrayList<EnumCase>(arr.length());
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject co = asObject(arr.opt(i), p);
      JSONArray vals = array(co, "associatedValues", p);
      String valPath = sub(p, "associatedValues");
      List<EnumAssociatedValue> values = new ArrayList<EnumAssociatedValue>();
      for (int j = 0; j < vals.length(); j++) {
        String vp = elem(valPath, j);
        JSONObject vo = asObject(vals.opt(j), vp);
        values.add(new EnumAssociatedValue(optString(vo, "label", vp),
                                           type(vo, "type", vp)));
      }
      cases.add(new EnumCase(string(co, "name", p), values,
                             optExpression(co, "rawValue", p)));
    }
    return new EnumDeclaration(string(obj, "name", path),
              generics(obj, path), optType(obj, "rawType", path),
              strings(obj, "conformances", path), cases);
  }

  private static ProtocolDeclaration protocol(JSONObject obj, String path)
      throws MalformedTreeException {
    JSONArray arr = array(obj, "propertyRequirements", path);
    String arrPath = sub(path, "propertyRequirements");
    List<PropertyRequirement> props = new ArrayList<PropertyRequirement>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject r = asObject(arr.opt(i), p);
      props.add(new PropertyRequirement(string(r, "name", p),
                    type(r, "type", p), bool(r, "readOnly", p)));
    }

    arr = array(obj, "methodRequirements", path);
    arrPath = sub(path, "methodRequirements");
    List<MethodRequirement> methods = new ArrayList<MethodRequirement>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject r = asObject(arr.opt(i), p);
      methods.add(new MethodRequirement(string(r, "name", p),
                    parameters(r, p), optType(r, "returnType", p),
                    bool(r, "mutating", p)));
    }

    arr = array(obj, "initializerRequirements", path);
    arrPath = sub(path, "initializerRequirements");
    List<InitializerRequirement> inits =
                                  new ArrayList<InitializerRequirement>();
    for (int i = 0; i < arr.length(); i++) {
      String p = elem(arrPath, i);
      JSONObject r = asObject(arr.opt(i), p);
      inits.add(new InitializerRequirement(parameters(r, p),
                                           bool(r, "failable", p)));
    }

    return new ProtocolDeclaration(string(obj, "name", path),
              strings(obj, "inheritedProtocols", path), props, methods,
              inits);
  }

  private static ImportSymbol importSymbol(JSONObject obj, String path)
      throws MalformedTreeException {
    JSONObject so = object(obj, "symbol", path);
    String p = sub(path, "symbol");
    SymbolKind kind = kind(SymbolKind.class, so, p);
    if (kind == SymbolKind.ENTIRE_MODULE) {
      if (opt(so, "name") != null) {
        throw new MalformedTreeException(p,
                          "whole-module import cannot name a symbol");
      }
      return ImportSymbol.entireModule();
    }
    return ImportSymbol.named(kind, string(so, "name", p));
  }
}
