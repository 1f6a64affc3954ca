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
package exm.swiftsyntax.printer;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.common.Settings;
import exm.swiftsyntax.common.exceptions.InvalidOptionException;
import exm.swiftsyntax.common.exceptions.SyntaxRuntimeError;
import exm.swiftsyntax.tree.AccessControl;
import exm.swiftsyntax.tree.ImportSymbol;
import exm.swiftsyntax.tree.Literal;
import exm.swiftsyntax.tree.StatementSequence;
import exm.swiftsyntax.tree.SyntaxNode;
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
import exm.swiftsyntax.tree.Patterns;
import exm.swiftsyntax.tree.Patterns.EnumCasePattern;
import exm.swiftsyntax.tree.Patterns.IdentifierPattern;
import exm.swiftsyntax.tree.Patterns.LiteralPattern;
import exm.swiftsyntax.tree.Patterns.Pattern;
import exm.swiftsyntax.tree.Patterns.TuplePattern;
import exm.swiftsyntax.tree.Patterns.TypePattern;
import exm.swiftsyntax.tree.Patterns.WildcardPattern;
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
import exm.swiftsyntax.tree.Statements.StmtKind;
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
import exm.swiftsyntax.tree.SwiftTypes.TypeKind;
import exm.swiftsyntax.walk.SyntaxWalker;

/**
 * Renders syntax trees as Swift source text.
 *
 * One statement goes on each line and blocks are braced and indented.
 * Operands that are themselves operator expressions are parenthesized,
 * so the output does not depend on operator precedence.
 *
 * A printer instance accumulates into a single buffer and is not
 * reusable; use the static print methods.
 */
public class SwiftPrinter implements SwiftTypes.Visitor<Void>,
    Expressions.Visitor<Void>, Statements.Visitor<Void>,
    Patterns.Visitor<Void>, Declarations.Visitor<Void> {

  private static final Logger logger = Logging.getLogger();

  private static final int DEFAULT_INDENT_WIDTH = 4;

  private final StringBuilder sb = new StringBuilder(256);
  private final int indentWidth;
  private int indentation = 0;

  private SwiftPrinter(int indentWidth) {
    this.indentWidth = indentWidth;
  }

  private static SwiftPrinter create() {
    int width;
    try {
      width = Settings.getInt(Settings.PRINTER_INDENT_WIDTH);
      if (width < 0) {
        throw new InvalidOptionException(Settings.PRINTER_INDENT_WIDTH +
                                         " must not be negative");
      }
    } catch (InvalidOptionException e) {
      Logging.uniqueWarn("Bad printer indent width, using " +
                         DEFAULT_INDENT_WIDTH + ": " + e.getMessage());
      width = DEFAULT_INDENT_WIDTH;
    }
    return new SwiftPrinter(width);
  }

  public static String print(SwiftType type) {
    return render(type);
  }

  public static String print(Expression expr) {
    return render(expr);
  }

  public static String print(Pattern pattern) {
    return render(pattern);
  }

  public static String print(Statement stmt) {
    return render(stmt);
  }

  public static String print(Declaration decl) {
    String text = render(decl);
    if (logger.isTraceEnabled()) {
      logger.trace("Printed " + decl.kind() + " declaration: " +
                   text.length() + " chars");
    }
    return text;
  }

  /**
   * Print statements one per line, without a trailing newline.
   */
  public static String print(StatementSequence seq) {
    return render(seq);
  }

  /**
   * Text for {@code toString()}: the printed source, or a one-line
   * summary if the tree is deeper than the configured depth limit.
   * Never throws for a tree of any depth.
   */
  public static String describe(SyntaxNode node) {
    int limit = SyntaxWalker.depthLimit();
    if (SyntaxWalker.deeperThan(node, limit)) {
      return "<" + node.getClass().getSimpleName() + ": " +
             SyntaxWalker.countNodes(node) + " nodes, deeper than " +
             Settings.MAX_DEPTH + " " + limit + ">";
    }
    return render(node);
  }

  /**
   * @throws SyntaxRuntimeError if the tree is deeper than the configured
   *    depth limit
   */
  private static String render(SyntaxNode root) {
    int limit = SyntaxWalker.depthLimit();
    if (SyntaxWalker.deeperThan(root, limit)) {
      throw new SyntaxRuntimeError("Cannot print " +
          root.getClass().getSimpleName() + ": tree is deeper than " +
          Settings.MAX_DEPTH + " " + limit);
    }
    SwiftPrinter p = create();
    if (root instanceof SwiftType) {
      ((SwiftType) root).accept(p);
    } else if (root instanceof Expression) {
      ((Expression) root).accept(p);
    } else if (root instanceof Pattern) {
      ((Pattern) root).accept(p);
    } else if (root instanceof Statement) {
      ((Statement) root).accept(p);
    } else if (root instanceof Declaration) {
      ((Declaration) root).accept(p);
    } else if (root instanceof StatementSequence) {
      boolean first = true;
      for (Statement stmt: (StatementSequence) root) {
        if (!first) {
          p.sb.append("\n");
        }
        first = false;
        stmt.accept(p);
      }
    } else {
      throw new SyntaxRuntimeError("Not a printable root: " +
                                   root.getClass().getName());
    }
    return p.sb.toString();
  }

  private void indent() {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  private void increaseIndent() {
    indentation += indentWidth;
  }

  private void decreaseIndent() {
    indentation -= indentWidth;
  }

  /**
   * Append statements inside curly braces.  The opening brace goes on
   * the current line, the closing one on its own line.
   */
  private void appendBlock(StatementSequence body) {
    sb.append("{\n");
    increaseIndent();
    appendLines(body);
    decreaseIndent();
    indent();
    sb.append("}");
  }

  private void appendLines(StatementSequence body) {
    for (Statement stmt: body) {
      indent();
      stmt.accept(this);
      sb.append("\n");
    }
  }

  private void appendMemberLine(Declaration decl) {
    indent();
    decl.accept(this);
    sb.append("\n");
  }

  private void appendAccess(AccessControl access) {
    // internal is the default and is left implicit
    if (access != AccessControl.INTERNAL) {
      sb.append(access.keyword());
      sb.append(" ");
    }
  }

  private void appendNameList(List<String> names) {
    sb.append(StringUtils.join(names, ", "));
  }

  private void appendInheritance(String superclass,
                                 List<String> conformances) {
    if (superclass == null && conformances.isEmpty()) {
      return;
    }
    sb.append(": ");
    if (superclass != null) {
      sb.append(superclass);
      if (!conformances.isEmpty()) {
        sb.append(", ");
      }
    }
    appendNameList(conformances);
  }

  private void appendGenerics(GenericsDeclaration generics) {
    if (generics == null) {
      return;
    }
    sb.append("<");
    boolean first = true;
    for (TypeParameter param: generics.typeParameters()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(param.name());
      if (param.hasConstraint()) {
        sb.append(": ");
        param.constraint().accept(this);
      }
    }
    sb.append(">");
  }

  private void appendParameters(List<FunctionParameter> params) {
    sb.append("(");
    boolean first = true;
    for (FunctionParameter param: params) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      // A label equal to the name is kept: it makes the name the
      // argument label even for initializer and subscript parameters
      if (param.hasLabel()) {
        sb.append(param.label());
        sb.append(" ");
      }
      sb.append(param.internalName());
      sb.append(": ");
      if (param.isInout()) {
        sb.append("inout ");
      }
      param.type().accept(this);
      if (param.isVariadic()) {
        sb.append("...");
      }
      if (param.hasDefaultValue()) {
        sb.append(" = ");
        param.defaultValue().accept(this);
      }
    }
    sb.append(")");
  }

  private void appendReturnType(SwiftType returnType) {
    if (returnType != null) {
      sb.append(" -> ");
      returnType.accept(this);
    }
  }

  private void appendCommaSeparated(List<Expression> exprs) {
    boolean first = true;
    for (Expression e: exprs) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      e.accept(this);
    }
  }

  /* ---------------------------------------------------------------- */
  /* Types                                                            */
  /* ---------------------------------------------------------------- */

  @Override
  public Void visitPrimitive(PrimitiveType type) {
    sb.append(type.primType().swiftName());
    return null;
  }

  @Override
  public Void visitOptional(OptionalType type) {
    // (Int) -> Int? would bind the ? to the result type
    boolean paren = type.wrapped().kind() == TypeKind.FUNCTION;
    if (paren) {
      sb.append("(");
    }
    type.wrapped().accept(this);
    if (paren) {
      sb.append(")");
    }
    sb.append("?");
    return null;
  }

  @Override
  public Void visitArray(ArrayType type) {
    sb.append("[");
    type.elementType().accept(this);
    sb.append("]");
    return null;
  }

  @Override
  public Void visitDictionary(DictionaryType type) {
    sb.append("[");
    type.keyType().accept(this);
    sb.append(": ");
    type.valueType().accept(this);
    sb.append("]");
    return null;
  }

  @Override
  public Void visitTuple(TupleType type) {
    appendTypeList(type.elementTypes());
    return null;
  }

  @Override
  public Void visitFunction(FunctionType type) {
    appendTypeList(type.parameterTypes());
    sb.append(" -> ");
    type.resultType().accept(this);
    return null;
  }

  @Override
  public Void visitCustom(CustomType type) {
    sb.append(type.name());
    return null;
  }

  private void appendTypeList(List<SwiftType> types) {
    sb.append("(");
    boolean first = true;
    for (SwiftType t: types) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      t.accept(this);
    }
    sb.append(")");
  }

  /* ---------------------------------------------------------------- */
  /* Expressions                                                      */
  /* ---------------------------------------------------------------- */

  /**
   * @return true if expression must be parenthesized when it is the
   *         operand of an operator
   */
  private static boolean isCompound(Expression e) {
    switch (e.kind()) {
      case BINARY:
      case UNARY:
      case CONDITIONAL:
      case ASSIGNMENT:
      case TYPE_CASTING:
      case PATTERN_MATCH:
        return true;
      case LITERAL:
        return isSigned(((LiteralExpression) e).literal());
      default:
        return false;
    }
  }

  /**
   * @return true if the literal prints with a leading minus sign, so that
   *    it reads as a prefix operator application
   */
  private static boolean isSigned(Literal lit) {
    switch (lit.getKind()) {
      case INTEGER:
        return lit.getIntLit() < 0;
      case FLOAT:
        // Includes -0.0 and -infinity, but not NaN
        return Double.compare(lit.getFloatLit(), 0.0) < 0;
      default:
        return false;
    }
  }

  /** Append the operand of an infix operator */
  private void appendOperand(Expression e) {
    // Prefix forms need no parentheses after an infix operator and space
    if (isCompound(e) && e.kind() != Expressions.ExprKind.UNARY &&
        e.kind() != Expressions.ExprKind.LITERAL) {
      appendParenthesized(e);
    } else {
      e.accept(this);
    }
  }

  /** Append an expression that is followed by a postfix: call, . or [] */
  private void appendPostfixTarget(Expression e) {
    if (isCompound(e) || e.kind() == Expressions.ExprKind.CLOSURE) {
      appendParenthesized(e);
    } else {
      e.accept(this);
    }
  }

  private void appendParenthesized(Expression e) {
    sb.append("(");
    e.accept(this);
    sb.append(")");
  }

  @Override
  public Void visitSelf(SelfExpression expr) {
    sb.append("self");
    return null;
  }

  @Override
  public Void visitSuper(SuperExpression expr) {
    sb.append("super");
    return null;
  }

  @Override
  public Void visitIdentifier(IdentifierExpression expr) {
    sb.append(expr.name());
    return null;
  }

  @Override
  public Void visitLiteral(LiteralExpression expr) {
    appendLiteral(expr.literal());
    return null;
  }

  @Override
  public Void visitBinary(BinaryExpression expr) {
    appendOperand(expr.left());
    sb.append(" ");
    sb.append(expr.operator().symbol());
    sb.append(" ");
    appendOperand(expr.right());
    return null;
  }

  @Override
  public Void visitUnary(UnaryExpression expr) {
    sb.append(expr.operator().symbol());
    // -(-x): adjacent operator characters would lex as one operator
    if (isCompound(expr.operand())) {
      appendParenthesized(expr.operand());
    } else {
      expr.operand().accept(this);
    }
    return null;
  }

  @Override
  public Void visitCall(CallExpression expr) {
    appendPostfixTarget(expr.callee());
    if (expr.hasGenericTypeArguments()) {
      sb.append("<");
      boolean first = true;
      for (SwiftType t: expr.genericTypeArguments()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        t.accept(this);
      }
      sb.append(">");
    }
    List<TrailingClosure> trailing = expr.trailingClosures();
    if (!expr.arguments().isEmpty() || trailing.isEmpty()) {
      sb.append("(");
      boolean first = true;
      for (Argument arg: expr.arguments()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        appendArgument(arg);
      }
      sb.append(")");
    }
    for (int i = 0; i < trailing.size(); i++) {
      TrailingClosure tc = trailing.get(i);
      sb.append(" ");
      // Swift has no syntax for a label on the first trailing closure
      if (i == 0 && tc.hasLabel()) {
        Logging.uniqueWarn("Label \"" + tc.label() + "\" of the first " +
              "trailing closure is not printed: Swift has no syntax for it");
      }
      if (i > 0 && tc.hasLabel()) {
        sb.append(tc.label());
        sb.append(": ");
      }
      tc.closure().accept(this);
    }
    return null;
  }

  private void appendArgument(Argument arg) {
    if (arg.hasLabel()) {
      sb.append(arg.label());
      sb.append(": ");
    }
    if (arg.isInout()) {
      sb.append("&");
    }
    arg.value().accept(this);
  }

  @Override
  public Void visitClosure(ClosureExpression expr) {
    sb.append("{");
    List<ClosureParameter> params = expr.parameters();
    boolean typed = expr.hasReturnType();
    for (ClosureParameter param: params) {
      typed = typed || param.hasTypeAnnotation();
    }
    if (typed) {
      sb.append(" (");
      boolean first = true;
      for (ClosureParameter param: params) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(param.name());
        if (param.hasTypeAnnotation()) {
          sb.append(": ");
          param.typeAnnotation().accept(this);
        }
      }
      sb.append(")");
      appendReturnType(expr.returnType());
      sb.append(" in");
    } else if (!params.isEmpty()) {
      sb.append(" ");
      boolean first = true;
      for (ClosureParameter param: params) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(param.name());
      }
      sb.append(" in");
    }
    sb.append("\n");
    increaseIndent();
    appendLines(expr.body());
    decreaseIndent();
    indent();
    sb.append("}");
    return null;
  }

  @Override
  public Void visitSubscript(SubscriptExpression expr) {
    appendPostfixTarget(expr.target());
    sb.append("[");
    expr.index().accept(this);
    sb.append("]");
    return null;
  }

  @Override
  public Void visitConditional(ConditionalExpression expr) {
    appendOperand(expr.condition());
    sb.append(" ? ");
    appendOperand(expr.trueExpression());
    sb.append(" : ");
    appendOperand(expr.falseExpression());
    return null;
  }

  @Override
  public Void visitTuple(TupleExpression expr) {
    sb.append("(");
    appendCommaSeparated(expr.elements());
    sb.append(")");
    return null;
  }

  @Override
  public Void visitArray(ArrayExpression expr) {
    sb.append("[");
    appendCommaSeparated(expr.elements());
    sb.append("]");
    return null;
  }

  @Override
  public Void visitDictionary(DictionaryExpression expr) {
    if (expr.entries().isEmpty()) {
      sb.append("[:]");
      return null;
    }
    sb.append("[");
    boolean first = true;
    for (DictionaryEntry entry: expr.entries()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      entry.key().accept(this);
      sb.append(": ");
      entry.value().accept(this);
    }
    sb.append("]");
    return null;
  }

  @Override
  public Void visitMemberAccess(MemberAccessExpression expr) {
    appendPostfixTarget(expr.target());
    sb.append(".");
    sb.append(expr.member());
    return null;
  }

  @Override
  public Void visitTypeCasting(TypeCastingExpression expr) {
    appendOperand(expr.expression());
    sb.append(" ");
    sb.append(expr.castKind().keyword());
    sb.append(" ");
    expr.targetType().accept(this);
    return null;
  }

  @Override
  public Void visitPatternMatch(PatternMatchExpression expr) {
    appendOperand(expr.pattern());
    sb.append(" ~= ");
    appendOperand(expr.expression());
    return null;
  }

  @Override
  public Void visitKeyPath(KeyPathExpression expr) {
    sb.append("\\");
    if (expr.hasTypeName()) {
      sb.append(expr.typeName());
    }
    for (String component: expr.path()) {
      sb.append(".");
      sb.append(component);
    }
    return null;
  }

  @Override
  public Void visitAssignment(AssignmentExpression expr) {
    appendOperand(expr.target());
    sb.append(" = ");
    appendOperand(expr.value());
    return null;
  }

  /* ---------------------------------------------------------------- */
  /* Literals                                                         */
  /* ---------------------------------------------------------------- */

  private void appendLiteral(Literal lit) {
    switch (lit.getKind()) {
      case INTEGER:
        sb.append(lit.getIntLit());
        break;
      case FLOAT:
        appendFloat(lit.getFloatLit());
        break;
      case BOOL:
        sb.append(lit.getBoolLit());
        break;
      case STRING:
        sb.append('"');
        appendEscaped(lit.getStringLit());
        sb.append('"');
        break;
      case CHARACTER:
        sb.append('"');
        appendEscaped(new String(Character.toChars(lit.getCharLit())));
        sb.append('"');
        break;
      case NIL:
        sb.append("nil");
        break;
      default:
        throw new SyntaxRuntimeError("Unknown literal kind " +
                                     lit.getKind());
    }
  }

  private void appendFloat(double v) {
    if (Double.isNaN(v)) {
      sb.append("Double.nan");
    } else if (Double.isInfinite(v)) {
      sb.append(v > 0 ? "Double.infinity" : "-Double.infinity");
    } else {
      sb.append(Double.toString(v));
    }
  }

  /**
   * Escape string contents for a Swift string literal
   */
  private void appendEscaped(String s) {
    int i = 0;
    while (i < s.length()) {
      int c = s.codePointAt(i);
      i += Character.charCount(c);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append("\\\"");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case 0:
          sb.append("\\0");
          break;
        default:
          if (Character.isISOControl(c)) {
            sb.append("\\u{");
            sb.append(Integer.toHexString(c));
            sb.append("}");
          } else {
            sb.appendCodePoint(c);
          }
      }
    }
  }

  /* ---------------------------------------------------------------- */
  /* Patterns                                                         */
  /* ---------------------------------------------------------------- */

  @Override
  public Void visitLiteral(LiteralPattern pattern) {
    appendLiteral(pattern.value());
    return null;
  }

  @Override
  public Void visitIdentifier(IdentifierPattern pattern) {
    sb.append("let ");
    sb.append(pattern.identifier().getName());
    return null;
  }

  @Override
  public Void visitTuple(TuplePattern pattern) {
    sb.append("(");
    appendPatterns(pattern.elements());
    sb.append(")");
    return null;
  }

  @Override
  public Void visitEnumCase(EnumCasePattern pattern) {
    if (pattern.hasEnumName()) {
      sb.append(pattern.enumName());
    }
    sb.append(".");
    sb.append(pattern.caseName());
    if (!pattern.associatedValues().isEmpty()) {
      sb.append("(");
      appendPatterns(pattern.associatedValues());
      sb.append(")");
    }
    return null;
  }

  @Override
  public Void visitWildcard(WildcardPattern pattern) {
    sb.append("_");
    return null;
  }

  @Override
  public Void visitType(TypePattern pattern) {
    sb.append("is ");
    pattern.type().accept(this);
    return null;
  }

  private void appendPatterns(List<Pattern> patterns) {
    boolean first = true;
    for (Pattern p: patterns) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      p.accept(this);
    }
  }

  /* ---------------------------------------------------------------- */
  /* Statements                                                       */
  /* ---------------------------------------------------------------- */

  @Override
  public Void visitBreak(BreakStatement stmt) {
    sb.append("break");
    if (stmt.hasLabel()) {
      sb.append(" ");
      sb.append(stmt.label());
    }
    return null;
  }

  @Override
  public Void visitContinue(ContinueStatement stmt) {
    sb.append("continue");
    if (stmt.hasLabel()) {
      sb.append(" ");
      sb.append(stmt.label());
    }
    return null;
  }

  @Override
  public Void visitExpression(ExpressionStatement stmt) {
    stmt.expression().accept(this);
    return null;
  }

  @Override
  public Void visitDeclaration(DeclarationStatement stmt) {
    stmt.declaration().accept(this);
    return null;
  }

  @Override
  public Void visitReturn(ReturnStatement stmt) {
    sb.append("return");
    if (stmt.hasExpression()) {
      sb.append(" ");
      stmt.expression().accept(this);
    }
    return null;
  }

  @Override
  public Void visitIf(IfStatement stmt) {
    sb.append("if ");
    stmt.condition().accept(this);
    sb.append(" ");
    appendBlock(stmt.body());
    if (stmt.hasElse()) {
      StatementSequence elseBody = stmt.elseBody();
      sb.append(" else ");
      if (elseBody.size() == 1 && elseBody.get(0).kind() == StmtKind.IF) {
        elseBody.get(0).accept(this);
      } else {
        appendBlock(elseBody);
      }
    }
    return null;
  }

  @Override
  public Void visitForLoop(ForLoopStatement stmt) {
    sb.append("for ");
    sb.append(stmt.variable());
    sb.append(" in ");
    appendOperand(stmt.rangeStart());
    sb.append(stmt.rangeKind().operator());
    appendOperand(stmt.rangeEnd());
    sb.append(" ");
    appendBlock(stmt.body());
    return null;
  }

  @Override
  public Void visitWhileLoop(WhileLoopStatement stmt) {
    sb.append("while ");
    stmt.condition().accept(this);
    sb.append(" ");
    appendBlock(stmt.body());
    return null;
  }

  @Override
  public Void visitRepeatWhileLoop(RepeatWhileLoopStatement stmt) {
    sb.append("repeat ");
    appendBlock(stmt.body());
    sb.append(" while ");
    stmt.condition().accept(this);
    return null;
  }

  @Override
  public Void visitSwitch(SwitchStatement stmt) {
    sb.append("switch ");
    stmt.expression().accept(this);
    sb.append(" {\n");
    for (Case c: stmt.cases()) {
      indent();
      sb.append("case ");
      int start = sb.length();
      appendPatterns(c.patterns());
      if (c.hasGuard()) {
        sb.append(" where ");
        c.guardExpression().accept(this);
      }
      if (c.body().isEmpty()) {
        warnEmptyCase("\"case " + sb.substring(start) + "\"");
      }
      sb.append(":\n");
      increaseIndent();
      appendLines(c.body());
      decreaseIndent();
    }
    if (stmt.hasDefault()) {
      if (stmt.defaultCase().isEmpty()) {
        warnEmptyCase("\"default\"");
      }
      indent();
      sb.append("default:\n");
      increaseIndent();
      appendLines(stmt.defaultCase());
      decreaseIndent();
    }
    indent();
    sb.append("}");
    return null;
  }

  /** Printed as is, but Swift needs at least one statement per case */
  private static void warnEmptyCase(String label) {
    Logging.uniqueWarn("Switch case " + label + " has an empty body, " +
                       "which Swift does not allow");
  }

  @Override
  public Void visitGuard(GuardStatement stmt) {
    sb.append("guard ");
    stmt.condition().accept(this);
    sb.append(" else ");
    appendBlock(stmt.body());
    return null;
  }

  @Override
  public Void visitThrow(ThrowStatement stmt) {
    sb.append("throw ");
    stmt.expression().accept(this);
    return null;
  }

  @Override
  public Void visitDoCatch(DoCatchStatement stmt) {
    sb.append("do ");
    appendBlock(stmt.body());
    sb.append(" catch ");
    appendBlock(stmt.catchBody());
    return null;
  }

  @Override
  public Void visitAssignment(AssignmentStatement stmt) {
    stmt.target().accept(this);
    sb.append(" = ");
    stmt.value().accept(this);
    return null;
  }

  /* ---------------------------------------------------------------- */
  /* Declarations                                                     */
  /* ---------------------------------------------------------------- */

  @Override
  public Void visitFunction(FunDeclaration decl) {
    appendAccess(decl.accessControl());
    sb.append("func ");
    sb.append(decl.name());
    appendGenerics(decl.generics());
    appendParameters(decl.parameters());
    if (decl.isThrowing()) {
      sb.append(" throws");
    }
    appendReturnType(decl.returnType());
    if (decl.hasBody()) {
      sb.append(" ");
      appendBlock(decl.body());
    }
    return null;
  }

  @Override
  public Void visitVar(VarDeclaration decl) {
    appendBinding("var", decl.name(), decl.type(), decl.initialValue());
    return null;
  }

  @Override
  public Void visitLet(LetDeclaration decl) {
    appendBinding("let", decl.name(), decl.type(), decl.initialValue());
    return null;
  }

  private void appendBinding(String keyword, String name, SwiftType type,
                             Expression initialValue) {
    sb.append(keyword);
    sb.append(" ");
    sb.append(name);
    if (type != null) {
      sb.append(": ");
      type.accept(this);
    }
    if (initialValue != null) {
      sb.append(" = ");
      initialValue.accept(this);
    }
  }

  @Override
  public Void visitStruct(StructDeclaration decl) {
    sb.append("struct ");
    sb.append(decl.name());
    appendGenerics(decl.generics());
    appendInheritance(null, decl.conformances());
    appendMembers(decl.properties(), decl.initializers(), decl.methods(),
                  null);
    return null;
  }

  @Override
  public Void visitClass(ClassDeclaration decl) {
    sb.append("class ");
    sb.append(decl.name());
    appendGenerics(decl.generics());
    appendInheritance(decl.superclass(), decl.conformances());
    appendMembers(decl.properties(), decl.initializers(), decl.methods(),
                  decl.deinitializer());
    return null;
  }

  @Override
  public Void visitExtension(ExtensionDeclaration decl) {
    sb.append("extension ");
    sb.append(decl.typeName());
    appendInheritance(null, decl.conformances());
    appendMembers(decl.properties(), decl.initializers(), decl.methods(),
                  null);
    return null;
  }

  /**
   * Members go in a fixed order: properties, initializers, methods,
   * deinit.
   */
  private void appendMembers(List<PropertyDeclaration> properties,
      List<InitializerDeclaration> initializers,
      List<FunDeclaration> methods, DeinitializerDeclaration deinit) {
    sb.append(" {\n");
    increaseIndent();
    for (PropertyDeclaration prop: properties) {
      indent();
      appendProperty(prop);
      sb.append("\n");
    }
    for (InitializerDeclaration init: initializers) {
      appendMemberLine(init);
    }
    for (FunDeclaration method: methods) {
      appendMemberLine(method);
    }
    if (deinit != null) {
      appendMemberLine(deinit);
    }
    decreaseIndent();
    indent();
    sb.append("}");
  }

  private void appendProperty(PropertyDeclaration prop) {
    switch (prop.kind()) {
      case STORED: {
        StoredProperty stored = (StoredProperty) prop;
        appendBinding(stored.isConstant() ? "let" : "var", stored.name(),
                      stored.type(), stored.initialValue());
        break;
      }
      case COMPUTED: {
        ComputedProperty computed = (ComputedProperty) prop;
        sb.append("var ");
        sb.append(computed.name());
        sb.append(": ");
        computed.type().accept(this);
        sb.append(" ");
        if (!computed.hasSetter()) {
          // read-only shorthand
          appendBlock(computed.getter());
        } else {
          sb.append("{\n");
          increaseIndent();
          indent();
          sb.append("get ");
          appendBlock(computed.getter());
          sb.append("\n");
          indent();
          sb.append("set");
          if (computed.setter().hasParameterName()) {
            sb.append("(");
            sb.append(computed.setter().parameterName());
            sb.append(")");
          }
          sb.append(" ");
          appendBlock(computed.setter().body());
          sb.append("\n");
          decreaseIndent();
          indent();
          sb.append("}");
        }
        break;
      }
      default:
        throw new SyntaxRuntimeError("Unknown property kind " + prop.kind());
    }
  }

  @Override
  public Void visitEnum(EnumDeclaration decl) {
    sb.append("enum ");
    sb.append(decl.name());
    appendGenerics(decl.generics());
    if (decl.hasRawType() || !decl.conformances().isEmpty()) {
      sb.append(": ");
      if (decl.hasRawType()) {
        decl.rawType().accept(this);
        if (!decl.conformances().isEmpty()) {
          sb.append(", ");
        }
      }
      appendNameList(decl.conformances());
    }
    sb.append(" {\n");
    increaseIndent();
    for (EnumCase c: decl.cases()) {
      indent();
      appendEnumCase(decl.name(), c);
      sb.append("\n");
    }
    decreaseIndent();
    indent();
    sb.append("}");
    return null;
  }

  private void appendEnumCase(String enumName, EnumCase c) {
    if (!c.associatedValues().isEmpty() && c.hasRawValue()) {
      Logging.uniqueWarn("Enum case " + enumName + "." + c.name() +
            " has both associated values and a raw value, which Swift " +
            "does not allow");
    }
    sb.append("case ");
    sb.append(c.name());
    if (!c.associatedValues().isEmpty()) {
      sb.append("(");
      boolean first = true;
      for (EnumAssociatedValue v: c.associatedValues()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        if (v.hasLabel()) {
          sb.append(v.label());
          sb.append(": ");
        }
        v.type().accept(this);
      }
      sb.append(")");
    }
    if (c.hasRawValue()) {
      sb.append(" = ");
      c.rawValue().accept(this);
    }
  }

  @Override
  public Void visitProtocol(ProtocolDeclaration decl) {
    sb.append("protocol ");
    sb.append(decl.name());
    appendInheritance(null, decl.inheritedProtocols());
    sb.append(" {\n");
    increaseIndent();
    for (PropertyRequirement req: decl.propertyRequirements()) {
      indent();
      sb.append("var ");
      sb.append(req.name());
      sb.append(": ");
      req.type().accept(this);
      sb.append(req.isReadOnly() ? " { get }" : " { get set }");
      sb.append("\n");
    }
    for (InitializerRequirement req: decl.initializerRequirements()) {
      indent();
      sb.append(req.isFailable() ? "init?" : "init");
      appendParameters(req.parameters());
      sb.append("\n");
    }
    for (MethodRequirement req: decl.methodRequirements()) {
      indent();
      if (req.isMutating()) {
        sb.append("mutating ");
      }
      sb.append("func ");
      sb.append(req.name());
      appendParameters(req.parameters());
      appendReturnType(req.returnType());
      sb.append("\n");
    }
    decreaseIndent();
    indent();
    sb.append("}");
    return null;
  }

  @Override
  public Void visitTypeAlias(TypeAliasDeclaration decl) {
    sb.append("typealias ");
    sb.append(decl.name());
    sb.append(" = ");
    decl.target().accept(this);
    return null;
  }

  @Override
  public Void visitImport(ImportDeclaration decl) {
    sb.append("import ");
    ImportSymbol symbol = decl.symbol();
    if (symbol.isEntireModule()) {
      sb.append(decl.module());
    } else {
      sb.append(symbol.kind().keyword());
      sb.append(" ");
      sb.append(decl.module());
      sb.append(".");
      sb.append(symbol.name());
    }
    return null;
  }

  @Override
  public Void visitInitializer(InitializerDeclaration decl) {
    appendAccess(decl.accessControl());
    if (decl.isConvenience()) {
      sb.append("convenience ");
    }
    sb.append(decl.isFailable() ? "init?" : "init");
    appendGenerics(decl.generics());
    appendParameters(decl.parameters());
    sb.append(" ");
    appendBlock(decl.body());
    return null;
  }

  @Override
  public Void visitDeinitializer(DeinitializerDeclaration decl) {
    sb.append("deinit ");
    appendBlock(decl.body());
    return null;
  }
}
