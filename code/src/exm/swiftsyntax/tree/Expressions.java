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
package exm.swiftsyntax.tree;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.swiftsyntax.printer.SwiftPrinter;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;

/**
 * Expressions: every construct with a value.
 *
 * Expression is a closed hierarchy: its constructor is private, so only
 * the variants nested in this class exist.  Consumers dispatch either
 * with a {@link Visitor}, or with a switch on {@link ExprKind} whose
 * default case throws.
 *
 * An expression never holds a statement directly.  The one path from
 * an expression to statements is the body of a ClosureExpression.
 */
public class Expressions {

  public static enum ExprKind {
    SELF,
    SUPER,
    IDENTIFIER,
    LITERAL,
    BINARY,
    UNARY,
    CALL,
    CLOSURE,
    SUBSCRIPT,
    CONDITIONAL,
    TUPLE,
    ARRAY,
    DICTIONARY,
    MEMBER_ACCESS,
    TYPE_CASTING,
    PATTERN_MATCH,
    KEY_PATH,
    ASSIGNMENT,
  }

  /**
   * Which of Swift's cast operators a TypeCastingExpression uses.
   * The three differ in what happens when the cast fails.
   */
  public static enum CastKind {
    /** as: guaranteed conversion, checked at compile time */
    AS("as"),
    /** as?: yields nil on failure */
    CONDITIONAL("as?"),
    /** as!: traps on failure */
    FORCED("as!");

    private final String keyword;

    private CastKind(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  public static interface Visitor<R> {
    R visitSelf(SelfExpression expr);
    R visitSuper(SuperExpression expr);
    R visitIdentifier(IdentifierExpression expr);
    R visitLiteral(LiteralExpression expr);
    R visitBinary(BinaryExpression expr);
    R visitUnary(UnaryExpression expr);
    R visitCall(CallExpression expr);
    R visitClosure(ClosureExpression expr);
    R visitSubscript(SubscriptExpression expr);
    R visitConditional(ConditionalExpression expr);
    R visitTuple(TupleExpression expr);
    R visitArray(ArrayExpression expr);
    R visitDictionary(DictionaryExpression expr);
    R visitMemberAccess(MemberAccessExpression expr);
    R visitTypeCasting(TypeCastingExpression expr);
    R visitPatternMatch(PatternMatchExpression expr);
    R visitKeyPath(KeyPathExpression expr);
    R visitAssignment(AssignmentExpression expr);
  }

  public abstract static class Expression extends AbstractSyntaxNode {

    private Expression() {
    }

    public abstract ExprKind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    /** Prints the expression as Swift source */
    @Override
    public String toString() {
      return SwiftPrinter.describe(this);
    }
  }

  /**
   * Operator symbol of a binary expression, e.g. "+" or "??".
   * Precedence and associativity are not recorded.
   */
  public static class InfixIdentifier {
    private final String symbol;

    public InfixIdentifier(String symbol) {
      this.symbol = Preconditions.checkNotNull(symbol, "symbol");
    }

    public String symbol() {
      return symbol;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof InfixIdentifier &&
             symbol.equals(((InfixIdentifier) o).symbol);
    }

    @Override
    public int hashCode() {
      return symbol.hashCode();
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /** Operator symbol of a prefix unary expression, e.g. "-" or "!" */
  public static class UnaryIdentifier {
    private final String symbol;

    public UnaryIdentifier(String symbol) {
      this.symbol = Preconditions.checkNotNull(symbol, "symbol");
    }

    public String symbol() {
      return symbol;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof UnaryIdentifier &&
             symbol.equals(((UnaryIdentifier) o).symbol);
    }

    @Override
    public int hashCode() {
      return symbol.hashCode();
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /** self */
  public static class SelfExpression extends Expression {
    @Override
    public ExprKind kind() {
      return ExprKind.SELF;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSelf(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** super */
  public static class SuperExpression extends Expression {
    @Override
    public ExprKind kind() {
      return ExprKind.SUPER;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSuper(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static class IdentifierExpression extends Expression {
    private final Identifier identifier;

    public IdentifierExpression(Identifier identifier) {
      this.identifier = Preconditions.checkNotNull(identifier, "identifier");
    }

    public Identifier identifier() {
      return identifier;
    }

    public String name() {
      return identifier.getName();
    }

    @Override
    public ExprKind kind() {
      return ExprKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIdentifier(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(identifier);
    }
  }

  public static class LiteralExpression extends Expression {
    private final Literal literal;

    public LiteralExpression(Literal literal) {
      this.literal = Preconditions.checkNotNull(literal, "literal");
    }

    public Literal literal() {
      return literal;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LITERAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteral(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(literal);
    }
  }

  /**
   * left op right.  The producer is responsible for nesting binary
   * expressions according to precedence; nothing here can check it.
   */
  public static class BinaryExpression extends Expression {
    private final Expression left;
    private final InfixIdentifier operator;
    private final Expression right;

    public BinaryExpression(Expression left, InfixIdentifier operator,
                            Expression right) {
      this.left = Preconditions.checkNotNull(left, "left");
      this.operator = Preconditions.checkNotNull(operator, "operator");
      this.right = Preconditions.checkNotNull(right, "right");
    }

    public Expression left() {
      return left;
    }

    public InfixIdentifier operator() {
      return operator;
    }

    public Expression right() {
      return right;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.BINARY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(left, right);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(operator);
    }
  }

  public static class UnaryExpression extends Expression {
    private final UnaryIdentifier operator;
    private final Expression operand;

    public UnaryExpression(UnaryIdentifier operator, Expression operand) {
      this.operator = Preconditions.checkNotNull(operator, "operator");
      this.operand = Preconditions.checkNotNull(operand, "operand");
    }

    public UnaryIdentifier operator() {
      return operator;
    }

    public Expression operand() {
      return operand;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.UNARY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(operand);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(operator);
    }
  }

  /**
   * An argument inside the parentheses of a call.
   * Labels are expected to be unique within one call; that is the
   * producer's job to ensure.
   */
  public static class Argument extends AbstractSyntaxNode {
    private final String label;
    private final Expression value;
    private final boolean variadic;
    private final boolean inout;

    public Argument(String label, Expression value, boolean variadic,
                    boolean inout) {
      this.label = label;
      this.value = Preconditions.checkNotNull(value, "value");
      this.variadic = variadic;
      this.inout = inout;
    }

    public static Argument unlabelled(Expression value) {
      return new Argument(null, value, false, false);
    }

    public static Argument labelled(String label, Expression value) {
      return new Argument(label, value, false, false);
    }

    public boolean hasLabel() {
      return label != null;
    }

    /** @return the label, or null if none */
    public String label() {
      return label;
    }

    public Expression value() {
      return value;
    }

    public boolean isVariadic() {
      return variadic;
    }

    /** True for &x arguments */
    public boolean isInout() {
      return inout;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(value);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(label, variadic, inout);
    }
  }

  /**
   * A closure written after the parentheses of a call.  The first
   * trailing closure of a call is usually unlabelled, any further ones
   * are labelled.
   */
  public static class TrailingClosure extends AbstractSyntaxNode {
    private final String label;
    private final ClosureExpression closure;

    public TrailingClosure(String label, ClosureExpression closure) {
      this.label = label;
      this.closure = Preconditions.checkNotNull(closure, "closure");
    }

    public boolean hasLabel() {
      return label != null;
    }

    /** @return the label, or null if none */
    public String label() {
      return label;
    }

    public ClosureExpression closure() {
      return closure;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(closure);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(label);
    }
  }

  /**
   * callee<T...>(arguments) trailing-closures.
   * Trailing closures are kept apart from the parenthesised arguments.
   */
  public static class CallExpression extends Expression {
    private final Expression callee;
    private final ImmutableList<Argument> arguments;
    /** Explicit generic arguments, null if none were written */
    private final ImmutableList<SwiftType> genericTypeArguments;
    private final ImmutableList<TrailingClosure> trailingClosures;

    public CallExpression(Expression callee, List<Argument> arguments,
        List<SwiftType> genericTypeArguments,
        List<TrailingClosure> trailingClosures) {
      this.callee = Preconditions.checkNotNull(callee, "callee");
      this.arguments = ImmutableList.copyOf(arguments);
      this.genericTypeArguments = genericTypeArguments == null ? null :
                            ImmutableList.copyOf(genericTypeArguments);
      this.trailingClosures = ImmutableList.copyOf(trailingClosures);
    }

    public CallExpression(Expression callee, List<Argument> arguments) {
      this(callee, arguments, null, ImmutableList.<TrailingClosure>of());
    }

    public Expression callee() {
      return callee;
    }

    public List<Argument> arguments() {
      return arguments;
    }

    public boolean hasGenericTypeArguments() {
      return genericTypeArguments != null;
    }

    /** @return generic arguments, or null if none were written */
    public List<SwiftType> genericTypeArguments() {
      return genericTypeArguments;
    }

    public List<TrailingClosure> trailingClosures() {
      return trailingClosures;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.CALL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public List<SyntaxNode> children() {
      Children c = Children.create().add(callee);
      if (genericTypeArguments != null) {
        c.addAll(genericTypeArguments);
      }
      return c.addAll(arguments).addAll(trailingClosures).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(genericTypeArguments != null);
    }
  }

  public static class ClosureParameter extends AbstractSyntaxNode {
    private final String name;
    private final SwiftType typeAnnotation;

    public ClosureParameter(String name, SwiftType typeAnnotation) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.typeAnnotation = typeAnnotation;
    }

    public String name() {
      return name;
    }

    public boolean hasTypeAnnotation() {
      return typeAnnotation != null;
    }

    /** @return the declared type, or null if left to inference */
    public SwiftType typeAnnotation() {
      return typeAnnotation;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(typeAnnotation).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, typeAnnotation != null);
    }
  }

  /**
   * { (params) -> R in body }
   */
  public static class ClosureExpression extends Expression {
    private final ImmutableList<ClosureParameter> parameters;
    private final SwiftType returnType;
    private final boolean escaping;
    private final StatementSequence body;

    public ClosureExpression(List<ClosureParameter> parameters,
        SwiftType returnType, boolean escaping, StatementSequence body) {
      this.parameters = ImmutableList.copyOf(parameters);
      this.returnType = returnType;
      this.escaping = escaping;
      this.body = Preconditions.checkNotNull(body, "body");
    }

    public List<ClosureParameter> parameters() {
      return parameters;
    }

    public boolean hasReturnType() {
      return returnType != null;
    }

    /** @return the declared return type, or null */
    public SwiftType returnType() {
      return returnType;
    }

    /** True if marked @escaping */
    public boolean isEscaping() {
      return escaping;
    }

    public StatementSequence body() {
      return body;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.CLOSURE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitClosure(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().addAll(parameters).add(returnType)
                              .add(body).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(returnType != null, escaping);
    }
  }

  /** target[index] */
  public static class SubscriptExpression extends Expression {
    private final Expression target;
    private final Expression index;

    public SubscriptExpression(Expression target, Expression index) {
      this.target = Preconditions.checkNotNull(target, "target");
      this.index = Preconditions.checkNotNull(index, "index");
    }

    public Expression target() {
      return target;
    }

    public Expression index() {
      return index;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.SUBSCRIPT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSubscript(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(target, index);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** condition ? trueExpression : falseExpression */
  public static class ConditionalExpression extends Expression {
    private final Expression condition;
    private final Expression trueExpression;
    private final Expression falseExpression;

    public ConditionalExpression(Expression condition,
        Expression trueExpression, Expression falseExpression) {
      this.condition = Preconditions.checkNotNull(condition, "condition");
      this.trueExpression = Preconditions.checkNotNull(trueExpression,
                                                       "trueExpression");
      this.falseExpression = Preconditions.checkNotNull(falseExpression,
                                                        "falseExpression");
    }

    public Expression condition() {
      return condition;
    }

    public Expression trueExpression() {
      return trueExpression;
    }

    public Expression falseExpression() {
      return falseExpression;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.CONDITIONAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConditional(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(condition, trueExpression,
                                          falseExpression);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static class TupleExpression extends Expression {
    private final ImmutableList<Expression> elements;

    public TupleExpression(List<Expression> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    public List<Expression> elements() {
      return elements;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.TUPLE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTuple(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>copyOf(elements);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static class ArrayExpression extends Expression {
    private final ImmutableList<Expression> elements;

    public ArrayExpression(List<Expression> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    public List<Expression> elements() {
      return elements;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ARRAY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArray(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>copyOf(elements);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** key: value inside a dictionary literal */
  public static class DictionaryEntry extends AbstractSyntaxNode {
    private final Expression key;
    private final Expression value;

    public DictionaryEntry(Expression key, Expression value) {
      this.key = Preconditions.checkNotNull(key, "key");
      this.value = Preconditions.checkNotNull(value, "value");
    }

    public Expression key() {
      return key;
    }

    public Expression value() {
      return value;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(key, value);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static class DictionaryExpression extends Expression {
    private final ImmutableList<DictionaryEntry> entries;

    public DictionaryExpression(List<DictionaryEntry> entries) {
      this.entries = ImmutableList.copyOf(entries);
    }

    public List<DictionaryEntry> entries() {
      return entries;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.DICTIONARY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDictionary(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>copyOf(entries);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** target.member */
  public static class MemberAccessExpression extends Expression {
    private final Expression target;
    private final String member;

    public MemberAccessExpression(Expression target, String member) {
      this.target = Preconditions.checkNotNull(target, "target");
      this.member = Preconditions.checkNotNull(member, "member");
    }

    public Expression target() {
      return target;
    }

    public String member() {
      return member;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.MEMBER_ACCESS;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMemberAccess(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(target);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(member);
    }
  }

  /** expression as/as?/as! TargetType */
  public static class TypeCastingExpression extends Expression {
    private final Expression expression;
    private final CastKind castKind;
    private final SwiftType targetType;

    public TypeCastingExpression(Expression expression, CastKind castKind,
                                 SwiftType targetType) {
      this.expression = Preconditions.checkNotNull(expression, "expression");
      this.castKind = Preconditions.checkNotNull(castKind, "castKind");
      this.targetType = Preconditions.checkNotNull(targetType, "targetType");
    }

    public Expression expression() {
      return expression;
    }

    public CastKind castKind() {
      return castKind;
    }

    public SwiftType targetType() {
      return targetType;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.TYPE_CASTING;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTypeCasting(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(expression, targetType);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(castKind);
    }
  }

  /** case pattern = expression */
  public static class PatternMatchExpression extends Expression {
    private final Expression pattern;
    private final Expression expression;

    public PatternMatchExpression(Expression pattern, Expression expression) {
      this.pattern = Preconditions.checkNotNull(pattern, "pattern");
      this.expression = Preconditions.checkNotNull(expression, "expression");
    }

    public Expression pattern() {
      return pattern;
    }

    public Expression expression() {
      return expression;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.PATTERN_MATCH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPatternMatch(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(pattern, expression);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /**
   * \Type.a.b, or \.a.b when the root type is left to inference
   */
  public static class KeyPathExpression extends Expression {
    private final String typeName;
    private final ImmutableList<String> path;

    public KeyPathExpression(String typeName, List<String> path) {
      this.typeName = typeName;
      this.path = ImmutableList.copyOf(path);
    }

    public boolean hasTypeName() {
      return typeName != null;
    }

    /** @return root type name, or null if inferred from context */
    public String typeName() {
      return typeName;
    }

    public List<String> path() {
      return path;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.KEY_PATH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitKeyPath(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(typeName, path);
    }
  }

  /** target = value, used as an expression */
  public static class AssignmentExpression extends Expression {
    private final Expression target;
    private final Expression value;

    public AssignmentExpression(Expression target, Expression value) {
      this.target = Preconditions.checkNotNull(target, "target");
      this.value = Preconditions.checkNotNull(value, "value");
    }

    public Expression target() {
      return target;
    }

    public Expression value() {
      return value;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ASSIGNMENT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignment(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(target, value);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static IdentifierExpression identifier(String name) {
    return new IdentifierExpression(new Identifier(name));
  }

  public static LiteralExpression intLit(long v) {
    return new LiteralExpression(Literal.createIntLit(v));
  }

  public static LiteralExpression floatLit(double v) {
    return new LiteralExpression(Literal.createFloatLit(v));
  }

  public static LiteralExpression boolLit(boolean v) {
    return new LiteralExpression(Literal.createBoolLit(v));
  }

  public static LiteralExpression stringLit(String v) {
    return new LiteralExpression(Literal.createStringLit(v));
  }

  public static LiteralExpression nil() {
    return new LiteralExpression(Literal.createNil());
  }

  public static BinaryExpression binary(Expression left, String op,
                                        Expression right) {
    return new BinaryExpression(left, new InfixIdentifier(op), right);
  }

  public static UnaryExpression unary(String op, Expression operand) {
    return new UnaryExpression(new UnaryIdentifier(op), operand);
  }

  public static MemberAccessExpression member(Expression target,
                                              String member) {
    return new MemberAccessExpression(target, member);
  }

  public static CallExpression call(Expression callee, Argument ...args) {
    return new CallExpression(callee, Arrays.asList(args));
  }
}
