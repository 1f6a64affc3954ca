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
import exm.swiftsyntax.tree.Declarations.Declaration;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Patterns.Pattern;

/**
 * Statements: one per control-flow or effect unit.  Nested blocks are
 * always {@link StatementSequence}s.
 */
public class Statements {

  public static enum StmtKind {
    BREAK,
    CONTINUE,
    EXPRESSION,
    DECLARATION,
    RETURN,
    IF,
    FOR_LOOP,
    WHILE_LOOP,
    REPEAT_WHILE_LOOP,
    SWITCH,
    GUARD,
    THROW,
    DO_CATCH,
    ASSIGNMENT,
  }

  public static interface Visitor<R> {
    R visitBreak(BreakStatement stmt);
    R visitContinue(ContinueStatement stmt);
    R visitExpression(ExpressionStatement stmt);
    R visitDeclaration(DeclarationStatement stmt);
    R visitReturn(ReturnStatement stmt);
    R visitIf(IfStatement stmt);
    R visitForLoop(ForLoopStatement stmt);
    R visitWhileLoop(WhileLoopStatement stmt);
    R visitRepeatWhileLoop(RepeatWhileLoopStatement stmt);
    R visitSwitch(SwitchStatement stmt);
    R visitGuard(GuardStatement stmt);
    R visitThrow(ThrowStatement stmt);
    R visitDoCatch(DoCatchStatement stmt);
    R visitAssignment(AssignmentStatement stmt);
  }

  public abstract static class Statement extends AbstractSyntaxNode {

    private Statement() {
    }

    public abstract StmtKind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public String toString() {
      return SwiftPrinter.describe(this);
    }
  }

  /** break, optionally with a loop label */
  public static class BreakStatement extends Statement {
    private final String label;

    public BreakStatement(String label) {
      this.label = label;
    }

    public boolean hasLabel() {
      return label != null;
    }

    /** @return label, or null if none */
    public String label() {
      return label;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.BREAK;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBreak(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(label);
    }
  }

  /** continue, optionally with a loop label */
  public static class ContinueStatement extends Statement {
    private final String label;

    public ContinueStatement(String label) {
      this.label = label;
    }

    public boolean hasLabel() {
      return label != null;
    }

    /** @return label, or null if none */
    public String label() {
      return label;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.CONTINUE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitContinue(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(label);
    }
  }

  /** An expression evaluated for its effect */
  public static class ExpressionStatement extends Statement {
    private final Expression expression;

    public ExpressionStatement(Expression expression) {
      this.expression = Preconditions.checkNotNull(expression, "expression");
    }

    public Expression expression() {
      return expression;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.EXPRESSION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExpression(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(expression);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** A declaration appearing in statement position */
  public static class DeclarationStatement extends Statement {
    private final Declaration declaration;

    public DeclarationStatement(Declaration declaration) {
      this.declaration = Preconditions.checkNotNull(declaration,
                                                    "declaration");
    }

    public Declaration declaration() {
      return declaration;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.DECLARATION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDeclaration(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(declaration);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static class ReturnStatement extends Statement {
    private final Expression expression;

    public ReturnStatement(Expression expression) {
      this.expression = expression;
    }

    public boolean hasExpression() {
      return expression != null;
    }

    /** @return returned value, or null for a bare return */
    public Expression expression() {
      return expression;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.RETURN;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReturn(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(expression).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(expression != null);
    }
  }

  public static class IfStatement extends Statement {
    private final Expression condition;
    private final StatementSequence body;
    private final StatementSequence elseBody;

    public IfStatement(Expression condition, StatementSequence body,
                       StatementSequence elseBody) {
      this.condition = Preconditions.checkNotNull(condition, "condition");
      this.body = Preconditions.checkNotNull(body, "body");
      this.elseBody = elseBody;
    }

    public Expression condition() {
      return condition;
    }

    public StatementSequence body() {
      return body;
    }

    public boolean hasElse() {
      return elseBody != null;
    }

    /** @return else arm, or null if there is no else */
    public StatementSequence elseBody() {
      return elseBody;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.IF;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(condition).add(body).add(elseBody)
                              .build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(elseBody != null);
    }
  }

  /**
   * for variable in start...end or start..<end.
   * Strided iteration and ranges with a missing end are not
   * representable.
   */
  public static class ForLoopStatement extends Statement {
    public static enum RangeKind {
      /** a...b */
      CLOSED("..."),
      /** a..<b */
      HALF_OPEN("..<");

      private final String operator;

      private RangeKind(String operator) {
        this.operator = operator;
      }

      public String operator() {
        return operator;
      }
    }

    private final String variable;
    private final RangeKind rangeKind;
    private final Expression rangeStart;
    private final Expression rangeEnd;
    private final StatementSequence body;

    public ForLoopStatement(String variable, RangeKind rangeKind,
        Expression rangeStart, Expression rangeEnd, StatementSequence body) {
      this.variable = Preconditions.checkNotNull(variable, "variable");
      this.rangeKind = Preconditions.checkNotNull(rangeKind, "rangeKind");
      this.rangeStart = Preconditions.checkNotNull(rangeStart, "rangeStart");
      this.rangeEnd = Preconditions.checkNotNull(rangeEnd, "rangeEnd");
      this.body = Preconditions.checkNotNull(body, "body");
    }

    /** Loop over a closed range start...end */
    public ForLoopStatement(String variable, Expression rangeStart,
                            Expression rangeEnd, StatementSequence body) {
      this(variable, RangeKind.CLOSED, rangeStart, rangeEnd, body);
    }

    public String variable() {
      return variable;
    }

    public RangeKind rangeKind() {
      return rangeKind;
    }

    public Expression rangeStart() {
      return rangeStart;
    }

    public Expression rangeEnd() {
      return rangeEnd;
    }

    public StatementSequence body() {
      return body;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.FOR_LOOP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitForLoop(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(rangeStart, rangeEnd, body);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(variable, rangeKind);
    }
  }

  public static class WhileLoopStatement extends Statement {
    private final Expression condition;
    private final StatementSequence body;

    public WhileLoopStatement(Expression condition, StatementSequence body) {
      this.condition = Preconditions.checkNotNull(condition, "condition");
      this.body = Preconditions.checkNotNull(body, "body");
    }

    public Expression condition() {
      return condition;
    }

    public StatementSequence body() {
      return body;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.WHILE_LOOP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWhileLoop(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(condition, body);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** repeat { body } while condition */
  public static class RepeatWhileLoopStatement extends Statement {
    private final StatementSequence body;
    private final Expression condition;

    public RepeatWhileLoopStatement(StatementSequence body,
                                    Expression condition) {
      this.body = Preconditions.checkNotNull(body, "body");
      this.condition = Preconditions.checkNotNull(condition, "condition");
    }

    public StatementSequence body() {
      return body;
    }

    public Expression condition() {
      return condition;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.REPEAT_WHILE_LOOP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRepeatWhileLoop(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(body, condition);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /**
   * One case of a switch.  The patterns are alternatives: the case
   * matches if any of them matches and the guard, if present, holds.
   */
  public static class Case extends AbstractSyntaxNode {
    private final ImmutableList<Pattern> patterns;
    private final Expression guardExpression;
    private final StatementSequence body;

    public Case(List<Pattern> patterns, Expression guardExpression,
                StatementSequence body) {
      this.patterns = ImmutableList.copyOf(patterns);
      this.guardExpression = guardExpression;
      this.body = Preconditions.checkNotNull(body, "body");
    }

    public List<Pattern> patterns() {
      return patterns;
    }

    public boolean hasGuard() {
      return guardExpression != null;
    }

    /** @return where-clause, or null if none */
    public Expression guardExpression() {
      return guardExpression;
    }

    public StatementSequence body() {
      return body;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().addAll(patterns).add(guardExpression)
                              .add(body).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(guardExpression != null);
    }
  }

  /**
   * switch expression { cases default }.  The default case is optional:
   * whether the cases are exhaustive without it is a semantic question.
   */
  public static class SwitchStatement extends Statement {
    private final Expression expression;
    private final ImmutableList<Case> cases;
    private final StatementSequence defaultCase;

    public SwitchStatement(Expression expression, List<Case> cases,
                           StatementSequence defaultCase) {
      this.expression = Preconditions.checkNotNull(expression, "expression");
      this.cases = ImmutableList.copyOf(cases);
      this.defaultCase = defaultCase;
    }

    public Expression expression() {
      return expression;
    }

    public List<Case> cases() {
      return cases;
    }

    public boolean hasDefault() {
      return defaultCase != null;
    }

    /** @return body of default case, or null if there is none */
    public StatementSequence defaultCase() {
      return defaultCase;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.SWITCH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSwitch(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(expression).addAll(cases)
                              .add(defaultCase).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(defaultCase != null);
    }
  }

  /** guard condition else { body } */
  public static class GuardStatement extends Statement {
    private final Expression condition;
    private final StatementSequence body;

    public GuardStatement(Expression condition, StatementSequence body) {
      this.condition = Preconditions.checkNotNull(condition, "condition");
      this.body = Preconditions.checkNotNull(body, "body");
    }

    public Expression condition() {
      return condition;
    }

    /** The else block */
    public StatementSequence body() {
      return body;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.GUARD;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGuard(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(condition, body);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static class ThrowStatement extends Statement {
    private final Expression expression;

    public ThrowStatement(Expression expression) {
      this.expression = Preconditions.checkNotNull(expression, "expression");
    }

    public Expression expression() {
      return expression;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.THROW;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitThrow(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(expression);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** do { body } catch { catchBody } */
  public static class DoCatchStatement extends Statement {
    private final StatementSequence body;
    private final StatementSequence catchBody;

    public DoCatchStatement(StatementSequence body,
                            StatementSequence catchBody) {
      this.body = Preconditions.checkNotNull(body, "body");
      this.catchBody = Preconditions.checkNotNull(catchBody, "catchBody");
    }

    public StatementSequence body() {
      return body;
    }

    public StatementSequence catchBody() {
      return catchBody;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.DO_CATCH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDoCatch(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(body, catchBody);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** target = value, in statement position */
  public static class AssignmentStatement extends Statement {
    private final Expression target;
    private final Expression value;

    public AssignmentStatement(Expression target, Expression value) {
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
    public StmtKind kind() {
      return StmtKind.ASSIGNMENT;
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

  public static ExpressionStatement expr(Expression expression) {
    return new ExpressionStatement(expression);
  }

  public static DeclarationStatement decl(Declaration declaration) {
    return new DeclarationStatement(declaration);
  }

  public static ReturnStatement returnStmt(Expression expression) {
    return new ReturnStatement(expression);
  }

  public static AssignmentStatement assign(Expression target,
                                           Expression value) {
    return new AssignmentStatement(target, value);
  }
}
