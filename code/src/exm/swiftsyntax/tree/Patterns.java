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
 * Patterns matched by the cases of a switch statement.
 */
public class Patterns {

  public static enum PatternKind {
    LITERAL,
    IDENTIFIER,
    TUPLE,
    ENUM_CASE,
    WILDCARD,
    TYPE,
  }

  public static interface Visitor<R> {
    R visitLiteral(LiteralPattern pattern);
    R visitIdentifier(IdentifierPattern pattern);
    R visitTuple(TuplePattern pattern);
    R visitEnumCase(EnumCasePattern pattern);
    R visitWildcard(WildcardPattern pattern);
    R visitType(TypePattern pattern);
  }

  public abstract static class Pattern extends AbstractSyntaxNode {

    private Pattern() {
    }

    public abstract PatternKind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public String toString() {
      return SwiftPrinter.describe(this);
    }
  }

  /** Matches values equal to a literal */
  public static class LiteralPattern extends Pattern {
    private final Literal value;

    public LiteralPattern(Literal value) {
      this.value = Preconditions.checkNotNull(value, "value");
    }

    public Literal value() {
      return value;
    }

    @Override
    public PatternKind kind() {
      return PatternKind.LITERAL;
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
      return Arrays.<Object>asList(value);
    }
  }

  /** Matches anything and binds it to a name: let x */
  public static class IdentifierPattern extends Pattern {
    private final Identifier identifier;

    public IdentifierPattern(Identifier identifier) {
      this.identifier = Preconditions.checkNotNull(identifier, "identifier");
    }

    public Identifier identifier() {
      return identifier;
    }

    @Override
    public PatternKind kind() {
      return PatternKind.IDENTIFIER;
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

  public static class TuplePattern extends Pattern {
    private final ImmutableList<Pattern> elements;

    public TuplePattern(List<Pattern> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    public List<Pattern> elements() {
      return elements;
    }

    @Override
    public PatternKind kind() {
      return PatternKind.TUPLE;
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

  /**
   * Enum.caseName(associated...), or .caseName(associated...) when the
   * enum type is to be inferred from context.  Inference is left to
   * consumers.
   */
  public static class EnumCasePattern extends Pattern {
    private final String enumName;
    private final String caseName;
    private final ImmutableList<Pattern> associatedValues;

    public EnumCasePattern(String enumName, String caseName,
                           List<Pattern> associatedValues) {
      this.enumName = enumName;
      this.caseName = Preconditions.checkNotNull(caseName, "caseName");
      this.associatedValues = ImmutableList.copyOf(associatedValues);
    }

    public boolean hasEnumName() {
      return enumName != null;
    }

    /** @return the enum name, or null for dot-shorthand */
    public String enumName() {
      return enumName;
    }

    public String caseName() {
      return caseName;
    }

    public List<Pattern> associatedValues() {
      return associatedValues;
    }

    @Override
    public PatternKind kind() {
      return PatternKind.ENUM_CASE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEnumCase(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>copyOf(associatedValues);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(enumName, caseName);
    }
  }

  /** _ */
  public static class WildcardPattern extends Pattern {
    @Override
    public PatternKind kind() {
      return PatternKind.WILDCARD;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWildcard(this);
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

  /** is Type */
  public static class TypePattern extends Pattern {
    private final SwiftType type;

    public TypePattern(SwiftType type) {
      this.type = Preconditions.checkNotNull(type, "type");
    }

    public SwiftType type() {
      return type;
    }

    @Override
    public PatternKind kind() {
      return PatternKind.TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitType(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(type);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static IdentifierPattern binding(String name) {
    return new IdentifierPattern(new Identifier(name));
  }

  public static LiteralPattern literal(Literal value) {
    return new LiteralPattern(value);
  }

  public static WildcardPattern wildcard() {
    return new WildcardPattern();
  }

  public static EnumCasePattern enumCase(String enumName, String caseName,
                                         Pattern ...associatedValues) {
    return new EnumCasePattern(enumName, caseName,
                               Arrays.asList(associatedValues));
  }
}
