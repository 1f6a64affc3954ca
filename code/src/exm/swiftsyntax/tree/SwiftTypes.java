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

/**
 * This module provides the type annotations that can appear in a Swift
 * syntax tree, along with convenience functions for creating them.
 *
 * The base class is SwiftType.  Its constructor is private, so the
 * variants nested here are the only ones there can be.
 *
 * Type annotations are syntax only: CustomType holds nothing but a name,
 * so MyClass<Int> and MyClass are indistinguishable.  Generic arguments
 * must be carried alongside, not inside, a CustomType.
 */
public class SwiftTypes {

  public static enum TypeKind {
    PRIMITIVE,
    OPTIONAL,
    ARRAY,
    DICTIONARY,
    TUPLE,
    FUNCTION,
    CUSTOM,
  }

  public static enum PrimType {
    INTEGER("Int"),
    FLOAT("Float"),
    BOOL("Bool"),
    STRING("String"),
    CHARACTER("Character");

    private final String swiftName;

    private PrimType(String swiftName) {
      this.swiftName = swiftName;
    }

    /** Name of the type in Swift source */
    public String swiftName() {
      return swiftName;
    }
  }

  public static interface Visitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitOptional(OptionalType type);
    R visitArray(ArrayType type);
    R visitDictionary(DictionaryType type);
    R visitTuple(TupleType type);
    R visitFunction(FunctionType type);
    R visitCustom(CustomType type);
  }

  /**
   * A type annotation.  Immutable once built.
   */
  public abstract static class SwiftType extends AbstractSyntaxNode {

    private SwiftType() {
    }

    public abstract TypeKind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    /** Prints the type as Swift source */
    @Override
    public String toString() {
      return SwiftPrinter.describe(this);
    }
  }

  public static class PrimitiveType extends SwiftType {
    private final PrimType primType;

    public PrimitiveType(PrimType primType) {
      this.primType = Preconditions.checkNotNull(primType, "primType");
    }

    public PrimType primType() {
      return primType;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.PRIMITIVE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPrimitive(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(primType);
    }
  }

  /** T? */
  public static class OptionalType extends SwiftType {
    private final SwiftType wrapped;

    public OptionalType(SwiftType wrapped) {
      this.wrapped = Preconditions.checkNotNull(wrapped, "wrapped");
    }

    public SwiftType wrapped() {
      return wrapped;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.OPTIONAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOptional(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(wrapped);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** [T] */
  public static class ArrayType extends SwiftType {
    private final SwiftType elementType;

    public ArrayType(SwiftType elementType) {
      this.elementType = Preconditions.checkNotNull(elementType, "elementType");
    }

    public SwiftType elementType() {
      return elementType;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.ARRAY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArray(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(elementType);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** [K: V] */
  public static class DictionaryType extends SwiftType {
    private final SwiftType keyType;
    private final SwiftType valueType;

    public DictionaryType(SwiftType keyType, SwiftType valueType) {
      this.keyType = Preconditions.checkNotNull(keyType, "keyType");
      this.valueType = Preconditions.checkNotNull(valueType, "valueType");
    }

    public SwiftType keyType() {
      return keyType;
    }

    public SwiftType valueType() {
      return valueType;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.DICTIONARY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDictionary(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(keyType, valueType);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** (A, B, ...).  May have any number of elements, including zero. */
  public static class TupleType extends SwiftType {
    private final ImmutableList<SwiftType> elementTypes;

    public TupleType(List<SwiftType> elementTypes) {
      this.elementTypes = ImmutableList.copyOf(elementTypes);
    }

    public List<SwiftType> elementTypes() {
      return elementTypes;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.TUPLE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTuple(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>copyOf(elementTypes);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /** (A, B) -> R */
  public static class FunctionType extends SwiftType {
    private final ImmutableList<SwiftType> parameterTypes;
    private final SwiftType resultType;

    public FunctionType(List<SwiftType> parameterTypes, SwiftType resultType) {
      this.parameterTypes = ImmutableList.copyOf(parameterTypes);
      this.resultType = Preconditions.checkNotNull(resultType, "resultType");
    }

    public List<SwiftType> parameterTypes() {
      return parameterTypes;
    }

    public SwiftType resultType() {
      return resultType;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.FUNCTION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunction(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>builder()
          .addAll(parameterTypes).add(resultType).build();
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  /**
   * A nominal type referred to by name: a struct, class, enum, protocol
   * or type alias.
   */
  public static class CustomType extends SwiftType {
    private final String name;

    public CustomType(String name) {
      this.name = Preconditions.checkNotNull(name, "name");
    }

    public String name() {
      return name;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.CUSTOM;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCustom(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name);
    }
  }

  public static PrimitiveType primitive(PrimType primType) {
    return new PrimitiveType(primType);
  }

  public static PrimitiveType intType() {
    return new PrimitiveType(PrimType.INTEGER);
  }

  public static PrimitiveType floatType() {
    return new PrimitiveType(PrimType.FLOAT);
  }

  public static PrimitiveType boolType() {
    return new PrimitiveType(PrimType.BOOL);
  }

  public static PrimitiveType stringType() {
    return new PrimitiveType(PrimType.STRING);
  }

  public static PrimitiveType characterType() {
    return new PrimitiveType(PrimType.CHARACTER);
  }

  public static OptionalType optional(SwiftType wrapped) {
    return new OptionalType(wrapped);
  }

  public static ArrayType array(SwiftType elementType) {
    return new ArrayType(elementType);
  }

  public static DictionaryType dictionary(SwiftType keyType,
                                          SwiftType valueType) {
    return new DictionaryType(keyType, valueType);
  }

  public static TupleType tuple(SwiftType ...elementTypes) {
    return new TupleType(Arrays.asList(elementTypes));
  }

  public static FunctionType function(List<SwiftType> parameterTypes,
                                      SwiftType resultType) {
    return new FunctionType(parameterTypes, resultType);
  }

  public static CustomType custom(String name) {
    return new CustomType(name);
  }
}
