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
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;

/**
 * Declarations: named program entities, at top level or as members.
 *
 * Aggregates (struct, class, extension) keep their properties, methods
 * and initializers in three separate lists.  Order within each list is
 * source order; the interleaving of the three lists is not recorded.
 */
public class Declarations {

  public static enum DeclKind {
    FUNCTION,
    VAR,
    LET,
    STRUCT,
    ENUM,
    CLASS,
    PROTOCOL,
    EXTENSION,
    TYPE_ALIAS,
    IMPORT,
    INITIALIZER,
    DEINITIALIZER,
  }

  public static interface Visitor<R> {
    R visitFunction(FunDeclaration decl);
    R visitVar(VarDeclaration decl);
    R visitLet(LetDeclaration decl);
    R visitStruct(StructDeclaration decl);
    R visitEnum(EnumDeclaration decl);
    R visitClass(ClassDeclaration decl);
    R visitProtocol(ProtocolDeclaration decl);
    R visitExtension(ExtensionDeclaration decl);
    R visitTypeAlias(TypeAliasDeclaration decl);
    R visitImport(ImportDeclaration decl);
    R visitInitializer(InitializerDeclaration decl);
    R visitDeinitializer(DeinitializerDeclaration decl);
  }

  public abstract static class Declaration extends AbstractSyntaxNode {

    private Declaration() {
    }

    public abstract DeclKind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public String toString() {
      return SwiftPrinter.describe(this);
    }
  }

  /** <T: Constraint, U> */
  public static class GenericsDeclaration extends AbstractSyntaxNode {
    private final ImmutableList<TypeParameter> typeParameters;

    public GenericsDeclaration(List<TypeParameter> typeParameters) {
      this.typeParameters = ImmutableList.copyOf(typeParameters);
    }

    public List<TypeParameter> typeParameters() {
      return typeParameters;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>copyOf(typeParameters);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }

  public static class TypeParameter extends AbstractSyntaxNode {
    private final String name;
    private final SwiftType constraint;

    public TypeParameter(String name, SwiftType constraint) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.constraint = constraint;
    }

    public String name() {
      return name;
    }

    public boolean hasConstraint() {
      return constraint != null;
    }

    /** @return the single constraint, or null if unconstrained */
    public SwiftType constraint() {
      return constraint;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(constraint).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, constraint != null);
    }
  }

  /**
   * label internalName: Type = default.
   * A null label means none was written, so the internal name doubles
   * as the argument label.  An explicit "_" label is stored as "_".
   */
  public static class FunctionParameter extends AbstractSyntaxNode {
    private final String label;
    private final String internalName;
    private final SwiftType type;
    private final Expression defaultValue;
    private final boolean variadic;
    private final boolean inout;

    public FunctionParameter(String label, String internalName,
        SwiftType type, Expression defaultValue, boolean variadic,
        boolean inout) {
      this.label = label;
      this.internalName = Preconditions.checkNotNull(internalName,
                                                     "internalName");
      this.type = Preconditions.checkNotNull(type, "type");
      this.defaultValue = defaultValue;
      this.variadic = variadic;
      this.inout = inout;
    }

    public static FunctionParameter simple(String name, SwiftType type) {
      return new FunctionParameter(null, name, type, null, false, false);
    }

    public boolean hasLabel() {
      return label != null;
    }

    /** @return explicit argument label, or null */
    public String label() {
      return label;
    }

    public String internalName() {
      return internalName;
    }

    public SwiftType type() {
      return type;
    }

    public boolean hasDefaultValue() {
      return defaultValue != null;
    }

    /** @return default argument, or null */
    public Expression defaultValue() {
      return defaultValue;
    }

    public boolean isVariadic() {
      return variadic;
    }

    public boolean isInout() {
      return inout;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(type).add(defaultValue).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(label, internalName, defaultValue != null,
          variadic, inout);
    }
  }

  /**
   * func name<generics>(parameters) throws -> ReturnType { body }
   *
   * A null body means the function has no implementation, as for a
   * protocol requirement.  This is different from an empty body.
   */
  public static class FunDeclaration extends Declaration {
    private final String name;
    private final GenericsDeclaration generics;
    private final ImmutableList<FunctionParameter> parameters;
    private final SwiftType returnType;
    private final boolean throwing;
    private final AccessControl accessControl;
    private final StatementSequence body;

    public FunDeclaration(String name, GenericsDeclaration generics,
        List<FunctionParameter> parameters, SwiftType returnType,
        boolean throwing, AccessControl accessControl,
        StatementSequence body) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.generics = generics;
      this.parameters = ImmutableList.copyOf(parameters);
      this.returnType = returnType;
      this.throwing = throwing;
      this.accessControl = Preconditions.checkNotNull(accessControl,
                                                      "accessControl");
      this.body = body;
    }

    public String name() {
      return name;
    }

    public boolean hasGenerics() {
      return generics != null;
    }

    /** @return generic parameters, or null */
    public GenericsDeclaration generics() {
      return generics;
    }

    public List<FunctionParameter> parameters() {
      return parameters;
    }

    public boolean hasReturnType() {
      return returnType != null;
    }

    /** @return return type, or null for Void */
    public SwiftType returnType() {
      return returnType;
    }

    public boolean isThrowing() {
      return throwing;
    }

    public AccessControl accessControl() {
      return accessControl;
    }

    public boolean hasBody() {
      return body != null;
    }

    /** @return body, or null for a function without implementation */
    public StatementSequence body() {
      return body;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.FUNCTION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunction(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(generics).addAll(parameters)
                     .add(returnType).add(body).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, generics != null,
          returnType != null, throwing, accessControl, body != null);
    }
  }

  /** var name: Type = initialValue */
  public static class VarDeclaration extends Declaration {
    private final String name;
    private final SwiftType type;
    private final Expression initialValue;

    public VarDeclaration(String name, SwiftType type,
                          Expression initialValue) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.type = type;
      this.initialValue = initialValue;
    }

    public String name() {
      return name;
    }

    public boolean hasType() {
      return type != null;
    }

    /** @return type annotation, or null if inferred */
    public SwiftType type() {
      return type;
    }

    public boolean hasInitialValue() {
      return initialValue != null;
    }

    /** @return initializer expression, or null */
    public Expression initialValue() {
      return initialValue;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.VAR;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVar(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(type).add(initialValue).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, type != null, initialValue != null);
    }
  }

  /** let name: Type = initialValue */
  public static class LetDeclaration extends Declaration {
    private final String name;
    private final SwiftType type;
    private final Expression initialValue;

    public LetDeclaration(String name, SwiftType type,
                          Expression initialValue) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.type = type;
      this.initialValue = initialValue;
    }

    public String name() {
      return name;
    }

    public boolean hasType() {
      return type != null;
    }

    /** @return type annotation, or null if inferred */
    public SwiftType type() {
      return type;
    }

    public boolean hasInitialValue() {
      return initialValue != null;
    }

    /** @return initializer expression, or null */
    public Expression initialValue() {
      return initialValue;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.LET;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLet(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(type).add(initialValue).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, type != null, initialValue != null);
    }
  }

  public static enum PropertyKind {
    STORED,
    COMPUTED,
  }

  /**
   * A property member of a struct, class or extension: either stored
   * or computed, never both.
   */
  public abstract static class PropertyDeclaration
      extends AbstractSyntaxNode {

    private PropertyDeclaration() {
    }

    public abstract PropertyKind kind();

    public abstract String name();
  }

  /** var/let name: Type = initialValue, as a member */
  public static class StoredProperty extends PropertyDeclaration {
    private final boolean constant;
    private final String name;
    private final SwiftType type;
    private final Expression initialValue;

    public StoredProperty(boolean constant, String name, SwiftType type,
                          Expression initialValue) {
      this.constant = constant;
      this.name = Preconditions.checkNotNull(name, "name");
      this.type = type;
      this.initialValue = initialValue;
    }

    /** True for let, false for var */
    public boolean isConstant() {
      return constant;
    }

    @Override
    public String name() {
      return name;
    }

    public boolean hasType() {
      return type != null;
    }

    /** @return type annotation, or null if inferred */
    public SwiftType type() {
      return type;
    }

    public boolean hasInitialValue() {
      return initialValue != null;
    }

    /** @return initializer expression, or null */
    public Expression initialValue() {
      return initialValue;
    }

    @Override
    public PropertyKind kind() {
      return PropertyKind.STORED;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(type).add(initialValue).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(constant, name, type != null,
          initialValue != null);
    }
  }

  /** set(parameterName) { body } */
  public static class PropertySetter extends AbstractSyntaxNode {
    private final String parameterName;
    private final StatementSequence body;

    public PropertySetter(String parameterName, StatementSequence body) {
      this.parameterName = parameterName;
      this.body = Preconditions.checkNotNull(body, "body");
    }

    public boolean hasParameterName() {
      return parameterName != null;
    }

    /** @return explicit name of new value, or null for newValue */
    public String parameterName() {
      return parameterName;
    }

    public StatementSequence body() {
      return body;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(body);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(parameterName);
    }
  }

  /** var name: Type { get { getter } set { setter } } */
  public static class ComputedProperty extends PropertyDeclaration {
    private final String name;
    private final SwiftType type;
    private final StatementSequence getter;
    private final PropertySetter setter;

    public ComputedProperty(String name, SwiftType type,
        StatementSequence getter, PropertySetter setter) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.type = Preconditions.checkNotNull(type, "type");
      this.getter = Preconditions.checkNotNull(getter, "getter");
      this.setter = setter;
    }

    @Override
    public String name() {
      return name;
    }

    public SwiftType type() {
      return type;
    }

    public StatementSequence getter() {
      return getter;
    }

    public boolean hasSetter() {
      return setter != null;
    }

    /** @return setter, or null for a read-only property */
    public PropertySetter setter() {
      return setter;
    }

    @Override
    public PropertyKind kind() {
      return PropertyKind.COMPUTED;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(type).add(getter).add(setter).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, setter != null);
    }
  }

  public static class StructDeclaration extends Declaration {
    private final String name;
    private final GenericsDeclaration generics;
    private final ImmutableList<String> conformances;
    private final ImmutableList<PropertyDeclaration> properties;
    private final ImmutableList<FunDeclaration> methods;
    private final ImmutableList<InitializerDeclaration> initializers;

    public StructDeclaration(String name, GenericsDeclaration generics,
        List<String> conformances, List<PropertyDeclaration> properties,
        List<FunDeclaration> methods,
        List<InitializerDeclaration> initializers) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.generics = generics;
      this.conformances = ImmutableList.copyOf(conformances);
      this.properties = ImmutableList.copyOf(properties);
      this.methods = ImmutableList.copyOf(methods);
      this.initializers = ImmutableList.copyOf(initializers);
    }

    public String name() {
      return name;
    }

    public boolean hasGenerics() {
      return generics != null;
    }

    /** @return generic parameters, or null */
    public GenericsDeclaration generics() {
      return generics;
    }

    public List<String> conformances() {
      return conformances;
    }

    public List<PropertyDeclaration> properties() {
      return properties;
    }

    public List<FunDeclaration> methods() {
      return methods;
    }

    public List<InitializerDeclaration> initializers() {
      return initializers;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.STRUCT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStruct(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(generics).addAll(properties)
                     .addAll(methods).addAll(initializers).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, generics != null, conformances);
    }
  }

  public static class EnumAssociatedValue extends AbstractSyntaxNode {
    private final String label;
    private final SwiftType type;

    public EnumAssociatedValue(String label, SwiftType type) {
      this.label = label;
      this.type = Preconditions.checkNotNull(type, "type");
    }

    public boolean hasLabel() {
      return label != null;
    }

    /** @return label, or null */
    public String label() {
      return label;
    }

    public SwiftType type() {
      return type;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(type);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(label);
    }
  }

  /**
   * case name(associated values) = rawValue.
   * Legal Swift has associated values or a raw value, never both.
   * Both are accepted here.
   */
  public static class EnumCase extends AbstractSyntaxNode {
    private final String name;
    private final ImmutableList<EnumAssociatedValue> associatedValues;
    private final Expression rawValue;

    public EnumCase(String name, List<EnumAssociatedValue> associatedValues,
                    Expression rawValue) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.associatedValues = ImmutableList.copyOf(associatedValues);
      this.rawValue = rawValue;
    }

    public String name() {
      return name;
    }

    public List<EnumAssociatedValue> associatedValues() {
      return associatedValues;
    }

    public boolean hasRawValue() {
      return rawValue != null;
    }

    /** @return raw value, or null */
    public Expression rawValue() {
      return rawValue;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().addAll(associatedValues).add(rawValue)
                              .build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, rawValue != null);
    }
  }

  /**
   * enum Name<generics>: RawType, Conformances { cases }
   */
  public static class EnumDeclaration extends Declaration {
    private final String name;
    private final GenericsDeclaration generics;
    private final SwiftType rawType;
    private final ImmutableList<String> conformances;
    private final ImmutableList<EnumCase> cases;

    public EnumDeclaration(String name, GenericsDeclaration generics,
        SwiftType rawType, List<String> conformances, List<EnumCase> cases) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.generics = generics;
      this.rawType = rawType;
      this.conformances = ImmutableList.copyOf(conformances);
      this.cases = ImmutableList.copyOf(cases);
    }

    public String name() {
      return name;
    }

    public boolean hasGenerics() {
      return generics != null;
    }

    /** @return generic parameters, or null */
    public GenericsDeclaration generics() {
      return generics;
    }

    public boolean hasRawType() {
      return rawType != null;
    }

    /** @return raw value type, or null */
    public SwiftType rawType() {
      return rawType;
    }

    public List<String> conformances() {
      return conformances;
    }

    public List<EnumCase> cases() {
      return cases;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.ENUM;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEnum(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(generics).add(rawType).addAll(cases)
                              .build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, generics != null, rawType != null,
          conformances);
    }
  }

  public static class ClassDeclaration extends Declaration {
    private final String name;
    private final GenericsDeclaration generics;
    private final String superclass;
    private final ImmutableList<String> conformances;
    private final ImmutableList<PropertyDeclaration> properties;
    private final ImmutableList<FunDeclaration> methods;
    private final ImmutableList<InitializerDeclaration> initializers;
    private final DeinitializerDeclaration deinitializer;

    public ClassDeclaration(String name, GenericsDeclaration generics,
        String superclass, List<String> conformances,
        List<PropertyDeclaration> properties, List<FunDeclaration> methods,
        List<InitializerDeclaration> initializers,
        DeinitializerDeclaration deinitializer) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.generics = generics;
      this.superclass = superclass;
      this.conformances = ImmutableList.copyOf(conformances);
      this.properties = ImmutableList.copyOf(properties);
      this.methods = ImmutableList.copyOf(methods);
      this.initializers = ImmutableList.copyOf(initializers);
      this.deinitializer = deinitializer;
    }

    public String name() {
      return name;
    }

    public boolean hasGenerics() {
      return generics != null;
    }

    /** @return generic parameters, or null */
    public GenericsDeclaration generics() {
      return generics;
    }

    public boolean hasSuperclass() {
      return superclass != null;
    }

    /** @return superclass name, or null for a root class */
    public String superclass() {
      return superclass;
    }

    public List<String> conformances() {
      return conformances;
    }

    public List<PropertyDeclaration> properties() {
      return properties;
    }

    public List<FunDeclaration> methods() {
      return methods;
    }

    public List<InitializerDeclaration> initializers() {
      return initializers;
    }

    public boolean hasDeinitializer() {
      return deinitializer != null;
    }

    /** @return deinit, or null */
    public DeinitializerDeclaration deinitializer() {
      return deinitializer;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.CLASS;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitClass(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(generics).addAll(properties)
                     .addAll(methods).addAll(initializers)
                     .add(deinitializer).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, generics != null, superclass,
          conformances, deinitializer != null);
    }
  }

  /** var name: Type { get } or { get set } */
  public static class PropertyRequirement extends AbstractSyntaxNode {
    private final String name;
    private final SwiftType type;
    private final boolean readOnly;

    public PropertyRequirement(String name, SwiftType type,
                               boolean readOnly) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.type = Preconditions.checkNotNull(type, "type");
      this.readOnly = readOnly;
    }

    public String name() {
      return name;
    }

    public SwiftType type() {
      return type;
    }

    public boolean isReadOnly() {
      return readOnly;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(type);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, readOnly);
    }
  }

  /**
   * A method a protocol requires.  There is no body to speak of.
   */
  public static class MethodRequirement extends AbstractSyntaxNode {
    private final String name;
    private final ImmutableList<FunctionParameter> parameters;
    private final SwiftType returnType;
    private final boolean mutating;

    public MethodRequirement(String name, List<FunctionParameter> parameters,
                             SwiftType returnType, boolean mutating) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.parameters = ImmutableList.copyOf(parameters);
      this.returnType = returnType;
      this.mutating = mutating;
    }

    public String name() {
      return name;
    }

    public List<FunctionParameter> parameters() {
      return parameters;
    }

    public boolean hasReturnType() {
      return returnType != null;
    }

    /** @return return type, or null for Void */
    public SwiftType returnType() {
      return returnType;
    }

    public boolean isMutating() {
      return mutating;
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().addAll(parameters).add(returnType).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, returnType != null, mutating);
    }
  }

  public static class InitializerRequirement extends AbstractSyntaxNode {
    private final ImmutableList<FunctionParameter> parameters;
    private final boolean failable;

    public InitializerRequirement(List<FunctionParameter> parameters,
                                  boolean failable) {
      this.parameters = ImmutableList.copyOf(parameters);
      this.failable = failable;
    }

    public List<FunctionParameter> parameters() {
      return parameters;
    }

    public boolean isFailable() {
      return failable;
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>copyOf(parameters);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(failable);
    }
  }

  public static class ProtocolDeclaration extends Declaration {
    private final String name;
    private final ImmutableList<String> inheritedProtocols;
    private final ImmutableList<PropertyRequirement> propertyRequirements;
    private final ImmutableList<MethodRequirement> methodRequirements;
    private final ImmutableList<InitializerRequirement>
                                          initializerRequirements;

    public ProtocolDeclaration(String name, List<String> inheritedProtocols,
        List<PropertyRequirement> propertyRequirements,
        List<MethodRequirement> methodRequirements,
        List<InitializerRequirement> initializerRequirements) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.inheritedProtocols = ImmutableList.copyOf(inheritedProtocols);
      this.propertyRequirements = ImmutableList.copyOf(propertyRequirements);
      this.methodRequirements = ImmutableList.copyOf(methodRequirements);
      this.initializerRequirements =
                              ImmutableList.copyOf(initializerRequirements);
    }

    public String name() {
      return name;
    }

    public List<String> inheritedProtocols() {
      return inheritedProtocols;
    }

    public List<PropertyRequirement> propertyRequirements() {
      return propertyRequirements;
    }

    public List<MethodRequirement> methodRequirements() {
      return methodRequirements;
    }

    public List<InitializerRequirement> initializerRequirements() {
      return initializerRequirements;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.PROTOCOL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitProtocol(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().addAll(propertyRequirements)
                     .addAll(methodRequirements)
                     .addAll(initializerRequirements).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name, inheritedProtocols);
    }
  }

  public static class ExtensionDeclaration extends Declaration {
    private final String typeName;
    private final ImmutableList<String> conformances;
    private final ImmutableList<PropertyDeclaration> properties;
    private final ImmutableList<FunDeclaration> methods;
    private final ImmutableList<InitializerDeclaration> initializers;

    public ExtensionDeclaration(String typeName, List<String> conformances,
        List<PropertyDeclaration> properties, List<FunDeclaration> methods,
        List<InitializerDeclaration> initializers) {
      this.typeName = Preconditions.checkNotNull(typeName, "typeName");
      this.conformances = ImmutableList.copyOf(conformances);
      this.properties = ImmutableList.copyOf(properties);
      this.methods = ImmutableList.copyOf(methods);
      this.initializers = ImmutableList.copyOf(initializers);
    }

    /** Name of the type being extended */
    public String typeName() {
      return typeName;
    }

    public List<String> conformances() {
      return conformances;
    }

    public List<PropertyDeclaration> properties() {
      return properties;
    }

    public List<FunDeclaration> methods() {
      return methods;
    }

    public List<InitializerDeclaration> initializers() {
      return initializers;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.EXTENSION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExtension(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().addAll(properties).addAll(methods)
                     .addAll(initializers).build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(typeName, conformances);
    }
  }

  /** typealias name = target */
  public static class TypeAliasDeclaration extends Declaration {
    private final String name;
    private final SwiftType target;

    public TypeAliasDeclaration(String name, SwiftType target) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.target = Preconditions.checkNotNull(target, "target");
    }

    public String name() {
      return name;
    }

    public SwiftType target() {
      return target;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.TYPE_ALIAS;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTypeAlias(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(target);
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(name);
    }
  }

  /** import Module, or import kind Module.symbol */
  public static class ImportDeclaration extends Declaration {
    private final String module;
    private final ImportSymbol symbol;

    public ImportDeclaration(String module, ImportSymbol symbol) {
      this.module = Preconditions.checkNotNull(module, "module");
      this.symbol = Preconditions.checkNotNull(symbol, "symbol");
    }

    public String module() {
      return module;
    }

    public ImportSymbol symbol() {
      return symbol;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.IMPORT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImport(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(module, symbol);
    }
  }

  /**
   * [convenience] init[?]<generics>(parameters) { body }.
   * Unlike a function, an initializer always has a body.
   */
  public static class InitializerDeclaration extends Declaration {
    private final GenericsDeclaration generics;
    private final ImmutableList<FunctionParameter> parameters;
    private final StatementSequence body;
    private final boolean failable;
    private final boolean convenience;
    private final AccessControl accessControl;

    public InitializerDeclaration(GenericsDeclaration generics,
        List<FunctionParameter> parameters, StatementSequence body,
        boolean failable, boolean convenience, AccessControl accessControl) {
      this.generics = generics;
      this.parameters = ImmutableList.copyOf(parameters);
      this.body = Preconditions.checkNotNull(body, "body");
      this.failable = failable;
      this.convenience = convenience;
      this.accessControl = Preconditions.checkNotNull(accessControl,
                                                      "accessControl");
    }

    public boolean hasGenerics() {
      return generics != null;
    }

    /** @return generic parameters, or null */
    public GenericsDeclaration generics() {
      return generics;
    }

    public List<FunctionParameter> parameters() {
      return parameters;
    }

    public StatementSequence body() {
      return body;
    }

    /** True for init? */
    public boolean isFailable() {
      return failable;
    }

    /** True for convenience initializers, false for designated ones */
    public boolean isConvenience() {
      return convenience;
    }

    public AccessControl accessControl() {
      return accessControl;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.INITIALIZER;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInitializer(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return Children.create().add(generics).addAll(parameters).add(body)
                              .build();
    }

    @Override
    List<Object> attributes() {
      return Arrays.<Object>asList(generics != null, failable, convenience,
          accessControl);
    }
  }

  /** deinit { body } */
  public static class DeinitializerDeclaration extends Declaration {
    private final StatementSequence body;

    public DeinitializerDeclaration(StatementSequence body) {
      this.body = Preconditions.checkNotNull(body, "body");
    }

    public StatementSequence body() {
      return body;
    }

    @Override
    public DeclKind kind() {
      return DeclKind.DEINITIALIZER;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDeinitializer(this);
    }

    @Override
    public List<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>of(body);
    }

    @Override
    List<Object> attributes() {
      return NO_ATTRIBUTES;
    }
  }
}
