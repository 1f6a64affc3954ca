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
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.swiftsyntax.printer.SwiftPrinter;
import exm.swiftsyntax.tree.Statements.Statement;

/**
 * An ordered, possibly empty, list of statements.  This is the body of
 * every block-shaped construct: if/else arms, loop bodies, switch cases,
 * closure, function, initializer and catch bodies.
 */
public class StatementSequence extends AbstractSyntaxNode
    implements Iterable<Statement> {
  private final ImmutableList<Statement> statements;

  public StatementSequence(List<Statement> statements) {
    this.statements = ImmutableList.copyOf(statements);
  }

  public static StatementSequence empty() {
    return new StatementSequence(ImmutableList.<Statement>of());
  }

  public static StatementSequence of(Statement ...statements) {
    return new StatementSequence(Arrays.asList(statements));
  }

  public List<Statement> statements() {
    return statements;
  }

  public int size() {
    return statements.size();
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public Statement get(int i) {
    return statements.get(i);
  }

  @Override
  public Iterator<Statement> iterator() {
    return statements.iterator();
  }

  @Override
  public List<SyntaxNode> children() {
    return ImmutableList.<SyntaxNode>copyOf(statements);
  }

  @Override
  List<Object> attributes() {
    return NO_ATTRIBUTES;
  }

  @Override
  public String toString() {
    return SwiftPrinter.describe(this);
  }
}
