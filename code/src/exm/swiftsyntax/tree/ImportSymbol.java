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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import exm.swiftsyntax.common.exceptions.SyntaxRuntimeError;

/**
 * What an import brings into scope: either the entire module, or one
 * named symbol of a given kind.  The two are separate variants, so a
 * single import can never be both.
 */
public abstract class ImportSymbol {

  public static enum SymbolKind {
    ENTIRE_MODULE(null),
    CLASS("class"),
    STRUCT("struct"),
    ENUM("enum"),
    PROTOCOL("protocol"),
    FUNCTION("func"),
    VARIABLE("var");

    private final String keyword;

    private SymbolKind(String keyword) {
      this.keyword = keyword;
    }

    /** @return keyword written after import, null for ENTIRE_MODULE */
    public String keyword() {
      return keyword;
    }
  }

  private ImportSymbol() {
  }

  public abstract SymbolKind kind();

  public boolean isEntireModule() {
    return kind() == SymbolKind.ENTIRE_MODULE;
  }

  /**
   * @return the imported symbol's name
   * @throws SyntaxRuntimeError if the entire module is imported
   */
  public abstract String name();

  public static EntireModule entireModule() {
    return new EntireModule();
  }

  public static NamedSymbol named(SymbolKind kind, String name) {
    return new NamedSymbol(kind, name);
  }

  public static class EntireModule extends ImportSymbol {
    @Override
    public SymbolKind kind() {
      return SymbolKind.ENTIRE_MODULE;
    }

    @Override
    public String name() {
      throw new SyntaxRuntimeError("name() for whole-module import");
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof EntireModule;
    }

    @Override
    public int hashCode() {
      return SymbolKind.ENTIRE_MODULE.hashCode();
    }

    @Override
    public String toString() {
      return "<module>";
    }
  }

  public static class NamedSymbol extends ImportSymbol {
    private final SymbolKind kind;
    private final String name;

    public NamedSymbol(SymbolKind kind, String name) {
      Preconditions.checkNotNull(kind, "kind");
      Preconditions.checkArgument(kind != SymbolKind.ENTIRE_MODULE,
          "A named import symbol cannot be an entire-module import");
      this.kind = kind;
      this.name = Preconditions.checkNotNull(name, "name");
    }

    @Override
    public SymbolKind kind() {
      return kind;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof NamedSymbol)) {
        return false;
      }
      NamedSymbol other = (NamedSymbol) o;
      return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(kind, name);
    }

    @Override
    public String toString() {
      return kind.keyword() + " " + name;
    }
  }
}
