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
 * A literal value as written in source.  Exactly one kind of value
 * is held; the accessors for the other kinds throw.
 */
public class Literal {
  public static enum LiteralKind {
    INTEGER, FLOAT, BOOL, STRING, CHARACTER, NIL
  }

  private final LiteralKind kind;

  /** Storage for literal, dependent on kind */
  private final long intLit;
  private final double floatLit;
  private final boolean boolLit;
  private final String stringLit;
  private final int charLit;

  /**
   * Private constructor so that it can only be built using static builder
   * methods (below)
   */
  private Literal(LiteralKind kind, long intLit, double floatLit,
      boolean boolLit, String stringLit, int charLit) {
    this.kind = kind;
    this.intLit = intLit;
    this.floatLit = floatLit;
    this.boolLit = boolLit;
    this.stringLit = stringLit;
    this.charLit = charLit;
  }

  public static Literal createIntLit(long v) {
    return new Literal(LiteralKind.INTEGER, v, 0, false, null, 0);
  }

  public static Literal createFloatLit(double v) {
    return new Literal(LiteralKind.FLOAT, 0, v, false, null, 0);
  }

  public static Literal createBoolLit(boolean v) {
    return new Literal(LiteralKind.BOOL, 0, 0, v, null, 0);
  }

  public static Literal createStringLit(String v) {
    Preconditions.checkNotNull(v, "string literal");
    return new Literal(LiteralKind.STRING, 0, 0, false, v, 0);
  }

  /**
   * @param codePoint a Unicode scalar value: a valid code point that is
   *    not a surrogate
   */
  public static Literal createCharLit(int codePoint) {
    Preconditions.checkArgument(Character.isValidCodePoint(codePoint) &&
        (codePoint < Character.MIN_SURROGATE ||
         codePoint > Character.MAX_SURROGATE),
        "Invalid code point: %s", codePoint);
    return new Literal(LiteralKind.CHARACTER, 0, 0, false, null, codePoint);
  }

  public static Literal createNil() {
    return new Literal(LiteralKind.NIL, 0, 0, false, null, 0);
  }

  public LiteralKind getKind() {
    return kind;
  }

  public long getIntLit() {
    if (kind == LiteralKind.INTEGER) {
      return intLit;
    } else {
      throw new SyntaxRuntimeError("getIntLit for " + kind + " literal");
    }
  }

  public double getFloatLit() {
    if (kind == LiteralKind.FLOAT) {
      return floatLit;
    } else {
      throw new SyntaxRuntimeError("getFloatLit for " + kind + " literal");
    }
  }

  public boolean getBoolLit() {
    if (kind == LiteralKind.BOOL) {
      return boolLit;
    } else {
      throw new SyntaxRuntimeError("getBoolLit for " + kind + " literal");
    }
  }

  public String getStringLit() {
    if (kind == LiteralKind.STRING) {
      return stringLit;
    } else {
      throw new SyntaxRuntimeError("getStringLit for " + kind + " literal");
    }
  }

  public int getCharLit() {
    if (kind == LiteralKind.CHARACTER) {
      return charLit;
    } else {
      throw new SyntaxRuntimeError("getCharLit for " + kind + " literal");
    }
  }

  public boolean isNil() {
    return kind == LiteralKind.NIL;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Literal)) {
      return false;
    }
    Literal other = (Literal) obj;
    if (kind != other.kind) {
      return false;
    }
    switch (kind) {
      case INTEGER:
        return intLit == other.intLit;
      case FLOAT:
        // NaN equals NaN, so that serialized trees compare equal
        return Double.compare(floatLit, other.floatLit) == 0;
      case BOOL:
        return boolLit == other.boolLit;
      case STRING:
        return stringLit.equals(other.stringLit);
      case CHARACTER:
        return charLit == other.charLit;
      case NIL:
        return true;
      default:
        throw new SyntaxRuntimeError("Unknown literal kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    switch (kind) {
      case INTEGER:
        return Objects.hashCode(kind, intLit);
      case FLOAT:
        return Objects.hashCode(kind, Double.valueOf(floatLit));
      case BOOL:
        return Objects.hashCode(kind, boolLit);
      case STRING:
        return Objects.hashCode(kind, stringLit);
      case CHARACTER:
        return Objects.hashCode(kind, charLit);
      case NIL:
        return kind.hashCode();
      default:
        throw new SyntaxRuntimeError("Unknown literal kind " + kind);
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case INTEGER:
        return Long.toString(intLit);
      case FLOAT:
        return Double.toString(floatLit);
      case BOOL:
        return Boolean.toString(boolLit);
      case STRING:
        return "\"" + stringLit + "\"";
      case CHARACTER:
        return "'" + new String(Character.toChars(charLit)) + "'";
      case NIL:
        return "nil";
      default:
        throw new SyntaxRuntimeError("Unknown literal kind " + kind);
    }
  }
}
