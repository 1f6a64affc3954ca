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

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import exm.swiftsyntax.common.Logging;
import exm.swiftsyntax.common.Settings;
import exm.swiftsyntax.common.exceptions.InvalidOptionException;
import exm.swiftsyntax.common.exceptions.MalformedTreeException;
import exm.swiftsyntax.tree.Declarations.Declaration;
import exm.swiftsyntax.tree.Expressions.Expression;
import exm.swiftsyntax.tree.Patterns.Pattern;
import exm.swiftsyntax.tree.StatementSequence;
import exm.swiftsyntax.tree.Statements.Statement;
import exm.swiftsyntax.tree.SwiftTypes.SwiftType;

/**
 * Text entry points for the JSON tree format.
 */
public class TreeJson {

  private TreeJson() {
  }

  public static String write(Declaration decl)
      throws MalformedTreeException {
    return format(TreeWriter.toJSON(decl));
  }

  public static String write(Statement stmt) throws MalformedTreeException {
    return format(TreeWriter.toJSON(stmt));
  }

  public static String write(StatementSequence seq)
      throws MalformedTreeException {
    JSONArray arr = TreeWriter.toJSON(seq);
    int indent = indentFactor();
    return indent == 0 ? arr.toString() : arr.toString(indent);
  }

  public static String write(Expression expr)
      throws MalformedTreeException {
    return format(TreeWriter.toJSON(expr));
  }

  public static String write(Pattern pattern)
      throws MalformedTreeException {
    return format(TreeWriter.toJSON(pattern));
  }

  public static String write(SwiftType type) throws MalformedTreeException {
    return format(TreeWriter.toJSON(type));
  }

  public static Declaration readDeclaration(String text)
      throws MalformedTreeException {
    return TreeReader.readDeclaration(parseObject(text));
  }

  public static Statement readStatement(String text)
      throws MalformedTreeException {
    return TreeReader.readStatement(parseObject(text));
  }

  public static StatementSequence readStatements(String text)
      throws MalformedTreeException {
    TreeReader.checkNesting(text);
    JSONArray arr;
    try {
      arr = new JSONArray(text);
    } catch (JSONException e) {
      throw new MalformedTreeException("Invalid JSON: " + e.getMessage(), e);
    }
    return TreeReader.readStatements(arr);
  }

  public static Expression readExpression(String text)
      throws MalformedTreeException {
    return TreeReader.readExpression(parseObject(text));
  }

  public static Pattern readPattern(String text)
      throws MalformedTreeException {
    return TreeReader.readPattern(parseObject(text));
  }

  public static SwiftType readType(String text)
      throws MalformedTreeException {
    return TreeReader.readType(parseObject(text));
  }

  private static JSONObject parseObject(String text)
      throws MalformedTreeException {
    TreeReader.checkNesting(text);
    try {
      return new JSONObject(text);
    } catch (JSONException e) {
      throw new MalformedTreeException("Invalid JSON: " + e.getMessage(), e);
    }
  }

  private static String format(JSONObject obj) {
    int indent = indentFactor();
    return indent == 0 ? obj.toString() : obj.toString(indent);
  }

  private static int indentFactor() {
    try {
      int indent = Settings.getInt(Settings.JSON_INDENT);
      return Math.max(indent, 0);
    } catch (InvalidOptionException e) {
      Logging.uniqueWarn(e.getMessage() + ", writing compact JSON");
      return 0;
    }
  }
}
