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
package exm.swiftsyntax.common.exceptions;

/**
 * An internal error in the syntax tree library or in the code driving it,
 * e.g. reading a literal as the wrong kind or a switch over a variant
 * kind that does not handle every case.
 * These always indicate a bug, never bad user input.
 * */
public class SyntaxRuntimeError extends RuntimeException
{
  public SyntaxRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
