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
 * Represents a tree handed to us from outside that cannot be accepted:
 * serialized input that does not describe a tree, or a tree in which
 * a subtree is shared between parents.
 * Thus, this should contain good error message information
 * */
public class MalformedTreeException
extends Exception
{
  public MalformedTreeException(String path, String message)
  {
    super((path == null || path.isEmpty() ? "<root>" : path) + ": " + message);
  }

  public MalformedTreeException(String message) {
    super(message);
  }

  public MalformedTreeException(String message, Throwable cause) {
    super(message, cause);
  }

  private static final long serialVersionUID = 1L;
}
