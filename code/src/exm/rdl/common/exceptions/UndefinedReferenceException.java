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

package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

/**
 * A parameter, instance, type, template or struct field name that could not
 * be resolved in the current scope.
 */
public class UndefinedReferenceException
extends UserException
{
  public UndefinedReferenceException(Context context, String msg)
  {
    super(context, msg);
  }

  public static UndefinedReferenceException fromName(Context context,
                                                     String name) {
    return fromName(context, "parameter or instance", name);
  }

  /**
   * @param what human-readable kind of thing looked up, e.g. "type"
   */
  public static UndefinedReferenceException fromName(Context context,
                                          String what, String name) {
    return new UndefinedReferenceException(context, "No " + what +
                " called " + name + " was defined in this context.");
  }

  private static final long serialVersionUID = 1L;
}
