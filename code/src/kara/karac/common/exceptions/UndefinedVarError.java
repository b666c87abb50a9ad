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

package kara.karac.common.exceptions;

import java.util.Collection;

import org.apache.commons.lang3.StringUtils;

import kara.karac.ast.FilePosition;
import kara.karac.common.diagnostics.DiagnosticKind;

public class UndefinedVarError
extends UserException
{
  public UndefinedVarError(FilePosition position, String msg)
  {
    super(position, DiagnosticKind.UNDEFINED_NAME, msg);
  }

  public static UndefinedVarError fromName(FilePosition position,
                                           String varName) {
    return fromName(position, varName, null);
  }

  public static UndefinedVarError fromName(FilePosition position,
          String varName, String extra) {
    String msg = "No variable called " + varName +
                 " was defined in this context.";
    if (extra != null) {
      msg += " " + extra;
    }
    return new UndefinedVarError(position, msg);
  }

  public static UndefinedVarError unknownType(FilePosition position,
                                              String typeName) {
    return new UndefinedVarError(position, "Unknown type " + typeName);
  }

  public static UndefinedVarError unknownFunction(FilePosition position,
                                                  String fnName) {
    return new UndefinedVarError(position, "No function or flow called "
                                 + fnName + " is defined");
  }

  public static UndefinedVarError fromNames(FilePosition position,
                                            Collection<String> varNames) {
    return new UndefinedVarError(position, "Variables with the "
        + "following names were undefined in this context: " +
        StringUtils.join(varNames, ", "));
  }

  private static final long serialVersionUID = 1L;
}
