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
package kara.karac.frontend.typecheck;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import kara.karac.ast.FilePosition;
import kara.karac.ast.Stmt.ArgBinding;
import kara.karac.ast.Stmt.Destination;
import kara.karac.ast.Stmt.OutBinding;
import kara.karac.common.exceptions.TypeMismatchException;
import kara.karac.common.exceptions.UndefinedVarError;
import kara.karac.common.exceptions.UserException;
import kara.karac.common.lang.Types;
import kara.karac.common.lang.Types.FunctionType;
import kara.karac.common.lang.Types.RecordType;
import kara.karac.common.lang.Types.TupleType;
import kara.karac.common.lang.Types.Type;

/**
 * Typechecking logic for calls.  Every argument is checked on its own
 * and all problems are returned, so a call with two bad arguments gets
 * two errors.
 */
public class FunctionTypeChecker {

  /**
   * Check a positional call f(a, b, ...)
   * @param argPositions position of each argument
   * @param errors problems are appended here
   */
  public static void checkCallArgs(FilePosition callPos, String callee,
      FunctionType sig, List<FilePosition> argPositions,
      List<Type> argTypes, List<UserException> errors) {
    int expected = sig.paramCount();
    if (argTypes.size() != expected) {
      errors.add(new TypeMismatchException(callPos, callee + " takes " +
          expected + " argument" + (expected == 1 ? "" : "s") + " but " +
          argTypes.size() + " were given"));
    }
    int n = Math.min(expected, argTypes.size());
    for (int i = 0; i < n; i++) {
      checkArg(argPositions.get(i), callee, sig, i, argTypes.get(i), errors);
    }
  }

  /**
   * Check the inputs of a pipeline call.  Inputs are either one unnamed
   * value for a single-parameter callee, or bound to parameters by name.
   * @param inputTypes type of each input value
   */
  public static void checkPipelineInputs(FilePosition callPos, String callee,
      FunctionType sig, List<ArgBinding> inputs, List<Type> inputTypes,
      List<UserException> errors) {
    if (inputs.size() == 1 && !inputs.get(0).isNamed()) {
      if (sig.paramCount() != 1) {
        errors.add(new TypeMismatchException(inputs.get(0).getPosition(),
            callee + " takes " + sig.paramCount() + " inputs: an unnamed " +
            "source only works for single-parameter functions, use " +
            "(name: value, ...) instead"));
        return;
      }
      checkArg(inputs.get(0).getPosition(), callee, sig, 0,
               inputTypes.get(0), errors);
      return;
    }

    Set<String> bound = new HashSet<String>();
    for (int i = 0; i < inputs.size(); i++) {
      ArgBinding in = inputs.get(i);
      String name = in.getParamName();
      int index = sig.paramIndex(name);
      if (index < 0) {
        errors.add(new TypeMismatchException(in.getPosition(), callee +
            " has no parameter called " + name + "; parameters are " +
            sig.getParamNames()));
      } else if (!bound.add(name)) {
        errors.add(new TypeMismatchException(in.getPosition(),
            "parameter " + name + " of " + callee + " bound twice"));
      } else {
        checkArg(in.getPosition(), callee, sig, index, inputTypes.get(i),
                 errors);
      }
    }
    List<String> missing = new ArrayList<String>();
    for (String param: sig.getParamNames()) {
      if (!bound.contains(param)) {
        missing.add(param);
      }
    }
    if (!missing.isEmpty()) {
      errors.add(new TypeMismatchException(callPos, "call to " + callee +
          " is missing input" + (missing.size() == 1 ? " " : "s ") +
          missing));
    }
  }

  private static void checkArg(FilePosition pos, String callee,
      FunctionType sig, int index, Type actual, List<UserException> errors) {
    try {
      TypeChecker.checkBoundary(pos, "parameter " +
            sig.getParamNames().get(index) + " of " + callee,
            sig.getParamTypes().get(index), actual);
    } catch (TypeMismatchException e) {
      errors.add(e);
    }
  }

  /**
   * Work out the names a pipeline destination binds.
   * Names that can't be typed are bound to the error type, so that later
   * uses don't cascade.
   * @return bound names with types, in order
   */
  public static Map<String, Type> destinationBindings(FilePosition callPos,
      String callee, Type result, Destination dest,
      List<UserException> errors) {
    Map<String, Type> bound = new LinkedHashMap<String, Type>();
    switch (dest.getKind()) {
      case NONE:
        break;
      case WHOLE:
        if (Types.isUnit(result)) {
          errors.add(new TypeMismatchException(callPos, callee +
              " returns nothing, so its result can't be bound to " +
              dest.getBindings().get(0).getBindName()));
          bound.put(dest.getBindings().get(0).getBindName(), Types.ERROR);
        } else {
          bound.put(dest.getBindings().get(0).getBindName(), result);
        }
        break;
      case DESTRUCTURE:
        destructure(callPos, callee, result, dest, bound, errors);
        break;
      default:
        throw new IllegalStateException("Unknown destination " +
                                        dest.getKind());
    }
    return bound;
  }

  private static void destructure(FilePosition callPos, String callee,
      Type result, Destination dest, Map<String, Type> bound,
      List<UserException> errors) {
    List<OutBinding> outs = dest.getBindings();
    if (result.isError()) {
      for (OutBinding out: outs) {
        bound.put(out.getBindName(), Types.ERROR);
      }
    } else if (result instanceof RecordType) {
      RecordType rec = (RecordType)result;
      for (OutBinding out: outs) {
        String field = out.getOutputName() != null ?
                        out.getOutputName() : out.getBindName();
        Type fieldType = rec.fieldType(field);
        if (fieldType == null) {
          errors.add(new UndefinedVarError(out.getPosition(), "record " +
              rec + " returned by " + callee + " has no field " + field));
          fieldType = Types.ERROR;
        }
        bound.put(out.getBindName(), fieldType);
      }
    } else if (result instanceof TupleType && !Types.isUnit(result)) {
      TupleType tuple = (TupleType)result;
      if (dest.hasFieldSelectors()) {
        errors.add(new TypeMismatchException(callPos, callee +
            " returns tuple " + tuple + ": tuple results are destructured " +
            "by position, not by name"));
      } else if (tuple.size() != outs.size()) {
        errors.add(new TypeMismatchException(callPos, callee +
            " returns " + tuple.size() + " values but destination binds " +
            outs.size()));
      }
      for (int i = 0; i < outs.size(); i++) {
        Type elem = i < tuple.size() && !dest.hasFieldSelectors() ?
                    tuple.elems().get(i) : Types.ERROR;
        bound.put(outs.get(i).getBindName(), elem);
      }
    } else {
      errors.add(new TypeMismatchException(callPos, "result of " + callee +
          " has type " + result + ", which can't be destructured"));
      for (OutBinding out: outs) {
        bound.put(out.getBindName(), Types.ERROR);
      }
    }
  }
}
