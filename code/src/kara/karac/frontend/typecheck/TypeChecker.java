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
import java.util.List;
import java.util.Map;

import kara.karac.ast.FilePosition;
import kara.karac.ast.Operator;
import kara.karac.ast.TypeRef;
import kara.karac.common.exceptions.InvalidOperandException;
import kara.karac.common.exceptions.TypeMismatchException;
import kara.karac.common.exceptions.UndefinedVarError;
import kara.karac.common.lang.Types;
import kara.karac.common.lang.Types.PrimCategory;
import kara.karac.common.lang.Types.PrimitiveType;
import kara.karac.common.lang.Types.TupleType;
import kara.karac.common.lang.Types.Type;
import kara.karac.common.lang.Types.UntypedLiteralType;

/**
 * Type rules.  Boundaries (arguments, results, record fields) are
 * nominal; operators inside bodies only look at the underlying
 * primitive.
 */
public class TypeChecker {

  /**
   * Resolve a type written in source against primitive names and the
   * given user-defined types.
   * @throws UndefinedVarError if a name isn't a type
   */
  public static Type resolveTypeRef(TypeRef ref, Map<String, Type> named)
      throws UndefinedVarError {
    if (ref.isTuple()) {
      if (ref.getElems().isEmpty()) {
        return Types.UNIT;
      }
      List<Type> elems = new ArrayList<Type>(ref.getElems().size());
      for (TypeRef elem: ref.getElems()) {
        elems.add(resolveTypeRef(elem, named));
      }
      return new TupleType(elems);
    }
    Type prim = Types.lookupPrimitive(ref.getName());
    if (prim != null) {
      return prim;
    }
    Type t = named.get(ref.getName());
    if (t == null) {
      throw UndefinedVarError.unknownType(ref.getPosition(), ref.getName());
    }
    return t;
  }

  /**
   * Can a value of type actual cross a boundary declared as expected?
   */
  public static boolean compatible(Type expected, Type actual) {
    if (expected.isError() || actual.isError()) {
      return true;
    } else if (expected.equals(actual)) {
      return true;
    } else if (actual instanceof UntypedLiteralType) {
      // Literals take on any primitive of their category, but never
      // a semantic type
      return expected.isPrimitive() &&
             expected.category() == actual.category();
    } else if (expected instanceof TupleType && actual instanceof TupleType) {
      List<Type> e = ((TupleType)expected).elems();
      List<Type> a = ((TupleType)actual).elems();
      if (e.size() != a.size()) {
        return false;
      }
      for (int i = 0; i < e.size(); i++) {
        if (!compatible(e.get(i), a.get(i))) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  /**
   * @param boundary description for message, e.g. "argument 1 of f"
   * @throws TypeMismatchException if not compatible
   */
  public static void checkBoundary(FilePosition pos, String boundary,
      Type expected, Type actual) throws TypeMismatchException {
    if (!compatible(expected, actual)) {
      String hint = "";
      if (expected.isSemantic() && actual.isPrimitive() &&
          expected.underlyingPrim().equals(actual)) {
        hint = ". Use 'as " + expected + "' to convert";
      } else if (expected.isPrimitive() && actual.isSemantic() &&
                 actual.underlyingPrim().equals(expected)) {
        hint = ". Use 'as " + expected + "' to convert";
      } else if (expected.isSemantic() &&
                 actual instanceof UntypedLiteralType &&
                 expected.category() == actual.category()) {
        hint = ". Use 'as " + expected + "' to convert";
      }
      throw new TypeMismatchException(pos, boundary + ": expected " +
                          expected + " but got " + actual + hint);
    }
  }

  /**
   * Check expr as target.  Only crosses between a semantic type and
   * its own underlying primitive.
   * @return the target type
   */
  public static Type checkConversion(FilePosition pos, Type source,
      Type target) throws TypeMismatchException {
    if (source.isError() || target.isError()) {
      return target;
    }
    if (target.isSemantic()) {
      PrimitiveType base = target.underlyingPrim();
      if (source.equals(target) || source.equals(base) ||
          (source instanceof UntypedLiteralType &&
           source.category() == base.category())) {
        return target;
      }
      if (source.isSemantic()) {
        throw new TypeMismatchException(pos, "cannot convert " + source +
            " directly to " + target + ": convert through the underlying " +
            "primitive with two conversions, e.g. (x as " +
            source.underlyingPrim() + ") as " + target);
      }
    } else if (target.isPrimitive()) {
      if (source.equals(target) ||
          (source.isSemantic() && source.underlyingPrim().equals(target)) ||
          (source instanceof UntypedLiteralType &&
           source.category() == target.category())) {
        return target;
      }
    } else {
      throw new TypeMismatchException(pos, "cannot convert to " + target +
          ": conversion only works between a semantic type and its " +
          "underlying primitive");
    }
    throw TypeMismatchException.mismatch(pos, "conversion to " + target,
          target.underlyingPrim(), source);
  }

  public static Type unaryResult(FilePosition pos, Operator op, Type operand)
      throws InvalidOperandException {
    if (operand.isError()) {
      return operand;
    }
    switch (op) {
      case NOT:
        if (!Types.isBool(operand)) {
          throw new InvalidOperandException(pos,
              "operator ! needs a bool operand, not " + operand);
        }
        return operand;
      case NEGATE:
        if (!Types.isNumeric(operand)) {
          throw new InvalidOperandException(pos,
              "operator - needs a numeric operand, not " + operand);
        }
        return operand;
      default:
        throw new IllegalArgumentException("not unary: " + op);
    }
  }

  public static Type binaryResult(FilePosition pos, Operator op, Type left,
      Type right) throws InvalidOperandException {
    if (left.isError() || right.isError()) {
      return Types.ERROR;
    }
    if (op.isComparison()) {
      checkComparable(pos, op, left, right);
      return Types.BOOL;
    }

    PrimCategory lcat = left.category();
    PrimCategory rcat = right.category();
    if (op == Operator.PLUS && lcat == PrimCategory.STRING &&
        rcat == PrimCategory.STRING) {
      return unify(pos, op, left, right);
    }
    if (lcat == null || !lcat.isNumeric() ||
        rcat == null || !rcat.isNumeric()) {
      throw new InvalidOperandException(pos, "operator " + op.symbol() +
          " can't be applied to " + left + " and " + right);
    }
    return unify(pos, op, left, right);
  }

  /**
   * Both operands must have the same underlying primitive.  Untyped
   * literals adapt to the other side.
   * @return the common type if both sides have it, else the primitive
   */
  private static Type unify(FilePosition pos, Operator op, Type left,
      Type right) throws InvalidOperandException {
    boolean lLit = left instanceof UntypedLiteralType;
    boolean rLit = right instanceof UntypedLiteralType;
    if (left.category() != right.category()) {
      throw operandMismatch(pos, op, left, right);
    }
    if (lLit && rLit) {
      return left;
    } else if (lLit) {
      return right;
    } else if (rLit) {
      return left;
    } else if (left.equals(right)) {
      return left;
    } else if (left.underlyingPrim().equals(right.underlyingPrim())) {
      return left.underlyingPrim();
    }
    throw operandMismatch(pos, op, left, right);
  }

  private static void checkComparable(FilePosition pos, Operator op,
      Type left, Type right) throws InvalidOperandException {
    boolean equality = op == Operator.EQ || op == Operator.NEQ;
    if (left.category() == null || right.category() == null) {
      // Records and tuples: equality only, and only between equal types
      if (equality && left.equals(right)) {
        return;
      }
      throw new InvalidOperandException(pos, "operator " + op.symbol() +
          " can't compare " + left + " and " + right);
    }
    unify(pos, op, left, right);
    if (!equality && left.category() == PrimCategory.BOOL) {
      throw new InvalidOperandException(pos, "operator " + op.symbol() +
          " needs numeric or string operands, not " + left);
    }
  }

  private static InvalidOperandException operandMismatch(FilePosition pos,
      Operator op, Type left, Type right) {
    return new InvalidOperandException(pos, "operands of " + op.symbol() +
        " must have the same underlying type, but got " + left + " and " +
        right);
  }

  /**
   * @return element type for t.index, or null if out of range
   */
  public static Type tupleElem(TupleType t, String index) {
    int i;
    try {
      i = Integer.parseInt(index);
    } catch (NumberFormatException e) {
      return null;
    }
    if (i < 0 || i >= t.size()) {
      return null;
    }
    return t.elems().get(i);
  }

  /**
   * Is t a type a body may yield without declaring a return type?
   */
  public static boolean isUnitLike(Type t) {
    return t.isError() || Types.isUnit(t);
  }
}
