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
package kara.karac.frontend;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import kara.karac.ast.Expr;
import kara.karac.ast.Expr.BinaryOp;
import kara.karac.ast.Expr.Call;
import kara.karac.ast.Expr.Conversion;
import kara.karac.ast.Expr.FieldAccess;
import kara.karac.ast.Expr.FieldInit;
import kara.karac.ast.Expr.Identifier;
import kara.karac.ast.Expr.Literal;
import kara.karac.ast.Expr.RecordLiteral;
import kara.karac.ast.Expr.TupleLiteral;
import kara.karac.ast.Expr.UnaryOp;
import kara.karac.ast.FilePosition;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.InvalidOperandException;
import kara.karac.common.exceptions.TypeMismatchException;
import kara.karac.common.exceptions.UndefinedVarError;
import kara.karac.common.exceptions.UserException;
import kara.karac.common.lang.Types;
import kara.karac.common.lang.Types.RecordType;
import kara.karac.common.lang.Types.TupleType;
import kara.karac.common.lang.Types.Type;
import kara.karac.frontend.typecheck.FunctionTypeChecker;
import kara.karac.frontend.typecheck.TypeChecker;

/**
 * Resolves names in an expression and infers its type.
 *
 * Errors are recorded and the failing subexpression gets the error type,
 * which is compatible with everything, so one mistake is reported once
 * and checking carries on with the rest of the expression.
 */
public class ExprWalker implements Expr.Visitor<Type, RuntimeException> {

  private final TypeTable types;
  private final Diagnostics diagnostics;
  private final boolean deferForwardRefs;

  /**
   * Reads of names bound later in the body, left for the graph builder,
   * with the position of the later binder
   */
  private final Map<Identifier, FilePosition> deferred =
                          new LinkedHashMap<Identifier, FilePosition>();

  private LocalContext context;

  /**
   * @param deferForwardRefs if true, reads of names bound later are left
   *        to the dependency graph builder instead of reported here
   */
  public ExprWalker(TypeTable types, Diagnostics diagnostics,
                    boolean deferForwardRefs) {
    this.types = types;
    this.diagnostics = diagnostics;
    this.deferForwardRefs = deferForwardRefs;
  }

  /**
   * Infer type of expression, resolving names in context
   */
  public Type infer(LocalContext context, Expr e) {
    LocalContext saved = this.context;
    this.context = context;
    try {
      return e.accept(this);
    } finally {
      this.context = saved;
    }
  }

  public Map<Identifier, FilePosition> getDeferredForwardRefs() {
    return deferred;
  }

  private Type result(Expr e, Type t) {
    types.setType(e, t);
    return t;
  }

  private Type error(Expr e, UserException err) {
    diagnostics.add(err);
    return result(e, Types.ERROR);
  }

  @Override
  public Type visitLiteral(Literal e) {
    switch (e.getKind()) {
      case INTEGER:
        return result(e, Types.INT_LITERAL);
      case FLOAT:
        return result(e, Types.FLOAT_LITERAL);
      case STRING:
        return result(e, Types.STRING);
      case BOOL:
        return result(e, Types.BOOL);
      default:
        throw new IllegalStateException("Unknown literal " + e.getKind());
    }
  }

  @Override
  public Type visitIdentifier(Identifier e) {
    String name = e.getName();
    Binding b = context.lookupVar(name);
    if (b != null) {
      return result(e, b.getType());
    }

    FilePosition later = context.boundLater(name);
    if (later != null) {
      if (deferForwardRefs) {
        deferred.put(e, later);
        return result(e, Types.ERROR);
      }
      return error(e, forwardReference(e, later));
    }

    Declaration decl = context.lookupDeclaration(name);
    if (decl != null) {
      return error(e, new UndefinedVarError(e.getPosition(), name + " is a "
          + decl.getKind().description() + ", not a value"));
    }
    return error(e, UndefinedVarError.fromName(e.getPosition(), name));
  }

  public static UserException forwardReference(Identifier e,
                                               FilePosition binder) {
    return new UserException(e.getPosition(),
        DiagnosticKind.FORWARD_REFERENCE, e.getName() +
        " is used before it is bound at " + binder);
  }

  @Override
  public Type visitFieldAccess(FieldAccess e) {
    Type target = infer(context, e.getTarget());
    if (target.isError()) {
      return result(e, target);
    }
    if (target instanceof RecordType) {
      Type field = ((RecordType)target).fieldType(e.getField());
      if (field == null) {
        return error(e, new UndefinedVarError(e.getPosition(),
            "record " + target + " has no field " + e.getField()));
      }
      return result(e, field);
    } else if (target instanceof TupleType && e.isIndex()) {
      Type elem = TypeChecker.tupleElem((TupleType)target, e.getField());
      if (elem == null) {
        return error(e, new InvalidOperandException(e.getPosition(),
            "tuple " + target + " has no element " + e.getField()));
      }
      return result(e, elem);
    }
    return error(e, new InvalidOperandException(e.getPosition(),
        "can't access " + e.getField() + " on a value of type " + target));
  }

  @Override
  public Type visitUnaryOp(UnaryOp e) {
    Type operand = infer(context, e.getOperand());
    try {
      return result(e, TypeChecker.unaryResult(e.getPosition(), e.getOp(),
                                               operand));
    } catch (InvalidOperandException ex) {
      return error(e, ex);
    }
  }

  @Override
  public Type visitBinaryOp(BinaryOp e) {
    Type left = infer(context, e.getLeft());
    Type right = infer(context, e.getRight());
    try {
      return result(e, TypeChecker.binaryResult(e.getPosition(), e.getOp(),
                                                left, right));
    } catch (InvalidOperandException ex) {
      return error(e, ex);
    }
  }

  @Override
  public Type visitRecordLiteral(RecordLiteral e) {
    // Check field values first so errors inside them are still found
    List<Type> valueTypes = new ArrayList<Type>();
    for (FieldInit f: e.getFields()) {
      valueTypes.add(infer(context, f.getValue()));
    }

    Type t = context.getGlobals().lookupType(e.getTypeName());
    if (t == null) {
      Declaration decl = context.lookupDeclaration(e.getTypeName());
      if (decl == null) {
        return error(e, UndefinedVarError.unknownType(e.getPosition(),
                                                      e.getTypeName()));
      }
      return error(e, new UndefinedVarError(e.getPosition(),
          e.getTypeName() + " is a " + decl.getKind().description() +
          ", not a record"));
    } else if (t.isError()) {
      return result(e, t);
    } else if (!(t instanceof RecordType)) {
      return error(e, new TypeMismatchException(e.getPosition(),
          e.getTypeName() + " is not a record type; build it with 'as " +
          e.getTypeName() + "'"));
    }

    RecordType rec = (RecordType)t;
    Set<String> seen = new HashSet<String>();
    for (int i = 0; i < e.getFields().size(); i++) {
      FieldInit f = e.getFields().get(i);
      Type expected = rec.fieldType(f.getField());
      if (expected == null) {
        diagnostics.add(new UndefinedVarError(f.getPosition(), "record " +
                rec + " has no field " + f.getField()));
      } else if (!seen.add(f.getField())) {
        diagnostics.add(new TypeMismatchException(f.getPosition(),
                "field " + f.getField() + " of " + rec + " given twice"));
      } else {
        try {
          TypeChecker.checkBoundary(f.getPosition(), "field " +
              f.getField() + " of " + rec, expected, valueTypes.get(i));
        } catch (TypeMismatchException ex) {
          diagnostics.add(ex);
        }
      }
    }
    List<String> missing = new ArrayList<String>();
    for (String field: rec.fieldNames()) {
      if (!seen.contains(field)) {
        missing.add(field);
      }
    }
    if (!missing.isEmpty()) {
      diagnostics.add(new TypeMismatchException(e.getPosition(), "record " +
          rec + " is missing field" + (missing.size() == 1 ? " " : "s ") +
          missing));
    }
    return result(e, rec);
  }

  @Override
  public Type visitTupleLiteral(TupleLiteral e) {
    if (e.getElems().isEmpty()) {
      return result(e, Types.UNIT);
    }
    List<Type> elems = new ArrayList<Type>();
    for (Expr elem: e.getElems()) {
      elems.add(infer(context, elem));
    }
    return result(e, new TupleType(elems));
  }

  @Override
  public Type visitCall(Call e) {
    List<Type> argTypes = new ArrayList<Type>();
    List<FilePosition> argPositions = new ArrayList<FilePosition>();
    for (Expr arg: e.getArgs()) {
      argTypes.add(infer(context, arg));
      argPositions.add(arg.getPosition());
    }

    Declaration fn = lookupCallee(context, e.getPosition(), e.getCallee());
    if (fn == null) {
      return result(e, Types.ERROR);
    }
    List<UserException> errors = new ArrayList<UserException>();
    FunctionTypeChecker.checkCallArgs(e.getPosition(), e.getCallee(),
        fn.getSignature(), argPositions, argTypes, errors);
    for (UserException err: errors) {
      diagnostics.add(err);
    }
    return result(e, fn.getSignature().getResultType());
  }

  /**
   * Find a function to call, reporting an error if there is none
   * @return the declaration, or null
   */
  Declaration lookupCallee(Context ctx, FilePosition pos, String name) {
    Declaration decl = ctx.lookupDeclaration(name);
    if (decl == null) {
      diagnostics.add(UndefinedVarError.unknownFunction(pos, name));
      return null;
    } else if (!decl.isCallable()) {
      diagnostics.add(new UndefinedVarError(pos, name + " is a " +
          decl.getKind().description() + ", not a function"));
      return null;
    }
    return decl;
  }

  @Override
  public Type visitConversion(Conversion e) {
    Type source = infer(context, e.getExpr());
    Type target;
    try {
      target = context.resolveType(e.getTarget());
    } catch (UndefinedVarError ex) {
      return error(e, ex);
    }
    try {
      return result(e, TypeChecker.checkConversion(e.getPosition(), source,
                                                   target));
    } catch (TypeMismatchException ex) {
      return error(e, ex);
    }
  }
}
