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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import kara.karac.ast.Block;
import kara.karac.ast.Expr;
import kara.karac.ast.FilePosition;
import kara.karac.ast.Stmt;
import kara.karac.ast.Stmt.Conditional;
import kara.karac.ast.Stmt.ExprStatement;
import kara.karac.ast.Stmt.LetBinding;
import kara.karac.ast.Stmt.OutBinding;
import kara.karac.ast.Stmt.PipelineCall;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.ast.TypedName;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.DoubleDefineException;
import kara.karac.common.exceptions.InvalidOperandException;
import kara.karac.common.exceptions.KaracRuntimeError;
import kara.karac.common.exceptions.TypeMismatchException;
import kara.karac.common.exceptions.UserException;
import kara.karac.common.lang.Types;
import kara.karac.common.lang.Types.FunctionType;
import kara.karac.common.lang.Types.Type;
import kara.karac.frontend.dataflow.VariableUsageInfo;
import kara.karac.frontend.typecheck.FunctionTypeChecker;
import kara.karac.frontend.typecheck.TypeChecker;

/**
 * Second pass: resolves names and checks types in the body of one
 * function or flow against the frozen global context.
 *
 * Each walker owns its diagnostics and type table, so walkers for
 * different definitions can run on different threads.
 */
public class ASTWalker implements Stmt.Visitor<Void, RuntimeException> {

  private final GlobalContext globals;
  private final FunctionDef function;
  private final Diagnostics diagnostics = new Diagnostics();
  private final TypeTable types = new TypeTable();
  private final ExprWalker exprWalker;

  /** Scope of statement being walked */
  private LocalContext context;

  public ASTWalker(GlobalContext globals, FunctionDef function) {
    this.globals = globals;
    this.function = function;
    // In flows the dependency graph builder reports forward references
    this.exprWalker = new ExprWalker(types, diagnostics, function.isFlow());
  }

  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  public TypeTable getTypes() {
    return types;
  }

  public FunctionDef getFunction() {
    return function;
  }

  /**
   * Check the body
   * @return true if no errors were found
   */
  public boolean walk() {
    Declaration decl = globals.lookupDeclaration(function.getName());
    if (decl == null || decl.getDef() != function) {
      throw new KaracRuntimeError("Walking " + function.getName() +
                                  ", which isn't the registered definition");
    }
    FunctionType sig = decl.getSignature();
    LocalContext fnContext = LocalContext.fnContext(globals, function);
    LogHelper.debug(fnContext, function.getPosition(), "walking " +
                    function.getPurity().keyword() + " " + function.getName());

    List<TypedName> params = function.getParams();
    for (int i = 0; i < params.size(); i++) {
      TypedName param = params.get(i);
      try {
        fnContext.declare(param.getName(), sig.getParamTypes().get(i),
                          Binding.Kind.PARAMETER, param.getPosition());
      } catch (DoubleDefineException e) {
        // Registry already reported this and marked the definition failed
        throw new KaracRuntimeError("Duplicate parameter in checked " +
                                    "definition " + function.getName(), e);
      }
    }

    Type result = walkBlock(fnContext, function.getBody());
    checkResult(sig.getResultType(), result);

    if (diagnostics.hasErrors()) {
      // No graph will be built, so report deferred reads here
      for (Map.Entry<Expr.Identifier, FilePosition> e:
                  exprWalker.getDeferredForwardRefs().entrySet()) {
        diagnostics.add(ExprWalker.forwardReference(e.getKey(), e.getValue()));
      }
    }
    LogHelper.debug(fnContext, function.getPosition(), "done " +
          function.getName() + ": " + diagnostics.errorCount() + " errors");
    return !diagnostics.hasErrors();
  }

  /**
   * Walk the statements of a block in a scope
   * @return type of trailing expression, or null if there is none
   */
  private Type walkBlock(LocalContext scope, Block block) {
    for (Stmt stmt: block.getStatements()) {
      for (Map.Entry<String, FilePosition> bound:
                  VariableUsageInfo.boundNames(stmt).entrySet()) {
        scope.expectBinding(bound.getKey(), bound.getValue());
      }
    }

    LocalContext saved = context;
    context = scope;
    try {
      for (Stmt stmt: block.getStatements()) {
        stmt.accept(this);
      }
      if (block.hasResult()) {
        return exprWalker.infer(scope, block.getResult());
      }
      return null;
    } finally {
      context = saved;
    }
  }

  private void checkResult(Type declared, Type result) {
    Block body = function.getBody();
    try {
      if (function.getReturnType() == null) {
        if (result != null && !TypeChecker.isUnitLike(result)) {
          throw new TypeMismatchException(body.getResult().getPosition(),
              function.getName() + " declares no return type but its body " +
              "yields a value of type " + result);
        }
      } else if (result == null) {
        if (!Types.isUnit(declared) && !declared.isError()) {
          throw new TypeMismatchException(function.getReturnType()
              .getPosition(), function.getName() + " must return " +
              declared + " but its body has no result expression");
        }
      } else {
        TypeChecker.checkBoundary(body.getResult().getPosition(),
            "result of " + function.getName(), declared, result);
      }
    } catch (TypeMismatchException e) {
      diagnostics.add(e);
    }
  }

  private void bind(String name, Type type, Binding.Kind kind,
                    FilePosition pos) {
    try {
      context.declare(name, type, kind, pos);
    } catch (DoubleDefineException e) {
      diagnostics.add(e);
    }
  }

  @Override
  public Void visitLetBinding(LetBinding s) {
    Type t = exprWalker.infer(context, s.getValue());
    bind(s.getName(), t, Binding.Kind.LET, s.getPosition());
    types.setBindings(s, Collections.singletonMap(s.getName(), t));
    return null;
  }

  @Override
  public Void visitPipelineCall(PipelineCall s) {
    List<Type> inputTypes = new ArrayList<Type>();
    for (Stmt.ArgBinding in: s.getInputs()) {
      inputTypes.add(exprWalker.infer(context, in.getValue()));
    }

    Declaration callee = exprWalker.lookupCallee(context,
                              s.getCalleePosition(), s.getCallee());
    Map<String, Type> bound;
    if (callee != null) {
      List<UserException> errors = new ArrayList<UserException>();
      FunctionType sig = callee.getSignature();
      FunctionTypeChecker.checkPipelineInputs(s.getCalleePosition(),
          s.getCallee(), sig, s.getInputs(), inputTypes, errors);
      bound = FunctionTypeChecker.destinationBindings(s.getCalleePosition(),
          s.getCallee(), sig.getResultType(), s.getDestination(), errors);
      for (UserException e: errors) {
        diagnostics.add(e);
      }
    } else {
      bound = new LinkedHashMap<String, Type>();
      for (String name: s.getDestination().boundNames()) {
        bound.put(name, Types.ERROR);
      }
    }

    for (OutBinding out: s.getDestination().getBindings()) {
      Type t = bound.get(out.getBindName());
      bind(out.getBindName(), t == null ? Types.ERROR : t,
           Binding.Kind.DESTINATION, out.getPosition());
    }
    types.setBindings(s, bound);
    return null;
  }

  @Override
  public Void visitConditional(Conditional s) {
    Type cond = exprWalker.infer(context, s.getCondition());
    if (!cond.isError() && !Types.isBool(cond)) {
      diagnostics.add(new InvalidOperandException(
          s.getCondition().getPosition(),
          "if condition must be bool, not " + cond));
    }
    walkBlock(context.createChild(), s.getThenBlock());
    if (s.hasElse()) {
      walkBlock(context.createChild(), s.getElseBlock());
    }
    return null;
  }

  @Override
  public Void visitExprStatement(ExprStatement s) {
    exprWalker.infer(context, s.getExpr());
    return null;
  }
}
