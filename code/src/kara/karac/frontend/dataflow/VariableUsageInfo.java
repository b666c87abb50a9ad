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
package kara.karac.frontend.dataflow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import kara.karac.ast.Block;
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
import kara.karac.ast.Stmt;
import kara.karac.ast.Stmt.ArgBinding;
import kara.karac.ast.Stmt.Conditional;
import kara.karac.ast.Stmt.ExprStatement;
import kara.karac.ast.Stmt.LetBinding;
import kara.karac.ast.Stmt.OutBinding;
import kara.karac.ast.Stmt.PipelineCall;

/**
 * Which variables statements read and bind.
 *
 * Assumptions:
 * * Names are resolved and type-checked elsewhere
 * * Callee and record type names are never variables
 */
public class VariableUsageInfo {

  private VariableUsageInfo() {
    // static methods only
  }

  /**
   * Names a statement binds in its own scope, with binder positions,
   * in order bound.  A conditional binds nothing: its branches are
   * scopes of their own.
   */
  public static Map<String, FilePosition> boundNames(Stmt stmt) {
    Map<String, FilePosition> result =
                          new LinkedHashMap<String, FilePosition>();
    if (stmt instanceof LetBinding) {
      result.put(((LetBinding)stmt).getName(), stmt.getPosition());
    } else if (stmt instanceof PipelineCall) {
      for (OutBinding out:
                ((PipelineCall)stmt).getDestination().getBindings()) {
        result.put(out.getBindName(), out.getPosition());
      }
    }
    return result;
  }

  /**
   * Identifiers the statement reads itself, ignoring nested blocks
   */
  public static List<Identifier> directReads(Stmt stmt) {
    ReadFinder f = new ReadFinder();
    stmt.accept(f);
    return f.reads;
  }

  public static List<Identifier> directReads(Expr expr) {
    ReadFinder f = new ReadFinder();
    expr.accept(f);
    return f.reads;
  }

  /**
   * Names the statement reads from the scope it is in.  A read inside a
   * nested block counts unless an earlier statement of that block
   * bound the name.
   */
  public static Set<String> inputs(Stmt stmt) {
    Set<String> result = new LinkedHashSet<String>();
    addNames(result, directReads(stmt));
    if (stmt instanceof Conditional) {
      Conditional c = (Conditional)stmt;
      result.addAll(freeNames(c.getThenBlock()));
      if (c.hasElse()) {
        result.addAll(freeNames(c.getElseBlock()));
      }
    }
    return result;
  }

  public static Set<String> inputs(Expr expr) {
    Set<String> result = new LinkedHashSet<String>();
    addNames(result, directReads(expr));
    return result;
  }

  /**
   * Names a block reads from enclosing scopes
   */
  public static Set<String> freeNames(Block block) {
    Set<String> result = new LinkedHashSet<String>();
    Set<String> bound = new HashSet<String>();
    for (Stmt stmt: block.getStatements()) {
      for (String in: inputs(stmt)) {
        if (!bound.contains(in)) {
          result.add(in);
        }
      }
      bound.addAll(boundNames(stmt).keySet());
    }
    if (block.hasResult()) {
      for (String in: inputs(block.getResult())) {
        if (!bound.contains(in)) {
          result.add(in);
        }
      }
    }
    return result;
  }

  private static void addNames(Set<String> names, List<Identifier> ids) {
    for (Identifier id: ids) {
      names.add(id.getName());
    }
  }

  private static class ReadFinder
        implements Stmt.Visitor<Void, RuntimeException>,
                   Expr.Visitor<Void, RuntimeException> {
    private final List<Identifier> reads = new ArrayList<Identifier>();

    @Override
    public Void visitLetBinding(LetBinding s) {
      return s.getValue().accept(this);
    }

    @Override
    public Void visitPipelineCall(PipelineCall s) {
      for (ArgBinding in: s.getInputs()) {
        in.getValue().accept(this);
      }
      return null;
    }

    @Override
    public Void visitConditional(Conditional s) {
      return s.getCondition().accept(this);
    }

    @Override
    public Void visitExprStatement(ExprStatement s) {
      return s.getExpr().accept(this);
    }

    @Override
    public Void visitLiteral(Literal e) {
      return null;
    }

    @Override
    public Void visitIdentifier(Identifier e) {
      reads.add(e);
      return null;
    }

    @Override
    public Void visitFieldAccess(FieldAccess e) {
      return e.getTarget().accept(this);
    }

    @Override
    public Void visitUnaryOp(UnaryOp e) {
      return e.getOperand().accept(this);
    }

    @Override
    public Void visitBinaryOp(BinaryOp e) {
      e.getLeft().accept(this);
      return e.getRight().accept(this);
    }

    @Override
    public Void visitRecordLiteral(RecordLiteral e) {
      for (FieldInit f: e.getFields()) {
        f.getValue().accept(this);
      }
      return null;
    }

    @Override
    public Void visitTupleLiteral(TupleLiteral e) {
      for (Expr elem: e.getElems()) {
        elem.accept(this);
      }
      return null;
    }

    @Override
    public Void visitCall(Call e) {
      for (Expr arg: e.getArgs()) {
        arg.accept(this);
      }
      return null;
    }

    @Override
    public Void visitConversion(Conversion e) {
      return e.getExpr().accept(this);
    }
  }
}
