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
import java.util.List;

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
import kara.karac.ast.Stmt.PipelineCall;

/**
 * Finds call sites by syntax alone, so it also works on bodies that
 * failed to resolve.  Only functions can be called, so a callee name
 * never refers to a local.
 */
public class CallFinder implements Stmt.Visitor<Void, RuntimeException>,
                                   Expr.Visitor<Void, RuntimeException> {

  public static class CallSite {
    private final String callee;
    private final FilePosition position;

    public CallSite(String callee, FilePosition position) {
      this.callee = callee;
      this.position = position;
    }

    public String getCallee() {
      return callee;
    }

    public FilePosition getPosition() {
      return position;
    }

    @Override
    public String toString() {
      return callee + "@" + position;
    }
  }

  private final boolean descend;
  private final List<CallSite> found = new ArrayList<CallSite>();

  private CallFinder(boolean descend) {
    this.descend = descend;
  }

  /**
   * @return all calls in block, nested blocks included, in source order
   */
  public static List<CallSite> inBlock(Block block) {
    CallFinder f = new CallFinder(true);
    f.walkBlock(block);
    return f.found;
  }

  /**
   * @return calls made by the statement itself, not by blocks nested
   *         inside it
   */
  public static List<CallSite> shallow(Stmt stmt) {
    CallFinder f = new CallFinder(false);
    stmt.accept(f);
    return f.found;
  }

  public static List<CallSite> inExpr(Expr expr) {
    CallFinder f = new CallFinder(false);
    expr.accept(f);
    return f.found;
  }

  private void walkBlock(Block block) {
    for (Stmt stmt: block.getStatements()) {
      stmt.accept(this);
    }
    if (block.hasResult()) {
      block.getResult().accept(this);
    }
  }

  @Override
  public Void visitLetBinding(LetBinding s) {
    return s.getValue().accept(this);
  }

  @Override
  public Void visitPipelineCall(PipelineCall s) {
    for (ArgBinding in: s.getInputs()) {
      in.getValue().accept(this);
    }
    found.add(new CallSite(s.getCallee(), s.getCalleePosition()));
    return null;
  }

  @Override
  public Void visitConditional(Conditional s) {
    s.getCondition().accept(this);
    if (descend) {
      walkBlock(s.getThenBlock());
      if (s.hasElse()) {
        walkBlock(s.getElseBlock());
      }
    }
    return null;
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
    found.add(new CallSite(e.getCallee(), e.getPosition()));
    return null;
  }

  @Override
  public Void visitConversion(Conversion e) {
    return e.getExpr().accept(this);
  }
}
