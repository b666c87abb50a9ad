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
package kara.karac.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Expression nodes.  The set of subclasses is closed: every pass handles
 * each of them through {@link Visitor}.  Nodes are immutable and carry no
 * resolved information; passes keep that in side tables keyed by node
 * identity, so equals/hashCode are deliberately not overridden.
 */
public abstract class Expr {

  public interface Visitor<T, X extends Exception> {
    T visitLiteral(Literal e) throws X;
    T visitIdentifier(Identifier e) throws X;
    T visitFieldAccess(FieldAccess e) throws X;
    T visitUnaryOp(UnaryOp e) throws X;
    T visitBinaryOp(BinaryOp e) throws X;
    T visitRecordLiteral(RecordLiteral e) throws X;
    T visitTupleLiteral(TupleLiteral e) throws X;
    T visitCall(Call e) throws X;
    T visitConversion(Conversion e) throws X;
  }

  private final FilePosition position;

  protected Expr(FilePosition position) {
    this.position = position;
  }

  public FilePosition getPosition() {
    return position;
  }

  public abstract <T, X extends Exception> T accept(Visitor<T, X> v)
                                                            throws X;

  public static enum LiteralKind {
    INTEGER,
    FLOAT,
    STRING,
    BOOL,
  }

  public static class Literal extends Expr {
    private final LiteralKind kind;
    /** Long, Double, String or Boolean according to kind */
    private final Object value;

    public Literal(LiteralKind kind, Object value, FilePosition position) {
      super(position);
      this.kind = kind;
      this.value = value;
    }

    public LiteralKind getKind() {
      return kind;
    }

    public Object getValue() {
      return value;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitLiteral(this);
    }

    @Override
    public String toString() {
      if (kind == LiteralKind.STRING) {
        return "\"" + value + "\"";
      }
      return String.valueOf(value);
    }
  }

  public static class Identifier extends Expr {
    private final String name;

    public Identifier(String name, FilePosition position) {
      super(position);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitIdentifier(this);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * a.b, or t.0 for tuple elements
   */
  public static class FieldAccess extends Expr {
    private final Expr target;
    private final String field;

    public FieldAccess(Expr target, String field, FilePosition position) {
      super(position);
      this.target = target;
      this.field = field;
    }

    public Expr getTarget() {
      return target;
    }

    public String getField() {
      return field;
    }

    /**
     * @return true if field is a tuple element index
     */
    public boolean isIndex() {
      return !field.isEmpty() && Character.isDigit(field.charAt(0));
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitFieldAccess(this);
    }

    @Override
    public String toString() {
      return target + "." + field;
    }
  }

  public static class UnaryOp extends Expr {
    private final Operator op;
    private final Expr operand;

    public UnaryOp(Operator op, Expr operand, FilePosition position) {
      super(position);
      assert(op.isUnary()) : op;
      this.op = op;
      this.operand = operand;
    }

    public Operator getOp() {
      return op;
    }

    public Expr getOperand() {
      return operand;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitUnaryOp(this);
    }

    @Override
    public String toString() {
      return op.symbol() + operand;
    }
  }

  public static class BinaryOp extends Expr {
    private final Operator op;
    private final Expr left;
    private final Expr right;

    public BinaryOp(Operator op, Expr left, Expr right,
                    FilePosition position) {
      super(position);
      assert(!op.isUnary()) : op;
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public Operator getOp() {
      return op;
    }

    public Expr getLeft() {
      return left;
    }

    public Expr getRight() {
      return right;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitBinaryOp(this);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }

  public static class FieldInit {
    private final String field;
    private final Expr value;
    private final FilePosition position;

    public FieldInit(String field, Expr value, FilePosition position) {
      this.field = field;
      this.value = value;
      this.position = position;
    }

    public String getField() {
      return field;
    }

    public Expr getValue() {
      return value;
    }

    public FilePosition getPosition() {
      return position;
    }

    @Override
    public String toString() {
      return field + ": " + value;
    }
  }

  /**
   * Point { x: 1, y: 2 }
   */
  public static class RecordLiteral extends Expr {
    private final String typeName;
    private final List<FieldInit> fields;

    public RecordLiteral(String typeName, List<FieldInit> fields,
                         FilePosition position) {
      super(position);
      this.typeName = typeName;
      this.fields = Collections.unmodifiableList(
                                  new ArrayList<FieldInit>(fields));
    }

    public String getTypeName() {
      return typeName;
    }

    public List<FieldInit> getFields() {
      return fields;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitRecordLiteral(this);
    }

    @Override
    public String toString() {
      return typeName + " { " + StringUtils.join(fields, ", ") + " }";
    }
  }

  /**
   * (a, b), or () for unit
   */
  public static class TupleLiteral extends Expr {
    private final List<Expr> elems;

    public TupleLiteral(List<Expr> elems, FilePosition position) {
      super(position);
      this.elems = Collections.unmodifiableList(new ArrayList<Expr>(elems));
    }

    public List<Expr> getElems() {
      return elems;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitTupleLiteral(this);
    }

    @Override
    public String toString() {
      return "(" + StringUtils.join(elems, ", ") + ")";
    }
  }

  /**
   * f(a, b).  Arguments are positional.
   */
  public static class Call extends Expr {
    private final String callee;
    private final List<Expr> args;

    public Call(String callee, List<Expr> args, FilePosition position) {
      super(position);
      this.callee = callee;
      this.args = Collections.unmodifiableList(new ArrayList<Expr>(args));
    }

    public String getCallee() {
      return callee;
    }

    public List<Expr> getArgs() {
      return args;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitCall(this);
    }

    @Override
    public String toString() {
      return callee + "(" + StringUtils.join(args, ", ") + ")";
    }
  }

  /**
   * expr as Type: the only way between a primitive and a semantic type
   */
  public static class Conversion extends Expr {
    private final Expr expr;
    private final TypeRef target;

    public Conversion(Expr expr, TypeRef target, FilePosition position) {
      super(position);
      this.expr = expr;
      this.target = target;
    }

    public Expr getExpr() {
      return expr;
    }

    public TypeRef getTarget() {
      return target;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitConversion(this);
    }

    @Override
    public String toString() {
      return expr + " as " + target;
    }
  }
}
