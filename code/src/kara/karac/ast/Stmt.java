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
 * Statement nodes.  Like {@link Expr}, a closed set handled by
 * every pass through {@link Visitor}.
 */
public abstract class Stmt {

  public interface Visitor<T, X extends Exception> {
    T visitLetBinding(LetBinding s) throws X;
    T visitPipelineCall(PipelineCall s) throws X;
    T visitConditional(Conditional s) throws X;
    T visitExprStatement(ExprStatement s) throws X;
  }

  private final FilePosition position;

  protected Stmt(FilePosition position) {
    this.position = position;
  }

  public FilePosition getPosition() {
    return position;
  }

  public abstract <T, X extends Exception> T accept(Visitor<T, X> v)
                                                            throws X;

  /**
   * let name = value;
   */
  public static class LetBinding extends Stmt {
    private final String name;
    private final Expr value;

    public LetBinding(String name, Expr value, FilePosition position) {
      super(position);
      this.name = name;
      this.value = value;
    }

    public String getName() {
      return name;
    }

    public Expr getValue() {
      return value;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitLetBinding(this);
    }

    @Override
    public String toString() {
      return "let " + name + " = " + value + ";";
    }
  }

  /**
   * Input to a pipeline call.  paramName is null for a single unnamed
   * source, which binds the callee's only parameter.
   */
  public static class ArgBinding {
    private final String paramName;
    private final Expr value;
    private final FilePosition position;

    public ArgBinding(String paramName, Expr value, FilePosition position) {
      this.paramName = paramName;
      this.value = value;
      this.position = position;
    }

    public String getParamName() {
      return paramName;
    }

    public boolean isNamed() {
      return paramName != null;
    }

    public Expr getValue() {
      return value;
    }

    public FilePosition getPosition() {
      return position;
    }

    @Override
    public String toString() {
      return paramName == null ? value.toString() : paramName + ": " + value;
    }
  }

  /**
   * One name bound by a pipeline destination.  outputName selects a
   * record field; when null the binding is positional for tuple results
   * and names the field itself for record results.
   */
  public static class OutBinding {
    private final String outputName;
    private final String bindName;
    private final FilePosition position;

    public OutBinding(String outputName, String bindName,
                      FilePosition position) {
      this.outputName = outputName;
      this.bindName = bindName;
      this.position = position;
    }

    public String getOutputName() {
      return outputName;
    }

    public String getBindName() {
      return bindName;
    }

    public FilePosition getPosition() {
      return position;
    }

    @Override
    public String toString() {
      return outputName == null ? bindName : outputName + ": " + bindName;
    }
  }

  public static class Destination {
    public static enum Kind {
      /** () : result discarded */
      NONE,
      /** single name bound to the whole result */
      WHOLE,
      /** tuple or record result split into several names */
      DESTRUCTURE,
    }

    private final Kind kind;
    private final List<OutBinding> bindings;

    private Destination(Kind kind, List<OutBinding> bindings) {
      this.kind = kind;
      this.bindings = Collections.unmodifiableList(
                            new ArrayList<OutBinding>(bindings));
    }

    public static Destination none() {
      return new Destination(Kind.NONE,
                             Collections.<OutBinding>emptyList());
    }

    public static Destination whole(String name, FilePosition position) {
      return new Destination(Kind.WHOLE, Collections.singletonList(
                              new OutBinding(null, name, position)));
    }

    public static Destination destructure(List<OutBinding> bindings) {
      return new Destination(Kind.DESTRUCTURE, bindings);
    }

    public Kind getKind() {
      return kind;
    }

    public List<OutBinding> getBindings() {
      return bindings;
    }

    /**
     * @return names bound, in order
     */
    public List<String> boundNames() {
      List<String> names = new ArrayList<String>(bindings.size());
      for (OutBinding b: bindings) {
        names.add(b.getBindName());
      }
      return names;
    }

    /**
     * @return true if any binding picks a record field by name
     */
    public boolean hasFieldSelectors() {
      for (OutBinding b: bindings) {
        if (b.getOutputName() != null) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      switch (kind) {
        case NONE:
          return "()";
        case WHOLE:
          return bindings.get(0).getBindName();
        default:
          return "(" + StringUtils.join(bindings, ", ") + ")";
      }
    }
  }

  /**
   * Call of a fn or flow in statement position.  The dense form
   * <code>src -> F -> dst;</code> and the verbose form
   * <code>Action: F From: p = e To: out = x;</code> produce the same node;
   * form is kept only for tools that reprint source.
   */
  public static class PipelineCall extends Stmt {
    public static enum Form {
      DENSE,
      VERBOSE,
    }

    private final String callee;
    private final FilePosition calleePosition;
    private final List<ArgBinding> inputs;
    private final Destination destination;
    private final Form form;

    public PipelineCall(String callee, FilePosition calleePosition,
                        List<ArgBinding> inputs, Destination destination,
                        Form form, FilePosition position) {
      super(position);
      this.callee = callee;
      this.calleePosition = calleePosition;
      this.inputs = Collections.unmodifiableList(
                                new ArrayList<ArgBinding>(inputs));
      this.destination = destination;
      this.form = form;
    }

    public String getCallee() {
      return callee;
    }

    public FilePosition getCalleePosition() {
      return calleePosition;
    }

    public List<ArgBinding> getInputs() {
      return inputs;
    }

    public Destination getDestination() {
      return destination;
    }

    public Form getForm() {
      return form;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitPipelineCall(this);
    }

    @Override
    public String toString() {
      String src;
      if (inputs.size() == 1 && !inputs.get(0).isNamed()) {
        src = inputs.get(0).toString();
      } else {
        src = "(" + StringUtils.join(inputs, ", ") + ")";
      }
      return src + " -> " + callee + " -> " + destination + ";";
    }
  }

  /**
   * if cond { ... } else { ... }.  An else-if chain is an else block
   * holding a single nested Conditional.
   */
  public static class Conditional extends Stmt {
    private final Expr condition;
    private final Block thenBlock;
    private final Block elseBlock;

    public Conditional(Expr condition, Block thenBlock, Block elseBlock,
                       FilePosition position) {
      super(position);
      this.condition = condition;
      this.thenBlock = thenBlock;
      this.elseBlock = elseBlock;
    }

    public Expr getCondition() {
      return condition;
    }

    public Block getThenBlock() {
      return thenBlock;
    }

    /**
     * @return else block or null
     */
    public Block getElseBlock() {
      return elseBlock;
    }

    public boolean hasElse() {
      return elseBlock != null;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitConditional(this);
    }

    @Override
    public String toString() {
      return "if " + condition + " {...}" + (hasElse() ? " else {...}" : "");
    }
  }

  /**
   * Expression evaluated for its effect, e.g. Print("hi");
   */
  public static class ExprStatement extends Stmt {
    private final Expr expr;

    public ExprStatement(Expr expr, FilePosition position) {
      super(position);
      this.expr = expr;
    }

    public Expr getExpr() {
      return expr;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitExprStatement(this);
    }

    @Override
    public String toString() {
      return expr + ";";
    }
  }
}
