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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import kara.karac.ast.Expr;
import kara.karac.ast.FilePosition;
import kara.karac.ast.Stmt;
import kara.karac.common.lang.Types.Type;

/**
 * One statement of an orchestration body, or the body's trailing result
 * expression.  Exactly one of getStatement() and getResult() is non-null.
 */
public class StatementNode {
  private final int index;
  private final Stmt statement;
  private final Expr result;
  private final Set<String> inputs;
  private final Map<String, Type> outputs;
  private final List<String> callees;
  private final boolean impure;
  private final boolean selfRecursive;
  private final List<DependencyGraph> nested;

  StatementNode(int index, Stmt statement, Expr result, Set<String> inputs,
                Map<String, Type> outputs, List<String> callees,
                boolean impure, boolean selfRecursive,
                List<DependencyGraph> nested) {
    assert((statement == null) != (result == null));
    this.index = index;
    this.statement = statement;
    this.result = result;
    this.inputs = Collections.unmodifiableSet(
                              new LinkedHashSet<String>(inputs));
    this.outputs = Collections.unmodifiableMap(
                              new LinkedHashMap<String, Type>(outputs));
    this.callees = Collections.unmodifiableList(
                              new ArrayList<String>(callees));
    this.impure = impure;
    this.selfRecursive = selfRecursive;
    this.nested = Collections.unmodifiableList(
                              new ArrayList<DependencyGraph>(nested));
  }

  /**
   * @return position in the block, from 0
   */
  public int getIndex() {
    return index;
  }

  public Stmt getStatement() {
    return statement;
  }

  public Expr getResult() {
    return result;
  }

  public boolean isResult() {
    return result != null;
  }

  public FilePosition getPosition() {
    return statement != null ? statement.getPosition() : result.getPosition();
  }

  /**
   * Names read from the enclosing scope, nested blocks included
   */
  public Set<String> getInputs() {
    return inputs;
  }

  /**
   * Names bound in this scope
   */
  public Set<String> getOutputs() {
    return outputs.keySet();
  }

  public Map<String, Type> getOutputTypes() {
    return outputs;
  }

  /**
   * Functions called directly, not counting nested blocks
   */
  public List<String> getCallees() {
    return callees;
  }

  /**
   * @return true if the node calls an impure function, branches included
   */
  public boolean isImpure() {
    return impure;
  }

  /**
   * @return true if the node calls the enclosing flow.  The call is a
   *         leaf: nothing of the callee's body appears in this graph.
   */
  public boolean isSelfRecursive() {
    return selfRecursive;
  }

  /**
   * Graphs for the branches of a conditional, then-branch first
   */
  public List<DependencyGraph> getNested() {
    return nested;
  }

  public String describe() {
    return statement != null ? statement.toString() : "=> " + result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(index).append("] ").append(describe());
    sb.append("  in: {").append(StringUtils.join(inputs, ", "));
    sb.append("} out: {").append(StringUtils.join(outputs.keySet(), ", "));
    sb.append('}');
    if (impure) {
      sb.append(" impure");
    }
    if (selfRecursive) {
      sb.append(" recursive");
    }
    return sb.toString();
  }
}
