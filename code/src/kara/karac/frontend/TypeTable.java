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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import kara.karac.ast.Expr;
import kara.karac.ast.Stmt;
import kara.karac.common.lang.Types.Type;

/**
 * Types inferred for AST nodes, keyed by node identity.  The AST itself
 * is never annotated.
 *
 * Each definition is checked with its own table; tables are merged once
 * all checks are done and only read after that.
 */
public class TypeTable {
  private final Map<Expr, Type> exprTypes =
                                new IdentityHashMap<Expr, Type>();

  /** Names bound by each statement with their types, in order bound */
  private final Map<Stmt, Map<String, Type>> bindings =
                                new IdentityHashMap<Stmt, Map<String, Type>>();

  public void setType(Expr e, Type t) {
    exprTypes.put(e, t);
  }

  /**
   * @return inferred type, or null if the expression wasn't checked
   */
  public Type getType(Expr e) {
    return exprTypes.get(e);
  }

  public void setBindings(Stmt s, Map<String, Type> bound) {
    bindings.put(s, Collections.unmodifiableMap(
                      new LinkedHashMap<String, Type>(bound)));
  }

  /**
   * @return names bound by statement, empty if none
   */
  public Map<String, Type> getBindings(Stmt s) {
    Map<String, Type> result = bindings.get(s);
    if (result == null) {
      return Collections.emptyMap();
    }
    return result;
  }

  public void putAll(TypeTable other) {
    exprTypes.putAll(other.exprTypes);
    bindings.putAll(other.bindings);
  }

  public int size() {
    return exprTypes.size();
  }
}
