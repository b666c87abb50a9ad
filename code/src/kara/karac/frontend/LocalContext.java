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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import kara.karac.ast.FilePosition;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.common.exceptions.DoubleDefineException;
import kara.karac.common.lang.Types.Type;

/**
 * One lexical scope inside a body: the body's top scope, which also holds
 * the parameters, or an if/else block.
 *
 * Each name can be bound once per scope.  A child scope may bind a name
 * already bound by an ancestor, shadowing it for the child's extent.
 */
public class LocalContext extends Context {

  private final Context parent;
  private final GlobalContext globals;
  private final FunctionDef function;

  private final Map<String, Binding> variables =
                                    new LinkedHashMap<String, Binding>();

  /**
   * Names bound by statements of this scope that haven't been reached
   * yet, with the position of their binder
   */
  private final Map<String, FilePosition> pending =
                                    new HashMap<String, FilePosition>();

  private LocalContext(Context parent, FunctionDef function) {
    super(parent.logger, parent.getLevel() + 1);
    this.parent = parent;
    this.globals = parent.getGlobals();
    this.function = function;
  }

  /**
   * Create the top scope of a function or flow body
   */
  public static LocalContext fnContext(GlobalContext global,
                                       FunctionDef function) {
    return new LocalContext(global, function);
  }

  public LocalContext createChild() {
    return new LocalContext(this, function);
  }

  @Override
  public GlobalContext getGlobals() {
    return globals;
  }

  @Override
  public boolean isTopLevel() {
    return false;
  }

  public Context getParent() {
    return parent;
  }

  public FunctionDef getFunction() {
    return function;
  }

  /**
   * Bind a name in this scope
   * @throws DoubleDefineException if this scope already binds the name
   */
  public Binding declare(String name, Type type, Binding.Kind kind,
        FilePosition position) throws DoubleDefineException {
    Binding existing = variables.get(name);
    if (existing != null) {
      throw DoubleDefineException.rebinding(position, name,
                                            existing.getPosition());
    }
    Binding b = new Binding(name, type, kind, position);
    variables.put(name, b);
    pending.remove(name);
    if (logger.isTraceEnabled()) {
      LogHelper.trace(this, position, "bind " + b);
    }
    return b;
  }

  /**
   * Note that a later statement of this scope binds name
   */
  public void expectBinding(String name, FilePosition binder) {
    if (!variables.containsKey(name) && !pending.containsKey(name)) {
      pending.put(name, binder);
    }
  }

  @Override
  public Binding lookupVar(String name) {
    Binding b = variables.get(name);
    if (b != null) {
      return b;
    }
    return parent.lookupVar(name);
  }

  /**
   * @return binding in this scope only, or null
   */
  public Binding lookupLocal(String name) {
    return variables.get(name);
  }

  /**
   * Is name not yet bound, but bound by a later statement of this scope
   * or of an enclosing one?
   * @return position of the later binder, or null
   */
  public FilePosition boundLater(String name) {
    FilePosition pos = pending.get(name);
    if (pos != null) {
      return pos;
    }
    if (parent instanceof LocalContext) {
      return ((LocalContext)parent).boundLater(name);
    }
    return null;
  }

  /**
   * @return bindings of this scope in order bound
   */
  public List<Binding> getBindings() {
    return new ArrayList<Binding>(variables.values());
  }

  @Override
  public String toString() {
    return "LocalContext(" + function.getName() + ", level " + level + ")" +
           variables.keySet();
  }
}
