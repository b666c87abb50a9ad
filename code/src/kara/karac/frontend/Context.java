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

import org.apache.log4j.Logger;

import kara.karac.ast.TypeRef;
import kara.karac.common.exceptions.UndefinedVarError;
import kara.karac.common.lang.Types.Type;
import kara.karac.frontend.typecheck.TypeChecker;

/**
 * Abstract interface used to track and access contextual information about
 * the program at different points in the AST.
 */
public abstract class Context {

  public static final int ROOT_LEVEL = 0;

  /**
   * How many levels from root: 0 if this is the root
   */
  protected final int level;

  /**
   * A logger for use by child classes
   */
  protected final Logger logger;

  public Context(Logger logger, int level) {
    super();
    this.level = level;
    this.logger = logger;
  }

  /**
     Return global context.
     If this is a GlobalContext, return this,
     else return the GlobalContext this is using.
   */
  public abstract GlobalContext getGlobals();

  /**
   * @return whether this is the global context
   */
  public abstract boolean isTopLevel();

  /**
   * Lookup a local value, searching enclosing scopes outward
   * @return the binding, or null if no scope binds the name
   */
  public abstract Binding lookupVar(String name);

  public int getLevel() {
    return level;
  }

  /**
   * @return top level declaration with this name, or null
   */
  public Declaration lookupDeclaration(String name) {
    return getGlobals().lookupDeclaration(name);
  }

  /**
   * @return callable declaration, or null if name isn't a function,
   *         flow or built-in
   */
  public Declaration lookupFunction(String name) {
    Declaration decl = lookupDeclaration(name);
    if (decl != null && decl.isCallable()) {
      return decl;
    }
    return null;
  }

  /**
   * Resolve a type written in source
   * @throws UndefinedVarError if a named type doesn't exist
   */
  public Type resolveType(TypeRef ref) throws UndefinedVarError {
    return TypeChecker.resolveTypeRef(ref, getGlobals().getNamedTypes());
  }
}
