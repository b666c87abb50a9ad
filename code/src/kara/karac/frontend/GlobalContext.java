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
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import kara.karac.ast.TopLevelDef;
import kara.karac.common.Logging;
import kara.karac.common.lang.Builtins;
import kara.karac.common.lang.Types.Type;

/**
 * Top level names of one compilation unit.  Built by the
 * DeclarationRegistry and immutable afterwards, so it can be shared
 * without locking by the threads that check definition bodies.
 */
public class GlobalContext extends Context {

  /** First declaration of each name: the one lookups resolve to */
  private final Map<String, Declaration> declarations;

  /** Every declaration of each name, duplicates included */
  private final ImmutableListMultimap<String, Declaration> allDefinitions;

  /** Record and semantic types by name */
  private final Map<String, Type> namedTypes;

  /** Definitions whose header failed to resolve */
  private final Set<TopLevelDef> failed;

  private final Builtins builtins;

  GlobalContext(Map<String, Declaration> declarations,
                ListMultimap<String, Declaration> allDefinitions,
                Map<String, Type> namedTypes, Set<TopLevelDef> failed,
                Builtins builtins) {
    super(Logging.getKaracLogger(), ROOT_LEVEL);
    this.declarations = Collections.unmodifiableMap(
                  new LinkedHashMap<String, Declaration>(declarations));
    this.allDefinitions = ImmutableListMultimap.copyOf(allDefinitions);
    this.namedTypes = Collections.unmodifiableMap(
                  new LinkedHashMap<String, Type>(namedTypes));
    Set<TopLevelDef> failedCopy = Collections.newSetFromMap(
                  new IdentityHashMap<TopLevelDef, Boolean>());
    failedCopy.addAll(failed);
    this.failed = Collections.unmodifiableSet(failedCopy);
    this.builtins = builtins;
  }

  @Override
  public GlobalContext getGlobals() {
    return this;
  }

  @Override
  public boolean isTopLevel() {
    return true;
  }

  /**
   * Top level names are never values
   */
  @Override
  public Binding lookupVar(String name) {
    return null;
  }

  @Override
  public Declaration lookupDeclaration(String name) {
    return declarations.get(name);
  }

  public Map<String, Declaration> getDeclarations() {
    return declarations;
  }

  /**
   * @return all declarations of name in source order, built-in first
   */
  public List<Declaration> getAllDefinitions(String name) {
    return allDefinitions.get(name);
  }

  public ListMultimap<String, Declaration> getAllDefinitions() {
    return allDefinitions;
  }

  Map<String, Type> getNamedTypes() {
    return namedTypes;
  }

  /**
   * @return record or semantic type, or null
   */
  public Type lookupType(String name) {
    return namedTypes.get(name);
  }

  /**
   * @return true if the definition had an error in its header, or
   *        duplicated another definition's name.  Its body isn't checked.
   */
  public boolean isFailed(TopLevelDef def) {
    return failed.contains(def);
  }

  public Builtins getBuiltins() {
    return builtins;
  }

  @Override
  public String toString() {
    return "GlobalContext" + declarations.keySet();
  }
}
