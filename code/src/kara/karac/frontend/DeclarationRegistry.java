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
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import kara.karac.ast.FilePosition;
import kara.karac.ast.Program;
import kara.karac.ast.TopLevelDef;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.ast.TopLevelDef.RecordDef;
import kara.karac.ast.TopLevelDef.SemanticTypeDef;
import kara.karac.ast.TypeRef;
import kara.karac.ast.TypedName;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.DoubleDefineException;
import kara.karac.common.exceptions.UndefinedVarError;
import kara.karac.common.exceptions.UserException;
import kara.karac.common.lang.Builtins;
import kara.karac.common.lang.Builtins.BuiltinFunction;
import kara.karac.common.lang.Types;
import kara.karac.common.lang.Types.FunctionType;
import kara.karac.common.lang.Types.RecordType;
import kara.karac.common.lang.Types.SemanticType;
import kara.karac.common.lang.Types.Type;
import kara.karac.frontend.typecheck.TypeChecker;

/**
 * First pass over a program: registers every top level name before any
 * body is looked at, so bodies can refer to definitions in any order.
 *
 * The registry is single use and single threaded.  {@link #build}
 * returns an immutable GlobalContext.
 */
public class DeclarationRegistry {
  private static final Logger logger = Logging.getKaracLogger();

  private static final String BUILTIN_FILE = "<builtins>";

  private final Builtins builtins;
  private final Diagnostics diagnostics;

  private final Map<String, TopLevelDef> firstDefs =
                                new LinkedHashMap<String, TopLevelDef>();
  private final ListMultimap<String, Declaration> allDefinitions =
                                ArrayListMultimap.create();
  private final Map<String, Declaration> declarations =
                                new LinkedHashMap<String, Declaration>();
  private final Map<String, Type> namedTypes =
                                new LinkedHashMap<String, Type>();
  private final Set<TopLevelDef> failed = Collections.newSetFromMap(
                                new IdentityHashMap<TopLevelDef, Boolean>());

  private boolean built = false;

  public DeclarationRegistry(Builtins builtins, Diagnostics diagnostics) {
    this.builtins = builtins;
    this.diagnostics = diagnostics;
  }

  /**
   * Register and resolve all top level definitions
   * @param malformed definitions that had syntax errors: registered so
   *        their names resolve, but treated as failed
   */
  public GlobalContext build(Program program, Set<TopLevelDef> malformed) {
    if (built) {
      throw new IllegalStateException("Registry already built");
    }
    built = true;
    failed.addAll(malformed);

    registerBuiltins();
    for (TopLevelDef def: program.getDefinitions()) {
      register(def);
    }

    // Semantic types first: records and signatures may use them
    for (TopLevelDef def: program.getDefinitions()) {
      if (def instanceof SemanticTypeDef && isFirst(def)) {
        resolveSemanticType((SemanticTypeDef)def);
      }
    }
    for (TopLevelDef def: program.getDefinitions()) {
      if (def instanceof RecordDef && isFirst(def)) {
        resolveRecord((RecordDef)def);
      }
    }
    for (TopLevelDef def: program.getDefinitions()) {
      if (def instanceof FunctionDef) {
        resolveSignature((FunctionDef)def);
      }
    }

    // Keep duplicate type definitions visible, without a usable type
    for (TopLevelDef def: program.getDefinitions()) {
      if (!isFirst(def) && !(def instanceof FunctionDef)) {
        Declaration.Kind kind = def instanceof RecordDef ?
            Declaration.Kind.RECORD : Declaration.Kind.SEMANTIC_TYPE;
        allDefinitions.put(def.getName(),
                           Declaration.forType(kind, def, Types.ERROR));
      }
    }

    GlobalContext globals = new GlobalContext(declarations, allDefinitions,
                                              namedTypes, failed, builtins);
    logger.debug("registry: " + declarations.size() + " declarations, " +
                 failed.size() + " failed definitions");
    return globals;
  }

  private void registerBuiltins() {
    FilePosition pos = FilePosition.unknown(BUILTIN_FILE);
    for (BuiltinFunction fn: builtins.getAll()) {
      Declaration decl = Declaration.forBuiltin(fn.getName(), fn.getType(),
                                                pos);
      declarations.put(fn.getName(), decl);
      allDefinitions.put(fn.getName(), decl);
    }
  }

  /**
   * Claim the name.  A later definition of a taken name is reported
   * and marked failed; the first one keeps the name.
   */
  private void register(TopLevelDef def) {
    String name = def.getName();
    try {
      if (Types.lookupPrimitive(name) != null) {
        throw new DoubleDefineException(def.getPosition(),
            DiagnosticKind.DUPLICATE_DEFINITION,
            name + " is a primitive type and can't be redefined");
      }
      BuiltinFunction builtin = builtins.lookup(name);
      if (builtin != null) {
        throw new DoubleDefineException(def.getPosition(),
            DiagnosticKind.DUPLICATE_DEFINITION,
            name + " is a built-in function and can't be redefined");
      }
      TopLevelDef prev = firstDefs.get(name);
      if (prev != null) {
        throw DoubleDefineException.duplicate(def.getPosition(),
            describe(prev), name, prev.getPosition());
      }
      firstDefs.put(name, def);
      if (def instanceof RecordDef) {
        namedTypes.put(name, new RecordType(name));
      }
    } catch (DoubleDefineException e) {
      diagnostics.add(e);
      failed.add(def);
    }
  }

  private boolean isFirst(TopLevelDef def) {
    return firstDefs.get(def.getName()) == def;
  }

  private void resolveSemanticType(SemanticTypeDef def) {
    TypeRef ref = def.getUnderlying();
    Type underlying;
    try {
      underlying = TypeChecker.resolveTypeRef(ref, namedTypes);
    } catch (UndefinedVarError e) {
      underlying = null;
      if (firstDefs.get(ref.getName()) instanceof SemanticTypeDef) {
        // Semantic types can't wrap each other
        diagnostics.add(invalidUnderlying(def, ref.toString()));
      } else {
        diagnostics.add(e);
      }
    }
    if (underlying != null && !underlying.isPrimitive()) {
      diagnostics.add(invalidUnderlying(def, underlying.toString()));
      underlying = null;
    }

    Type t;
    if (underlying == null) {
      failed.add(def);
      t = Types.ERROR;
    } else {
      t = new SemanticType(def.getName(), (Types.PrimitiveType)underlying);
    }
    namedTypes.put(def.getName(), t);
    addDeclaration(Declaration.forType(Declaration.Kind.SEMANTIC_TYPE,
                                       def, t));
  }

  private UserException invalidUnderlying(SemanticTypeDef def,
                                          String typeName) {
    return new UserException(def.getUnderlying().getPosition(),
        DiagnosticKind.INVALID_DEFINITION, "semantic type " + def.getName()
        + " must wrap a primitive type, not " + typeName);
  }

  private void resolveRecord(RecordDef def) {
    RecordType type = (RecordType)namedTypes.get(def.getName());
    LinkedHashMap<String, Type> fields = new LinkedHashMap<String, Type>();
    Map<String, FilePosition> seen = new LinkedHashMap<String, FilePosition>();
    for (TypedName field: def.getFields()) {
      Type fieldType = resolveOrError(def, field.getType());
      if (seen.containsKey(field.getName())) {
        diagnostics.add(DoubleDefineException.duplicate(field.getPosition(),
            "field", field.getName(), seen.get(field.getName())));
        failed.add(def);
        continue;
      }
      seen.put(field.getName(), field.getPosition());
      fields.put(field.getName(), fieldType);
    }
    type.defineFields(fields);
    addDeclaration(Declaration.forType(Declaration.Kind.RECORD, def, type));
  }

  private void resolveSignature(FunctionDef def) {
    List<String> names = new ArrayList<String>();
    List<Type> types = new ArrayList<Type>();
    Set<String> seen = new HashSet<String>();
    for (TypedName param: def.getParams()) {
      Type t = resolveOrError(def, param.getType());
      if (!seen.add(param.getName())) {
        diagnostics.add(DoubleDefineException.duplicate(param.getPosition(),
            "parameter", param.getName(), def.getPosition()));
        failed.add(def);
        continue;
      }
      names.add(param.getName());
      types.add(t);
    }
    Type result = Types.UNIT;
    if (def.getReturnType() != null) {
      result = resolveOrError(def, def.getReturnType());
    }
    FunctionType sig = new FunctionType(names, types, result);
    if (LogHelper.isDebugEnabled()) {
      logger.debug("signature: " + def.getPurity().keyword() + " " +
                   def.getName() + sig);
    }
    if (isFirst(def)) {
      addDeclaration(Declaration.forFunction(def, sig));
    } else {
      allDefinitions.put(def.getName(), Declaration.forFunction(def, sig));
    }
  }

  /**
   * Resolve a type in a definition's header.  On failure the error is
   * reported, the definition marked failed and the error type returned.
   */
  private Type resolveOrError(TopLevelDef def, TypeRef ref) {
    try {
      Type t = TypeChecker.resolveTypeRef(ref, namedTypes);
      if (t.isError()) {
        // Refers to a semantic type that already failed
        failed.add(def);
      }
      return t;
    } catch (UndefinedVarError e) {
      diagnostics.add(e);
      failed.add(def);
      return Types.ERROR;
    }
  }

  private void addDeclaration(Declaration decl) {
    declarations.put(decl.getName(), decl);
    allDefinitions.put(decl.getName(), decl);
  }

  private static String describe(TopLevelDef def) {
    if (def instanceof RecordDef) {
      return "record";
    } else if (def instanceof SemanticTypeDef) {
      return "type";
    }
    return ((FunctionDef)def).getPurity().keyword();
  }
}
