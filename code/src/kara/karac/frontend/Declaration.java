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

import kara.karac.ast.FilePosition;
import kara.karac.ast.TopLevelDef;
import kara.karac.common.lang.Purity;
import kara.karac.common.lang.Types.FunctionType;
import kara.karac.common.lang.Types.Type;

/**
 * A top level name: record, semantic type, user function or built-in.
 * Immutable once the registry is frozen.
 */
public class Declaration {
  public static enum Kind {
    RECORD("record"),
    SEMANTIC_TYPE("type"),
    FUNCTION("function"),
    BUILTIN("built-in function");

    private final String description;

    private Kind(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final String name;
  private final Kind kind;
  /** Null for built-ins */
  private final TopLevelDef def;
  /** Set for records and semantic types */
  private final Type type;
  /** Set for functions and built-ins */
  private final FunctionType signature;
  /** Declared purity, null for types */
  private final Purity purity;
  private final FilePosition position;

  private Declaration(String name, Kind kind, TopLevelDef def, Type type,
            FunctionType signature, Purity purity, FilePosition position) {
    this.name = name;
    this.kind = kind;
    this.def = def;
    this.type = type;
    this.signature = signature;
    this.purity = purity;
    this.position = position;
  }

  public static Declaration forType(Kind kind, TopLevelDef def, Type type) {
    assert(kind == Kind.RECORD || kind == Kind.SEMANTIC_TYPE);
    return new Declaration(def.getName(), kind, def, type, null, null,
                           def.getPosition());
  }

  public static Declaration forFunction(TopLevelDef.FunctionDef def,
                                        FunctionType signature) {
    return new Declaration(def.getName(), Kind.FUNCTION, def, null,
                      signature, def.getPurity(), def.getPosition());
  }

  public static Declaration forBuiltin(String name, FunctionType signature,
                                       FilePosition position) {
    return new Declaration(name, Kind.BUILTIN, null, null, signature,
                           Purity.IMPURE, position);
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public TopLevelDef getDef() {
    return def;
  }

  public Type getType() {
    return type;
  }

  public FunctionType getSignature() {
    return signature;
  }

  public Purity getPurity() {
    return purity;
  }

  public FilePosition getPosition() {
    return position;
  }

  public boolean isCallable() {
    return kind == Kind.FUNCTION || kind == Kind.BUILTIN;
  }

  public boolean isType() {
    return kind == Kind.RECORD || kind == Kind.SEMANTIC_TYPE;
  }

  @Override
  public String toString() {
    return kind.description() + " " + name;
  }
}
