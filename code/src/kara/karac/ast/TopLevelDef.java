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

import kara.karac.common.lang.Purity;

public abstract class TopLevelDef {

  public interface Visitor<T, X extends Exception> {
    T visitRecordDef(RecordDef d) throws X;
    T visitSemanticTypeDef(SemanticTypeDef d) throws X;
    T visitFunctionDef(FunctionDef d) throws X;
  }

  private final String name;
  private final FilePosition position;

  protected TopLevelDef(String name, FilePosition position) {
    this.name = name;
    this.position = position;
  }

  public String getName() {
    return name;
  }

  public FilePosition getPosition() {
    return position;
  }

  public abstract <T, X extends Exception> T accept(Visitor<T, X> v)
                                                            throws X;

  public static class RecordDef extends TopLevelDef {
    private final List<TypedName> fields;

    public RecordDef(String name, List<TypedName> fields,
                     FilePosition position) {
      super(name, position);
      this.fields = Collections.unmodifiableList(
                                new ArrayList<TypedName>(fields));
    }

    public List<TypedName> getFields() {
      return fields;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitRecordDef(this);
    }

    @Override
    public String toString() {
      return "record " + getName() + " { " +
             StringUtils.join(fields, ", ") + " }";
    }
  }

  /**
   * type UserId i64;
   */
  public static class SemanticTypeDef extends TopLevelDef {
    private final TypeRef underlying;

    public SemanticTypeDef(String name, TypeRef underlying,
                           FilePosition position) {
      super(name, position);
      this.underlying = underlying;
    }

    public TypeRef getUnderlying() {
      return underlying;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitSemanticTypeDef(this);
    }

    @Override
    public String toString() {
      return "type " + getName() + " " + underlying + ";";
    }
  }

  /**
   * fn (pure) or flow (impure)
   */
  public static class FunctionDef extends TopLevelDef {
    private final Purity purity;
    private final List<TypedName> params;
    private final TypeRef returnType;
    private final Block body;

    public FunctionDef(String name, Purity purity, List<TypedName> params,
                       TypeRef returnType, Block body,
                       FilePosition position) {
      super(name, position);
      this.purity = purity;
      this.params = Collections.unmodifiableList(
                                new ArrayList<TypedName>(params));
      this.returnType = returnType;
      this.body = body;
    }

    public Purity getPurity() {
      return purity;
    }

    public boolean isFlow() {
      return purity == Purity.IMPURE;
    }

    public List<TypedName> getParams() {
      return params;
    }

    /**
     * @return declared return type, or null if none declared
     */
    public TypeRef getReturnType() {
      return returnType;
    }

    public Block getBody() {
      return body;
    }

    @Override
    public <T, X extends Exception> T accept(Visitor<T, X> v) throws X {
      return v.visitFunctionDef(this);
    }

    @Override
    public String toString() {
      return purity.keyword() + " " + getName() + "(" +
             StringUtils.join(params, ", ") + ")" +
             (returnType == null ? "" : " -> " + returnType);
    }
  }
}
