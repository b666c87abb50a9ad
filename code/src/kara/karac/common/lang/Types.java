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
package kara.karac.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import kara.karac.common.exceptions.KaracRuntimeError;

/**
 * Class to contain type definitions used by the front end.
 *
 * The base class for all types is Type.  Primitive, semantic and record
 * types are nominal: two of them are equal only if they have the same
 * name.  Tuples are structural.  Untyped literal types and the error
 * type only exist inside bodies.
 */
public class Types {

  public static enum PrimCategory {
    INTEGER,
    FLOAT,
    STRING,
    BOOL;

    public boolean isNumeric() {
      return this == INTEGER || this == FLOAT;
    }
  }

  public static enum PrimType {
    I8("i8", PrimCategory.INTEGER),
    I16("i16", PrimCategory.INTEGER),
    I32("i32", PrimCategory.INTEGER),
    I64("i64", PrimCategory.INTEGER),
    U8("u8", PrimCategory.INTEGER),
    U16("u16", PrimCategory.INTEGER),
    U32("u32", PrimCategory.INTEGER),
    U64("u64", PrimCategory.INTEGER),
    F32("f32", PrimCategory.FLOAT),
    F64("f64", PrimCategory.FLOAT),
    BOOL("bool", PrimCategory.BOOL),
    STRING("string", PrimCategory.STRING);

    private final String typeName;
    private final PrimCategory category;

    private PrimType(String typeName, PrimCategory category) {
      this.typeName = typeName;
      this.category = category;
    }

    public String typeName() {
      return typeName;
    }

    public PrimCategory category() {
      return category;
    }
  }

  public abstract static class Type {

    public abstract String typeName();

    /**
     * @return the primitive this type is or wraps, null if it is
     *         neither primitive nor semantic
     */
    public PrimitiveType underlyingPrim() {
      return null;
    }

    /**
     * @return category of values of this type, null if not a scalar
     */
    public PrimCategory category() {
      PrimitiveType prim = underlyingPrim();
      return prim == null ? null : prim.primType().category();
    }

    public boolean isPrimitive() {
      return false;
    }

    public boolean isSemantic() {
      return false;
    }

    public boolean isError() {
      return false;
    }

    @Override
    public String toString() {
      return typeName();
    }
  }

  public static class PrimitiveType extends Type {
    private final PrimType primType;

    private PrimitiveType(PrimType primType) {
      this.primType = primType;
    }

    public PrimType primType() {
      return primType;
    }

    @Override
    public String typeName() {
      return primType.typeName();
    }

    @Override
    public PrimitiveType underlyingPrim() {
      return this;
    }

    @Override
    public boolean isPrimitive() {
      return true;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PrimitiveType &&
          ((PrimitiveType)other).primType == primType;
    }

    @Override
    public int hashCode() {
      return primType.hashCode();
    }
  }

  /**
   * Nominal wrapper around a primitive.  Distinct from every other type,
   * including its own underlying primitive.
   */
  public static class SemanticType extends Type {
    private final String name;
    private final PrimitiveType baseType;

    public SemanticType(String name, PrimitiveType baseType) {
      super();
      this.name = name;
      this.baseType = baseType;
    }

    public PrimitiveType baseType() {
      return baseType;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public PrimitiveType underlyingPrim() {
      return baseType;
    }

    @Override
    public boolean isSemantic() {
      return true;
    }

    @Override
    public boolean equals(Object other) {
      // Identity is the declared name, never the base type
      return other instanceof SemanticType &&
          ((SemanticType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + 7;
    }
  }

  /**
   * Record type.  Fields are filled in once, by the declaration registry,
   * after every type name is known so that records can refer to
   * each other in any order.
   */
  public static class RecordType extends Type {
    private final String name;
    private Map<String, Type> fields = null;

    public RecordType(String name) {
      this.name = name;
    }

    public void defineFields(LinkedHashMap<String, Type> fieldTypes) {
      if (fields != null) {
        throw new KaracRuntimeError("Fields of record " + name +
                                    " already defined");
      }
      fields = Collections.unmodifiableMap(
                    new LinkedHashMap<String, Type>(fieldTypes));
    }

    /**
     * @return field type, or null if no such field
     */
    public Type fieldType(String fieldName) {
      checkDefined();
      return fields.get(fieldName);
    }

    /**
     * @return field names in declaration order
     */
    public List<String> fieldNames() {
      checkDefined();
      return new ArrayList<String>(fields.keySet());
    }

    private void checkDefined() {
      if (fields == null) {
        throw new KaracRuntimeError("Fields of record " + name +
                                    " not yet defined");
      }
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof RecordType &&
          ((RecordType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + 11;
    }
  }

  public static class TupleType extends Type {
    private final List<Type> elems;

    public TupleType(List<Type> elems) {
      this.elems = Collections.unmodifiableList(new ArrayList<Type>(elems));
    }

    public List<Type> elems() {
      return elems;
    }

    public int size() {
      return elems.size();
    }

    public boolean isUnit() {
      return elems.isEmpty();
    }

    @Override
    public String typeName() {
      return "(" + StringUtils.join(elems, ", ") + ")";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof TupleType &&
          ((TupleType)other).elems.equals(elems);
    }

    @Override
    public int hashCode() {
      return elems.hashCode();
    }
  }

  /**
   * Type of a numeric literal that hasn't met a boundary yet
   */
  public static class UntypedLiteralType extends Type {
    private final PrimCategory category;

    private UntypedLiteralType(PrimCategory category) {
      this.category = category;
    }

    @Override
    public PrimCategory category() {
      return category;
    }

    @Override
    public String typeName() {
      return category == PrimCategory.FLOAT ? "{float}" : "{integer}";
    }
  }

  /**
   * Assigned to anything that failed to resolve, so that a single error
   * doesn't cascade.
   */
  public static class ErrorType extends Type {
    private ErrorType() {
    }

    @Override
    public String typeName() {
      return "<error>";
    }

    @Override
    public boolean isError() {
      return true;
    }
  }

  /**
   * Signature of a function, flow or built-in.  Parameters are named so
   * pipelines can bind them by name.
   */
  public static class FunctionType {
    private final List<String> paramNames;
    private final List<Type> paramTypes;
    private final Type resultType;

    public FunctionType(List<String> paramNames, List<Type> paramTypes,
                        Type resultType) {
      assert(paramNames.size() == paramTypes.size());
      this.paramNames = Collections.unmodifiableList(
                                new ArrayList<String>(paramNames));
      this.paramTypes = Collections.unmodifiableList(
                                new ArrayList<Type>(paramTypes));
      this.resultType = resultType;
    }

    public List<String> getParamNames() {
      return paramNames;
    }

    public List<Type> getParamTypes() {
      return paramTypes;
    }

    public int paramCount() {
      return paramTypes.size();
    }

    /**
     * @return index of named parameter, or -1
     */
    public int paramIndex(String name) {
      return paramNames.indexOf(name);
    }

    public Type getResultType() {
      return resultType;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(");
      for (int i = 0; i < paramTypes.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(paramNames.get(i)).append(": ").append(paramTypes.get(i));
      }
      sb.append(") -> ").append(resultType);
      return sb.toString();
    }
  }

  public static final PrimitiveType I8 = new PrimitiveType(PrimType.I8);
  public static final PrimitiveType I16 = new PrimitiveType(PrimType.I16);
  public static final PrimitiveType I32 = new PrimitiveType(PrimType.I32);
  public static final PrimitiveType I64 = new PrimitiveType(PrimType.I64);
  public static final PrimitiveType U8 = new PrimitiveType(PrimType.U8);
  public static final PrimitiveType U16 = new PrimitiveType(PrimType.U16);
  public static final PrimitiveType U32 = new PrimitiveType(PrimType.U32);
  public static final PrimitiveType U64 = new PrimitiveType(PrimType.U64);
  public static final PrimitiveType F32 = new PrimitiveType(PrimType.F32);
  public static final PrimitiveType F64 = new PrimitiveType(PrimType.F64);
  public static final PrimitiveType BOOL = new PrimitiveType(PrimType.BOOL);
  public static final PrimitiveType STRING =
                                    new PrimitiveType(PrimType.STRING);

  public static final TupleType UNIT =
                      new TupleType(Collections.<Type>emptyList());

  public static final UntypedLiteralType INT_LITERAL =
                      new UntypedLiteralType(PrimCategory.INTEGER);
  public static final UntypedLiteralType FLOAT_LITERAL =
                      new UntypedLiteralType(PrimCategory.FLOAT);

  public static final ErrorType ERROR = new ErrorType();

  private static final Map<String, PrimitiveType> builtInTypes =
                                new HashMap<String, PrimitiveType>();

  static {
    for (PrimitiveType t: new PrimitiveType[] {I8, I16, I32, I64, U8, U16,
                              U32, U64, F32, F64, BOOL, STRING}) {
      builtInTypes.put(t.typeName(), t);
    }
  }

  /**
   * @return primitive with this name, or null
   */
  public static PrimitiveType lookupPrimitive(String name) {
    return builtInTypes.get(name);
  }

  public static boolean isUnit(Type t) {
    return t instanceof TupleType && ((TupleType)t).isUnit();
  }

  public static boolean isNumeric(Type t) {
    PrimCategory cat = t.category();
    return cat != null && cat.isNumeric();
  }

  public static boolean isBool(Type t) {
    return t.category() == PrimCategory.BOOL;
  }
}
