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
 * Reference to a type by name, or a tuple of type references.
 * Resolved against the global declarations by name.
 */
public class TypeRef {
  /** Null for tuples */
  private final String name;
  /** Null for named types */
  private final List<TypeRef> elems;
  private final FilePosition position;

  private TypeRef(String name, List<TypeRef> elems, FilePosition position) {
    this.name = name;
    this.elems = elems;
    this.position = position;
  }

  public static TypeRef named(String name, FilePosition position) {
    return new TypeRef(name, null, position);
  }

  public static TypeRef tuple(List<TypeRef> elems, FilePosition position) {
    return new TypeRef(null, Collections.unmodifiableList(
                          new ArrayList<TypeRef>(elems)), position);
  }

  public boolean isTuple() {
    return elems != null;
  }

  public String getName() {
    return name;
  }

  public List<TypeRef> getElems() {
    return elems;
  }

  public FilePosition getPosition() {
    return position;
  }

  @Override
  public String toString() {
    if (isTuple()) {
      return "(" + StringUtils.join(elems, ", ") + ")";
    }
    return name;
  }
}
