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

/**
 * A name with a declared type: a parameter or record field.
 */
public class TypedName {
  private final String name;
  private final TypeRef type;
  private final FilePosition position;

  public TypedName(String name, TypeRef type, FilePosition position) {
    this.name = name;
    this.type = type;
    this.position = position;
  }

  public String getName() {
    return name;
  }

  public TypeRef getType() {
    return type;
  }

  public FilePosition getPosition() {
    return position;
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }
}
