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
import kara.karac.common.lang.Types.Type;

/**
 * A local name bound inside a body.  Bindings are immutable: each name
 * is bound at most once per scope.
 */
public class Binding {
  public static enum Kind {
    PARAMETER,
    LET,
    /** Bound by a pipeline call's destination */
    DESTINATION,
  }

  private final String name;
  private final Type type;
  private final Kind kind;
  private final FilePosition position;

  public Binding(String name, Type type, Kind kind, FilePosition position) {
    this.name = name;
    this.type = type;
    this.kind = kind;
    this.position = position;
  }

  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  public Kind getKind() {
    return kind;
  }

  public FilePosition getPosition() {
    return position;
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }
}
