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

/**
 * Braced sequence of statements.  Only the body block of a definition
 * can end with a result expression.
 */
public class Block {
  private final List<Stmt> statements;
  private final Expr result;
  private final FilePosition position;

  public Block(List<Stmt> statements, Expr result, FilePosition position) {
    this.statements = Collections.unmodifiableList(
                                      new ArrayList<Stmt>(statements));
    this.result = result;
    this.position = position;
  }

  public List<Stmt> getStatements() {
    return statements;
  }

  /**
   * @return trailing expression, or null if none
   */
  public Expr getResult() {
    return result;
  }

  public boolean hasResult() {
    return result != null;
  }

  public FilePosition getPosition() {
    return position;
  }
}
