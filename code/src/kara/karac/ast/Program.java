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
 * Root of the syntax tree for one compilation unit
 */
public class Program {
  private final String file;
  private final List<TopLevelDef> definitions;

  public Program(String file, List<TopLevelDef> definitions) {
    this.file = file;
    this.definitions = Collections.unmodifiableList(
                          new ArrayList<TopLevelDef>(definitions));
  }

  public String getFile() {
    return file;
  }

  /**
   * @return definitions in source order
   */
  public List<TopLevelDef> getDefinitions() {
    return definitions;
  }

  public List<TopLevelDef.FunctionDef> getFunctions() {
    List<TopLevelDef.FunctionDef> result =
                    new ArrayList<TopLevelDef.FunctionDef>();
    for (TopLevelDef def: definitions) {
      if (def instanceof TopLevelDef.FunctionDef) {
        result.add((TopLevelDef.FunctionDef)def);
      }
    }
    return result;
  }
}
