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
package kara.karac.common.diagnostics;

/**
 * Every kind of problem the front end can report.  Kinds are grouped
 * into categories that match the stage that finds them.
 */
public enum DiagnosticKind {
  INVALID_BYTE(Category.LEXICAL, "InvalidByte"),
  UNTERMINATED_STRING(Category.LEXICAL, "UnterminatedString"),
  INVALID_ENCODING(Category.LEXICAL, "InvalidEncoding"),
  INTEGER_OVERFLOW(Category.LEXICAL, "IntegerOverflow"),

  UNEXPECTED_TOKEN(Category.SYNTAX, "UnexpectedToken"),
  MALFORMED_PIPELINE(Category.SYNTAX, "MalformedPipeline"),

  UNDEFINED_NAME(Category.NAME, "UndefinedName"),
  DUPLICATE_DEFINITION(Category.NAME, "DuplicateDefinition"),
  IMMUTABLE_REBINDING(Category.NAME, "ImmutableRebinding"),

  INVALID_DEFINITION(Category.DEFINITION, "InvalidDefinition"),

  BOUNDARY_TYPE_MISMATCH(Category.TYPE, "BoundaryTypeMismatch"),
  INVALID_OPERAND(Category.TYPE, "InvalidOperand"),

  PURITY_VIOLATION(Category.PURITY, "PurityViolation"),

  FORWARD_REFERENCE(Category.DATAFLOW, "ForwardReference"),

  UNUSED_BINDING(Category.WARNING, "UnusedBinding");

  public static enum Category {
    LEXICAL("LexicalError"),
    SYNTAX("SyntaxError"),
    NAME("NameError"),
    DEFINITION("DefinitionError"),
    TYPE("TypeError"),
    PURITY("PurityError"),
    DATAFLOW("DataflowError"),
    WARNING("Warning");

    private final String displayName;

    private Category(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }
  }

  private final Category category;
  private final String displayName;

  private DiagnosticKind(Category category, String displayName) {
    this.category = category;
    this.displayName = displayName;
  }

  public Category category() {
    return category;
  }

  public String displayName() {
    return displayName;
  }

  public Severity defaultSeverity() {
    return category == Category.WARNING ? Severity.WARNING : Severity.ERROR;
  }

  /**
   * Lexical problems after which the rest of the file can't be trusted
   */
  public boolean isFatal() {
    return this == UNTERMINATED_STRING || this == INVALID_ENCODING;
  }
}
