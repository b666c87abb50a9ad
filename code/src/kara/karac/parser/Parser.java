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
package kara.karac.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import kara.karac.ast.Block;
import kara.karac.ast.Expr;
import kara.karac.ast.Expr.LiteralKind;
import kara.karac.ast.FilePosition;
import kara.karac.ast.Operator;
import kara.karac.ast.Program;
import kara.karac.ast.Stmt;
import kara.karac.ast.Stmt.ArgBinding;
import kara.karac.ast.Stmt.Destination;
import kara.karac.ast.Stmt.OutBinding;
import kara.karac.ast.Stmt.PipelineCall;
import kara.karac.ast.TopLevelDef;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.ast.TypeRef;
import kara.karac.ast.TypedName;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.InvalidSyntaxException;
import kara.karac.common.lang.Purity;

/**
 * Recursive descent parser producing the AST for one source file.
 *
 * Syntax errors are thrown as InvalidSyntaxException from the point of
 * failure and caught at the enclosing statement or definition, which
 * records the error and resynchronizes, so that every independent error
 * in the file is reported.
 */
public class Parser {
  private static final Logger logger = Logging.getKaracLogger();

  /** Contextual words of the verbose call form */
  private static final String ACTION = "Action";
  private static final String FROM = "From";
  private static final String TO = "To";

  private final String file;
  private final List<Token> tokens;
  private final Diagnostics diagnostics = new Diagnostics();
  private int pos = 0;

  /** Definitions parsed in spite of syntax errors in their bodies */
  private final Set<TopLevelDef> malformed =
      Collections.newSetFromMap(new IdentityHashMap<TopLevelDef, Boolean>());

  /** Set while parsing an if condition, where '{' opens the block */
  private boolean noRecordLiteral = false;

  public Parser(String file, List<Token> input) {
    this.file = file;
    // Error tokens were already reported by the lexer
    this.tokens = new ArrayList<Token>(input.size());
    for (Token t: input) {
      if (!t.is(TokenKind.ERROR)) {
        tokens.add(t);
      }
    }
    if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
      FilePosition end = tokens.isEmpty() ? new FilePosition(file, 1, 1, 0) :
                          tokens.get(tokens.size() - 1).position();
      tokens.add(new Token(TokenKind.EOF, "", null, end));
    }
  }

  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  /**
   * @return definitions in the program whose bodies had syntax errors
   *         recovered from.  Their names are declared but their bodies
   *         must not be checked.
   */
  public Set<TopLevelDef> getMalformedDefinitions() {
    return Collections.unmodifiableSet(malformed);
  }

  public Program parseProgram() {
    List<TopLevelDef> defs = new ArrayList<TopLevelDef>();
    while (!check(TokenKind.EOF)) {
      try {
        defs.add(topLevelDef());
      } catch (InvalidSyntaxException e) {
        diagnostics.add(e);
        logger.debug("syntax error: " + e.getMessage());
        synchronizeTopLevel();
      }
    }
    logger.debug("parser: " + file + ": " + defs.size() + " definitions, " +
                 diagnostics.size() + " errors");
    return new Program(file, defs);
  }

  /* ---- top level ---- */

  private TopLevelDef topLevelDef() throws InvalidSyntaxException {
    Token t = peek();
    switch (t.kind()) {
      case RECORD:
        return recordDef();
      case TYPE:
        return semanticTypeDef();
      case FN:
        return functionDef(Purity.PURE);
      case FLOW:
        return functionDef(Purity.IMPURE);
      default:
        throw InvalidSyntaxException.expected(t.position(),
            "'record', 'type', 'fn' or 'flow'", t.describe());
    }
  }

  private TopLevelDef recordDef() throws InvalidSyntaxException {
    Token kw = consume(TokenKind.RECORD);
    Token name = consume(TokenKind.IDENTIFIER);
    consume(TokenKind.LEFT_BRACE);
    List<TypedName> fields = new ArrayList<TypedName>();
    while (!check(TokenKind.RIGHT_BRACE)) {
      fields.add(typedName());
      if (!match(TokenKind.COMMA)) {
        break;
      }
    }
    consume(TokenKind.RIGHT_BRACE);
    if (logger.isTraceEnabled()) {
      logger.trace("parsed record " + name.lexeme());
    }
    return new TopLevelDef.RecordDef(name.lexeme(), fields, kw.position());
  }

  private TopLevelDef semanticTypeDef() throws InvalidSyntaxException {
    Token kw = consume(TokenKind.TYPE);
    Token name = consume(TokenKind.IDENTIFIER);
    TypeRef underlying = typeRef();
    consume(TokenKind.SEMICOLON);
    return new TopLevelDef.SemanticTypeDef(name.lexeme(), underlying,
                                           kw.position());
  }

  private FunctionDef functionDef(Purity purity)
      throws InvalidSyntaxException {
    Token kw = advance();
    Token name = consume(TokenKind.IDENTIFIER);
    List<TypedName> params = new ArrayList<TypedName>();
    // Parameter list is optional for flows only
    if (purity == Purity.PURE || check(TokenKind.LEFT_PAREN)) {
      consume(TokenKind.LEFT_PAREN);
      if (!check(TokenKind.RIGHT_PAREN)) {
        do {
          params.add(typedName());
        } while (match(TokenKind.COMMA));
      }
      consume(TokenKind.RIGHT_PAREN);
    }
    TypeRef returnType = null;
    if (match(TokenKind.ARROW)) {
      returnType = typeRef();
    }
    int errorsBefore = diagnostics.size();
    Block body = block(true);
    boolean bodyHadErrors = diagnostics.size() > errorsBefore;
    if (logger.isTraceEnabled()) {
      logger.trace("parsed " + purity.keyword() + " " + name.lexeme() +
                   ": " + body.getStatements().size() + " statements");
    }
    FunctionDef def = new FunctionDef(name.lexeme(), purity, params,
                                      returnType, body, kw.position());
    if (bodyHadErrors) {
      malformed.add(def);
    }
    return def;
  }

  private TypedName typedName() throws InvalidSyntaxException {
    Token name = consume(TokenKind.IDENTIFIER);
    consume(TokenKind.COLON);
    return new TypedName(name.lexeme(), typeRef(), name.position());
  }

  private TypeRef typeRef() throws InvalidSyntaxException {
    Token t = peek();
    if (t.is(TokenKind.IDENTIFIER)) {
      advance();
      return TypeRef.named(t.lexeme(), t.position());
    } else if (t.is(TokenKind.LEFT_PAREN)) {
      advance();
      List<TypeRef> elems = new ArrayList<TypeRef>();
      if (!check(TokenKind.RIGHT_PAREN)) {
        do {
          elems.add(typeRef());
        } while (match(TokenKind.COMMA));
      }
      consume(TokenKind.RIGHT_PAREN);
      return TypeRef.tuple(elems, t.position());
    }
    throw InvalidSyntaxException.expected(t.position(), "type",
                                          t.describe());
  }

  /* ---- blocks and statements ---- */

  /**
   * @param isBody true for the body of a definition, the only block
   *               that may end with a result expression
   */
  private Block block(boolean isBody) throws InvalidSyntaxException {
    Token open = consume(TokenKind.LEFT_BRACE);
    List<Stmt> stmts = new ArrayList<Stmt>();
    Expr result = null;
    while (!check(TokenKind.RIGHT_BRACE) && !check(TokenKind.EOF) &&
           !atTopLevelKeyword()) {
      try {
        Object item = statement(isBody);
        if (item instanceof Stmt) {
          stmts.add((Stmt)item);
        } else {
          result = (Expr)item;
        }
      } catch (InvalidSyntaxException e) {
        diagnostics.add(e);
        logger.debug("syntax error: " + e.getMessage());
        synchronize();
      }
    }
    // Missing '}' before a new definition escapes to the top level
    consume(TokenKind.RIGHT_BRACE);
    return new Block(stmts, result, open.position());
  }

  /**
   * @return a Stmt, or an Expr if a trailing body expression was found
   */
  private Object statement(boolean isBody) throws InvalidSyntaxException {
    Token t = peek();
    if (t.is(TokenKind.LET)) {
      return letBinding();
    } else if (t.is(TokenKind.IF)) {
      return conditional();
    } else if (isContextual(t, ACTION) && peekAt(1).is(TokenKind.COLON)) {
      return verboseCall();
    } else if (isPipelineStart()) {
      return pipeline();
    }

    Expr e = expression();
    if (match(TokenKind.SEMICOLON)) {
      return new Stmt.ExprStatement(e, t.position());
    } else if (isBody && check(TokenKind.RIGHT_BRACE)) {
      return e;
    }
    Token next = peek();
    throw InvalidSyntaxException.expected(next.position(), "';'",
                                          next.describe());
  }

  private Stmt letBinding() throws InvalidSyntaxException {
    Token kw = consume(TokenKind.LET);
    Token name = consume(TokenKind.IDENTIFIER);
    consume(TokenKind.EQUAL);
    Expr value = expression();
    consume(TokenKind.SEMICOLON);
    return new Stmt.LetBinding(name.lexeme(), value, kw.position());
  }

  private Stmt conditional() throws InvalidSyntaxException {
    Token kw = consume(TokenKind.IF);
    boolean saved = noRecordLiteral;
    noRecordLiteral = true;
    Expr cond;
    try {
      cond = expression();
    } finally {
      noRecordLiteral = saved;
    }
    Block thenBlock = block(false);
    Block elseBlock = null;
    if (check(TokenKind.ELSE)) {
      advance();
      if (check(TokenKind.IF)) {
        Token elseIf = peek();
        Stmt nested = conditional();
        elseBlock = new Block(Collections.singletonList(nested),
                              null, elseIf.position());
      } else {
        elseBlock = block(false);
      }
    }
    return new Stmt.Conditional(cond, thenBlock, elseBlock, kw.position());
  }

  /**
   * Does the statement at the current position have the form
   * endpoint '->' ... ?  An endpoint is a name or a parenthesized list.
   */
  private boolean isPipelineStart() {
    Token t = peek();
    if (t.is(TokenKind.IDENTIFIER)) {
      return peekAt(1).is(TokenKind.ARROW);
    } else if (t.is(TokenKind.LEFT_PAREN)) {
      int depth = 0;
      for (int i = pos; i < tokens.size(); i++) {
        TokenKind k = tokens.get(i).kind();
        if (k == TokenKind.LEFT_PAREN) {
          depth++;
        } else if (k == TokenKind.RIGHT_PAREN) {
          depth--;
          if (depth == 0) {
            return i + 1 < tokens.size() &&
                   tokens.get(i + 1).is(TokenKind.ARROW);
          }
        } else if (k == TokenKind.SEMICOLON || k == TokenKind.LEFT_BRACE ||
                   k == TokenKind.RIGHT_BRACE || k == TokenKind.EOF) {
          return false;
        }
      }
    }
    return false;
  }

  /**
   * source -> Callee -> destination ;
   */
  private Stmt pipeline() throws InvalidSyntaxException {
    Token start = peek();
    List<ArgBinding> inputs = new ArrayList<ArgBinding>();
    if (start.is(TokenKind.IDENTIFIER)) {
      advance();
      inputs.add(new ArgBinding(null,
          new Expr.Identifier(start.lexeme(), start.position()),
          start.position()));
    } else {
      consume(TokenKind.LEFT_PAREN);
      if (!check(TokenKind.RIGHT_PAREN)) {
        do {
          inputs.add(sourceBinding());
        } while (match(TokenKind.COMMA));
      }
      consume(TokenKind.RIGHT_PAREN);
    }
    consume(TokenKind.ARROW);
    Token callee = peek();
    if (!callee.is(TokenKind.IDENTIFIER)) {
      throw malformed(callee, "function or flow name");
    }
    advance();
    if (!check(TokenKind.ARROW)) {
      throw malformed(peek(), "'->' and a destination");
    }
    advance();
    Destination dest = denseDestination();
    if (!check(TokenKind.SEMICOLON)) {
      Token t = peek();
      if (t.is(TokenKind.ARROW)) {
        throw malformed(t, "';': a pipeline calls exactly one function");
      }
      throw InvalidSyntaxException.expected(t.position(), "';'",
                                            t.describe());
    }
    advance();
    return new PipelineCall(callee.lexeme(), callee.position(), inputs,
                            dest, PipelineCall.Form.DENSE, start.position());
  }

  /**
   * name [: value].  A bare name passes the local of the same name.
   */
  private ArgBinding sourceBinding() throws InvalidSyntaxException {
    Token name = peek();
    if (!name.is(TokenKind.IDENTIFIER)) {
      throw malformed(name, "parameter name");
    }
    advance();
    Expr value;
    if (match(TokenKind.COLON)) {
      value = expression();
    } else {
      value = new Expr.Identifier(name.lexeme(), name.position());
    }
    return new ArgBinding(name.lexeme(), value, name.position());
  }

  private Destination denseDestination() throws InvalidSyntaxException {
    Token t = peek();
    if (t.is(TokenKind.IDENTIFIER)) {
      advance();
      return Destination.whole(t.lexeme(), t.position());
    } else if (!t.is(TokenKind.LEFT_PAREN)) {
      throw malformed(t, "destination name or '('");
    }
    advance();
    if (match(TokenKind.RIGHT_PAREN)) {
      return Destination.none();
    }
    List<OutBinding> outs = new ArrayList<OutBinding>();
    do {
      Token first = peek();
      if (!first.is(TokenKind.IDENTIFIER)) {
        throw malformed(first, "name in destination");
      }
      advance();
      if (match(TokenKind.COLON)) {
        Token local = peek();
        if (!local.is(TokenKind.IDENTIFIER)) {
          throw malformed(local, "local name after ':' in destination");
        }
        advance();
        outs.add(new OutBinding(first.lexeme(), local.lexeme(),
                                local.position()));
      } else {
        outs.add(new OutBinding(null, first.lexeme(), first.position()));
      }
    } while (match(TokenKind.COMMA));
    consume(TokenKind.RIGHT_PAREN);
    return Destination.destructure(outs);
  }

  /**
   * Action: Callee [From: p = e, ...] [To: out [= local], ...] ;
   */
  private Stmt verboseCall() throws InvalidSyntaxException {
    Token start = advance();
    consume(TokenKind.COLON);
    Token callee = peek();
    if (!callee.is(TokenKind.IDENTIFIER)) {
      throw malformed(callee, "function or flow name after 'Action:'");
    }
    advance();

    List<ArgBinding> inputs = new ArrayList<ArgBinding>();
    if (isContextual(peek(), FROM) && peekAt(1).is(TokenKind.COLON)) {
      advance();
      advance();
      do {
        Token param = peek();
        if (!param.is(TokenKind.IDENTIFIER)) {
          throw malformed(param, "parameter name after 'From:'");
        }
        advance();
        if (!check(TokenKind.EQUAL)) {
          throw malformed(peek(), "'=' after parameter " + param.lexeme());
        }
        advance();
        inputs.add(new ArgBinding(param.lexeme(), expression(),
                                  param.position()));
      } while (match(TokenKind.COMMA));
    }

    Destination dest = Destination.none();
    if (isContextual(peek(), TO) && peekAt(1).is(TokenKind.COLON)) {
      advance();
      advance();
      List<OutBinding> outs = new ArrayList<OutBinding>();
      do {
        Token out = peek();
        if (!out.is(TokenKind.IDENTIFIER)) {
          throw malformed(out, "output name after 'To:'");
        }
        advance();
        if (match(TokenKind.EQUAL)) {
          Token local = peek();
          if (!local.is(TokenKind.IDENTIFIER)) {
            throw malformed(local, "local name after '='");
          }
          advance();
          outs.add(new OutBinding(out.lexeme(), local.lexeme(),
                                  local.position()));
        } else {
          outs.add(new OutBinding(null, out.lexeme(), out.position()));
        }
      } while (match(TokenKind.COMMA));
      if (outs.size() == 1 && outs.get(0).getOutputName() == null) {
        dest = Destination.whole(outs.get(0).getBindName(),
                                 outs.get(0).getPosition());
      } else {
        dest = Destination.destructure(outs);
      }
    }
    consume(TokenKind.SEMICOLON);
    return new PipelineCall(callee.lexeme(), callee.position(), inputs,
                            dest, PipelineCall.Form.VERBOSE,
                            start.position());
  }

  private InvalidSyntaxException malformed(Token found, String expected) {
    return new InvalidSyntaxException(found.position(),
        DiagnosticKind.MALFORMED_PIPELINE,
        "malformed pipeline: expected " + expected + ", found " +
        found.describe());
  }

  /* ---- expressions ---- */

  private Expr expression() throws InvalidSyntaxException {
    return binary(1);
  }

  /**
   * Precedence climbing over the binary operator levels.  All levels
   * are left associative.
   */
  private Expr binary(int minPrec) throws InvalidSyntaxException {
    Expr left = unary();
    while (true) {
      Operator op = binaryOperator(peek().kind());
      if (op == null || op.precedence() < minPrec) {
        return left;
      }
      advance();
      Expr right = binary(op.precedence() + 1);
      left = new Expr.BinaryOp(op, left, right, left.getPosition());
    }
  }

  private static Operator binaryOperator(TokenKind kind) {
    switch (kind) {
      case EQUAL_EQUAL: return Operator.EQ;
      case BANG_EQUAL: return Operator.NEQ;
      case LESS: return Operator.LT;
      case LESS_EQUAL: return Operator.LTE;
      case GREATER: return Operator.GT;
      case GREATER_EQUAL: return Operator.GTE;
      case PLUS: return Operator.PLUS;
      case MINUS: return Operator.MINUS;
      case STAR: return Operator.MULT;
      case SLASH: return Operator.DIV;
      default: return null;
    }
  }

  private Expr unary() throws InvalidSyntaxException {
    Token t = peek();
    if (t.is(TokenKind.BANG)) {
      advance();
      return new Expr.UnaryOp(Operator.NOT, unary(), t.position());
    } else if (t.is(TokenKind.MINUS)) {
      advance();
      return new Expr.UnaryOp(Operator.NEGATE, unary(), t.position());
    }
    return postfix();
  }

  private Expr postfix() throws InvalidSyntaxException {
    Expr e = primary();
    while (check(TokenKind.DOT)) {
      advance();
      Token field = peek();
      if (field.is(TokenKind.IDENTIFIER) || field.is(TokenKind.INTEGER)) {
        advance();
        e = new Expr.FieldAccess(e, field.lexeme(), field.position());
      } else if (field.is(TokenKind.FLOAT)) {
        // t.0.1 lexes the indices as one float
        advance();
        for (String index: field.lexeme().split("\\.")) {
          e = new Expr.FieldAccess(e, index, field.position());
        }
      } else {
        throw InvalidSyntaxException.expected(field.position(),
                                  "field name or index", field.describe());
      }
    }
    while (check(TokenKind.AS)) {
      Token as = advance();
      e = new Expr.Conversion(e, typeRef(), as.position());
    }
    return e;
  }

  private Expr primary() throws InvalidSyntaxException {
    Token t = peek();
    switch (t.kind()) {
      case INTEGER:
        advance();
        return new Expr.Literal(LiteralKind.INTEGER, t.value(), t.position());
      case FLOAT:
        advance();
        return new Expr.Literal(LiteralKind.FLOAT, t.value(), t.position());
      case STRING:
        advance();
        return new Expr.Literal(LiteralKind.STRING, t.value(), t.position());
      case TRUE:
      case FALSE:
        advance();
        return new Expr.Literal(LiteralKind.BOOL, t.is(TokenKind.TRUE),
                                t.position());
      case IDENTIFIER:
        advance();
        if (check(TokenKind.LEFT_PAREN)) {
          return call(t);
        } else if (check(TokenKind.LEFT_BRACE) && !noRecordLiteral) {
          return recordLiteral(t);
        }
        return new Expr.Identifier(t.lexeme(), t.position());
      case LEFT_PAREN:
        return parenthesized();
      default:
        throw InvalidSyntaxException.expected(t.position(), "expression",
                                              t.describe());
    }
  }

  private Expr call(Token callee) throws InvalidSyntaxException {
    consume(TokenKind.LEFT_PAREN);
    boolean saved = noRecordLiteral;
    noRecordLiteral = false;
    List<Expr> args = new ArrayList<Expr>();
    try {
      if (!check(TokenKind.RIGHT_PAREN)) {
        do {
          args.add(expression());
        } while (match(TokenKind.COMMA));
      }
    } finally {
      noRecordLiteral = saved;
    }
    consume(TokenKind.RIGHT_PAREN);
    return new Expr.Call(callee.lexeme(), args, callee.position());
  }

  private Expr recordLiteral(Token typeName) throws InvalidSyntaxException {
    consume(TokenKind.LEFT_BRACE);
    List<Expr.FieldInit> fields = new ArrayList<Expr.FieldInit>();
    while (!check(TokenKind.RIGHT_BRACE)) {
      Token field = consume(TokenKind.IDENTIFIER);
      consume(TokenKind.COLON);
      fields.add(new Expr.FieldInit(field.lexeme(), expression(),
                                    field.position()));
      if (!match(TokenKind.COMMA)) {
        break;
      }
    }
    consume(TokenKind.RIGHT_BRACE);
    return new Expr.RecordLiteral(typeName.lexeme(), fields,
                                  typeName.position());
  }

  /**
   * (), (e) or (e1, e2, ...)
   */
  private Expr parenthesized() throws InvalidSyntaxException {
    Token open = consume(TokenKind.LEFT_PAREN);
    if (match(TokenKind.RIGHT_PAREN)) {
      return new Expr.TupleLiteral(new ArrayList<Expr>(), open.position());
    }
    boolean saved = noRecordLiteral;
    noRecordLiteral = false;
    List<Expr> elems = new ArrayList<Expr>();
    try {
      do {
        elems.add(expression());
      } while (match(TokenKind.COMMA));
    } finally {
      noRecordLiteral = saved;
    }
    consume(TokenKind.RIGHT_PAREN);
    if (elems.size() == 1) {
      return elems.get(0);
    }
    return new Expr.TupleLiteral(elems, open.position());
  }

  /* ---- error recovery ---- */

  /**
   * Skip to the end of the current statement: past the next ';' or up
   * to the '}' closing the current block.  Nested braces are skipped
   * whole.
   */
  private void synchronize() {
    int depth = 0;
    while (!check(TokenKind.EOF)) {
      Token t = peek();
      if (t.is(TokenKind.LEFT_BRACE)) {
        depth++;
      } else if (t.is(TokenKind.RIGHT_BRACE)) {
        if (depth == 0) {
          return;
        }
        depth--;
      } else if (t.is(TokenKind.SEMICOLON) && depth == 0) {
        advance();
        return;
      } else if (depth == 0 && atTopLevelKeyword()) {
        return;
      }
      advance();
    }
  }

  private void synchronizeTopLevel() {
    while (!check(TokenKind.EOF) && !atTopLevelKeyword()) {
      advance();
    }
  }

  private boolean atTopLevelKeyword() {
    switch (peek().kind()) {
      case RECORD:
      case TYPE:
      case FN:
      case FLOW:
        return true;
      default:
        return false;
    }
  }

  /* ---- token access ---- */

  private Token peek() {
    return tokens.get(pos);
  }

  private Token peekAt(int ahead) {
    int i = Math.min(pos + ahead, tokens.size() - 1);
    return tokens.get(i);
  }

  private Token advance() {
    Token t = tokens.get(pos);
    if (!t.is(TokenKind.EOF)) {
      pos++;
    }
    return t;
  }

  private boolean check(TokenKind kind) {
    return peek().is(kind);
  }

  private boolean match(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private Token consume(TokenKind kind) throws InvalidSyntaxException {
    Token t = peek();
    if (!t.is(kind)) {
      throw InvalidSyntaxException.expected(t.position(), kind.describe(),
                                            t.describe());
    }
    return advance();
  }

  private static boolean isContextual(Token t, String word) {
    return t.is(TokenKind.IDENTIFIER) && t.lexeme().equals(word);
  }
}
