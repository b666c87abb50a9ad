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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import kara.karac.ast.FilePosition;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.diagnostics.Diagnostics;
import kara.karac.common.exceptions.LexicalException;

/**
 * Converts UTF-8 source bytes into tokens.
 *
 * Works directly on the byte array: multi-byte sequences are only decoded
 * while scanning identifiers and strings.  Bytes that start no token
 * produce an ERROR token and scanning carries on from the next byte, so
 * that every lexical error in a file is reported in one pass.  Invalid
 * UTF-8 and unterminated strings are fatal: the caller should not go on
 * to parse the file.
 */
public class Lexer {
  private static final Logger logger = Logging.getKaracLogger();

  private final String file;
  private final byte[] src;
  private final Diagnostics diagnostics;

  /** First byte of token being scanned */
  private int start;
  /** Next byte to read */
  private int current;
  /** Current line, 1-based */
  private int line;
  /** Offset of first byte of current line */
  private int lineStart;

  /** Position of token being scanned */
  private int tokenLine;
  private int tokenCol;

  private boolean fatal = false;

  public Lexer(String file, byte[] src) {
    this(file, src, 0, 1, 0);
  }

  private Lexer(String file, byte[] src, int offset, int line,
                int lineStart) {
    this.file = file;
    this.src = src;
    this.start = offset;
    this.current = offset;
    this.line = line;
    this.lineStart = lineStart;
    this.diagnostics = new Diagnostics();
  }

  /**
   * Create a lexer that resumes scanning at a position previously
   * returned in a token from this source.  Diagnostics start empty.
   */
  public Lexer restartAt(FilePosition pos) {
    if (pos.offset < 0 || pos.offset > src.length) {
      throw new IllegalArgumentException("Position " + pos +
                                         " is outside the source");
    }
    return new Lexer(file, src, pos.offset, pos.line,
                     pos.offset - (pos.col - 1));
  }

  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  /**
   * @return true if an error was found that makes the rest of the
   *        token stream meaningless
   */
  public boolean hitFatalError() {
    return fatal;
  }

  /**
   * Scan the whole input.  Stops early after a fatal error.
   * @return tokens, always ending with EOF
   */
  public List<Token> tokenize() {
    List<Token> tokens = new ArrayList<Token>();
    while (true) {
      Token tok = nextToken();
      if (fatal && !tok.is(TokenKind.EOF)) {
        tokens.add(tok);
        tokens.add(makeEof());
        break;
      }
      tokens.add(tok);
      if (tok.is(TokenKind.EOF)) {
        break;
      }
    }
    logger.debug("lexer: " + file + ": " + tokens.size() + " tokens, " +
                 diagnostics.size() + " errors");
    return tokens;
  }

  public Token nextToken() {
    skipWhitespace();
    start = current;
    tokenLine = line;
    tokenCol = current - lineStart + 1;

    if (isAtEnd()) {
      return makeEof();
    }

    byte c = advance();
    Token tok;
    switch (c) {
      case '(': tok = make(TokenKind.LEFT_PAREN); break;
      case ')': tok = make(TokenKind.RIGHT_PAREN); break;
      case '{': tok = make(TokenKind.LEFT_BRACE); break;
      case '}': tok = make(TokenKind.RIGHT_BRACE); break;
      case ',': tok = make(TokenKind.COMMA); break;
      case ':': tok = make(TokenKind.COLON); break;
      case ';': tok = make(TokenKind.SEMICOLON); break;
      case '.': tok = make(TokenKind.DOT); break;
      case '+': tok = make(TokenKind.PLUS); break;
      case '*': tok = make(TokenKind.STAR); break;
      case '/': tok = make(TokenKind.SLASH); break;
      case '-':
        tok = make(match('>') ? TokenKind.ARROW : TokenKind.MINUS);
        break;
      case '=':
        tok = make(match('=') ? TokenKind.EQUAL_EQUAL : TokenKind.EQUAL);
        break;
      case '!':
        tok = make(match('=') ? TokenKind.BANG_EQUAL : TokenKind.BANG);
        break;
      case '<':
        tok = make(match('=') ? TokenKind.LESS_EQUAL : TokenKind.LESS);
        break;
      case '>':
        tok = make(match('=') ? TokenKind.GREATER_EQUAL : TokenKind.GREATER);
        break;
      case '"':
        tok = string();
        break;
      default:
        if (isDigit(c)) {
          tok = number();
        } else if (isAsciiIdentStart(c) || !isAscii(c)) {
          tok = identifier(c);
        } else {
          tok = error(DiagnosticKind.INVALID_BYTE,
              "unexpected character " + describeByte(c));
        }
        break;
    }
    if (logger.isTraceEnabled()) {
      logger.trace("token: " + tok);
    }
    return tok;
  }

  /**
   * Skip whitespace and line comments.  Neither produces tokens.
   */
  private void skipWhitespace() {
    while (!isAtEnd()) {
      byte c = peek();
      switch (c) {
        case ' ':
        case '\t':
        case '\r':
          current++;
          break;
        case '\n':
          current++;
          newLine();
          break;
        case '/':
          if (peekNext() == '/') {
            while (!isAtEnd() && peek() != '\n') {
              current++;
            }
          } else {
            return;
          }
          break;
        default:
          return;
      }
    }
  }

  private Token identifier(byte first) {
    if (!isAscii(first)) {
      // Back up so the whole sequence is decoded
      current = start;
      int cp;
      try {
        cp = decodeCodePoint();
      } catch (LexicalException e) {
        return encodingError(e);
      }
      if (!Character.isLetter(cp)) {
        return error(DiagnosticKind.INVALID_BYTE, "unexpected character " +
                     String.format("U+%04X", cp));
      }
    }

    while (!isAtEnd()) {
      byte c = peek();
      if (isAscii(c)) {
        if (isAsciiIdentStart(c) || isDigit(c)) {
          current++;
        } else {
          break;
        }
      } else {
        int save = current;
        int cp;
        try {
          cp = decodeCodePoint();
        } catch (LexicalException e) {
          return encodingError(e);
        }
        if (!Character.isLetterOrDigit(cp)) {
          current = save;
          break;
        }
      }
    }

    String text = lexeme();
    TokenKind kw = TokenKind.keyword(text);
    if (kw == null) {
      return new Token(TokenKind.IDENTIFIER, text, text, position());
    } else if (kw == TokenKind.TRUE || kw == TokenKind.FALSE) {
      return new Token(kw, text, kw == TokenKind.TRUE, position());
    }
    return make(kw);
  }

  private Token number() {
    while (isDigit(peek())) {
      current++;
    }

    boolean isFloat = false;
    if (peek() == '.' && isDigit(peekNext())) {
      isFloat = true;
      current++;
      while (isDigit(peek())) {
        current++;
      }
    }

    String text = lexeme();
    if (isFloat) {
      return new Token(TokenKind.FLOAT, text, Double.parseDouble(text),
                       position());
    }
    Long value;
    try {
      value = Long.parseLong(text);
    } catch (NumberFormatException e) {
      diagnostics.error(DiagnosticKind.INTEGER_OVERFLOW, "integer literal " +
          text + " does not fit in 64 bits", position());
      // Keep an integer token so the parser doesn't report more errors
      value = 0L;
    }
    return new Token(TokenKind.INTEGER, text, value, position());
  }

  private Token string() {
    ByteArrayOutputStream value = new ByteArrayOutputStream();
    while (true) {
      if (isAtEnd()) {
        return error(DiagnosticKind.UNTERMINATED_STRING,
                     "unterminated string literal");
      }
      byte c = peek();
      if (c == '"') {
        current++;
        break;
      } else if (c == '\n') {
        current++;
        newLine();
        value.write(c);
      } else if (c == '\\') {
        current++;
        escape(value);
      } else if (isAscii(c)) {
        current++;
        value.write(c);
      } else {
        int seqStart = current;
        try {
          decodeCodePoint();
        } catch (LexicalException e) {
          return encodingError(e);
        }
        value.write(src, seqStart, current - seqStart);
      }
    }
    String decoded = new String(value.toByteArray(), StandardCharsets.UTF_8);
    return new Token(TokenKind.STRING, lexeme(), decoded, position());
  }

  private void escape(ByteArrayOutputStream value) {
    if (isAtEnd()) {
      // Reported as unterminated by caller
      return;
    }
    byte c = peek();
    switch (c) {
      case 'n': value.write('\n'); break;
      case 't': value.write('\t'); break;
      case 'r': value.write('\r'); break;
      case '"': value.write('"'); break;
      case '\\': value.write('\\'); break;
      default:
        diagnostics.error(DiagnosticKind.INVALID_BYTE,
            "unknown escape sequence \\" + describeByte(c),
            new FilePosition(file, line, current - lineStart, current - 1));
        // Leave the byte to the string loop
        value.write('\\');
        return;
    }
    current++;
  }

  /**
   * Decode one UTF-8 code point starting at current, and advance past it.
   * @throws LexicalException if bytes are not valid UTF-8
   */
  private int decodeCodePoint() throws LexicalException {
    int b0 = src[current] & 0xff;
    int len;
    int cp;
    if (b0 < 0x80) {
      current++;
      return b0;
    } else if (b0 >= 0xc2 && b0 <= 0xdf) {
      len = 2;
      cp = b0 & 0x1f;
    } else if (b0 >= 0xe0 && b0 <= 0xef) {
      len = 3;
      cp = b0 & 0x0f;
    } else if (b0 >= 0xf0 && b0 <= 0xf4) {
      len = 4;
      cp = b0 & 0x07;
    } else {
      throw invalidEncoding(b0);
    }
    if (current + len > src.length) {
      throw invalidEncoding(b0);
    }
    for (int i = 1; i < len; i++) {
      int b = src[current + i] & 0xff;
      if ((b & 0xc0) != 0x80) {
        throw invalidEncoding(b0);
      }
      cp = (cp << 6) | (b & 0x3f);
    }
    // Reject overlong forms, surrogates and values past U+10FFFF
    if ((len == 3 && cp < 0x800) || (len == 4 && cp < 0x10000) ||
        (cp >= 0xd800 && cp <= 0xdfff) || cp > 0x10ffff) {
      throw invalidEncoding(b0);
    }
    current += len;
    return cp;
  }

  private LexicalException invalidEncoding(int leadByte) {
    FilePosition pos = new FilePosition(file, line,
                        current - lineStart + 1, current);
    return new LexicalException(pos, DiagnosticKind.INVALID_ENCODING,
        "invalid UTF-8 sequence starting with byte " +
        String.format("0x%02x", leadByte));
  }

  private Token encodingError(LexicalException e) {
    fatal = fatal || e.getKind().isFatal();
    diagnostics.add(e);
    current = Math.min(current + 1, src.length);
    return new Token(TokenKind.ERROR, rawLexeme(), null, e.getPosition());
  }

  private Token error(DiagnosticKind kind, String message) {
    FilePosition pos = position();
    diagnostics.error(kind, message, pos);
    fatal = fatal || kind.isFatal();
    return new Token(TokenKind.ERROR, rawLexeme(), null, pos);
  }

  private Token make(TokenKind kind) {
    return new Token(kind, lexeme(), null, position());
  }

  private Token makeEof() {
    return new Token(TokenKind.EOF, "", null,
            new FilePosition(file, line, current - lineStart + 1, current));
  }

  private FilePosition position() {
    return new FilePosition(file, tokenLine, tokenCol, start);
  }

  private String lexeme() {
    return new String(src, start, current - start, StandardCharsets.UTF_8);
  }

  /**
   * Lexeme for error tokens, which may hold broken UTF-8
   */
  private String rawLexeme() {
    StringBuilder sb = new StringBuilder();
    for (int i = start; i < current; i++) {
      byte b = src[i];
      if (isAscii(b) && b >= 0x20) {
        sb.append((char)b);
      } else {
        sb.append(String.format("\\x%02x", b & 0xff));
      }
    }
    return sb.toString();
  }

  private void newLine() {
    line++;
    lineStart = current;
  }

  private boolean isAtEnd() {
    return current >= src.length;
  }

  private byte advance() {
    return src[current++];
  }

  private boolean match(char expected) {
    if (isAtEnd() || src[current] != expected) {
      return false;
    }
    current++;
    return true;
  }

  private byte peek() {
    return isAtEnd() ? 0 : src[current];
  }

  private byte peekNext() {
    return current + 1 >= src.length ? 0 : src[current + 1];
  }

  private static boolean isAscii(byte c) {
    return (c & 0x80) == 0;
  }

  private static boolean isDigit(byte c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAsciiIdentStart(byte c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static String describeByte(byte c) {
    if (isAscii(c) && c >= 0x20 && c < 0x7f) {
      return "'" + (char)c + "'";
    }
    return String.format("0x%02x", c & 0xff);
  }
}
