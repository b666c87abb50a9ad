package kara.karac.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import kara.karac.ast.FilePosition;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.diagnostics.DiagnosticKind;

public class LexerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Lexer lexer(String src) {
    return new Lexer("test.kara", src.getBytes(StandardCharsets.UTF_8));
  }

  private static List<TokenKind> kinds(List<Token> tokens) {
    List<TokenKind> result = new ArrayList<TokenKind>();
    for (Token t: tokens) {
      result.add(t.kind());
    }
    return result;
  }

  @Test
  public void testKeywordsAndOperators() {
    List<Token> toks = lexer("flow f -> == != <= >= < > = ! as").tokenize();
    List<TokenKind> expected = new ArrayList<TokenKind>();
    expected.add(TokenKind.FLOW);
    expected.add(TokenKind.IDENTIFIER);
    expected.add(TokenKind.ARROW);
    expected.add(TokenKind.EQUAL_EQUAL);
    expected.add(TokenKind.BANG_EQUAL);
    expected.add(TokenKind.LESS_EQUAL);
    expected.add(TokenKind.GREATER_EQUAL);
    expected.add(TokenKind.LESS);
    expected.add(TokenKind.GREATER);
    expected.add(TokenKind.EQUAL);
    expected.add(TokenKind.BANG);
    expected.add(TokenKind.AS);
    expected.add(TokenKind.EOF);
    assertEquals(expected, kinds(toks));
  }

  @Test
  public void testKeywordNeedsExactMatch() {
    List<Token> toks = lexer("letter let fnx").tokenize();
    assertEquals(TokenKind.IDENTIFIER, toks.get(0).kind());
    assertEquals(TokenKind.LET, toks.get(1).kind());
    assertEquals(TokenKind.IDENTIFIER, toks.get(2).kind());
  }

  @Test
  public void testNumbers() {
    List<Token> toks = lexer("42 3.25 7.x").tokenize();
    assertEquals(TokenKind.INTEGER, toks.get(0).kind());
    assertEquals(42L, toks.get(0).value());
    assertEquals(TokenKind.FLOAT, toks.get(1).kind());
    assertEquals(3.25, (Double)toks.get(1).value(), 0.0);
    // '.' not followed by a digit ends the integer
    assertEquals(TokenKind.INTEGER, toks.get(2).kind());
    assertEquals(TokenKind.DOT, toks.get(3).kind());
    assertEquals(TokenKind.IDENTIFIER, toks.get(4).kind());
  }

  @Test
  public void testIntegerOverflow() {
    Lexer l = lexer("99999999999999999999");
    List<Token> toks = l.tokenize();
    assertEquals(TokenKind.INTEGER, toks.get(0).kind());
    assertEquals(1, l.getDiagnostics().size());
    assertEquals(DiagnosticKind.INTEGER_OVERFLOW,
                 l.getDiagnostics().getAll().get(0).getKind());
  }

  @Test
  public void testStringEscapes() {
    List<Token> toks = lexer("\"a\\n\\\"b\"").tokenize();
    assertEquals(TokenKind.STRING, toks.get(0).kind());
    assertEquals("a\n\"b", toks.get(0).value());
  }

  @Test
  public void testCommentsAndPositions() {
    List<Token> toks = lexer("// comment\n  let x").tokenize();
    assertEquals(TokenKind.LET, toks.get(0).kind());
    FilePosition pos = toks.get(0).position();
    assertEquals(2, pos.line);
    assertEquals(3, pos.col);
    assertEquals(13, pos.offset);
    assertEquals(TokenKind.IDENTIFIER, toks.get(1).kind());
    assertEquals(7, toks.get(1).position().col);
  }

  @Test
  public void testNonAsciiIdentifier() {
    List<Token> toks = lexer("let größe = 1;").tokenize();
    assertEquals(TokenKind.IDENTIFIER, toks.get(1).kind());
    assertEquals("größe", toks.get(1).lexeme());
    assertEquals(TokenKind.EQUAL, toks.get(2).kind());
  }

  @Test
  public void testInvalidBytesAllReported() {
    Lexer l = lexer("let a = 1 @ 2 $ 3;");
    List<Token> toks = l.tokenize();
    assertFalse("Invalid bytes are not fatal", l.hitFatalError());
    assertEquals(2, l.getDiagnostics().size());
    for (Diagnostic d: l.getDiagnostics().getAll()) {
      assertEquals(DiagnosticKind.INVALID_BYTE, d.getKind());
    }
    assertEquals(TokenKind.EOF, toks.get(toks.size() - 1).kind());
    assertEquals(TokenKind.SEMICOLON, toks.get(toks.size() - 2).kind());
  }

  @Test
  public void testUnterminatedStringIsFatal() {
    Lexer l = lexer("let s = \"abc");
    List<Token> toks = l.tokenize();
    assertTrue(l.hitFatalError());
    assertEquals(DiagnosticKind.UNTERMINATED_STRING,
                 l.getDiagnostics().getAll().get(0).getKind());
    assertEquals(TokenKind.EOF, toks.get(toks.size() - 1).kind());
  }

  @Test
  public void testInvalidUtf8IsFatal() {
    byte[] src = new byte[] {'l', 'e', 't', ' ', (byte)0xff, ' ', 'x'};
    Lexer l = new Lexer("test.kara", src);
    l.tokenize();
    assertTrue(l.hitFatalError());
    assertEquals(DiagnosticKind.INVALID_ENCODING,
                 l.getDiagnostics().getAll().get(0).getKind());
  }

  /**
   * Concatenating lexemes gives back the source minus whitespace
   * and comments
   */
  @Test
  public void testLexemesReproduceSource() {
    String src = "flow main() {\n  // say hi\n  let greeting = \"hi\";\n" +
                 "  greeting -> Print -> ();\n}\n";
    StringBuilder sb = new StringBuilder();
    for (Token t: lexer(src).tokenize()) {
      sb.append(t.lexeme());
    }
    String stripped = src.replace("// say hi", "").replaceAll("\\s+", "");
    assertEquals(stripped, sb.toString().replaceAll("\\s+", ""));
  }

  @Test
  public void testRestartAtPosition() {
    String src = "let a = 1;\nlet b = 2;";
    Lexer first = lexer(src);
    List<Token> all = first.tokenize();
    // Second "let"
    Token secondLet = all.get(5);
    assertEquals(TokenKind.LET, secondLet.kind());
    Lexer restarted = first.restartAt(secondLet.position());
    List<Token> rest = restarted.tokenize();
    assertEquals(kinds(all.subList(5, all.size())), kinds(rest));
    assertEquals(2, rest.get(0).position().line);
    assertEquals(1, rest.get(0).position().col);
  }
}
