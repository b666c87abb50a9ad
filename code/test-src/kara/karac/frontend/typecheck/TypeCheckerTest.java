package kara.karac.frontend.typecheck;

import static kara.karac.frontend.typecheck.TypeChecker.binaryResult;
import static kara.karac.frontend.typecheck.TypeChecker.checkConversion;
import static kara.karac.frontend.typecheck.TypeChecker.compatible;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import kara.karac.ast.FilePosition;
import kara.karac.ast.Operator;
import kara.karac.ast.TypeRef;
import kara.karac.common.exceptions.InvalidOperandException;
import kara.karac.common.exceptions.TypeMismatchException;
import kara.karac.common.exceptions.UndefinedVarError;
import kara.karac.common.lang.Types;
import kara.karac.common.lang.Types.SemanticType;
import kara.karac.common.lang.Types.TupleType;
import kara.karac.common.lang.Types.Type;

public class TypeCheckerTest {

  private static final FilePosition POS = new FilePosition("t.kara", 1, 1, 0);

  private static final SemanticType USER_ID =
                        new SemanticType("UserId", Types.I64);
  private static final SemanticType PRODUCT_ID =
                        new SemanticType("ProductId", Types.I64);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testSemanticTypesAreNominal() {
    assertTrue(compatible(USER_ID, new SemanticType("UserId", Types.I64)));
    assertFalse("Same underlying primitive is not enough",
                compatible(USER_ID, PRODUCT_ID));
    assertFalse("Primitive doesn't pass as semantic type",
                compatible(USER_ID, Types.I64));
    assertFalse("Semantic type doesn't pass as primitive",
                compatible(Types.I64, USER_ID));
    assertFalse("Literal doesn't pass as semantic type",
                compatible(USER_ID, Types.INT_LITERAL));
  }

  @Test
  public void testLiteralsAdaptWithinCategory() {
    assertTrue(compatible(Types.I8, Types.INT_LITERAL));
    assertTrue(compatible(Types.U64, Types.INT_LITERAL));
    assertTrue(compatible(Types.F32, Types.FLOAT_LITERAL));
    assertFalse(compatible(Types.F64, Types.INT_LITERAL));
    assertFalse(compatible(Types.I64, Types.I32));
  }

  @Test
  public void testTuplesElementwise() {
    Type expected = new TupleType(Arrays.<Type>asList(Types.I64, USER_ID));
    assertTrue(compatible(expected, new TupleType(
                Arrays.<Type>asList(Types.INT_LITERAL, USER_ID))));
    assertFalse(compatible(expected, new TupleType(
                Arrays.<Type>asList(Types.I64, PRODUCT_ID))));
  }

  @Test
  public void testErrorTypeCompatibleWithAnything() {
    assertTrue(compatible(USER_ID, Types.ERROR));
    assertTrue(compatible(Types.ERROR, Types.STRING));
  }

  @Test
  public void testBoundaryMismatchHint() throws TypeMismatchException {
    exception.expect(TypeMismatchException.class);
    exception.expectMessage("Use 'as UserId' to convert");
    TypeChecker.checkBoundary(POS, "argument u of f", USER_ID, Types.I64);
  }

  @Test
  public void testConversions() throws TypeMismatchException {
    assertEquals(USER_ID, checkConversion(POS, Types.I64, USER_ID));
    assertEquals(USER_ID, checkConversion(POS, Types.INT_LITERAL, USER_ID));
    assertEquals(Types.I64, checkConversion(POS, USER_ID, Types.I64));
    assertEquals(USER_ID, checkConversion(POS, USER_ID, USER_ID));
  }

  @Test
  public void testNoDirectSemanticToSemantic() throws TypeMismatchException {
    exception.expect(TypeMismatchException.class);
    exception.expectMessage("two conversions");
    checkConversion(POS, USER_ID, PRODUCT_ID);
  }

  @Test
  public void testConversionToOtherPrimitiveRejected()
      throws TypeMismatchException {
    exception.expect(TypeMismatchException.class);
    checkConversion(POS, USER_ID, Types.I32);
  }

  @Test
  public void testArithmetic() throws InvalidOperandException {
    assertEquals(Types.I64, binaryResult(POS, Operator.PLUS,
                                         Types.I64, Types.INT_LITERAL));
    assertEquals(USER_ID, binaryResult(POS, Operator.PLUS,
                                       USER_ID, Types.INT_LITERAL));
    assertEquals(Types.I64, binaryResult(POS, Operator.MINUS,
                                         USER_ID, PRODUCT_ID));
    assertEquals(Types.STRING, binaryResult(POS, Operator.PLUS,
                                            Types.STRING, Types.STRING));
    assertEquals(Types.BOOL, binaryResult(POS, Operator.LT,
                                          Types.F64, Types.FLOAT_LITERAL));
  }

  @Test
  public void testMixedCategoriesRejected() throws InvalidOperandException {
    exception.expect(InvalidOperandException.class);
    binaryResult(POS, Operator.PLUS, Types.INT_LITERAL, Types.FLOAT_LITERAL);
  }

  @Test
  public void testBoolOrderingRejected() throws InvalidOperandException {
    exception.expect(InvalidOperandException.class);
    binaryResult(POS, Operator.LT, Types.BOOL, Types.BOOL);
  }

  @Test
  public void testResolveTypeRef() throws UndefinedVarError {
    TypeRef unit = TypeRef.tuple(Collections.<TypeRef>emptyList(), POS);
    assertEquals(Types.UNIT, TypeChecker.resolveTypeRef(unit,
                                Collections.<String, Type>emptyMap()));
    assertEquals(USER_ID, TypeChecker.resolveTypeRef(
                TypeRef.named("UserId", POS),
                Collections.<String, Type>singletonMap("UserId", USER_ID)));
    exception.expect(UndefinedVarError.class);
    TypeChecker.resolveTypeRef(TypeRef.named("Nope", POS),
                               Collections.<String, Type>emptyMap());
  }
}
