package exm.rdl.frontend;

import static exm.rdl.Fixtures.myRegDef;
import static exm.rdl.Fixtures.myRegTDef;
import static exm.rdl.Fixtures.s1Def;
import static exm.rdl.Fixtures.s1Lit;
import static exm.rdl.Fixtures.s2Def;
import static exm.rdl.ast.ASTBuilder.*;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.rdl.Elaborator;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.Logging;
import exm.rdl.common.exceptions.DoubleDefineException;
import exm.rdl.common.exceptions.ForwardReferenceException;
import exm.rdl.common.exceptions.ParameterTypeMismatchException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.exceptions.UnknownParameterException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.Types;
import exm.rdl.common.lang.Value;
import exm.rdl.common.util.Pair;

public class ParameterBinderTest {

  private GlobalContext globals;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ParameterBinderTest.rdl.log", true);
  }

  @Before
  public void loadDeclarations() throws UserException {
    Elaborator elab = new Elaborator("test.rdl", false, true, 1024);
    elab.loadDeclarations(root(s1Def(), s2Def(), myRegDef(), myRegTDef(),
        // reg chain #(longint A = 2, longint B = A * 3) {};
        componentDef("reg", "chain",
            params(param(type("longint"), "A", intLit(2)),
                   param(type("longint"), "B",
                         op(RDLTokens.MULT, var("A"), intLit(3)))),
            body()),
        // reg fwd #(longint A = B, longint B = 1) {};
        componentDef("reg", "fwd",
            params(param(type("longint"), "A", var("B")),
                   param(type("longint"), "B", intLit(1))),
            body()),
        // reg nodefault #(longint A) {};
        componentDef("reg", "nodefault",
            params(param(type("longint"), "A", null)), body())));
    globals = elab.getGlobals();
  }

  private ComponentTemplate template(String name) {
    return globals.lookupTemplate(name);
  }

  private static Map<String, Value> overrides(Object ...kv) {
    Map<String, Value> m = new HashMap<String, Value>();
    for (int i = 0; i < kv.length; i += 2) {
      m.put((String)kv[i], (Value)kv[i + 1]);
    }
    return m;
  }

  @Test
  public void testDefaults() throws UserException {
    ParameterEnvironment env = ParameterBinder.bind(template("myReg"),
                              Collections.<String, Value>emptyMap());
    assertEquals(Value.createIntLit(32), env.get("SIZE"));
    assertEquals(Value.TRUE, env.get("SHARED"));
    assertEquals(Value.createArray(Types.STRING,
        Collections.singletonList(Value.createStringLit("[7:0]"))),
        env.get("FIELD_SLICES"));
  }

  @Test
  public void testOverride() throws UserException {
    ParameterEnvironment env = ParameterBinder.bind(template("myReg"),
        overrides("SIZE", Value.createIntLit(16)));
    assertEquals(Value.createIntLit(16), env.get("SIZE"));
    assertEquals(Value.TRUE, env.get("SHARED"));
  }

  @Test
  public void testFullySpecifiedRoundTrips() throws UserException {
    Map<String, Value> full = overrides(
        "SIZE", Value.createIntLit(8),
        "SHARED", Value.FALSE,
        "FIELD_SLICES", Value.createArray(Types.STRING,
            Collections.singletonList(Value.createStringLit("x"))));
    ParameterEnvironment env = ParameterBinder.bind(template("myReg"), full);
    assertEquals(full, env.asMap());
    assertEquals(env, ParameterBinder.bind(template("myReg"), env.asMap()));
  }

  @Test
  public void testOverrideConverted() throws UserException {
    ParameterEnvironment env = ParameterBinder.bind(template("myReg"),
        overrides("SHARED", Value.createIntLit(0)));
    assertEquals(Value.FALSE, env.get("SHARED"));
  }

  @Test
  public void testLaterDefaultSeesEarlier() throws UserException {
    ParameterEnvironment env = ParameterBinder.bind(template("chain"),
        overrides("A", Value.createIntLit(5)));
    assertEquals(Value.createIntLit(15), env.get("B"));
  }

  @Test
  public void testForwardReference() throws UserException {
    exception.expect(ForwardReferenceException.class);
    ParameterBinder.bind(template("fwd"),
                         Collections.<String, Value>emptyMap());
  }

  @Test
  public void testForwardReferenceOverridden() throws UserException {
    // Default of A is never evaluated
    ParameterEnvironment env = ParameterBinder.bind(template("fwd"),
        overrides("A", Value.createIntLit(7)));
    assertEquals(Value.createIntLit(7), env.get("A"));
    assertEquals(Value.createIntLit(1), env.get("B"));
  }

  @Test
  public void testUnknownParameter() throws UserException {
    exception.expect(UnknownParameterException.class);
    ParameterBinder.bind(template("myReg"),
                         overrides("WIDTH", Value.createIntLit(8)));
  }

  @Test
  public void testWrongScalarType() throws UserException {
    exception.expect(ParameterTypeMismatchException.class);
    ParameterBinder.bind(template("myReg"),
                         overrides("SIZE", Value.createStringLit("16")));
  }

  @Test
  public void testStringForStruct() throws UserException {
    exception.expect(ParameterTypeMismatchException.class);
    ParameterBinder.bind(template("my_reg_t"),
                         overrides("S", Value.createStringLit("x")));
  }

  @Test
  public void testWrongStructType() throws UserException {
    Value s1 = ExprEvaluator.evaluate(globals, s1Lit(true, "x"),
                                      ParameterEnvironment.EMPTY);
    exception.expect(ParameterTypeMismatchException.class);
    ParameterBinder.bind(template("my_reg_t"), overrides("S", s1));
  }

  @Test
  public void testMissingRequired() throws UserException {
    exception.expect(UndefinedReferenceException.class);
    exception.expectMessage("has no default");
    ParameterBinder.bind(template("nodefault"),
                         Collections.<String, Value>emptyMap());
  }

  @Test
  public void testEvalOverridesDuplicate() throws UserException {
    exception.expect(DoubleDefineException.class);
    ParameterBinder.evalOverrides(globals, Arrays.asList(
        Pair.create("SIZE", intLit(1)), Pair.create("SIZE", intLit(2))));
  }
}
