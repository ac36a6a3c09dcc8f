package exm.rdl.frontend;

import static exm.rdl.Fixtures.myRegDef;
import static exm.rdl.ast.ASTBuilder.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.rdl.Elaborator;
import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;
import exm.rdl.common.Logging;
import exm.rdl.common.exceptions.InstantiationCycleException;
import exm.rdl.common.exceptions.InvalidExtentException;
import exm.rdl.common.exceptions.OutOfBoundsException;
import exm.rdl.common.exceptions.PropertyTypeMismatchException;
import exm.rdl.common.exceptions.TypeMismatchException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.exceptions.UnknownPropertyException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.BuiltinEnums.AccessType;
import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.Types;
import exm.rdl.common.lang.Value;
import exm.rdl.common.util.Pair;
import exm.rdl.frontend.SpecializedComponent.ChildSlot;
import exm.rdl.frontend.SpecializedComponent.PathElem;
import exm.rdl.frontend.SpecializedComponent.PropertyOverride;

public class ComponentSpecializerTest {

  private static final long MAX_EXTENT = 1024;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ComponentSpecializerTest.rdl.log", true);
  }

  /**
   * Load definitions, returning the global context
   */
  private static GlobalContext load(RDLAST ...defs) throws UserException {
    Elaborator elab = new Elaborator("test.rdl", false, true, MAX_EXTENT);
    elab.loadDeclarations(root(defs));
    return elab.getGlobals();
  }

  private static SpecializedComponent specialize(ComponentSpecializer s,
      GlobalContext globals, String name, Map<String, Value> overrides)
          throws UserException {
    ComponentTemplate t = globals.lookupTemplate(name);
    return s.specialize(t, ParameterBinder.bind(t, overrides));
  }

  private static SpecializedComponent specialize(GlobalContext globals,
      String name) throws UserException {
    return specialize(new ComponentSpecializer(null, MAX_EXTENT), globals,
                      name, Collections.<String, Value>emptyMap());
  }

  private static Map<String, Value> size(long size) {
    Map<String, Value> m = new HashMap<String, Value>();
    m.put("SIZE", Value.createIntLit(size));
    return m;
  }

  /**
   * reg name { stmts };
   */
  private static RDLAST reg(String name, RDLAST ...stmts) {
    return componentDef("reg", name, body(stmts));
  }

  @Test
  public void testMyRegDefaults() throws UserException {
    SpecializedComponent r = specialize(load(myRegDef()), "myReg");
    assertEquals(ComponentKind.REG, r.kind());
    assertEquals(Value.createIntLit(32), r.property("regwidth"));
    assertEquals(Value.TRUE, r.property("shared"));

    ChildSlot data = r.child("data");
    assertEquals(ComponentKind.FIELD, data.definition().kind());
    assertNull(data.extent());
    assertEquals(Value.createEnumLit(AccessType.RW),
                 data.definition().property("sw"));
    assertEquals(Value.createIntLit(32),
                 data.definition().property("fieldwidth"));

    assertEquals(1, r.overrides().size());
    PropertyOverride o = r.overrides().get(0);
    assertEquals(Collections.singletonList(new PathElem("data", null)),
                 o.path());
    assertEquals("hdl_path_slice", o.property());
    assertEquals(Value.createArray(Types.STRING,
        Collections.singletonList(Value.createStringLit("[7:0]"))),
        o.value());
  }

  @Test
  public void testValueEqualOverridesShareResult() throws UserException {
    GlobalContext globals = load(myRegDef());
    SpecializationCache cache = new SpecializationCache();
    ComponentSpecializer s = new ComponentSpecializer(cache, MAX_EXTENT);
    ComponentTemplate t = globals.lookupTemplate("myReg");

    // .SIZE(16) and .SIZE(8+8)
    Map<String, Value> o1 = size(16);
    Map<String, Value> o2 = ParameterBinder.evalOverrides(globals,
        Collections.singletonList(Pair.create("SIZE",
            op(RDLTokens.PLUS, intLit(8), intLit(8)))));
    SpecializedComponent r1 = s.specialize(t, ParameterBinder.bind(t, o1));
    SpecializedComponent r2 = s.specialize(t, ParameterBinder.bind(t, o2));
    assertSame(r1, r2);
    assertEquals(Value.createIntLit(16), r1.property("regwidth"));

    SpecializedComponent r3 = s.specialize(t, ParameterBinder.bind(t,
                                                                size(8)));
    assertNotSame(r1, r3);
    assertEquals(Value.createIntLit(8), r3.property("regwidth"));
  }

  @Test
  public void testStructurallyEqualWithoutCache() throws UserException {
    GlobalContext globals = load(myRegDef());
    ComponentSpecializer s = new ComponentSpecializer(null, MAX_EXTENT);
    SpecializedComponent r1 = specialize(s, globals, "myReg", size(16));
    SpecializedComponent r2 = specialize(s, globals, "myReg", size(16));
    assertNotSame(r1, r2);
    assertEquals(r1, r2);
    assertEquals(r1.hashCode(), r2.hashCode());
  }

  @Test
  public void testCacheBuildsOncePerKey() throws UserException {
    GlobalContext globals = load(myRegDef(), componentDef("addrmap", "map",
        body(inst("myReg", assigns(), elem("a")),
             inst("myReg", assigns(), elem("b")),
             inst("myReg", assigns(assign("SIZE", intLit(32))), elem("c")))));
    SpecializationCache cache = new SpecializationCache();
    ComponentSpecializer s = new ComponentSpecializer(cache, MAX_EXTENT);
    SpecializedComponent map = specialize(s, globals, "map",
                                 Collections.<String, Value>emptyMap());
    assertSame(map.child("a").definition(), map.child("c").definition());
    // map, myReg and its field
    assertEquals(3, cache.size());
    assertEquals(3, cache.misses());
    assertEquals(2, cache.hits());
  }

  @Test
  public void testConcurrentSpecialization() throws Exception {
    final GlobalContext globals = load(myRegDef());
    final ComponentSpecializer s = new ComponentSpecializer(
                            new SpecializationCache(), MAX_EXTENT);
    final ComponentTemplate t = globals.lookupTemplate("myReg");
    final CountDownLatch start = new CountDownLatch(1);
    int nThreads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(nThreads);
    try {
      List<Future<SpecializedComponent>> results =
                      new ArrayList<Future<SpecializedComponent>>();
      for (int i = 0; i < nThreads; i++) {
        final long size = 8 + (i % 2) * 8;
        results.add(pool.submit(new Callable<SpecializedComponent>() {
          @Override
          public SpecializedComponent call() throws Exception {
            start.await();
            return s.specialize(t, ParameterBinder.bind(t, size(size)));
          }
        }));
      }
      start.countDown();

      SpecializedComponent even = results.get(0).get();
      SpecializedComponent odd = results.get(1).get();
      for (int i = 0; i < nThreads; i++) {
        assertSame(i % 2 == 0 ? even : odd, results.get(i).get());
      }
      assertEquals(Value.createIntLit(8), even.property("regwidth"));
      assertEquals(Value.createIntLit(16), odd.property("regwidth"));
      // Two myReg and two field specializations
      assertEquals(4, s.getCache().misses());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  public void testLastWriteWins() throws UserException {
    SpecializedComponent r = specialize(load(reg("r",
        set("regwidth", intLit(8)),
        set("desc", strLit("first")),
        set("regwidth", intLit(16)))), "r");
    assertEquals(Value.createIntLit(16), r.property("regwidth"));
    assertEquals(Value.createStringLit("first"), r.property("desc"));
  }

  @Test
  public void testBareBooleanAssignment() throws UserException {
    SpecializedComponent r = specialize(load(reg("r", set("shared"))), "r");
    assertEquals(Value.TRUE, r.property("shared"));
  }

  @Test
  public void testBareNonBooleanAssignment() throws UserException {
    exception.expect(PropertyTypeMismatchException.class);
    specialize(load(reg("r", set("regwidth"))), "r");
  }

  @Test
  public void testPropertyNotApplicable() throws UserException {
    exception.expect(UnknownPropertyException.class);
    exception.expectMessage("cannot be assigned on a reg");
    specialize(load(reg("r", set("fieldwidth", intLit(3)))), "r");
  }

  @Test
  public void testUndefinedProperty() throws UserException {
    exception.expect(UnknownPropertyException.class);
    specialize(load(reg("r", set("p_nothere", intLit(3)))), "r");
  }

  @Test
  public void testPropertyTypeMismatch() throws UserException {
    exception.expect(PropertyTypeMismatchException.class);
    specialize(load(reg("r", set("regwidth", strLit("32")))), "r");
  }

  @Test
  public void testFailFast() throws UserException {
    // The second statement fails, so the third is never evaluated
    exception.expect(PropertyTypeMismatchException.class);
    specialize(load(reg("r",
        set("regwidth", intLit(8)),
        set("regwidth", strLit("x")),
        set("regwidth", op(RDLTokens.DIV, intLit(1), intLit(0))))), "r");
  }

  @Test
  public void testInstanceArray() throws UserException {
    SpecializedComponent m = specialize(load(myRegDef(),
        componentDef("addrmap", "m", params(param(type("longint"), "N",
                                                  intLit(3))),
            body(inst("myReg", assigns(), elem("regs",
                 op(RDLTokens.PLUS, var("N"), intLit(1))))))), "m");
    assertEquals(Long.valueOf(4), m.child("regs").extent());
  }

  @Test
  public void testNegativeExtent() throws UserException {
    exception.expect(InvalidExtentException.class);
    specialize(load(myRegDef(), componentDef("addrmap", "m",
        body(inst("myReg", assigns(), elem("regs",
             op(RDLTokens.MINUS, intLit(0), intLit(1))))))), "m");
  }

  @Test
  public void testExtentTooLarge() throws UserException {
    exception.expect(InvalidExtentException.class);
    specialize(load(myRegDef(), componentDef("addrmap", "m",
        body(inst("myReg", assigns(), elem("regs", intLit(5000)))))), "m");
  }

  @Test
  public void testNonIntegerExtent() throws UserException {
    exception.expect(InvalidExtentException.class);
    specialize(load(myRegDef(), componentDef("addrmap", "m",
        body(inst("myReg", assigns(), elem("regs", strLit("2")))))), "m");
  }

  @Test
  public void testIndexedOverride() throws UserException {
    SpecializedComponent m = specialize(load(myRegDef(),
        componentDef("addrmap", "m",
            body(inst("myReg", assigns(), elem("regs", intLit(4))),
                 propAssign(target(pathElem("regs", intLit(2)),
                                   pathElem("data")),
                            "fieldwidth", intLit(3))))), "m");
    PropertyOverride o = m.overrides().get(0);
    assertEquals(new PathElem("regs", 2L), o.path().get(0));
    assertEquals(new PathElem("data", null), o.path().get(1));
  }

  @Test
  public void testIndexedOverrideOutOfBounds() throws UserException {
    exception.expect(OutOfBoundsException.class);
    specialize(load(myRegDef(), componentDef("addrmap", "m",
        body(inst("myReg", assigns(), elem("regs", intLit(4))),
             propAssign(target(pathElem("regs", intLit(4))),
                        "regwidth", intLit(3))))), "m");
  }

  @Test
  public void testIndexNonArrayInstance() throws UserException {
    exception.expect(TypeMismatchException.class);
    specialize(load(myRegDef(), componentDef("addrmap", "m",
        body(inst("myReg", assigns(), elem("r")),
             propAssign(target(pathElem("r", intLit(0))),
                        "regwidth", intLit(3))))), "m");
  }

  @Test
  public void testOverrideBeforeInstance() throws UserException {
    exception.expect(UndefinedReferenceException.class);
    exception.expectMessage("No instance called r");
    specialize(load(myRegDef(), componentDef("addrmap", "m",
        body(propAssign(target(pathElem("r")), "regwidth", intLit(3)),
             inst("myReg", assigns(), elem("r"))))), "m");
  }

  @Test
  public void testOverrideKindChecked() throws UserException {
    exception.expect(UnknownPropertyException.class);
    specialize(load(myRegDef(), componentDef("addrmap", "m",
        body(inst("myReg", assigns(), elem("r")),
             propAssign(target(pathElem("r"), pathElem("data")),
                        "regwidth", intLit(3))))), "m");
  }

  @Test
  public void testInstanceAsReference() throws UserException {
    SpecializedComponent m = specialize(load(componentDef("addrmap", "m",
        body(inst(componentDef("signal", null, body()), elem("rst")),
             inst(componentDef("reg", null, body(
                 inst(componentDef("field", null, body()), elem("f")))),
                  elem("r")),
             propAssign(target(pathElem("r"), pathElem("f")),
                        "resetsignal", var("rst"))))), "m");
    assertEquals(Value.createComponentRef("rst"),
                 m.overrides().get(0).value());
  }

  @Test
  public void testSelfInstantiation() throws UserException {
    exception.expect(InstantiationCycleException.class);
    exception.expectMessage("rf -> rf");
    specialize(load(componentDef("regfile", "rf",
        body(inst("rf", assigns(), elem("inner"))))), "rf");
  }

  @Test
  public void testMutualInstantiation() throws UserException {
    exception.expect(InstantiationCycleException.class);
    exception.expectMessage("a -> b -> a");
    specialize(load(
        componentDef("regfile", "a", body(inst("b", assigns(), elem("x")))),
        componentDef("regfile", "b", body(inst("a", assigns(), elem("y"))))),
        "a");
  }

  @Test
  public void testSelfInstantiationWithCache() throws UserException {
    exception.expect(InstantiationCycleException.class);
    GlobalContext globals = load(componentDef("regfile", "rf",
        body(inst("rf", assigns(), elem("inner")))));
    specialize(new ComponentSpecializer(new SpecializationCache(),
        MAX_EXTENT), globals, "rf", Collections.<String, Value>emptyMap());
  }

  @Test
  public void testNestedDefinition() throws UserException {
    // addrmap m #(longint W = 4) { reg inner { regwidth = W; }; inner r; };
    SpecializedComponent m = specialize(load(componentDef("addrmap", "m",
        params(param(type("longint"), "W", intLit(4))),
        body(componentDef("reg", "inner", body(set("regwidth", var("W")))),
             inst("inner", assigns(), elem("r"))))), "m");
    assertEquals(Value.createIntLit(4),
                 m.child("r").definition().property("regwidth"));
  }

  @Test
  public void testDefaultsRecordedOnSlots() throws UserException {
    SpecializedComponent m = specialize(load(myRegDef(),
        componentDef("addrmap", "m",
            body(inst("myReg", assigns(), elem("before")),
                 defaultSet("desc", strLit("d")),
                 inst("myReg", assigns(), elem("after"))))), "m");
    assertEquals(0, m.child("before").defaults().size());
    assertEquals(Value.createStringLit("d"),
                 m.child("after").defaults().get("desc").value());
  }
}
