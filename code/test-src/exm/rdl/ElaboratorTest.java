package exm.rdl;

import static exm.rdl.Fixtures.description;
import static exm.rdl.Fixtures.myRegDef;
import static exm.rdl.ast.ASTBuilder.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Collections;

import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.rdl.Elaborator.ElaborationResult;
import exm.rdl.ast.RDLAST;
import exm.rdl.common.Logging;
import exm.rdl.common.Settings;
import exm.rdl.common.exceptions.InvalidOptionException;
import exm.rdl.common.exceptions.InvalidSyntaxException;
import exm.rdl.common.exceptions.UndefinedReferenceException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.BuiltinEnums.AccessType;
import exm.rdl.common.lang.ComponentKind;
import exm.rdl.common.lang.Types;
import exm.rdl.common.lang.Value;
import exm.rdl.elab.ElaboratedTree;
import exm.rdl.elab.Instance;

public class ElaboratorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ElaboratorTest.rdl.log", true);
  }

  @After
  public void resetSettings() {
    for (String key: Settings.getKeys()) {
      Settings.reset(key);
    }
  }

  private static ElaboratedTree elaborateDescription() throws UserException {
    ElaborationResult result = new Elaborator("test.rdl", false, true, 1024)
                                              .elaborate(description());
    assertTrue(result.isSuccess());
    assertEquals(1, result.getTrees().size());
    return result.getTree("top_inst");
  }

  private static ElaboratedTree elaborate(RDLAST ...stmts)
      throws UserException {
    ElaborationResult result = new Elaborator("test.rdl", false, true, 1024)
                                              .elaborate(root(stmts));
    assertEquals(1, result.getTrees().size());
    return result.getTrees().get(0);
  }

  @Test
  public void testParameterizedRegisters() throws UserException {
    ElaboratedTree tree = elaborateDescription();
    Instance top = tree.getRoot();
    assertEquals("top_inst", top.name());
    assertEquals(ComponentKind.ADDRMAP, top.kind());

    Instance rDefault = tree.find("r_default");
    assertEquals(Value.createIntLit(32), rDefault.property("regwidth"));
    assertEquals(Value.TRUE, rDefault.property("shared"));

    Instance r16 = tree.find("r16");
    assertEquals(Value.createIntLit(16), r16.property("regwidth"));
    assertEquals(Value.TRUE, r16.property("shared"));

    Instance r8 = tree.find("r8");
    assertEquals(Value.createIntLit(8), r8.property("regwidth"));
    assertEquals(Value.FALSE, r8.property("shared"));
  }

  @Test
  public void testFieldProperties() throws UserException {
    ElaboratedTree tree = elaborateDescription();
    Instance data = tree.find("r8.data");
    assertEquals(ComponentKind.FIELD, data.kind());
    assertEquals(Value.createIntLit(8), data.property("fieldwidth"));
    assertEquals(Value.createEnumLit(AccessType.RW), data.property("sw"));
    assertEquals(Value.createArray(Types.STRING,
        Collections.singletonList(Value.createStringLit("[7:0]"))),
        data.property("hdl_path_slice"));
  }

  @Test
  public void testEqualParameterizationsShared() throws UserException {
    ElaboratedTree tree = elaborateDescription();
    Instance r16 = tree.find("r16");
    for (int i = 0; i < 4; i++) {
      Instance reg = tree.find("regs[" + i + "]");
      assertEquals(Long.valueOf(i), reg.ordinal());
      assertSame(r16.definition(), reg.definition());
      assertEquals(Value.createIntLit(16),
                   tree.find("regs[" + i + "].data").property("fieldwidth"));
    }
    assertFalse(r16.definition().equals(tree.find("r8").definition()));
    assertNull(tree.find("regs[4]"));
  }

  @Test
  public void testStructParameter() throws UserException {
    Instance nested = elaborateDescription().find("nested");
    assertEquals(Value.createStringLit("hey"), nested.property("desc"));
    assertEquals(Value.createStringLit("foo"), nested.property("name"));
    assertEquals(Value.createIntLit(61), nested.property("p_int"));
    assertNotNull(nested.child("f"));
  }

  @Test
  public void testTreeSize() throws UserException {
    // top, 7 registers with one field each, nested with one field
    assertEquals(1 + 7 * 2 + 2, elaborateDescription().size());
  }

  @Test
  public void testDefaultsAndOverrides() throws UserException {
    // addrmap m {
    //   default desc = "dflt";
    //   myReg a; myReg b[2];
    //   b->desc = "all b";
    //   b[1]->desc = "b1";
    //   a.data->fieldwidth = 3;
    // };
    ElaboratedTree tree = elaborate(myRegDef(),
        componentDef("addrmap", "m", body(
            defaultSet("desc", strLit("dflt")),
            inst("myReg", assigns(), elem("a")),
            inst("myReg", assigns(), elem("b", intLit(2))),
            propAssign(target(pathElem("b")), "desc", strLit("all b")),
            propAssign(target(pathElem("b", intLit(1))), "desc",
                       strLit("b1")),
            propAssign(target(pathElem("a"), pathElem("data")),
                       "fieldwidth", intLit(3)))),
        inst("m", assigns(), elem("top")));
    assertEquals(Value.createStringLit("dflt"),
                 tree.find("a").property("desc"));
    assertEquals(Value.createStringLit("dflt"),
                 tree.find("a.data").property("desc"));
    assertEquals(Value.createStringLit("all b"),
                 tree.find("b[0]").property("desc"));
    assertEquals(Value.createStringLit("b1"),
                 tree.find("b[1]").property("desc"));
    assertEquals(Value.createIntLit(3),
                 tree.find("a.data").property("fieldwidth"));
    assertEquals(Value.createIntLit(32),
                 tree.find("b[0].data").property("fieldwidth"));
    // Overrides don't change the shared definition
    assertSame(tree.find("a").definition(), tree.find("b[0]").definition());
  }

  @Test
  public void testUserPropertyDefault() throws UserException {
    // property p_num { type = longint; component = reg; default = 7; };
    // addrmap m { reg { p_num; } r; };
    ElaboratedTree tree = elaborate(
        propertyDef("p_num", attr("type", type("longint")),
                    attr("component", kinds("reg")),
                    attr("default", intLit(7))),
        componentDef("addrmap", "m", body(
            inst(componentDef("reg", null, body(set("p_num"))),
                 elem("r")))));
    assertEquals("m", tree.getRoot().name());
    assertEquals(Value.createIntLit(7), tree.find("r").property("p_num"));
  }

  @Test
  public void testImplicitTopIsLastAddrmap() throws UserException {
    ElaboratedTree tree = elaborate(myRegDef(),
        componentDef("addrmap", "first", body()),
        componentDef("addrmap", "second",
                     body(inst("myReg", assigns(), elem("r")))),
        componentDef("regfile", "rf", body()));
    assertEquals("second", tree.getRoot().name());
    assertNotNull(tree.find("r.data"));
  }

  @Test
  public void testNothingToElaborate() throws UserException {
    ElaborationResult result = new Elaborator("test.rdl", false, true, 1024)
                                              .elaborate(root(myRegDef()));
    assertTrue(result.isSuccess());
    assertTrue(result.getTrees().isEmpty());
  }

  @Test
  public void testAnonymousTopLevelInstance() throws UserException {
    ElaboratedTree tree = elaborate(
        inst(componentDef("addrmap", null,
                 body(inst(componentDef("reg", null, body()), elem("r")))),
             elem("anon")));
    assertEquals("anon", tree.getRoot().name());
    assertEquals(ComponentKind.REG, tree.find("r").kind());
  }

  @Test
  public void testTopLevelArray() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("cannot be an array");
    new Elaborator("test.rdl", false, true, 1024).elaborate(root(myRegDef(),
        inst("myReg", assigns(), elem("regs", intLit(2)))));
  }

  @Test
  public void testFirstErrorStops() throws UserException {
    exception.expect(UndefinedReferenceException.class);
    exception.expectMessage("test.rdl:");
    new Elaborator("test.rdl", false, true, 1024).elaborate(root(myRegDef(),
        inst("nothere", assigns(), elem("bad")),
        inst("myReg", assigns(), elem("good"))));
  }

  @Test
  public void testCollectErrors() throws UserException {
    ElaborationResult result = new Elaborator("test.rdl", true, true, 1024)
      .elaborate(root(myRegDef(),
        inst("nothere", assigns(), elem("bad")),
        inst("myReg", assigns(), elem("good")),
        inst("myReg", assigns(assign("NOPE", intLit(1))), elem("bad2"))));
    assertFalse(result.isSuccess());
    assertEquals(2, result.getErrors().size());
    assertTrue(result.getErrors().get(0)
                     instanceof UndefinedReferenceException);
    assertEquals(1, result.getTrees().size());
    assertNotNull(result.getTree("good"));
    assertNull(result.getTree("bad"));
  }

  @Test
  public void testElaborateTop() throws UserException {
    Elaborator elab = new Elaborator("test.rdl", false, true, 1024);
    elab.loadDeclarations(root(myRegDef()));
    ElaboratedTree tree = elab.elaborateTop("myReg",
        Collections.singletonMap("SIZE", Value.createIntLit(4)));
    assertEquals("myReg", tree.getRoot().name());
    assertEquals(Value.createIntLit(4),
                 tree.find("data").property("fieldwidth"));
  }

  @Test
  public void testCacheStatistics() throws UserException {
    Elaborator elab = new Elaborator("test.rdl", false, true, 1024);
    elab.elaborate(description());
    // r_default, r16 / regs, r8 and my_reg_t each with their field, and top
    assertEquals(9, elab.getCache().size());
    assertTrue(elab.getCache().hits() > 0);
  }

  @Test
  public void testWithoutCache() throws UserException {
    Elaborator elab = new Elaborator("test.rdl", false, false, 1024);
    assertNull(elab.getCache());
    Instance r16 = elab.elaborate(description()).getTree("top_inst")
                       .find("r16");
    assertEquals(Value.createIntLit(16), r16.property("regwidth"));
  }

  @Test
  public void testSettings() throws Exception {
    Settings.set(Settings.INPUT_FILENAME, "from-settings.rdl");
    Settings.set(Settings.SPECIALIZATION_CACHE, "false");
    Elaborator elab = new Elaborator();
    assertNull(elab.getCache());
    assertEquals("from-settings.rdl", elab.getGlobals().getInputFile());
  }

  @Test
  public void testBadSetting() throws Exception {
    exception.expect(InvalidOptionException.class);
    Settings.set(Settings.MAX_EXTENT, "lots");
    new Elaborator();
  }
}
