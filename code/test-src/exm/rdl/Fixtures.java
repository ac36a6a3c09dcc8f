package exm.rdl;

import static exm.rdl.ast.ASTBuilder.*;

import exm.rdl.ast.RDLAST;
import exm.rdl.ast.RDLTokens;

/**
 * Example descriptions shared between tests.
 */
public class Fixtures {

  /**
   * <pre>
   * struct s1_t { boolean bool; string str; longint n_arr[]; };
   * </pre>
   */
  public static RDLAST s1Def() {
    return structDef("s1_t", null,
        structField(type("boolean"), "bool"),
        structField(type("string"), "str"),
        structField(arrayType("longint"), "n_arr"));
  }

  /**
   * <pre>
   * struct s2_t { string str; s1_t nest; s1_t nest_arr[]; };
   * </pre>
   */
  public static RDLAST s2Def() {
    return structDef("s2_t", null,
        structField(type("string"), "str"),
        structField(type("s1_t"), "nest"),
        structField(arrayType("s1_t"), "nest_arr"));
  }

  /**
   * <pre>
   * property p_int { type = longint; component = all; };
   * </pre>
   */
  public static RDLAST userProperty(String name, String type) {
    return propertyDef(name,
        attr("type", type(type)),
        attr("component", kinds("all")));
  }

  /**
   * <pre>
   * s1_t'{bool: b, str: s, n_arr: '{n...}}
   * </pre>
   */
  public static RDLAST s1Lit(boolean b, String s, long ...n) {
    return structLit("s1_t",
        init("bool", boolLit(b)),
        init("str", strLit(s)),
        init("n_arr", intArray(n)));
  }

  /**
   * <pre>
   * s2_t'{str: "top",
   *       nest: s1_t'{bool: true, str: "hey", n_arr: '{}},
   *       nest_arr: '{s1_t'{bool: false, str: "foo", n_arr: '{1}},
   *                   s1_t'{bool: true, str: "bar", n_arr: '{59, 60, 61}}}}
   * </pre>
   */
  public static RDLAST nestedLit() {
    return structLit("s2_t",
        init("str", strLit("top")),
        init("nest", s1Lit(true, "hey")),
        init("nest_arr", arrayLit(s1Lit(false, "foo", 1),
                                  s1Lit(true, "bar", 59, 60, 61))));
  }

  /**
   * <pre>
   * reg myReg #(longint SIZE = 32, boolean SHARED = true,
   *             string FIELD_SLICES[] = '{"[7:0]"}) {
   *   regwidth = SIZE;
   *   shared = SHARED;
   *   field { sw = rw; fieldwidth = SIZE; } data;
   *   data->hdl_path_slice = FIELD_SLICES;
   * };
   * </pre>
   */
  public static RDLAST myRegDef() {
    return componentDef("reg", "myReg",
        params(param(type("longint"), "SIZE", intLit(32)),
               param(type("boolean"), "SHARED", boolLit(true)),
               param(arrayType("string"), "FIELD_SLICES",
                     arrayLit(strLit("[7:0]")))),
        body(set("regwidth", var("SIZE")),
             set("shared", var("SHARED")),
             inst(componentDef("field", null,
                     body(set("sw", enumLit("rw")),
                          set("fieldwidth", var("SIZE")))),
                  elem("data")),
             propAssign(target(pathElem("data")), "hdl_path_slice",
                        var("FIELD_SLICES"))));
  }

  /**
   * <pre>
   * reg my_reg_t #(s2_t S = ...) {
   *   desc = S.nest.str;
   *   name = S.nest_arr[0].str;
   *   p_int = S.nest_arr[1].n_arr[2];
   *   field {} f;
   * };
   * </pre>
   */
  public static RDLAST myRegTDef() {
    return componentDef("reg", "my_reg_t",
        params(param(type("s2_t"), "S", nestedLit())),
        body(set("desc", field(field(var("S"), "nest"), "str")),
             set("name", field(index(field(var("S"), "nest_arr"), 0),
                               "str")),
             set("p_int", index(field(index(field(var("S"), "nest_arr"), 1),
                                      "n_arr"), 2)),
             inst(componentDef("field", null, body()), elem("f"))));
  }

  /**
   * <pre>
   * addrmap top {
   *   myReg r_default;
   *   myReg #(.SIZE(16)) r16;
   *   myReg #(.SIZE(8), .SHARED(false)) r8;
   *   myReg #(.SIZE(8 + 8)) regs[4];
   *   my_reg_t nested;
   * };
   * </pre>
   */
  public static RDLAST topDef() {
    return componentDef("addrmap", "top",
        body(inst("myReg", assigns(), elem("r_default")),
             inst("myReg", assigns(assign("SIZE", intLit(16))),
                  elem("r16")),
             inst("myReg", assigns(assign("SIZE", intLit(8)),
                                   assign("SHARED", boolLit(false))),
                  elem("r8")),
             inst("myReg", assigns(assign("SIZE",
                      op(RDLTokens.PLUS, intLit(8), intLit(8)))),
                  elem("regs", intLit(4))),
             inst("my_reg_t", assigns(), elem("nested"))));
  }

  /**
   * All of the above plus <code>top top_inst;</code>
   */
  public static RDLAST description() {
    return root(s1Def(), s2Def(),
        userProperty("p_int", "longint"),
        userProperty("p_bool", "boolean"),
        userProperty("p_s1", "s1_t"),
        myRegDef(), myRegTDef(), topDef(),
        inst("top", assigns(), elem("top_inst")));
  }
}
