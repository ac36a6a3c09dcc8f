package exm.rdl.ast;

import static exm.rdl.ast.RDLTokens.*;

/**
 * Shorthand for building the trees the parser would produce, so tests can
 * be written close to the source syntax.
 */
public class ASTBuilder {

  public static RDLAST node(int type, RDLAST ...kids) {
    return RDLAST.create(type, tokenNames[type]).add(kids);
  }

  public static RDLAST id(String name) {
    return RDLAST.create(ID, name);
  }

  public static RDLAST root(RDLAST ...stmts) {
    return node(ROOT, stmts);
  }

  // Expressions

  public static RDLAST intLit(String text) {
    return node(INT_LITERAL, RDLAST.create(NUMBER, text));
  }

  public static RDLAST intLit(long val) {
    return intLit(Long.toString(val));
  }

  public static RDLAST boolLit(boolean val) {
    return node(BOOL_LITERAL, id(Boolean.toString(val)));
  }

  /**
   * @param text string contents, without quotes
   */
  public static RDLAST strLit(String text) {
    return node(STRING_LITERAL, RDLAST.create(STRING, "\"" + text + "\""));
  }

  public static RDLAST enumLit(String literal) {
    return node(ENUM_LITERAL, id(literal));
  }

  public static RDLAST var(String name) {
    return node(VARIABLE, id(name));
  }

  /** <code>struct.field</code> */
  public static RDLAST field(RDLAST struct, String field) {
    return node(STRUCT_LOAD, struct, id(field));
  }

  /** <code>arr[index]</code> */
  public static RDLAST index(RDLAST arr, RDLAST index) {
    return node(ARRAY_LOAD, arr, index);
  }

  public static RDLAST index(RDLAST arr, long index) {
    return index(arr, intLit(index));
  }

  /** <code>type'{name: expr, ...}</code> */
  public static RDLAST structLit(String type, RDLAST ...inits) {
    return node(STRUCT_LITERAL, id(type)).add(inits);
  }

  public static RDLAST init(String field, RDLAST val) {
    return node(STRUCT_FIELD_INIT, id(field), val);
  }

  /** <code>'{e1, e2, ...}</code> */
  public static RDLAST arrayLit(RDLAST ...elems) {
    return node(ARRAY_LITERAL, elems);
  }

  public static RDLAST intArray(long ...vals) {
    RDLAST arr = node(ARRAY_LITERAL);
    for (long v: vals) {
      arr.add(intLit(v));
    }
    return arr;
  }

  public static RDLAST op(int opToken, RDLAST ...operands) {
    return node(OPERATOR, RDLAST.create(opToken, tokenNames[opToken]))
              .add(operands);
  }

  public static RDLAST ternary(RDLAST cond, RDLAST a, RDLAST b) {
    return node(TERNARY, cond, a, b);
  }

  /** <code>type'(expr)</code> */
  public static RDLAST typeCast(String type, RDLAST expr) {
    return node(CAST, type(type), expr);
  }

  /** <code>width'(expr)</code> */
  public static RDLAST widthCast(RDLAST width, RDLAST expr) {
    return node(CAST, width, expr);
  }

  // Declarations

  public static RDLAST type(String name) {
    return node(TYPE, id(name));
  }

  /** <code>name[]</code> */
  public static RDLAST arrayType(String name) {
    return node(TYPE, id(name), node(ARRAY_DIM));
  }

  public static RDLAST structDef(String name, String base,
                                 RDLAST ...fields) {
    RDLAST def = node(STRUCT_DEF, id(name));
    if (base != null) {
      def.add(node(STRUCT_BASE, id(base)));
    }
    return def.add(fields);
  }

  public static RDLAST structField(RDLAST type, String name) {
    return node(STRUCT_FIELD, type, id(name));
  }

  public static RDLAST propertyDef(String name, RDLAST ...attrs) {
    return node(PROPERTY_DEF, id(name)).add(attrs);
  }

  public static RDLAST attr(String name, RDLAST val) {
    return node(PROPERTY_ATTR, id(name), val);
  }

  public static RDLAST kinds(String ...kinds) {
    RDLAST t = node(COMPONENT_KINDS);
    for (String k: kinds) {
      t.add(id(k));
    }
    return t;
  }

  /**
   * @param name null for anonymous definitions
   */
  public static RDLAST componentDef(String kind, String name,
                                    RDLAST params, RDLAST body) {
    RDLAST nameTree = name == null ? RDLAST.create(ANONYMOUS, "ANONYMOUS")
                                   : id(name);
    return node(COMPONENT_DEF, id(kind), nameTree, params, body);
  }

  public static RDLAST componentDef(String kind, String name,
                                    RDLAST body) {
    return componentDef(kind, name, params(), body);
  }

  public static RDLAST params(RDLAST ...decls) {
    return node(PARAM_DECLS, decls);
  }

  public static RDLAST param(RDLAST type, String name, RDLAST defaultVal) {
    RDLAST p = node(PARAM_DECL, type, id(name));
    if (defaultVal != null) {
      p.add(defaultVal);
    }
    return p;
  }

  public static RDLAST body(RDLAST ...stmts) {
    return node(BODY, stmts);
  }

  /**
   * Instantiate named component
   */
  public static RDLAST inst(String typeName, RDLAST assigns,
                            RDLAST ...elems) {
    return node(COMPONENT_INST, id(typeName), assigns).add(elems);
  }

  /**
   * Instantiate anonymous definition
   */
  public static RDLAST inst(RDLAST anonDef, RDLAST ...elems) {
    return node(COMPONENT_INST, anonDef, node(PARAM_ASSIGNS)).add(elems);
  }

  public static RDLAST assigns(RDLAST ...assigns) {
    return node(PARAM_ASSIGNS, assigns);
  }

  /** <code>.name(val)</code> */
  public static RDLAST assign(String name, RDLAST val) {
    return node(PARAM_ASSIGN, id(name), val);
  }

  public static RDLAST elem(String name) {
    return node(INST_ELEM, id(name));
  }

  public static RDLAST elem(String name, RDLAST extent) {
    return node(INST_ELEM, id(name), node(INST_EXTENT, extent));
  }

  /** <code>prop = val;</code> on the enclosing component */
  public static RDLAST set(String prop, RDLAST val) {
    return propAssign(target(), prop, val);
  }

  /** <code>prop;</code> */
  public static RDLAST set(String prop) {
    return node(PROP_ASSIGN, target(), id(prop));
  }

  /** <code>a.b[i]->prop = val;</code> */
  public static RDLAST propAssign(RDLAST target, String prop, RDLAST val) {
    return node(PROP_ASSIGN, target, id(prop), val);
  }

  public static RDLAST target(RDLAST ...pathElems) {
    return node(PROP_TARGET, pathElems);
  }

  public static RDLAST pathElem(String name) {
    return node(PATH_ELEM, id(name));
  }

  public static RDLAST pathElem(String name, RDLAST index) {
    return node(PATH_ELEM, id(name), index);
  }

  /** <code>default prop = val;</code> */
  public static RDLAST defaultSet(String prop, RDLAST val) {
    return node(DEFAULT_PROP_ASSIGN, id(prop), val);
  }
}
