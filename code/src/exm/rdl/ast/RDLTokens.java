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
package exm.rdl.ast;

/**
 * Token types of the abstract syntax tree consumed by the elaborator.
 *
 * The parser is a separate tool: it hands over a tree of {@link RDLAST}
 * nodes using these token types.  Shapes, by node type:
 * <pre>
 * ROOT                 (STRUCT_DEF | PROPERTY_DEF | COMPONENT_DEF | COMPONENT_INST)*
 * STRUCT_DEF           ID [STRUCT_BASE] STRUCT_FIELD*
 * STRUCT_BASE          ID
 * STRUCT_FIELD         TYPE ID
 * TYPE                 ID [ARRAY_DIM]
 * PROPERTY_DEF         ID PROPERTY_ATTR*
 * PROPERTY_ATTR        ID(type) TYPE | ID(component) COMPONENT_KINDS | ID(default) expr
 * COMPONENT_KINDS      ID+               (component keywords or "all")
 * COMPONENT_DEF        ID(kind) (ID(name) | ANONYMOUS) PARAM_DECLS BODY
 * PARAM_DECLS          PARAM_DECL*
 * PARAM_DECL           TYPE ID [expr]
 * BODY                 (COMPONENT_DEF | STRUCT_DEF | COMPONENT_INST
 *                        | PROP_ASSIGN | DEFAULT_PROP_ASSIGN)*
 * COMPONENT_INST       (ID | COMPONENT_DEF) PARAM_ASSIGNS INST_ELEM+
 * PARAM_ASSIGNS        PARAM_ASSIGN*
 * PARAM_ASSIGN         ID expr
 * INST_ELEM            ID [INST_EXTENT]
 * INST_EXTENT          expr
 * PROP_ASSIGN          PROP_TARGET ID [expr]
 * PROP_TARGET          PATH_ELEM*        (empty: the enclosing component)
 * PATH_ELEM            ID [expr]
 * DEFAULT_PROP_ASSIGN  ID [expr]
 *
 * INT_LITERAL          NUMBER            (e.g. 32, 0x1f, 4'hf, 8'd255)
 * BOOL_LITERAL         ID(true|false)
 * STRING_LITERAL       STRING            (with surrounding quotes)
 * ENUM_LITERAL         ID                (e.g. rw, woclr)
 * VARIABLE             ID
 * STRUCT_LOAD          expr ID
 * ARRAY_LOAD           expr expr
 * STRUCT_LITERAL       ID STRUCT_FIELD_INIT*
 * STRUCT_FIELD_INIT    ID expr
 * ARRAY_LITERAL        expr*
 * OPERATOR             (operator token) expr+
 * TERNARY              expr expr expr
 * CAST                 (TYPE | expr) expr   (type cast or width cast)
 * </pre>
 */
public class RDLTokens {
  public static final int ROOT = 4;
  public static final int ID = 5;
  public static final int NUMBER = 6;
  public static final int STRING = 7;
  public static final int ANONYMOUS = 8;

  public static final int STRUCT_DEF = 10;
  public static final int STRUCT_BASE = 11;
  public static final int STRUCT_FIELD = 12;
  public static final int TYPE = 13;
  public static final int ARRAY_DIM = 14;
  public static final int PROPERTY_DEF = 15;
  public static final int PROPERTY_ATTR = 16;
  public static final int COMPONENT_KINDS = 17;
  public static final int COMPONENT_DEF = 18;
  public static final int PARAM_DECLS = 19;
  public static final int PARAM_DECL = 20;
  public static final int BODY = 21;
  public static final int COMPONENT_INST = 22;
  public static final int PARAM_ASSIGNS = 23;
  public static final int PARAM_ASSIGN = 24;
  public static final int INST_ELEM = 25;
  public static final int INST_EXTENT = 26;
  public static final int PROP_ASSIGN = 27;
  public static final int PROP_TARGET = 28;
  public static final int PATH_ELEM = 29;
  public static final int DEFAULT_PROP_ASSIGN = 30;

  public static final int INT_LITERAL = 40;
  public static final int BOOL_LITERAL = 41;
  public static final int STRING_LITERAL = 42;
  public static final int ENUM_LITERAL = 43;
  public static final int VARIABLE = 44;
  public static final int STRUCT_LOAD = 45;
  public static final int ARRAY_LOAD = 46;
  public static final int STRUCT_LITERAL = 47;
  public static final int STRUCT_FIELD_INIT = 48;
  public static final int ARRAY_LITERAL = 49;
  public static final int OPERATOR = 50;
  public static final int TERNARY = 51;
  public static final int CAST = 52;

  // Operator tokens, first child of OPERATOR
  public static final int PLUS = 60;
  public static final int MINUS = 61;
  public static final int MULT = 62;
  public static final int DIV = 63;
  public static final int MOD = 64;
  public static final int POW = 65;
  public static final int AMP = 66;
  public static final int PIPE = 67;
  public static final int CARET = 68;
  /** ~^ or ^~ */
  public static final int XNOR = 69;
  /** ~& */
  public static final int NAND = 70;
  /** ~| */
  public static final int NOR = 71;
  public static final int TILDE = 72;
  public static final int NOT = 73;
  public static final int SHL = 74;
  public static final int SHR = 75;
  public static final int EQUALS = 76;
  public static final int NEQUALS = 77;
  public static final int LT = 78;
  public static final int GT = 79;
  public static final int LTE = 80;
  public static final int GTE = 81;
  public static final int LAND = 82;
  public static final int LOR = 83;

  public static final String[] tokenNames = new String[LOR + 1];

  static {
    tokenNames[ROOT] = "ROOT";
    tokenNames[ID] = "ID";
    tokenNames[NUMBER] = "NUMBER";
    tokenNames[STRING] = "STRING";
    tokenNames[ANONYMOUS] = "ANONYMOUS";
    tokenNames[STRUCT_DEF] = "STRUCT_DEF";
    tokenNames[STRUCT_BASE] = "STRUCT_BASE";
    tokenNames[STRUCT_FIELD] = "STRUCT_FIELD";
    tokenNames[TYPE] = "TYPE";
    tokenNames[ARRAY_DIM] = "ARRAY_DIM";
    tokenNames[PROPERTY_DEF] = "PROPERTY_DEF";
    tokenNames[PROPERTY_ATTR] = "PROPERTY_ATTR";
    tokenNames[COMPONENT_KINDS] = "COMPONENT_KINDS";
    tokenNames[COMPONENT_DEF] = "COMPONENT_DEF";
    tokenNames[PARAM_DECLS] = "PARAM_DECLS";
    tokenNames[PARAM_DECL] = "PARAM_DECL";
    tokenNames[BODY] = "BODY";
    tokenNames[COMPONENT_INST] = "COMPONENT_INST";
    tokenNames[PARAM_ASSIGNS] = "PARAM_ASSIGNS";
    tokenNames[PARAM_ASSIGN] = "PARAM_ASSIGN";
    tokenNames[INST_ELEM] = "INST_ELEM";
    tokenNames[INST_EXTENT] = "INST_EXTENT";
    tokenNames[PROP_ASSIGN] = "PROP_ASSIGN";
    tokenNames[PROP_TARGET] = "PROP_TARGET";
    tokenNames[PATH_ELEM] = "PATH_ELEM";
    tokenNames[DEFAULT_PROP_ASSIGN] = "DEFAULT_PROP_ASSIGN";
    tokenNames[INT_LITERAL] = "INT_LITERAL";
    tokenNames[BOOL_LITERAL] = "BOOL_LITERAL";
    tokenNames[STRING_LITERAL] = "STRING_LITERAL";
    tokenNames[ENUM_LITERAL] = "ENUM_LITERAL";
    tokenNames[VARIABLE] = "VARIABLE";
    tokenNames[STRUCT_LOAD] = "STRUCT_LOAD";
    tokenNames[ARRAY_LOAD] = "ARRAY_LOAD";
    tokenNames[STRUCT_LITERAL] = "STRUCT_LITERAL";
    tokenNames[STRUCT_FIELD_INIT] = "STRUCT_FIELD_INIT";
    tokenNames[ARRAY_LITERAL] = "ARRAY_LITERAL";
    tokenNames[OPERATOR] = "OPERATOR";
    tokenNames[TERNARY] = "TERNARY";
    tokenNames[CAST] = "CAST";
    tokenNames[PLUS] = "+";
    tokenNames[MINUS] = "-";
    tokenNames[MULT] = "*";
    tokenNames[DIV] = "/";
    tokenNames[MOD] = "%";
    tokenNames[POW] = "**";
    tokenNames[AMP] = "&";
    tokenNames[PIPE] = "|";
    tokenNames[CARET] = "^";
    tokenNames[XNOR] = "~^";
    tokenNames[NAND] = "~&";
    tokenNames[NOR] = "~|";
    tokenNames[TILDE] = "~";
    tokenNames[NOT] = "!";
    tokenNames[SHL] = "<<";
    tokenNames[SHR] = ">>";
    tokenNames[EQUALS] = "==";
    tokenNames[NEQUALS] = "!=";
    tokenNames[LT] = "<";
    tokenNames[GT] = ">";
    tokenNames[LTE] = "<=";
    tokenNames[GTE] = ">=";
    tokenNames[LAND] = "&&";
    tokenNames[LOR] = "||";
  }
}
