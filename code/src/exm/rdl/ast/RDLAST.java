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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;

/**
 * Tree class for the register description AST handed over by the parser.
 * See {@link RDLTokens} for the node shapes.
 */
public class RDLAST extends CommonTree {

  public RDLAST(Token t) {
    super(t);
  }

  /**
   * Build a node without source position information
   */
  public static RDLAST create(int type, String text) {
    return new RDLAST(new CommonToken(type, text));
  }

  public static RDLAST create(int type, String text, int line, int col) {
    CommonToken tok = new CommonToken(type, text);
    tok.setLine(line);
    tok.setCharPositionInLine(col);
    return new RDLAST(tok);
  }

  /**
   * Append children, returning this so trees can be built as expressions
   */
  public RDLAST add(RDLAST ...kids) {
    for (RDLAST kid: kids) {
      addChild(kid);
    }
    return this;
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * RDLAST everywhere
   */
  public RDLAST child(int i) {
    return (RDLAST)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<RDLAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<RDLAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++) {
      writer.print(' ');
    }
    writer.println(getText());
    for (RDLAST kid: children()) {
      kid.printTree(writer, indent + 2);
    }
  }
}
