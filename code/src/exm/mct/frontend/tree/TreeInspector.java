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

package exm.mct.frontend.tree;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;

import exm.mct.common.util.Pair;

/**
 * Human-readable views of a tree: an indented outline and node statistics
 */
public class TreeInspector {

  private static final String BRANCH = "|-- ";
  private static final String LAST_BRANCH = "`-- ";
  private static final String CONTINUE = "|   ";
  private static final String SPACE = "    ";

  /**
   * Render the tree as an outline, one node per line, with node fields
   * labelled.
   */
  public static String printTree(Node root) {
    StringBuilder sb = new StringBuilder();
    sb.append(label(root)).append('\n');
    appendFields(sb, root, "");
    return sb.toString();
  }

  private static void appendFields(StringBuilder sb, Node node,
                                   String prefix) {
    List<Pair<String, List<Node>>> fields = node.accept(FIELDS);
    for (int i = 0; i < fields.size(); i++) {
      Pair<String, List<Node>> field = fields.get(i);
      boolean lastField = (i == fields.size() - 1);
      sb.append(prefix).append(lastField ? LAST_BRANCH : BRANCH)
        .append(field.val1).append(":\n");
      String fieldPrefix = prefix + (lastField ? SPACE : CONTINUE);
      List<Node> children = field.val2;
      for (int j = 0; j < children.size(); j++) {
        Node child = children.get(j);
        boolean lastChild = (j == children.size() - 1);
        sb.append(fieldPrefix).append(lastChild ? LAST_BRANCH : BRANCH)
          .append(label(child)).append('\n');
        appendFields(sb, child, fieldPrefix + (lastChild ? SPACE : CONTINUE));
      }
    }
  }

  /**
   * @return node kind with the node's key attribute, e.g. "BinaryOp [+]"
   */
  public static String label(Node node) {
    return node.accept(LABELS);
  }

  /**
   * @return number of nodes of each kind in the tree
   */
  public static Multiset<NodeKind> countNodes(Node root) {
    Multiset<NodeKind> counts = EnumMultiset.create(NodeKind.class);
    List<Node> stack = new ArrayList<Node>();
    stack.add(root);
    while (!stack.isEmpty()) {
      Node node = stack.remove(stack.size() - 1);
      counts.add(node.getKind());
      stack.addAll(node.children());
    }
    return counts;
  }

  /**
   * @return signature in source syntax, e.g. "int add(int a, int b)"
   */
  public static String signature(FunctionDef fn) {
    return fn.getReturnType().typeName() + " " + fn.getName() + "(" +
           StringUtils.join(fn.getParams(), ", ") + ")";
  }

  /**
   * Render node counts, most frequent first, and a summary of each function
   */
  public static String stats(Program program) {
    Multiset<NodeKind> counts = countNodes(program);
    StringBuilder sb = new StringBuilder();
    sb.append("Nodes: ").append(counts.size()).append(" total, ")
      .append(counts.elementSet().size()).append(" kinds\n");
    for (Multiset.Entry<NodeKind> e:
              Multisets.copyHighestCountFirst(counts).entrySet()) {
      sb.append("  ")
        .append(StringUtils.rightPad(e.getElement().displayName(), 12))
        .append(StringUtils.leftPad(Integer.toString(e.getCount()), 4))
        .append('\n');
    }
    sb.append("Functions (").append(program.getBody().size()).append("):\n");
    for (FunctionDef fn: program.getBody()) {
      sb.append("  ").append(signature(fn)).append('\n');
      sb.append("    statements: ").append(fn.getBody().getBody().size())
        .append('\n');
    }
    return sb.toString();
  }

  private static final NodeVisitor<String> LABELS = new NodeVisitor<String>() {
    @Override
    public String visitProgram(Program program) {
      return "Program";
    }

    @Override
    public String visitFunctionDef(FunctionDef function) {
      return "FunctionDef [" + function.getName() + "]";
    }

    @Override
    public String visitVarDecl(VarDecl decl) {
      return "VarDecl [" + decl.getName() + ": " + decl.getDataType() + "]";
    }

    @Override
    public String visitAssignment(Assignment assignment) {
      return "Assignment [" + assignment.getTarget() + "]";
    }

    @Override
    public String visitIf(If ifStmt) {
      return "If";
    }

    @Override
    public String visitWhile(While loop) {
      return "While";
    }

    @Override
    public String visitBinaryOp(BinaryOp op) {
      return "BinaryOp [" + op.getOp().symbol() + "]";
    }

    @Override
    public String visitCall(Call call) {
      return "Call [" + call.getCallee() + "]";
    }

    @Override
    public String visitIdentifier(Identifier id) {
      return "Identifier [" + id.getName() + "]";
    }

    @Override
    public String visitLiteral(Literal literal) {
      return "Literal [" + literal.getValue() + "]";
    }

    @Override
    public String visitReturn(Return ret) {
      return "Return";
    }

    @Override
    public String visitPrint(Print print) {
      return "Print";
    }

    @Override
    public String visitBlock(Block block) {
      return "Block";
    }
  };

  /** Named child fields of each node kind; empty fields are left out */
  private static final NodeVisitor<List<Pair<String, List<Node>>>> FIELDS =
      new NodeVisitor<List<Pair<String, List<Node>>>>() {

    private List<Pair<String, List<Node>>> fields(Object... nameNodePairs) {
      List<Pair<String, List<Node>>> result =
                            new ArrayList<Pair<String, List<Node>>>();
      for (int i = 0; i < nameNodePairs.length; i += 2) {
        String name = (String) nameNodePairs[i];
        Object val = nameNodePairs[i + 1];
        List<Node> nodes;
        if (val == null) {
          continue;
        } else if (val instanceof Node) {
          nodes = ImmutableList.of((Node) val);
        } else {
          nodes = new ArrayList<Node>();
          for (Object o: (List<?>) val) {
            nodes.add((Node) o);
          }
          if (nodes.isEmpty()) {
            continue;
          }
        }
        result.add(Pair.create(name, nodes));
      }
      return result;
    }

    @Override
    public List<Pair<String, List<Node>>> visitProgram(Program program) {
      return fields("body", program.getBody());
    }

    @Override
    public List<Pair<String, List<Node>>> visitFunctionDef(FunctionDef fn) {
      return fields("body", fn.getBody());
    }

    @Override
    public List<Pair<String, List<Node>>> visitVarDecl(VarDecl decl) {
      return fields("init", decl.getInit());
    }

    @Override
    public List<Pair<String, List<Node>>> visitAssignment(Assignment a) {
      return fields("value", a.getValue());
    }

    @Override
    public List<Pair<String, List<Node>>> visitIf(If ifStmt) {
      return fields("test", ifStmt.getTest(),
                    "consequent", ifStmt.getConsequent(),
                    "alternate", ifStmt.getAlternate());
    }

    @Override
    public List<Pair<String, List<Node>>> visitWhile(While loop) {
      return fields("test", loop.getTest(), "body", loop.getBody());
    }

    @Override
    public List<Pair<String, List<Node>>> visitBinaryOp(BinaryOp op) {
      return fields("left", op.getLeft(), "right", op.getRight());
    }

    @Override
    public List<Pair<String, List<Node>>> visitCall(Call call) {
      return fields("args", call.getArgs());
    }

    @Override
    public List<Pair<String, List<Node>>> visitIdentifier(Identifier id) {
      return fields();
    }

    @Override
    public List<Pair<String, List<Node>>> visitLiteral(Literal literal) {
      return fields();
    }

    @Override
    public List<Pair<String, List<Node>>> visitReturn(Return ret) {
      return fields("value", ret.getValue());
    }

    @Override
    public List<Pair<String, List<Node>>> visitPrint(Print print) {
      return fields("value", print.getValue());
    }

    @Override
    public List<Pair<String, List<Node>>> visitBlock(Block block) {
      return fields("body", block.getBody());
    }
  };
}
