/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.astpos.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.astpos.tree.Node.Prop;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.nullness.Nullable;

/**
 * A syntax tree construction helper class. Every factory documents the child layout of the node
 * it returns; absent optional children are represented by {@link #empty()} placeholders so that
 * children can be found by index.
 */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  /** FILE: [NAME package, declaration...] */
  public static Node file(String packageName, Node... decls) {
    Node file = new Node(Token.FILE, name(packageName));
    for (Node decl : decls) {
      checkState(mayBeDeclaration(decl), "File cannot contain %s", decl.getToken());
      file.addChildToBack(decl);
    }
    return file;
  }

  // ==========================================================================
  // Declarations

  /** An unparenthesized declaration group holding exactly one spec, e.g. {@code var a = 1}. */
  public static Node decl(Token kind, Node spec) {
    checkArgument(kind.isDeclarationGroup(), kind);
    checkSpec(kind, spec);
    return new Node(kind, spec);
  }

  /** A parenthesized declaration group: IMPORT/CONST/TYPE/VAR [spec...] */
  public static Node group(Token kind, Node... specs) {
    checkArgument(kind.isDeclarationGroup(), kind);
    Node group = new Node(kind);
    group.putBooleanProp(Prop.PARENTHESIZED, true);
    for (Node spec : specs) {
      checkSpec(kind, spec);
      group.addChildToBack(spec);
    }
    return group;
  }

  private static void checkSpec(Token kind, Node spec) {
    switch (kind) {
      case IMPORT:
        checkState(spec.getToken() == Token.IMPORT_SPEC, spec);
        break;
      case TYPE:
        checkState(spec.getToken() == Token.TYPE_SPEC, spec);
        break;
      default:
        checkState(spec.getToken() == Token.VALUE_SPEC, spec);
        break;
    }
  }

  /** IMPORT_SPEC: [NAME local name | EMPTY, LITERAL path] */
  public static Node importSpec(String path) {
    return new Node(Token.IMPORT_SPEC, empty(), string(path));
  }

  public static Node importSpec(String localName, String path) {
    return new Node(Token.IMPORT_SPEC, name(localName), string(path));
  }

  /** VALUE_SPEC: [EXPR_LIST names, type | EMPTY, EXPR_LIST values] */
  public static Node valueSpec(List<Node> names, @Nullable Node type, List<Node> values) {
    checkArgument(!names.isEmpty(), "Value spec without names");
    for (Node name : names) {
      checkState(name.isName(), name);
    }
    checkState(type == null || mayBeType(type), type);
    for (Node value : values) {
      checkState(mayBeExpression(value), value);
    }
    return new Node(Token.VALUE_SPEC, exprList(names), orEmpty(type), exprList(values));
  }

  public static Node valueSpec(String name, @Nullable Node type, @Nullable Node value) {
    return valueSpec(
        ImmutableList.of(name(name)),
        type,
        value == null ? ImmutableList.<Node>of() : ImmutableList.of(value));
  }

  /** TYPE_SPEC: [NAME, FIELD_LIST type parameters | EMPTY, type] */
  public static Node typeSpec(String name, Node type) {
    return typeSpec(name(name), empty(), type);
  }

  public static Node typeSpec(Node name, Node typeParams, Node type) {
    checkState(name.isName(), name);
    checkState(typeParams.isEmpty() || typeParams.isFieldList(), typeParams);
    checkState(mayBeType(type), type);
    return new Node(Token.TYPE_SPEC, name, typeParams, type);
  }

  /** A TYPE_SPEC of the form {@code type A = B}. */
  public static Node aliasSpec(String name, Node type) {
    Node spec = typeSpec(name, type);
    spec.putBooleanProp(Prop.ALIAS, true);
    return spec;
  }

  /** FUNC_DECL: [FIELD_LIST receiver | EMPTY, NAME, FUNC_TYPE, BLOCK | EMPTY] */
  public static Node funcDecl(
      @Nullable Node receiver, String name, Node funcType, @Nullable Node body) {
    checkState(receiver == null || receiver.isFieldList(), receiver);
    checkState(funcType.isFuncType(), funcType);
    checkState(body == null || body.isBlock(), body);
    Node decl = new Node(Token.FUNC_DECL, orEmpty(receiver), name(name), funcType);
    decl.addChildToBack(orEmpty(body));
    return decl;
  }

  public static Node funcDecl(String name, Node funcType, Node body) {
    return funcDecl(null, name, funcType, body);
  }

  // ==========================================================================
  // Fields and types

  /** FIELD_LIST: [FIELD...], written with delimiters. */
  public static Node fieldList(Node... fields) {
    Node list = new Node(Token.FIELD_LIST);
    list.putBooleanProp(Prop.DELIMITED, true);
    for (Node field : fields) {
      checkState(field.getToken() == Token.FIELD, field);
      list.addChildToBack(field);
    }
    return list;
  }

  /** A FIELD_LIST holding a single unnamed result type written without parentheses. */
  public static Node bareResult(Node type) {
    return new Node(Token.FIELD_LIST, field(type));
  }

  /** FIELD: [EXPR_LIST names, type, LITERAL tag | EMPTY] */
  public static Node field(List<Node> names, Node type, @Nullable Node tag) {
    for (Node name : names) {
      checkState(name.isName(), name);
    }
    checkState(mayBeType(type), type);
    checkState(tag == null || tag.isLiteral(), tag);
    return new Node(Token.FIELD, exprList(names), type, orEmpty(tag));
  }

  public static Node field(String name, Node type) {
    return field(ImmutableList.of(name(name)), type, null);
  }

  public static Node field(Node type) {
    return field(ImmutableList.<Node>of(), type, null);
  }

  /** STRUCT_TYPE: [FIELD_LIST] */
  public static Node structType(Node... fields) {
    return new Node(Token.STRUCT_TYPE, fieldList(fields));
  }

  /** INTERFACE_TYPE: [FIELD_LIST] */
  public static Node interfaceType(Node... methods) {
    return new Node(Token.INTERFACE_TYPE, fieldList(methods));
  }

  /** FUNC_TYPE: [FIELD_LIST type parameters | EMPTY, FIELD_LIST params, FIELD_LIST results | EMPTY] */
  public static Node funcType(@Nullable Node typeParams, Node params, @Nullable Node results) {
    checkState(typeParams == null || typeParams.isFieldList(), typeParams);
    checkState(params.isFieldList() && params.getBooleanProp(Prop.DELIMITED), params);
    checkState(results == null || results.isFieldList(), results);
    return new Node(Token.FUNC_TYPE, orEmpty(typeParams), params, orEmpty(results));
  }

  public static Node funcType(Node params, @Nullable Node results) {
    return funcType(null, params, results);
  }

  /** A signature without parameters or results. */
  public static Node funcType() {
    return funcType(null, fieldList(), null);
  }

  /** ARRAY_TYPE: [length | EMPTY, element type]; an absent length makes a slice type. */
  public static Node arrayType(@Nullable Node length, Node elementType) {
    checkState(length == null || mayBeExpression(length), length);
    checkState(mayBeType(elementType), elementType);
    return new Node(Token.ARRAY_TYPE, orEmpty(length), elementType);
  }

  public static Node sliceType(Node elementType) {
    return arrayType(null, elementType);
  }

  /** MAP_TYPE: [key type, value type] */
  public static Node mapType(Node key, Node value) {
    checkState(mayBeType(key), key);
    checkState(mayBeType(value), value);
    return new Node(Token.MAP_TYPE, key, value);
  }

  /** CHAN_TYPE: [element type] */
  public static Node chanType(Node value) {
    checkState(mayBeType(value), value);
    return new Node(Token.CHAN_TYPE, value);
  }

  public static Node sendChanType(Node value) {
    return chanType(value).putBooleanProp(Prop.SEND_ONLY, true);
  }

  public static Node recvChanType(Node value) {
    return chanType(value).putBooleanProp(Prop.RECV_ONLY, true);
  }

  /** ELLIPSIS: [element type | EMPTY] */
  public static Node ellipsis(@Nullable Node elementType) {
    return new Node(Token.ELLIPSIS, orEmpty(elementType));
  }

  // ==========================================================================
  // Expressions

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "Empty identifier");
    return Node.newString(Token.NAME, name);
  }

  /** A basic literal given by its source text, e.g. {@code 42}, {@code 'x'} or {@code `raw`}. */
  public static Node literal(String text) {
    checkArgument(!text.isEmpty(), "Empty literal");
    return Node.newString(Token.LITERAL, text);
  }

  public static Node number(long value) {
    return literal(Long.toString(value));
  }

  /** An interpreted string literal holding {@code value}. */
  public static Node string(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
      }
    }
    sb.append('"');
    return literal(sb.toString());
  }

  /** COMPOSITE_LIT: [type | EMPTY, element...] */
  public static Node compositeLit(@Nullable Node type, Node... elements) {
    checkState(type == null || mayBeType(type), type);
    Node lit = new Node(Token.COMPOSITE_LIT, orEmpty(type));
    for (Node element : elements) {
      checkState(mayBeExpression(element), element);
      lit.addChildToBack(element);
    }
    return lit;
  }

  /** KEY_VALUE: [key, value] */
  public static Node keyValue(Node key, Node value) {
    checkState(mayBeExpression(key), key);
    checkState(mayBeExpression(value), value);
    return new Node(Token.KEY_VALUE, key, value);
  }

  /** FUNC_LIT: [FUNC_TYPE, BLOCK] */
  public static Node funcLit(Node funcType, Node body) {
    checkState(funcType.isFuncType(), funcType);
    checkState(body.isBlock(), body);
    return new Node(Token.FUNC_LIT, funcType, body);
  }

  /** PAREN: [expression] */
  public static Node paren(Node x) {
    checkState(mayBeExpression(x), x);
    return new Node(Token.PAREN, x);
  }

  /** SELECTOR: [expression, NAME selector] */
  public static Node selector(Node x, String selector) {
    checkState(mayBeExpression(x), x);
    return new Node(Token.SELECTOR, x, name(selector));
  }

  /** Builds a qualified selector chain such as {@code fmt.Println}. */
  public static Node qualifiedName(String first, String... rest) {
    Node n = name(first);
    for (String part : rest) {
      n = selector(n, part);
    }
    return n;
  }

  /** INDEX: [expression, index] */
  public static Node index(Node x, Node index) {
    checkState(mayBeExpression(x), x);
    checkState(mayBeExpression(index), index);
    return new Node(Token.INDEX, x, index);
  }

  /** INDEX_LIST: [expression, index...] for instantiations with several type arguments. */
  public static Node indexList(Node x, Node... indices) {
    checkArgument(indices.length > 1, "Use index() for a single index");
    Node n = new Node(Token.INDEX_LIST, x);
    for (Node index : indices) {
      checkState(mayBeExpression(index), index);
      n.addChildToBack(index);
    }
    return n;
  }

  /** SLICE: [expression, low | EMPTY, high | EMPTY, max | EMPTY] */
  public static Node slice(Node x, @Nullable Node low, @Nullable Node high) {
    return slice(x, low, high, null);
  }

  public static Node slice(Node x, @Nullable Node low, @Nullable Node high, @Nullable Node max) {
    checkState(mayBeExpression(x), x);
    checkArgument(max == null || high != null, "A full slice expression needs a high bound");
    Node n = new Node(Token.SLICE, x, orEmpty(low), orEmpty(high));
    n.addChildToBack(orEmpty(max));
    return n;
  }

  /** TYPE_ASSERT: [expression, type | EMPTY]; an absent type stands for {@code x.(type)}. */
  public static Node typeAssert(Node x, @Nullable Node type) {
    checkState(mayBeExpression(x), x);
    checkState(type == null || mayBeType(type), type);
    return new Node(Token.TYPE_ASSERT, x, orEmpty(type));
  }

  /** CALL: [function, argument...] */
  public static Node call(Node fun, Node... args) {
    checkState(mayBeExpression(fun), fun);
    Node call = new Node(Token.CALL, fun);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  /** A CALL whose last argument is spread with {@code ...}. */
  public static Node variadicCall(Node fun, Node... args) {
    checkArgument(args.length > 0, "Variadic call without arguments");
    return call(fun, args).putBooleanProp(Prop.VARIADIC, true);
  }

  /** STAR: [expression], a pointer type or dereference. */
  public static Node star(Node x) {
    checkState(mayBeExpression(x), x);
    return new Node(Token.STAR, x);
  }

  /** UNARY: [operand] */
  public static Node unary(Operator op, Node x) {
    checkArgument(op.isUnary(), "Not a unary operator: %s", op);
    checkState(mayBeExpression(x), x);
    return new Node(Token.UNARY, x).setOperator(op);
  }

  /** BINARY: [left, right] */
  public static Node binary(Operator op, Node x, Node y) {
    checkArgument(op.isBinary(), "Not a binary operator: %s", op);
    checkState(mayBeExpression(x), x);
    checkState(mayBeExpression(y), y);
    return new Node(Token.BINARY, x, y).setOperator(op);
  }

  // ==========================================================================
  // Statements

  /** EXPR_STMT: [expression] */
  public static Node exprStmt(Node x) {
    checkState(mayBeExpression(x), x);
    return new Node(Token.EXPR_STMT, x);
  }

  /** DECL_STMT: [declaration group] */
  public static Node declStmt(Node decl) {
    checkState(decl.getToken().isDeclarationGroup() && decl.getToken() != Token.IMPORT, decl);
    return new Node(Token.DECL_STMT, decl);
  }

  public static Node emptyStmt() {
    return new Node(Token.EMPTY_STMT);
  }

  /** An EMPTY_STMT standing for a semicolon that is not written out. */
  public static Node implicitEmptyStmt() {
    return emptyStmt().putBooleanProp(Prop.IMPLICIT, true);
  }

  /** LABELED: [NAME label, statement] */
  public static Node labeled(String label, Node stmt) {
    checkState(mayBeStatement(stmt), stmt);
    return new Node(Token.LABELED, name(label), stmt);
  }

  /** SEND: [channel, value] */
  public static Node send(Node channel, Node value) {
    checkState(mayBeExpression(channel), channel);
    checkState(mayBeExpression(value), value);
    return new Node(Token.SEND, channel, value);
  }

  /** INC_DEC: [operand] */
  public static Node incDec(Node x, Operator op) {
    checkArgument(op.isIncDec(), "Not ++ or --: %s", op);
    checkState(mayBeExpression(x), x);
    return new Node(Token.INC_DEC, x).setOperator(op);
  }

  /** ASSIGN: [EXPR_LIST left, EXPR_LIST right] */
  public static Node assign(Operator op, List<Node> lhs, List<Node> rhs) {
    checkArgument(op.isAssignment(), "Not an assignment operator: %s", op);
    checkArgument(!lhs.isEmpty() && !rhs.isEmpty(), "Assignment needs both sides");
    for (Node n : lhs) {
      checkState(mayBeExpression(n), n);
    }
    for (Node n : rhs) {
      checkState(mayBeExpression(n), n);
    }
    return new Node(Token.ASSIGN, exprList(lhs), exprList(rhs)).setOperator(op);
  }

  public static Node assign(Node lhs, Node rhs) {
    return assign(Operator.ASSIGN, ImmutableList.of(lhs), ImmutableList.of(rhs));
  }

  public static Node define(Node lhs, Node rhs) {
    return assign(Operator.DEFINE, ImmutableList.of(lhs), ImmutableList.of(rhs));
  }

  /** GO: [CALL] */
  public static Node goStmt(Node call) {
    checkState(call.getToken() == Token.CALL, call);
    return new Node(Token.GO, call);
  }

  /** DEFER: [CALL] */
  public static Node deferStmt(Node call) {
    checkState(call.getToken() == Token.CALL, call);
    return new Node(Token.DEFER, call);
  }

  /** RETURN: [EXPR_LIST results] */
  public static Node returnStmt(Node... results) {
    for (Node result : results) {
      checkState(mayBeExpression(result), result);
    }
    return new Node(Token.RETURN, exprList(results));
  }

  /** BREAK, CONTINUE or GOTO: [NAME label | EMPTY]; FALLTHROUGH: [EMPTY] */
  public static Node branch(Token kind, @Nullable String label) {
    checkArgument(
        kind == Token.BREAK
            || kind == Token.CONTINUE
            || kind == Token.GOTO
            || kind == Token.FALLTHROUGH,
        kind);
    checkArgument(kind != Token.GOTO || label != null, "goto needs a label");
    checkArgument(kind != Token.FALLTHROUGH || label == null, "fallthrough takes no label");
    return new Node(kind, label == null ? empty() : name(label));
  }

  /** BLOCK: [statement...] */
  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  /** IF: [init | EMPTY, condition, BLOCK, else (IF or BLOCK) | EMPTY] */
  public static Node ifStmt(
      @Nullable Node init, Node cond, Node then, @Nullable Node elseBranch) {
    checkState(init == null || mayBeStatement(init), init);
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    checkState(
        elseBranch == null || elseBranch.isBlock() || elseBranch.getToken() == Token.IF,
        elseBranch);
    Node n = new Node(Token.IF, orEmpty(init), cond, then);
    n.addChildToBack(orEmpty(elseBranch));
    return n;
  }

  public static Node ifStmt(Node cond, Node then) {
    return ifStmt(null, cond, then, null);
  }

  /** FOR: [init | EMPTY, condition | EMPTY, post | EMPTY, BLOCK] */
  public static Node forStmt(
      @Nullable Node init, @Nullable Node cond, @Nullable Node post, Node body) {
    checkState(init == null || mayBeStatement(init), init);
    checkState(cond == null || mayBeExpression(cond), cond);
    checkState(post == null || mayBeStatement(post), post);
    checkState(body.isBlock(), body);
    Node n = new Node(Token.FOR, orEmpty(init), orEmpty(cond), orEmpty(post));
    n.addChildToBack(body);
    return n;
  }

  /**
   * RANGE: [key | EMPTY, value | EMPTY, expression, BLOCK]. The operator is {@code :=} or {@code
   * =} and must be given exactly when a key is.
   */
  public static Node rangeStmt(
      @Nullable Node key, @Nullable Node value, @Nullable Operator op, Node x, Node body) {
    checkArgument((key == null) == (op == null), "Range key and operator go together");
    checkArgument(op == null || op == Operator.DEFINE || op == Operator.ASSIGN, op);
    checkArgument(value == null || key != null, "Range value without key");
    checkState(mayBeExpression(x), x);
    checkState(body.isBlock(), body);
    Node n = new Node(Token.RANGE, orEmpty(key), orEmpty(value), x);
    n.addChildToBack(body);
    n.setOperator(op);
    return n;
  }

  /** SWITCH: [init | EMPTY, tag | EMPTY, BLOCK of CASE] */
  public static Node switchStmt(@Nullable Node init, @Nullable Node tag, Node... clauses) {
    checkState(init == null || mayBeStatement(init), init);
    checkState(tag == null || mayBeExpression(tag), tag);
    return new Node(Token.SWITCH, orEmpty(init), orEmpty(tag), clauses(Token.CASE, clauses));
  }

  /** TYPE_SWITCH: [init | EMPTY, EXPR_STMT or ASSIGN of a type assertion, BLOCK of CASE] */
  public static Node typeSwitch(@Nullable Node init, Node assign, Node... clauses) {
    checkState(init == null || mayBeStatement(init), init);
    checkState(
        assign.getToken() == Token.EXPR_STMT || assign.getToken() == Token.ASSIGN, assign);
    return new Node(Token.TYPE_SWITCH, orEmpty(init), assign, clauses(Token.CASE, clauses));
  }

  /** SELECT: [BLOCK of COMM] */
  public static Node selectStmt(Node... clauses) {
    return new Node(Token.SELECT, clauses(Token.COMM, clauses));
  }

  private static Node clauses(Token kind, Node... clauses) {
    Node body = new Node(Token.BLOCK);
    for (Node clause : clauses) {
      checkState(clause.getToken() == kind, "Expected %s: %s", kind, clause);
      body.addChildToBack(clause);
    }
    return body;
  }

  /** CASE: [EXPR_LIST matches | EMPTY for default, statement...] */
  public static Node caseClause(List<Node> matches, Node... body) {
    checkArgument(!matches.isEmpty(), "Use defaultClause() for a clause without matches");
    return clause(Token.CASE, exprList(matches), body);
  }

  public static Node defaultClause(Node... body) {
    return clause(Token.CASE, empty(), body);
  }

  /** COMM: [SEND, EXPR_STMT or ASSIGN communication | EMPTY for default, statement...] */
  public static Node commClause(Node comm, Node... body) {
    checkState(
        comm.getToken() == Token.SEND
            || comm.getToken() == Token.EXPR_STMT
            || comm.getToken() == Token.ASSIGN,
        comm);
    return clause(Token.COMM, comm, body);
  }

  public static Node commDefault(Node... body) {
    return clause(Token.COMM, empty(), body);
  }

  private static Node clause(Token kind, Node head, Node... body) {
    Node clause = new Node(kind, head);
    for (Node stmt : body) {
      checkState(mayBeStatement(stmt), stmt);
      clause.addChildToBack(stmt);
    }
    return clause;
  }

  /** EXPR_LIST: [element...] */
  public static Node exprList(List<Node> elements) {
    Node list = new Node(Token.EXPR_LIST);
    for (Node element : elements) {
      list.addChildToBack(element);
    }
    return list;
  }

  public static Node exprList(Node... elements) {
    return exprList(ImmutableList.copyOf(elements));
  }

  private static Node orEmpty(@Nullable Node n) {
    return n == null ? empty() : n;
  }

  // ==========================================================================
  // Shape predicates

  public static boolean mayBeDeclaration(Node n) {
    return n.getToken().isDeclarationGroup() || n.getToken() == Token.FUNC_DECL;
  }

  /** It isn't possible to always determine if a detached node is a type, so this is loose. */
  public static boolean mayBeType(Node n) {
    switch (n.getToken()) {
      case NAME:
      case SELECTOR:
      case STAR:
      case PAREN:
      case INDEX:
      case INDEX_LIST:
      case ARRAY_TYPE:
      case STRUCT_TYPE:
      case FUNC_TYPE:
      case INTERFACE_TYPE:
      case MAP_TYPE:
      case CHAN_TYPE:
      case ELLIPSIS:
        return true;
      default:
        return false;
    }
  }

  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case LITERAL:
      case COMPOSITE_LIT:
      case FUNC_LIT:
      case SLICE:
      case TYPE_ASSERT:
      case CALL:
      case UNARY:
      case BINARY:
      case KEY_VALUE:
        return true;
      default:
        return mayBeType(n);
    }
  }

  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case DECL_STMT:
      case EMPTY_STMT:
      case LABELED:
      case EXPR_STMT:
      case SEND:
      case INC_DEC:
      case ASSIGN:
      case GO:
      case DEFER:
      case RETURN:
      case BREAK:
      case CONTINUE:
      case GOTO:
      case FALLTHROUGH:
      case BLOCK:
      case IF:
      case SWITCH:
      case TYPE_SWITCH:
      case SELECT:
      case FOR:
      case RANGE:
        return true;
      default:
        return false;
    }
  }
}
