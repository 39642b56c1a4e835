/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import ast.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// Interns every node reachable from the visited root into an AstNodeTable
// and returns the root's identity. Statements and instructions carry their
// construction id among their args, so each occurrence stays distinct;
// expressions, lvals and types do not, so equal ones collapse into one
// record.
public class AstSerializer implements AstVisitor<Integer> {
    private final AstNodeTable table;

    // construction id -> node identity
    private final Map<Integer, Integer> instructionIndices = new TreeMap<>();
    private final Map<Integer, Integer> expressionIndices = new TreeMap<>();
    private final Map<Integer, Integer> lvalIndices = new TreeMap<>();

    public AstSerializer(AstNodeTable table) {
        this.table = table;
    }

    public AstSerializer() {
        this(new AstNodeTable());
    }

    public AstNodeTable getTable() {
        return table;
    }

    public List<JsonObject> records() {
        return table.records();
    }

    public int index(AstNode node) {
        return (int) idx(node);
    }

    public Map<Integer, Integer> getInstructionIndices() {
        return Collections.unmodifiableMap(instructionIndices);
    }

    public Map<Integer, Integer> getExpressionIndices() {
        return Collections.unmodifiableMap(expressionIndices);
    }

    public Map<Integer, Integer> getLvalIndices() {
        return Collections.unmodifiableMap(lvalIndices);
    }

    private static List<String> tags(String... tags) {
        return new ArrayList<>(Arrays.asList(tags));
    }

    private static JsonObject node(String tag) {
        JsonObject node = new JsonObject();
        node.addProperty("tag", tag);
        return node;
    }

    private int add(List<String> tags, List<Long> args, JsonObject node) {
        JsonArray jsonArgs = new JsonArray();
        for (Long arg : args) {
            jsonArgs.add(arg);
        }
        node.add("args", jsonArgs);
        return table.intern(new AstNodeKey(tags, args), node);
    }

    private long idx(AstNode node) {
        int id = node.accept(this);
        if (node instanceof AstInstruction) {
            instructionIndices.put(((AstInstruction) node).getInstrId(), id);
        } else if (node instanceof AstExpr) {
            expressionIndices.put(((AstExpr) node).getExprId(), id);
        } else if (node instanceof AstLval) {
            lvalIndices.put(((AstLval) node).getLvalId(), id);
        }
        return id;
    }

    // ------------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------------

    @Override
    public Integer visitReturn(AstReturn stmt) {
        List<Long> args = new ArrayList<>();
        args.add((long) stmt.getStmtId());
        if (stmt.hasReturnValue()) {
            args.add(idx(stmt.getExpr()));
        }
        return add(tags(stmt.getTag()), args, node(stmt.getTag()));
    }

    @Override
    public Integer visitBlock(AstBlock stmt) {
        List<Long> args = new ArrayList<>();
        args.add((long) stmt.getStmtId());
        for (AstStmt s : stmt.getStmts()) {
            args.add(idx(s));
        }
        return add(tags(stmt.getTag()), args, node(stmt.getTag()));
    }

    @Override
    public Integer visitInstrSequence(AstInstrSequence stmt) {
        List<Long> args = new ArrayList<>();
        args.add((long) stmt.getStmtId());
        for (AstInstruction instr : stmt.getInstructions()) {
            args.add(idx(instr));
        }
        return add(tags(stmt.getTag()), args, node(stmt.getTag()));
    }

    @Override
    public Integer visitBranch(AstBranch stmt) {
        List<Long> args = new ArrayList<>();
        args.add((long) stmt.getStmtId());
        args.add(idx(stmt.getCondition()));
        args.add(idx(stmt.getIfStmt()));
        args.add(idx(stmt.getElseStmt()));
        JsonObject node = node(stmt.getTag());
        node.addProperty("pc-offset", stmt.getRelativeOffset());
        return add(tags(stmt.getTag(), String.valueOf(stmt.getRelativeOffset())), args, node);
    }

    @Override
    public Integer visitGoto(AstGoto stmt) {
        List<Long> args = new ArrayList<>();
        args.add((long) stmt.getStmtId());
        JsonObject node = node(stmt.getTag());
        node.addProperty("destination", stmt.getDestination());
        return add(tags(stmt.getTag(), stmt.getDestination()), args, node);
    }

    // ------------------------------------------------------------------------
    // Instructions
    // ------------------------------------------------------------------------

    @Override
    public Integer visitAssign(AstAssign instr) {
        List<Long> args = new ArrayList<>();
        args.add((long) instr.getInstrId());
        args.add(idx(instr.getLhs()));
        args.add(idx(instr.getRhs()));
        return add(tags(instr.getTag()), args, node(instr.getTag()));
    }

    @Override
    public Integer visitCall(AstCall instr) {
        List<Long> args = new ArrayList<>();
        args.add((long) instr.getInstrId());
        args.add(instr.hasLhs() ? idx(instr.getLhs()) : -1L);
        args.add(idx(instr.getTarget()));
        for (AstExpr arg : instr.getArguments()) {
            args.add(idx(arg));
        }
        return add(tags(instr.getTag()), args, node(instr.getTag()));
    }

    @Override
    public Integer visitNop(AstNopInstruction instr) {
        List<Long> args = new ArrayList<>();
        args.add((long) instr.getInstrId());
        JsonObject node = node(instr.getTag());
        node.addProperty("descr", instr.getDescription());
        return add(tags(instr.getTag(), instr.getDescription()), args, node);
    }

    // ------------------------------------------------------------------------
    // Lvalues
    // ------------------------------------------------------------------------

    @Override
    public Integer visitLval(AstLval lval) {
        List<Long> args = List.of(idx(lval.getLhost()), idx(lval.getOffset()));
        return add(tags(lval.getTag()), args, node(lval.getTag()));
    }

    @Override
    public Integer visitVariable(AstVariable variable) {
        JsonObject node = node(variable.getTag());
        node.addProperty("name", variable.getName());
        return add(tags(variable.getTag(), variable.getName()), List.of(), node);
    }

    @Override
    public Integer visitMemRef(AstMemRef memref) {
        return add(tags(memref.getTag()), List.of(idx(memref.getMemExp())), node(memref.getTag()));
    }

    @Override
    public Integer visitNoOffset(AstNoOffset offset) {
        return add(tags(offset.getTag()), List.of(), node(offset.getTag()));
    }

    @Override
    public Integer visitFieldOffset(AstFieldOffset offset) {
        JsonObject node = node(offset.getTag());
        node.addProperty("fname", offset.getFieldName());
        List<Long> args = List.of((long) offset.getCompKey(), idx(offset.getOffset()));
        return add(tags(offset.getTag(), offset.getFieldName()), args, node);
    }

    @Override
    public Integer visitIndexOffset(AstIndexOffset offset) {
        List<Long> args = List.of(idx(offset.getIndexExpr()), idx(offset.getOffset()));
        return add(tags(offset.getTag()), args, node(offset.getTag()));
    }

    // ------------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------------

    @Override
    public Integer visitIntegerConstant(AstIntegerConstant expr) {
        String value = expr.getValue().toString();
        JsonObject node = node(expr.getTag());
        node.addProperty("value", value);
        return add(tags(expr.getTag(), value), List.of(), node);
    }

    @Override
    public Integer visitGlobalAddress(AstGlobalAddressConstant expr) {
        String value = expr.getValue().toString();
        JsonObject node = node(expr.getTag());
        node.addProperty("value", value);
        return add(tags(expr.getTag(), value), List.of(idx(expr.getAddressExpr())), node);
    }

    @Override
    public Integer visitStringConstant(AstStringConstant expr) {
        List<String> tags = tags(expr.getTag(), expr.getString());
        List<Long> args = new ArrayList<>();
        JsonObject node = node(expr.getTag());
        node.addProperty("cstr", expr.getString());
        if (expr.getAddressExpr() != null) {
            args.add(idx(expr.getAddressExpr()));
        }
        if (expr.getStringAddress() != null) {
            tags.add(expr.getStringAddress());
            node.addProperty("va", expr.getStringAddress());
        }
        return add(tags, args, node);
    }

    @Override
    public Integer visitLvalExpr(AstLvalExpr expr) {
        return add(tags(expr.getTag()), List.of(idx(expr.getLval())), node(expr.getTag()));
    }

    @Override
    public Integer visitSubstitutedExpr(AstSubstitutedExpr expr) {
        String assigned = String.valueOf(expr.getAssignId());
        JsonObject node = node(expr.getTag());
        node.addProperty("assigned", assigned);
        List<Long> args = List.of(idx(expr.getLval()), idx(expr.getSubstitutedExpr()));
        return add(tags(expr.getTag(), assigned), args, node);
    }

    @Override
    public Integer visitCastExpr(AstCastExpr expr) {
        List<Long> args = List.of(idx(expr.getCastType()), idx(expr.getCastExpr()));
        return add(tags(expr.getTag()), args, node(expr.getTag()));
    }

    @Override
    public Integer visitUnaryOp(AstUnaryOp expr) {
        JsonObject node = node(expr.getTag());
        node.addProperty("op", expr.getOp());
        return add(tags(expr.getTag(), expr.getOp()), List.of(idx(expr.getExp1())), node);
    }

    @Override
    public Integer visitBinaryOp(AstBinaryOp expr) {
        JsonObject node = node(expr.getTag());
        node.addProperty("op", expr.getOp());
        List<Long> args = List.of(idx(expr.getExp1()), idx(expr.getExp2()));
        return add(tags(expr.getTag(), expr.getOp()), args, node);
    }

    @Override
    public Integer visitQuestion(AstQuestion expr) {
        List<Long> args = List.of(idx(expr.getExp1()), idx(expr.getExp2()), idx(expr.getExp3()));
        return add(tags(expr.getTag()), args, node(expr.getTag()));
    }

    @Override
    public Integer visitAddressOf(AstAddressOf expr) {
        return add(tags(expr.getTag()), List.of(idx(expr.getLval())), node(expr.getTag()));
    }

    // ------------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------------

    @Override
    public Integer visitVoidType(AstTypVoid typ) {
        return add(tags(typ.getTag()), List.of(), node(typ.getTag()));
    }

    @Override
    public Integer visitIntType(AstTypInt typ) {
        JsonObject node = node(typ.getTag());
        node.addProperty("ikind", typ.getIkind());
        return add(tags(typ.getTag(), typ.getIkind()), List.of(), node);
    }

    @Override
    public Integer visitFloatType(AstTypFloat typ) {
        JsonObject node = node(typ.getTag());
        node.addProperty("fkind", typ.getFkind());
        return add(tags(typ.getTag(), typ.getFkind()), List.of(), node);
    }

    @Override
    public Integer visitPointerType(AstTypPtr typ) {
        return add(tags(typ.getTag()), List.of(idx(typ.getTargetType())), node(typ.getTag()));
    }

    @Override
    public Integer visitArrayType(AstTypArray typ) {
        List<Long> args = new ArrayList<>();
        args.add(idx(typ.getTargetType()));
        if (typ.hasSizeExpr()) {
            args.add(idx(typ.getSizeExpr()));
        }
        return add(tags(typ.getTag()), args, node(typ.getTag()));
    }

    @Override
    public Integer visitFunType(AstTypFun typ) {
        List<Long> args = new ArrayList<>();
        args.add(idx(typ.getReturnType()));
        if (typ.getArgTypes() != null) {
            args.add(idx(typ.getArgTypes()));
        }
        return add(tags(typ.getTag()), args, node(typ.getTag()));
    }

    @Override
    public Integer visitFunArgs(AstFunArgs funargs) {
        List<Long> args = new ArrayList<>();
        for (AstFunArg arg : funargs.getFunArgs()) {
            args.add(idx(arg));
        }
        return add(tags(funargs.getTag()), args, node(funargs.getTag()));
    }

    @Override
    public Integer visitFunArg(AstFunArg funarg) {
        JsonObject node = node(funarg.getTag());
        node.addProperty("name", funarg.getArgName());
        return add(tags(funarg.getTag(), funarg.getArgName()), List.of(idx(funarg.getArgType())), node);
    }

    @Override
    public Integer visitNamedType(AstTypNamed typ) {
        JsonObject node = node(typ.getTag());
        node.addProperty("name", typ.getTypeName());
        return add(tags(typ.getTag(), typ.getTypeName()), List.of(idx(typ.getTypeDef())), node);
    }

    @Override
    public Integer visitCompType(AstTypComp typ) {
        JsonObject node = node(typ.getTag());
        node.addProperty("cname", typ.getCompName());
        return add(tags(typ.getTag(), typ.getCompName()), List.of((long) typ.getCompKey()), node);
    }

    // ------------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------------

    @Override
    public Integer visitVarInfo(AstVarInfo vinfo) {
        JsonObject node = node(vinfo.getTag());
        node.addProperty("name", vinfo.getName());
        List<Long> args = new ArrayList<>();
        args.add(vinfo.getType() != null ? idx(vinfo.getType()) : -1L);
        args.add(vinfo.getParameter() != null ? (long) vinfo.getParameter() : -1L);
        args.add(vinfo.getGlobalAddress() != null ? vinfo.getGlobalAddress() : -1L);
        if (vinfo.getDescription() != null) {
            node.addProperty("descr", vinfo.getDescription());
        }
        return add(tags(vinfo.getTag(), vinfo.getName()), args, node);
    }

    @Override
    public Integer visitFieldInfo(AstFieldInfo finfo) {
        JsonObject node = node(finfo.getTag());
        node.addProperty("name", finfo.getFieldName());
        List<Long> args = List.of(idx(finfo.getFieldType()), (long) finfo.getCompKey());
        return add(tags(finfo.getTag(), finfo.getFieldName()), args, node);
    }

    @Override
    public Integer visitCompInfo(AstCompInfo cinfo) {
        JsonObject node = node(cinfo.getTag());
        node.addProperty("name", cinfo.getCompName());
        List<Long> args = new ArrayList<>();
        args.add((long) cinfo.getCompKey());
        args.add(cinfo.isUnion() ? 1L : 0L);
        for (AstFieldInfo finfo : cinfo.getFieldInfos()) {
            args.add(idx(finfo));
        }
        return add(tags(cinfo.getTag(), cinfo.getCompName()), args, node);
    }
}
