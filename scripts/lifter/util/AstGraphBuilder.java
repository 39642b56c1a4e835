/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import ast.*;

import domain.ReachingDefinition;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

// Builds an AstGraph from an AST root. Expression labels show the
// expression's mapping to its low-level counterpart and its reaching
// definitions when the provenance records them.
public class AstGraphBuilder implements AstVisitor<Void> {
    private static final Map<String, String> NODE_COLORS = Map.of(
        "stmt", "#ffcc99",
        "instr", "#99ccff",
        "expr", "#ccff99",
        "cst", "#ffff99",
        "lval", "#ff99cc",
        "var", "#cc99ff",
        "type", "#dddddd");

    private final AstGraph graph;
    private final AstProvenance provenance;
    private final Map<Integer, InstructionSpan> spanMap;

    private AstGraphBuilder(String name, AstProvenance provenance, Map<Integer, InstructionSpan> spanMap) {
        this.graph = new AstGraph(name);
        this.provenance = provenance;
        this.spanMap = spanMap;
    }

    public static AstGraph build(String name, AstNode root, AstInterface astree) {
        return build(name, root, astree.getProvenance(), astree.getSpanMap());
    }

    public static AstGraph build(
            String name, AstNode root, AstProvenance provenance, Map<Integer, InstructionSpan> spanMap) {
        AstGraphBuilder builder = new AstGraphBuilder(name, provenance, spanMap);
        root.accept(builder);
        return builder.graph;
    }

    private void addNode(String nodeName, String label, String kind) {
        graph.addNode(nodeName, label, NODE_COLORS.get(kind));
    }

    // ------------------------------------------------------------------------
    // Node names
    // ------------------------------------------------------------------------

    private static String stmtName(AstStmt stmt) {
        return "stmt:" + stmt.getStmtId();
    }

    private static String instrName(AstInstruction instr) {
        return "instr:" + instr.getInstrId();
    }

    private static String exprName(AstExpr expr) {
        if (expr.isIntegerConstant()) {
            return "int:" + ((AstIntegerConstant) expr).getValue();
        }
        return "expr:" + expr.getExprId();
    }

    private static String lvalName(AstLval lval) {
        return "lval:" + lval.getLvalId();
    }

    private static String lhostName(AstLHost lhost) {
        if (lhost.isVariable()) {
            return "lhost:var:" + ((AstVariable) lhost).getName();
        }
        return "lhost:memref:" + ((AstMemRef) lhost).getMemExp().getExprId();
    }

    private static String offsetName(AstOffset offset) {
        if (offset.isNoOffset()) {
            return "no-offset";
        }
        if (offset instanceof AstFieldOffset) {
            AstFieldOffset field = (AstFieldOffset) offset;
            return "field:" + field.getFieldName() + ":" + field.getCompKey();
        }
        return "index:" + ((AstIndexOffset) offset).getIndexExpr().getExprId();
    }

    private static String typeName(AstTyp typ) {
        return "type:" + AstPrettyPrinter.render(typ);
    }

    private String span(AstInstruction instr) {
        InstructionSpan span = spanMap.get(instr.getLocationId());
        return "\\n" + (span == null ? "?" : span.toString());
    }

    private String connections(AstExpr expr) {
        StringBuilder result = new StringBuilder();
        if (provenance.hasExpressionMapping(expr.getExprId())) {
            result.append("\\nmapped:").append(provenance.getExpressionMapping(expr.getExprId()));
        }
        if (provenance.hasReachingDefinitions(expr.getExprId())) {
            List<ReachingDefinition> rdefs = provenance.getReachingDefinitions(expr.getExprId());
            result.append("\\nrdefs:[")
                .append(rdefs.stream().map(ReachingDefinition::toString).collect(Collectors.joining(",")))
                .append("]");
        }
        return result.toString();
    }

    private void exprNode(AstExpr expr, String label, String kind) {
        addNode(exprName(expr), label + ":" + expr.getExprId() + connections(expr), kind);
    }

    // ------------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------------

    @Override
    public Void visitReturn(AstReturn stmt) {
        String name = stmtName(stmt);
        addNode(name, "return:" + stmt.getStmtId(), "stmt");
        if (stmt.hasReturnValue()) {
            graph.addEdge(name, exprName(stmt.getExpr()));
            stmt.getExpr().accept(this);
        }
        return null;
    }

    @Override
    public Void visitBlock(AstBlock stmt) {
        String name = stmtName(stmt);
        addNode(name, "block:" + stmt.getStmtId(), "stmt");
        for (AstStmt s : stmt.getStmts()) {
            graph.addEdge(name, stmtName(s));
            s.accept(this);
        }
        return null;
    }

    @Override
    public Void visitInstrSequence(AstInstrSequence stmt) {
        String name = stmtName(stmt);
        addNode(name, "instrs:" + stmt.getStmtId(), "stmt");
        for (AstInstruction instr : stmt.getInstructions()) {
            graph.addEdge(name, instrName(instr));
            instr.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBranch(AstBranch stmt) {
        String name = stmtName(stmt);
        addNode(name, "if:" + stmt.getStmtId(), "stmt");
        graph.addEdge(name, stmtName(stmt.getIfStmt()), "then");
        graph.addEdge(name, stmtName(stmt.getElseStmt()), "else");
        graph.addEdge(name, exprName(stmt.getCondition()), "condition");
        stmt.getIfStmt().accept(this);
        stmt.getElseStmt().accept(this);
        stmt.getCondition().accept(this);
        return null;
    }

    @Override
    public Void visitGoto(AstGoto stmt) {
        addNode(stmtName(stmt), "goto:" + stmt.getDestination(), "stmt");
        return null;
    }

    // ------------------------------------------------------------------------
    // Instructions
    // ------------------------------------------------------------------------

    @Override
    public Void visitAssign(AstAssign instr) {
        String name = instrName(instr);
        addNode(name, "assign:" + instr.getInstrId() + span(instr), "instr");
        graph.addEdge(name, lvalName(instr.getLhs()), "lhs");
        graph.addEdge(name, exprName(instr.getRhs()), "rhs");
        instr.getLhs().accept(this);
        instr.getRhs().accept(this);
        return null;
    }

    @Override
    public Void visitCall(AstCall instr) {
        String name = instrName(instr);
        addNode(name, "call:" + instr.getInstrId() + span(instr), "instr");
        if (instr.hasLhs()) {
            graph.addEdge(name, lvalName(instr.getLhs()), "lhs");
            instr.getLhs().accept(this);
        }
        graph.addEdge(name, exprName(instr.getTarget()), "tgt");
        instr.getTarget().accept(this);
        int index = 0;
        for (AstExpr arg : instr.getArguments()) {
            graph.addEdge(name, exprName(arg), "arg" + index++);
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitNop(AstNopInstruction instr) {
        addNode(
            instrName(instr),
            "nop:" + instr.getDescription() + ":" + instr.getInstrId() + span(instr),
            "instr");
        return null;
    }

    // ------------------------------------------------------------------------
    // Lvalues
    // ------------------------------------------------------------------------

    @Override
    public Void visitLval(AstLval lval) {
        String name = lvalName(lval);
        addNode(name, "lval:" + lval.getLvalId(), "lval");
        graph.addEdge(name, lhostName(lval.getLhost()));
        lval.getLhost().accept(this);
        if (!lval.getOffset().isNoOffset()) {
            graph.addEdge(name, offsetName(lval.getOffset()));
            lval.getOffset().accept(this);
        }
        return null;
    }

    @Override
    public Void visitVariable(AstVariable variable) {
        addNode(lhostName(variable), "var:" + variable.getName(), "var");
        return null;
    }

    @Override
    public Void visitMemRef(AstMemRef memref) {
        String name = lhostName(memref);
        addNode(name, "memref", "var");
        graph.addEdge(name, exprName(memref.getMemExp()));
        memref.getMemExp().accept(this);
        return null;
    }

    @Override
    public Void visitNoOffset(AstNoOffset offset) {
        return null;
    }

    @Override
    public Void visitFieldOffset(AstFieldOffset offset) {
        String name = offsetName(offset);
        addNode(name, "fieldoffset:" + offset.getFieldName(), "lval");
        if (!offset.getOffset().isNoOffset()) {
            graph.addEdge(name, offsetName(offset.getOffset()));
            offset.getOffset().accept(this);
        }
        return null;
    }

    @Override
    public Void visitIndexOffset(AstIndexOffset offset) {
        String name = offsetName(offset);
        addNode(name, "indexoffset", "lval");
        graph.addEdge(name, exprName(offset.getIndexExpr()));
        offset.getIndexExpr().accept(this);
        if (!offset.getOffset().isNoOffset()) {
            graph.addEdge(name, offsetName(offset.getOffset()));
            offset.getOffset().accept(this);
        }
        return null;
    }

    // ------------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------------

    @Override
    public Void visitIntegerConstant(AstIntegerConstant expr) {
        addNode(exprName(expr), "int:" + expr.getValue(), "cst");
        return null;
    }

    @Override
    public Void visitGlobalAddress(AstGlobalAddressConstant expr) {
        exprNode(expr, "gaddr:0x" + expr.getValue().toString(16), "cst");
        return null;
    }

    @Override
    public Void visitStringConstant(AstStringConstant expr) {
        exprNode(expr, "string:" + expr.getString(), "cst");
        return null;
    }

    @Override
    public Void visitLvalExpr(AstLvalExpr expr) {
        exprNode(expr, "lvalexpr", "expr");
        graph.addEdge(exprName(expr), lvalName(expr.getLval()));
        expr.getLval().accept(this);
        return null;
    }

    @Override
    public Void visitSubstitutedExpr(AstSubstitutedExpr expr) {
        exprNode(expr, "substituted:" + expr.getAssignId(), "expr");
        graph.addEdge(exprName(expr), lvalName(expr.getLval()), "lval");
        graph.addEdge(exprName(expr), exprName(expr.getSubstitutedExpr()), "expr");
        expr.getLval().accept(this);
        expr.getSubstitutedExpr().accept(this);
        return null;
    }

    @Override
    public Void visitCastExpr(AstCastExpr expr) {
        exprNode(expr, "cast", "expr");
        graph.addEdge(exprName(expr), typeName(expr.getCastType()), "type");
        graph.addEdge(exprName(expr), exprName(expr.getCastExpr()));
        expr.getCastType().accept(this);
        expr.getCastExpr().accept(this);
        return null;
    }

    @Override
    public Void visitUnaryOp(AstUnaryOp expr) {
        exprNode(expr, "unop:" + expr.getOp(), "expr");
        graph.addEdge(exprName(expr), exprName(expr.getExp1()));
        expr.getExp1().accept(this);
        return null;
    }

    @Override
    public Void visitBinaryOp(AstBinaryOp expr) {
        exprNode(expr, "binop:" + expr.getOp(), "expr");
        graph.addEdge(exprName(expr), exprName(expr.getExp1()), "exp1");
        graph.addEdge(exprName(expr), exprName(expr.getExp2()), "exp2");
        expr.getExp1().accept(this);
        expr.getExp2().accept(this);
        return null;
    }

    @Override
    public Void visitQuestion(AstQuestion expr) {
        exprNode(expr, "question", "expr");
        graph.addEdge(exprName(expr), exprName(expr.getExp1()), "cond");
        graph.addEdge(exprName(expr), exprName(expr.getExp2()), "true");
        graph.addEdge(exprName(expr), exprName(expr.getExp3()), "false");
        expr.getExp1().accept(this);
        expr.getExp2().accept(this);
        expr.getExp3().accept(this);
        return null;
    }

    @Override
    public Void visitAddressOf(AstAddressOf expr) {
        exprNode(expr, "addressof", "expr");
        graph.addEdge(exprName(expr), lvalName(expr.getLval()));
        expr.getLval().accept(this);
        return null;
    }

    // ------------------------------------------------------------------------
    // Types and declarations are drawn as leaves.
    // ------------------------------------------------------------------------

    private Void typeLeaf(AstTyp typ) {
        addNode(typeName(typ), AstPrettyPrinter.render(typ), "type");
        return null;
    }

    @Override
    public Void visitVoidType(AstTypVoid typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitIntType(AstTypInt typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitFloatType(AstTypFloat typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitPointerType(AstTypPtr typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitArrayType(AstTypArray typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitFunType(AstTypFun typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitFunArgs(AstFunArgs funargs) {
        return null;
    }

    @Override
    public Void visitFunArg(AstFunArg funarg) {
        return null;
    }

    @Override
    public Void visitNamedType(AstTypNamed typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitCompType(AstTypComp typ) {
        return typeLeaf(typ);
    }

    @Override
    public Void visitVarInfo(AstVarInfo vinfo) {
        addNode("varinfo:" + vinfo.getName(), "varinfo:" + vinfo.getName(), "var");
        return null;
    }

    @Override
    public Void visitFieldInfo(AstFieldInfo finfo) {
        addNode("fieldinfo:" + finfo.getFieldName(), "fieldinfo:" + finfo.getFieldName(), "var");
        return null;
    }

    @Override
    public Void visitCompInfo(AstCompInfo cinfo) {
        addNode("compinfo:" + cinfo.getCompKey(), "compinfo:" + cinfo.getCompName(), "var");
        return null;
    }
}
