/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

// Renders nodes as C-like source text. Statements are rendered one per line,
// indented by nesting depth.
public class AstPrettyPrinter implements AstVisitor<String> {
    public static final Map<String, String> OPERATOR_SYMBOLS = Map.ofEntries(
        Map.entry("plus", "+"),
        Map.entry("minus", "-"),
        Map.entry("mult", "*"),
        Map.entry("div", "/"),
        Map.entry("mod", "%"),
        Map.entry("shiftlt", "<<"),
        Map.entry("shiftrt", ">>"),
        Map.entry("lt", "<"),
        Map.entry("gt", ">"),
        Map.entry("le", "<="),
        Map.entry("ge", ">="),
        Map.entry("eq", "=="),
        Map.entry("ne", "!="),
        Map.entry("band", "&"),
        Map.entry("bor", "|"),
        Map.entry("bxor", "^"),
        Map.entry("land", "&&"),
        Map.entry("lor", "||"),
        Map.entry("neg", "-"),
        Map.entry("bnot", "~"),
        Map.entry("lnot", "!"));

    private static final String INDENT = "  ";

    private int depth = 0;

    public static String render(AstNode node) {
        return node.accept(new AstPrettyPrinter());
    }

    private String indent() {
        return INDENT.repeat(depth);
    }

    private String nested(AstStmt stmt) {
        depth++;
        try {
            return stmt.accept(this);
        } finally {
            depth--;
        }
    }

    private String joinExprs(List<AstExpr> exprs) {
        return exprs.stream().map(e -> e.accept(this)).collect(Collectors.joining(", "));
    }

    // Operands of an operator are parenthesized unless they are atomic.
    private String operand(AstExpr expr) {
        String text = expr.accept(this);
        if (expr instanceof AstBinaryOp || expr instanceof AstQuestion) {
            return "(" + text + ")";
        }
        return text;
    }

    private static String symbol(String op) {
        return OPERATOR_SYMBOLS.getOrDefault(op, op);
    }

    @Override
    public String visitReturn(AstReturn stmt) {
        if (stmt.hasReturnValue()) {
            return indent() + "return " + stmt.getExpr().accept(this) + ";\n";
        }
        return indent() + "return;\n";
    }

    @Override
    public String visitBlock(AstBlock stmt) {
        StringBuilder sb = new StringBuilder();
        for (AstStmt s : stmt.getStmts()) {
            sb.append(s.accept(this));
        }
        return sb.toString();
    }

    @Override
    public String visitInstrSequence(AstInstrSequence stmt) {
        StringBuilder sb = new StringBuilder();
        for (AstInstruction instr : stmt.getInstructions()) {
            sb.append(indent()).append(instr.accept(this)).append(";\n");
        }
        return sb.toString();
    }

    @Override
    public String visitBranch(AstBranch stmt) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent()).append("if (").append(stmt.getCondition().accept(this)).append(") {\n");
        sb.append(nested(stmt.getIfStmt()));
        String elsePart = nested(stmt.getElseStmt());
        if (!elsePart.isEmpty()) {
            sb.append(indent()).append("} else {\n").append(elsePart);
        }
        sb.append(indent()).append("}\n");
        return sb.toString();
    }

    @Override
    public String visitGoto(AstGoto stmt) {
        return indent() + "goto " + stmt.getDestination() + ";\n";
    }

    @Override
    public String visitAssign(AstAssign instr) {
        return instr.getLhs().accept(this) + " = " + instr.getRhs().accept(this);
    }

    @Override
    public String visitCall(AstCall instr) {
        String call = instr.getTarget().accept(this) + "(" + joinExprs(instr.getArguments()) + ")";
        if (instr.hasLhs()) {
            return instr.getLhs().accept(this) + " = " + call;
        }
        return call;
    }

    @Override
    public String visitNop(AstNopInstruction instr) {
        return "/* " + instr.getDescription() + " */";
    }

    @Override
    public String visitLval(AstLval lval) {
        return lval.getLhost().accept(this) + lval.getOffset().accept(this);
    }

    @Override
    public String visitVariable(AstVariable variable) {
        return variable.getName();
    }

    @Override
    public String visitMemRef(AstMemRef memref) {
        return "*" + operand(memref.getMemExp());
    }

    @Override
    public String visitNoOffset(AstNoOffset offset) {
        return "";
    }

    @Override
    public String visitFieldOffset(AstFieldOffset offset) {
        return "." + offset.getFieldName() + offset.getOffset().accept(this);
    }

    @Override
    public String visitIndexOffset(AstIndexOffset offset) {
        return "[" + offset.getIndexExpr().accept(this) + "]" + offset.getOffset().accept(this);
    }

    @Override
    public String visitIntegerConstant(AstIntegerConstant expr) {
        return expr.getValue().toString();
    }

    @Override
    public String visitGlobalAddress(AstGlobalAddressConstant expr) {
        return "0x" + expr.getValue().toString(16);
    }

    @Override
    public String visitStringConstant(AstStringConstant expr) {
        return "\"" + expr.getString() + "\"";
    }

    @Override
    public String visitLvalExpr(AstLvalExpr expr) {
        return expr.getLval().accept(this);
    }

    @Override
    public String visitSubstitutedExpr(AstSubstitutedExpr expr) {
        return expr.getSubstitutedExpr().accept(this);
    }

    @Override
    public String visitCastExpr(AstCastExpr expr) {
        return "(" + expr.getCastType().accept(this) + ")" + operand(expr.getCastExpr());
    }

    @Override
    public String visitUnaryOp(AstUnaryOp expr) {
        return symbol(expr.getOp()) + operand(expr.getExp1());
    }

    @Override
    public String visitBinaryOp(AstBinaryOp expr) {
        return operand(expr.getExp1()) + " " + symbol(expr.getOp()) + " " + operand(expr.getExp2());
    }

    @Override
    public String visitQuestion(AstQuestion expr) {
        return operand(expr.getExp1()) + " ? " + operand(expr.getExp2()) + " : " + operand(expr.getExp3());
    }

    @Override
    public String visitAddressOf(AstAddressOf expr) {
        return "&" + expr.getLval().accept(this);
    }

    @Override
    public String visitVoidType(AstTypVoid typ) {
        return "void";
    }

    @Override
    public String visitIntType(AstTypInt typ) {
        switch (typ.getIkind()) {
            case "ichar": return "char";
            case "ischar": return "signed char";
            case "iuchar": return "unsigned char";
            case "ibool": return "bool";
            case "iint": return "int";
            case "iuint": return "unsigned int";
            case "ishort": return "short";
            case "iushort": return "unsigned short";
            case "ilong": return "long";
            case "iulong": return "unsigned long";
            case "ilonglong": return "long long";
            case "iulonglong": return "unsigned long long";
            default: return typ.getIkind();
        }
    }

    @Override
    public String visitFloatType(AstTypFloat typ) {
        return "longdouble".equals(typ.getFkind()) ? "long double" : typ.getFkind();
    }

    @Override
    public String visitPointerType(AstTypPtr typ) {
        return typ.getTargetType().accept(this) + " *";
    }

    @Override
    public String visitArrayType(AstTypArray typ) {
        String size = typ.hasSizeExpr() ? typ.getSizeExpr().accept(this) : "";
        return typ.getTargetType().accept(this) + "[" + size + "]";
    }

    @Override
    public String visitFunType(AstTypFun typ) {
        String args = typ.getArgTypes() == null ? "" : typ.getArgTypes().accept(this);
        if (typ.isVarArgs()) {
            args = args.isEmpty() ? "..." : args + ", ...";
        }
        return typ.getReturnType().accept(this) + " (" + args + ")";
    }

    @Override
    public String visitFunArgs(AstFunArgs funargs) {
        return funargs.getFunArgs().stream()
            .map(a -> a.accept(this))
            .collect(Collectors.joining(", "));
    }

    @Override
    public String visitFunArg(AstFunArg funarg) {
        return funarg.getArgType().accept(this) + " " + funarg.getArgName();
    }

    @Override
    public String visitNamedType(AstTypNamed typ) {
        return typ.getTypeName();
    }

    @Override
    public String visitCompType(AstTypComp typ) {
        return "struct " + typ.getCompName();
    }

    @Override
    public String visitVarInfo(AstVarInfo vinfo) {
        if (vinfo.getType() == null) {
            return vinfo.getName();
        }
        return vinfo.getType().accept(this) + " " + vinfo.getName();
    }

    @Override
    public String visitFieldInfo(AstFieldInfo finfo) {
        return finfo.getFieldType().accept(this) + " " + finfo.getFieldName();
    }

    @Override
    public String visitCompInfo(AstCompInfo cinfo) {
        StringBuilder sb = new StringBuilder();
        sb.append(cinfo.isUnion() ? "union " : "struct ").append(cinfo.getCompName()).append(" {\n");
        for (AstFieldInfo finfo : cinfo.getFieldInfos()) {
            sb.append(INDENT).append(finfo.accept(this)).append(";\n");
        }
        sb.append("}");
        return sb.toString();
    }
}
