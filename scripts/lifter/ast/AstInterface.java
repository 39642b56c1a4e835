/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import domain.DefUses;
import domain.ReachingDefinition;

import java.math.BigInteger;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

// Builder for the AST of one function lift. Every node constructed for a
// function goes through one instance of this class, which hands out the
// construction ids, owns the symbol table and the span map, and records the
// provenance between the two levels.
//
// An instance is not shared between lifts; functions lifted concurrently each
// get their own.
public class AstInterface {
    public static final Set<String> BINARY_OPERATORS = Set.of(
        "plus", "minus", "mult", "div", "mod",
        "shiftlt", "shiftrt",
        "lt", "gt", "le", "ge", "eq", "ne",
        "band", "bor", "bxor", "land", "lor");

    public static final Set<String> UNARY_OPERATORS = Set.of("neg", "bnot", "lnot");

    private int nextStmtId = 1;
    private int nextInstrId = 1;
    private int nextExprId = 1;
    private int nextLvalId = 1;
    private int nextLocationId = 1;

    // Variables are shared by name: every reference to "R0" in a function
    // resolves to the same varinfo.
    private final Map<String, AstVarInfo> symbolTable = new LinkedHashMap<>();
    private final Map<Integer, AstCompInfo> compInfos = new TreeMap<>();
    private final Map<String, AstTypInt> integerTypes = new HashMap<>();
    private final Map<Integer, InstructionSpan> spanMap = new TreeMap<>();

    private final AstProvenance provenance = new AstProvenance();
    private final AstNoOffset noOffset = new AstNoOffset();
    private final AstTypVoid voidType = new AstTypVoid();

    public AstProvenance getProvenance() {
        return provenance;
    }

    public Map<Integer, InstructionSpan> getSpanMap() {
        return Collections.unmodifiableMap(spanMap);
    }

    public Map<String, AstVarInfo> getSymbolTable() {
        return Collections.unmodifiableMap(symbolTable);
    }

    public Map<Integer, AstCompInfo> getCompInfos() {
        return Collections.unmodifiableMap(compInfos);
    }

    private int recordSpan(String iaddr, String bytestring) {
        int locationId = nextLocationId++;
        spanMap.put(locationId, new InstructionSpan(iaddr, bytestring));
        return locationId;
    }

    // ------------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------------

    public AstVarInfo mkVarInfo(
            String name, AstTyp type, Integer parameter,
            Long globalAddress, String description) {
        AstVarInfo existing = symbolTable.get(name);
        if (existing != null) {
            return existing;
        }
        AstVarInfo vinfo = new AstVarInfo(name, type, parameter, globalAddress, description);
        symbolTable.put(name, vinfo);
        return vinfo;
    }

    public AstVarInfo mkVarInfo(String name) {
        return mkVarInfo(name, null, null, null, null);
    }

    public boolean hasVarInfo(String name) {
        return symbolTable.containsKey(name);
    }

    public AstFieldInfo mkFieldInfo(String fieldName, AstTyp fieldType, int compKey, int byteOffset) {
        return new AstFieldInfo(fieldName, fieldType, compKey, byteOffset);
    }

    public AstCompInfo mkCompInfo(
            String compName, int compKey, boolean union, List<AstFieldInfo> fieldInfos) {
        if (compInfos.containsKey(compKey)) {
            throw new IllegalStateException(
                "Composite key " + compKey + " is already used by " + compInfos.get(compKey).getCompName());
        }
        AstCompInfo cinfo = new AstCompInfo(compName, compKey, union, fieldInfos);
        compInfos.put(compKey, cinfo);
        return cinfo;
    }

    public AstCompInfo getCompInfo(int compKey) {
        AstCompInfo cinfo = compInfos.get(compKey);
        if (cinfo == null) {
            throw new IllegalArgumentException("No composite with key " + compKey);
        }
        return cinfo;
    }

    // ------------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------------

    public AstTypVoid mkVoidType() {
        return voidType;
    }

    public AstTypInt mkIntType(String ikind) {
        return integerTypes.computeIfAbsent(ikind, AstTypInt::new);
    }

    public AstTypInt mkSignedIntType() {
        return mkIntType("iint");
    }

    public AstTypInt mkUnsignedIntType() {
        return mkIntType("iuint");
    }

    public AstTypFloat mkFloatType(String fkind) {
        return new AstTypFloat(fkind);
    }

    public AstTypPtr mkPointerType(AstTyp targetType) {
        return new AstTypPtr(targetType);
    }

    public AstTypArray mkArrayType(AstTyp targetType, AstExpr sizeExpr) {
        return new AstTypArray(targetType, sizeExpr);
    }

    public AstFunArg mkFunArg(String argName, AstTyp argType) {
        return new AstFunArg(argName, argType);
    }

    public AstTypFun mkFunType(AstTyp returnType, List<AstFunArg> args, boolean varArgs) {
        AstFunArgs funArgs = args == null ? null : new AstFunArgs(args);
        return new AstTypFun(returnType, funArgs, varArgs);
    }

    public AstTypNamed mkNamedType(String typeName, AstTyp typeDef) {
        return new AstTypNamed(typeName, typeDef);
    }

    public AstTypComp mkCompType(int compKey) {
        AstCompInfo cinfo = getCompInfo(compKey);
        return new AstTypComp(cinfo.getCompName(), compKey);
    }

    // ------------------------------------------------------------------------
    // Lvalues
    // ------------------------------------------------------------------------

    public AstNoOffset mkNoOffset() {
        return noOffset;
    }

    public AstFieldOffset mkFieldOffset(String fieldName, int compKey, AstOffset offset) {
        getCompInfo(compKey).getFieldInfo(fieldName);
        return new AstFieldOffset(fieldName, compKey, offset);
    }

    public AstIndexOffset mkIndexOffset(AstExpr indexExpr, AstOffset offset) {
        return new AstIndexOffset(indexExpr, offset);
    }

    public AstLval mkLval(AstLHost lhost, AstOffset offset) {
        return new AstLval(nextLvalId++, lhost, offset);
    }

    public AstVariable mkVariable(String name) {
        return new AstVariable(mkVarInfo(name));
    }

    public AstLval mkVariableLval(String name) {
        return mkLval(mkVariable(name), noOffset);
    }

    public AstLval mkVariableLval(AstVarInfo vinfo) {
        return mkLval(new AstVariable(vinfo), noOffset);
    }

    public AstMemRef mkMemRef(AstExpr memExp) {
        return new AstMemRef(memExp);
    }

    public AstLval mkMemRefLval(AstExpr memExp) {
        return mkLval(mkMemRef(memExp), noOffset);
    }

    public AstLval mkMemRefLval(AstExpr memExp, AstOffset offset) {
        return mkLval(mkMemRef(memExp), offset);
    }

    // ------------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------------

    public AstIntegerConstant mkIntegerConstant(long value) {
        return mkIntegerConstant(BigInteger.valueOf(value));
    }

    public AstIntegerConstant mkIntegerConstant(BigInteger value) {
        return new AstIntegerConstant(nextExprId++, value);
    }

    public AstGlobalAddressConstant mkGlobalAddressConstant(long value, AstExpr addressExpr) {
        return new AstGlobalAddressConstant(nextExprId++, BigInteger.valueOf(value), addressExpr);
    }

    public AstStringConstant mkStringConstant(String cstr, AstExpr addressExpr, String stringAddress) {
        return new AstStringConstant(nextExprId++, cstr, addressExpr, stringAddress);
    }

    public AstLvalExpr mkLvalExpr(AstLval lval) {
        return new AstLvalExpr(nextExprId++, lval);
    }

    public AstLvalExpr mkVariableExpr(String name) {
        return mkLvalExpr(mkVariableLval(name));
    }

    public AstLvalExpr mkMemRefExpr(AstExpr memExp) {
        return mkLvalExpr(mkMemRefLval(memExp));
    }

    public AstSubstitutedExpr mkSubstitutedExpr(AstLval lval, int assignId, AstExpr expr) {
        return new AstSubstitutedExpr(nextExprId++, lval, assignId, expr);
    }

    public AstCastExpr mkCastExpr(AstTyp castType, AstExpr castExpr) {
        return new AstCastExpr(nextExprId++, castType, castExpr);
    }

    public AstUnaryOp mkUnaryOp(String op, AstExpr exp1) {
        if (!UNARY_OPERATORS.contains(op)) {
            throw new IllegalArgumentException("Unknown unary operator: " + op);
        }
        return new AstUnaryOp(nextExprId++, op, exp1);
    }

    public AstBinaryOp mkBinaryOp(String op, AstExpr exp1, AstExpr exp2) {
        if (!BINARY_OPERATORS.contains(op)) {
            throw new IllegalArgumentException("Unknown binary operator: " + op);
        }
        return new AstBinaryOp(nextExprId++, op, exp1, exp2);
    }

    public AstQuestion mkQuestion(AstExpr exp1, AstExpr exp2, AstExpr exp3) {
        return new AstQuestion(nextExprId++, exp1, exp2, exp3);
    }

    public AstAddressOf mkAddressOf(AstLval lval) {
        return new AstAddressOf(nextExprId++, lval);
    }

    // ------------------------------------------------------------------------
    // Instructions
    // ------------------------------------------------------------------------

    public AstAssign mkAssign(
            AstLval lhs, AstExpr rhs, String iaddr, String bytestring,
            List<String> annotations) {
        int locationId = recordSpan(iaddr, bytestring);
        return new AstAssign(nextInstrId++, locationId, lhs, rhs, annotations);
    }

    public AstCall mkCall(
            AstLval lhs, AstExpr target, List<AstExpr> arguments,
            String iaddr, String bytestring, List<String> annotations) {
        int locationId = recordSpan(iaddr, bytestring);
        return new AstCall(nextInstrId++, locationId, lhs, target, arguments, annotations);
    }

    public AstNopInstruction mkNopInstruction(
            String description, String iaddr, String bytestring,
            List<String> annotations) {
        int locationId = recordSpan(iaddr, bytestring);
        return new AstNopInstruction(nextInstrId++, locationId, description, annotations);
    }

    // ------------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------------

    public AstReturn mkReturn(AstExpr expr) {
        return new AstReturn(nextStmtId++, nextLocationId++, expr);
    }

    public AstBlock mkBlock(List<AstStmt> stmts) {
        return new AstBlock(nextStmtId++, nextLocationId++, stmts);
    }

    public AstInstrSequence mkInstrSequence(List<AstInstruction> instructions) {
        return new AstInstrSequence(nextStmtId++, nextLocationId++, instructions);
    }

    public AstBranch mkBranch(
            AstExpr condition, AstStmt ifStmt, AstStmt elseStmt, long relativeOffset) {
        return new AstBranch(
            nextStmtId++, nextLocationId++, condition, ifStmt, elseStmt, relativeOffset);
    }

    public AstGoto mkGoto(String destination) {
        return new AstGoto(nextStmtId++, nextLocationId++, destination);
    }

    // ------------------------------------------------------------------------
    // Provenance
    // ------------------------------------------------------------------------

    public void addInstrMapping(AstInstruction highInstr, AstInstruction lowInstr) {
        provenance.addInstructionMapping(highInstr.getInstrId(), lowInstr.getInstrId());
    }

    public void addInstrAddress(AstInstruction instr, List<String> addresses) {
        provenance.addInstructionAddress(instr.getInstrId(), addresses);
    }

    public void addExprMapping(AstExpr highExpr, AstExpr lowExpr) {
        provenance.addExpressionMapping(highExpr.getExprId(), lowExpr.getExprId());
    }

    public void addLvalMapping(AstLval highLval, AstLval lowLval) {
        provenance.addLvalMapping(highLval.getLvalId(), lowLval.getLvalId());
    }

    public void addExprReachingDefs(AstExpr expr, List<ReachingDefinition> rdefs) {
        provenance.addReachingDefinitions(expr.getExprId(), rdefs);
    }

    public void addLvalDefUses(AstLval lval, DefUses uses) {
        provenance.addLvalDefUses(lval.getLvalId(), uses);
    }

    public void addLvalDefUsesHigh(AstLval lval, DefUses uses) {
        provenance.addLvalDefUsesHigh(lval.getLvalId(), uses);
    }

    public void addConditionAddress(AstExpr condition, List<String> addresses) {
        provenance.addConditionAddress(condition.getExprId(), addresses);
    }
}
