/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import ast.AstExpr;
import ast.AstInstruction;
import ast.AstInterface;
import ast.AstLval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

// An operand of a decoded ARM instruction. Exactly one kind-specific group of
// attributes is populated; asking for an attribute of another kind is a
// programming error and throws IllegalStateException.
public class ArmOperand {
    public static final int WORD_SIZE = 4;

    private static final List<String> WRITEBACK_ANNOTATIONS = List.of("writeback");

    private final OperandKind kind;
    private final int size;

    private final ArmRegister register;
    private final List<ArmRegister> registers;
    private final long value;
    private final long offset;
    private final IndexMode indexMode;

    private ArmOperand(
            OperandKind kind, int size, ArmRegister register,
            List<ArmRegister> registers, long value, long offset,
            IndexMode indexMode) {
        this.kind = kind;
        this.size = size;
        this.register = register;
        this.registers = registers;
        this.value = value;
        this.offset = offset;
        this.indexMode = indexMode;
    }

    public static ArmOperand register(ArmRegister register) {
        return new ArmOperand(
            OperandKind.REGISTER, WORD_SIZE, register, null, 0, 0, null);
    }

    public static ArmOperand indirectRegister(
            ArmRegister register, long offset, IndexMode indexMode, int size) {
        return new ArmOperand(
            OperandKind.INDIRECT_REGISTER, size, register, null, 0, offset, indexMode);
    }

    public static ArmOperand indirectRegister(ArmRegister register, long offset) {
        return indirectRegister(register, offset, IndexMode.OFFSET, WORD_SIZE);
    }

    public static ArmOperand registerList(List<ArmRegister> registers) {
        if (registers.isEmpty()) {
            throw new IllegalArgumentException("Register list must not be empty");
        }
        List<ArmRegister> sorted = new ArrayList<>(registers);
        sorted.sort(Comparator.comparingInt(ArmRegister::getNumber));
        return new ArmOperand(
            OperandKind.REGISTER_LIST, WORD_SIZE * sorted.size(), null,
            Collections.unmodifiableList(sorted), 0, 0, null);
    }

    public static ArmOperand immediate(long value) {
        return new ArmOperand(OperandKind.IMMEDIATE, WORD_SIZE, null, null, value, 0, null);
    }

    public static ArmOperand absolute(long address) {
        return new ArmOperand(OperandKind.ABSOLUTE, WORD_SIZE, null, null, address, 0, null);
    }

    public OperandKind getKind() {
        return kind;
    }

    public int getSize() {
        return size;
    }

    public boolean isRegister() {
        return kind == OperandKind.REGISTER;
    }

    public boolean isIndirectRegister() {
        return kind == OperandKind.INDIRECT_REGISTER;
    }

    public boolean isRegisterList() {
        return kind == OperandKind.REGISTER_LIST;
    }

    public boolean isImmediate() {
        return kind == OperandKind.IMMEDIATE;
    }

    public boolean isAbsolute() {
        return kind == OperandKind.ABSOLUTE;
    }

    private void requireKind(String attribute, OperandKind... kinds) {
        for (OperandKind k : kinds) {
            if (k == kind) {
                return;
            }
        }
        throw new IllegalStateException(
            "Operand " + this + " of kind " + kind + " has no " + attribute);
    }

    public long getValue() {
        requireKind("value", OperandKind.IMMEDIATE, OperandKind.ABSOLUTE);
        return value;
    }

    public ArmRegister getRegister() {
        requireKind("register", OperandKind.REGISTER, OperandKind.INDIRECT_REGISTER);
        return register;
    }

    public List<ArmRegister> getRegisters() {
        requireKind("registers", OperandKind.REGISTER_LIST);
        return registers;
    }

    public long getOffset() {
        requireKind("offset", OperandKind.INDIRECT_REGISTER);
        return offset;
    }

    public IndexMode getIndexMode() {
        requireKind("index mode", OperandKind.INDIRECT_REGISTER);
        return indexMode;
    }

    // Rn := Rn + off, emitted around the access by pre- and post-indexed modes.
    private AstInstruction writeback(AstInterface astree, String iaddr, String bytestring) {
        AstLval lhs = astree.mkVariableLval(register.name());
        AstExpr rhs = astree.mkBinaryOp(
            "plus", astree.mkVariableExpr(register.name()), astree.mkIntegerConstant(offset));
        return astree.mkAssign(lhs, rhs, iaddr, bytestring, WRITEBACK_ANNOTATIONS);
    }

    private AstExpr indirectAddress(AstInterface astree) {
        AstExpr base = astree.mkVariableExpr(register.name());
        if (indexMode != IndexMode.OFFSET || offset == 0) {
            return base;
        }
        return astree.mkBinaryOp("plus", base, astree.mkIntegerConstant(offset));
    }

    private List<AstInstruction> preInstructions(AstInterface astree, String iaddr, String bytestring) {
        if (indexMode == IndexMode.PRE_INDEX) {
            return List.of(writeback(astree, iaddr, bytestring));
        }
        return List.of();
    }

    private List<AstInstruction> postInstructions(AstInterface astree, String iaddr, String bytestring) {
        if (indexMode == IndexMode.POST_INDEX) {
            return List.of(writeback(astree, iaddr, bytestring));
        }
        return List.of();
    }

    public OperandFragment<AstLval> astLvalue(AstInterface astree, String iaddr, String bytestring) {
        switch (kind) {
            case REGISTER:
                return new OperandFragment<>(astree.mkVariableLval(register.name()));
            case INDIRECT_REGISTER:
                return new OperandFragment<>(
                    astree.mkMemRefLval(indirectAddress(astree)),
                    preInstructions(astree, iaddr, bytestring),
                    postInstructions(astree, iaddr, bytestring));
            case ABSOLUTE:
                return new OperandFragment<>(
                    astree.mkMemRefLval(astree.mkIntegerConstant(value)));
            default:
                throw new IllegalStateException("Operand " + this + " cannot be assigned to");
        }
    }

    public OperandFragment<AstExpr> astRvalue(AstInterface astree, String iaddr, String bytestring) {
        switch (kind) {
            case REGISTER:
                return new OperandFragment<>(astree.mkVariableExpr(register.name()));
            case INDIRECT_REGISTER:
                return new OperandFragment<>(
                    astree.mkMemRefExpr(indirectAddress(astree)),
                    preInstructions(astree, iaddr, bytestring),
                    postInstructions(astree, iaddr, bytestring));
            case IMMEDIATE:
                return new OperandFragment<>(astree.mkIntegerConstant(value));
            case ABSOLUTE:
                return new OperandFragment<>(
                    astree.mkMemRefExpr(astree.mkIntegerConstant(value)));
            default:
                throw new IllegalStateException("Operand " + this + " has no value");
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case REGISTER:
                return register.name();
            case INDIRECT_REGISTER:
                if (indexMode == IndexMode.POST_INDEX) {
                    return "[" + register.name() + "], #" + offset;
                }
                String inner = offset == 0
                    ? "[" + register.name() + "]"
                    : "[" + register.name() + ", #" + offset + "]";
                return indexMode == IndexMode.PRE_INDEX ? inner + "!" : inner;
            case REGISTER_LIST:
                return registers.stream().map(Enum::name).collect(Collectors.joining(",", "{", "}"));
            case IMMEDIATE:
                return "#" + value;
            case ABSOLUTE:
                return "0x" + Long.toHexString(value);
            default:
                return kind.name();
        }
    }
}
