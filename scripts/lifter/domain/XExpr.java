/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

// A symbolic value computed by the invariant analysis: a constant, a
// variable, or an operator applied to one or two operands. Operator names
// are the ones the AST uses (plus, minus, ..., lnot).
public class XExpr {
    public enum Form {
        CONSTANT,
        VARIABLE,
        OPERATOR
    }

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
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

    private final Form form;
    private final BigInteger constant;
    private final XVariable variable;
    private final String operator;
    private final List<XExpr> operands;

    private XExpr(Form form, BigInteger constant, XVariable variable, String operator, List<XExpr> operands) {
        this.form = form;
        this.constant = constant;
        this.variable = variable;
        this.operator = operator;
        this.operands = operands;
    }

    public static XExpr constant(long value) {
        return new XExpr(Form.CONSTANT, BigInteger.valueOf(value), null, null, List.of());
    }

    public static XExpr constant(BigInteger value) {
        return new XExpr(Form.CONSTANT, value, null, null, List.of());
    }

    public static XExpr variable(XVariable variable) {
        return new XExpr(Form.VARIABLE, null, variable, null, List.of());
    }

    public static XExpr variable(String name) {
        return variable(new XVariable(name));
    }

    public static XExpr op(String operator, XExpr... operands) {
        if (operands.length < 1 || operands.length > 2) {
            throw new IllegalArgumentException(
                "Operator " + operator + " applied to " + operands.length + " operands");
        }
        return new XExpr(Form.OPERATOR, null, null, operator, List.of(operands));
    }

    public Form getForm() {
        return form;
    }

    public boolean isConstant() {
        return form == Form.CONSTANT;
    }

    public boolean isVariable() {
        return form == Form.VARIABLE;
    }

    public boolean isOperator() {
        return form == Form.OPERATOR;
    }

    public BigInteger getConstant() {
        if (form != Form.CONSTANT) {
            throw new IllegalStateException("Not a constant: " + this);
        }
        return constant;
    }

    public XVariable getVariable() {
        if (form != Form.VARIABLE) {
            throw new IllegalStateException("Not a variable: " + this);
        }
        return variable;
    }

    public String getOperator() {
        if (form != Form.OPERATOR) {
            throw new IllegalStateException("Not an operator expression: " + this);
        }
        return operator;
    }

    public List<XExpr> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof XExpr)) {
            return false;
        }
        XExpr that = (XExpr) other;
        return form == that.form
            && Objects.equals(constant, that.constant)
            && Objects.equals(variable, that.variable)
            && Objects.equals(operator, that.operator)
            && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(form, constant, variable, operator, operands);
    }

    @Override
    public String toString() {
        switch (form) {
            case CONSTANT:
                return constant.toString();
            case VARIABLE:
                return variable.toString();
            default:
                String sym = SYMBOLS.getOrDefault(operator, operator);
                if (operands.size() == 1) {
                    return sym + operands.get(0);
                }
                return "(" + operands.get(0) + " " + sym + " " + operands.get(1) + ")";
        }
    }
}
