/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstExpr;
import ast.AstInterface;
import ast.AstLval;

import domain.XExpr;
import domain.XVariable;

import java.util.List;

// Structural conversion: variables become variable lvals (globals carry their
// address in the varinfo), constants become integer constants and operators
// map one to one onto AST operators.
public class DefaultExpressionResolver implements ExpressionResolver {
    @Override
    public List<AstLval> toLvals(AstInterface astree, XVariable variable) throws ExpressionConversionException {
        return List.of(lval(astree, variable));
    }

    @Override
    public List<AstExpr> toExprs(AstInterface astree, XExpr expr) throws ExpressionConversionException {
        return List.of(expr(astree, expr));
    }

    private AstLval lval(AstInterface astree, XVariable variable) {
        if (variable.isGlobal()) {
            return astree.mkVariableLval(astree.mkVarInfo(
                variable.getName(), null, null, variable.getGlobalAddress(), "global"));
        }
        return astree.mkVariableLval(variable.getName());
    }

    private AstExpr expr(AstInterface astree, XExpr expr) throws ExpressionConversionException {
        switch (expr.getForm()) {
            case CONSTANT:
                return astree.mkIntegerConstant(expr.getConstant());
            case VARIABLE:
                return astree.mkLvalExpr(lval(astree, expr.getVariable()));
            default:
                break;
        }

        String op = expr.getOperator();
        List<XExpr> operands = expr.getOperands();
        if (operands.size() == 1 && AstInterface.UNARY_OPERATORS.contains(op)) {
            return astree.mkUnaryOp(op, expr(astree, operands.get(0)));
        }
        if (operands.size() == 2 && AstInterface.BINARY_OPERATORS.contains(op)) {
            return astree.mkBinaryOp(op, expr(astree, operands.get(0)), expr(astree, operands.get(1)));
        }
        throw new ExpressionConversionException(
            "No AST operator for " + op + " with " + operands.size() + " operand(s) in " + expr);
    }
}
