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

// Converts values recovered by the analysis into AST fragments. A single
// recovered value may map to zero, one or several fragments.
public interface ExpressionResolver {
    List<AstLval> toLvals(AstInterface astree, XVariable variable) throws ExpressionConversionException;

    List<AstExpr> toExprs(AstInterface astree, XExpr expr) throws ExpressionConversionException;
}
