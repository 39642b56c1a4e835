/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstExpr;

public class ConditionPair {
    private final AstExpr highLevel;
    private final AstExpr lowLevel;

    public ConditionPair(AstExpr highLevel, AstExpr lowLevel) {
        this.highLevel = highLevel;
        this.lowLevel = lowLevel;
    }

    public AstExpr getHighLevel() {
        return highLevel;
    }

    public AstExpr getLowLevel() {
        return lowLevel;
    }
}
