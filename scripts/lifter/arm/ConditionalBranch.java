/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import domain.ArmOperand;
import domain.FactBundle;
import domain.XExpr;

import java.util.List;

// Opcodes that transfer control only when a condition holds.
public interface ConditionalBranch {
    // True unless the encoding makes the branch unconditional (B with AL).
    boolean isConditional();

    ArmOperand branchTarget();

    // [false condition, true condition], or empty when the analysis has not
    // supplied both.
    List<XExpr> ftConditions(FactBundle bundle);

    // The branch condition at both levels. With reverse set the condition
    // under which the branch is not taken is returned instead.
    ConditionPair astConditionProv(
        LiftContext context, String iaddr, String bytestring,
        FactBundle bundle, boolean reverse);
}
