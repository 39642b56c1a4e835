/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import ast.AstInstruction;

import java.util.List;

// The AST form of an operand together with the side-effect instructions the
// addressing mode requires before and after the access.
public class OperandFragment<T> {
    private final T node;
    private final List<AstInstruction> preInstructions;
    private final List<AstInstruction> postInstructions;

    public OperandFragment(T node) {
        this(node, List.of(), List.of());
    }

    public OperandFragment(
            T node, List<AstInstruction> preInstructions,
            List<AstInstruction> postInstructions) {
        this.node = node;
        this.preInstructions = List.copyOf(preInstructions);
        this.postInstructions = List.copyOf(postInstructions);
    }

    public T getNode() {
        return node;
    }

    public List<AstInstruction> getPreInstructions() {
        return preInstructions;
    }

    public List<AstInstruction> getPostInstructions() {
        return postInstructions;
    }
}
