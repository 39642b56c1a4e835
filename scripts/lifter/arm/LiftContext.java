/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstInterface;

// What a handler needs to lift one instruction: the function's AST builder
// and the resolver for recovered values.
public class LiftContext {
    private final AstInterface astree;
    private final ExpressionResolver resolver;

    public LiftContext(AstInterface astree, ExpressionResolver resolver) {
        this.astree = astree;
        this.resolver = resolver;
    }

    public LiftContext(AstInterface astree) {
        this(astree, new DefaultExpressionResolver());
    }

    public AstInterface getAstree() {
        return astree;
    }

    public ExpressionResolver getResolver() {
        return resolver;
    }
}
