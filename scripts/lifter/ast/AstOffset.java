/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public abstract class AstOffset extends AstNode {
    protected AstOffset(String tag) {
        super(tag);
    }

    public boolean isNoOffset() {
        return false;
    }
}
