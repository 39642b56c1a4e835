/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

// Common root of every node that can appear in a lifted function body or in
// the declarations it references. The tag doubles as the first component of
// the content key used when the node is interned.
public abstract class AstNode {
    private final String tag;

    protected AstNode(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public abstract <R> R accept(AstVisitor<R> visitor);

    @Override
    public String toString() {
        return AstPrettyPrinter.render(this);
    }
}
