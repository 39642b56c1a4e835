/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

// Reference to a struct or union by key; the layout itself lives in the
// matching AstCompInfo.
public class AstTypComp extends AstTyp {
    private final String compName;
    private final int compKey;

    public AstTypComp(String compName, int compKey) {
        super("comp");
        this.compName = compName;
        this.compKey = compKey;
    }

    public String getCompName() {
        return compName;
    }

    public int getCompKey() {
        return compKey;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCompType(this);
    }
}
