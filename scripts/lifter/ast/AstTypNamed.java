/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstTypNamed extends AstTyp {
    private final String typeName;
    private final AstTyp typeDef;

    public AstTypNamed(String typeName, AstTyp typeDef) {
        super("typdef");
        this.typeName = typeName;
        this.typeDef = typeDef;
    }

    public String getTypeName() {
        return typeName;
    }

    public AstTyp getTypeDef() {
        return typeDef;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNamedType(this);
    }
}
