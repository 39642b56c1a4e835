/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.Set;

public class AstTypFloat extends AstTyp {
    public static final Set<String> FLOAT_KINDS = Set.of("float", "double", "longdouble");

    private final String fkind;

    public AstTypFloat(String fkind) {
        super("float");
        if (!FLOAT_KINDS.contains(fkind)) {
            throw new IllegalArgumentException("Unknown float kind: " + fkind);
        }
        this.fkind = fkind;
    }

    public String getFkind() {
        return fkind;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFloatType(this);
    }
}
