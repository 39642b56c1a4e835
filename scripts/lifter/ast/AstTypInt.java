/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.Set;

public class AstTypInt extends AstTyp {
    public static final Set<String> INTEGER_KINDS = Set.of(
        "ichar", "ischar", "iuchar", "ibool",
        "iint", "iuint", "ishort", "iushort",
        "ilong", "iulong", "ilonglong", "iulonglong");

    private final String ikind;

    public AstTypInt(String ikind) {
        super("int");
        if (!INTEGER_KINDS.contains(ikind)) {
            throw new IllegalArgumentException("Unknown integer kind: " + ikind);
        }
        this.ikind = ikind;
    }

    public String getIkind() {
        return ikind;
    }

    public boolean isUnsigned() {
        return ikind.startsWith("iu");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIntType(this);
    }
}
