/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

// An instruction carries the location id under which its address and raw
// bytes were recorded in the span map, plus free-form annotations (usually
// the instruction address followed by the mnemonic).
public abstract class AstInstruction extends AstNode {
    private final int instrId;
    private final int locationId;
    private final List<String> annotations;

    protected AstInstruction(String tag, int instrId, int locationId, List<String> annotations) {
        super(tag);
        this.instrId = instrId;
        this.locationId = locationId;
        this.annotations = List.copyOf(annotations);
    }

    public int getInstrId() {
        return instrId;
    }

    public int getLocationId() {
        return locationId;
    }

    public List<String> getAnnotations() {
        return annotations;
    }
}
