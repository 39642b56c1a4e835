/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.List;

// A decoded instruction: tags[0] is the mnemonic, tags[1] the condition code
// for families that have one. The meaning of each arg is fixed per opcode;
// most are indices into the function's OperandTable.
public class InstructionRecord {
    private final List<String> tags;
    private final List<Integer> args;

    public InstructionRecord(List<String> tags, List<Integer> args) {
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("Instruction record without mnemonic");
        }
        this.tags = List.copyOf(tags);
        this.args = List.copyOf(args);
    }

    public String getMnemonic() {
        return tags.get(0);
    }

    public List<String> getTags() {
        return tags;
    }

    public List<Integer> getArgs() {
        return args;
    }

    public int getArg(int i) {
        return args.get(i);
    }

    @Override
    public String toString() {
        return String.join(",", tags) + ":" + args;
    }
}
