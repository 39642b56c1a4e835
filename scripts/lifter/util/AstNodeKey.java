/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import java.util.List;

// Structural identity of a node: its tag list and the ordered identities (or
// literal integers) of its children. Two nodes with equal keys are the same
// node in the serialized table.
public final class AstNodeKey {
    private final List<String> tags;
    private final List<Long> args;

    public AstNodeKey(List<String> tags, List<Long> args) {
        this.tags = List.copyOf(tags);
        this.args = List.copyOf(args);
    }

    public List<String> getTags() {
        return tags;
    }

    public List<Long> getArgs() {
        return args;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof AstNodeKey)) {
            return false;
        }
        AstNodeKey that = (AstNodeKey) other;
        return tags.equals(that.tags) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return 31 * tags.hashCode() + args.hashCode();
    }

    @Override
    public String toString() {
        return tags + "" + args;
    }
}
