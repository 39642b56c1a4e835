/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

// The resolved target of a call instruction.
public class CallTarget {
    private final String name;
    private final Long address;

    public CallTarget(String name, Long address) {
        this.name = name;
        this.address = address;
    }

    public String getName() {
        return name;
    }

    public boolean hasAddress() {
        return address != null;
    }

    public Long getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return name;
    }
}
