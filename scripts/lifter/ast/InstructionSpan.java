/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

// Address and raw bytes (hex encoded) of the machine instruction that an AST
// instruction was lifted from.
public class InstructionSpan {
    private final String address;
    private final String bytes;

    public InstructionSpan(String address, String bytes) {
        this.address = address;
        this.bytes = bytes;
    }

    public String getAddress() {
        return address;
    }

    public String getBytes() {
        return bytes;
    }

    @Override
    public String toString() {
        return address + ":" + bytes;
    }
}
