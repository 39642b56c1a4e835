/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

// One instruction of a function as delivered upstream: where it is, its
// bytes, its decoded record and the analysis facts computed for it.
public class DecodedInstruction {
    private final String address;
    private final String bytes;
    private final InstructionRecord record;
    private final FactBundle facts;

    public DecodedInstruction(String address, String bytes, InstructionRecord record, FactBundle facts) {
        this.address = address;
        this.bytes = bytes;
        this.record = record;
        this.facts = facts;
    }

    public String getAddress() {
        return address;
    }

    public long getAddressValue() {
        return parseAddress(address);
    }

    public String getBytes() {
        return bytes;
    }

    public InstructionRecord getRecord() {
        return record;
    }

    public FactBundle getFacts() {
        return facts;
    }

    public static long parseAddress(String address) {
        if (address.startsWith("0x") || address.startsWith("0X")) {
            return Long.parseLong(address.substring(2), 16);
        }
        return Long.parseLong(address);
    }
}
