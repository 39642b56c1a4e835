/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import domain.InstructionRecord;
import domain.OperandTable;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

// Maps mnemonic tags to the constructors of their handlers.
public class ArmOpcodeRegistry {
    private final Map<String, ArmOpcodeConstructor> constructors = new TreeMap<>();

    public static ArmOpcodeRegistry createDefault() {
        ArmOpcodeRegistry registry = new ArmOpcodeRegistry();
        for (ArmMnemonic mnemonic : ArmMnemonic.values()) {
            registry.register(mnemonic.getTag(), mnemonic.getConstructor());
        }
        return registry;
    }

    public synchronized void register(String tag, ArmOpcodeConstructor constructor) {
        if (constructors.containsKey(tag)) {
            throw new IllegalStateException("Opcode tag registered twice: " + tag);
        }
        constructors.put(tag, constructor);
    }

    public synchronized boolean isRegistered(String tag) {
        return constructors.containsKey(tag);
    }

    public synchronized Set<String> getRegisteredTags() {
        return Collections.unmodifiableSet(new TreeSet<>(constructors.keySet()));
    }

    public ArmOpcode construct(OperandTable operandTable, InstructionRecord record) {
        ArmOpcodeConstructor constructor;
        synchronized (this) {
            constructor = constructors.get(record.getMnemonic());
        }
        if (constructor == null) {
            throw new ArmDecodeException("No handler registered for mnemonic " + record.getMnemonic());
        }
        return constructor.construct(operandTable, record);
    }
}
