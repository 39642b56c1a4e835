/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

// Raised when a decoded record cannot be turned into an opcode: the mnemonic
// is not registered, or the record's tag or argument count does not match
// the opcode's encoding.
public class ArmDecodeException extends RuntimeException {
    public ArmDecodeException(String message) {
        super(message);
    }

    public ArmDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
