/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

// A recovered variable or expression has no AST rendering.
public class ExpressionConversionException extends Exception {
    public ExpressionConversionException(String message) {
        super(message);
    }

    public ExpressionConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
