/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

// Addressing mode of an indirect-register operand.
//
//   OFFSET      [Rn, #off]       address Rn + off, Rn unchanged
//   PRE_INDEX   [Rn, #off]!      Rn := Rn + off first, address Rn
//   POST_INDEX  [Rn], #off       address Rn, then Rn := Rn + off
public enum IndexMode {
    OFFSET,
    PRE_INDEX,
    POST_INDEX
};
