package com.polyfetch.backend.rpc;

import java.math.BigInteger;

/**
 * Finalized account view. Amounts are in yoctoNEAR (10^-24 NEAR).
 */
public record AccountBalance(
        String accountId,
        BigInteger amount,
        BigInteger locked,
        long storageUsage,
        long blockHeight,
        String blockHash
) {
}
