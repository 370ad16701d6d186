package com.openforge.gazetranslate.memory;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped locks serialising writes per owner. Two owners may share a stripe,
 * which only costs throughput; one owner always maps to the same lock.
 */
final class OwnerLocks {

    private final ReentrantLock[] stripes;

    OwnerLocks(int stripeCount) {
        this.stripes = new ReentrantLock[Math.max(1, stripeCount)];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    Lock forOwner(String ownerId) {
        return stripes[Math.floorMod(ownerId.hashCode(), stripes.length)];
    }
}
