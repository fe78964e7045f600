package com.codeheadsystems.swapdot.server.model;

import java.time.Instant;

/**
 * Immutable record of one completed ownership change.
 *
 * @param tokenId   the token
 * @param fromOwner previous owner
 * @param toOwner   new owner
 * @param counter   token counter after the change
 * @param timestamp when it committed
 * @param protocol  which flow produced it
 */
public record TransferEvent(
    String tokenId,
    String fromOwner,
    String toOwner,
    long counter,
    Instant timestamp,
    TransferProtocol protocol) {
}
