package com.threadsmith.telegram.service;

import java.time.Instant;

/**
 * Per-chat conversation state: idle, or holding a scrape until an instruction arrives
 * or {@code expiresAt} passes.
 */
public record ChatSession(
        long chatId,
        State state,
        PendingBatch pendingBatch,
        Instant expiresAt
) {
    public enum State {
        IDLE,
        AWAITING_INSTRUCTION
    }

    public static ChatSession idle(long chatId) {
        return new ChatSession(chatId, State.IDLE, null, null);
    }

    public static ChatSession awaitingInstruction(long chatId, PendingBatch batch, Instant expiresAt) {
        return new ChatSession(chatId, State.AWAITING_INSTRUCTION, batch, expiresAt);
    }

    public boolean isAwaitingInstruction() {
        return state == State.AWAITING_INSTRUCTION;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
