package com.threadsmith.telegram.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chat sessions keyed by chat id. Idle chats hold no entry.
 */
public class ChatSessionStore {

    private final Map<Long, ChatSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ChatSessionStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public ChatSession find(long chatId) {
        return sessions.getOrDefault(chatId, ChatSession.idle(chatId));
    }

    /**
     * Replaces whatever the chat was doing with a batch waiting for its instruction.
     */
    public ChatSession awaitInstruction(PendingBatch batch) {
        ChatSession session = ChatSession.awaitingInstruction(
                batch.chatId(), batch, clock.instant().plus(ttl));
        sessions.put(batch.chatId(), session);
        return session;
    }

    /**
     * Atomically removes the waiting batch so a follow-up is processed once.
     *
     * @return the batch, or empty when the chat is idle or the batch has expired
     */
    public Optional<PendingBatch> claimPending(long chatId) {
        ChatSession session = sessions.remove(chatId);
        if (session == null || !session.isAwaitingInstruction() || session.isExpiredAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(session.pendingBatch());
    }

    public boolean hasExpiredPending(long chatId) {
        ChatSession session = sessions.get(chatId);
        return session != null && session.isAwaitingInstruction() && session.isExpiredAt(clock.instant());
    }

    public void reset(long chatId) {
        sessions.remove(chatId);
    }

    /**
     * Drops sessions whose batch expired.
     *
     * @return number of sessions removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isExpiredAt(now));
        return before - sessions.size();
    }

    Instant now() {
        return clock.instant();
    }
}
