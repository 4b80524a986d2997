package com.threadsmith.telegram.service;

/**
 * The parts of a Telegram text message the scraper bot acts on.
 */
public record IncomingChatMessage(
        long chatId,
        long userId,
        String username,
        String firstName,
        String text
) {
}
