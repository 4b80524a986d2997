package com.threadsmith.telegram.service;

import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Outbound side of the bot, supplied by the polling adapter.
 */
@FunctionalInterface
public interface BotReplySender {

    void send(SendMessage message) throws TelegramApiException;
}
