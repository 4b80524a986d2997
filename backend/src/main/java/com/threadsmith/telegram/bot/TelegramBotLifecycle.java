package com.threadsmith.telegram.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.Objects;

/**
 * Starts long polling once the context is up and stops it on shutdown.
 */
public class TelegramBotLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotLifecycle.class);

    private final TelegramLongPollingBotAdapter longPollingBot;

    private volatile BotSession session;

    public TelegramBotLifecycle(TelegramLongPollingBotAdapter longPollingBot) {
        this.longPollingBot = Objects.requireNonNull(longPollingBot, "longPollingBot");
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        try {
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
            session = botsApi.registerBot(longPollingBot);
            log.info("Telegram bot @{} is polling for updates", longPollingBot.getBotUsername());
        } catch (TelegramApiException ex) {
            throw new IllegalStateException("Failed to register Telegram bot", ex);
        }
    }

    @Override
    public synchronized void stop() {
        if (session == null) {
            return;
        }
        try {
            if (session.isRunning()) {
                session.stop();
            }
        } finally {
            session = null;
            log.info("Telegram bot polling stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return session != null && session.isRunning();
    }
}
