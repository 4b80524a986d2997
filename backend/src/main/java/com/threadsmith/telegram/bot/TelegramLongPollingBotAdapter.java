package com.threadsmith.telegram.bot;

import com.threadsmith.telegram.config.TelegramBotProperties;
import com.threadsmith.telegram.service.TelegramUpdateHandler;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.Objects;

/**
 * Long-polling bot that hands every update to the handler and sends its replies.
 */
public class TelegramLongPollingBotAdapter extends TelegramLongPollingBot {

    private final TelegramBotProperties properties;
    private final TelegramUpdateHandler updateHandler;

    public TelegramLongPollingBotAdapter(
            DefaultBotOptions options,
            TelegramBotProperties properties,
            TelegramUpdateHandler updateHandler) {
        super(options, properties.getBot().getToken());
        this.properties = Objects.requireNonNull(properties, "properties");
        this.updateHandler = Objects.requireNonNull(updateHandler, "updateHandler");
    }

    @Override
    public void onUpdateReceived(Update update) {
        updateHandler.handle(update, this::execute);
    }

    @Override
    public String getBotUsername() {
        return properties.getBot().getUsername();
    }
}
