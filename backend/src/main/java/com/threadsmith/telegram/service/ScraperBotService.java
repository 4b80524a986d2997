package com.threadsmith.telegram.service;

import com.threadsmith.config.ThreadsmithRuntimeProperties;
import com.threadsmith.model.RedditItem;
import com.threadsmith.model.RewriteResult;
import com.threadsmith.provider.WorkflowPayload;
import com.threadsmith.provider.WorkflowWebhookClient;
import com.threadsmith.service.PersonalityStore;
import com.threadsmith.service.PostFetchService;
import com.threadsmith.service.RateLimiter;
import com.threadsmith.service.TitleEnhancementService;
import com.threadsmith.telegram.config.TelegramBotProperties;
import com.threadsmith.web.RequestValidationException;
import com.threadsmith.web.SubredditNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Chat front end: {@code /scrape} fetches and previews posts, the next plain message is
 * the rewrite instruction (or {@code skip}) for that batch.
 */
public class ScraperBotService implements TelegramUpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(ScraperBotService.class);

    static final String SKIP = "skip";
    static final int MAX_MESSAGE_LENGTH = 3500;
    static final String GLOBAL_SEND_KEY = "send:global";

    static final String WELCOME = """
            👋 Welcome to Reddit Scraper!

            Use /scrape to fetch Reddit posts.
            Example: `/scrape python 10 top week`""";
    static final String HELP = """
            ℹ️ *Commands*

            `/scrape <subreddit> <limit> <sort> <time_filter>`
            • limit: 1-50
            • sort: hot, new, top, rising
            • time\\_filter: hour, day, week, month, year, all

            After the preview, reply with rewrite instructions (e.g. "Make them more clickbait") or `skip` to keep the originals.""";
    static final String USAGE = """
            🤔 I need more info to scrape Reddit!

            💡 Try: `/scrape python 10 top week`

            Format: /scrape [subreddit] [limit] [sort] [time_filter]""";
    static final String INVALID_LIMIT = "❌ Invalid number. Use 1-50.";
    static final String ASK_FOR_INSTRUCTION = """
            🤖 Would you like to rewrite these titles with AI?

            Reply with instructions (e.g., 'Make them more clickbait')
            or type 'skip' to keep originals.""";
    static final String SESSION_EXPIRED = "⌛ That scrape has expired. Run /scrape again.";
    static final String NOTHING_PENDING = "💡 Use /scrape to fetch posts first, or /help for usage.";
    static final String UNKNOWN_COMMAND = "🤷 Unknown command. Try /help.";
    static final String KEEPING_ORIGINALS = "✅ Keeping the original titles.";
    static final String WORKFLOW_SENDING = "📤 Sending to workflow...";
    static final String WORKFLOW_DEFAULT_REPLY = "Processing complete!";
    static final String WORKFLOW_FAILED = "⚠️ Error sending to workflow. Please try again later.";
    static final String UNEXPECTED_ERROR = "⚠️ Something went wrong. Please try again later.";

    private final TelegramBotProperties properties;
    private final ThreadsmithRuntimeProperties runtimeProperties;
    private final ChatSessionStore sessionStore;
    private final PostFetchService postFetchService;
    private final TitleEnhancementService titleEnhancementService;
    private final PersonalityStore personalityStore;
    private final WorkflowWebhookClient workflowWebhookClient;
    private final RateLimiter rateLimiter;

    public ScraperBotService(
            TelegramBotProperties properties,
            ThreadsmithRuntimeProperties runtimeProperties,
            ChatSessionStore sessionStore,
            PostFetchService postFetchService,
            TitleEnhancementService titleEnhancementService,
            PersonalityStore personalityStore,
            WorkflowWebhookClient workflowWebhookClient,
            RateLimiter rateLimiter) {
        this.properties = properties;
        this.runtimeProperties = runtimeProperties;
        this.sessionStore = sessionStore;
        this.postFetchService = postFetchService;
        this.titleEnhancementService = titleEnhancementService;
        this.personalityStore = personalityStore;
        this.workflowWebhookClient = workflowWebhookClient;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public void handle(Update update, BotReplySender replies) {
        if (update == null || !update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }
        Message message = update.getMessage();
        User from = message.getFrom();
        handleMessage(new IncomingChatMessage(
                message.getChatId(),
                from != null ? from.getId() : message.getChatId(),
                from != null ? from.getUserName() : null,
                from != null ? from.getFirstName() : null,
                message.getText()
        ), replies);
    }

    void handleMessage(IncomingChatMessage message, BotReplySender replies) {
        try {
            String text = message.text().strip();
            if (text.startsWith("/")) {
                handleCommand(message, text, replies);
            } else {
                handleInstruction(message, text, replies);
            }
        } catch (RuntimeException ex) {
            log.error("Failed to handle message in chat {}", message.chatId(), ex);
            reply(replies, message.chatId(), UNEXPECTED_ERROR, null);
        }
    }

    private void handleCommand(IncomingChatMessage message, String text, BotReplySender replies) {
        String[] parts = text.split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        log.info("Command {} from user {} in chat {}", command, message.userId(), message.chatId());

        switch (command) {
            case "/start" -> {
                sessionStore.reset(message.chatId());
                reply(replies, message.chatId(), WELCOME, ParseMode.MARKDOWN);
            }
            case "/help" -> reply(replies, message.chatId(), HELP, ParseMode.MARKDOWN);
            case "/scrape" -> handleScrape(message, parts, replies);
            default -> reply(replies, message.chatId(), UNKNOWN_COMMAND, null);
        }
    }

    private void handleScrape(IncomingChatMessage message, String[] parts, BotReplySender replies) {
        long chatId = message.chatId();
        if (!isAllowed(message.userId())) {
            log.warn("Denied /scrape for user {}", message.userId());
            reply(replies, chatId, "❌ Access denied. Please contact "
                    + properties.getAccessDeniedContact() + " to request access.", null);
            return;
        }
        if (parts.length < 5) {
            reply(replies, chatId, USAGE, ParseMode.MARKDOWN);
            return;
        }

        String subreddit = parts[1];
        int limit;
        try {
            limit = Integer.parseInt(parts[2]);
        } catch (NumberFormatException ex) {
            reply(replies, chatId, INVALID_LIMIT, null);
            return;
        }
        if (limit < 1) {
            reply(replies, chatId, INVALID_LIMIT, null);
            return;
        }
        int perMinute = runtimeProperties.getRateLimit().getScrapesPerUserPerMinute();
        if (!rateLimiter.tryAcquire("scrape:" + message.userId(), perMinute, Duration.ofMinutes(1))) {
            reply(replies, chatId, "⏳ Slow down! You can run " + perMinute + " scrapes per minute.", null);
            return;
        }
        limit = Math.min(limit, 50);
        String sort = parts[3].toLowerCase(Locale.ROOT);
        String timeFilter = parts[4].toLowerCase(Locale.ROOT);

        int evicted = sessionStore.evictExpired();
        if (evicted > 0) {
            log.debug("Evicted {} expired chat sessions", evicted);
        }
        personalityStore.getOrCreateUser(message.userId(), message.username(), message.firstName());

        String safeSubreddit = HtmlUtils.htmlEscape(subreddit);
        reply(replies, chatId, "🔍 <b>Scraping r/" + safeSubreddit + "...</b>\n"
                + "📊 Fetching " + limit + " " + HtmlUtils.htmlEscape(sort) + " posts...", ParseMode.HTML);

        List<RedditItem> posts;
        try {
            posts = postFetchService.fetch(subreddit, sort, timeFilter, limit);
        } catch (SubredditNotFoundException ex) {
            reply(replies, chatId, "❌ r/" + subreddit + " doesn't exist or is private.", null);
            return;
        } catch (RequestValidationException ex) {
            reply(replies, chatId, "❌ " + ex.getMessage(), null);
            return;
        } catch (RuntimeException ex) {
            log.warn("Scrape of r/{} for chat {} failed: {}", subreddit, chatId, ex.toString());
            reply(replies, chatId, "❌ Error scraping r/" + subreddit + "\nPlease try again later.", null);
            return;
        }
        if (posts.isEmpty()) {
            reply(replies, chatId, "❌ No posts found in r/" + subreddit, null);
            return;
        }

        reply(replies, chatId, preview(posts), ParseMode.HTML);
        reply(replies, chatId, ASK_FOR_INSTRUCTION, null);
        sessionStore.awaitInstruction(new PendingBatch(
                message.userId(), chatId, subreddit, sort, timeFilter, posts, sessionStore.now()));
    }

    private void handleInstruction(IncomingChatMessage message, String text, BotReplySender replies) {
        long chatId = message.chatId();
        boolean expired = sessionStore.hasExpiredPending(chatId);
        Optional<PendingBatch> pending = sessionStore.claimPending(chatId);
        if (pending.isEmpty()) {
            reply(replies, chatId, expired ? SESSION_EXPIRED : NOTHING_PENDING, null);
            return;
        }

        PendingBatch batch = pending.get();
        boolean skip = SKIP.equalsIgnoreCase(text);
        if (workflowWebhookClient.isConfigured()) {
            forwardToWorkflow(batch, skip ? null : text, replies);
        } else if (skip) {
            reply(replies, chatId, KEEPING_ORIGINALS, null);
        } else {
            rewriteInProcess(batch, text, replies);
        }
    }

    private void forwardToWorkflow(PendingBatch batch, String instruction, BotReplySender replies) {
        reply(replies, batch.chatId(), WORKFLOW_SENDING, null);
        WorkflowPayload payload = new WorkflowPayload(
                batch.telegramId(),
                batch.chatId(),
                batch.subreddit(),
                batch.posts(),
                new WorkflowPayload.Metadata(
                        batch.sortType(),
                        batch.timeFilter(),
                        batch.posts().size(),
                        batch.scrapedAt().toString()),
                instruction != null,
                instruction
        );
        try {
            String answer = workflowWebhookClient.send(payload).orElse(WORKFLOW_DEFAULT_REPLY);
            reply(replies, batch.chatId(), "✅ " + answer, null);
        } catch (RuntimeException ex) {
            log.warn("Workflow delivery for chat {} failed: {}", batch.chatId(), ex.toString());
            reply(replies, batch.chatId(), WORKFLOW_FAILED, null);
        }
    }

    private void rewriteInProcess(PendingBatch batch, String instruction, BotReplySender replies) {
        reply(replies, batch.chatId(), "🤖 Rewriting " + batch.posts().size() + " titles...", null);
        List<String> titles = batch.posts().stream().map(RedditItem::title).toList();
        List<RewriteResult> results = titleEnhancementService.rewriteTitles(titles, instruction);

        List<String> lines = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            RewriteResult result = results.get(i);
            String line = (i + 1) + ". " + HtmlUtils.htmlEscape(result.rewrittenText());
            if (result.failed()) {
                line += " <i>(original kept)</i>";
            }
            lines.add(line);
        }
        for (String chunk : chunk("✨ <b>Rewritten titles</b>\n\n", lines)) {
            reply(replies, batch.chatId(), chunk, ParseMode.HTML);
        }
    }

    String preview(List<RedditItem> posts) {
        int size = properties.getPreviewSize();
        int maxLength = properties.getPreviewTitleLength();
        StringBuilder preview = new StringBuilder("✅ <b>Successfully scraped!</b>\n\n<b>Preview:</b>\n");
        for (int i = 0; i < Math.min(size, posts.size()); i++) {
            String title = posts.get(i).title();
            String shortened = title.length() > maxLength ? title.substring(0, maxLength) + "..." : title;
            preview.append(i + 1).append(". ").append(HtmlUtils.htmlEscape(shortened)).append('\n');
        }
        if (posts.size() > size) {
            preview.append("\n<i>...and ").append(posts.size() - size).append(" more posts</i>");
        }
        return preview.toString();
    }

    static List<String> chunk(String header, List<String> lines) {
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder(header);
        boolean hasLines = false;
        for (String line : lines) {
            if (hasLines && current.length() + line.length() + 1 > MAX_MESSAGE_LENGTH) {
                chunks.add(current.toString());
                current = new StringBuilder();
            }
            current.append(line).append('\n');
            hasLines = true;
        }
        if (hasLines) {
            chunks.add(current.toString());
        }
        return chunks;
    }

    private boolean isAllowed(long userId) {
        List<Long> allowed = properties.getAllowedUserIds();
        return allowed == null || allowed.isEmpty() || allowed.contains(userId);
    }

    private void reply(BotReplySender replies, long chatId, String text, String parseMode) {
        int perSecond = runtimeProperties.getRateLimit().getSendsPerSecond();
        if (!rateLimiter.tryAcquire(GLOBAL_SEND_KEY, perSecond, Duration.ofSeconds(1))) {
            log.warn("Dropping reply to chat {}: global send rate of {}/s exceeded", chatId, perSecond);
            return;
        }
        SendMessage message = SendMessage.builder()
                .chatId(String.valueOf(chatId))
                .text(text)
                .parseMode(parseMode)
                .build();
        try {
            replies.send(message);
        } catch (TelegramApiException ex) {
            log.warn("Failed to send reply to chat {}: {}", chatId, ex.getMessage());
        }
    }
}
