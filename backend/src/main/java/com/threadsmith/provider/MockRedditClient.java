package com.threadsmith.provider;

import com.threadsmith.model.SortMode;
import com.threadsmith.model.TimeWindow;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Reddit client serving pre-cached posts for local runs without credentials.
 */
@Component
@ConditionalOnProperty(prefix = "threadsmith.reddit", name = "mode", havingValue = "mock")
public class MockRedditClient implements RedditClient {

    private static final List<RedditPost> CACHED_POSTS = List.of(
        new RedditPost("mk001", "What is the most underrated Python library you use every day?", 1842, "https://www.reddit.com/r/python/comments/mk001/", "/r/python/comments/mk001/", 1717000000, "snake_charmer", 412, 0.97, "Mine is more-itertools. Curious what everyone else reaches for.", false, false),
        new RedditPost("mk002", "I rewrote our billing service in a weekend and here is what broke", 1210, "https://blog.example.com/billing-rewrite", "/r/python/comments/mk002/", 1717003600, "weekend_hacker", 233, 0.91, "", false, false),
        new RedditPost("mk003", "Async IO finally clicked for me after drawing this diagram", 988, "https://i.example.com/asyncio.png", "/r/python/comments/mk003/", 1717007200, null, 87, 0.95, "", false, false),
        new RedditPost("mk004", "PSA: pin your dependencies before the next major release lands", 743, "https://www.reddit.com/r/python/comments/mk004/", "/r/python/comments/mk004/", 1717010800, "release_watch", 156, 0.89, "Lockfiles exist for a reason.", false, false),
        new RedditPost("mk005", "Show and tell: a tiny CLI that turns CSV files into charts", 512, "https://github.com/example/csv-charts", "/r/python/comments/mk005/", 1717014400, "chart_maker", 64, 0.93, "", false, false),
        new RedditPost("mk006", "Why does my list comprehension run slower than the for loop?", 301, "https://www.reddit.com/r/python/comments/mk006/", "/r/python/comments/mk006/", 1717018000, "loop_curious", 98, 0.84, "Benchmarks attached, numbers are confusing me.", false, false),
        new RedditPost("mk007", "Type hints saved our team from a nasty production bug", 276, "https://www.reddit.com/r/python/comments/mk007/", "/r/python/comments/mk007/", 1717021600, "typed_dev", 45, 0.9, "", false, false),
        new RedditPost("mk008", "A walkthrough video of packaging a project from scratch", 198, "https://v.example.com/packaging", "/r/python/comments/mk008/", 1717025200, "pkg_guide", 21, 0.88, "", true, false),
        new RedditPost("mk009", "Weekly thread: what are you working on?", 87, "https://www.reddit.com/r/python/comments/mk009/", "/r/python/comments/mk009/", 1717028800, "AutoModerator", 310, 0.99, "Share your projects below.", false, false),
        new RedditPost("mk010", "Is it worth learning Rust extensions for a data pipeline?", 64, "https://www.reddit.com/r/python/comments/mk010/", "/r/python/comments/mk010/", 1717032400, "pipeline_person", 52, 0.8, "", false, false)
    );

    @Override
    public List<RedditPost> fetchPosts(String subreddit, SortMode sort, TimeWindow timeWindow, int limit) {
        return new ArrayList<>(CACHED_POSTS.subList(0, Math.max(0, Math.min(limit, CACHED_POSTS.size()))));
    }

    @Override
    public boolean subredditExists(String subreddit) {
        return StringUtils.hasText(subreddit);
    }
}
