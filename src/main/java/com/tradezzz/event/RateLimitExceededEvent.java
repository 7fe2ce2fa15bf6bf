package com.tradezzz.event;

import org.springframework.context.ApplicationEvent;

public class RateLimitExceededEvent extends ApplicationEvent {

    private final String userId;
    private final String category;

    public RateLimitExceededEvent(Object source, String userId, String category) {
        super(source);
        this.userId = userId;
        this.category = category;
    }

    public String getUserId() {
        return userId;
    }

    /** Rate-limit category, or "exchange:&lt;id&gt;" for venue call budgets. */
    public String getCategory() {
        return category;
    }
}
