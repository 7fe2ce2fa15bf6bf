package com.tradezzz.ratelimit;

/**
 * Whether a metered action is allowed, with the specific reason when it is not.
 */
public record ActionDecision(boolean allowed, String reason) {

    public static ActionDecision allow() {
        return new ActionDecision(true, null);
    }

    public static ActionDecision deny(String reason) {
        return new ActionDecision(false, reason);
    }
}
