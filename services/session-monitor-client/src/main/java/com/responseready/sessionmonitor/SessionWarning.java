package com.responseready.sessionmonitor;

/**
 * @param minutesRemaining whole minutes until the logout, rounded up, at least 1
 */
public record SessionWarning(TimeoutReason reason, long minutesRemaining) {}
