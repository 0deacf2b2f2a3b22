package io.kassa.core.longpoll;

public enum ResumeReason {
    TRIGGERED,
    TIMEOUT,
    SHUTDOWN
}
