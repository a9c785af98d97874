package com.cred.freestyle.repricer.exception;

/**
 * Thrown when processing an inbound event fails unexpectedly. By the time it reaches the caller,
 * held locks have been released and the pre-emptive variant cooldown rolled back.
 *
 * @author Repricer Team
 */
public class EventProcessingException extends RuntimeException {

    private final String messageId;
    private final String topic;

    public EventProcessingException(String messageId, String topic, Throwable cause) {
        super(String.format("Failed to process event %s (%s): %s", messageId, topic, cause.getMessage()), cause);
        this.messageId = messageId;
        this.topic = topic;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getTopic() {
        return topic;
    }
}
