package com.eyelevel.jobengine.broker.redis;

/**
 * Key layout of one queue. Every key of a queue shares the {@code {prefix:queue}} hash tag so the
 * Lua scripts touch a single cluster slot.
 */
record RedisQueueKeys(String base) {

    static RedisQueueKeys of(final String keyPrefix, final String queueName) {
        return new RedisQueueKeys("{" + keyPrefix + ":" + queueName + "}");
    }

    String waiting() {
        return base + ":waiting";
    }

    String delayed() {
        return base + ":delayed";
    }

    String active() {
        return base + ":active";
    }

    String completed() {
        return base + ":completed";
    }

    String failed() {
        return base + ":failed";
    }

    String sequence() {
        return base + ":seq";
    }

    String messagePrefix() {
        return base + ":msg:";
    }

    String message(final String messageId) {
        return messagePrefix() + messageId;
    }
}
