package com.eyelevel.jobengine.broker;

/**
 * A message whose worker lock expired. {@code state} is WAITING when it was put back for another
 * delivery, FAILED when it stalled too many times.
 */
public record StalledMessage(String queueName, String messageId, MessageState state) {
}
