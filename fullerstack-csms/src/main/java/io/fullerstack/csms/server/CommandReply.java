package io.fullerstack.csms.server;

/**
 * The charge point's reply to an {@link OcppCommand}.
 *
 * @param commandId correlation token of the command this reply answers
 * @param status    status value as sent by the charge point, e.g. "Accepted", "Scheduled"
 */
public record CommandReply(String commandId, String status) {}
