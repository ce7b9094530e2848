package io.fullerstack.csms.session;

/**
 * What a caller of a command operation gets back.
 *
 * @param status    outcome of the command
 * @param commandId correlation token, null if nothing was sent
 * @param detail    human-readable explanation, may be null
 */
public record CommandResult(
    CommandStatus status,
    String commandId,
    String detail
) {

    public static CommandResult replied(String commandId, CommandStatus status) {
        return new CommandResult(status, commandId, null);
    }

    public static CommandResult notSent(CommandStatus status, String detail) {
        return new CommandResult(status, null, detail);
    }

    public boolean isAccepted() {
        return status.isAccepted();
    }

    public boolean wasSent() {
        return commandId != null;
    }
}
