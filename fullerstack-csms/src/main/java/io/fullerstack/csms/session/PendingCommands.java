package io.fullerstack.csms.session;

import io.fullerstack.csms.server.CommandReply;
import io.fullerstack.csms.server.OcppCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * In-flight centrally-initiated commands awaiting their correlated reply.
 * <p>
 * Each command is keyed by its correlation token and carries a deadline. A charge point has
 * at most one pending command at a time; {@link #register} refuses a second one.
 * </p>
 * <pre>
 * register(command)          → slot taken, deadline timer armed
 *   reply arrives in time    → complete(reply): slot freed, caller gets the reply
 *   deadline passes first    → caller gets TimeoutException, slot freed
 *   reply arrives afterwards → complete(reply) finds nothing, reply discarded
 * </pre>
 */
public class PendingCommands implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PendingCommands.class);

    private final Map<String, PendingCommand> byCommandId;
    private final Map<String, String> commandIdByChargePoint;
    private final ScheduledExecutorService timeoutScheduler;
    private final Clock clock;

    private record PendingCommand(
        OcppCommand command,
        Instant sentAt,
        Instant deadline,
        CompletableFuture<CommandReply> reply
    ) {}

    public PendingCommands(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.byCommandId = new ConcurrentHashMap<>();
        this.commandIdByChargePoint = new ConcurrentHashMap<>();
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pending-command-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Takes the charge point's command slot and arms the deadline.
     *
     * @return future completed with the reply, or exceptionally with {@link TimeoutException}
     *         once the deadline passes; empty if another command is pending for the charge point
     */
    public Optional<CompletableFuture<CommandReply>> register(OcppCommand command, Duration timeout) {
        String chargePointId = command.chargePointId();
        String commandId = command.commandId();

        String busyWith = commandIdByChargePoint.putIfAbsent(chargePointId, commandId);
        if (busyWith != null) {
            logger.warn("Refusing {} for {}: command {} still pending",
                command.getClass().getSimpleName(), chargePointId, busyWith);
            return Optional.empty();
        }

        Instant now = clock.instant();
        CompletableFuture<CommandReply> reply = new CompletableFuture<>();
        byCommandId.put(commandId, new PendingCommand(command, now, now.plus(timeout), reply));

        ScheduledFuture<?> timer = timeoutScheduler.schedule(
            () -> expire(commandId), timeout.toMillis(), TimeUnit.MILLISECONDS);
        reply.whenComplete((ignored, error) -> timer.cancel(false));

        logger.debug("Registered pending {} {} for {} (deadline {})",
            command.getClass().getSimpleName(), commandId, chargePointId, now.plus(timeout));
        return Optional.of(reply);
    }

    /**
     * Hands a correlated reply to its waiting caller.
     *
     * @return false if no command with that token is pending (late or unknown reply, discarded)
     */
    public boolean complete(CommandReply reply) {
        PendingCommand pending = release(reply.commandId());
        if (pending == null) {
            logger.warn("Discarding reply '{}' for command {}: no longer pending",
                reply.status(), reply.commandId());
            return false;
        }

        Duration responseTime = Duration.between(pending.sentAt(), clock.instant());
        logger.info("{} {} on {} answered '{}' after {} ms",
            pending.command().getClass().getSimpleName(), reply.commandId(),
            pending.command().chargePointId(), reply.status(), responseTime.toMillis());
        return pending.reply().complete(reply);
    }

    /**
     * Fails a pending command, e.g. when it could not be sent or the charge point answered
     * with an error.
     *
     * @return false if the command was no longer pending
     */
    public boolean fail(String commandId, Throwable cause) {
        PendingCommand pending = release(commandId);
        if (pending == null) {
            logger.debug("Ignoring failure of command {}: no longer pending", commandId);
            return false;
        }
        logger.warn("Command {} to {} failed: {}",
            commandId, pending.command().chargePointId(), cause.getMessage());
        return pending.reply().completeExceptionally(cause);
    }

    /**
     * Expires a command whose deadline passed.
     */
    boolean expire(String commandId) {
        PendingCommand pending = release(commandId);
        if (pending == null) {
            return false;
        }
        logger.error("Command TIMEOUT: {} {} to {}, no reply by {}",
            pending.command().getClass().getSimpleName(), commandId,
            pending.command().chargePointId(), pending.deadline());
        return pending.reply().completeExceptionally(
            new TimeoutException("No reply to command " + commandId + " by " + pending.deadline()));
    }

    public boolean isPending(String chargePointId) {
        return commandIdByChargePoint.containsKey(chargePointId);
    }

    public int size() {
        return byCommandId.size();
    }

    private PendingCommand release(String commandId) {
        PendingCommand pending = byCommandId.remove(commandId);
        if (pending != null) {
            commandIdByChargePoint.remove(pending.command().chargePointId(), commandId);
        }
        return pending;
    }

    @Override
    public void close() {
        List<String> outstanding = List.copyOf(byCommandId.keySet());
        for (String commandId : outstanding) {
            fail(commandId, new CancellationException("Central system shutting down"));
        }
        timeoutScheduler.shutdownNow();
        logger.info("PendingCommands closed ({} outstanding command(s) cancelled)", outstanding.size());
    }
}
