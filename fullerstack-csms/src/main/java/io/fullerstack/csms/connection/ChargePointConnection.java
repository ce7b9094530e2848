package io.fullerstack.csms.connection;

import io.fullerstack.csms.server.CommandReply;
import io.fullerstack.csms.server.OcppCommand;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to one live connection of a charge point, provided by the transport.
 * Correlating a command with its reply is the transport's job.
 */
public interface ChargePointConnection {

    String chargePointId();

    /**
     * Sends a command over this connection.
     *
     * @return future completed with the charge point's correlated reply, or exceptionally if
     *         the command could not be sent or the charge point answered with an error
     */
    CompletableFuture<CommandReply> send(OcppCommand command);

    boolean isOpen();

    /**
     * Closes the underlying connection. Closing twice is a no-op.
     */
    void close();
}
