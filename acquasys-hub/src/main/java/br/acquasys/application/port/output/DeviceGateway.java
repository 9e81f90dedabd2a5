package br.acquasys.application.port.output;

import br.acquasys.domain.common.ConnectionState;
import br.acquasys.domain.control.PumpCommand;

/**
 * Outbound side of the device transport.
 */
public interface DeviceGateway {

    /**
     * Publish a command to the pump controller.
     *
     * @return true if the transport accepted the message, false if it is disconnected or the
     *         publish failed
     */
    boolean sendPumpCommand(PumpCommand command);

    ConnectionState connectionState();
}
