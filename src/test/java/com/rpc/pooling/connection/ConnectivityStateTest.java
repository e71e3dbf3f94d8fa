package com.rpc.pooling.connection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConnectivityState Tests")
class ConnectivityStateTest {

    @Test
    @DisplayName("Only READY and IDLE should be usable")
    void healthyStates() {
        for (ConnectivityState state : ConnectivityState.values()) {
            assertEquals(EnumSet.of(ConnectivityState.READY, ConnectivityState.IDLE).contains(state),
                    state.isHealthy(), state.name());
        }
    }

    @Test
    @DisplayName("Only TRANSIENT_FAILURE and SHUTDOWN should need repair")
    void brokenStates() {
        for (ConnectivityState state : ConnectivityState.values()) {
            assertEquals(EnumSet.of(ConnectivityState.TRANSIENT_FAILURE, ConnectivityState.SHUTDOWN).contains(state),
                    state.isBroken(), state.name());
        }
    }

    @Test
    @DisplayName("CONNECTING should be neither usable nor broken")
    void connectingIsInBetween() {
        assertFalse(ConnectivityState.CONNECTING.isHealthy());
        assertFalse(ConnectivityState.CONNECTING.isBroken());
    }
}
