package com.mergeline.backend.remote;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

import com.mergeline.backend.staging.FastForwardProtocol;
import com.mergeline.backend.staging.FastForwardProtocol.Target;

public class UnconfiguredRemoteRepositoriesTest {

    private final RemoteRepository odoo = new UnconfiguredRemoteRepositories().forRepository("odoo");

    @Test
    void everyCallIsUnsupported() {
        assertEquals("odoo", odoo.name());

        UnsupportedOperationException head = assertThrows(UnsupportedOperationException.class, () -> odoo.head("master"));
        assertEquals("no remote configured for odoo", head.getMessage());
        assertThrows(UnsupportedOperationException.class, () -> odoo.setRef("tmp.master", "abc"));
        assertThrows(UnsupportedOperationException.class, () -> odoo.fastForward("master", "abc"));
    }

    @Test
    void fastForwardProtocol_doesNotTurnItIntoAFastForwardFailure() {
        FastForwardProtocol protocol = new FastForwardProtocol("tmp.", List.of(Duration.ZERO), pause -> {});

        assertThrows(UnsupportedOperationException.class,
                () -> protocol.run("master", List.of(new Target(odoo, "staged"))));
    }
}
