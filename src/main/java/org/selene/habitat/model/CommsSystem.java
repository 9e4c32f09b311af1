package org.selene.habitat.model;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Communications summary: local network availability and the relay gateway.
 */
@Value
@Accessors(fluent = true)
public class CommsSystem {
    boolean local;
    String gateway;

    private CommsSystem(boolean local, String gateway) {
        this.local = local;
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    public static CommsSystem of(boolean local, String gateway) {
        return new CommsSystem(local, gateway);
    }
}
