package fr.lapetina.inference.domain.model;

import java.util.Objects;

/**
 * Source model whose compiled functions are loaded onto a device.
 */
public record Module(String name) {

    public Module {
        Objects.requireNonNull(name, "Module name is required");
    }
}
