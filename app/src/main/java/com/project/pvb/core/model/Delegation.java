package com.project.pvb.core.model;

/**
 * Device and owning verifier read together from one registry snapshot.
 */
public record Delegation(Device device, Verifier verifier) {

    public boolean isAuthorized() {
        return device.active() && verifier != null && verifier.active();
    }
}
