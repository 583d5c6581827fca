package com.project.pvb.core;

import com.project.pvb.core.TrustChainException.AuthorizationException;
import com.project.pvb.core.TrustChainException.ConflictException;
import com.project.pvb.core.TrustChainException.NotFoundException;
import com.project.pvb.core.model.Address;
import com.project.pvb.core.model.Delegation;
import com.project.pvb.core.model.Device;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.core.model.Verifier;
import com.project.pvb.crypto.ErrorLogger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Source of truth for which verifiers and devices may submit attested data.
 *
 * Administrative changes are gated by the caller's address:
 * - the owner may register verifiers, toggle any verifier or device, and register devices for any verifier
 * - with open registration, a principal may register itself as a verifier
 * - a verifier may register and toggle its own devices
 *
 * All state sits behind one read/write lock, so a device and its verifier are always
 * observed together in a consistent state (see {@link #resolveDelegation(DeviceId)}).
 */
public class TrustRegistry {

    private final Address owner;
    private final boolean openRegistration;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Address, Verifier> verifiers = new HashMap<>();
    private final Map<DeviceId, Device> devices = new HashMap<>();
    private final Map<Address, List<DeviceId>> verifierDevices = new HashMap<>();

    public TrustRegistry(Address owner, boolean openRegistration) {
        this(owner, openRegistration, Clock.systemUTC());
    }

    public TrustRegistry(Address owner, boolean openRegistration, Clock clock) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.openRegistration = openRegistration;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Address owner() {
        return owner;
    }

    public boolean isOpenRegistration() {
        return openRegistration;
    }

    // ==================== Verifier management ====================

    public Verifier registerVerifier(Address caller, Address address, String name, String metadata) {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(address, "address must not be null");
        InputValidator.validateVerifierName(name);

        boolean selfRegistration = openRegistration && caller.equals(address);
        if (!isOwner(caller) && !selfRegistration) {
            throw new AuthorizationException(
                String.format("Caller %s may not register verifier %s (open registration: %s)",
                    caller, address, openRegistration)
            );
        }

        lock.writeLock().lock();
        try {
            if (verifiers.containsKey(address)) {
                throw new ConflictException("Verifier already registered: " + address);
            }
            Verifier verifier = new Verifier(
                    address,
                    name.trim(),
                    InputValidator.normalizeMetadata(metadata),
                    true,
                    clock.instant()
            );
            verifiers.put(address, verifier);
            verifierDevices.put(address, new ArrayList<>());
            ErrorLogger.logInfo("registerVerifier", "Registered verifier " + address + " (" + verifier.name() + ")");
            return verifier;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Activate or deactivate a verifier. Owner only; idempotent.
     */
    public void setVerifierActive(Address caller, Address address, boolean active) {
        Objects.requireNonNull(address, "address must not be null");
        requireOwner(caller, "change verifier status");

        lock.writeLock().lock();
        try {
            Verifier verifier = verifiers.get(address);
            if (verifier == null) {
                throw new NotFoundException("Verifier not found: " + address);
            }
            if (verifier.active() != active) {
                verifiers.put(address, verifier.withActive(active));
                ErrorLogger.logInfo("setVerifierActive", address + " -> " + (active ? "ACTIVE" : "INACTIVE"));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Device management ====================

    public Device registerDevice(Address caller, DeviceId deviceId, Address verifierAddress,
                                 byte[] publicKey, String metadata) {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(verifierAddress, "verifierAddress must not be null");
        InputValidator.validateByteArray(publicKey, "Device public key");

        if (!isOwner(caller) && !caller.equals(verifierAddress)) {
            throw new AuthorizationException(
                String.format("Caller %s may not register devices for verifier %s", caller, verifierAddress)
            );
        }

        lock.writeLock().lock();
        try {
            if (devices.containsKey(deviceId)) {
                throw new ConflictException("Device already registered: " + deviceId);
            }
            Verifier verifier = verifiers.get(verifierAddress);
            if (verifier == null) {
                throw new NotFoundException("Verifier not found: " + verifierAddress);
            }
            if (!verifier.active()) {
                throw new AuthorizationException("Verifier is not active: " + verifierAddress);
            }
            Device device = new Device(
                    deviceId,
                    verifierAddress,
                    publicKey,
                    InputValidator.normalizeMetadata(metadata),
                    true,
                    clock.instant()
            );
            devices.put(deviceId, device);
            verifierDevices.get(verifierAddress).add(deviceId);
            ErrorLogger.logInfo("registerDevice", "Registered device " + deviceId + " under " + verifierAddress);
            return device;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Activate or deactivate a device. Allowed for the owner and the device's own verifier.
     */
    public void setDeviceActive(Address caller, DeviceId deviceId, boolean active) {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(deviceId, "deviceId must not be null");

        lock.writeLock().lock();
        try {
            Device device = devices.get(deviceId);
            if (device == null) {
                throw new NotFoundException("Device not found: " + deviceId);
            }
            if (!isOwner(caller) && !caller.equals(device.verifierAddress())) {
                throw new AuthorizationException(
                    String.format("Caller %s may not change status of device %s", caller, deviceId)
                );
            }
            if (device.active() != active) {
                devices.put(deviceId, device.withActive(active));
                ErrorLogger.logInfo("setDeviceActive", deviceId + " -> " + (active ? "ACTIVE" : "INACTIVE"));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Queries ====================

    public boolean isVerifierActive(Address address) {
        lock.readLock().lock();
        try {
            Verifier verifier = address == null ? null : verifiers.get(address);
            return verifier != null && verifier.active();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Whether the device's own flag is set. The owning verifier is not consulted.
     */
    public boolean isDeviceActive(DeviceId deviceId) {
        lock.readLock().lock();
        try {
            Device device = deviceId == null ? null : devices.get(deviceId);
            return device != null && device.active();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Verifier getVerifier(Address address) {
        lock.readLock().lock();
        try {
            Verifier verifier = address == null ? null : verifiers.get(address);
            if (verifier == null) {
                throw new NotFoundException("Verifier not found: " + address);
            }
            return verifier;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Device getDevice(DeviceId deviceId) {
        lock.readLock().lock();
        try {
            Device device = deviceId == null ? null : devices.get(deviceId);
            if (device == null) {
                throw new NotFoundException("Device not found: " + deviceId);
            }
            return device;
        } finally {
            lock.readLock().unlock();
        }
    }

    public byte[] getDevicePublicKey(DeviceId deviceId) {
        return getDevice(deviceId).publicKey();
    }

    /**
     * Devices registered under a verifier, in registration order.
     */
    public List<DeviceId> getVerifierDevices(Address address) {
        lock.readLock().lock();
        try {
            List<DeviceId> ids = address == null ? null : verifierDevices.get(address);
            if (ids == null) {
                throw new NotFoundException("Verifier not found: " + address);
            }
            return List.copyOf(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reads a device together with its owning verifier under one lock.
     *
     * @return empty if the device is unknown
     */
    public Optional<Delegation> resolveDelegation(DeviceId deviceId) {
        lock.readLock().lock();
        try {
            Device device = deviceId == null ? null : devices.get(deviceId);
            if (device == null) {
                return Optional.empty();
            }
            Verifier verifier = verifiers.get(device.verifierAddress());
            return Optional.of(new Delegation(device, verifier));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int verifierCount() {
        lock.readLock().lock();
        try {
            return verifiers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int deviceCount() {
        lock.readLock().lock();
        try {
            return devices.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean isOwner(Address caller) {
        return owner.equals(caller);
    }

    private void requireOwner(Address caller, String action) {
        if (!isOwner(caller)) {
            throw new AuthorizationException(
                String.format("Only the registry owner may %s (caller: %s)", action, caller)
            );
        }
    }
}
