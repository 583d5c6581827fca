package com.project.pvb.core;

import com.project.pvb.core.TrustChainException.AuthorizationException;
import com.project.pvb.core.TrustChainException.ConflictException;
import com.project.pvb.core.TrustChainException.IntegrityException;
import com.project.pvb.core.TrustChainException.NotFoundException;
import com.project.pvb.core.TrustChainException.RangeException;
import com.project.pvb.core.TrustChainException.ValidationException;
import com.project.pvb.core.event.DataSubmitted;
import com.project.pvb.core.event.SubmissionListener;
import com.project.pvb.core.event.SubmissionVerified;
import com.project.pvb.core.model.Address;
import com.project.pvb.core.model.AuditPage;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.Delegation;
import com.project.pvb.core.model.Device;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.core.model.LedgerStatus;
import com.project.pvb.core.model.Submission;
import com.project.pvb.core.model.SubmissionDetails;
import com.project.pvb.core.model.Verifier;
import com.project.pvb.crypto.ErrorLogger;
import com.project.pvb.crypto.SignatureScheme;
import com.project.pvb.crypto.SignatureVerifier;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only ledger of signed, content-addressed data submissions.
 *
 * Writes are serialized by a single lock held across validation and commit.
 * Reads never take that lock: the global history append is the commit point, and a
 * reader only trusts records whose sequence number lies below the history size it
 * sampled, so a submission in progress is never visible.
 *
 * Records are never updated or removed. Revoking a device or verifier later only
 * affects future submissions.
 */
public class SubmissionLedger {

    private final Address owner;
    private final SignatureScheme signatureScheme;
    private final SignatureVerifier signatureVerifier;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile TrustRegistry registry;

    private final Map<DataHash, Submission> submissions = new ConcurrentHashMap<>();
    private final AppendOnlyIndex<Submission> history = new AppendOnlyIndex<>(Submission[]::new);
    private final Map<DeviceId, AppendOnlyIndex<Submission>> deviceSubmissions = new ConcurrentHashMap<>();
    private final Map<Address, AppendOnlyIndex<Submission>> verifierSubmissions = new ConcurrentHashMap<>();

    private final List<SubmissionListener> listeners = new CopyOnWriteArrayList<>();

    public SubmissionLedger(TrustRegistry registry, Address owner, SignatureScheme signatureScheme) {
        this(registry, owner, signatureScheme, Clock.systemUTC());
    }

    public SubmissionLedger(TrustRegistry registry, Address owner, SignatureScheme signatureScheme, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.signatureScheme = Objects.requireNonNull(signatureScheme, "signatureScheme must not be null");
        this.signatureVerifier = signatureScheme.verifier();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ==================== Submission ====================

    /**
     * Validate, authorize, verify and record a submission.
     *
     * Checks run in order and the first failure wins: hash present and non-zero,
     * signature and URI non-empty, hash unused, device active, verifier active,
     * signature valid for the device key. Nothing is written unless all pass.
     *
     * @return the data hash, which identifies the submission
     */
    public DataHash submitData(DeviceId deviceId, DataHash dataHash, byte[] signature,
                               String dataUri, String metadata) {
        if (dataHash == null || dataHash.isZero()) {
            throw new ValidationException("Data hash must be non-zero");
        }
        if (signature == null || signature.length == 0) {
            throw new ValidationException("Signature must not be empty");
        }
        InputValidator.validateDataUri(dataUri);
        if (deviceId == null) {
            throw new ValidationException("Device ID must not be null");
        }

        writeLock.lock();
        try {
            if (submissions.containsKey(dataHash)) {
                throw new ConflictException("Data hash already submitted: " + dataHash);
            }

            Delegation delegation = registry.resolveDelegation(deviceId)
                    .orElseThrow(() -> new AuthorizationException("Device not registered: " + deviceId));
            Device device = delegation.device();
            if (!device.active()) {
                throw new AuthorizationException("Device is not active: " + deviceId);
            }
            Verifier verifier = delegation.verifier();
            if (verifier == null || !verifier.active()) {
                throw new AuthorizationException(
                    "Verifier is not active: " + device.verifierAddress() + " (device " + deviceId + ")");
            }

            if (!signatureVerifier.verify(dataHash.toBytes(), signature, device.publicKey())) {
                throw new IntegrityException(
                    String.format("Signature does not verify for %s against key of device %s (%s)",
                        dataHash, deviceId, signatureScheme.id()));
            }

            Submission submission = new Submission(
                    dataHash,
                    deviceId,
                    device.verifierAddress(),
                    signature,
                    clock.instant(),
                    dataUri,
                    InputValidator.normalizeMetadata(metadata),
                    true,
                    history.size()
            );
            commit(submission);
            notifyListeners(submission);
            return dataHash;
        } finally {
            writeLock.unlock();
        }
    }

    private void commit(Submission submission) {
        submissions.put(submission.dataHash(), submission);
        deviceSubmissions.computeIfAbsent(submission.deviceId(), id -> new AppendOnlyIndex<>(Submission[]::new))
                .append(submission);
        verifierSubmissions.computeIfAbsent(submission.verifierAddress(), a -> new AppendOnlyIndex<>(Submission[]::new))
                .append(submission);
        // Publishing the history entry makes the submission visible to readers
        history.append(submission);
    }

    private void notifyListeners(Submission submission) {
        DataSubmitted submitted = DataSubmitted.of(submission);
        SubmissionVerified verified = SubmissionVerified.of(submission);
        for (SubmissionListener listener : listeners) {
            try {
                listener.onDataSubmitted(submitted);
            } catch (RuntimeException e) {
                ErrorLogger.logError("notifyListeners",
                        "DataSubmitted listener failed for committed submission " + submission.dataHash(), e);
            }
            try {
                listener.onSubmissionVerified(verified);
            } catch (RuntimeException e) {
                ErrorLogger.logError("notifyListeners",
                        "SubmissionVerified listener failed for committed submission " + submission.dataHash(), e);
            }
        }
    }

    // ==================== Queries ====================

    /**
     * Full record of a committed submission.
     */
    public Submission verifySubmission(DataHash dataHash) {
        return committed(dataHash, history.size());
    }

    /**
     * Recompute the hash of {@code providedData} and compare it to a submitted hash.
     * This checks the payload at rest, independently of the signature.
     */
    public boolean verifyDataIntegrity(DataHash dataHash, byte[] providedData) {
        Submission submission = verifySubmission(dataHash);
        if (providedData == null) {
            throw new ValidationException("Provided data must not be null");
        }
        return submission.dataHash().equals(DataHash.digest(providedData));
    }

    public List<DataHash> getDeviceSubmissions(DeviceId deviceId) {
        return hashesOf(deviceSubmissions.get(deviceId));
    }

    public List<DataHash> getVerifierSubmissions(Address verifierAddress) {
        return hashesOf(verifierSubmissions.get(verifierAddress));
    }

    /**
     * A submission joined with the current registry state of its device and verifier.
     */
    public SubmissionDetails getSubmissionDetails(DataHash dataHash) {
        Submission submission = verifySubmission(dataHash);
        TrustRegistry current = registry;
        Device device = current.getDevice(submission.deviceId());
        Verifier verifier = current.getVerifier(device.verifierAddress());
        return new SubmissionDetails(submission, device, verifier);
    }

    public boolean hasSubmission(DataHash dataHash) {
        if (dataHash == null) {
            return false;
        }
        Submission submission = submissions.get(dataHash);
        return submission != null && submission.sequenceNumber() < history.size();
    }

    public long getTotalSubmissions() {
        return history.size();
    }

    /**
     * Hashes in {@code [startIndex, min(startIndex + count, total))}, in commit order.
     */
    public List<DataHash> getSubmissionHistory(long startIndex, int count) {
        return slice(startIndex, count).stream().map(Submission::dataHash).toList();
    }

    /**
     * Same slice as {@link #getSubmissionHistory(long, int)}, with full records.
     */
    public AuditPage getAuditTrail(long startIndex, int count) {
        int total = history.size();
        List<Submission> page = slice(startIndex, count, total);
        return new AuditPage(total, startIndex, page.size(), page);
    }

    private List<Submission> slice(long startIndex, int count) {
        return slice(startIndex, count, history.size());
    }

    private List<Submission> slice(long startIndex, int count, int total) {
        InputValidator.validateNonNegative(count, "count");
        if (startIndex < 0 || startIndex >= total) {
            throw new RangeException(
                String.format("Start index %d outside history of %d submissions", startIndex, total));
        }
        int from = (int) startIndex;
        int to = (int) Math.min((long) from + count, total);
        return history.slice(from, to);
    }

    // ==================== Administration ====================

    /**
     * Point the ledger at a different registry. Only the ledger owner may do this.
     */
    public void updateRegistry(Address caller, TrustRegistry newRegistry) {
        Objects.requireNonNull(newRegistry, "newRegistry must not be null");
        if (!owner.equals(caller)) {
            throw new AuthorizationException("Only the ledger owner may update the registry (caller: " + caller + ")");
        }
        writeLock.lock();
        try {
            registry = newRegistry;
            ErrorLogger.logInfo("updateRegistry", "Ledger now consults registry owned by " + newRegistry.owner());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Snapshot of registry reachability and ledger size. Never throws; a registry that fails to answer
     * is reported as not accessible.
     */
    public LedgerStatus healthCheck() {
        TrustRegistry current = registry;
        boolean accessible = true;
        int verifiers = 0;
        int devices = 0;
        try {
            verifiers = current.verifierCount();
            devices = current.deviceCount();
        } catch (RuntimeException e) {
            ErrorLogger.logError("healthCheck", "Registry owned by " + current.owner() + " did not answer", e);
            accessible = false;
            verifiers = 0;
            devices = 0;
        }
        return new LedgerStatus(accessible, verifiers, devices, history.size(), current.owner(),
                signatureScheme.id(), clock.instant());
    }

    public TrustRegistry registry() {
        return registry;
    }

    public Address owner() {
        return owner;
    }

    public SignatureScheme signatureScheme() {
        return signatureScheme;
    }

    public void addListener(SubmissionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(SubmissionListener listener) {
        listeners.remove(listener);
    }

    // ==================== Internal helpers ====================

    private Submission committed(DataHash dataHash, int watermark) {
        Submission submission = dataHash == null ? null : submissions.get(dataHash);
        if (submission == null || submission.sequenceNumber() >= watermark) {
            throw new NotFoundException("Submission not found: " + dataHash);
        }
        return submission;
    }

    private List<DataHash> hashesOf(AppendOnlyIndex<Submission> index) {
        if (index == null) {
            return List.of();
        }
        int watermark = history.size();
        return index.snapshot(s -> s.sequenceNumber() < watermark).stream()
                .map(Submission::dataHash)
                .toList();
    }
}
