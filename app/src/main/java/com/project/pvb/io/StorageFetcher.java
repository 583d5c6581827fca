package com.project.pvb.io;

import java.util.Optional;

/**
 * Retrieves off-chain payload bytes referenced by a submission's data URI.
 */
@FunctionalInterface
public interface StorageFetcher {
    Optional<byte[]> fetch(String dataUri);
}
