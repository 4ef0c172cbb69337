package org.exifrenamer.controller.metadata;

/**
 * Answers whether a container type can be opened for metadata in the
 * current runtime.  Consulted only for containers that need an optional
 * decoder.
 */
@FunctionalInterface
public interface DecodabilityOracle {

    /**
     * @param extension a lower-case extension with its leading dot, e.g. {@code .heic}
     * @return true if files with this extension can be decoded here
     */
    boolean canDecode(String extension);
}
