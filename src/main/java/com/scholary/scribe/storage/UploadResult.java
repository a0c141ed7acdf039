package com.scholary.scribe.storage;

/**
 * Outcome of an upload.
 *
 * @param objectId id of the remote object holding the content
 * @param skipped true when an object with the same fingerprint already existed
 */
public record UploadResult(String objectId, boolean skipped) {}
