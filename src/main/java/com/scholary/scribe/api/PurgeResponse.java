package com.scholary.scribe.api;

/** Number of history entries removed by a purge. */
public record PurgeResponse(int removed) {}
