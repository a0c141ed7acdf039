package com.scholary.scribe.api;

import jakarta.validation.constraints.NotBlank;

/** Request to start tracking a recording by its source id. */
public record RegisterJobRequest(@NotBlank String id, String filename) {}
