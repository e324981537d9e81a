package com.smurthy.ai.shopping.dto;

import com.smurthy.ai.shopping.errors.ErrorKind;

import java.time.Instant;

/**
 * Error body rendered for any request the API rejects.
 */
public record ErrorResponse(String error, ErrorKind kind, String message, Instant timestamp) {
}
