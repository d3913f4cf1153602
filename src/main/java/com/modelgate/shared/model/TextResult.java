package com.modelgate.shared.model;

/** Concatenated text of a drained stream plus its finish reason, if one arrived. */
public record TextResult(String text, String finishReason) {}
