package com.modelgate.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Acknowledgement returned by the remote stream command. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamResponse(@JsonProperty("request_id") String requestId) {}
