package com.gentoro.honeybadger.notice;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Root payload of the notices endpoint. */
@JsonPropertyOrder({"api_key", "notifier", "error", "request", "server"})
public record Notice(
    @JsonProperty("api_key") String apiKey,
    @JsonProperty("notifier") NotifierInfo notifier,
    @JsonProperty("error") ErrorRecord error,
    @JsonProperty("request") RequestContext request,
    @JsonProperty("server") ServerInfo server) {}
