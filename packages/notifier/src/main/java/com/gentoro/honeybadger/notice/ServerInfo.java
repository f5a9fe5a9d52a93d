package com.gentoro.honeybadger.notice;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"project_root", "environment_name", "hostname", "time", "pid"})
public record ServerInfo(
    @JsonProperty("project_root") String projectRoot,
    @JsonProperty("environment_name") String environmentName,
    @JsonProperty("hostname") String hostname,
    @JsonProperty("time") long time,
    @JsonProperty("pid") long pid) {}
