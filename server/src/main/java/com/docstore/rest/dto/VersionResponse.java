package com.docstore.rest.dto;

/** Body of the version endpoint. */
public record VersionResponse(String version, String build) {}
