package com.scholary.podsummary.service;

/** A stored artifact loaded for download. */
public record Artifact(String name, String contentType, byte[] content) {}
