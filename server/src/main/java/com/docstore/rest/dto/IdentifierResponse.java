package com.docstore.rest.dto;

/**
 * Response body carrying a document identifier, returned when an identifier is allocated, when a
 * document is created, and when a document is replaced.
 *
 * @param identifier the document identifier in canonical UUID form
 */
public record IdentifierResponse(String identifier) {}
