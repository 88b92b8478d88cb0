package com.ledgerwise.core.model;

import java.io.Serializable;

/**
 * Where part of an answer came from.
 *
 * @param origin     document or record identifier
 * @param excerpt    short excerpt of the supporting content
 * @param confidence retrieval score; nullable
 */
public record SourceAttribution(
    String origin,
    String excerpt,
    Double confidence
) implements Serializable {}
