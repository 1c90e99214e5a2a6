package com.tnpds.scraper;

/**
 * Why a shop's record is incomplete.
 *
 * @param attempts how many pipeline attempts were made (0 when never attempted)
 */
public record ErrorInfo(ErrorKind kind, String message, int attempts) {}
