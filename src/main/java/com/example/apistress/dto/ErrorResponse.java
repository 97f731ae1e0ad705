package com.example.apistress.dto;

/**
 * Error payload returned by the REST layer.
 *
 * @param error short error title
 * @param details human-readable cause
 */
public record ErrorResponse(String error, String details) {}
