package com.mk.fx.qa.device.load.cfg;

/**
 * Error body returned by the REST endpoints.
 *
 * @param error short error title
 * @param details human readable cause
 */
public record ErrorResponse(String error, String details) {}
