package com.nicolaswinsten.lootsync.web;

import java.time.Instant;

import com.nicolaswinsten.lootsync.error.ErrorKind;

/** Body of every failed HTTP response. */
public record ApiError(ErrorKind error, String message, int status, Instant timestamp, String path) {}
