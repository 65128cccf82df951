package com.nicolaswinsten.lootsync.sync;

import com.fasterxml.jackson.annotation.JsonValue;

/** Names of the server→client events, as they appear in the {@code event} field on the wire. */
public enum EventType {
    CONNECTED("connected"),
    OBJECT_CREATED("object_created"),
    OBJECT_UPDATED("object_updated"),
    OBJECT_COLLECTED("object_collected"),
    OBJECT_UNCOLLECTED("object_uncollected"),
    OBJECT_DELETED("object_deleted"),
    ALL_FINDS_RESET("all_finds_reset"),
    USER_LOCATION_UPDATED("user_location_updated"),
    DEVICE_REGISTERED("device_registered"),
    CONNECTED_CLIENTS_LIST("connected_clients_list"),
    DIAGNOSTIC_PONG("diagnostic_pong"),
    ADMIN_DIAGNOSTIC_PING("admin_diagnostic_ping"),
    ADMIN_PING_RESPONSE("admin_ping_response"),
    ADMIN_PING_ERROR("admin_ping_error"),
    OBJECTS_BATCH("objects_batch"),
    PONG("pong");

    private final String value;

    EventType(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }
}
