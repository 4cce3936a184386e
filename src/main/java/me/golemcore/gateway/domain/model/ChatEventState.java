package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * State carried by a chat projection event.
 */
public enum ChatEventState {

    DELTA("delta"), FINAL("final"), ERROR("error");

    private final String wireValue;

    ChatEventState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
