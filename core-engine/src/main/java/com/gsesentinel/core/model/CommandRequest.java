package com.gsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An operator's request to run a command against one device.
 *
 * <p>
 * Parameters arrive as a loosely typed map and are decoded into a typed
 * structure by {@link com.gsesentinel.core.command.CommandParameterDecoder}
 * before anything reads them.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CommandRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Issuer recorded when the request names none. */
    public static final String DEFAULT_ISSUER = "operator";

    private final String deviceId;
    private final String commandType;
    private final Map<String, Object> parameters;
    private final String issuedBy;

    @JsonCreator
    public CommandRequest(@JsonProperty("device_id") String deviceId,
            @JsonProperty("command_type") String commandType,
            @JsonProperty("parameters") Map<String, Object> parameters,
            @JsonProperty("issued_by") String issuedBy) {
        this.deviceId = deviceId;
        this.commandType = commandType;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
        this.issuedBy = issuedBy != null && !issuedBy.isBlank() ? issuedBy : DEFAULT_ISSUER;
    }

    /**
     * Convenience factory for a request without parameters.
     */
    public static CommandRequest of(String deviceId, String commandType, String issuedBy) {
        return new CommandRequest(deviceId, commandType, null, issuedBy);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getCommandType() {
        return commandType;
    }

    /**
     * @return unmodifiable view of the raw parameters, never {@code null}
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String getIssuedBy() {
        return issuedBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CommandRequest that))
            return false;
        return Objects.equals(deviceId, that.deviceId)
                && Objects.equals(commandType, that.commandType)
                && parameters.equals(that.parameters)
                && issuedBy.equals(that.issuedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, commandType, parameters, issuedBy);
    }

    @Override
    public String toString() {
        return "CommandRequest{" +
                "deviceId='" + deviceId + '\'' +
                ", commandType='" + commandType + '\'' +
                ", parameters=" + parameters +
                ", issuedBy='" + issuedBy + '\'' +
                '}';
    }
}
