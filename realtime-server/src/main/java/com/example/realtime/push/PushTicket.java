package com.example.realtime.push;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider receipt for one message. Tickets come back in the order the messages were sent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushTicket {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";
    public static final String DEVICE_NOT_REGISTERED = "DeviceNotRegistered";

    private String status;
    private String id;
    private String message;
    private Map<String, Object> details;

    public static PushTicket ok(String id) {
        return new PushTicket(STATUS_OK, id, null, null);
    }

    public static PushTicket error(String message, String errorCode) {
        return new PushTicket(STATUS_ERROR, null, message, errorCode != null ? Map.of("error", errorCode) : null);
    }

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    public String errorCode() {
        if (details == null) {
            return null;
        }
        Object error = details.get("error");
        return error != null ? error.toString() : null;
    }

    public boolean isDeviceNotRegistered() {
        return DEVICE_NOT_REGISTERED.equals(errorCode());
    }
}
