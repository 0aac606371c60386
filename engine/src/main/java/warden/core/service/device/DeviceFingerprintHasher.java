package warden.core.service.device;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import warden.core.model.device.DeviceAttributes;

/**
 * Deterministic 32-bit hash of device attributes.
 *
 * <p>The attributes are serialized as compact JSON in a fixed field order, with an empty
 * {@code hash} field last, and folded with {@code hash = hash * 31 + c} over the UTF-16
 * code units. The absolute value is rendered as lowercase hex. Hashes stay compatible with
 * fingerprints already stored by browser clients.
 */
final class DeviceFingerprintHasher {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private DeviceFingerprintHasher() {}

    static String hash(DeviceAttributes attributes) {
        final var json = serialize(attributes);
        var hash = 0;
        for (var i = 0; i < json.length(); i++) {
            hash = (hash << 5) - hash + json.charAt(i);
        }
        return Long.toHexString(Math.abs((long) hash));
    }

    static String serialize(DeviceAttributes attributes) {
        try {
            return OBJECT_MAPPER.writeValueAsString(HashInput.of(attributes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize device attributes", e);
        }
    }

    @JsonPropertyOrder({"userAgent", "screenResolution", "timezone", "language", "colorDepth", "touchSupport", "hash"})
    record HashInput(
            String userAgent,
            String screenResolution,
            String timezone,
            String language,
            int colorDepth,
            boolean touchSupport,
            String hash) {

        static HashInput of(DeviceAttributes attributes) {
            return new HashInput(
                    attributes.userAgent(),
                    attributes.screenResolution(),
                    attributes.timezone(),
                    attributes.language(),
                    attributes.colorDepth(),
                    attributes.touchSupport(),
                    "");
        }
    }
}
