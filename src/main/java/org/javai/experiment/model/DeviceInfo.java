package org.javai.experiment.model;

/**
 * Device context captured at assignment time.
 */
public record DeviceInfo(
        DeviceType type,
        String operatingSystem,
        String browser,
        String timezone
) {

    public static DeviceInfo unknown() {
        return new DeviceInfo(null, null, null, null);
    }
}
