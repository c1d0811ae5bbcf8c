package org.javai.experiment.model;

public enum DeviceType {
    DESKTOP,
    MOBILE,
    TABLET
}
