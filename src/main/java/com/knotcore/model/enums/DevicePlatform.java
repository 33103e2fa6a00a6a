package com.knotcore.model.enums;

/**
 * Push platform of a registered device.
 */
public enum DevicePlatform {
    IOS, ANDROID
}
