package com.questrail.chamber.api;

/**
 * Physical outputs the controller drives.
 */
public enum Actuator
{
    HEATER,
    FANS
}
