package com.questrail.chamber.hardware;

/**
 * Port to the temperature acquisition layer.
 *
 * <p>Implementations report a failed probe as {@link ProbeReading#failed(String)}
 * rather than throwing. An exception from {@link #read()} is treated as every
 * probe failing for that tick.</p>
 */
@FunctionalInterface
public interface ProbeSource
{
    ProbeReadings read() throws Exception;
}
