package br.acquasys.application.orchestration;

/**
 * Structured status projection. Measurement fields are null when {@link #online()} is false.
 *
 * @param online          true once at least one reading was received
 * @param transport       device transport state
 * @param storeDegraded   true while only in-memory history is available
 * @param device          device id of the latest reading
 * @param level           water level in percent
 * @param temperature     temperature in Celsius
 * @param current         current draw in amperes
 * @param vibrationRms    vibration RMS in G
 * @param pumpOn          reported pump state
 * @param mode            "Automatic" or "Manual"
 * @param efficiency      averaged efficiency in percent
 * @param uptimeMinutes   device uptime, whole minutes
 * @param uptimeSeconds   device uptime, remaining seconds
 * @param freeMemoryKb    free device memory in KB, rounded
 * @param rssi            signal strength in dBm
 * @param updatedAt       local time of the report, dd/MM/yyyy, HH:mm:ss
 */
public record StatusSnapshot(
    boolean online,
    String transport,
    boolean storeDegraded,
    String device,
    Double level,
    Double temperature,
    Double current,
    Double vibrationRms,
    Boolean pumpOn,
    String mode,
    Double efficiency,
    Long uptimeMinutes,
    Long uptimeSeconds,
    Long freeMemoryKb,
    Integer rssi,
    String updatedAt
) {
    public static StatusSnapshot offline(String transport, boolean storeDegraded, String mode, String updatedAt) {
        return new StatusSnapshot(false, transport, storeDegraded, null, null, null, null, null, null,
            mode, null, null, null, null, null, updatedAt);
    }
}
