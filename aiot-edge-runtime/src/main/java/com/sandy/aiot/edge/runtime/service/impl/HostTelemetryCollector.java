package com.sandy.aiot.edge.runtime.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.service.TelemetryCollectionException;
import com.sandy.aiot.edge.runtime.service.TelemetryCollector;
import com.sandy.aiot.edge.runtime.tools.MetricMath;
import com.sandy.aiot.edge.runtime.tools.ProcessCommandRunner;
import com.sandy.aiot.edge.runtime.tools.ProcessCommandRunner.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Collections;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Live host telemetry. Falls back from JVM platform sensors to a PowerShell CIM query
 * (Windows only) and finally to a load-average estimate. The JVM has no battery sensor, so
 * battery level and plug state are read separately: Win32_Battery on Windows, the kernel's
 * power supply class elsewhere.
 */
@Service
@Profile("!test")
@Slf4j
public class HostTelemetryCollector implements TelemetryCollector {

    private static final String WINDOWS_BATTERY_QUERY = String.join("\n",
            "$battery = Get-CimInstance Win32_Battery | Select-Object -First 1",
            "if ($battery) { [PSCustomObject]@{ battery_percent = [double]$battery.EstimatedChargeRemaining;"
                    + " power_plugged = @('2','6','7','8','9') -contains [string]$battery.BatteryStatus } | ConvertTo-Json -Compress }");

    private static final Set<String> PLUGGED_STATUSES = Set.of("charging", "full", "not charging");

    private static final String WINDOWS_QUERY = String.join("\n",
            "$os = Get-CimInstance Win32_OperatingSystem",
            "$cpuLoad = (Get-CimInstance Win32_Processor | Measure-Object -Property LoadPercentage -Average).Average",
            "$disk = Get-CimInstance Win32_LogicalDisk -Filter \"DeviceID='C:'\" | Select-Object -First 1",
            "$battery = Get-CimInstance Win32_Battery | Select-Object -First 1",
            "$processCount = (Get-Process | Measure-Object).Count",
            "$diskPercent = 0",
            "if ($disk -and $disk.Size -gt 0) { $diskPercent = (($disk.Size - $disk.FreeSpace) / $disk.Size) * 100 }",
            "$memoryPercent = 0",
            "if ($os -and $os.TotalVisibleMemorySize -gt 0) { $memoryPercent = (($os.TotalVisibleMemorySize - $os.FreePhysicalMemory) / $os.TotalVisibleMemorySize) * 100 }",
            "$batteryPercent = $null",
            "$powerPlugged = $null",
            "if ($battery) { $batteryPercent = [double]$battery.EstimatedChargeRemaining; $powerPlugged = @('2','6','7','8','9') -contains [string]$battery.BatteryStatus }",
            "[PSCustomObject]@{ cpu_percent = [double]$cpuLoad; memory_percent = [double]$memoryPercent; disk_percent = [double]$diskPercent;"
                    + " battery_percent = $batteryPercent; power_plugged = $powerPlugged; process_count = [int]$processCount } | ConvertTo-Json -Compress");

    private final ProcessCommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path powerSupplyDir;

    public HostTelemetryCollector(ProcessCommandRunner commandRunner,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  @Value("${telemetry.power-supply-dir:/sys/class/power_supply}") String powerSupplyDir) {
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.powerSupplyDir = Paths.get(powerSupplyDir);
    }

    @Override
    public TelemetrySnapshot collectLive() {
        Optional<TelemetrySnapshot> sensed = readPlatformSensors();
        if (sensed.isPresent()) {
            Optional<BatteryReading> battery = isWindows() ? readWindowsBattery() : readPowerSupplyBattery();
            return battery.map(b -> sensed.get().toBuilder()
                            .batteryPercent(b.percent())
                            .powerPlugged(b.plugged())
                            .build())
                    .orElse(sensed.get());
        }
        if (isWindows()) return queryWindows();
        return estimateMinimal();
    }

    @Override
    public TelemetrySnapshot estimateMinimal() {
        double load = 0.0;
        try {
            double avg = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
            if (avg >= 0) load = avg * 25.0;
        } catch (Exception e) {
            log.debug("Load average unavailable: {}", e.getMessage());
        }
        return base()
                .cpuPercent(MetricMath.round2(MetricMath.clampPercent(load)))
                .memoryPercent(0.0)
                .diskPercent(0.0)
                .processCount(0)
                .build();
    }

    private Optional<TelemetrySnapshot> readPlatformSensors() {
        try {
            OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
            if (!(os instanceof com.sun.management.OperatingSystemMXBean sensors)) {
                return Optional.empty();
            }
            double cpu = Math.max(0.0, sensors.getCpuLoad()) * 100.0;
            long totalMem = sensors.getTotalMemorySize();
            double memory = totalMem > 0 ? (totalMem - sensors.getFreeMemorySize()) * 100.0 / totalMem : 0.0;
            File root = new File(isWindows() ? "C:\\" : "/");
            long totalDisk = root.getTotalSpace();
            double disk = totalDisk > 0 ? (totalDisk - root.getUsableSpace()) * 100.0 / totalDisk : 0.0;
            int processes = (int) ProcessHandle.allProcesses().count();
            return Optional.of(base()
                    .cpuPercent(MetricMath.round2(MetricMath.clampPercent(cpu)))
                    .memoryPercent(MetricMath.round2(MetricMath.clampPercent(memory)))
                    .diskPercent(MetricMath.round2(MetricMath.clampPercent(disk)))
                    .processCount(processes)
                    .build());
        } catch (Exception e) {
            log.debug("Platform sensors unavailable, degrading: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private TelemetrySnapshot queryWindows() {
        CommandResult result;
        try {
            result = commandRunner.run(List.of("powershell", "-NoProfile", "-Command", WINDOWS_QUERY));
        } catch (IOException e) {
            throw new TelemetryCollectionException("Windows telemetry command could not start: " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            String err = result.stderr() == null ? "" : result.stderr().trim();
            throw new TelemetryCollectionException(err.isEmpty() ? "Windows telemetry command failed" : err);
        }
        try {
            JsonNode node = objectMapper.readTree(result.stdout().trim());
            JsonNode battery = node.path("battery_percent");
            JsonNode plugged = node.path("power_plugged");
            return base()
                    .cpuPercent(MetricMath.round2(MetricMath.clampPercent(node.path("cpu_percent").asDouble(0.0))))
                    .memoryPercent(MetricMath.round2(MetricMath.clampPercent(node.path("memory_percent").asDouble(0.0))))
                    .diskPercent(MetricMath.round2(MetricMath.clampPercent(node.path("disk_percent").asDouble(0.0))))
                    .batteryPercent(battery.isNumber() ? MetricMath.round2(battery.asDouble()) : null)
                    .powerPlugged(plugged.isBoolean() ? plugged.asBoolean() : null)
                    .processCount(node.path("process_count").asInt(0))
                    .build();
        } catch (IOException e) {
            throw new TelemetryCollectionException("Unparseable Windows telemetry output: " + e.getMessage(), e);
        }
    }

    /**
     * Battery state from Win32_Battery. Empty when the host has no battery or the query fails;
     * a missing battery is not a telemetry failure.
     */
    Optional<BatteryReading> readWindowsBattery() {
        try {
            CommandResult result = commandRunner.run(List.of("powershell", "-NoProfile", "-Command", WINDOWS_BATTERY_QUERY));
            if (!result.isSuccess()) {
                log.debug("Battery query failed exit={} err={}", result.exitCode(), result.stderr());
                return Optional.empty();
            }
            String out = result.stdout() == null ? "" : result.stdout().trim();
            if (out.isEmpty()) return Optional.empty();
            JsonNode node = objectMapper.readTree(out);
            JsonNode percent = node.path("battery_percent");
            if (!percent.isNumber()) return Optional.empty();
            JsonNode plugged = node.path("power_plugged");
            return Optional.of(new BatteryReading(
                    MetricMath.round2(MetricMath.clampPercent(percent.asDouble())),
                    plugged.isBoolean() ? plugged.asBoolean() : null));
        } catch (IOException e) {
            log.debug("Battery query unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Battery state from the first {@code BAT*} entry of the power supply directory. The plug
     * state comes from the battery status, or from a mains adapter's {@code online} flag when
     * the status is not conclusive.
     */
    Optional<BatteryReading> readPowerSupplyBattery() {
        if (!Files.isDirectory(powerSupplyDir)) return Optional.empty();
        List<Path> batteries = new ArrayList<>();
        List<Path> adapters = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(powerSupplyDir)) {
            for (Path entry : entries) {
                if (entry.getFileName().toString().startsWith("BAT")) batteries.add(entry);
                else adapters.add(entry);
            }
            if (batteries.isEmpty()) return Optional.empty();
            Collections.sort(batteries);
            Path battery = batteries.get(0);
            Path capacityFile = battery.resolve("capacity");
            if (!Files.isReadable(capacityFile)) return Optional.empty();
            double percent = Double.parseDouble(readValue(capacityFile));
            Boolean plugged = null;
            Path statusFile = battery.resolve("status");
            if (Files.isReadable(statusFile)) {
                String status = readValue(statusFile).toLowerCase(Locale.ROOT);
                if (PLUGGED_STATUSES.contains(status)) plugged = true;
                else if ("discharging".equals(status)) plugged = false;
            }
            if (plugged == null) plugged = adapterOnline(adapters);
            return Optional.of(new BatteryReading(MetricMath.round2(MetricMath.clampPercent(percent)), plugged));
        } catch (IOException | NumberFormatException e) {
            log.debug("Power supply battery unreadable under {}: {}", powerSupplyDir, e.getMessage());
            return Optional.empty();
        }
    }

    private static Boolean adapterOnline(List<Path> adapters) throws IOException {
        Boolean online = null;
        for (Path adapter : adapters) {
            Path flag = adapter.resolve("online");
            if (!Files.isReadable(flag)) continue;
            if ("1".equals(readValue(flag))) return true;
            online = false;
        }
        return online;
    }

    private static String readValue(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8).trim();
    }

    private TelemetrySnapshot.TelemetrySnapshotBuilder base() {
        return TelemetrySnapshot.builder()
                .timestamp(clock.instant())
                .hostname(hostname())
                .platform(System.getProperty("os.name") + "-" + System.getProperty("os.version") + "-" + System.getProperty("os.arch"))
                .faultFlag(false)
                .gridStatus(TelemetrySnapshot.GRID_HEALTHY);
    }

    private String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            log.debug("Hostname lookup failed: {}", e.getMessage());
            return "edge-node";
        }
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("win");
    }

    record BatteryReading(Double percent, Boolean plugged) {
    }
}
