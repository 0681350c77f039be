package io.agenthive.controlplane;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Source of the load figure reported to the control plane, in the range 0..1.
 */
@FunctionalInterface
public interface LoadSampler {

  double sample();

  /**
   * Whole-machine CPU utilisation, falling back to the normalised load average where the JVM does not
   * expose it.
   */
  static LoadSampler systemCpu() {
    OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    return () -> {
      double load = -1;
      if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
        load = extended.getCpuLoad();
      }
      if (load < 0) {
        double average = os.getSystemLoadAverage();
        load = average < 0 ? 0 : average / os.getAvailableProcessors();
      }
      return Math.max(0, Math.min(1, load));
    };
  }
}
