package io.agentflow.runtime;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;

/**
 * Per-thread allocation counter from the HotSpot thread MX bean. Returns -1 where unsupported.
 */
final class MemoryProbe {
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    private static final com.sun.management.ThreadMXBean BEAN = resolve();

    private MemoryProbe() {
    }

    static boolean supported() {
        return BEAN != null;
    }

    static long allocatedBytes(Thread thread) {
        if (BEAN == null || thread == null) {
            return -1L;
        }
        return BEAN.getThreadAllocatedBytes(thread.getId());
    }

    static double toMb(long bytes) {
        return bytes <= 0L ? 0.0 : bytes / BYTES_PER_MB;
    }

    private static com.sun.management.ThreadMXBean resolve() {
        ThreadMXBean bean = ManagementFactory.getThreadMXBean();
        if (bean instanceof com.sun.management.ThreadMXBean) {
            com.sun.management.ThreadMXBean hotspot = (com.sun.management.ThreadMXBean) bean;
            if (hotspot.isThreadAllocatedMemorySupported()) {
                if (!hotspot.isThreadAllocatedMemoryEnabled()) {
                    hotspot.setThreadAllocatedMemoryEnabled(true);
                }
                return hotspot;
            }
        }
        return null;
    }
}
