package io.agentflow.runtime;

/**
 * Named memory budget inside an organization runtime. Allocation never exceeds the maximum and
 * usage never goes negative.
 */
public final class MemoryPool {
    private final String name;
    private final int maxMemoryMb;
    private int usedMemoryMb;

    public MemoryPool(String name, int maxMemoryMb) {
        if (maxMemoryMb < 1) {
            throw new IllegalArgumentException("maxMemoryMb must be >= 1");
        }
        this.name = name;
        this.maxMemoryMb = maxMemoryMb;
    }

    public String name() {
        return name;
    }

    public int maxMemoryMb() {
        return maxMemoryMb;
    }

    public synchronized int usedMemoryMb() {
        return usedMemoryMb;
    }

    public synchronized int availableMemoryMb() {
        return maxMemoryMb - usedMemoryMb;
    }

    public synchronized boolean tryAllocate(int memoryMb) {
        if (memoryMb < 0) {
            throw new IllegalArgumentException("memoryMb must be >= 0");
        }
        if (usedMemoryMb + memoryMb > maxMemoryMb) {
            return false;
        }
        usedMemoryMb += memoryMb;
        return true;
    }

    public synchronized void release(int memoryMb) {
        usedMemoryMb = Math.max(0, usedMemoryMb - Math.max(0, memoryMb));
    }
}
