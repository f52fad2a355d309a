package com.webmon.service.runtime;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.OptionalLong;
import java.util.logging.Logger;

// The JVM cannot raise its own descriptor limit; this only reports on the inherited one.
public final class FileDescriptorBudget {
    private static final Logger LOGGER = Logger.getLogger(FileDescriptorBudget.class.getName());
    static final int DESCRIPTORS_PER_SITE = 2;

    private FileDescriptorBudget() {
    }

    public static boolean check(int siteCount) {
        return check(siteCount, maxFileDescriptors());
    }

    static boolean check(int siteCount, OptionalLong limit) {
        long wanted = (long) siteCount * DESCRIPTORS_PER_SITE;
        if (limit.isEmpty()) {
            LOGGER.info("Open file limit unknown on this platform; " + siteCount + " sites need about " + wanted);
            return true;
        }
        if (limit.getAsLong() < wanted) {
            LOGGER.warning("Open file limit is " + limit.getAsLong() + " but " + siteCount + " sites need about "
                    + wanted + "; raise it with 'ulimit -n " + wanted + "' before starting");
            return false;
        }
        LOGGER.fine(() -> "Open file limit " + limit.getAsLong() + " covers " + siteCount + " sites");
        return true;
    }

    static OptionalLong maxFileDescriptors() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.UnixOperatingSystemMXBean unix) {
            return OptionalLong.of(unix.getMaxFileDescriptorCount());
        }
        return OptionalLong.empty();
    }
}
