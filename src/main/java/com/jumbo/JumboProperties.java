package com.jumbo;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code jumbo} prefix:
 *
 * jumbo:
 *   root-dir: .jumbo
 *   bus:
 *     dispatch-threads: 4
 */
@ConfigurationProperties(prefix = "jumbo")
public class JumboProperties {

    /**
     * Project state directory holding {@code events/} and {@code jumbo.db}.
     */
    private String rootDir = ".jumbo";

    private final Bus bus = new Bus();

    public String getRootDir() {
        return rootDir;
    }

    public void setRootDir(String rootDir) {
        this.rootDir = rootDir;
    }

    public Bus getBus() {
        return bus;
    }

    public static class Bus {

        /**
         * Threads running projection handlers concurrently outside of replay.
         */
        private int dispatchThreads = 4;

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            if (dispatchThreads < 1) {
                throw new IllegalArgumentException("jumbo.bus.dispatch-threads must be at least 1, got " + dispatchThreads);
            }
            this.dispatchThreads = dispatchThreads;
        }
    }
}
