package io.hisondata.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide default configuration.
 * <p>
 * Tables capture the configuration current at their construction, so installing a new
 * one affects only tables created afterwards.
 */
public final class HisonData {
    private static final Logger LOG = LoggerFactory.getLogger(HisonData.class);

    private static volatile HisonDataConfiguration configuration = HisonDataConfiguration.defaults();

    private HisonData() {
    }

    public static HisonDataConfiguration configuration() {
        return configuration;
    }

    /**
     * Install the process-wide configuration.
     *
     * @param newConfiguration the configuration to use for new tables
     */
    public static void configure(HisonDataConfiguration newConfiguration) {
        if (newConfiguration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        configuration = newConfiguration;
        LOG.info("Installed {}", newConfiguration);
    }

    /**
     * Restore {@link HisonDataConfiguration#defaults()}.
     */
    public static void reset() {
        configuration = HisonDataConfiguration.defaults();
        LOG.debug("Restored default configuration");
    }
}
