package com.phillippitts.audioprep.config;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Wires pipeline collaborators that depend on dataset settings.
 */
@Configuration
public class DatasetConfig {
    private static final Logger LOG = LogManager.getLogger(DatasetConfig.class);

    /**
     * Random source used to shuffle files before splitting. Seeded from
     * {@code dataset.shuffle-seed} so repeated runs over the same tree give the same splits.
     */
    @Bean(name = "splitRandom")
    public Random splitRandom(DatasetProperties properties) {
        LOG.info("Split shuffle seed: {}", properties.getShuffleSeed());
        return new Random(properties.getShuffleSeed());
    }
}
