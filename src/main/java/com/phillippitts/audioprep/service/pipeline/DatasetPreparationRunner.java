package com.phillippitts.audioprep.service.pipeline;

import com.phillippitts.audioprep.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs dataset preparation once the application has started.
 *
 * <p>Enabled with {@code dataset.prepare-on-startup=true}. Pass {@code --overwrite} to
 * regenerate existing feature files.
 */
@Component
@ConditionalOnProperty(prefix = "dataset", name = "prepare-on-startup", havingValue = "true")
public class DatasetPreparationRunner implements ApplicationRunner {
    private static final Logger LOG = LogManager.getLogger(DatasetPreparationRunner.class);

    static final String OVERWRITE_OPTION = "overwrite";

    private final DatasetPreparationService preparationService;

    public DatasetPreparationRunner(DatasetPreparationService preparationService) {
        this.preparationService = preparationService;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean overwrite = args.containsOption(OVERWRITE_OPTION);
        LOG.info("Starting dataset preparation (overwrite={})", overwrite);
        long t0 = System.nanoTime();
        boolean generated = preparationService.prepare(overwrite);
        LOG.info("Dataset preparation {} in {} ms",
                generated ? "finished" : "skipped", TimeUtils.elapsedMillis(t0));
    }
}
