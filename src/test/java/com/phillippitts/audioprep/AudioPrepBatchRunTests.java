package com.phillippitts.audioprep;

import com.phillippitts.audioprep.testutil.WavFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class AudioPrepBatchRunTests {

    private static final String POOL_PREFIX = "batch-run-pool-";

    @TempDir
    Path workDir;

    @Test
    void startupRunExitsCleanlyAndStopsFeaturePool() throws InterruptedException {
        Path dataDir = workDir.resolve("data");
        for (int i = 0; i < 10; i++) {
            WavFixtures.tone(dataDir.resolve("Orca/2019/orca" + i + ".wav"), 16_000, 1, 6.0, 300 + 40 * i);
        }

        int exitCode = AudioPrepApplication.runBatch(
                "--dataset.data-path=" + dataDir,
                "--dataset.output-path=" + workDir.resolve("output"),
                "--dataset.prepare-on-startup=true",
                "--threadpool.feature.thread-name-prefix=" + POOL_PREFIX,
                "--spring.jmx.unique-names=true");

        assertThat(exitCode).isZero();
        assertThat(dataDir.resolve("TRAIN.features")).isRegularFile();
        assertThat(dataDir.resolve("TEST.features")).isRegularFile();
        assertThat(livePoolThreads()).isEmpty();
    }

    private static List<String> livePoolThreads() throws InterruptedException {
        long deadline = System.nanoTime() + 5_000_000_000L;
        List<String> alive = poolThreadNames();
        while (!alive.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(50);
            alive = poolThreadNames();
        }
        return alive;
    }

    private static List<String> poolThreadNames() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .map(Thread::getName)
                .filter(name -> name.startsWith(POOL_PREFIX))
                .collect(Collectors.toList());
    }
}
