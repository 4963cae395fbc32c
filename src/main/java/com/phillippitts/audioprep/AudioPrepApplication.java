package com.phillippitts.audioprep;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DatasetProperties.class
})
public class AudioPrepApplication {

    public static void main(String[] args) {
        System.exit(runBatch(args));
    }

    /**
     * Starts the context, lets startup runners finish, then closes it so the feature pool
     * shuts down.
     *
     * @return process exit code
     */
    static int runBatch(String... args) {
        return SpringApplication.exit(SpringApplication.run(AudioPrepApplication.class, args));
    }

}
