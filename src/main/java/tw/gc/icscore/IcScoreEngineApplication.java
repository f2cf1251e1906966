package tw.gc.icscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * IC Score engine. Scheduling is owned by an external scheduler which calls
 * {@link tw.gc.icscore.services.IcScoreService} after market close (full run)
 * and hourly during market hours (price-sensitive refresh).
 */
@SpringBootApplication
public class IcScoreEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IcScoreEngineApplication.class, args);
    }
}
