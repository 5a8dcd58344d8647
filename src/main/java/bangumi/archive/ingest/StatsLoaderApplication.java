package bangumi.archive.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Loads Bangumi archive snapshots (character, person and subject JSON lines) into dated
 * PostgreSQL statistics tables.
 *
 * Usage: [run] [character|person|subject|all] [limit]
 */
@SpringBootApplication
public class StatsLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(StatsLoaderApplication.class, args)
        ));
    }
}
