package electoral.analytics.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ElectoralIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(ElectoralIngestApplication.class, args);
    }
}
