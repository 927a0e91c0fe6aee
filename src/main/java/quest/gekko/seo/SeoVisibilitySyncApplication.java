package quest.gekko.seo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SeoVisibilitySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeoVisibilitySyncApplication.class, args);
    }

}
