package io.procjobs.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProcJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcJobsApplication.class, args);
    }
}
