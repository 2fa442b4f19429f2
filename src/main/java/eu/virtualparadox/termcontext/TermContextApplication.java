package eu.virtualparadox.termcontext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TermContextApplication {

    public static void main(final String[] args) {
        SpringApplication.run(TermContextApplication.class, args);
    }
}
