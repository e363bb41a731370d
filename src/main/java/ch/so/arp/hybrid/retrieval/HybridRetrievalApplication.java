package ch.so.arp.hybrid.retrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HybridRetrievalApplication {

    public static void main(String[] args) {
        SpringApplication.run(HybridRetrievalApplication.class, args);
    }
}
